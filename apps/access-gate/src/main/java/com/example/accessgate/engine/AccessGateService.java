package com.example.accessgate.engine;

import com.example.accessgate.approval.AccessRequestResult;
import com.example.accessgate.approval.ApprovalGate;
import com.example.accessgate.approval.EscalationSweeper;
import com.example.accessgate.approval.SweepReport;
import com.example.accessgate.approval.model.AccessRequest;
import com.example.accessgate.approval.model.ApprovalDecision;
import com.example.accessgate.approval.model.RequestDetails;
import com.example.accessgate.audit.AuditService;
import com.example.accessgate.cache.CacheScope;
import com.example.accessgate.cache.CacheStats;
import com.example.accessgate.cache.DecisionCache;
import com.example.accessgate.cache.DecisionCacheInvalidator;
import com.example.accessgate.exception.AccessGateException;
import com.example.accessgate.exception.NotFoundException;
import com.example.accessgate.model.Action;
import com.example.accessgate.model.FieldPermissions;
import com.example.accessgate.model.Permission;
import com.example.accessgate.model.ResourceTarget;
import com.example.accessgate.rbac.EffectivePermissions;
import com.example.accessgate.rbac.ResourceMatcher;
import com.example.accessgate.rbac.RoleResolver;
import com.example.accessgate.store.DirectoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Entry point for callers of the access gate. Every operation is non-blocking; typed failures
 * arrive as {@link AccessGateException} subclasses carrying a reason code.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessGateService {

    private final EvaluationOrchestrator orchestrator;
    private final ApprovalGate approvalGate;
    private final EscalationSweeper escalationSweeper;
    private final DecisionCache decisionCache;
    private final DecisionCacheInvalidator cacheInvalidator;
    private final RoleResolver roleResolver;
    private final DirectoryStore directoryStore;
    private final AuditService auditService;

    @NonNull
    public Mono<Decision> evaluate(@NonNull PrincipalRef principal, @NonNull ResourceTarget resource,
                                   @NonNull String action, @Nullable Map<String, ?> context) {
        return orchestrator.evaluate(principal, resource, action, context == null ? Map.of() : context);
    }

    @NonNull
    public Mono<List<Decision>> evaluateBatch(@NonNull PrincipalRef principal, @NonNull List<BatchItem> items,
                                              @Nullable Map<String, ?> context) {
        return orchestrator.evaluateBatch(principal, items, context == null ? Map.of() : context);
    }

    @NonNull
    public Mono<FieldPermissions> getFieldPermissions(@NonNull PrincipalRef principal,
                                                      @NonNull ResourceTarget resource,
                                                      @NonNull String action,
                                                      @Nullable Map<String, ?> context) {
        return orchestrator.getFieldPermissions(principal, resource, action, context == null ? Map.of() : context)
                .onErrorResume(AccessGateException.class,
                        e -> failed(principal.principalId(), null, "getFieldPermissions", e));
    }

    /**
     * Explicitly requests approval for an action. Fails with {@link NotFoundException} when no
     * active chain gates the action on the resource.
     */
    @NonNull
    public Mono<AccessRequestResult> requestApproval(@NonNull PrincipalRef principal,
                                                     @NonNull ResourceTarget resource,
                                                     @NonNull String action,
                                                     @Nullable String justification,
                                                     @Nullable Instant accessExpiresAt,
                                                     @Nullable Map<String, ?> context) {
        return Mono.defer(() -> {
                    Action parsed = Action.fromValue(action);
                    resource.validate();
                    return orchestrator.loadSubject(principal, resource, context == null ? Map.of() : context)
                            .flatMap(subject -> approvalGate.requiresApproval(
                                            new ResourceMatcher.MatchTarget(subject.resource().type(),
                                                    subject.resource().id(), subject.resource().path()), parsed)
                                    .switchIfEmpty(Mono.error(() -> new NotFoundException("ApprovalChain",
                                            resource.key() + "#" + parsed.value())))
                                    .flatMap(chain -> approvalGate.createAccessRequest(
                                            subject.principal().tenantId(), subject.principal().id(), chain,
                                            new RequestDetails(resource, parsed, justification, accessExpiresAt),
                                            subject.context())));
                })
                .onErrorResume(AccessGateException.class,
                        e -> failed(principal.principalId(), null, "requestApproval", e));
    }

    @NonNull
    public Mono<AccessRequest> recordApprovalDecision(@NonNull String requestId,
                                                      @NonNull String approverId,
                                                      int level,
                                                      @NonNull String decision,
                                                      @Nullable String comments) {
        return Mono.defer(() -> approvalGate.recordDecision(requestId, approverId, level,
                        ApprovalDecision.fromValue(decision), comments))
                .onErrorResume(AccessGateException.class,
                        e -> failed(approverId, requestId, "recordApprovalDecision", e));
    }

    @NonNull
    public Mono<AccessRequest> cancelAccessRequest(@NonNull String requestId, @NonNull String requesterId) {
        return approvalGate.cancel(requestId, requesterId)
                .onErrorResume(AccessGateException.class,
                        e -> failed(requesterId, requestId, "cancelAccessRequest", e));
    }

    @NonNull
    public Mono<AccessRequest> getAccessRequest(@NonNull String requestId) {
        return approvalGate.findRequest(requestId);
    }

    /**
     * Evicts cached decisions in the scope.
     *
     * @return number of evicted entries, where the cache backend can count them
     */
    @NonNull
    public Mono<Long> clearCache(@NonNull CacheScope scope) {
        return cacheInvalidator.invalidate(scope, "manual");
    }

    @NonNull
    public Mono<SweepReport> runEscalationSweep() {
        return escalationSweeper.runEscalationSweep();
    }

    @NonNull
    public Mono<CacheStats> cacheStats() {
        return decisionCache.stats();
    }

    @NonNull
    public Mono<EffectivePermissions> getEffectivePermissions(@NonNull String principalId) {
        return roleResolver.resolveDetailed(principalId)
                .flatMap(roles -> Flux.fromIterable(roles.all())
                        .flatMap(directoryStore::findPermissionsByRole)
                        .distinct(Permission::id)
                        .sort(Comparator.comparing(Permission::id))
                        .collectList()
                        .map(permissions -> new EffectivePermissions(principalId, roles, permissions)));
    }

    private <T> Mono<T> failed(@Nullable String principalId, @Nullable String requestId, String operation,
                               AccessGateException error) {
        log.debug("{} failed with {}: {}", operation, error.getReasonCode(), error.getMessage());
        return auditService.failure(principalId, requestId, operation, error).then(Mono.error(error));
    }
}
