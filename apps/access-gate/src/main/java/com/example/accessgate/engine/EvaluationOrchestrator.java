package com.example.accessgate.engine;

import com.example.accessgate.approval.AccessRequestResult;
import com.example.accessgate.approval.ApprovalGate;
import com.example.accessgate.approval.model.ApprovalChain;
import com.example.accessgate.approval.model.GrantedAccess;
import com.example.accessgate.approval.model.RequestDetails;
import com.example.accessgate.audit.AuditEvent;
import com.example.accessgate.audit.AuditService;
import com.example.accessgate.cache.CachedDecision;
import com.example.accessgate.cache.DecisionCache;
import com.example.accessgate.cache.DecisionCacheKey;
import com.example.accessgate.common.util.StringSanitizer;
import com.example.accessgate.config.properties.AccessGateProperties;
import com.example.accessgate.exception.AccessGateException;
import com.example.accessgate.exception.NotFoundException;
import com.example.accessgate.exception.ReasonCode;
import com.example.accessgate.exception.UnavailableException;
import com.example.accessgate.exception.ValidationException;
import com.example.accessgate.model.Action;
import com.example.accessgate.model.FieldPermissions;
import com.example.accessgate.model.Principal;
import com.example.accessgate.model.Resource;
import com.example.accessgate.model.ResourceTarget;
import com.example.accessgate.observability.metrics.DecisionMetrics;
import com.example.accessgate.observability.metrics.DecisionMetrics.DecisionResult;
import com.example.accessgate.rbac.AggregationResult;
import com.example.accessgate.rbac.FieldPermissionService;
import com.example.accessgate.rbac.PermissionAggregator;
import com.example.accessgate.rbac.ResourceMatcher;
import com.example.accessgate.rbac.RoleResolver;
import com.example.accessgate.store.ApprovalStore;
import com.example.accessgate.store.DirectoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Public evaluation pipeline: cache lookup, approval gate, role resolution, permission
 * aggregation, cache write.
 *
 * <p>Fails closed: when a backend is unavailable the result is a denial carrying
 * {@link ReasonCode#UNAVAILABLE}, never an allow. Validation and lookup failures propagate.
 * Allowed decisions are cached for {@code cache.ttl}, denials for {@code cache.negative-ttl};
 * approval-required and approved-request decisions are not cached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvaluationOrchestrator {

    static final String PRINCIPAL_KEY = "principal";
    static final String RESOURCE_KEY = "resource";

    private final DecisionCache decisionCache;
    private final DirectoryStore directoryStore;
    private final ApprovalStore approvalStore;
    private final ApprovalGate approvalGate;
    private final RoleResolver roleResolver;
    private final PermissionAggregator permissionAggregator;
    private final FieldPermissionService fieldPermissionService;
    private final AuditService auditService;
    private final DecisionMetrics metrics;
    private final AccessGateProperties properties;
    private final Clock clock;

    @NonNull
    public Mono<Decision> evaluate(@NonNull PrincipalRef principal,
                                   @NonNull ResourceTarget resource,
                                   @NonNull String action,
                                   @NonNull Map<String, ?> context) {
        return Mono.defer(() -> {
                    Action parsedAction = Action.fromValue(action);
                    resource.validate();
                    DecisionCacheKey key = new DecisionCacheKey(principal.tenantId(), principal.principalId(),
                            resource.type(), resource.locator(), parsedAction.value());
                    return decisionCache.get(key)
                            .map(Decision::fromCache)
                            .flatMap(decision -> recordDecision(principal, resource, parsedAction, decision, true))
                            .switchIfEmpty(Mono.defer(() -> compute(principal, resource, parsedAction, context, key)));
                })
                .onErrorResume(UnavailableException.class, e -> failClosed(principal, resource, action, e))
                .doOnError(e -> metrics.recordDecision(DecisionResult.ERROR))
                .onErrorResume(AccessGateException.class, e -> auditService
                        .failure(principal.principalId(), null, "evaluate", e)
                        .then(Mono.error(e)));
    }

    /**
     * Evaluates each item independently; a failing item becomes an error decision in its slot.
     */
    @NonNull
    public Mono<List<Decision>> evaluateBatch(@NonNull PrincipalRef principal,
                                              @NonNull List<BatchItem> items,
                                              @NonNull Map<String, ?> context) {
        return Flux.fromIterable(items)
                .flatMapSequential(item -> evaluate(principal, item.resource(), item.action(), context)
                        .onErrorResume(e -> Mono.just(itemFailure(e))))
                .collectList();
    }

    /**
     * Merged field permissions of the principal for the resource and action, normalized against
     * field definitions. Bypasses the decision cache and the approval gate.
     */
    @NonNull
    public Mono<FieldPermissions> getFieldPermissions(@NonNull PrincipalRef principal,
                                                      @NonNull ResourceTarget resource,
                                                      @NonNull String action,
                                                      @NonNull Map<String, ?> context) {
        return Mono.defer(() -> {
            Action parsedAction = Action.fromValue(action);
            resource.validate();
            return loadPrincipal(principal).zipWith(loadResource(resource))
                    .flatMap(loaded -> {
                        Principal p = loaded.getT1();
                        Resource r = loaded.getT2();
                        return roleResolver.resolveFor(p)
                                .flatMap(roles -> permissionAggregator.aggregate(roles.all(), matchTarget(r),
                                        parsedAction, evaluationContext(p, r, context)));
                    })
                    .flatMap(result -> fieldPermissionService.normalize(resource.type(), result.fieldPermissions()));
        });
    }

    /**
     * Loads the principal and resource and builds the condition context for them.
     */
    @NonNull
    public Mono<EvaluationSubject> loadSubject(@NonNull PrincipalRef principal,
                                               @NonNull ResourceTarget resource,
                                               @NonNull Map<String, ?> context) {
        return loadPrincipal(principal).zipWith(loadResource(resource))
                .map(loaded -> new EvaluationSubject(loaded.getT1(), loaded.getT2(),
                        evaluationContext(loaded.getT1(), loaded.getT2(), context)));
    }

    private Mono<Decision> compute(PrincipalRef principalRef, ResourceTarget resource, Action action,
                                   Map<String, ?> context, DecisionCacheKey key) {
        long started = System.nanoTime();
        return decisionCache.generation(principalRef.principalId())
                .flatMap(generation -> loadSubject(principalRef, resource, context)
                        .flatMap(subject -> activeGrant(subject.principal(), resource, action)
                                .flatMap(grant -> grant.isPresent()
                                        ? rbac(subject, action, true, key, generation)
                                        : gate(subject, resource, action, key, generation))))
                .doOnNext(d -> metrics.recordEvaluation(Duration.ofNanos(System.nanoTime() - started)))
                .flatMap(decision -> recordDecision(principalRef, resource, action, decision, false));
    }

    private Mono<Optional<GrantedAccess>> activeGrant(Principal principal, ResourceTarget resource, Action action) {
        return approvalStore.findActiveGrant(principal.id(), resource.key(), action, clock.instant())
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    private Mono<Decision> gate(EvaluationSubject subject, ResourceTarget resource, Action action,
                                DecisionCacheKey key, long generation) {
        return approvalGate.requiresApproval(matchTarget(subject.resource()), action)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(chain -> chain.isPresent()
                        ? requestApproval(subject, resource, action, chain.get(), key, generation)
                        : rbac(subject, action, false, key, generation));
    }

    private Mono<Decision> requestApproval(EvaluationSubject subject, ResourceTarget resource, Action action,
                                           ApprovalChain chain, DecisionCacheKey key, long generation) {
        RequestDetails details = new RequestDetails(resource, action, null, null);
        return approvalGate.createAccessRequest(subject.principal().tenantId(), subject.principal().id(), chain,
                        details, subject.context())
                .flatMap((AccessRequestResult result) -> result.autoApproved()
                        ? rbac(subject, action, false, key, generation)
                        : Mono.just(Decision.approvalRequired(result.request().id())));
    }

    private Mono<Decision> rbac(EvaluationSubject subject, Action action, boolean approvedAccess,
                                DecisionCacheKey key, long generation) {
        return roleResolver.resolveFor(subject.principal())
                .flatMap(roles -> permissionAggregator.aggregate(roles.all(), matchTarget(subject.resource()),
                        action, subject.context()))
                .flatMap(result -> approvedAccess
                        ? Mono.just(Decision.approvedAccess(result))
                        : cache(key, result, generation).thenReturn(Decision.of(result)));
    }

    /**
     * Stores the result, then drops it again if the principal's entries were invalidated while
     * it was being computed.
     */
    private Mono<Void> cache(DecisionCacheKey key, AggregationResult result, long generation) {
        Duration ttl = result.allowed() ? properties.getCache().getTtl() : properties.getCache().getNegativeTtl();
        CachedDecision value = new CachedDecision(result.allowed(), result.fieldPermissions(),
                result.matchedConditions(), result.matchedPermissionIds(), clock.instant());
        return decisionCache.set(key, value, ttl)
                .then(decisionCache.generation(key.principalId()))
                .flatMap(current -> {
                    if (current != generation) {
                        log.debug("Decision for {} invalidated during evaluation, not caching", key.asString());
                        return decisionCache.delete(key);
                    }
                    return Mono.empty();
                });
    }

    private Mono<Decision> recordDecision(PrincipalRef principal, ResourceTarget resource, Action action,
                                          Decision decision, boolean cached) {
        DecisionResult result;
        AuditEvent.Outcome outcome;
        if (decision.allowed()) {
            result = DecisionResult.ALLOWED;
            outcome = AuditEvent.Outcome.ALLOW;
        } else if (decision.requiresApproval()) {
            result = DecisionResult.APPROVAL_REQUIRED;
            outcome = AuditEvent.Outcome.DENY;
        } else {
            result = DecisionResult.DENIED;
            outcome = AuditEvent.Outcome.DENY;
        }
        metrics.recordDecision(result);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("cached", cached);
        if (decision.accessRequestId() != null) {
            details.put("accessRequestId", decision.accessRequestId());
        }
        if (!decision.matchedConditions().isEmpty()) {
            details.put("matchedConditions", decision.matchedConditions());
        }
        return auditService.decision(principal.tenantId(), principal.principalId(), resource, action, outcome,
                        decision.reason(), details)
                .thenReturn(decision);
    }

    private Mono<Decision> failClosed(PrincipalRef principal, ResourceTarget resource, String action,
                                      UnavailableException error) {
        log.error("Evaluation failed closed for principal={} resource={} action={}: {}",
                StringSanitizer.forLog(principal.principalId()), StringSanitizer.forLog(resource.key()),
                StringSanitizer.forLog(action), error.getMessage());
        metrics.recordDecision(DecisionResult.ERROR);
        return auditService.failure(principal.principalId(), null, "evaluate", error)
                .thenReturn(Decision.failure(ReasonCode.UNAVAILABLE, error.getMessage()));
    }

    private Mono<Principal> loadPrincipal(PrincipalRef ref) {
        return directoryStore.findPrincipal(ref.principalId())
                .filter(p -> ref.tenantId() == null || ref.tenantId().equals(p.tenantId()))
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Principal", ref.principalId())));
    }

    private Mono<Resource> loadResource(ResourceTarget target) {
        if (target.id() == null || target.id().isBlank()) {
            return Mono.just(Resource.builder().type(target.type()).path(target.path()).build());
        }
        return directoryStore.findResource(target.id())
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Resource", target.key())))
                .flatMap(stored -> {
                    if (stored.type() != null && !stored.type().equals(target.type())) {
                        return Mono.error(new ValidationException("Resource " + target.id() + " is a "
                                + stored.type() + ", not a " + target.type()));
                    }
                    return Mono.just(stored);
                });
    }

    private static ResourceMatcher.MatchTarget matchTarget(Resource resource) {
        return new ResourceMatcher.MatchTarget(resource.type(), resource.id(), resource.path());
    }

    /**
     * Caller context plus the principal and resource attributes. Stored identity wins over
     * caller-supplied values under the same keys.
     */
    static Map<String, Object> evaluationContext(Principal principal, Resource resource, Map<String, ?> context) {
        Map<String, Object> merged = new HashMap<>(context);
        merged.put(PRINCIPAL_KEY, principal.asContext());
        merged.put(RESOURCE_KEY, resource.asContext());
        return merged;
    }

    private static Decision itemFailure(Throwable error) {
        if (error instanceof AccessGateException age) {
            return Decision.failure(age.getReasonCode(), age.getMessage());
        }
        log.warn("Batch item failed unexpectedly: {}", error.getMessage());
        return Decision.failure(ReasonCode.INTERNAL_ERROR, String.valueOf(error.getMessage()));
    }

    /**
     * Principal and resource of an evaluation, with the condition context built from them.
     */
    public record EvaluationSubject(Principal principal, Resource resource, Map<String, Object> context) {
    }
}
