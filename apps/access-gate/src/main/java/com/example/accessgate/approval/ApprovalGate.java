package com.example.accessgate.approval;

import com.example.accessgate.approval.model.AccessRequest;
import com.example.accessgate.approval.model.AccessRequestStatus;
import com.example.accessgate.approval.model.Approval;
import com.example.accessgate.approval.model.ApprovalChain;
import com.example.accessgate.approval.model.ApprovalDecision;
import com.example.accessgate.approval.model.ApprovalLevel;
import com.example.accessgate.approval.model.GrantedAccess;
import com.example.accessgate.approval.model.RequestDetails;
import com.example.accessgate.audit.AuditService;
import com.example.accessgate.cache.DecisionCacheInvalidator;
import com.example.accessgate.common.util.StringSanitizer;
import com.example.accessgate.exception.ConflictException;
import com.example.accessgate.exception.NotFoundException;
import com.example.accessgate.exception.ReasonCode;
import com.example.accessgate.exception.UnauthorizedApproverException;
import com.example.accessgate.exception.UnavailableException;
import com.example.accessgate.exception.ValidationException;
import com.example.accessgate.model.Action;
import com.example.accessgate.notification.ApprovalNotifier;
import com.example.accessgate.notification.NotificationTarget;
import com.example.accessgate.observability.metrics.DecisionMetrics;
import com.example.accessgate.rbac.ResourceMatcher;
import com.example.accessgate.rbac.RoleResolver;
import com.example.accessgate.store.ApprovalStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Decides whether an action needs multi-level approval and drives access requests through
 * their state machine:
 *
 * <pre>
 * pending -> pending_next_level* -> approved | denied | expired | cancelled
 * </pre>
 *
 * Every transition is a conditional update on (status, current level, version); a caller that
 * loses the race gets {@link ConflictException} and is expected to re-read. Nothing here retries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApprovalGate {

    private static final int GRANT_MAX_RETRIES = 3;
    private static final Duration GRANT_RETRY_BACKOFF = Duration.ofMillis(100);

    private final ApprovalStore approvalStore;
    private final ResourceMatcher resourceMatcher;
    private final AutoApprovalPolicy autoApprovalPolicy;
    private final RoleResolver roleResolver;
    private final ApprovalNotifier notifier;
    private final DecisionCacheInvalidator cacheInvalidator;
    private final AuditService auditService;
    private final DecisionMetrics metrics;
    private final Clock clock;

    /**
     * First active chain, by id, whose type and pattern match the resource and which gates the action.
     */
    @NonNull
    public Mono<ApprovalChain> requiresApproval(@NonNull ResourceMatcher.MatchTarget target, @NonNull Action action) {
        return approvalStore.findActiveChains(target.type())
                .filter(chain -> chain.gates(action))
                .filter(chain -> resourceMatcher.matchesPattern(chain.resourcePattern(), target))
                .next();
    }

    /**
     * Auto-approves when the effective first-level conditions hold against {@code context};
     * otherwise returns the requester's open request for the same resource and action, or opens
     * a new one at the first level and notifies its approvers. The store decides reuse versus
     * insert atomically, so concurrent callers share one request.
     */
    @NonNull
    public Mono<AccessRequestResult> createAccessRequest(@NonNull String tenantId,
                                                         @NonNull String requesterId,
                                                         @NonNull ApprovalChain chain,
                                                         @NonNull RequestDetails details,
                                                         @NonNull Map<String, ?> context) {
        if (!chain.active()) {
            return Mono.error(new ValidationException("Approval chain " + chain.id() + " is inactive"));
        }
        if (autoApprovalPolicy.isAutoApproved(chain, context)) {
            log.info("Access auto-approved: requester={}, chain={}, resource={}, action={}",
                    StringSanitizer.forLog(requesterId), chain.id(), details.resource().key(), details.action().value());
            return auditService.transition(tenantId, requesterId, null, ReasonCode.AUTO_APPROVED,
                            details(chain.id(), details, null))
                    .thenReturn(AccessRequestResult.autoApproved(chain.id()));
        }
        return openRequest(tenantId, requesterId, chain, details);
    }

    private Mono<AccessRequestResult> openRequest(String tenantId, String requesterId, ApprovalChain chain,
                                                  RequestDetails details) {
        Instant now = clock.instant();
        ApprovalLevel first = chain.firstLevel();
        AccessRequest request = AccessRequest.builder()
                .id(UUID.randomUUID().toString())
                .tenantId(tenantId)
                .requesterId(requesterId)
                .chainId(chain.id())
                .details(details)
                .status(AccessRequestStatus.PENDING)
                .currentLevel(first.level())
                .createdAt(now)
                .levelEnteredAt(now)
                .updatedAt(now)
                .version(0)
                .build();
        return approvalStore.insertIfNoneOpen(request)
                .flatMap(saved -> {
                    if (!saved.id().equals(request.id())) {
                        log.debug("Reusing open access request {} for {}", saved.id(),
                                StringSanitizer.forLog(requesterId));
                        return Mono.just(AccessRequestResult.pending(saved));
                    }
                    log.info("Access request {} opened at level {} of chain {}", saved.id(), first.level(), chain.id());
                    metrics.recordTransition(AccessRequestStatus.PENDING);
                    notifier.dispatch(NotificationTarget.role(first.approverRole()), saved.id(), first.level());
                    return auditService.transition(tenantId, requesterId, saved.id(), ReasonCode.APPROVAL_REQUIRED,
                                    details(chain.id(), details, saved))
                            .thenReturn(AccessRequestResult.pending(saved));
                });
    }

    /**
     * Records an approver's decision for {@code level}.
     *
     * @return the request after the transition; fails with {@link UnauthorizedApproverException}
     *         when the approver lacks the level's role, and with {@link ConflictException} when
     *         the request is no longer open at that level or the race was lost
     */
    @NonNull
    public Mono<AccessRequest> recordDecision(@NonNull String requestId,
                                              @NonNull String approverId,
                                              int level,
                                              @NonNull ApprovalDecision decision,
                                              @Nullable String comments) {
        return loadRequestAndChain(requestId)
                .flatMap(loaded -> {
                    AccessRequest request = loaded.request();
                    ApprovalChain chain = loaded.chain();
                    ApprovalLevel levelConfig = chain.level(level)
                            .orElseThrow(() -> new ValidationException(
                                    "Chain " + chain.id() + " has no level " + level));
                    return authorize(approverId, request, levelConfig)
                            .then(Mono.defer(() -> decide(request, chain, levelConfig, approverId, decision, comments)));
                });
    }

    /**
     * Cancels an open request on behalf of its requester.
     */
    @NonNull
    public Mono<AccessRequest> cancel(@NonNull String requestId, @NonNull String byRequester) {
        return approvalStore.findRequest(requestId)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("AccessRequest", requestId)))
                .flatMap(request -> {
                    if (!request.requesterId().equals(byRequester)) {
                        return Mono.error(new UnauthorizedApproverException(byRequester, requestId,
                                request.currentLevel(), "Only the requester may cancel request " + requestId));
                    }
                    if (!request.status().isOpen()) {
                        return Mono.error(new ConflictException("Request " + requestId + " is already "
                                + request.status().value()));
                    }
                    AccessRequest cancelled = request.transition(AccessRequestStatus.CANCELLED,
                            request.currentLevel(), false, clock.instant());
                    return swap(request, cancelled);
                })
                .flatMap(saved -> {
                    log.info("Access request {} cancelled by requester", saved.id());
                    metrics.recordTransition(AccessRequestStatus.CANCELLED);
                    return auditService.transition(saved.tenantId(), byRequester, saved.id(), ReasonCode.CANCELLED,
                                    Map.of("level", saved.currentLevel()))
                            .thenReturn(saved);
                });
    }

    @NonNull
    public Mono<AccessRequest> findRequest(@NonNull String requestId) {
        return approvalStore.findRequest(requestId)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("AccessRequest", requestId)));
    }

    /**
     * Conditional update; empty result from the store becomes {@link ConflictException}.
     */
    Mono<AccessRequest> swap(AccessRequest expected, AccessRequest updated) {
        return approvalStore.compareAndSet(expected, updated)
                .switchIfEmpty(Mono.error(() -> new ConflictException("Access request " + expected.id()
                        + " changed concurrently (expected " + expected.status().value()
                        + " at level " + expected.currentLevel() + ")")));
    }

    private Mono<Void> authorize(String approverId, AccessRequest request, ApprovalLevel levelConfig) {
        return roleResolver.resolve(approverId)
                .onErrorResume(NotFoundException.class, e -> Mono.just(Set.of()))
                .flatMap(roles -> {
                    if (roles.contains(levelConfig.approverRole())) {
                        return Mono.<Void>empty();
                    }
                    log.warn("Approver {} lacks role {} for level {} of request {}",
                            StringSanitizer.forLog(approverId), levelConfig.approverRole(),
                            levelConfig.level(), request.id());
                    return Mono.<Void>error(new UnauthorizedApproverException(approverId, request.id(),
                            levelConfig.level(), "Approver " + approverId + " is not eligible for level "
                            + levelConfig.level()));
                });
    }

    private Mono<AccessRequest> decide(AccessRequest request, ApprovalChain chain, ApprovalLevel levelConfig,
                                       String approverId, ApprovalDecision decision, @Nullable String comments) {
        int level = levelConfig.level();
        if (!request.status().isOpen()) {
            return Mono.error(new ConflictException("Request " + request.id() + " is already "
                    + request.status().value()));
        }
        if (request.currentLevel() != level) {
            return Mono.error(new ConflictException("Request " + request.id() + " is at level "
                    + request.currentLevel() + ", not " + level));
        }
        Instant now = clock.instant();
        AccessRequest updated;
        if (decision == ApprovalDecision.DENIED) {
            updated = request.transition(AccessRequestStatus.DENIED, level, false, now);
        } else if (chain.isFinal(level)) {
            updated = request.transition(AccessRequestStatus.APPROVED, level, false, now);
        } else {
            int next = chain.nextLevel(level).map(ApprovalLevel::level).orElseThrow();
            updated = request.transition(AccessRequestStatus.PENDING_NEXT_LEVEL, next, true, now);
        }
        Approval approval = new Approval(request.id(), approverId, level, decision, comments, now);
        return approvalStore.insertApproval(approval)
                .then(Mono.defer(() -> swap(request, updated)
                        .onErrorResume(e -> rollbackApproval(approval, e))))
                .flatMap(saved -> afterDecision(saved, chain, approverId, approval));
    }

    /**
     * The approval row is written before the request moves; when the move does not commit the
     * row is removed again so the level stays undecided.
     */
    private Mono<AccessRequest> rollbackApproval(Approval approval, Throwable cause) {
        return approvalStore.deleteApproval(approval.requestId(), approval.level())
                .onErrorResume(deleteError -> {
                    log.error("Failed to roll back approval for level {} of request {}: {}",
                            approval.level(), approval.requestId(), deleteError.getMessage());
                    cause.addSuppressed(deleteError);
                    return Mono.empty();
                })
                .then(Mono.<AccessRequest>error(cause));
    }

    private Mono<AccessRequest> afterDecision(AccessRequest saved, ApprovalChain chain, String approverId,
                                              Approval approval) {
        metrics.recordTransition(saved.status());
        log.info("Access request {} level {} {} by {} -> {}", saved.id(), approval.level(),
                approval.decision().value(), StringSanitizer.forLog(approverId), saved.status().value());

        Map<String, Object> auditDetails = new LinkedHashMap<>();
        auditDetails.put("level", approval.level());
        auditDetails.put("decision", approval.decision().value());
        auditDetails.put("status", saved.status().value());
        auditDetails.put("currentLevel", saved.currentLevel());
        ReasonCode reason = switch (saved.status()) {
            case APPROVED -> ReasonCode.GRANTED;
            case DENIED -> ReasonCode.REJECTED;
            default -> ReasonCode.APPROVAL_REQUIRED;
        };
        Mono<Void> audit = auditService.transition(saved.tenantId(), approverId, saved.id(), reason, auditDetails);

        Mono<Void> effects = switch (saved.status()) {
            case PENDING_NEXT_LEVEL -> {
                chain.level(saved.currentLevel()).ifPresent(next ->
                        notifier.dispatch(NotificationTarget.role(next.approverRole()), saved.id(), next.level()));
                yield Mono.empty();
            }
            case APPROVED -> grant(saved)
                    .then(cacheInvalidator.invalidatePrincipal(saved.requesterId(), "access-request-approved"))
                    .then();
            case DENIED -> cacheInvalidator.invalidatePrincipal(saved.requesterId(), "access-request-denied")
                    .then();
            default -> Mono.empty();
        };
        return audit.then(effects).thenReturn(saved);
    }

    private Mono<GrantedAccess> grant(AccessRequest approved) {
        GrantedAccess grant = new GrantedAccess(
                approved.id(),
                approved.requesterId(),
                approved.details().resource().key(),
                approved.details().action(),
                approved.id(),
                clock.instant(),
                approved.details().accessExpiresAt());
        return approvalStore.saveGrant(grant)
                .retryWhen(Retry.backoff(GRANT_MAX_RETRIES, GRANT_RETRY_BACKOFF)
                        .filter(UnavailableException.class::isInstance)
                        .doBeforeRetry(signal -> log.warn("Retrying grant for approved request {}, attempt {}: {}",
                                approved.id(), signal.totalRetries() + 1, signal.failure().getMessage())))
                .onErrorResume(e -> {
                    // The transition has committed and is not reported as a failed decision
                    log.error("Request {} is approved but its grant could not be stored: {}",
                            approved.id(), e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<LoadedRequest> loadRequestAndChain(String requestId) {
        return findRequest(requestId)
                .flatMap(request -> approvalStore.findChain(request.chainId())
                        .switchIfEmpty(Mono.error(() -> new NotFoundException("ApprovalChain", request.chainId())))
                        .map(chain -> new LoadedRequest(request, chain)));
    }

    private static Map<String, Object> details(String chainId, RequestDetails details, @Nullable AccessRequest request) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("chainId", chainId);
        map.put("resource", details.resource().key());
        map.put("action", details.action().value());
        if (request != null) {
            map.put("level", request.currentLevel());
        }
        return map;
    }

    private record LoadedRequest(AccessRequest request, ApprovalChain chain) {
    }
}
