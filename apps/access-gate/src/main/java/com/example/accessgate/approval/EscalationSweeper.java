package com.example.accessgate.approval;

import com.example.accessgate.approval.SweepReport.SweepOutcome;
import com.example.accessgate.approval.model.AccessRequest;
import com.example.accessgate.approval.model.AccessRequestStatus;
import com.example.accessgate.approval.model.ApprovalChain;
import com.example.accessgate.approval.model.ApprovalLevel;
import com.example.accessgate.audit.AuditService;
import com.example.accessgate.exception.ConflictException;
import com.example.accessgate.exception.ReasonCode;
import com.example.accessgate.notification.ApprovalNotifier;
import com.example.accessgate.notification.NotificationTarget;
import com.example.accessgate.observability.metrics.DecisionMetrics;
import com.example.accessgate.store.ApprovalStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Moves open requests whose current level has timed out: to the level's
 * {@code escalateToLevel} when configured, otherwise to {@code expired}.
 *
 * <p>Holds no state between runs and owns no timer. Writes go through the same conditional
 * update as approver decisions, so concurrent sweeps (or a sweep racing an approver) change a
 * request at most once; the losers count it as a conflict.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EscalationSweeper {

    private final ApprovalStore approvalStore;
    private final ApprovalGate approvalGate;
    private final ApprovalNotifier notifier;
    private final AuditService auditService;
    private final DecisionMetrics metrics;
    private final Clock clock;

    @NonNull
    public Mono<SweepReport> runEscalationSweep() {
        Instant now = clock.instant();
        return approvalStore.findOpenRequests()
                .concatMap(request -> approvalStore.findChain(request.chainId())
                        .flatMap(chain -> sweep(request, chain, now))
                        .defaultIfEmpty(SweepOutcome.UNCHANGED))
                .reduce(SweepReport.empty(), SweepReport::add)
                .doOnNext(report -> {
                    if (report.escalated() + report.expired() + report.conflicts() > 0) {
                        log.info("Escalation sweep: examined={}, escalated={}, expired={}, conflicts={}",
                                report.examined(), report.escalated(), report.expired(), report.conflicts());
                    }
                });
    }

    private Mono<SweepOutcome> sweep(AccessRequest request, ApprovalChain chain, Instant now) {
        ApprovalLevel level = chain.level(request.currentLevel()).orElse(null);
        if (level == null) {
            log.error("Request {} is at level {} which chain {} does not define", request.id(),
                    request.currentLevel(), chain.id());
            return Mono.just(SweepOutcome.UNCHANGED);
        }
        if (level.timeout() == null || !timedOut(request, level.timeout(), now)) {
            return Mono.just(SweepOutcome.UNCHANGED);
        }
        Integer target = level.escalateToLevel();
        boolean escalate = target != null && chain.level(target).isPresent();
        AccessRequest updated = escalate
                ? request.transition(AccessRequestStatus.PENDING_NEXT_LEVEL, target, true, now)
                : request.transition(AccessRequestStatus.EXPIRED, request.currentLevel(), false, now);

        return approvalGate.swap(request, updated)
                .flatMap(saved -> escalate ? escalated(saved, chain, level) : expired(saved, level))
                .onErrorResume(ConflictException.class, e -> {
                    log.debug("Request {} changed during sweep: {}", request.id(), e.getMessage());
                    metrics.recordSweep(DecisionMetrics.SweepOutcome.CONFLICT);
                    return Mono.just(SweepOutcome.CONFLICT);
                });
    }

    private static boolean timedOut(AccessRequest request, Duration timeout, Instant now) {
        return Duration.between(request.levelEnteredAt(), now).compareTo(timeout) > 0;
    }

    private Mono<SweepOutcome> escalated(AccessRequest saved, ApprovalChain chain, ApprovalLevel from) {
        ApprovalLevel to = chain.level(saved.currentLevel()).orElseThrow();
        log.info("Request {} escalated from level {} to {}", saved.id(), from.level(), to.level());
        metrics.recordSweep(DecisionMetrics.SweepOutcome.ESCALATED);
        metrics.recordTransition(saved.status());
        notifier.dispatch(NotificationTarget.role(to.approverRole()), saved.id(), to.level());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("fromLevel", from.level());
        details.put("toLevel", to.level());
        return auditService.transition(saved.tenantId(), null, saved.id(), ReasonCode.ESCALATED, details)
                .thenReturn(SweepOutcome.ESCALATED);
    }

    private Mono<SweepOutcome> expired(AccessRequest saved, ApprovalLevel level) {
        log.info("Request {} expired at level {}", saved.id(), level.level());
        metrics.recordSweep(DecisionMetrics.SweepOutcome.EXPIRED);
        metrics.recordTransition(AccessRequestStatus.EXPIRED);
        return auditService.transition(saved.tenantId(), null, saved.id(), ReasonCode.EXPIRED,
                        Map.of("level", level.level()))
                .thenReturn(SweepOutcome.EXPIRED);
    }
}
