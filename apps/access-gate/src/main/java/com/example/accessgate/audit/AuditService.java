package com.example.accessgate.audit;

import com.example.accessgate.exception.AccessGateException;
import com.example.accessgate.exception.ReasonCode;
import com.example.accessgate.model.Action;
import com.example.accessgate.model.ResourceTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

/**
 * Builds audit events for engine operations and hands them to the {@link AuditSink}.
 * Sink failures are logged and dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditSink sink;
    private final Clock clock;

    public Mono<Void> decision(String tenantId, String principalId, ResourceTarget resource, Action action,
                               AuditEvent.Outcome outcome, ReasonCode reason, Map<String, Object> details) {
        return emit(AuditEvent.builder()
                .type(AuditEvent.EventType.DECISION)
                .outcome(outcome)
                .reasonCode(reason)
                .tenantId(tenantId)
                .principalId(principalId)
                .resource(resource.key())
                .action(action.value())
                .details(details));
    }

    public Mono<Void> transition(String tenantId, String actorId, String requestId, ReasonCode reason,
                                 Map<String, Object> details) {
        AuditEvent.Outcome outcome = reason == ReasonCode.REJECTED || reason == ReasonCode.EXPIRED
                ? AuditEvent.Outcome.DENY
                : AuditEvent.Outcome.INFO;
        return emit(AuditEvent.builder()
                .type(AuditEvent.EventType.APPROVAL_TRANSITION)
                .outcome(outcome)
                .reasonCode(reason)
                .tenantId(tenantId)
                .principalId(actorId)
                .requestId(requestId)
                .details(details));
    }

    public Mono<Void> invalidation(String scope, long evicted, String cause) {
        return emit(AuditEvent.builder()
                .type(AuditEvent.EventType.CACHE_INVALIDATION)
                .outcome(AuditEvent.Outcome.INFO)
                .reasonCode(ReasonCode.GRANTED)
                .detail("scope", scope)
                .detail("evicted", evicted)
                .detail("cause", cause));
    }

    public Mono<Void> mutation(String operation, Map<String, Object> details) {
        return emit(AuditEvent.builder()
                .type(AuditEvent.EventType.MUTATION)
                .outcome(AuditEvent.Outcome.INFO)
                .reasonCode(ReasonCode.GRANTED)
                .detail("operation", operation)
                .details(details));
    }

    public Mono<Void> failure(@Nullable String principalId, @Nullable String requestId, String operation,
                              Throwable error) {
        ReasonCode reason = error instanceof AccessGateException age ? age.getReasonCode() : ReasonCode.INTERNAL_ERROR;
        boolean systemFault = reason == ReasonCode.UNAVAILABLE || reason == ReasonCode.INTERNAL_ERROR;
        return emit(AuditEvent.builder()
                .type(AuditEvent.EventType.ERROR)
                .outcome(systemFault ? AuditEvent.Outcome.ERROR : AuditEvent.Outcome.DENY)
                .reasonCode(reason)
                .principalId(principalId)
                .requestId(requestId)
                .detail("operation", operation)
                .detail("message", String.valueOf(error.getMessage())));
    }

    private Mono<Void> emit(AuditEvent.AuditEventBuilder builder) {
        AuditEvent event = builder.timestamp(clock.instant()).build();
        return sink.record(event)
                .onErrorResume(e -> {
                    log.warn("Audit sink rejected {} event: {}", event.type(), e.getMessage());
                    return Mono.empty();
                });
    }
}
