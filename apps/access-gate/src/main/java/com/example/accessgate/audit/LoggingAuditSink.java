package com.example.accessgate.audit;

import com.example.accessgate.common.util.StringSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Writes audit events as single-line JSON to the {@code ACCESS_AUDIT} logger.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "access-gate.audit.enabled", havingValue = "true", matchIfMissing = true)
public class LoggingAuditSink implements AuditSink {

    static final String AUDIT_LOGGER = "ACCESS_AUDIT";

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger(AUDIT_LOGGER);

    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> record(@NonNull AuditEvent event) {
        return Mono.fromRunnable(() -> logEvent(event));
    }

    private void logEvent(AuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            logByOutcome(event.outcome(), json);
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(event);
        }
    }

    private void logByOutcome(AuditEvent.Outcome outcome, String json) {
        switch (outcome) {
            case ALLOW, INFO -> AUDIT_LOG.info(json);
            case DENY -> AUDIT_LOG.warn(json);
            case ERROR -> AUDIT_LOG.error(json);
        }
    }

    private void logFallback(AuditEvent event) {
        AUDIT_LOG.warn("Access {} {} - principal={}, resource={}, action={}, request={}, reason={}",
                event.type(),
                event.outcome(),
                StringSanitizer.forLog(event.principalId()),
                StringSanitizer.forLog(event.resource()),
                event.action(),
                StringSanitizer.forLog(event.requestId()),
                event.reasonCode());
    }
}
