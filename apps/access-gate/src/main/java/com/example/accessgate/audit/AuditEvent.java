package com.example.accessgate.audit;

import com.example.accessgate.exception.ReasonCode;
import lombok.Builder;
import lombok.Singular;
import org.springframework.lang.NonNull;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Builder
public record AuditEvent(
        @NonNull EventType type,
        @NonNull Outcome outcome,
        @NonNull ReasonCode reasonCode,
        String tenantId,
        String principalId,
        String resource,
        String action,
        String requestId,
        @Singular("detail") Map<String, Object> details,
        @NonNull Instant timestamp
) {
    public enum EventType {
        DECISION,
        APPROVAL_TRANSITION,
        CACHE_INVALIDATION,
        MUTATION,
        ERROR
    }

    public enum Outcome {
        ALLOW,
        DENY,
        INFO,
        ERROR
    }

    public Map<String, Object> toStructuredLog() {
        Map<String, Object> log = new LinkedHashMap<>();
        log.put("eventType", "ACCESS_" + type.name());
        log.put("timestamp", timestamp.toString());
        log.put("outcome", outcome.name());
        log.put("reason", reasonCode.name());
        putIfPresent(log, "tenantId", tenantId);
        putIfPresent(log, "principalId", principalId);
        putIfPresent(log, "resource", resource);
        putIfPresent(log, "action", action);
        putIfPresent(log, "requestId", requestId);
        if (details != null && !details.isEmpty()) {
            log.put("details", details);
        }
        return log;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
