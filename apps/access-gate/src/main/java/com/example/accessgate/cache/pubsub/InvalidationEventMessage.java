package com.example.accessgate.cache.pubsub;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Cross-instance decision cache invalidation, carried over Redis pub/sub.
 */
public record InvalidationEventMessage(
        @NonNull EventType eventType,
        @Nullable String principalId,
        @NonNull Instant timestamp,
        @Nullable String sourceInstanceId
) {
    public enum EventType {
        EVICT_PRINCIPAL,
        EVICT_ALL
    }

    public static InvalidationEventMessage evictPrincipal(String principalId, String instanceId, Instant now) {
        return new InvalidationEventMessage(EventType.EVICT_PRINCIPAL, principalId, now, instanceId);
    }

    public static InvalidationEventMessage evictAll(String instanceId, Instant now) {
        return new InvalidationEventMessage(EventType.EVICT_ALL, null, now, instanceId);
    }
}
