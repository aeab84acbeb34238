package com.example.accessgate.approval.model;

import com.example.accessgate.common.util.CacheKeyUtils;
import lombok.Builder;

import java.time.Instant;

/**
 * Approval workflow instance. {@code version} increases on every transition and guards
 * conditional updates together with {@code status} and {@code currentLevel}.
 */
@Builder(toBuilder = true)
public record AccessRequest(
        String id,
        String tenantId,
        String requesterId,
        String chainId,
        RequestDetails details,
        AccessRequestStatus status,
        int currentLevel,
        Instant createdAt,
        Instant levelEnteredAt,
        Instant updatedAt,
        long version
) {
    /**
     * Next state of this request, one version ahead.
     */
    public AccessRequest transition(AccessRequestStatus newStatus, int newLevel, boolean levelChanged, Instant now) {
        return toBuilder()
                .status(newStatus)
                .currentLevel(newLevel)
                .levelEnteredAt(levelChanged ? now : levelEnteredAt)
                .updatedAt(now)
                .version(version + 1)
                .build();
    }

    /**
     * Identity shared by every request of one requester for the same chain, resource and
     * action. At most one open request exists per key.
     */
    public String openKey() {
        return CacheKeyUtils.encode(requesterId) + CacheKeyUtils.SEPARATOR
                + CacheKeyUtils.encode(chainId) + CacheKeyUtils.SEPARATOR
                + CacheKeyUtils.encode(details.resource().key()) + CacheKeyUtils.SEPARATOR
                + CacheKeyUtils.encode(details.action().value());
    }
}
