package com.example.accessgate.approval.model;

import com.example.accessgate.model.Action;

import java.time.Instant;

/**
 * Access obtained through a fully approved request.
 */
public record GrantedAccess(
        String id,
        String principalId,
        String resourceKey,
        Action action,
        String requestId,
        Instant grantedAt,
        Instant expiresAt
) {
    public boolean isActive(Instant now) {
        return expiresAt == null || now.isBefore(expiresAt);
    }
}
