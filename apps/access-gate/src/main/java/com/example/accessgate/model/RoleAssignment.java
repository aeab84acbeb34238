package com.example.accessgate.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Direct role grant to a principal, optionally time-bound.
 */
@Builder(toBuilder = true)
public record RoleAssignment(
        String principalId,
        String roleId,
        Instant expiresAt,
        boolean active
) {
    public boolean isEffective(Instant now) {
        return active && (expiresAt == null || now.isBefore(expiresAt));
    }
}
