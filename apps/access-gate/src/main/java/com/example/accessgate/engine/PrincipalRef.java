package com.example.accessgate.engine;

import com.example.accessgate.exception.ValidationException;

/**
 * Authenticated caller identity as supplied by the identity provider. Roles are never taken
 * from here; they are always resolved from persisted state.
 */
public record PrincipalRef(String tenantId, String principalId) {

    public PrincipalRef {
        if (principalId == null || principalId.isBlank()) {
            throw new ValidationException("Principal id must not be blank");
        }
    }

    public static PrincipalRef of(String tenantId, String principalId) {
        return new PrincipalRef(tenantId, principalId);
    }
}
