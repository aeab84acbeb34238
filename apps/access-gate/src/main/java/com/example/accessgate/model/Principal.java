package com.example.accessgate.model;

import lombok.Builder;
import lombok.Singular;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * User or service account. Owned by the identity collaborator and read-only here.
 * Group memberships travel with the principal.
 */
@Builder(toBuilder = true)
public record Principal(
        String id,
        String tenantId,
        boolean serviceAccount,
        @Singular Map<String, Object> attributes,
        @Singular Set<String> groupIds,
        boolean active
) {
    public Principal {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        groupIds = groupIds == null ? Set.of() : Set.copyOf(groupIds);
    }

    /**
     * Attributes exposed to condition evaluation under the {@code principal} key.
     */
    public Map<String, Object> asContext() {
        Map<String, Object> ctx = new HashMap<>(attributes);
        ctx.put("id", id);
        ctx.put("tenantId", tenantId);
        ctx.put("serviceAccount", serviceAccount);
        return ctx;
    }
}
