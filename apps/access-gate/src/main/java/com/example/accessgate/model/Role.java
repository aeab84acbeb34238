package com.example.accessgate.model;

import lombok.Builder;

/**
 * Role in a single-parent hierarchy. A role inherits every permission of its parent chain.
 * {@code priority} orders roles for display and audit only.
 */
@Builder(toBuilder = true)
public record Role(
        String id,
        String tenantId,
        String parentId,
        int priority,
        boolean assignable,
        boolean active
) {
}
