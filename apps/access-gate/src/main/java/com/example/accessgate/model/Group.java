package com.example.accessgate.model;

import lombok.Builder;
import lombok.Singular;

import java.util.Set;

/**
 * Principal group. Members receive {@code roleIds} and the roles of every ancestor group.
 */
@Builder(toBuilder = true)
public record Group(
        String id,
        String tenantId,
        String parentId,
        @Singular Set<String> roleIds,
        boolean active
) {
    public Group {
        roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
    }
}
