package com.example.accessgate.rbac;

import com.example.accessgate.model.FieldPermissions;
import com.example.accessgate.model.Permission;

import java.util.List;

/**
 * Outcome of permission aggregation. {@code matchedConditions} lists the condition paths of
 * matching permissions that were satisfied.
 */
public record AggregationResult(
        boolean allowed,
        List<Permission> matchedPermissions,
        FieldPermissions fieldPermissions,
        List<String> matchedConditions
) {
    public AggregationResult {
        matchedPermissions = List.copyOf(matchedPermissions);
        matchedConditions = List.copyOf(matchedConditions);
    }

    public static AggregationResult denied() {
        return new AggregationResult(false, List.of(), FieldPermissions.empty(), List.of());
    }

    public List<String> matchedPermissionIds() {
        return matchedPermissions.stream().map(Permission::id).toList();
    }
}
