package com.example.accessgate.cache;

import com.example.accessgate.model.FieldPermissions;

import java.time.Instant;
import java.util.List;

public record CachedDecision(
        boolean allowed,
        FieldPermissions fieldPermissions,
        List<String> matchedConditions,
        List<String> matchedPermissionIds,
        Instant cachedAt
) {
    public CachedDecision {
        fieldPermissions = fieldPermissions == null ? FieldPermissions.empty() : fieldPermissions;
        matchedConditions = matchedConditions == null ? List.of() : List.copyOf(matchedConditions);
        matchedPermissionIds = matchedPermissionIds == null ? List.of() : List.copyOf(matchedPermissionIds);
    }
}
