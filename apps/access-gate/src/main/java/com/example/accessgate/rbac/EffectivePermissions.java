package com.example.accessgate.rbac;

import com.example.accessgate.model.Permission;

import java.util.List;

/**
 * Everything a principal currently holds: its resolved roles and the active permissions linked
 * to any of them, ordered by permission id.
 */
public record EffectivePermissions(String principalId, ResolvedRoles roles, List<Permission> permissions) {

    public EffectivePermissions {
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }
}
