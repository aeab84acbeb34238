package com.example.accessgate.util;

import com.example.accessgate.approval.model.ApprovalChain;
import com.example.accessgate.approval.model.ApprovalLevel;
import com.example.accessgate.model.Action;
import com.example.accessgate.model.Group;
import com.example.accessgate.model.Permission;
import com.example.accessgate.model.Principal;
import com.example.accessgate.model.Resource;
import com.example.accessgate.model.Role;
import com.example.accessgate.model.RoleAssignment;
import com.example.accessgate.store.ApprovalStore;
import com.example.accessgate.store.DirectoryStore;

import java.time.Duration;

/**
 * Shorthand for building and seeding access model records in tests.
 */
public final class AccessModelTestBuilder {

    public static final String TENANT = "tenant-1";

    private AccessModelTestBuilder() {}

    public static Principal aPrincipal(String id) {
        return Principal.builder().id(id).tenantId(TENANT).active(true).build();
    }

    public static Role aRole(String id) {
        return Role.builder().id(id).tenantId(TENANT).assignable(true).active(true).build();
    }

    public static Role aRole(String id, String parentId) {
        return aRole(id).toBuilder().parentId(parentId).build();
    }

    public static Group aGroup(String id, String... roleIds) {
        Group.GroupBuilder builder = Group.builder().id(id).tenantId(TENANT).active(true);
        for (String roleId : roleIds) {
            builder.roleId(roleId);
        }
        return builder.build();
    }

    public static Permission.PermissionBuilder aPermission(String id, String resourceType, Action... actions) {
        Permission.PermissionBuilder builder = Permission.builder()
                .id(id)
                .tenantId(TENANT)
                .resourceType(resourceType)
                .active(true);
        for (Action action : actions) {
            builder.action(action);
        }
        return builder;
    }

    public static Resource aResource(String type, String id) {
        return Resource.builder().id(id).tenantId(TENANT).type(type).build();
    }

    public static ApprovalLevel aLevel(int level, String approverRole) {
        return ApprovalLevel.builder().level(level).approverRole(approverRole).build();
    }

    public static ApprovalLevel aLevel(int level, String approverRole, Duration timeout, Integer escalateTo) {
        return ApprovalLevel.builder()
                .level(level)
                .approverRole(approverRole)
                .timeout(timeout)
                .escalateToLevel(escalateTo)
                .build();
    }

    public static ApprovalChain.ApprovalChainBuilder aChain(String id, String resourceType, String pattern) {
        return ApprovalChain.builder()
                .id(id)
                .tenantId(TENANT)
                .resourceType(resourceType)
                .resourcePattern(pattern)
                .active(true);
    }

    // Seeding helpers write straight to the stores; they bypass cache invalidation.

    public static void seedPrincipal(DirectoryStore store, Principal principal) {
        store.savePrincipal(principal).block();
    }

    public static void seedRole(DirectoryStore store, Role role) {
        store.saveRole(role).block();
    }

    public static void seedGroup(DirectoryStore store, Group group) {
        store.saveGroup(group).block();
    }

    public static void assign(DirectoryStore store, String principalId, String roleId) {
        store.saveAssignment(RoleAssignment.builder()
                .principalId(principalId)
                .roleId(roleId)
                .active(true)
                .build()).block();
    }

    public static void grant(DirectoryStore store, String roleId, Permission permission) {
        store.savePermission(permission).block();
        store.link(roleId, permission.id()).block();
    }

    public static void seedResource(DirectoryStore store, Resource resource) {
        store.saveResource(resource).block();
    }

    public static void seedChain(ApprovalStore store, ApprovalChain chain) {
        store.saveChain(chain.validate()).block();
    }
}
