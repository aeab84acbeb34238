package com.example.accessgate.admin;

import com.example.accessgate.approval.model.ApprovalChain;
import com.example.accessgate.audit.AuditService;
import com.example.accessgate.cache.DecisionCacheInvalidator;
import com.example.accessgate.common.util.StringSanitizer;
import com.example.accessgate.exception.NotFoundException;
import com.example.accessgate.exception.ValidationException;
import com.example.accessgate.model.Group;
import com.example.accessgate.model.Permission;
import com.example.accessgate.model.Principal;
import com.example.accessgate.model.Resource;
import com.example.accessgate.model.Role;
import com.example.accessgate.model.RoleAssignment;
import com.example.accessgate.rbac.FieldPermissionService;
import com.example.accessgate.store.ApprovalStore;
import com.example.accessgate.store.DirectoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Mutations of the access model. Each one evicts the cached decisions it can affect before it
 * completes, so a caller that evaluates after the returned publisher finishes never sees a
 * decision computed from the old state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DirectoryAdminService {

    private final DirectoryStore directoryStore;
    private final ApprovalStore approvalStore;
    private final FieldPermissionService fieldPermissionService;
    private final DecisionCacheInvalidator cacheInvalidator;
    private final AuditService auditService;

    @NonNull
    public Mono<Principal> savePrincipal(@NonNull Principal principal) {
        if (principal.id() == null || principal.id().isBlank()) {
            return Mono.error(new ValidationException("Principal id must not be blank"));
        }
        return directoryStore.savePrincipal(principal)
                .flatMap(saved -> cacheInvalidator.invalidatePrincipal(saved.id(), "principal-saved")
                        .then(audited("savePrincipal", Map.of("principalId", saved.id())))
                        .thenReturn(saved));
    }

    /**
     * Saves a role. Rejects a parent that would make the role its own ancestor.
     */
    @NonNull
    public Mono<Role> saveRole(@NonNull Role role) {
        if (role.id() == null || role.id().isBlank()) {
            return Mono.error(new ValidationException("Role id must not be blank"));
        }
        return checkNoCycle(role.id(), role.parentId())
                .then(directoryStore.saveRole(role))
                .flatMap(saved -> cacheInvalidator.invalidateRole(saved.id(), "role-saved")
                        .then(audited("saveRole", details("roleId", saved.id(), "parentId", saved.parentId())))
                        .thenReturn(saved));
    }

    @NonNull
    public Mono<Role> setRoleParent(@NonNull String roleId, @Nullable String parentId) {
        return directoryStore.findRole(roleId)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Role", roleId)))
                .flatMap(role -> saveRole(role.toBuilder().parentId(parentId).build()));
    }

    /**
     * Saves a group. Membership changes reach an unbounded set of principals, so every cached
     * decision is evicted.
     */
    @NonNull
    public Mono<Group> saveGroup(@NonNull Group group) {
        if (group.id() == null || group.id().isBlank()) {
            return Mono.error(new ValidationException("Group id must not be blank"));
        }
        return directoryStore.saveGroup(group)
                .flatMap(saved -> cacheInvalidator.invalidateAll("group-saved")
                        .then(audited("saveGroup", Map.of("groupId", saved.id())))
                        .thenReturn(saved));
    }

    @NonNull
    public Mono<RoleAssignment> assignRole(@NonNull String principalId, @NonNull String roleId,
                                           @Nullable Instant expiresAt) {
        return directoryStore.findPrincipal(principalId)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Principal", principalId)))
                .then(directoryStore.findRole(roleId)
                        .switchIfEmpty(Mono.error(() -> new NotFoundException("Role", roleId))))
                .flatMap(role -> {
                    if (!role.assignable()) {
                        return Mono.error(new ValidationException("Role " + roleId + " is not assignable"));
                    }
                    return directoryStore.saveAssignment(RoleAssignment.builder()
                            .principalId(principalId)
                            .roleId(roleId)
                            .expiresAt(expiresAt)
                            .active(true)
                            .build());
                })
                .flatMap(saved -> cacheInvalidator.invalidatePrincipal(principalId, "role-assigned")
                        .then(audited("assignRole", details("principalId", principalId, "roleId", roleId)))
                        .thenReturn(saved));
    }

    @NonNull
    public Mono<Boolean> revokeRole(@NonNull String principalId, @NonNull String roleId) {
        return directoryStore.deleteAssignment(principalId, roleId)
                .flatMap(removed -> cacheInvalidator.invalidatePrincipal(principalId, "role-revoked")
                        .then(audited("revokeRole", details("principalId", principalId, "roleId", roleId)))
                        .thenReturn(removed));
    }

    /**
     * Validates and stores a permission. Field permissions are normalized against the field
     * definitions of the permission's resource type. Roles already linked to it are invalidated.
     */
    @NonNull
    public Mono<Permission> savePermission(@NonNull Permission permission) {
        return Mono.fromRunnable(permission::validate)
                .then(fieldPermissionService.normalize(permission.resourceType(), permission.fieldPermissions()))
                .map(normalized -> permission.toBuilder().fieldPermissions(normalized).build())
                .flatMap(directoryStore::savePermission)
                .flatMap(saved -> directoryStore.findRolesByPermission(saved.id())
                        .concatMap(roleId -> cacheInvalidator.invalidateRole(roleId, "permission-saved"))
                        .then(audited("savePermission", Map.of("permissionId", saved.id())))
                        .thenReturn(saved));
    }

    @NonNull
    public Mono<Boolean> linkPermission(@NonNull String roleId, @NonNull String permissionId) {
        return directoryStore.findRole(roleId)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Role", roleId)))
                .then(directoryStore.findPermission(permissionId)
                        .switchIfEmpty(Mono.error(() -> new NotFoundException("Permission", permissionId))))
                .then(directoryStore.link(roleId, permissionId))
                .flatMap(linked -> cacheInvalidator.invalidateRole(roleId, "permission-linked")
                        .then(audited("linkPermission", details("roleId", roleId, "permissionId", permissionId)))
                        .thenReturn(linked));
    }

    @NonNull
    public Mono<Boolean> unlinkPermission(@NonNull String roleId, @NonNull String permissionId) {
        return directoryStore.unlink(roleId, permissionId)
                .flatMap(unlinked -> cacheInvalidator.invalidateRole(roleId, "permission-unlinked")
                        .then(audited("unlinkPermission", details("roleId", roleId, "permissionId", permissionId)))
                        .thenReturn(unlinked));
    }

    @NonNull
    public Mono<Resource> saveResource(@NonNull Resource resource) {
        if (resource.id() == null || resource.id().isBlank() || resource.type() == null) {
            return Mono.error(new ValidationException("Resource needs an id and a type"));
        }
        return directoryStore.saveResource(resource)
                .flatMap(saved -> cacheInvalidator.invalidateAll("resource-saved")
                        .then(audited("saveResource", Map.of("resourceId", saved.id())))
                        .thenReturn(saved));
    }

    /**
     * Stores an approval chain. Cached allows for resources the chain now gates are evicted.
     */
    @NonNull
    public Mono<ApprovalChain> saveChain(@NonNull ApprovalChain chain) {
        return Mono.fromRunnable(chain::validate)
                .then(approvalStore.saveChain(chain))
                .flatMap(saved -> cacheInvalidator.invalidateAll("chain-saved")
                        .then(audited("saveChain", Map.of("chainId", saved.id())))
                        .thenReturn(saved));
    }

    private Mono<Void> checkNoCycle(String roleId, @Nullable String parentId) {
        return walkAncestors(roleId, parentId, new HashSet<>());
    }

    private Mono<Void> walkAncestors(String roleId, @Nullable String current, Set<String> seen) {
        if (current == null) {
            return Mono.empty();
        }
        if (current.equals(roleId)) {
            return Mono.error(new ValidationException("Role " + roleId
                    + " cannot become its own ancestor"));
        }
        if (!seen.add(current)) {
            // existing cycle above the role, tolerated by resolution
            return Mono.empty();
        }
        return directoryStore.findRole(current)
                .flatMap(role -> walkAncestors(roleId, role.parentId(), seen));
    }

    private Mono<Void> audited(String operation, Map<String, Object> details) {
        log.info("Directory mutation {}: {}", operation, StringSanitizer.forLog(details.toString()));
        return auditService.mutation(operation, details);
    }

    private static Map<String, Object> details(String k1, @Nullable Object v1, String k2, @Nullable Object v2) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(k1, v1);
        details.put(k2, v2);
        return details;
    }
}
