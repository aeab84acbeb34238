package com.example.accessgate.store.memory;

import com.example.accessgate.model.FieldDefinition;
import com.example.accessgate.model.Group;
import com.example.accessgate.model.Permission;
import com.example.accessgate.model.Principal;
import com.example.accessgate.model.Resource;
import com.example.accessgate.model.Role;
import com.example.accessgate.model.RoleAssignment;
import com.example.accessgate.model.RolePermissionLink;
import com.example.accessgate.store.DirectoryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
@ConditionalOnProperty(name = "access-gate.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryDirectoryStore implements DirectoryStore {

    private final Map<String, Principal> principals = new ConcurrentHashMap<>();
    private final Map<String, Role> roles = new ConcurrentHashMap<>();
    private final Map<String, Group> groups = new ConcurrentHashMap<>();
    private final Map<String, RoleAssignment> assignments = new ConcurrentHashMap<>();
    private final Map<String, Permission> permissions = new ConcurrentHashMap<>();
    private final Set<RolePermissionLink> links = ConcurrentHashMap.newKeySet();
    private final Map<String, Resource> resources = new ConcurrentHashMap<>();
    private final Map<String, FieldDefinition> fieldDefinitions = new ConcurrentHashMap<>();

    public InMemoryDirectoryStore() {
        log.info("Initialized in-memory directory store");
    }

    @Override
    public Mono<Principal> findPrincipal(String principalId) {
        return Mono.justOrEmpty(principals.get(principalId));
    }

    @Override
    public Mono<Principal> savePrincipal(Principal principal) {
        return Mono.fromSupplier(() -> {
            principals.put(principal.id(), principal);
            return principal;
        });
    }

    @Override
    public Mono<Role> findRole(String roleId) {
        return Mono.justOrEmpty(roles.get(roleId));
    }

    @Override
    public Flux<Role> findChildRoles(String parentRoleId) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(roles.values())))
                .filter(role -> parentRoleId.equals(role.parentId()));
    }

    @Override
    public Mono<Role> saveRole(Role role) {
        return Mono.fromSupplier(() -> {
            roles.put(role.id(), role);
            return role;
        });
    }

    @Override
    public Mono<Group> findGroup(String groupId) {
        return Mono.justOrEmpty(groups.get(groupId));
    }

    @Override
    public Flux<Group> findChildGroups(String parentGroupId) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(groups.values())))
                .filter(group -> parentGroupId.equals(group.parentId()));
    }

    @Override
    public Flux<Group> findGroupsGrantingRole(String roleId) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(groups.values())))
                .filter(group -> group.roleIds().contains(roleId));
    }

    @Override
    public Mono<Group> saveGroup(Group group) {
        return Mono.fromSupplier(() -> {
            groups.put(group.id(), group);
            return group;
        });
    }

    @Override
    public Flux<Principal> findGroupMembers(String groupId) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(principals.values())))
                .filter(principal -> principal.groupIds().contains(groupId));
    }

    @Override
    public Flux<RoleAssignment> findAssignments(String principalId) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(assignments.values())))
                .filter(assignment -> principalId.equals(assignment.principalId()));
    }

    @Override
    public Flux<RoleAssignment> findAssignmentsForRole(String roleId) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(assignments.values())))
                .filter(assignment -> roleId.equals(assignment.roleId()));
    }

    @Override
    public Mono<RoleAssignment> saveAssignment(RoleAssignment assignment) {
        return Mono.fromSupplier(() -> {
            assignments.put(assignmentKey(assignment.principalId(), assignment.roleId()), assignment);
            return assignment;
        });
    }

    @Override
    public Mono<Boolean> deleteAssignment(String principalId, String roleId) {
        return Mono.fromSupplier(() -> assignments.remove(assignmentKey(principalId, roleId)) != null);
    }

    @Override
    public Mono<Permission> findPermission(String permissionId) {
        return Mono.justOrEmpty(permissions.get(permissionId));
    }

    @Override
    public Mono<Permission> savePermission(Permission permission) {
        return Mono.fromSupplier(() -> {
            permissions.put(permission.id(), permission);
            return permission;
        });
    }

    @Override
    public Flux<Permission> findPermissionsByRole(String roleId) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(links)))
                .filter(link -> roleId.equals(link.roleId()))
                .map(link -> permissions.get(link.permissionId()))
                .filter(Objects::nonNull)
                .filter(Permission::active);
    }

    @Override
    public Flux<String> findRolesByPermission(String permissionId) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(links)))
                .filter(link -> permissionId.equals(link.permissionId()))
                .map(RolePermissionLink::roleId);
    }

    @Override
    public Mono<Boolean> link(String roleId, String permissionId) {
        return Mono.fromSupplier(() -> links.add(new RolePermissionLink(roleId, permissionId)));
    }

    @Override
    public Mono<Boolean> unlink(String roleId, String permissionId) {
        return Mono.fromSupplier(() -> links.remove(new RolePermissionLink(roleId, permissionId)));
    }

    @Override
    public Mono<Resource> findResource(String resourceId) {
        return Mono.justOrEmpty(resources.get(resourceId));
    }

    @Override
    public Flux<Resource> findResourcesByPathPrefix(String pathPrefix) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(resources.values())))
                .filter(resource -> resource.path() != null && resource.path().startsWith(pathPrefix));
    }

    @Override
    public Mono<Resource> saveResource(Resource resource) {
        return Mono.fromSupplier(() -> {
            resources.put(resource.id(), resource);
            return resource;
        });
    }

    @Override
    public Flux<FieldDefinition> findFieldDefinitions(String entityType) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(fieldDefinitions.values())))
                .filter(definition -> entityType.equals(definition.entityType()));
    }

    @Override
    public Mono<FieldDefinition> saveFieldDefinition(FieldDefinition definition) {
        return Mono.fromSupplier(() -> {
            fieldDefinitions.put(definition.entityType() + "/" + definition.tier() + "/" + definition.fieldName(),
                    definition);
            return definition;
        });
    }

    private static String assignmentKey(String principalId, String roleId) {
        return principalId + "/" + roleId;
    }
}
