package com.example.accessgate.store;

import com.example.accessgate.model.FieldDefinition;
import com.example.accessgate.model.Group;
import com.example.accessgate.model.Permission;
import com.example.accessgate.model.Principal;
import com.example.accessgate.model.Resource;
import com.example.accessgate.model.Role;
import com.example.accessgate.model.RoleAssignment;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence port for principals, roles, groups, permissions, resources and field definitions.
 * Backend failures surface as {@link com.example.accessgate.exception.UnavailableException}.
 */
public interface DirectoryStore {

    Mono<Principal> findPrincipal(String principalId);

    Mono<Principal> savePrincipal(Principal principal);

    Mono<Role> findRole(String roleId);

    Flux<Role> findChildRoles(String parentRoleId);

    Mono<Role> saveRole(Role role);

    Mono<Group> findGroup(String groupId);

    Flux<Group> findChildGroups(String parentGroupId);

    Flux<Group> findGroupsGrantingRole(String roleId);

    Mono<Group> saveGroup(Group group);

    Flux<Principal> findGroupMembers(String groupId);

    Flux<RoleAssignment> findAssignments(String principalId);

    Flux<RoleAssignment> findAssignmentsForRole(String roleId);

    Mono<RoleAssignment> saveAssignment(RoleAssignment assignment);

    Mono<Boolean> deleteAssignment(String principalId, String roleId);

    Mono<Permission> findPermission(String permissionId);

    Mono<Permission> savePermission(Permission permission);

    /**
     * Active permissions linked to the role.
     */
    Flux<Permission> findPermissionsByRole(String roleId);

    Flux<String> findRolesByPermission(String permissionId);

    Mono<Boolean> link(String roleId, String permissionId);

    Mono<Boolean> unlink(String roleId, String permissionId);

    Mono<Resource> findResource(String resourceId);

    Flux<Resource> findResourcesByPathPrefix(String pathPrefix);

    Mono<Resource> saveResource(Resource resource);

    Flux<FieldDefinition> findFieldDefinitions(String entityType);

    Mono<FieldDefinition> saveFieldDefinition(FieldDefinition definition);
}
