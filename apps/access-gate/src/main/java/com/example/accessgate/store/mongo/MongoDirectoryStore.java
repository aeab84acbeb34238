package com.example.accessgate.store.mongo;

import com.example.accessgate.model.FieldDefinition;
import com.example.accessgate.model.Group;
import com.example.accessgate.model.Permission;
import com.example.accessgate.model.Principal;
import com.example.accessgate.model.Resource;
import com.example.accessgate.model.Role;
import com.example.accessgate.model.RoleAssignment;
import com.example.accessgate.store.DirectoryStore;
import com.example.accessgate.store.mongo.document.RoleAssignmentDoc;
import com.example.accessgate.store.mongo.document.RolePermissionDoc;
import com.example.accessgate.store.mongo.repository.FieldDefinitionRepository;
import com.example.accessgate.store.mongo.repository.GroupRepository;
import com.example.accessgate.store.mongo.repository.PermissionRepository;
import com.example.accessgate.store.mongo.repository.PrincipalRepository;
import com.example.accessgate.store.mongo.repository.ResourceRepository;
import com.example.accessgate.store.mongo.repository.RoleAssignmentRepository;
import com.example.accessgate.store.mongo.repository.RolePermissionRepository;
import com.example.accessgate.store.mongo.repository.RoleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "access-gate.store.type", havingValue = "mongo")
public class MongoDirectoryStore implements DirectoryStore {

    private final PrincipalRepository principalRepository;
    private final RoleRepository roleRepository;
    private final GroupRepository groupRepository;
    private final RoleAssignmentRepository assignmentRepository;
    private final PermissionRepository permissionRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final ResourceRepository resourceRepository;
    private final FieldDefinitionRepository fieldDefinitionRepository;

    @Override
    public Mono<Principal> findPrincipal(String principalId) {
        return principalRepository.findById(principalId)
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findPrincipal", e));
    }

    @Override
    public Mono<Principal> savePrincipal(Principal principal) {
        return principalRepository.save(MongoDocumentMapper.toDoc(principal))
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("savePrincipal", e));
    }

    @Override
    public Mono<Role> findRole(String roleId) {
        return roleRepository.findById(roleId)
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findRole", e));
    }

    @Override
    public Flux<Role> findChildRoles(String parentRoleId) {
        return roleRepository.findByParentId(parentRoleId)
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findChildRoles", e));
    }

    @Override
    public Mono<Role> saveRole(Role role) {
        return roleRepository.save(MongoDocumentMapper.toDoc(role))
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("saveRole", e));
    }

    @Override
    public Mono<Group> findGroup(String groupId) {
        return groupRepository.findById(groupId)
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findGroup", e));
    }

    @Override
    public Flux<Group> findChildGroups(String parentGroupId) {
        return groupRepository.findByParentId(parentGroupId)
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findChildGroups", e));
    }

    @Override
    public Flux<Group> findGroupsGrantingRole(String roleId) {
        return groupRepository.findByRoleIds(roleId)
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findGroupsGrantingRole", e));
    }

    @Override
    public Mono<Group> saveGroup(Group group) {
        return groupRepository.save(MongoDocumentMapper.toDoc(group))
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("saveGroup", e));
    }

    @Override
    public Flux<Principal> findGroupMembers(String groupId) {
        return principalRepository.findByGroupIds(groupId)
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findGroupMembers", e));
    }

    @Override
    public Flux<RoleAssignment> findAssignments(String principalId) {
        return assignmentRepository.findByPrincipalId(principalId)
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findAssignments", e));
    }

    @Override
    public Flux<RoleAssignment> findAssignmentsForRole(String roleId) {
        return assignmentRepository.findByRoleId(roleId)
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findAssignmentsForRole", e));
    }

    @Override
    public Mono<RoleAssignment> saveAssignment(RoleAssignment assignment) {
        return assignmentRepository.save(MongoDocumentMapper.toDoc(assignment))
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("saveAssignment", e));
    }

    @Override
    public Mono<Boolean> deleteAssignment(String principalId, String roleId) {
        String id = RoleAssignmentDoc.idFor(principalId, roleId);
        return assignmentRepository.existsById(id)
                .flatMap(exists -> exists
                        ? assignmentRepository.deleteById(id).thenReturn(true)
                        : Mono.just(false))
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("deleteAssignment", e));
    }

    @Override
    public Mono<Permission> findPermission(String permissionId) {
        return permissionRepository.findById(permissionId)
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findPermission", e));
    }

    @Override
    public Mono<Permission> savePermission(Permission permission) {
        return permissionRepository.save(MongoDocumentMapper.toDoc(permission))
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("savePermission", e));
    }

    @Override
    public Flux<Permission> findPermissionsByRole(String roleId) {
        return rolePermissionRepository.findByRoleId(roleId)
                .map(RolePermissionDoc::getPermissionId)
                .collectList()
                .flatMapMany(permissionRepository::findAllById)
                .map(MongoDocumentMapper::fromDoc)
                .filter(Permission::active)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findPermissionsByRole", e));
    }

    @Override
    public Flux<String> findRolesByPermission(String permissionId) {
        return rolePermissionRepository.findByPermissionId(permissionId)
                .map(RolePermissionDoc::getRoleId)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findRolesByPermission", e));
    }

    @Override
    public Mono<Boolean> link(String roleId, String permissionId) {
        String id = RolePermissionDoc.idFor(roleId, permissionId);
        return rolePermissionRepository.existsById(id)
                .flatMap(exists -> exists
                        ? Mono.just(false)
                        : rolePermissionRepository.save(RolePermissionDoc.builder()
                                .id(id)
                                .roleId(roleId)
                                .permissionId(permissionId)
                                .build()).thenReturn(true))
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("link", e));
    }

    @Override
    public Mono<Boolean> unlink(String roleId, String permissionId) {
        String id = RolePermissionDoc.idFor(roleId, permissionId);
        return rolePermissionRepository.existsById(id)
                .flatMap(exists -> exists
                        ? rolePermissionRepository.deleteById(id).thenReturn(true)
                        : Mono.just(false))
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("unlink", e));
    }

    @Override
    public Mono<Resource> findResource(String resourceId) {
        return resourceRepository.findById(resourceId)
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findResource", e));
    }

    @Override
    public Flux<Resource> findResourcesByPathPrefix(String pathPrefix) {
        return resourceRepository.findByPathStartingWith(pathPrefix)
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findResourcesByPathPrefix", e));
    }

    @Override
    public Mono<Resource> saveResource(Resource resource) {
        return resourceRepository.save(MongoDocumentMapper.toDoc(resource))
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("saveResource", e));
    }

    @Override
    public Flux<FieldDefinition> findFieldDefinitions(String entityType) {
        return fieldDefinitionRepository.findByEntityType(entityType)
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("findFieldDefinitions", e));
    }

    @Override
    public Mono<FieldDefinition> saveFieldDefinition(FieldDefinition definition) {
        return fieldDefinitionRepository.save(MongoDocumentMapper.toDoc(definition))
                .map(MongoDocumentMapper::fromDoc)
                .onErrorMap(DataAccessException.class, e -> MongoErrors.translate("saveFieldDefinition", e));
    }
}
