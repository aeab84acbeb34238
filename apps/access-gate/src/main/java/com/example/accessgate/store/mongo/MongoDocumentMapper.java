package com.example.accessgate.store.mongo;

import com.example.accessgate.approval.model.AccessRequest;
import com.example.accessgate.approval.model.AccessRequestStatus;
import com.example.accessgate.approval.model.Approval;
import com.example.accessgate.approval.model.ApprovalChain;
import com.example.accessgate.approval.model.ApprovalDecision;
import com.example.accessgate.approval.model.ApprovalLevel;
import com.example.accessgate.approval.model.GrantedAccess;
import com.example.accessgate.approval.model.RequestDetails;
import com.example.accessgate.condition.Condition;
import com.example.accessgate.condition.ConditionParser;
import com.example.accessgate.model.Action;
import com.example.accessgate.model.FieldAction;
import com.example.accessgate.model.FieldDefinition;
import com.example.accessgate.model.FieldPermissions;
import com.example.accessgate.model.FieldTier;
import com.example.accessgate.model.Group;
import com.example.accessgate.model.Permission;
import com.example.accessgate.model.Principal;
import com.example.accessgate.model.Resource;
import com.example.accessgate.model.ResourceTarget;
import com.example.accessgate.model.Role;
import com.example.accessgate.model.RoleAssignment;
import com.example.accessgate.store.mongo.document.AccessRequestDoc;
import com.example.accessgate.store.mongo.document.ApprovalChainDoc;
import com.example.accessgate.store.mongo.document.ApprovalDoc;
import com.example.accessgate.store.mongo.document.ConditionDoc;
import com.example.accessgate.store.mongo.document.FieldDefinitionDoc;
import com.example.accessgate.store.mongo.document.GrantedAccessDoc;
import com.example.accessgate.store.mongo.document.GroupDoc;
import com.example.accessgate.store.mongo.document.PermissionDoc;
import com.example.accessgate.store.mongo.document.PrincipalDoc;
import com.example.accessgate.store.mongo.document.ResourceDoc;
import com.example.accessgate.store.mongo.document.RoleAssignmentDoc;
import com.example.accessgate.store.mongo.document.RoleDoc;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Conversions between domain records and their MongoDB documents. Enums are stored by their
 * lowercase value or name so documents stay readable from the shell.
 */
final class MongoDocumentMapper {

    private MongoDocumentMapper() {}

    static PrincipalDoc toDoc(Principal principal) {
        return PrincipalDoc.builder()
                .id(principal.id())
                .tenantId(principal.tenantId())
                .serviceAccount(principal.serviceAccount())
                .attributes(principal.attributes())
                .groupIds(principal.groupIds())
                .active(principal.active())
                .build();
    }

    static Principal fromDoc(PrincipalDoc doc) {
        return new Principal(doc.getId(), doc.getTenantId(), doc.isServiceAccount(), doc.getAttributes(),
                doc.getGroupIds(), doc.isActive());
    }

    static RoleDoc toDoc(Role role) {
        return RoleDoc.builder()
                .id(role.id())
                .tenantId(role.tenantId())
                .parentId(role.parentId())
                .priority(role.priority())
                .assignable(role.assignable())
                .active(role.active())
                .build();
    }

    static Role fromDoc(RoleDoc doc) {
        return new Role(doc.getId(), doc.getTenantId(), doc.getParentId(), doc.getPriority(), doc.isAssignable(),
                doc.isActive());
    }

    static GroupDoc toDoc(Group group) {
        return GroupDoc.builder()
                .id(group.id())
                .tenantId(group.tenantId())
                .parentId(group.parentId())
                .roleIds(group.roleIds())
                .active(group.active())
                .build();
    }

    static Group fromDoc(GroupDoc doc) {
        return new Group(doc.getId(), doc.getTenantId(), doc.getParentId(), doc.getRoleIds(), doc.isActive());
    }

    static RoleAssignmentDoc toDoc(RoleAssignment assignment) {
        return RoleAssignmentDoc.builder()
                .id(RoleAssignmentDoc.idFor(assignment.principalId(), assignment.roleId()))
                .principalId(assignment.principalId())
                .roleId(assignment.roleId())
                .expiresAt(assignment.expiresAt())
                .active(assignment.active())
                .build();
    }

    static RoleAssignment fromDoc(RoleAssignmentDoc doc) {
        return new RoleAssignment(doc.getPrincipalId(), doc.getRoleId(), doc.getExpiresAt(), doc.isActive());
    }

    static PermissionDoc toDoc(Permission permission) {
        return PermissionDoc.builder()
                .id(permission.id())
                .tenantId(permission.tenantId())
                .resourceType(permission.resourceType())
                .resourceId(permission.resourceId())
                .resourcePath(permission.resourcePath())
                .actions(permission.actions().stream().map(Action::value).sorted().toList())
                .conditions(toConditionDocs(permission.conditions()))
                .fieldPermissions(toFieldMap(permission.fieldPermissions()))
                .active(permission.active())
                .build();
    }

    static Permission fromDoc(PermissionDoc doc) {
        return new Permission(doc.getId(), doc.getTenantId(), doc.getResourceType(), doc.getResourceId(),
                doc.getResourcePath(), toActions(doc.getActions()), fromConditionDocs(doc.getConditions()),
                fromFieldMap(doc.getFieldPermissions()), doc.isActive());
    }

    static ResourceDoc toDoc(Resource resource) {
        return ResourceDoc.builder()
                .id(resource.id())
                .tenantId(resource.tenantId())
                .type(resource.type())
                .parentId(resource.parentId())
                .path(resource.path())
                .attributes(resource.attributes())
                .build();
    }

    static Resource fromDoc(ResourceDoc doc) {
        return new Resource(doc.getId(), doc.getTenantId(), doc.getType(), doc.getParentId(), doc.getPath(),
                doc.getAttributes());
    }

    static FieldDefinitionDoc toDoc(FieldDefinition definition) {
        return FieldDefinitionDoc.builder()
                .id(definition.entityType() + "/" + definition.tier().name() + "/" + definition.fieldName())
                .entityType(definition.entityType())
                .fieldName(definition.fieldName())
                .tier(definition.tier().name())
                .build();
    }

    static FieldDefinition fromDoc(FieldDefinitionDoc doc) {
        return new FieldDefinition(doc.getEntityType(), doc.getFieldName(), FieldTier.valueOf(doc.getTier()));
    }

    static ApprovalChainDoc toDoc(ApprovalChain chain) {
        return ApprovalChainDoc.builder()
                .id(chain.id())
                .tenantId(chain.tenantId())
                .resourceType(chain.resourceType())
                .resourcePattern(chain.resourcePattern())
                .actions(chain.actions().stream().map(Action::value).sorted().toList())
                .levels(chain.levels().stream().map(MongoDocumentMapper::toLevelDoc).toList())
                .autoApproveConditions(toConditionDocs(chain.autoApproveConditions()))
                .active(chain.active())
                .build();
    }

    static ApprovalChain fromDoc(ApprovalChainDoc doc) {
        List<ApprovalLevel> levels = doc.getLevels() == null
                ? List.of()
                : doc.getLevels().stream().map(MongoDocumentMapper::fromLevelDoc).toList();
        return new ApprovalChain(doc.getId(), doc.getTenantId(), doc.getResourceType(), doc.getResourcePattern(),
                toActions(doc.getActions()), levels, fromConditionDocs(doc.getAutoApproveConditions()),
                doc.isActive());
    }

    static AccessRequestDoc toDoc(AccessRequest request) {
        RequestDetails details = request.details();
        ResourceTarget resource = details.resource();
        return AccessRequestDoc.builder()
                .id(request.id())
                .tenantId(request.tenantId())
                .requesterId(request.requesterId())
                .chainId(request.chainId())
                .resourceType(resource.type())
                .resourceId(resource.id())
                .resourcePath(resource.path())
                .resourceKey(resource.key())
                .action(details.action().value())
                .justification(details.justification())
                .accessExpiresAt(details.accessExpiresAt())
                .status(request.status().name())
                .openKey(request.status().isOpen() ? request.openKey() : null)
                .currentLevel(request.currentLevel())
                .createdAt(request.createdAt())
                .levelEnteredAt(request.levelEnteredAt())
                .updatedAt(request.updatedAt())
                .version(request.version())
                .build();
    }

    static AccessRequest fromDoc(AccessRequestDoc doc) {
        RequestDetails details = new RequestDetails(
                new ResourceTarget(doc.getResourceType(), doc.getResourceId(), doc.getResourcePath()),
                Action.fromValue(doc.getAction()),
                doc.getJustification(),
                doc.getAccessExpiresAt());
        return AccessRequest.builder()
                .id(doc.getId())
                .tenantId(doc.getTenantId())
                .requesterId(doc.getRequesterId())
                .chainId(doc.getChainId())
                .details(details)
                .status(AccessRequestStatus.valueOf(doc.getStatus()))
                .currentLevel(doc.getCurrentLevel())
                .createdAt(doc.getCreatedAt())
                .levelEnteredAt(doc.getLevelEnteredAt())
                .updatedAt(doc.getUpdatedAt())
                .version(doc.getVersion())
                .build();
    }

    static ApprovalDoc toDoc(Approval approval) {
        return ApprovalDoc.builder()
                .id(ApprovalDoc.idFor(approval.requestId(), approval.level()))
                .requestId(approval.requestId())
                .approverId(approval.approverId())
                .level(approval.level())
                .decision(approval.decision().value())
                .comments(approval.comments())
                .decidedAt(approval.decidedAt())
                .build();
    }

    static Approval fromDoc(ApprovalDoc doc) {
        return new Approval(doc.getRequestId(), doc.getApproverId(), doc.getLevel(),
                ApprovalDecision.fromValue(doc.getDecision()), doc.getComments(), doc.getDecidedAt());
    }

    static GrantedAccessDoc toDoc(GrantedAccess grant) {
        return GrantedAccessDoc.builder()
                .id(grant.id())
                .principalId(grant.principalId())
                .resourceKey(grant.resourceKey())
                .action(grant.action().value())
                .requestId(grant.requestId())
                .grantedAt(grant.grantedAt())
                .expiresAt(grant.expiresAt())
                .build();
    }

    static GrantedAccess fromDoc(GrantedAccessDoc doc) {
        return new GrantedAccess(doc.getId(), doc.getPrincipalId(), doc.getResourceKey(),
                Action.fromValue(doc.getAction()), doc.getRequestId(), doc.getGrantedAt(), doc.getExpiresAt());
    }

    private static ApprovalChainDoc.LevelDoc toLevelDoc(ApprovalLevel level) {
        return ApprovalChainDoc.LevelDoc.builder()
                .level(level.level())
                .approverRole(level.approverRole())
                .timeoutMillis(level.timeout() == null ? null : level.timeout().toMillis())
                .escalateToLevel(level.escalateToLevel())
                .autoApproveConditions(toConditionDocs(level.autoApproveConditions()))
                .build();
    }

    private static ApprovalLevel fromLevelDoc(ApprovalChainDoc.LevelDoc doc) {
        return new ApprovalLevel(doc.getLevel(), doc.getApproverRole(),
                doc.getTimeoutMillis() == null ? null : Duration.ofMillis(doc.getTimeoutMillis()),
                doc.getEscalateToLevel(), fromConditionDocs(doc.getAutoApproveConditions()));
    }

    private static List<ConditionDoc> toConditionDocs(List<Condition> conditions) {
        List<ConditionDoc> docs = new ArrayList<>();
        ConditionParser.toMap(conditions).forEach((path, value) -> docs.add(new ConditionDoc(path, value)));
        return docs;
    }

    private static List<Condition> fromConditionDocs(List<ConditionDoc> docs) {
        if (docs == null || docs.isEmpty()) {
            return List.of();
        }
        Map<String, Object> raw = new LinkedHashMap<>();
        docs.forEach(doc -> raw.put(doc.getPath(), doc.getValue()));
        return ConditionParser.parse(raw);
    }

    private static Set<Action> toActions(Collection<String> values) {
        if (values == null) {
            return Set.of();
        }
        return values.stream().map(Action::fromValue).collect(Collectors.toSet());
    }

    private static Map<String, Map<String, List<String>>> toFieldMap(FieldPermissions permissions) {
        Map<String, Map<String, List<String>>> tiers = new TreeMap<>();
        permissions.tiers().forEach((tier, fields) -> {
            Map<String, List<String>> byField = new TreeMap<>();
            fields.forEach((field, actions) -> byField.put(field, actions.stream().map(Enum::name).toList()));
            tiers.put(tier.name(), byField);
        });
        return tiers;
    }

    private static FieldPermissions fromFieldMap(Map<String, Map<String, List<String>>> raw) {
        if (raw == null || raw.isEmpty()) {
            return FieldPermissions.empty();
        }
        FieldPermissions.Builder builder = FieldPermissions.builder();
        raw.forEach((tier, fields) -> fields.forEach((field, actions) -> builder.grant(FieldTier.valueOf(tier), field,
                actions.stream().map(FieldAction::valueOf).toList())));
        return builder.build();
    }
}
