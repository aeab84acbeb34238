package com.example.accessgate.model;

import com.example.accessgate.condition.Condition;
import com.example.accessgate.exception.ValidationException;
import lombok.Builder;
import lombok.Singular;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Grant of {@code actions} on resources located by exactly one of {@code resourceId} or
 * {@code resourcePath} (a glob). With neither, the grant covers every resource of
 * {@code resourceType}. Attached to roles through {@link RolePermissionLink}s.
 */
@Builder(toBuilder = true)
public record Permission(
        String id,
        String tenantId,
        String resourceType,
        String resourceId,
        String resourcePath,
        @Singular Set<Action> actions,
        @Singular List<Condition> conditions,
        FieldPermissions fieldPermissions,
        boolean active
) {
    public Permission {
        actions = actions == null || actions.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(actions));
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        fieldPermissions = fieldPermissions == null ? FieldPermissions.empty() : fieldPermissions;
    }

    public boolean isTypeWide() {
        return resourceId == null && resourcePath == null;
    }

    /**
     * @throws ValidationException when both locators are set, or the type is missing
     */
    public Permission validate() {
        if (id == null || id.isBlank()) {
            throw new ValidationException("Permission id must not be blank");
        }
        if (resourceType == null || resourceType.isBlank()) {
            throw new ValidationException("Permission " + id + " has no resource type");
        }
        if (resourceId != null && resourcePath != null) {
            throw new ValidationException("Permission " + id + " must set either resourceId or resourcePath, not both");
        }
        if (actions.isEmpty()) {
            throw new ValidationException("Permission " + id + " grants no actions");
        }
        return this;
    }
}
