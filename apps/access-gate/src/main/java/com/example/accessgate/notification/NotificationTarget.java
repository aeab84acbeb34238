package com.example.accessgate.notification;

import java.util.Set;

/**
 * Recipients of an approval notification: approver roles and/or individual principals.
 */
public record NotificationTarget(Set<String> roleIds, Set<String> principalIds) {

    public NotificationTarget {
        roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
        principalIds = principalIds == null ? Set.of() : Set.copyOf(principalIds);
    }

    public static NotificationTarget role(String roleId) {
        return new NotificationTarget(Set.of(roleId), Set.of());
    }
}
