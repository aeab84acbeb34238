package com.example.accessgate.model;

public record RolePermissionLink(String roleId, String permissionId) {
}
