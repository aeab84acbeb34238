package com.example.accessgate.store.mongo.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

// ID format: "{roleId}#{permissionId}"
@Data
@Builder
@Document(collection = "role_permissions")
public class RolePermissionDoc {

    @Id
    private String id;

    @Indexed
    private String roleId;

    @Indexed
    private String permissionId;

    public static String idFor(String roleId, String permissionId) {
        return roleId + "#" + permissionId;
    }
}
