package com.example.accessgate.store.mongo.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

// ID format: "{principalId}#{roleId}"
@Data
@Builder
@Document(collection = "role_assignments")
public class RoleAssignmentDoc {

    @Id
    private String id;

    @Indexed
    private String principalId;

    @Indexed
    private String roleId;

    private Instant expiresAt;

    private boolean active;

    public static String idFor(String principalId, String roleId) {
        return principalId + "#" + roleId;
    }
}
