package com.example.accessgate.store.mongo.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Data
@Builder
@Document(collection = "roles")
public class RoleDoc {

    @Id
    private String id;

    private String tenantId;

    /**
     * Single parent; null for a root role.
     */
    @Indexed
    private String parentId;

    private int priority;

    private boolean assignable;

    private boolean active;
}
