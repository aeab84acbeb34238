package com.example.accessgate.store.mongo.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;
import java.util.Map;

@Data
@Builder
@Document(collection = "permissions")
public class PermissionDoc {

    @Id
    private String id;

    private String tenantId;

    private String resourceType;

    private String resourceId;

    /**
     * Glob over resource paths; mutually exclusive with {@link #resourceId}.
     */
    private String resourcePath;

    private List<String> actions;

    private List<ConditionDoc> conditions;

    /**
     * Tier name to field name to action names.
     */
    private Map<String, Map<String, List<String>>> fieldPermissions;

    private boolean active;
}
