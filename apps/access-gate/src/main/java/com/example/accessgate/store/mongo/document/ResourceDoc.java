package com.example.accessgate.store.mongo.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Map;

@Data
@Builder
@Document(collection = "resources")
public class ResourceDoc {

    @Id
    private String id;

    private String tenantId;

    private String type;

    private String parentId;

    /**
     * Materialized ancestry, e.g. {@code /root-id/child-id/}. Prefix queries use this index.
     */
    @Indexed
    private String path;

    private Map<String, Object> attributes;
}
