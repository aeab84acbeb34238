package com.example.accessgate.store.mongo.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Access request with its details flattened. Transitions are conditional updates on
 * {@code status}, {@code currentLevel} and {@code version}. {@code openKey} is only written
 * while the request is open; its unique sparse index admits one open request per key.
 */
@Data
@Builder
@Document(collection = "access_requests")
public class AccessRequestDoc {

    public static final String ID = "_id";
    public static final String STATUS = "status";
    public static final String CURRENT_LEVEL = "currentLevel";
    public static final String VERSION = "version";

    @Id
    private String id;

    private String tenantId;

    private String requesterId;

    private String chainId;

    private String resourceType;

    private String resourceId;

    private String resourcePath;

    private String resourceKey;

    private String action;

    private String justification;

    private Instant accessExpiresAt;

    @Indexed
    private String status;

    @Indexed(name = "open_request_idx", unique = true, sparse = true)
    private String openKey;

    private int currentLevel;

    private Instant createdAt;

    private Instant levelEnteredAt;

    private Instant updatedAt;

    private long version;
}
