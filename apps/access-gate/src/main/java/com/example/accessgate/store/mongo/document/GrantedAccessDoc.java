package com.example.accessgate.store.mongo.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@Builder
@Document(collection = "granted_access")
@CompoundIndex(name = "grant_lookup_idx", def = "{'principalId': 1, 'resourceKey': 1, 'action': 1}")
public class GrantedAccessDoc {

    @Id
    private String id;

    private String principalId;

    private String resourceKey;

    private String action;

    private String requestId;

    private Instant grantedAt;

    private Instant expiresAt;
}
