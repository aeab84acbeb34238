package com.example.accessgate.store.mongo.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

// ID format: "{requestId}#{level}". The unique index backs the one-decision-per-level rule.
@Data
@Builder
@Document(collection = "approvals")
@CompoundIndex(name = "request_level_uidx", def = "{'requestId': 1, 'level': 1}", unique = true)
public class ApprovalDoc {

    @Id
    private String id;

    private String requestId;

    private String approverId;

    private int level;

    private String decision;

    private String comments;

    private Instant decidedAt;

    public static String idFor(String requestId, int level) {
        return requestId + "#" + level;
    }
}
