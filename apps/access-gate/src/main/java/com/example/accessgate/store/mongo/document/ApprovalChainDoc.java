package com.example.accessgate.store.mongo.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;

@Data
@Builder
@Document(collection = "approval_chains")
@CompoundIndex(name = "type_active_idx", def = "{'resourceType': 1, 'active': 1}")
public class ApprovalChainDoc {

    @Id
    private String id;

    private String tenantId;

    private String resourceType;

    private String resourcePattern;

    /**
     * Gated actions; empty gates every action.
     */
    private List<String> actions;

    private List<LevelDoc> levels;

    private List<ConditionDoc> autoApproveConditions;

    private boolean active;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LevelDoc {

        private int level;

        private String approverRole;

        /**
         * Null never escalates.
         */
        private Long timeoutMillis;

        private Integer escalateToLevel;

        private List<ConditionDoc> autoApproveConditions;
    }
}
