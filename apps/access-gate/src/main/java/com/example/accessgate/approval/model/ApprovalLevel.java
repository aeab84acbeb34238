package com.example.accessgate.approval.model;

import com.example.accessgate.condition.Condition;
import lombok.Builder;
import lombok.Singular;

import java.time.Duration;
import java.util.List;

/**
 * One sign-off step. A null {@code timeout} never escalates.
 */
@Builder(toBuilder = true)
public record ApprovalLevel(
        int level,
        String approverRole,
        Duration timeout,
        Integer escalateToLevel,
        @Singular List<Condition> autoApproveConditions
) {
    public ApprovalLevel {
        autoApproveConditions = autoApproveConditions == null ? List.of() : List.copyOf(autoApproveConditions);
    }
}
