package com.example.accessgate.approval.model;

import java.time.Instant;

/**
 * Immutable decision of one approver at one level. At most one exists per (request, level).
 */
public record Approval(
        String requestId,
        String approverId,
        int level,
        ApprovalDecision decision,
        String comments,
        Instant decidedAt
) {
}
