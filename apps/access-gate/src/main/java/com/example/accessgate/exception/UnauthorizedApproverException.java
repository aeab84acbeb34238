package com.example.accessgate.exception;

import lombok.Getter;

/**
 * Raised when the caller recording an approval decision does not hold the approver role of the level.
 */
@Getter
public class UnauthorizedApproverException extends AccessGateException {

    private final String approverId;
    private final String requestId;
    private final int level;

    public UnauthorizedApproverException(String approverId, String requestId, int level, String message) {
        super(ReasonCode.UNAUTHORIZED, message);
        this.approverId = approverId;
        this.requestId = requestId;
        this.level = level;
    }
}
