package com.example.accessgate.exception;

/**
 * Machine-readable reason attached to errors, denied decisions and audit events.
 */
public enum ReasonCode {
    GRANTED,
    NO_MATCHING_PERMISSION,
    APPROVAL_REQUIRED,
    REJECTED,
    AUTO_APPROVED,
    NOT_FOUND,
    VALIDATION,
    UNAUTHORIZED,
    CONFLICT,
    UNAVAILABLE,
    ESCALATED,
    EXPIRED,
    CANCELLED,
    INTERNAL_ERROR
}
