package com.example.accessgate.approval.model;

import com.example.accessgate.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ApprovalDecision {
    APPROVED,
    DENIED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ApprovalDecision fromValue(String raw) {
        if (raw != null) {
            for (ApprovalDecision decision : values()) {
                if (decision.value().equalsIgnoreCase(raw.trim())) {
                    return decision;
                }
            }
        }
        throw new ValidationException("Unknown approval decision: " + raw);
    }
}
