package com.example.accessgate.approval.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AccessRequestStatus {
    PENDING,
    PENDING_NEXT_LEVEL,
    APPROVED,
    DENIED,
    EXPIRED,
    CANCELLED;

    public boolean isOpen() {
        return this == PENDING || this == PENDING_NEXT_LEVEL;
    }

    public boolean isTerminal() {
        return !isOpen();
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
