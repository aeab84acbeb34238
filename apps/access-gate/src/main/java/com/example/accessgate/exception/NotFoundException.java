package com.example.accessgate.exception;

import lombok.Getter;

@Getter
public class NotFoundException extends AccessGateException {

    private final String entityType;
    private final String entityId;

    public NotFoundException(String entityType, String entityId) {
        super(ReasonCode.NOT_FOUND, entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }
}
