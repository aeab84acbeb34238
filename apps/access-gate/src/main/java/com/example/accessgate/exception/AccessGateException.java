package com.example.accessgate.exception;

import lombok.Getter;

/**
 * Base type for every error surfaced by the engine.
 */
@Getter
public abstract class AccessGateException extends RuntimeException {

    private final ReasonCode reasonCode;

    protected AccessGateException(ReasonCode reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    protected AccessGateException(ReasonCode reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
    }
}
