package com.example.accessgate.exception;

/**
 * Lost race on a state transition or duplicate terminal decision. Callers may re-read and retry.
 */
public class ConflictException extends AccessGateException {

    public ConflictException(String message) {
        super(ReasonCode.CONFLICT, message);
    }

    public ConflictException(String message, Throwable cause) {
        super(ReasonCode.CONFLICT, message, cause);
    }
}
