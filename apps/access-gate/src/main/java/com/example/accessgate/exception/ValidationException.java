package com.example.accessgate.exception;

public class ValidationException extends AccessGateException {

    public ValidationException(String message) {
        super(ReasonCode.VALIDATION, message);
    }
}
