package com.example.accessgate.exception;

import lombok.Getter;

/**
 * A persistence or cache backend could not be reached.
 */
@Getter
public class UnavailableException extends AccessGateException {

    private final String backend;

    public UnavailableException(String backend, String message, Throwable cause) {
        super(ReasonCode.UNAVAILABLE, backend + " unavailable: " + message, cause);
        this.backend = backend;
    }
}
