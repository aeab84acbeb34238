package com.example.accessgate.store.mongo;

import com.example.accessgate.exception.ConflictException;
import com.example.accessgate.exception.UnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;

final class MongoErrors {

    static final String BACKEND = "mongodb";

    private MongoErrors() {}

    /**
     * Duplicate keys are conflicts; every other data access failure means the store is unavailable.
     */
    static RuntimeException translate(String operation, DataAccessException error) {
        if (error instanceof DuplicateKeyException) {
            return new ConflictException(operation + " violates a unique constraint", error);
        }
        return new UnavailableException(BACKEND, operation + " failed: " + error.getMessage(), error);
    }
}
