package com.example.accessgate.approval.model;

import com.example.accessgate.model.Action;
import com.example.accessgate.model.ResourceTarget;

import java.time.Instant;

/**
 * What the requester asked for. {@code accessExpiresAt} bounds the resulting grant; null means
 * the grant does not expire.
 */
public record RequestDetails(
        ResourceTarget resource,
        Action action,
        String justification,
        Instant accessExpiresAt
) {
}
