package com.example.accessgate.audit;

import reactor.core.publisher.Mono;

/**
 * Append-only destination for audit events. Implementations never fail the caller.
 */
public interface AuditSink {

    Mono<Void> record(AuditEvent event);
}
