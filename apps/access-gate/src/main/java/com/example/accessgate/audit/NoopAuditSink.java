package com.example.accessgate.audit;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Service
@ConditionalOnProperty(name = "access-gate.audit.enabled", havingValue = "false")
public class NoopAuditSink implements AuditSink {

    @Override
    public Mono<Void> record(AuditEvent event) {
        return Mono.empty();
    }
}
