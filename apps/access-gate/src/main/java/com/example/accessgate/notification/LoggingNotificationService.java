package com.example.accessgate.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Default delivery that only logs.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "access-gate.notification.type", havingValue = "log", matchIfMissing = true)
public class LoggingNotificationService implements NotificationService {

    @Override
    public Mono<Void> notify(NotificationTarget target, String requestId, int level) {
        return Mono.fromRunnable(() -> log.info("Approval needed: request={}, level={}, roles={}, principals={}",
                requestId, level, target.roleIds(), target.principalIds()));
    }
}
