package com.example.accessgate.notification;

import reactor.core.publisher.Mono;

/**
 * Delivery collaborator for approval notifications. The engine never consumes a result.
 */
public interface NotificationService {

    Mono<Void> notify(NotificationTarget target, String requestId, int level);
}
