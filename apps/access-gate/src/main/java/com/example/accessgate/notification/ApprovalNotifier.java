package com.example.accessgate.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Fire-and-forget dispatch: the caller's transition never waits on delivery and delivery
 * failures are only logged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApprovalNotifier {

    private final NotificationService notificationService;

    public void dispatch(NotificationTarget target, String requestId, int level) {
        Mono.defer(() -> notificationService.notify(target, requestId, level))
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        ok -> {},
                        error -> log.warn("Notification for request {} level {} failed: {}",
                                requestId, level, error.getMessage()),
                        () -> log.debug("Notification dispatched for request {} level {}", requestId, level));
    }
}
