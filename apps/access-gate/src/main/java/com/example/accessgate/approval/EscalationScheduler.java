package com.example.accessgate.approval;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Optional in-process trigger for {@link EscalationSweeper}. Disabled by default; deployments
 * usually trigger the sweep from an external scheduler instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "access-gate.approval.escalation.enabled", havingValue = "true")
public class EscalationScheduler {

    private final EscalationSweeper sweeper;

    @Scheduled(fixedDelayString = "${access-gate.approval.escalation.interval:PT5M}")
    public void trigger() {
        sweeper.runEscalationSweep()
                .subscribe(
                        report -> log.debug("Scheduled escalation sweep finished: {}", report),
                        error -> log.warn("Scheduled escalation sweep failed: {}", error.getMessage()));
    }
}
