package com.example.accessgate.observability.metrics;

import com.example.accessgate.approval.model.AccessRequestStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Decision, approval and escalation counters. Tag values come from closed enums only.
 */
@Component
public class DecisionMetrics {

    public enum DecisionResult { ALLOWED, DENIED, APPROVAL_REQUIRED, ERROR }

    public enum SweepOutcome { ESCALATED, EXPIRED, CONFLICT }

    private final Map<DecisionResult, Counter> decisions = new EnumMap<>(DecisionResult.class);
    private final Map<AccessRequestStatus, Counter> transitions = new EnumMap<>(AccessRequestStatus.class);
    private final Map<SweepOutcome, Counter> sweeps = new EnumMap<>(SweepOutcome.class);
    private final Timer evaluationTimer;

    public DecisionMetrics(@NonNull MeterRegistry registry) {
        for (DecisionResult result : DecisionResult.values()) {
            decisions.put(result, Counter.builder("access_gate.decision")
                    .tag("result", result.name().toLowerCase())
                    .description("Access decisions by result")
                    .register(registry));
        }
        for (AccessRequestStatus status : AccessRequestStatus.values()) {
            transitions.put(status, Counter.builder("access_gate.approval.transition")
                    .tag("to", status.value())
                    .description("Access request state transitions")
                    .register(registry));
        }
        for (SweepOutcome outcome : SweepOutcome.values()) {
            sweeps.put(outcome, Counter.builder("access_gate.escalation.sweep")
                    .tag("outcome", outcome.name().toLowerCase())
                    .description("Escalation sweep results")
                    .register(registry));
        }
        this.evaluationTimer = Timer.builder("access_gate.evaluation")
                .description("Uncached evaluation latency")
                .register(registry);
    }

    public void recordDecision(DecisionResult result) {
        decisions.get(result).increment();
    }

    public void recordTransition(AccessRequestStatus to) {
        transitions.get(to).increment();
    }

    public void recordSweep(SweepOutcome outcome) {
        sweeps.get(outcome).increment();
    }

    public void recordEvaluation(Duration duration) {
        evaluationTimer.record(duration);
    }
}
