package com.example.accessgate.approval;

/**
 * Counts from one escalation sweep. {@code conflicts} are requests that changed underneath the
 * sweep and were left alone.
 */
public record SweepReport(int examined, int escalated, int expired, int conflicts) {

    public static SweepReport empty() {
        return new SweepReport(0, 0, 0, 0);
    }

    SweepReport add(SweepOutcome outcome) {
        return new SweepReport(
                examined + 1,
                escalated + (outcome == SweepOutcome.ESCALATED ? 1 : 0),
                expired + (outcome == SweepOutcome.EXPIRED ? 1 : 0),
                conflicts + (outcome == SweepOutcome.CONFLICT ? 1 : 0));
    }

    enum SweepOutcome { UNCHANGED, ESCALATED, EXPIRED, CONFLICT }
}
