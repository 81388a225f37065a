package com.ableclub.monitor.events.model;

public record FiringResult(
    String jobName,
    FiringDecision decision,
    JobOutcome outcome
) {
    public static FiringResult skipped(String jobName, FiringDecision decision) {
        return new FiringResult(jobName, decision, null);
    }

    public static FiringResult ran(String jobName, JobOutcome outcome) {
        return new FiringResult(jobName, FiringDecision.RAN, outcome);
    }

    public boolean skipped() {
        return decision != FiringDecision.RAN;
    }
}
