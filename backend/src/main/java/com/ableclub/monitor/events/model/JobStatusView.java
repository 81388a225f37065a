package com.ableclub.monitor.events.model;

import java.time.Instant;

public record JobStatusView(
    String jobName,
    JobStatus status,
    int consecutiveFailures,
    Instant pausedUntil,
    Instant lastFiredAt,
    JobOutcome lastOutcome
) {
}
