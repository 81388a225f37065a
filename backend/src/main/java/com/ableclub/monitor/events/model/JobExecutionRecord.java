package com.ableclub.monitor.events.model;

import java.time.Instant;
import java.util.Map;

public record JobExecutionRecord(
    Long id,
    String jobName,
    Instant startedAt,
    Instant finishedAt,
    long durationMs,
    JobOutcome outcome,
    int attempts,
    String errorSummary,
    Map<String, Integer> resultData
) {
    public JobExecutionRecord {
        resultData = resultData == null ? Map.of() : Map.copyOf(resultData);
    }
}
