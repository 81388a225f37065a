package com.ableclub.monitor.events.model;

import java.util.List;

public record JobExecutionStats(
    String jobName,
    int days,
    long totalExecutions,
    long successfulExecutions,
    long failedExecutions,
    double successRate,
    double averageDurationMs,
    List<String> recentFailureSummaries
) {
}
