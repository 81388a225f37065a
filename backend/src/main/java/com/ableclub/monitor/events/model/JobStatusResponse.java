package com.ableclub.monitor.events.model;

public record JobStatusResponse(
    JobStatusView state,
    JobExecutionRecord latestExecution
) {
}
