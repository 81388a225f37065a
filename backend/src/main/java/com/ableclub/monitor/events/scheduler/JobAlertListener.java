package com.ableclub.monitor.events.scheduler;

import java.time.Instant;

public interface JobAlertListener {
    void cycleFailed(String jobName, int attempts, String errorSummary);

    void jobPaused(String jobName, int consecutiveFailures, Instant pausedUntil);

    void jobResumed(String jobName);
}
