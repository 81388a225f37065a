package com.ableclub.monitor.events.scheduler;

import java.time.Duration;
import java.util.List;

/**
 * Static configuration of a recurring job, loaded once at startup.
 *
 * <p>At most one instance of a job runs at any time; the scheduler enforces
 * that, so there is no per-definition concurrency setting.
 */
public record JobDefinition(
    String name,
    Duration interval,
    int maxRetries,
    List<Duration> backoffSchedule,
    int pauseThreshold,
    Duration pauseDuration
) {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final List<Duration> DEFAULT_BACKOFF = List.of(
        Duration.ofMinutes(1),
        Duration.ofMinutes(2),
        Duration.ofMinutes(3)
    );
    public static final int DEFAULT_PAUSE_THRESHOLD = 3;
    public static final Duration DEFAULT_PAUSE_DURATION = Duration.ofHours(6);

    public JobDefinition {
        if (name == null || name.isBlank()) {
            throw new JobConfigurationException("Job name must not be blank");
        }
        name = name.trim();
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new JobConfigurationException("Job '" + name + "' needs a positive interval, got " + interval);
        }
        if (maxRetries < 1) {
            throw new JobConfigurationException("Job '" + name + "' needs maxRetries >= 1, got " + maxRetries);
        }
        backoffSchedule = backoffSchedule == null ? List.of() : List.copyOf(backoffSchedule);
        if (backoffSchedule.size() < maxRetries - 1) {
            throw new JobConfigurationException(
                "Job '" + name + "' needs at least " + (maxRetries - 1) + " backoff steps, got " + backoffSchedule.size()
            );
        }
        for (Duration step : backoffSchedule) {
            if (step.isNegative()) {
                throw new JobConfigurationException("Job '" + name + "' has a negative backoff step " + step);
            }
        }
        if (pauseThreshold < 1) {
            throw new JobConfigurationException("Job '" + name + "' needs pauseThreshold >= 1, got " + pauseThreshold);
        }
        if (pauseDuration == null || pauseDuration.isNegative() || pauseDuration.isZero()) {
            throw new JobConfigurationException("Job '" + name + "' needs a positive pause duration, got " + pauseDuration);
        }
    }

    public static JobDefinition withDefaults(String name, Duration interval) {
        return new JobDefinition(
            name,
            interval,
            DEFAULT_MAX_RETRIES,
            DEFAULT_BACKOFF,
            DEFAULT_PAUSE_THRESHOLD,
            DEFAULT_PAUSE_DURATION
        );
    }

    /** Wait before the attempt that follows {@code failedAttempt} (1-based). */
    public Duration backoffAfter(int failedAttempt) {
        return backoffSchedule.get(failedAttempt - 1);
    }
}
