package com.ableclub.monitor.events.scheduler;

import com.ableclub.monitor.events.model.JobOutcome;
import com.ableclub.monitor.events.model.JobStatus;
import com.ableclub.monitor.events.model.JobStatusView;

import java.time.Instant;

/**
 * Mutable run state of one job. Only touched from the scheduler's timer
 * thread.
 */
final class JobRunState {
    private final String jobName;
    private JobStatus status = JobStatus.IDLE;
    private int consecutiveFailures;
    private Instant pausedUntil;
    private Instant pendingPauseUntil;
    private Instant lastFiredAt;
    private JobOutcome lastOutcome;

    JobRunState(String jobName) {
        this.jobName = jobName;
    }

    JobStatus status() {
        return status;
    }

    int consecutiveFailures() {
        return consecutiveFailures;
    }

    Instant pausedUntil() {
        return pausedUntil;
    }

    boolean isPausedAt(Instant now) {
        return status == JobStatus.PAUSED && pausedUntil != null && now.isBefore(pausedUntil);
    }

    /**
     * Moves an elapsed pause back to idle and starts the failure count over.
     * Returns whether a transition happened.
     */
    boolean expirePause(Instant now) {
        if (status == JobStatus.PAUSED && !isPausedAt(now)) {
            status = JobStatus.IDLE;
            pausedUntil = null;
            consecutiveFailures = 0;
            return true;
        }
        return false;
    }

    void markRunning(Instant now) {
        status = JobStatus.RUNNING;
        lastFiredAt = now;
    }

    void recordSuccess() {
        lastOutcome = JobOutcome.SUCCESS;
        consecutiveFailures = 0;
        status = JobStatus.IDLE;
    }

    int recordFailure() {
        lastOutcome = JobOutcome.FAILURE;
        consecutiveFailures++;
        status = JobStatus.IDLE;
        return consecutiveFailures;
    }

    void pause(Instant until) {
        status = JobStatus.PAUSED;
        pausedUntil = until;
    }

    void requestPause(Instant until) {
        pendingPauseUntil = until;
    }

    /** Applies a pause requested while a run was in flight. */
    boolean applyPendingPause() {
        if (pendingPauseUntil == null) {
            return false;
        }
        pause(pendingPauseUntil);
        pendingPauseUntil = null;
        return true;
    }

    void forceResume() {
        pendingPauseUntil = null;
        consecutiveFailures = 0;
        if (status == JobStatus.PAUSED) {
            status = JobStatus.IDLE;
            pausedUntil = null;
        }
    }

    JobStatusView snapshot() {
        return new JobStatusView(jobName, status, consecutiveFailures, pausedUntil, lastFiredAt, lastOutcome);
    }
}
