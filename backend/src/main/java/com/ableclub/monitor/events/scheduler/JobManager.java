package com.ableclub.monitor.events.scheduler;

import com.ableclub.monitor.config.MonitorProperties;
import com.ableclub.monitor.events.model.JobExecutionRecord;
import com.ableclub.monitor.events.model.JobOutcome;
import com.ableclub.monitor.events.persistence.JobHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs one cycle of a job: bounded attempts with escalating backoff, then
 * exactly one history record.
 *
 * <p>Attempts run on the worker pool. The wait between attempts is a delayed
 * task on the timer rather than a sleeping thread, so a job in backoff holds
 * no thread and never delays other jobs' firings.
 */
@Service
public class JobManager {
    private static final Logger log = LoggerFactory.getLogger(JobManager.class);
    private static final int MAX_ERROR_LENGTH = 1000;

    private final JobHistoryStore historyStore;
    private final ScheduledExecutorService timer;
    private final ExecutorService workers;
    private final Clock clock;
    private final Duration historyRetention;
    private final JobAlertListener alerts;

    public JobManager(
        JobHistoryStore historyStore,
        @Qualifier("jobTimer") ScheduledExecutorService timer,
        @Qualifier("jobWorkerExecutor") ExecutorService workers,
        Clock clock,
        MonitorProperties properties,
        JobAlertListener alerts
    ) {
        this.historyStore = historyStore;
        this.timer = timer;
        this.workers = workers;
        this.clock = clock;
        this.historyRetention = properties.getScheduler().getHistoryRetention();
        this.alerts = alerts;
    }

    /**
     * Starts a cycle and returns its outcome once the history record has been
     * written. The returned future never completes exceptionally for a
     * failing job body; failures are reported as {@link JobOutcome#FAILURE}.
     */
    public CompletableFuture<JobOutcome> execute(JobDefinition definition, JobBody body) {
        Cycle cycle = new Cycle(definition, body, clock.instant());
        cycle.submitAttempt(1);
        return cycle.result;
    }

    static String summarize(Throwable error) {
        if (error == null) {
            return null;
        }
        String message = error.getMessage();
        String summary = error.getClass().getSimpleName()
            + (message == null || message.isBlank() ? "" : ": " + message.trim());
        if (summary.length() > MAX_ERROR_LENGTH) {
            return summary.substring(0, MAX_ERROR_LENGTH);
        }
        return summary;
    }

    private final class Cycle {
        private final JobDefinition definition;
        private final JobBody body;
        private final Instant startedAt;
        private final CompletableFuture<JobOutcome> result = new CompletableFuture<>();

        private Cycle(JobDefinition definition, JobBody body, Instant startedAt) {
            this.definition = definition;
            this.body = body;
            this.startedAt = startedAt;
        }

        private void submitAttempt(int attempt) {
            try {
                workers.execute(() -> runAttempt(attempt));
            } catch (RejectedExecutionException e) {
                log.warn("Job {} attempt {} rejected; worker pool is shut down", definition.name(), attempt);
                finish(JobOutcome.FAILURE, attempt, e, Map.of());
            }
        }

        private void runAttempt(int attempt) {
            Map<String, Integer> counters;
            try {
                counters = body.run();
            } catch (Exception e) {
                onAttemptFailed(attempt, e);
                return;
            } catch (Throwable t) {
                log.error("Job {} attempt {} failed with an unrecoverable error", definition.name(), attempt, t);
                finish(JobOutcome.FAILURE, attempt, t, Map.of());
                return;
            }
            if (attempt > 1) {
                log.info("Job {} succeeded on attempt {}/{}", definition.name(), attempt, definition.maxRetries());
            }
            finish(JobOutcome.SUCCESS, attempt, null, counters);
        }

        private void onAttemptFailed(int attempt, Exception error) {
            boolean retryable = !(error instanceof NonRetryableJobException);
            if (!retryable || attempt >= definition.maxRetries()) {
                log.error(
                    "Job {} failed after {} attempt(s): {}",
                    definition.name(),
                    attempt,
                    summarize(error),
                    error
                );
                finish(JobOutcome.FAILURE, attempt, error, Map.of());
                return;
            }
            Duration backoff = definition.backoffAfter(attempt);
            log.warn(
                "Job {} failed (attempt {}/{}), retrying in {}: {}",
                definition.name(),
                attempt,
                definition.maxRetries(),
                backoff,
                summarize(error)
            );
            try {
                timer.schedule(() -> submitAttempt(attempt + 1), backoff.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.warn("Job {} retry could not be scheduled; timer is shut down", definition.name());
                finish(JobOutcome.FAILURE, attempt, error, Map.of());
            }
        }

        private void finish(JobOutcome outcome, int attempts, Throwable error, Map<String, Integer> counters) {
            Instant finishedAt = clock.instant();
            String errorSummary = outcome == JobOutcome.FAILURE ? summarize(error) : null;
            JobExecutionRecord record = new JobExecutionRecord(
                null,
                definition.name(),
                startedAt,
                finishedAt,
                Math.max(0L, Duration.between(startedAt, finishedAt).toMillis()),
                outcome,
                attempts,
                errorSummary,
                counters
            );
            try {
                historyStore.append(record);
            } catch (Exception e) {
                log.warn("Failed to record {} cycle of job {}", outcome, definition.name(), e);
            }
            sweepHistory(finishedAt);
            if (outcome == JobOutcome.FAILURE) {
                notifyFailure(attempts, errorSummary);
            } else {
                log.info("Job {} cycle succeeded in {} ms, counters={}", definition.name(), record.durationMs(), counters);
            }
            result.complete(outcome);
        }

        private void sweepHistory(Instant now) {
            try {
                int deleted = historyStore.deleteOlderThan(now.minus(historyRetention));
                if (deleted > 0) {
                    log.info("Removed {} job history records older than {}", deleted, historyRetention);
                }
            } catch (Exception e) {
                log.warn("Job history retention sweep failed", e);
            }
        }

        private void notifyFailure(int attempts, String errorSummary) {
            try {
                alerts.cycleFailed(definition.name(), attempts, errorSummary);
            } catch (Exception e) {
                log.warn("Failed to send failure alert for job {}", definition.name(), e);
            }
        }
    }
}
