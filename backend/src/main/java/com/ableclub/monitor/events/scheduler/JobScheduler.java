package com.ableclub.monitor.events.scheduler;

import com.ableclub.monitor.events.model.FiringDecision;
import com.ableclub.monitor.events.model.FiringResult;
import com.ableclub.monitor.events.model.JobOutcome;
import com.ableclub.monitor.events.model.JobStatus;
import com.ableclub.monitor.events.model.JobStatusView;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Fires registered jobs on their interval and owns their pause/resume
 * lifecycle.
 *
 * <p>Every read and write of a job's {@link JobRunState} happens on the single
 * timer thread. Firing decisions, outcome handling and the administrative
 * overrides are all submitted to that thread, which is what makes the
 * single-flight guarantee hold without locks: a job is {@code RUNNING} from
 * the moment a firing is accepted until its outcome has been applied, and any
 * firing that observes {@code RUNNING} is skipped.
 */
@Service
public class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final JobManager jobManager;
    private final ScheduledExecutorService timer;
    private final ExecutorService alertExecutor;
    private final Clock clock;
    private final JobAlertListener alerts;
    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();
    private final Object lifecycleLock = new Object();

    private boolean started;

    public JobScheduler(
        JobManager jobManager,
        @Qualifier("jobTimer") ScheduledExecutorService timer,
        @Qualifier("jobWorkerExecutor") ExecutorService alertExecutor,
        Clock clock,
        JobAlertListener alerts
    ) {
        this.jobManager = jobManager;
        this.timer = timer;
        this.alertExecutor = alertExecutor;
        this.clock = clock;
        this.alerts = alerts;
    }

    public void registerJob(JobDefinition definition, JobBody body) {
        if (definition == null || body == null) {
            throw new JobConfigurationException("Job definition and body are required");
        }
        if (definition.interval().isNegative() || definition.interval().isZero()) {
            throw new JobConfigurationException("Job '" + definition.name() + "' needs a positive interval");
        }
        Registration registration = new Registration(definition, body);
        synchronized (lifecycleLock) {
            if (registrations.putIfAbsent(definition.name(), registration) != null) {
                throw new JobConfigurationException("Job '" + definition.name() + "' is already registered");
            }
            log.info(
                "Registered job {} interval={} maxRetries={} pauseThreshold={} pauseDuration={}",
                definition.name(),
                definition.interval(),
                definition.maxRetries(),
                definition.pauseThreshold(),
                definition.pauseDuration()
            );
            if (started) {
                schedule(registration);
            }
        }
    }

    /** Begins firing every registered job: once immediately, then every interval. */
    public void start() {
        synchronized (lifecycleLock) {
            if (started) {
                return;
            }
            started = true;
            for (Registration registration : registrations.values()) {
                schedule(registration);
            }
            log.info("Job scheduler started with {} job(s)", registrations.size());
        }
    }

    /** Cancels future firings. A run already in flight finishes normally. */
    @PreDestroy
    public void stop() {
        synchronized (lifecycleLock) {
            if (!started) {
                return;
            }
            started = false;
            for (Registration registration : registrations.values()) {
                if (registration.trigger != null) {
                    registration.trigger.cancel(false);
                    registration.trigger = null;
                }
            }
            log.info("Job scheduler stopped");
        }
    }

    public boolean isStarted() {
        synchronized (lifecycleLock) {
            return started;
        }
    }

    /**
     * Fires a job outside its regular schedule. The firing goes through the
     * same pause and single-flight checks as a scheduled one.
     */
    public CompletableFuture<FiringResult> triggerNow(String jobName) {
        Registration registration = require(jobName);
        CompletableFuture<FiringResult> completion = new CompletableFuture<>();
        try {
            timer.execute(() -> fireSafely(registration, completion));
        } catch (RejectedExecutionException e) {
            completion.complete(FiringResult.skipped(jobName, FiringDecision.SKIPPED_STOPPED));
        }
        return completion;
    }

    public JobStatusView getStatus(String jobName) {
        Registration registration = require(jobName);
        return onTimer(() -> {
            expirePause(registration, clock.instant());
            return registration.state.snapshot();
        });
    }

    public List<JobStatusView> listStatuses() {
        List<Registration> all = new ArrayList<>(registrations.values());
        all.sort((left, right) -> left.definition.name().compareTo(right.definition.name()));
        return onTimer(() -> {
            Instant now = clock.instant();
            List<JobStatusView> views = new ArrayList<>(all.size());
            for (Registration registration : all) {
                expirePause(registration, now);
                views.add(registration.state.snapshot());
            }
            return views;
        });
    }

    public JobStatusView forcePause(String jobName) {
        return forcePause(jobName, require(jobName).definition.pauseDuration());
    }

    /**
     * Pauses a job regardless of its failure count. If the job is running the
     * pause is applied once the run completes.
     */
    public JobStatusView forcePause(String jobName, Duration duration) {
        Registration registration = require(jobName);
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("Pause duration must be positive");
        }
        return onTimer(() -> {
            JobRunState state = registration.state;
            Instant until = clock.instant().plus(duration);
            if (state.status() == JobStatus.RUNNING) {
                state.requestPause(until);
                log.info("Job {} will pause until {} once the current run completes", jobName, until);
            } else {
                state.pause(until);
                log.info("Job {} paused by administrator until {}", jobName, until);
            }
            return state.snapshot();
        });
    }

    /** Clears a pause and the consecutive-failure counter. */
    public JobStatusView forceResume(String jobName) {
        Registration registration = require(jobName);
        return onTimer(() -> {
            registration.state.forceResume();
            log.info("Job {} resumed by administrator", jobName);
            return registration.state.snapshot();
        });
    }

    public JobDefinition getDefinition(String jobName) {
        return require(jobName).definition;
    }

    private void schedule(Registration registration) {
        long periodMs = Math.max(1L, registration.definition.interval().toMillis());
        registration.trigger = timer.scheduleAtFixedRate(
            () -> fireSafely(registration, null),
            0L,
            periodMs,
            TimeUnit.MILLISECONDS
        );
    }

    /**
     * Runs on the timer thread. Exceptions are contained here because a
     * periodic task that throws is never run again.
     */
    private void fireSafely(Registration registration, CompletableFuture<FiringResult> completion) {
        try {
            fire(registration, completion);
        } catch (RuntimeException e) {
            log.error("Unexpected error while firing job {}", registration.definition.name(), e);
            if (completion != null) {
                completion.completeExceptionally(e);
            }
        }
    }

    private void fire(Registration registration, CompletableFuture<FiringResult> completion) {
        String jobName = registration.definition.name();
        JobRunState state = registration.state;
        Instant now = clock.instant();

        if (state.isPausedAt(now)) {
            log.info("Job {} is paused until {}, skipping firing", jobName, state.pausedUntil());
            complete(completion, FiringResult.skipped(jobName, FiringDecision.SKIPPED_PAUSED));
            return;
        }
        expirePause(registration, now);
        if (state.status() == JobStatus.RUNNING) {
            log.info("Job {} is still running, skipping firing", jobName);
            complete(completion, FiringResult.skipped(jobName, FiringDecision.SKIPPED_RUNNING));
            return;
        }

        state.markRunning(now);
        CompletableFuture<JobOutcome> outcome;
        try {
            outcome = jobManager.execute(registration.definition, registration.body);
        } catch (RuntimeException e) {
            outcome = CompletableFuture.failedFuture(e);
        }
        outcome.whenComplete((result, error) -> runOnTimer(() -> applyOutcome(registration, result, error, completion)));
    }

    private void applyOutcome(
        Registration registration,
        JobOutcome result,
        Throwable error,
        CompletableFuture<FiringResult> completion
    ) {
        String jobName = registration.definition.name();
        JobRunState state = registration.state;
        JobOutcome outcome = result;
        if (error != null || result == null) {
            log.error("Job {} cycle ended without an outcome; counting it as a failure", jobName, error);
            outcome = JobOutcome.FAILURE;
        }

        if (outcome == JobOutcome.SUCCESS) {
            state.recordSuccess();
        } else {
            int failures = state.recordFailure();
            int threshold = registration.definition.pauseThreshold();
            if (failures >= threshold) {
                Instant until = clock.instant().plus(registration.definition.pauseDuration());
                state.pause(until);
                log.warn("Job {} failed {} consecutive cycles, paused until {}", jobName, failures, until);
                notifyPaused(jobName, failures, until);
            } else {
                log.warn("Job {} failed ({}/{} consecutive failures before pause)", jobName, failures, threshold);
            }
        }
        if (state.applyPendingPause()) {
            log.info("Job {} paused by administrator until {}", jobName, state.pausedUntil());
        }
        complete(completion, FiringResult.ran(jobName, outcome));
    }

    private void expirePause(Registration registration, Instant now) {
        if (registration.state.expirePause(now)) {
            String jobName = registration.definition.name();
            log.info("Job {} pause elapsed, resuming", jobName);
            sendAlert(jobName, "resume", () -> alerts.jobResumed(jobName));
        }
    }

    private void notifyPaused(String jobName, int failures, Instant until) {
        sendAlert(jobName, "pause", () -> alerts.jobPaused(jobName, failures, until));
    }

    /** Alert delivery may block on the network, so it never runs on the timer thread. */
    private void sendAlert(String jobName, String kind, Runnable alert) {
        Runnable guarded = () -> {
            try {
                alert.run();
            } catch (Exception e) {
                log.warn("Failed to send {} alert for job {}", kind, jobName, e);
            }
        };
        try {
            alertExecutor.execute(guarded);
        } catch (RejectedExecutionException e) {
            log.warn("Dropping {} alert for job {}; worker pool is shut down", kind, jobName);
        }
    }

    private void runOnTimer(Runnable task) {
        try {
            timer.execute(task);
        } catch (RejectedExecutionException e) {
            // Timer already shut down; nothing else can touch the state now.
            task.run();
        }
    }

    private <T> T onTimer(Supplier<T> supplier) {
        try {
            return CompletableFuture.supplyAsync(supplier, timer).join();
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Job scheduler timer is shut down", e);
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    private static void complete(CompletableFuture<FiringResult> completion, FiringResult result) {
        if (completion != null) {
            completion.complete(result);
        }
    }

    private Registration require(String jobName) {
        Registration registration = jobName == null ? null : registrations.get(jobName);
        if (registration == null) {
            throw new UnknownJobException(jobName);
        }
        return registration;
    }

    private static final class Registration {
        private final JobDefinition definition;
        private final JobBody body;
        private final JobRunState state;
        private ScheduledFuture<?> trigger;

        private Registration(JobDefinition definition, JobBody body) {
            this.definition = definition;
            this.body = body;
            this.state = new JobRunState(definition.name());
        }
    }
}
