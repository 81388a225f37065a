package com.ableclub.monitor.events.scheduler;

import com.ableclub.monitor.events.model.FiringDecision;
import com.ableclub.monitor.events.model.FiringResult;
import com.ableclub.monitor.events.model.JobOutcome;
import com.ableclub.monitor.events.model.JobStatus;
import com.ableclub.monitor.events.model.JobStatusView;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobSchedulerTest {
    private static final Instant START = Instant.parse("2026-03-01T08:00:00Z");
    private static final JobDefinition DEFINITION = new JobDefinition(
        "pipeline",
        Duration.ofHours(1),
        1,
        List.of(),
        3,
        Duration.ofHours(6)
    );
    private static final JobBody BODY = Map::of;

    @Mock
    private JobManager jobManager;

    @Mock
    private JobAlertListener alerts;

    private ScheduledExecutorService timer;
    private ExecutorService workers;
    private MutableClock clock;
    private JobScheduler scheduler;

    @BeforeEach
    void setUp() {
        timer = Executors.newSingleThreadScheduledExecutor();
        workers = Executors.newFixedThreadPool(2);
        clock = new MutableClock(START);
        scheduler = new JobScheduler(jobManager, timer, workers, clock, alerts);
        scheduler.registerJob(DEFINITION, BODY);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        timer.shutdownNow();
        workers.shutdownNow();
    }

    @Test
    void secondFiringIsSkippedWhileFirstIsRunning() throws Exception {
        CompletableFuture<JobOutcome> inFlight = new CompletableFuture<>();
        when(jobManager.execute(DEFINITION, BODY)).thenReturn(inFlight);

        CompletableFuture<FiringResult> first = scheduler.triggerNow("pipeline");
        FiringResult second = scheduler.triggerNow("pipeline").get(5, TimeUnit.SECONDS);

        assertEquals(FiringDecision.SKIPPED_RUNNING, second.decision());
        assertEquals(JobStatus.RUNNING, scheduler.getStatus("pipeline").status());
        assertThat(first).isNotDone();

        inFlight.complete(JobOutcome.SUCCESS);
        FiringResult firstResult = first.get(5, TimeUnit.SECONDS);

        assertEquals(FiringDecision.RAN, firstResult.decision());
        assertEquals(JobOutcome.SUCCESS, firstResult.outcome());
        verify(jobManager, times(1)).execute(DEFINITION, BODY);
        assertEquals(JobStatus.IDLE, scheduler.getStatus("pipeline").status());
    }

    @Test
    void pausesAfterThresholdAndSkipsWithoutRunning() throws Exception {
        when(jobManager.execute(DEFINITION, BODY)).thenReturn(CompletableFuture.completedFuture(JobOutcome.FAILURE));

        for (int i = 0; i < 3; i++) {
            FiringResult result = scheduler.triggerNow("pipeline").get(5, TimeUnit.SECONDS);
            assertEquals(JobOutcome.FAILURE, result.outcome());
        }

        JobStatusView status = scheduler.getStatus("pipeline");
        assertEquals(JobStatus.PAUSED, status.status());
        assertEquals(3, status.consecutiveFailures());
        assertEquals(START.plus(Duration.ofHours(6)), status.pausedUntil());
        verify(alerts, timeout(5000)).jobPaused("pipeline", 3, START.plus(Duration.ofHours(6)));

        FiringResult skipped = scheduler.triggerNow("pipeline").get(5, TimeUnit.SECONDS);
        assertEquals(FiringDecision.SKIPPED_PAUSED, skipped.decision());
        assertNull(skipped.outcome());
        verify(jobManager, times(3)).execute(DEFINITION, BODY);
    }

    @Test
    void resumesOncePauseElapsesAndSuccessResetsCounter() throws Exception {
        when(jobManager.execute(DEFINITION, BODY))
            .thenReturn(CompletableFuture.completedFuture(JobOutcome.FAILURE))
            .thenReturn(CompletableFuture.completedFuture(JobOutcome.FAILURE))
            .thenReturn(CompletableFuture.completedFuture(JobOutcome.FAILURE))
            .thenReturn(CompletableFuture.completedFuture(JobOutcome.SUCCESS));
        for (int i = 0; i < 3; i++) {
            scheduler.triggerNow("pipeline").get(5, TimeUnit.SECONDS);
        }

        clock.advance(Duration.ofHours(6));
        FiringResult result = scheduler.triggerNow("pipeline").get(5, TimeUnit.SECONDS);

        assertEquals(FiringDecision.RAN, result.decision());
        assertEquals(JobOutcome.SUCCESS, result.outcome());
        verify(alerts, timeout(5000)).jobResumed("pipeline");
        JobStatusView status = scheduler.getStatus("pipeline");
        assertEquals(JobStatus.IDLE, status.status());
        assertEquals(0, status.consecutiveFailures());
        assertNull(status.pausedUntil());
    }

    @Test
    void failureAfterAutomaticResumeStartsCountOver() throws Exception {
        when(jobManager.execute(DEFINITION, BODY)).thenReturn(CompletableFuture.completedFuture(JobOutcome.FAILURE));
        for (int i = 0; i < 3; i++) {
            scheduler.triggerNow("pipeline").get(5, TimeUnit.SECONDS);
        }

        clock.advance(Duration.ofHours(7));
        FiringResult result = scheduler.triggerNow("pipeline").get(5, TimeUnit.SECONDS);

        assertEquals(FiringDecision.RAN, result.decision());
        JobStatusView status = scheduler.getStatus("pipeline");
        assertEquals(JobStatus.IDLE, status.status());
        assertEquals(1, status.consecutiveFailures());
        assertNull(status.pausedUntil());

        scheduler.triggerNow("pipeline").get(5, TimeUnit.SECONDS);
        scheduler.triggerNow("pipeline").get(5, TimeUnit.SECONDS);

        JobStatusView pausedAgain = scheduler.getStatus("pipeline");
        assertEquals(JobStatus.PAUSED, pausedAgain.status());
        assertEquals(3, pausedAgain.consecutiveFailures());
        assertEquals(START.plus(Duration.ofHours(13)), pausedAgain.pausedUntil());
    }

    @Test
    void slowAlertDoesNotHoldUpTheScheduler() throws Exception {
        CountDownLatch alertStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            alertStarted.countDown();
            release.await(10, TimeUnit.SECONDS);
            return null;
        }).when(alerts).jobPaused(any(), anyInt(), any());
        when(jobManager.execute(DEFINITION, BODY)).thenReturn(CompletableFuture.completedFuture(JobOutcome.FAILURE));

        try {
            assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
                for (int i = 0; i < 3; i++) {
                    scheduler.triggerNow("pipeline").get(5, TimeUnit.SECONDS);
                }
                assertTrue(alertStarted.await(1, TimeUnit.SECONDS));
                assertEquals(JobStatus.PAUSED, scheduler.getStatus("pipeline").status());
                FiringResult skipped = scheduler.triggerNow("pipeline").get(5, TimeUnit.SECONDS);
                assertEquals(FiringDecision.SKIPPED_PAUSED, skipped.decision());
            });
        } finally {
            release.countDown();
        }
    }

    @Test
    void successBelowThresholdResetsCounter() throws Exception {
        when(jobManager.execute(DEFINITION, BODY))
            .thenReturn(CompletableFuture.completedFuture(JobOutcome.FAILURE))
            .thenReturn(CompletableFuture.completedFuture(JobOutcome.FAILURE))
            .thenReturn(CompletableFuture.completedFuture(JobOutcome.SUCCESS));

        scheduler.triggerNow("pipeline").get(5, TimeUnit.SECONDS);
        scheduler.triggerNow("pipeline").get(5, TimeUnit.SECONDS);
        assertEquals(2, scheduler.getStatus("pipeline").consecutiveFailures());

        scheduler.triggerNow("pipeline").get(5, TimeUnit.SECONDS);

        JobStatusView status = scheduler.getStatus("pipeline");
        assertEquals(0, status.consecutiveFailures());
        assertEquals(JobOutcome.SUCCESS, status.lastOutcome());
        assertEquals(START, status.lastFiredAt());
    }

    @Test
    void exceptionalOutcomeCountsAsFailure() throws Exception {
        when(jobManager.execute(DEFINITION, BODY))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));

        FiringResult result = scheduler.triggerNow("pipeline").get(5, TimeUnit.SECONDS);

        assertEquals(JobOutcome.FAILURE, result.outcome());
        assertEquals(1, scheduler.getStatus("pipeline").consecutiveFailures());
    }

    @Test
    void forcePauseAndForceResume() throws Exception {
        JobStatusView paused = scheduler.forcePause("pipeline", Duration.ofHours(2));
        assertEquals(JobStatus.PAUSED, paused.status());
        assertEquals(START.plus(Duration.ofHours(2)), paused.pausedUntil());

        FiringResult skipped = scheduler.triggerNow("pipeline").get(5, TimeUnit.SECONDS);
        assertEquals(FiringDecision.SKIPPED_PAUSED, skipped.decision());

        JobStatusView resumed = scheduler.forceResume("pipeline");
        assertEquals(JobStatus.IDLE, resumed.status());
        assertNull(resumed.pausedUntil());
        assertEquals(0, resumed.consecutiveFailures());
    }

    @Test
    void forcePauseDefaultsToConfiguredDuration() {
        JobStatusView paused = scheduler.forcePause("pipeline");

        assertEquals(START.plus(Duration.ofHours(6)), paused.pausedUntil());
    }

    @Test
    void forcePauseWhileRunningAppliesAfterRunCompletes() throws Exception {
        CompletableFuture<JobOutcome> inFlight = new CompletableFuture<>();
        when(jobManager.execute(DEFINITION, BODY)).thenReturn(inFlight);
        CompletableFuture<FiringResult> firing = scheduler.triggerNow("pipeline");
        assertEquals(JobStatus.RUNNING, scheduler.getStatus("pipeline").status());

        JobStatusView during = scheduler.forcePause("pipeline", Duration.ofHours(1));
        assertEquals(JobStatus.RUNNING, during.status());

        inFlight.complete(JobOutcome.SUCCESS);
        firing.get(5, TimeUnit.SECONDS);

        JobStatusView after = scheduler.getStatus("pipeline");
        assertEquals(JobStatus.PAUSED, after.status());
        assertEquals(START.plus(Duration.ofHours(1)), after.pausedUntil());
    }

    @Test
    void forceResumeClearsFailureCounter() throws Exception {
        when(jobManager.execute(DEFINITION, BODY)).thenReturn(CompletableFuture.completedFuture(JobOutcome.FAILURE));
        scheduler.triggerNow("pipeline").get(5, TimeUnit.SECONDS);
        scheduler.triggerNow("pipeline").get(5, TimeUnit.SECONDS);

        JobStatusView resumed = scheduler.forceResume("pipeline");

        assertEquals(0, resumed.consecutiveFailures());
    }

    @Test
    void rejectsDuplicateRegistration() {
        assertThatThrownBy(() -> scheduler.registerJob(DEFINITION, BODY))
            .isInstanceOf(JobConfigurationException.class)
            .hasMessageContaining("already registered");
    }

    @Test
    void unknownJobIsReported() {
        assertThatThrownBy(() -> scheduler.getStatus("missing")).isInstanceOf(UnknownJobException.class);
        assertThatThrownBy(() -> scheduler.triggerNow("missing")).isInstanceOf(UnknownJobException.class);
    }

    @Test
    void startFiresImmediately() throws Exception {
        CompletableFuture<JobOutcome> inFlight = new CompletableFuture<>();
        when(jobManager.execute(eq(DEFINITION), any())).thenReturn(inFlight);

        scheduler.start();

        verify(jobManager, timeout(5000)).execute(DEFINITION, BODY);
        assertThat(scheduler.isStarted()).isTrue();
        inFlight.complete(JobOutcome.SUCCESS);
    }

    @Test
    void scheduledFiringsNeverOverlapAndStopLetsRunFinish() throws Exception {
        JobDefinition fast = new JobDefinition("fast", Duration.ofMillis(50), 1, List.of(), 3, Duration.ofHours(1));
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        AtomicInteger calls = new AtomicInteger();
        AtomicReference<CompletableFuture<JobOutcome>> lastRun = new AtomicReference<>();
        when(jobManager.execute(eq(fast), any())).thenAnswer(invocation -> {
            calls.incrementAndGet();
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            CompletableFuture<JobOutcome> run = CompletableFuture.supplyAsync(() -> {
                try {
                    Thread.sleep(200);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                inFlight.decrementAndGet();
                return JobOutcome.SUCCESS;
            }, workers);
            lastRun.set(run);
            return run;
        });
        JobScheduler fastScheduler = new JobScheduler(jobManager, timer, workers, clock, alerts);
        fastScheduler.registerJob(fast, BODY);

        fastScheduler.start();
        verify(jobManager, timeout(1000).atLeastOnce()).execute(eq(fast), any());
        Thread.sleep(700);
        fastScheduler.stop();

        assertEquals(JobOutcome.SUCCESS, lastRun.get().get(5, TimeUnit.SECONDS));
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (fastScheduler.getStatus("fast").status() != JobStatus.IDLE && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(JobStatus.IDLE, fastScheduler.getStatus("fast").status());
        assertEquals(JobOutcome.SUCCESS, fastScheduler.getStatus("fast").lastOutcome());
        assertEquals(1, maxInFlight.get());
        assertThat(calls.get()).isGreaterThanOrEqualTo(2);

        int callsAfterStop = calls.get();
        Thread.sleep(200);
        assertEquals(callsAfterStop, calls.get());
    }

    @Test
    void listStatusesReturnsEveryJobByName() {
        scheduler.registerJob(
            new JobDefinition("another", Duration.ofMinutes(10), 1, List.of(), 1, Duration.ofMinutes(5)),
            BODY
        );

        List<JobStatusView> statuses = scheduler.listStatuses();

        assertThat(statuses).extracting(JobStatusView::jobName).containsExactly("another", "pipeline");
        assertThat(statuses).extracting(JobStatusView::status).containsOnly(JobStatus.IDLE);
    }
}
