package com.ableclub.monitor.events.api;

import com.ableclub.monitor.events.model.JobExecutionRecord;
import com.ableclub.monitor.events.model.JobExecutionStats;
import com.ableclub.monitor.events.model.JobStatusResponse;
import com.ableclub.monitor.events.model.JobStatusView;
import com.ableclub.monitor.events.persistence.JdbcJobHistoryRepository;
import com.ableclub.monitor.events.scheduler.JobScheduler;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/api/jobs")
public class JobController {
    private static final int MAX_HISTORY_LIMIT = 100;
    private static final int MAX_STATS_DAYS = 365;

    private final JobScheduler scheduler;
    private final JdbcJobHistoryRepository historyRepository;
    private final Clock clock;

    public JobController(JobScheduler scheduler, JdbcJobHistoryRepository historyRepository, Clock clock) {
        this.scheduler = scheduler;
        this.historyRepository = historyRepository;
        this.clock = clock;
    }

    @GetMapping
    public List<JobStatusView> list() {
        return scheduler.listStatuses();
    }

    @GetMapping("/{name}/status")
    public JobStatusResponse status(@PathVariable("name") String name) {
        JobStatusView state = scheduler.getStatus(name);
        return new JobStatusResponse(state, historyRepository.findLatest(name));
    }

    @PostMapping("/{name}/pause")
    public JobStatusView pause(
        @PathVariable("name") String name,
        @RequestParam(name = "hours", required = false) Integer hours
    ) {
        if (hours == null) {
            return scheduler.forcePause(name);
        }
        return scheduler.forcePause(name, Duration.ofHours(hours));
    }

    @PostMapping("/{name}/resume")
    public JobStatusView resume(@PathVariable("name") String name) {
        return scheduler.forceResume(name);
    }

    /** Returns immediately; the firing's result is visible through status and history. */
    @PostMapping("/{name}/trigger")
    public JobStatusView trigger(@PathVariable("name") String name) {
        scheduler.triggerNow(name);
        return scheduler.getStatus(name);
    }

    @GetMapping("/{name}/history")
    public List<JobExecutionRecord> history(
        @PathVariable("name") String name,
        @RequestParam(name = "limit", required = false, defaultValue = "10") int limit
    ) {
        scheduler.getDefinition(name);
        int safeLimit = Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT));
        return historyRepository.findRecent(name, safeLimit);
    }

    @GetMapping("/{name}/history/{id}")
    public JobExecutionRecord execution(@PathVariable("name") String name, @PathVariable("id") long id) {
        scheduler.getDefinition(name);
        JobExecutionRecord record = historyRepository.findById(name, id);
        if (record == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No execution " + id + " for job " + name);
        }
        return record;
    }

    @GetMapping("/{name}/stats")
    public JobExecutionStats stats(
        @PathVariable("name") String name,
        @RequestParam(name = "days", required = false, defaultValue = "7") int days
    ) {
        scheduler.getDefinition(name);
        int safeDays = Math.max(1, Math.min(days, MAX_STATS_DAYS));
        return historyRepository.computeStats(name, clock.instant().minus(Duration.ofDays(safeDays)), safeDays);
    }
}
