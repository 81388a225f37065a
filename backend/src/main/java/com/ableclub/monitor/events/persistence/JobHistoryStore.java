package com.ableclub.monitor.events.persistence;

import com.ableclub.monitor.events.model.JobExecutionRecord;

import java.time.Instant;

public interface JobHistoryStore {
    long append(JobExecutionRecord record);

    int deleteOlderThan(Instant cutoff);
}
