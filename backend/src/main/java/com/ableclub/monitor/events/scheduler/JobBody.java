package com.ableclub.monitor.events.scheduler;

import java.util.Map;

@FunctionalInterface
public interface JobBody {
    /**
     * Runs one attempt of the job.
     *
     * @return counters describing what the attempt did, stored with the
     *     history record of the cycle
     */
    Map<String, Integer> run() throws Exception;
}
