package com.ableclub.monitor.events.notify;

import com.ableclub.monitor.events.scheduler.NonRetryableJobException;

/**
 * Raised at the end of a notification pass in which at least one delivery
 * failed. Every obligation has already been attempted by then, so repeating
 * the cycle would not redeliver anything.
 */
public class DispatchFailureException extends NonRetryableJobException {
    private final int failedDeliveries;
    private final int attemptedDeliveries;

    public DispatchFailureException(int failedDeliveries, int attemptedDeliveries, String firstError) {
        super(failedDeliveries + " of " + attemptedDeliveries + " notification deliveries failed"
            + (firstError == null ? "" : " (first: " + firstError + ")"));
        this.failedDeliveries = failedDeliveries;
        this.attemptedDeliveries = attemptedDeliveries;
    }

    public int getFailedDeliveries() {
        return failedDeliveries;
    }

    public int getAttemptedDeliveries() {
        return attemptedDeliveries;
    }
}
