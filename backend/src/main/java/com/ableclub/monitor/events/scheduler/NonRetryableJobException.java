package com.ableclub.monitor.events.scheduler;

/**
 * Ends the current cycle as a failure without spending the remaining
 * attempts.
 */
public class NonRetryableJobException extends RuntimeException {
    public NonRetryableJobException(String message) {
        super(message);
    }
}
