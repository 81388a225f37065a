package com.ableclub.monitor.events.scheduler;

public class JobConfigurationException extends RuntimeException {
    public JobConfigurationException(String message) {
        super(message);
    }
}
