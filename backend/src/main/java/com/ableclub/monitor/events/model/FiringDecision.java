package com.ableclub.monitor.events.model;

public enum FiringDecision {
    RAN,
    SKIPPED_PAUSED,
    SKIPPED_RUNNING,
    SKIPPED_STOPPED
}
