package com.ableclub.monitor.events.model;

public enum JobStatus {
    IDLE,
    RUNNING,
    PAUSED
}
