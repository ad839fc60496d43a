package com.servicetracker.subscription;

public enum WorkerState {
    INITIALIZING,
    RUNNING,
    DRAINING,
    STOPPED
}
