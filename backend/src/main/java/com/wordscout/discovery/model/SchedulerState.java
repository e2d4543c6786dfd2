package com.wordscout.discovery.model;

public enum SchedulerState {
    IDLE,
    RUNNING,
    PAUSED,
    DRAINING,
    STOPPED
}
