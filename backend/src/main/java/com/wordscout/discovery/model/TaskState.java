package com.wordscout.discovery.model;

public enum TaskState {
    ENQUEUED,
    IN_FLIGHT,
    COMPLETED,
    FAILED
}
