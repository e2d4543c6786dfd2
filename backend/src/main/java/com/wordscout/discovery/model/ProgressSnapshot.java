package com.wordscout.discovery.model;

public record ProgressSnapshot(
    SchedulerState state,
    int foundCount,
    int queueDepth,
    int inFlight,
    long completedRequests,
    int failedTasks,
    double elapsedSeconds,
    long cacheHitCount
) {
}
