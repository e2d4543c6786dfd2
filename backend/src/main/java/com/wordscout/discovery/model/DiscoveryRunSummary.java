package com.wordscout.discovery.model;

import java.time.Instant;

public record DiscoveryRunSummary(
    String status,
    int keywordsFound,
    long completedRequests,
    int failedTasks,
    long cacheHits,
    Instant startedAt,
    Instant finishedAt,
    String notes
) {
}
