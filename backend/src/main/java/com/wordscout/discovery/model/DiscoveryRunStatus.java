package com.wordscout.discovery.model;

import java.time.Instant;

public record DiscoveryRunStatus(
    boolean active,
    ProgressSnapshot progress,
    DiscoveryRunSummary lastSummary,
    String lastError,
    Instant startedAt
) {
}
