package com.wordscout.discovery.model;

import com.wordscout.discovery.client.FetchErrorKind;

import java.time.Instant;

public record TaskFailure(
    String phrase,
    int depth,
    String seed,
    FailureKind kind,
    FetchErrorKind errorKind,
    String message,
    int attempts,
    Instant failedAt
) {
    public static TaskFailure of(DiscoveryTask task, FailureKind kind, FetchErrorKind errorKind, String message, int attempts) {
        return new TaskFailure(task.phrase(), task.depth(), task.seed(), kind, errorKind, message, attempts, Instant.now());
    }
}
