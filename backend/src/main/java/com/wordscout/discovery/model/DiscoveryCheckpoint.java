package com.wordscout.discovery.model;

import java.time.Instant;
import java.util.List;

/**
 * Serializable image of a session: everything needed to rebuild the frontier and the dedup sets.
 * {@code pendingTasks} includes tasks that were in flight when the checkpoint was taken.
 */
public record DiscoveryCheckpoint(
    List<DiscoveryTask> pendingTasks,
    List<TaskKey> queriedKeys,
    List<KeywordRecord> keywords,
    long completedRequests,
    Instant savedAt
) {
    public DiscoveryCheckpoint {
        pendingTasks = pendingTasks == null ? List.of() : List.copyOf(pendingTasks);
        queriedKeys = queriedKeys == null ? List.of() : List.copyOf(queriedKeys);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}
