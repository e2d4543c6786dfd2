package com.wordscout.discovery.service;

import com.wordscout.discovery.model.DiscoveryCheckpoint;
import com.wordscout.discovery.model.DiscoveryTask;
import com.wordscout.discovery.model.KeywordRecord;
import com.wordscout.discovery.model.TaskFailure;
import com.wordscout.discovery.model.TaskKey;
import com.wordscout.discovery.model.TaskState;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one discovery run. Every method holds the instance monitor, so readers on
 * other threads (status endpoints, autosave) always see a consistent image.
 *
 * <p>Invariants: {@code pendingKeys} is exactly the keys of the frontier plus the in-flight
 * tasks; a key is never both pending and queried; keyword counts never decrease.
 */
public class DiscoverySession {
    private final Map<String, KeywordRecord> keywords = new HashMap<>();
    private final Set<TaskKey> queriedKeys = new LinkedHashSet<>();
    private final Set<TaskKey> pendingKeys = new HashSet<>();
    private final Deque<DiscoveryTask> frontier = new ArrayDeque<>();
    private final Map<TaskKey, DiscoveryTask> inFlight = new LinkedHashMap<>();
    private final List<TaskFailure> failures = new ArrayList<>();
    private final Set<TaskKey> failedKeys = new HashSet<>();
    private long completedRequests;
    private long cacheHits;
    private Instant startedAt;

    /**
     * Adds the task to the back of the frontier unless its key is already pending or queried.
     */
    public synchronized boolean enqueue(DiscoveryTask task) {
        TaskKey key = task.key();
        if (pendingKeys.contains(key) || queriedKeys.contains(key)) {
            return false;
        }
        pendingKeys.add(key);
        frontier.addLast(task);
        return true;
    }

    /**
     * Moves the next frontier task to in-flight, or returns {@code null} if the frontier is empty.
     */
    public synchronized DiscoveryTask dispatchNext() {
        DiscoveryTask task = frontier.pollFirst();
        if (task != null) {
            inFlight.put(task.key(), task);
        }
        return task;
    }

    public synchronized void markCompleted(DiscoveryTask task, boolean fromCache) {
        TaskKey key = task.key();
        inFlight.remove(key);
        pendingKeys.remove(key);
        queriedKeys.add(key);
        completedRequests++;
        if (fromCache) {
            cacheHits++;
        }
    }

    /**
     * Completes the task with a failure. The key counts as queried, so no later parent can
     * enqueue it again in this run.
     */
    public synchronized void markFailed(DiscoveryTask task, TaskFailure failure) {
        TaskKey key = task.key();
        inFlight.remove(key);
        pendingKeys.remove(key);
        queriedKeys.add(key);
        failedKeys.add(key);
        failures.add(failure);
    }

    /**
     * Inserts the record or raises the stored count to the observed one.
     *
     * @return {@code true} if the phrase was new
     */
    public synchronized boolean mergeKeyword(KeywordRecord record) {
        KeywordRecord existing = keywords.get(record.phrase());
        if (existing == null) {
            keywords.put(record.phrase(), record);
            return true;
        }
        keywords.put(record.phrase(), existing.mergeCount(record.count()));
        return false;
    }

    public synchronized void markStarted(Instant now) {
        if (startedAt == null) {
            startedAt = now;
        }
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized boolean isDrained() {
        return frontier.isEmpty() && inFlight.isEmpty();
    }

    public synchronized int frontierSize() {
        return frontier.size();
    }

    public synchronized int inFlightCount() {
        return inFlight.size();
    }

    public synchronized int keywordCount() {
        return keywords.size();
    }

    public synchronized long completedRequests() {
        return completedRequests;
    }

    public synchronized long cacheHits() {
        return cacheHits;
    }

    public synchronized int failedCount() {
        return failures.size();
    }

    public synchronized Counts counts() {
        return new Counts(frontier.size(), inFlight.size(), keywords.size(), completedRequests, failures.size(), cacheHits);
    }

    public synchronized boolean isPending(TaskKey key) {
        return pendingKeys.contains(key);
    }

    public synchronized boolean isQueried(TaskKey key) {
        return queriedKeys.contains(key);
    }

    /**
     * Lifecycle position of a task, or {@code null} if the key was never enqueued in this session.
     */
    public synchronized TaskState taskState(TaskKey key) {
        if (inFlight.containsKey(key)) {
            return TaskState.IN_FLIGHT;
        }
        if (pendingKeys.contains(key)) {
            return TaskState.ENQUEUED;
        }
        if (failedKeys.contains(key)) {
            return TaskState.FAILED;
        }
        return queriedKeys.contains(key) ? TaskState.COMPLETED : null;
    }

    public synchronized KeywordRecord keyword(String phrase) {
        return keywords.get(phrase);
    }

    /**
     * Keywords ordered by count descending, then phrase.
     */
    public synchronized List<KeywordRecord> keywordsByCount() {
        List<KeywordRecord> sorted = new ArrayList<>(keywords.values());
        sorted.sort(Comparator.comparingLong(KeywordRecord::count).reversed().thenComparing(KeywordRecord::phrase));
        return sorted;
    }

    public synchronized List<TaskFailure> failures() {
        return List.copyOf(failures);
    }

    public synchronized List<DiscoveryTask> frontierSnapshot() {
        return List.copyOf(frontier);
    }

    public synchronized DiscoveryCheckpoint checkpoint(Instant now) {
        List<DiscoveryTask> pending = new ArrayList<>(inFlight.values());
        pending.addAll(frontier);
        return new DiscoveryCheckpoint(
            pending,
            new ArrayList<>(queriedKeys),
            keywordsByCount(),
            completedRequests,
            now
        );
    }

    /**
     * Replaces all state with the checkpoint's. In-flight tasks of the saved run come back as
     * frontier tasks.
     */
    public synchronized void restore(DiscoveryCheckpoint checkpoint) {
        keywords.clear();
        queriedKeys.clear();
        pendingKeys.clear();
        frontier.clear();
        inFlight.clear();
        failures.clear();
        failedKeys.clear();
        cacheHits = 0;
        completedRequests = checkpoint.completedRequests();
        queriedKeys.addAll(checkpoint.queriedKeys());
        for (KeywordRecord record : checkpoint.keywords()) {
            mergeKeyword(record);
        }
        for (DiscoveryTask task : checkpoint.pendingTasks()) {
            enqueue(task);
        }
    }

    /**
     * Counters read under a single monitor entry.
     */
    public record Counts(int frontier, int inFlight, int keywords, long completedRequests, int failed, long cacheHits) {
    }
}
