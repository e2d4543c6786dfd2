package com.wordscout.discovery.service;

import com.wordscout.config.DiscoveryProperties;
import com.wordscout.discovery.model.DiscoveryCheckpoint;
import com.wordscout.discovery.model.DiscoveryRunRequest;
import com.wordscout.discovery.model.DiscoveryRunResponse;
import com.wordscout.discovery.model.DiscoveryRunStatus;
import com.wordscout.discovery.model.DiscoveryRunSummary;
import com.wordscout.discovery.model.KeywordRecord;
import com.wordscout.discovery.model.ProgressEvent;
import com.wordscout.discovery.model.ProgressSnapshot;
import com.wordscout.discovery.model.SchedulerState;
import com.wordscout.discovery.model.TaskFailure;
import com.wordscout.discovery.persistence.CheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Owns the single active discovery run: starts it on the run executor, pumps its progress events
 * into the log and the checkpoint file, and answers status queries.
 */
@Service
public class DiscoveryRunService {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryRunService.class);
    private static final long EVENT_POLL_MS = 200;

    private final DiscoverySchedulerFactory schedulerFactory;
    private final CheckpointStore checkpointStore;
    private final DiscoveryProperties properties;
    private final ExecutorService runExecutor;
    private final Object lifecycleLock = new Object();

    private volatile DiscoveryScheduler current;
    private volatile Future<DiscoveryRunSummary> currentRun;
    private volatile DiscoveryRunSummary lastSummary;
    private volatile String lastError;
    private volatile Instant startedAt;

    public DiscoveryRunService(
        DiscoverySchedulerFactory schedulerFactory,
        CheckpointStore checkpointStore,
        DiscoveryProperties properties,
        @Qualifier("discoveryRunExecutor") ExecutorService runExecutor
    ) {
        this.schedulerFactory = schedulerFactory;
        this.checkpointStore = checkpointStore;
        this.properties = properties;
        this.runExecutor = runExecutor;
    }

    public DiscoveryRunResponse start(DiscoveryRunRequest request) {
        synchronized (lifecycleLock) {
            ensureNoActiveRun();
            DiscoveryScheduler scheduler = schedulerFactory.create(request);
            int queued = scheduler.seed(request == null ? "" : request.seedText());
            if (queued == 0) {
                throw new IllegalArgumentException("no usable seed phrases");
            }
            launch(scheduler);
            return new DiscoveryRunResponse("RUNNING", queued, "/api/discovery/status");
        }
    }

    public DiscoveryRunResponse resumeFromCheckpoint(DiscoveryRunRequest overrides) {
        synchronized (lifecycleLock) {
            ensureNoActiveRun();
            DiscoveryCheckpoint checkpoint = checkpointStore.load()
                .orElseThrow(() -> new IllegalStateException("no checkpoint at " + checkpointStore.path()));
            DiscoveryScheduler scheduler = schedulerFactory.create(overrides);
            scheduler.restore(checkpoint);
            int queued = checkpoint.pendingTasks().size();
            if (overrides != null) {
                queued += scheduler.seed(overrides.seedText());
            }
            launch(scheduler);
            return new DiscoveryRunResponse("RUNNING", queued, "/api/discovery/status");
        }
    }

    /**
     * Runs on the run executor and blocks the caller until the run finishes. Used by the CLI.
     */
    public DiscoveryRunSummary runAndWait(DiscoveryRunRequest request, boolean resume) throws InterruptedException {
        if (resume) {
            resumeFromCheckpoint(request);
        } else {
            start(request);
        }
        Future<DiscoveryRunSummary> run = currentRun;
        try {
            return run.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("discovery run failed", e.getCause());
        }
    }

    public boolean isActive() {
        Future<DiscoveryRunSummary> run = currentRun;
        return run != null && !run.isDone();
    }

    public DiscoveryRunStatus pause() {
        DiscoveryScheduler scheduler = current;
        if (scheduler != null) {
            scheduler.pause();
        }
        return status();
    }

    public DiscoveryRunStatus resume() {
        DiscoveryScheduler scheduler = current;
        if (scheduler != null) {
            scheduler.resume();
        }
        return status();
    }

    public DiscoveryRunStatus stop() {
        DiscoveryScheduler scheduler = current;
        if (scheduler != null) {
            scheduler.stop();
        }
        return status();
    }

    public DiscoveryRunStatus status() {
        DiscoveryScheduler scheduler = current;
        ProgressSnapshot progress = scheduler == null
            ? new ProgressSnapshot(SchedulerState.IDLE, 0, 0, 0, 0, 0, 0.0, 0)
            : scheduler.progress();
        return new DiscoveryRunStatus(isActive(), progress, lastSummary, lastError, startedAt);
    }

    public List<KeywordRecord> keywords(Integer limit) {
        DiscoveryScheduler scheduler = current;
        if (scheduler == null) {
            return List.of();
        }
        List<KeywordRecord> keywords = scheduler.keywords();
        if (limit == null || limit <= 0 || limit >= keywords.size()) {
            return keywords;
        }
        return keywords.subList(0, limit);
    }

    public List<TaskFailure> failures() {
        DiscoveryScheduler scheduler = current;
        return scheduler == null ? List.of() : scheduler.failures();
    }

    private void ensureNoActiveRun() {
        if (isActive()) {
            throw new ActiveDiscoveryRunException("A discovery run is already in progress");
        }
    }

    private void launch(DiscoveryScheduler scheduler) {
        current = scheduler;
        lastSummary = null;
        lastError = null;
        startedAt = Instant.now();
        currentRun = runExecutor.submit(() -> execute(scheduler));
    }

    private DiscoveryRunSummary execute(DiscoveryScheduler scheduler) {
        Future<?> pump = runExecutor.submit(() -> pumpEvents(scheduler));
        DiscoveryRunSummary summary = null;
        try {
            summary = scheduler.run();
        } catch (DiscoveryAbortedException e) {
            summary = e.getSummary();
            lastError = e.getMessage();
            log.error("Discovery run aborted ({}): {}", e.getErrorKind(), e.getMessage());
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            log.error("Discovery run failed", e);
        } finally {
            lastSummary = summary;
            awaitPump(pump);
            saveCheckpoint(scheduler);
        }
        return summary;
    }

    private void pumpEvents(DiscoveryScheduler scheduler) {
        try {
            while (true) {
                ProgressEvent event = scheduler.events().poll(EVENT_POLL_MS, TimeUnit.MILLISECONDS);
                if (event == null) {
                    if (scheduler.state() == SchedulerState.STOPPED && scheduler.events().isEmpty()) {
                        return;
                    }
                    continue;
                }
                ProgressSnapshot snapshot = event.snapshot();
                switch (event.type()) {
                    case SNAPSHOT -> log.info(
                        "Discovery progress: state={} found={} queued={} inFlight={} done={} failed={} cacheHits={} elapsed={}s",
                        snapshot.state(),
                        snapshot.foundCount(),
                        snapshot.queueDepth(),
                        snapshot.inFlight(),
                        snapshot.completedRequests(),
                        snapshot.failedTasks(),
                        snapshot.cacheHitCount(),
                        Math.round(snapshot.elapsedSeconds())
                    );
                    case AUTOSAVE -> saveCheckpoint(scheduler);
                    case FINISHED -> {
                        return;
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void awaitPump(Future<?> pump) {
        try {
            pump.get(EVENT_POLL_MS * 10, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("Progress pump did not finish cleanly: {}", e.toString());
            pump.cancel(true);
        }
    }

    private void saveCheckpoint(DiscoveryScheduler scheduler) {
        if (!properties.getCheckpoint().isEnabled()) {
            return;
        }
        try {
            checkpointStore.save(scheduler.checkpoint());
        } catch (UncheckedIOException e) {
            log.warn("Checkpoint save failed: {}", e.getMessage());
        }
    }
}
