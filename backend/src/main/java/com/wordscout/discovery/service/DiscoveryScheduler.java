package com.wordscout.discovery.service;

import com.wordscout.config.InvalidConfigException;
import com.wordscout.discovery.cache.CacheMode;
import com.wordscout.discovery.cache.ResponseCache;
import com.wordscout.discovery.client.FetchErrorKind;
import com.wordscout.discovery.client.FetchOutcome;
import com.wordscout.discovery.client.SuggestionClient;
import com.wordscout.discovery.client.SuggestionQuery;
import com.wordscout.discovery.filter.FilterDecision;
import com.wordscout.discovery.filter.KeywordFilter;
import com.wordscout.discovery.model.DiscoveryCheckpoint;
import com.wordscout.discovery.model.DiscoveryRunSummary;
import com.wordscout.discovery.model.DiscoveryTask;
import com.wordscout.discovery.model.FailureKind;
import com.wordscout.discovery.model.KeywordOrigin;
import com.wordscout.discovery.model.KeywordRecord;
import com.wordscout.discovery.model.ProgressEvent;
import com.wordscout.discovery.model.ProgressSnapshot;
import com.wordscout.discovery.model.SchedulerState;
import com.wordscout.discovery.model.SuggestionItem;
import com.wordscout.discovery.model.SuggestionResponse;
import com.wordscout.discovery.model.TaskFailure;
import com.wordscout.discovery.nlp.GeoResult;
import com.wordscout.discovery.nlp.GeoTokenCleaner;
import com.wordscout.discovery.nlp.PhraseNormalizer;
import com.wordscout.discovery.ratelimit.AcquireResult;
import com.wordscout.discovery.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Breadth-first keyword discovery. A single driving thread owns dispatch and merging; a fixed
 * pool of workers performs cache lookups, quota acquisition and API calls.
 *
 * <p>One instance runs at most once. Build a new scheduler for every run.
 */
public class DiscoveryScheduler {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryScheduler.class);

    private final SuggestionClient client;
    private final ResponseCache cache;
    private final RateLimiter rateLimiter;
    private final PhraseNormalizer normalizer;
    private final KeywordFilter filter;
    private final GeoTokenCleaner geoCleaner;
    private final SchedulerSettings settings;
    private final Sleeper sleeper;
    private final Clock clock;

    private final DiscoverySession session = new DiscoverySession();
    private final BlockingQueue<ProgressEvent> events;
    private final Object lifecycleLock = new Object();

    private volatile SchedulerState state = SchedulerState.IDLE;
    private volatile DiscoveryParameters parameters = DiscoveryParameters.defaults();
    private volatile boolean stopRequested;
    private volatile long runStartNanos;
    private volatile long runEndNanos;

    private long nextProgressNanos;
    private long nextAutosaveNanos;

    public DiscoveryScheduler(
        SuggestionClient client,
        ResponseCache cache,
        RateLimiter rateLimiter,
        PhraseNormalizer normalizer,
        KeywordFilter filter,
        GeoTokenCleaner geoCleaner,
        SchedulerSettings settings,
        Sleeper sleeper,
        Clock clock
    ) {
        this.client = client;
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.normalizer = normalizer;
        this.filter = filter;
        this.geoCleaner = geoCleaner;
        this.settings = settings;
        this.sleeper = sleeper == null ? Sleeper.system() : sleeper;
        this.clock = clock;
        this.events = new ArrayBlockingQueue<>(settings.eventQueueCapacity());
    }

    public void configure(DiscoveryParameters parameters) {
        if (parameters == null) {
            throw new InvalidConfigException("discovery parameters are required");
        }
        synchronized (lifecycleLock) {
            requireIdle("configure");
            this.parameters = parameters;
        }
        log.info(
            "Discovery configured: depth={} topN={} phrasesPerCall={} device={} regions={} geo={} expandFiltered={}",
            parameters.maxDepth(),
            parameters.topN(),
            parameters.phrasesPerCall(),
            parameters.device(),
            parameters.regions(),
            parameters.geoMode(),
            parameters.expandFilteredPhrases()
        );
    }

    public DiscoveryParameters parameters() {
        return parameters;
    }

    /**
     * Enqueues every distinct non-empty line of {@code rawSeedText} as a depth-1 task.
     *
     * @return number of tasks actually added
     */
    public int seed(String rawSeedText) {
        synchronized (lifecycleLock) {
            if (state == SchedulerState.DRAINING || state == SchedulerState.STOPPED) {
                throw new IllegalStateException("cannot seed a scheduler in state " + state);
            }
        }
        if (rawSeedText == null || rawSeedText.isBlank()) {
            return 0;
        }
        Set<String> phrases = new LinkedHashSet<>();
        for (String line : rawSeedText.split("\\R")) {
            String normalized = normalizer.normalize(line);
            if (!normalized.isEmpty()) {
                phrases.add(normalized);
            }
        }
        int added = 0;
        for (String phrase : phrases) {
            if (session.enqueue(DiscoveryTask.seed(phrase))) {
                added++;
            }
        }
        log.info("Seeded {} task(s) from {} distinct phrase(s)", added, phrases.size());
        return added;
    }

    public void restore(DiscoveryCheckpoint checkpoint) {
        synchronized (lifecycleLock) {
            requireIdle("restore");
            session.restore(checkpoint);
        }
        log.info(
            "Restored checkpoint from {}: pending={} queried={} keywords={}",
            checkpoint.savedAt(),
            checkpoint.pendingTasks().size(),
            checkpoint.queriedKeys().size(),
            checkpoint.keywords().size()
        );
    }

    public DiscoveryCheckpoint checkpoint() {
        return session.checkpoint(clock.instant());
    }

    public SchedulerState state() {
        return state;
    }

    public void pause() {
        synchronized (lifecycleLock) {
            if (state == SchedulerState.RUNNING) {
                state = SchedulerState.PAUSED;
                log.info("Discovery paused ({} in flight)", session.inFlightCount());
            }
        }
    }

    public void resume() {
        synchronized (lifecycleLock) {
            if (state == SchedulerState.PAUSED) {
                state = SchedulerState.RUNNING;
                log.info("Discovery resumed");
            }
        }
    }

    /**
     * Stops dispatching. Tasks already in flight still complete and are merged before
     * {@link #run()} returns.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (state == SchedulerState.IDLE) {
                state = SchedulerState.STOPPED;
                stopRequested = true;
            } else if (state == SchedulerState.RUNNING || state == SchedulerState.PAUSED) {
                state = SchedulerState.DRAINING;
                stopRequested = true;
                log.info("Discovery stop requested, draining {} in-flight task(s)", session.inFlightCount());
            }
        }
    }

    public ProgressSnapshot progress() {
        DiscoverySession.Counts counts = session.counts();
        return new ProgressSnapshot(
            state,
            counts.keywords(),
            counts.frontier(),
            counts.inFlight(),
            counts.completedRequests(),
            counts.failed(),
            elapsedSeconds(),
            counts.cacheHits()
        );
    }

    public List<KeywordRecord> keywords() {
        return session.keywordsByCount();
    }

    public List<TaskFailure> failures() {
        return session.failures();
    }

    /**
     * Progress events for a single consumer. When the consumer falls behind, the oldest events
     * are dropped.
     */
    public BlockingQueue<ProgressEvent> events() {
        return events;
    }

    DiscoverySession session() {
        return session;
    }

    /**
     * Drives the run until the frontier and the in-flight set are both empty, or until
     * {@link #stop()} has drained the in-flight set.
     *
     * @throws DiscoveryAbortedException after draining, when a fetch failed fatally
     */
    public DiscoveryRunSummary run() {
        synchronized (lifecycleLock) {
            requireIdle("run");
            state = SchedulerState.RUNNING;
        }
        Instant startedAt = clock.instant();
        session.markStarted(startedAt);
        runStartNanos = System.nanoTime();
        nextProgressNanos = runStartNanos + settings.progressInterval().toNanos();
        nextAutosaveNanos = runStartNanos + settings.autosaveInterval().toNanos();
        log.info(
            "Discovery started: {} queued, {} workers, cache={}",
            session.frontierSize(),
            settings.workerCount(),
            settings.cacheMode()
        );

        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(settings.workerCount(), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("discovery-worker-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        CompletionService<TaskResult> completion = new ExecutorCompletionService<>(pool);
        TaskResult fatal = null;
        String notes = null;

        try {
            while (true) {
                SchedulerState current = state;
                if (current == SchedulerState.RUNNING) {
                    dispatch(completion);
                }
                if (session.inFlightCount() == 0
                    && (current == SchedulerState.DRAINING || session.frontierSize() == 0)) {
                    break;
                }
                Future<TaskResult> done = completion.poll(settings.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
                while (done != null) {
                    TaskResult result = await(done);
                    if (handle(result) && fatal == null) {
                        fatal = result;
                        enterDraining();
                    }
                    done = completion.poll();
                }
                publishOnSchedule();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            notes = "interrupted";
            log.warn("Discovery driving loop interrupted with {} task(s) in flight", session.inFlightCount());
        } finally {
            shutdownPool(pool, notes != null);
            runEndNanos = System.nanoTime();
            synchronized (lifecycleLock) {
                state = SchedulerState.STOPPED;
            }
        }

        String status;
        if (fatal != null) {
            status = "ABORTED";
            notes = fatal.message();
        } else if (stopRequested || notes != null) {
            status = "STOPPED";
        } else {
            status = "COMPLETED";
        }
        DiscoveryRunSummary summary = new DiscoveryRunSummary(
            status,
            session.keywordCount(),
            session.completedRequests(),
            session.failedCount(),
            session.cacheHits(),
            startedAt,
            clock.instant(),
            notes
        );
        publish(ProgressEvent.Type.FINISHED);
        log.info(
            "Discovery {}: keywords={} requests={} failed={} cacheHits={} elapsed={}s",
            status.toLowerCase(Locale.ROOT),
            summary.keywordsFound(),
            summary.completedRequests(),
            summary.failedTasks(),
            summary.cacheHits(),
            String.format("%.1f", elapsedSeconds())
        );
        if (fatal != null) {
            throw new DiscoveryAbortedException(
                "discovery aborted on '" + fatal.task().phrase() + "': " + notes,
                fatal.errorKind(),
                summary
            );
        }
        return summary;
    }

    private void dispatch(CompletionService<TaskResult> completion) {
        while (session.inFlightCount() < settings.workerCount()) {
            DiscoveryTask task = session.dispatchNext();
            if (task == null) {
                return;
            }
            completion.submit(() -> executeSafely(task));
        }
    }

    private TaskResult await(Future<TaskResult> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // executeSafely converts exceptions into results; only Errors get here
            throw new IllegalStateException("discovery worker crashed", e.getCause());
        }
    }

    /**
     * Applies a finished task to the session on the driving thread.
     *
     * @return {@code true} if the failure requires the run to abort
     */
    private boolean handle(TaskResult result) {
        DiscoveryTask task = result.task();
        if (result.isSuccess()) {
            merge(task, result.response(), result.fromCache());
            return false;
        }
        TaskFailure failure = TaskFailure.of(
            task,
            result.failureKind(),
            result.errorKind(),
            result.message(),
            result.attempts()
        );
        session.markFailed(task, failure);
        if (result.failureKind() == FailureKind.FATAL) {
            log.error("Fatal fetch error for '{}' (depth {}): {}", task.phrase(), task.depth(), result.message());
            return true;
        }
        log.warn(
            "Task '{}' (depth {}) failed: {} after {} attempt(s): {}",
            task.phrase(),
            task.depth(),
            result.failureKind(),
            result.attempts(),
            result.message()
        );
        return false;
    }

    private void merge(DiscoveryTask task, SuggestionResponse response, boolean fromCache) {
        DiscoveryParameters current = parameters;
        Instant now = clock.instant();
        KeywordOrigin origin = fromCache ? KeywordOrigin.CACHE : KeywordOrigin.API;

        List<Candidate> candidates = new ArrayList<>();
        List<KeywordRecord> records = new ArrayList<>();
        for (SuggestionItem item : response.candidates()) {
            if (!item.isWellFormed()) {
                log.debug("Dropping malformed candidate {} from '{}'", item, task.phrase());
                continue;
            }
            String phrase = normalizer.normalize(item.phrase());
            if (phrase.isEmpty()) {
                log.debug("Dropping candidate '{}' from '{}': empty after normalization", item.phrase(), task.phrase());
                continue;
            }
            long count = item.count();
            boolean retained = false;
            FilterDecision decision = filter.apply(phrase, count);
            if (decision.accepted()) {
                GeoResult geo = geoCleaner.apply(phrase, current.geoMode());
                if (geo.isDropped()) {
                    log.debug("Candidate '{}' dropped by geo mode {}", phrase, current.geoMode());
                } else {
                    KeywordRecord record = new KeywordRecord(
                        normalizer.normalize(geo.phrase()),
                        count,
                        task.seed(),
                        task.depth(),
                        task.phrase(),
                        geo.geoTokens(),
                        now,
                        origin
                    );
                    records.add(record);
                    retained = true;
                }
            } else {
                log.debug("Candidate '{}' rejected: {}", phrase, decision.describe());
            }
            candidates.add(new Candidate(phrase, count, retained));
        }

        List<DiscoveryTask> children = new ArrayList<>();
        if (task.depth() < current.maxDepth()) {
            List<Candidate> ranked = new ArrayList<>();
            for (Candidate candidate : candidates) {
                if (current.expandFilteredPhrases() || candidate.retained()) {
                    ranked.add(candidate);
                }
            }
            // List.sort is stable, so equal counts keep API order
            ranked.sort(Comparator.comparingLong(Candidate::count).reversed());
            for (Candidate candidate : ranked.subList(0, Math.min(current.topN(), ranked.size()))) {
                children.add(task.child(candidate.phrase()));
            }
        }

        // Single monitor entry: status readers never see the task counted without its keywords
        int added = 0;
        int expanded = 0;
        synchronized (session) {
            session.markCompleted(task, fromCache);
            for (KeywordRecord record : records) {
                if (session.mergeKeyword(record)) {
                    added++;
                }
            }
            for (DiscoveryTask child : children) {
                if (session.enqueue(child)) {
                    expanded++;
                }
            }
        }
        log.debug(
            "Merged '{}' (depth {}, {}): candidates={} new={} expanded={}",
            task.phrase(),
            task.depth(),
            origin,
            candidates.size(),
            added,
            expanded
        );
    }

    private TaskResult executeSafely(DiscoveryTask task) {
        try {
            return execute(task);
        } catch (InvalidConfigException e) {
            return TaskResult.failure(task, FailureKind.FATAL, FetchErrorKind.AUTH_ERROR, e.getMessage(), 0);
        } catch (RuntimeException e) {
            log.warn("Unexpected error while fetching '{}'", task.phrase(), e);
            return TaskResult.failure(task, FailureKind.UNEXPECTED, null, e.toString(), 0);
        }
    }

    TaskResult execute(DiscoveryTask task) {
        CacheMode mode = settings.cacheMode();
        if (mode.reads()) {
            Optional<SuggestionResponse> cached = cache.get(task.phrase());
            if (cached.isPresent() && !cached.get().isEmpty()) {
                return TaskResult.success(task, cached.get(), true);
            }
            if (mode == CacheMode.ONLY) {
                log.debug("Cache-only miss for '{}'", task.phrase());
                return TaskResult.success(task, SuggestionResponse.empty(), false);
            }
        }

        DiscoveryParameters current = parameters;
        SuggestionQuery query = new SuggestionQuery(
            task.phrase(),
            current.phrasesPerCall(),
            current.regions(),
            current.device()
        );
        int maxAttempts = settings.maxFetchAttempts();
        FetchOutcome last = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            AcquireResult permit;
            try {
                permit = rateLimiter.acquire(1, settings.acquireTimeout());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return TaskResult.failure(task, FailureKind.UNEXPECTED, null, "interrupted while waiting for quota", attempt);
            }
            if (!permit.granted()) {
                return TaskResult.failure(task, FailureKind.QUOTA_EXCEEDED, null, permit.reason(), attempt);
            }

            FetchOutcome outcome = client.fetch(query);
            if (outcome.isSuccess()) {
                if (mode.writes()) {
                    cache.set(task.phrase(), outcome.response());
                }
                return TaskResult.success(task, outcome.response(), false);
            }
            last = outcome;
            FetchErrorKind kind = outcome.errorKind();
            if (kind.disposition() == FetchErrorKind.Disposition.FATAL) {
                return TaskResult.failure(task, FailureKind.FATAL, kind, outcome.describe(), attempt + 1);
            }
            if (kind.disposition() == FetchErrorKind.Disposition.SKIP) {
                return TaskResult.failure(task, FailureKind.CLIENT_ERROR, kind, outcome.describe(), attempt + 1);
            }
            if (attempt + 1 < maxAttempts) {
                Duration delay = settings.backoff(attempt);
                log.warn(
                    "Fetch '{}' failed ({}), retry {}/{} in {} ms",
                    task.phrase(),
                    outcome.describe(),
                    attempt + 1,
                    maxAttempts - 1,
                    delay.toMillis()
                );
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return TaskResult.failure(task, FailureKind.UNEXPECTED, kind, "interrupted during backoff", attempt + 1);
                }
            }
        }
        return TaskResult.failure(
            task,
            FailureKind.RETRIES_EXHAUSTED,
            last.errorKind(),
            last.describe(),
            maxAttempts
        );
    }

    private void enterDraining() {
        synchronized (lifecycleLock) {
            if (state == SchedulerState.RUNNING || state == SchedulerState.PAUSED) {
                state = SchedulerState.DRAINING;
            }
        }
    }

    private void publishOnSchedule() {
        long now = System.nanoTime();
        if (now - nextProgressNanos >= 0) {
            publish(ProgressEvent.Type.SNAPSHOT);
            nextProgressNanos = now + settings.progressInterval().toNanos();
        }
        if (now - nextAutosaveNanos >= 0) {
            publish(ProgressEvent.Type.AUTOSAVE);
            nextAutosaveNanos = now + settings.autosaveInterval().toNanos();
        }
    }

    private void publish(ProgressEvent.Type type) {
        ProgressEvent event = new ProgressEvent(type, progress(), clock.instant());
        while (!events.offer(event)) {
            ProgressEvent dropped = events.poll();
            if (dropped != null) {
                log.debug("Progress queue full, dropped {} event", dropped.type());
            }
        }
    }

    private void shutdownPool(ExecutorService pool, boolean abrupt) {
        if (abrupt) {
            pool.shutdownNow();
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(settings.acquireTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Discovery workers did not finish in time, forcing shutdown");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private double elapsedSeconds() {
        long start = runStartNanos;
        if (start == 0) {
            return 0.0;
        }
        long end = runEndNanos == 0 ? System.nanoTime() : runEndNanos;
        return (end - start) / 1_000_000_000.0;
    }

    private void requireIdle(String operation) {
        if (state != SchedulerState.IDLE) {
            throw new IllegalStateException(operation + " is only allowed while idle, state is " + state);
        }
    }

    private record Candidate(String phrase, long count, boolean retained) {
    }

    record TaskResult(
        DiscoveryTask task,
        SuggestionResponse response,
        boolean fromCache,
        FailureKind failureKind,
        FetchErrorKind errorKind,
        String message,
        int attempts
    ) {
        static TaskResult success(DiscoveryTask task, SuggestionResponse response, boolean fromCache) {
            return new TaskResult(task, response, fromCache, null, null, null, 0);
        }

        static TaskResult failure(
            DiscoveryTask task,
            FailureKind kind,
            FetchErrorKind errorKind,
            String message,
            int attempts
        ) {
            return new TaskResult(task, null, false, kind, errorKind, message, attempts);
        }

        boolean isSuccess() {
            return failureKind == null;
        }
    }
}
