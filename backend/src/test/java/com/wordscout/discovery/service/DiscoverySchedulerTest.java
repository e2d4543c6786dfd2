package com.wordscout.discovery.service;

import com.wordscout.config.InvalidConfigException;
import com.wordscout.discovery.cache.CacheMode;
import com.wordscout.discovery.cache.CacheStats;
import com.wordscout.discovery.cache.ResponseCache;
import com.wordscout.discovery.client.DeviceFilter;
import com.wordscout.discovery.client.FetchErrorKind;
import com.wordscout.discovery.client.FetchOutcome;
import com.wordscout.discovery.client.SuggestionClient;
import com.wordscout.discovery.client.SuggestionQuery;
import com.wordscout.discovery.filter.KeywordFilter;
import com.wordscout.discovery.filter.KeywordFilterSettings;
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
import com.wordscout.discovery.model.TaskKey;
import com.wordscout.discovery.model.TaskState;
import com.wordscout.discovery.nlp.GeoMode;
import com.wordscout.discovery.nlp.GeoTokenCleaner;
import com.wordscout.discovery.nlp.PhraseNormalizer;
import com.wordscout.discovery.ratelimit.RateLimiter;
import com.wordscout.discovery.ratelimit.RateLimiterSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Timeout(20)
class DiscoverySchedulerTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    private final PhraseNormalizer normalizer = new PhraseNormalizer();
    private final GeoTokenCleaner geoCleaner = new GeoTokenCleaner(normalizer, List.of());
    private final ScriptedClient client = new ScriptedClient();
    private final InMemoryCache cache = new InMemoryCache();
    private final List<Duration> sleeps = Collections.synchronizedList(new ArrayList<>());
    private RateLimiter rateLimiter = new RateLimiter(new RateLimiterSettings(100, 10_000, 100_000), CLOCK);

    private static SchedulerSettings settings(int workers, CacheMode cacheMode) {
        return new SchedulerSettings(
            workers,
            cacheMode,
            3,
            Duration.ofSeconds(60),
            Duration.ofSeconds(1),
            Duration.ofMillis(10),
            Duration.ofMillis(50),
            Duration.ofSeconds(5),
            16
        );
    }

    private static DiscoveryParameters parameters(int depth, int topN) {
        return new DiscoveryParameters(depth, topN, 100, DeviceFilter.ALL, List.of(), GeoMode.OFF, true);
    }

    private DiscoveryScheduler scheduler(KeywordFilterSettings filterSettings, SchedulerSettings settings, DiscoveryParameters parameters) {
        DiscoveryScheduler scheduler = new DiscoveryScheduler(
            client,
            cache,
            rateLimiter,
            normalizer,
            new KeywordFilter(normalizer, filterSettings),
            geoCleaner,
            settings,
            sleeps::add,
            CLOCK
        );
        scheduler.configure(parameters);
        return scheduler;
    }

    private DiscoveryScheduler scheduler(DiscoveryParameters parameters) {
        return scheduler(KeywordFilterSettings.defaults(), settings(2, CacheMode.OFF), parameters);
    }

    private static SuggestionItem item(String phrase, long count) {
        return new SuggestionItem(phrase, count);
    }

    private static SuggestionResponse response(SuggestionItem... items) {
        return new SuggestionResponse(Arrays.asList(items), List.of(), 200);
    }

    @Test
    void expandsTopRankedCandidatesAndKeepsOnlyFilteredKeywords() {
        client.respond("shoes", item("running shoes", 500), item("cheap shoes", 50), item("shoes repair", 10));
        DiscoveryScheduler scheduler = scheduler(
            KeywordFilterSettings.builder().minCount(20).build(),
            settings(2, CacheMode.OFF),
            parameters(2, 2)
        );

        assertThat(scheduler.seed("shoes")).isEqualTo(1);
        DiscoveryRunSummary summary = scheduler.run();

        assertThat(summary.status()).isEqualTo("COMPLETED");
        assertThat(summary.completedRequests()).isEqualTo(3);
        assertThat(scheduler.keywords()).extracting(KeywordRecord::phrase).containsExactly("running shoes", "cheap shoes");
        assertThat(client.queries()).containsExactlyInAnyOrder("shoes", "running shoes", "cheap shoes");
        assertThat(scheduler.session().isQueried(new TaskKey("running shoes", 2))).isTrue();
        assertThat(scheduler.session().isQueried(new TaskKey("cheap shoes", 2))).isTrue();
        assertThat(scheduler.session().isQueried(new TaskKey("shoes repair", 2))).isFalse();

        KeywordRecord running = scheduler.session().keyword("running shoes");
        assertThat(running.count()).isEqualTo(500);
        assertThat(running.depth()).isEqualTo(1);
        assertThat(running.seed()).isEqualTo("shoes");
        assertThat(running.sourcePhrase()).isEqualTo("shoes");
        assertThat(running.origin()).isEqualTo(KeywordOrigin.API);
        assertThat(scheduler.state()).isEqualTo(SchedulerState.STOPPED);
    }

    @Test
    void filteredCandidatesStillExpandUnlessDisabled() {
        client.respond("shoes", item("running shoes", 500), item("cheap shoes", 50), item("shoes repair", 10));
        KeywordFilterSettings strict = KeywordFilterSettings.builder().minCount(100).build();

        DiscoveryScheduler expanding = scheduler(strict, settings(2, CacheMode.OFF), parameters(2, 2));
        expanding.seed("shoes");
        expanding.run();
        assertThat(client.queries()).containsExactlyInAnyOrder("shoes", "running shoes", "cheap shoes");

        client.clearQueries();
        DiscoveryScheduler retainedOnly = scheduler(
            strict,
            settings(2, CacheMode.OFF),
            new DiscoveryParameters(2, 2, 100, DeviceFilter.ALL, List.of(), GeoMode.OFF, false)
        );
        retainedOnly.seed("shoes");
        retainedOnly.run();
        assertThat(client.queries()).containsExactlyInAnyOrder("shoes", "running shoes");
    }

    @Test
    void duplicateSeedsProduceOneTask() {
        DiscoveryScheduler scheduler = scheduler(parameters(1, 1));

        assertThat(scheduler.seed("обувь\nОбувь  \n\n обувь!")).isEqualTo(1);
        assertThat(scheduler.seed("обувь")).isZero();
        assertThat(scheduler.progress().queueDepth()).isEqualTo(1);
    }

    @Test
    void neverQueriesBeyondMaxDepth() {
        client.respond("a", item("b", 10));
        client.respond("b", item("c", 10));
        client.respond("c", item("d", 10));
        DiscoveryScheduler scheduler = scheduler(parameters(3, 1));
        scheduler.seed("a");

        scheduler.run();

        assertThat(client.queries()).containsExactly("a", "b", "c");
        assertThat(scheduler.session().keyword("d").depth()).isEqualTo(3);
        assertThat(scheduler.session().keyword("b").depth()).isEqualTo(1);
    }

    @Test
    void keepsHighestObservedCount() {
        client.respond("a", item("x", 100));
        client.respond("b", item("x", 300));
        DiscoveryScheduler scheduler = scheduler(parameters(1, 1));
        scheduler.seed("a\nb");

        scheduler.run();

        assertThat(scheduler.keywords()).hasSize(1);
        assertThat(scheduler.session().keyword("x").count()).isEqualTo(300);
    }

    @Test
    void dropsMalformedCandidatesWithoutExpandingThem() {
        client.respond("a", item("", 10), new SuggestionItem("broken", null), item("ok", 5));
        DiscoveryScheduler scheduler = scheduler(parameters(2, 5));
        scheduler.seed("a");

        scheduler.run();

        assertThat(scheduler.keywords()).extracting(KeywordRecord::phrase).containsExactly("ok");
        assertThat(client.queries()).containsExactlyInAnyOrder("a", "ok");
    }

    @Test
    void geoRemoveStripsPlaceNamesAndDropsGeoOnlyPhrases() {
        client.respond("кроссовки", item("кроссовки москва", 200), item("москва", 50));
        DiscoveryScheduler scheduler = scheduler(
            KeywordFilterSettings.defaults(),
            settings(1, CacheMode.OFF),
            new DiscoveryParameters(1, 1, 100, DeviceFilter.ALL, List.of(), GeoMode.REMOVE, true)
        );
        scheduler.seed("кроссовки");

        scheduler.run();

        assertThat(scheduler.keywords()).hasSize(1);
        KeywordRecord record = scheduler.keywords().get(0);
        assertThat(record.phrase()).isEqualTo("кроссовки");
        assertThat(record.geoTokens()).containsExactly("москва");
    }

    @Test
    void retriesRetryableErrorsWithExponentialBackoff() {
        client.script(
            "обувь",
            FetchOutcome.failure(FetchErrorKind.SERVER_ERROR, 503, "busy"),
            FetchOutcome.failure(FetchErrorKind.RATE_LIMITED, 429, "slow down")
        );
        client.respond("обувь", item("кроссовки", 100));
        DiscoveryScheduler scheduler = scheduler(parameters(1, 1));
        scheduler.seed("обувь");

        DiscoveryRunSummary summary = scheduler.run();

        assertThat(summary.status()).isEqualTo("COMPLETED");
        assertThat(summary.failedTasks()).isZero();
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        assertThat(client.queries()).hasSize(3);
        assertThat(scheduler.session().keyword("кроссовки")).isNotNull();
    }

    @Test
    void recordsFailureWhenRetriesAreExhausted() {
        client.script(
            "обувь",
            FetchOutcome.failure(FetchErrorKind.SERVER_ERROR, 500, "boom"),
            FetchOutcome.failure(FetchErrorKind.SERVER_ERROR, 500, "boom"),
            FetchOutcome.failure(FetchErrorKind.TIMEOUT, 0, "slow")
        );
        DiscoveryScheduler scheduler = scheduler(parameters(1, 1));
        scheduler.seed("обувь");

        DiscoveryRunSummary summary = scheduler.run();

        assertThat(summary.status()).isEqualTo("COMPLETED");
        assertThat(summary.failedTasks()).isEqualTo(1);
        assertThat(summary.completedRequests()).isZero();
        TaskFailure failure = scheduler.failures().get(0);
        assertThat(failure.kind()).isEqualTo(FailureKind.RETRIES_EXHAUSTED);
        assertThat(failure.errorKind()).isEqualTo(FetchErrorKind.TIMEOUT);
        assertThat(failure.attempts()).isEqualTo(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void clientErrorSkipsTaskAndRunContinues() {
        client.script("плохая фраза", FetchOutcome.failure(FetchErrorKind.CLIENT_ERROR, 400, "invalid phrase"));
        client.respond("обувь", item("кроссовки", 100));
        DiscoveryScheduler scheduler = scheduler(parameters(1, 1));
        scheduler.seed("плохая фраза\nобувь");

        DiscoveryRunSummary summary = scheduler.run();

        assertThat(summary.status()).isEqualTo("COMPLETED");
        assertThat(summary.failedTasks()).isEqualTo(1);
        assertThat(scheduler.failures().get(0).kind()).isEqualTo(FailureKind.CLIENT_ERROR);
        assertThat(scheduler.session().taskState(new TaskKey("плохая фраза", 1))).isEqualTo(TaskState.FAILED);
        assertThat(sleeps).isEmpty();
        assertThat(scheduler.session().keyword("кроссовки")).isNotNull();
    }

    @Test
    void failedTaskIsNotFetchedAgainWhenAnotherParentSuggestsIt() throws Exception {
        CountDownLatch bEntered = new CountDownLatch(1);
        CountDownLatch bRelease = new CountDownLatch(1);
        client.respond("a", item("x", 50));
        client.respond("b", item("x", 50));
        client.script("x", FetchOutcome.failure(FetchErrorKind.CLIENT_ERROR, 400, "invalid phrase"));
        client.blockOn("b", bEntered, bRelease);
        DiscoveryScheduler scheduler = scheduler(KeywordFilterSettings.defaults(), settings(2, CacheMode.OFF), parameters(2, 1));
        scheduler.seed("a\nb");

        CompletableFuture<DiscoveryRunSummary> run = CompletableFuture.supplyAsync(scheduler::run);
        assertThat(bEntered.await(5, TimeUnit.SECONDS)).isTrue();
        TaskKey x = new TaskKey("x", 2);
        while (scheduler.session().taskState(x) != TaskState.FAILED) {
            Thread.sleep(10);
        }
        bRelease.countDown();
        DiscoveryRunSummary summary = run.get(5, TimeUnit.SECONDS);

        assertThat(summary.status()).isEqualTo("COMPLETED");
        assertThat(summary.failedTasks()).isEqualTo(1);
        assertThat(client.queries()).containsExactlyInAnyOrder("a", "b", "x");
        assertThat(scheduler.checkpoint().queriedKeys()).contains(x);
    }

    @Test
    void authFailureAbortsTheRun() {
        client.script("a", FetchOutcome.failure(FetchErrorKind.AUTH_ERROR, 401, "bad key"));
        DiscoveryScheduler scheduler = scheduler(KeywordFilterSettings.defaults(), settings(1, CacheMode.OFF), parameters(1, 1));
        scheduler.seed("a\nb");

        assertThatThrownBy(scheduler::run)
            .isInstanceOfSatisfying(DiscoveryAbortedException.class, aborted -> {
                assertThat(aborted.getErrorKind()).isEqualTo(FetchErrorKind.AUTH_ERROR);
                assertThat(aborted.getSummary().status()).isEqualTo("ABORTED");
                assertThat(aborted.getSummary().failedTasks()).isEqualTo(1);
            });
        assertThat(client.queries()).containsExactly("a");
        assertThat(scheduler.failures().get(0).kind()).isEqualTo(FailureKind.FATAL);
        assertThat(scheduler.state()).isEqualTo(SchedulerState.STOPPED);
    }

    @Test
    void missingCredentialsAbortAsAuthError() {
        SuggestionClient unconfigured = query -> {
            throw new InvalidConfigException("discovery.api.api-key is not set");
        };
        DiscoveryScheduler scheduler = new DiscoveryScheduler(
            unconfigured,
            cache,
            rateLimiter,
            normalizer,
            new KeywordFilter(normalizer, KeywordFilterSettings.defaults()),
            geoCleaner,
            settings(1, CacheMode.OFF),
            sleeps::add,
            CLOCK
        );
        scheduler.seed("a");

        assertThatThrownBy(scheduler::run)
            .isInstanceOf(DiscoveryAbortedException.class)
            .hasMessageContaining("api-key");
    }

    @Test
    void quotaRefusalIsRecordedAsFailure() {
        rateLimiter = new RateLimiter(new RateLimiterSettings(1, 1, 1), CLOCK);
        SchedulerSettings settings = new SchedulerSettings(
            1,
            CacheMode.OFF,
            3,
            Duration.ofSeconds(60),
            Duration.ofMillis(50),
            Duration.ofMillis(10),
            Duration.ofMillis(50),
            Duration.ofSeconds(5),
            16
        );
        DiscoveryScheduler scheduler = scheduler(KeywordFilterSettings.defaults(), settings, parameters(1, 1));
        scheduler.seed("a\nb");

        DiscoveryRunSummary summary = scheduler.run();

        assertThat(summary.completedRequests()).isEqualTo(1);
        assertThat(summary.failedTasks()).isEqualTo(1);
        TaskFailure failure = scheduler.failures().get(0);
        assertThat(failure.phrase()).isEqualTo("b");
        assertThat(failure.kind()).isEqualTo(FailureKind.QUOTA_EXCEEDED);
        assertThat(failure.message()).contains("timeout");
        assertThat(client.queries()).containsExactly("a");
    }

    @Test
    void cacheOnlyModeNeverCallsTheApi() {
        cache.set("обувь", response(item("кроссовки", 100)));
        DiscoveryScheduler scheduler = scheduler(KeywordFilterSettings.defaults(), settings(2, CacheMode.ONLY), parameters(1, 1));
        scheduler.seed("обувь\nкеды");

        DiscoveryRunSummary summary = scheduler.run();

        assertThat(client.queries()).isEmpty();
        assertThat(summary.completedRequests()).isEqualTo(2);
        assertThat(summary.cacheHits()).isEqualTo(1);
        assertThat(scheduler.session().keyword("кроссовки").origin()).isEqualTo(KeywordOrigin.CACHE);
    }

    @Test
    void cacheOnlyModeDoesNotCountEmptyEntriesAsHits() {
        cache.set("кеды", SuggestionResponse.empty());
        DiscoveryScheduler scheduler = scheduler(KeywordFilterSettings.defaults(), settings(1, CacheMode.ONLY), parameters(1, 1));
        scheduler.seed("кеды");

        DiscoveryRunSummary summary = scheduler.run();

        assertThat(client.queries()).isEmpty();
        assertThat(summary.completedRequests()).isEqualTo(1);
        assertThat(summary.cacheHits()).isZero();
    }

    @Test
    void cacheOnModeFetchesOnMissAndStoresResponse() {
        cache.set("обувь", SuggestionResponse.empty());
        cache.set("кеды", response(item("кеды белые", 40)));
        client.respond("обувь", item("кроссовки", 100));
        DiscoveryScheduler scheduler = scheduler(KeywordFilterSettings.defaults(), settings(2, CacheMode.ON), parameters(1, 1));
        scheduler.seed("обувь\nкеды");

        DiscoveryRunSummary summary = scheduler.run();

        assertThat(client.queries()).containsExactly("обувь");
        assertThat(summary.cacheHits()).isEqualTo(1);
        assertThat(cache.get("обувь")).hasValueSatisfying(stored -> assertThat(stored.isEmpty()).isFalse());
        assertThat(scheduler.keywords()).extracting(KeywordRecord::phrase).containsExactly("кроссовки", "кеды белые");
    }

    @Test
    void refreshModeIgnoresCachedEntries() {
        cache.set("обувь", response(item("старое", 5)));
        client.respond("обувь", item("новое", 50));
        DiscoveryScheduler scheduler = scheduler(KeywordFilterSettings.defaults(), settings(1, CacheMode.REFRESH), parameters(1, 1));
        scheduler.seed("обувь");

        scheduler.run();

        assertThat(client.queries()).containsExactly("обувь");
        assertThat(scheduler.keywords()).extracting(KeywordRecord::phrase).containsExactly("новое");
        assertThat(cache.get("обувь").get().results().get(0).phrase()).isEqualTo("новое");
    }

    @Test
    void restoredCheckpointSkipsQueriedTasks() {
        DiscoveryCheckpoint checkpoint = new DiscoveryCheckpoint(
            List.of(new DiscoveryTask("кроссовки", 2, "обувь", "обувь")),
            List.of(new TaskKey("обувь", 1)),
            List.of(new KeywordRecord("кроссовки", 100, "обувь", 1, "обувь", List.of(), CLOCK.instant(), KeywordOrigin.API)),
            1,
            CLOCK.instant()
        );
        client.respond("кроссовки", item("кроссовки nike", 60));
        DiscoveryScheduler scheduler = scheduler(parameters(2, 2));

        scheduler.restore(checkpoint);
        assertThat(scheduler.seed("обувь")).isZero();
        DiscoveryRunSummary summary = scheduler.run();

        assertThat(client.queries()).containsExactly("кроссовки");
        assertThat(summary.completedRequests()).isEqualTo(2);
        assertThat(scheduler.keywords()).extracting(KeywordRecord::phrase).containsExactly("кроссовки", "кроссовки nike");
    }

    @Test
    void stopDrainsInFlightTasksAndKeepsTheFrontier() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        client.respond("a", item("a child", 10));
        client.blockOn("a", entered, release);
        DiscoveryScheduler scheduler = scheduler(KeywordFilterSettings.defaults(), settings(1, CacheMode.OFF), parameters(2, 1));
        scheduler.seed("a\nb");

        CompletableFuture<DiscoveryRunSummary> run = CompletableFuture.supplyAsync(scheduler::run);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        scheduler.stop();
        assertThat(scheduler.state()).isEqualTo(SchedulerState.DRAINING);
        release.countDown();
        DiscoveryRunSummary summary = run.get(5, TimeUnit.SECONDS);

        assertThat(summary.status()).isEqualTo("STOPPED");
        assertThat(client.queries()).containsExactly("a");
        assertThat(scheduler.session().keyword("a child")).isNotNull();
        assertThat(scheduler.checkpoint().pendingTasks())
            .extracting(DiscoveryTask::phrase)
            .containsExactlyInAnyOrder("b", "a child");
    }

    @Test
    void pauseHoldsDispatchUntilResumed() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        client.blockOn("a", entered, release);
        DiscoveryScheduler scheduler = scheduler(KeywordFilterSettings.defaults(), settings(1, CacheMode.OFF), parameters(1, 1));
        scheduler.seed("a\nb");

        CompletableFuture<DiscoveryRunSummary> run = CompletableFuture.supplyAsync(scheduler::run);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        scheduler.pause();
        release.countDown();
        Thread.sleep(200);

        assertThat(scheduler.state()).isEqualTo(SchedulerState.PAUSED);
        assertThat(client.queries()).containsExactly("a");
        assertThat(run).isNotDone();

        scheduler.resume();
        DiscoveryRunSummary summary = run.get(5, TimeUnit.SECONDS);
        assertThat(summary.status()).isEqualTo("COMPLETED");
        assertThat(client.queries()).containsExactly("a", "b");
    }

    @Test
    void progressNeverCountsATaskWithoutItsKeywords() throws Exception {
        StringBuilder seeds = new StringBuilder();
        for (int i = 0; i < 60; i++) {
            client.respond("seed " + i, item("found " + i, 10 + i));
            seeds.append("seed ").append(i).append('\n');
        }
        DiscoveryScheduler scheduler = scheduler(KeywordFilterSettings.defaults(), settings(4, CacheMode.OFF), parameters(1, 1));
        assertThat(scheduler.seed(seeds.toString())).isEqualTo(60);

        CompletableFuture<DiscoveryRunSummary> run = CompletableFuture.supplyAsync(scheduler::run);
        List<ProgressSnapshot> torn = new ArrayList<>();
        while (!run.isDone()) {
            ProgressSnapshot snapshot = scheduler.progress();
            boolean consistent = snapshot.foundCount() == snapshot.completedRequests()
                && snapshot.queueDepth() + snapshot.inFlight() + snapshot.completedRequests() == 60;
            if (!consistent) {
                torn.add(snapshot);
            }
        }

        assertThat(run.get(5, TimeUnit.SECONDS).keywordsFound()).isEqualTo(60);
        assertThat(torn).isEmpty();
    }

    @Test
    void finishedEventIsPublishedLast() {
        client.respond("a", item("b", 10));
        DiscoveryScheduler scheduler = scheduler(parameters(2, 1));
        scheduler.seed("a");

        scheduler.run();

        List<ProgressEvent> events = new ArrayList<>();
        scheduler.events().drainTo(events);
        assertThat(events).isNotEmpty();
        ProgressEvent last = events.get(events.size() - 1);
        assertThat(last.type()).isEqualTo(ProgressEvent.Type.FINISHED);
        assertThat(last.snapshot().state()).isEqualTo(SchedulerState.STOPPED);
        assertThat(last.snapshot().completedRequests()).isEqualTo(2);
    }

    @Test
    void lifecycleGuards() {
        DiscoveryScheduler scheduler = scheduler(parameters(1, 1));

        DiscoveryRunSummary summary = scheduler.run();

        assertThat(summary.status()).isEqualTo("COMPLETED");
        assertThat(summary.completedRequests()).isZero();
        assertThatThrownBy(() -> scheduler.configure(parameters(2, 2))).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> scheduler.seed("a")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(scheduler::run).isInstanceOf(IllegalStateException.class);

        DiscoveryScheduler idle = scheduler(parameters(1, 1));
        idle.stop();
        assertThat(idle.state()).isEqualTo(SchedulerState.STOPPED);
        assertThatThrownBy(idle::run).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void parametersAreBounded() {
        assertThatThrownBy(() -> parameters(4, 1)).isInstanceOf(InvalidConfigException.class);
        assertThatThrownBy(() -> parameters(0, 1)).isInstanceOf(InvalidConfigException.class);
        assertThatThrownBy(() -> parameters(2, 6)).isInstanceOf(InvalidConfigException.class);
        assertThatThrownBy(() -> new DiscoveryParameters(2, 2, 2001, null, null, null, true))
            .isInstanceOf(InvalidConfigException.class);
        assertThatThrownBy(() -> settings(11, CacheMode.ON)).isInstanceOf(InvalidConfigException.class);
    }

    @Test
    void backoffDoublesUpToTheCap() {
        SchedulerSettings settings = new SchedulerSettings(
            1,
            CacheMode.ON,
            5,
            Duration.ofSeconds(5),
            Duration.ofSeconds(1),
            Duration.ofMillis(10),
            Duration.ofSeconds(1),
            Duration.ofSeconds(1),
            4
        );

        assertThat(settings.backoff(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(settings.backoff(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(settings.backoff(3)).isEqualTo(Duration.ofSeconds(5));
        assertThat(settings.backoff(100)).isEqualTo(Duration.ofSeconds(5));
    }

    private static final class ScriptedClient implements SuggestionClient {
        private final Map<String, SuggestionResponse> responses = new ConcurrentHashMap<>();
        private final Map<String, Deque<FetchOutcome>> scripted = new ConcurrentHashMap<>();
        private final Map<String, CountDownLatch[]> blocking = new ConcurrentHashMap<>();
        private final List<String> queries = Collections.synchronizedList(new ArrayList<>());

        void respond(String phrase, SuggestionItem... items) {
            responses.put(phrase, response(items));
        }

        void script(String phrase, FetchOutcome... outcomes) {
            scripted.put(phrase, new ArrayDeque<>(Arrays.asList(outcomes)));
        }

        void blockOn(String phrase, CountDownLatch entered, CountDownLatch release) {
            blocking.put(phrase, new CountDownLatch[] {entered, release});
        }

        List<String> queries() {
            synchronized (queries) {
                return new ArrayList<>(queries);
            }
        }

        void clearQueries() {
            queries.clear();
        }

        @Override
        public FetchOutcome fetch(SuggestionQuery query) {
            String phrase = query.phrase();
            queries.add(phrase);
            CountDownLatch[] latches = blocking.get(phrase);
            if (latches != null) {
                latches[0].countDown();
                try {
                    latches[1].await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            Deque<FetchOutcome> pending = scripted.get(phrase);
            if (pending != null) {
                synchronized (pending) {
                    FetchOutcome next = pending.pollFirst();
                    if (next != null) {
                        return next;
                    }
                }
            }
            return FetchOutcome.success(responses.getOrDefault(phrase, SuggestionResponse.empty()));
        }
    }

    private static final class InMemoryCache implements ResponseCache {
        private final Map<String, SuggestionResponse> entries = new ConcurrentHashMap<>();

        @Override
        public Optional<SuggestionResponse> get(String key) {
            return Optional.ofNullable(entries.get(key));
        }

        @Override
        public void set(String key, SuggestionResponse response) {
            entries.put(key, response);
        }

        @Override
        public void delete(String key) {
            entries.remove(key);
        }

        @Override
        public void clear() {
            entries.clear();
        }

        @Override
        public CacheStats stats() {
            return new CacheStats(entries.size(), entries.size(), 0);
        }

        @Override
        public int sweepExpired() {
            return 0;
        }
    }
}
