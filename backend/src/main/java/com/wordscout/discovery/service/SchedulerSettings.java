package com.wordscout.discovery.service;

import com.wordscout.config.DiscoveryProperties;
import com.wordscout.config.InvalidConfigException;
import com.wordscout.discovery.cache.CacheMode;

import java.time.Duration;

/**
 * Execution settings of the driving loop and its worker pool.
 */
public record SchedulerSettings(
    int workerCount,
    CacheMode cacheMode,
    int maxFetchAttempts,
    Duration maxBackoff,
    Duration acquireTimeout,
    Duration pollInterval,
    Duration progressInterval,
    Duration autosaveInterval,
    int eventQueueCapacity
) {
    public static final int MIN_WORKERS = 1;
    public static final int MAX_WORKERS = 10;

    public SchedulerSettings {
        if (workerCount < MIN_WORKERS || workerCount > MAX_WORKERS) {
            throw new InvalidConfigException(
                "workerCount must be between " + MIN_WORKERS + " and " + MAX_WORKERS + ": " + workerCount
            );
        }
        if (maxFetchAttempts < 1) {
            throw new InvalidConfigException("maxFetchAttempts must be >= 1: " + maxFetchAttempts);
        }
        if (eventQueueCapacity < 1) {
            throw new InvalidConfigException("eventQueueCapacity must be >= 1: " + eventQueueCapacity);
        }
        cacheMode = cacheMode == null ? CacheMode.ON : cacheMode;
        maxBackoff = positive("maxBackoff", maxBackoff);
        acquireTimeout = positive("acquireTimeout", acquireTimeout);
        pollInterval = positive("pollInterval", pollInterval);
        progressInterval = positive("progressInterval", progressInterval);
        autosaveInterval = positive("autosaveInterval", autosaveInterval);
    }

    public static SchedulerSettings from(DiscoveryProperties properties) {
        DiscoveryProperties.Scheduler scheduler = properties.getScheduler();
        return new SchedulerSettings(
            scheduler.getWorkerCount(),
            properties.getCache().getMode(),
            scheduler.getMaxFetchAttempts(),
            Duration.ofSeconds(scheduler.getMaxBackoffSeconds()),
            Duration.ofSeconds(scheduler.getAcquireTimeoutSeconds()),
            Duration.ofMillis(scheduler.getPollIntervalMs()),
            Duration.ofMillis(scheduler.getProgressIntervalMs()),
            Duration.ofSeconds(scheduler.getAutosaveIntervalSeconds()),
            scheduler.getEventQueueCapacity()
        );
    }

    public SchedulerSettings withCacheMode(CacheMode mode) {
        return new SchedulerSettings(
            workerCount,
            mode,
            maxFetchAttempts,
            maxBackoff,
            acquireTimeout,
            pollInterval,
            progressInterval,
            autosaveInterval,
            eventQueueCapacity
        );
    }

    public SchedulerSettings withWorkerCount(int count) {
        return new SchedulerSettings(
            count,
            cacheMode,
            maxFetchAttempts,
            maxBackoff,
            acquireTimeout,
            pollInterval,
            progressInterval,
            autosaveInterval,
            eventQueueCapacity
        );
    }

    /**
     * Delay before retry number {@code attempt + 1}: {@code min(2^attempt, maxBackoff)} seconds.
     */
    public Duration backoff(int attempt) {
        if (attempt >= 62) {
            return maxBackoff;
        }
        Duration delay = Duration.ofSeconds(1L << Math.max(0, attempt));
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    private static Duration positive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new InvalidConfigException(name + " must be positive: " + value);
        }
        return value;
    }
}
