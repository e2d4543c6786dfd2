package com.wordscout.discovery.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Admission control for the suggestion API: a sliding one-second window plus fixed hourly and
 * daily counters. Every attempt is evaluated atomically under the instance monitor.
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);
    private static final long RETRY_SLEEP_MS = 10;

    private final RateLimiterSettings settings;
    private final Clock clock;

    private final Deque<Instant> secondWindow = new ArrayDeque<>();
    private Instant hourStart;
    private long hourCount;
    private Instant dayStart;
    private long dayCount;

    public RateLimiter(RateLimiterSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        Instant now = clock.instant();
        this.hourStart = now;
        this.dayStart = now;
    }

    public RateLimiterSettings settings() {
        return settings;
    }

    /**
     * Single attempt. Checks the day budget, then the hour, then the second; a request that
     * would land exactly on a limit plus one is refused.
     */
    public synchronized AcquireResult tryAcquire(int cost) {
        requirePositiveCost(cost);
        Instant now = clock.instant();
        roll(now);

        if (dayCount + cost > settings.maxPerDay()) {
            return AcquireResult.rejected(
                QuotaWindow.DAY,
                "daily quota exhausted (" + dayCount + "/" + settings.maxPerDay() + ")"
            );
        }
        if (hourCount + cost > settings.maxPerHour()) {
            return AcquireResult.rejected(
                QuotaWindow.HOUR,
                "hourly quota exhausted (" + hourCount + "/" + settings.maxPerHour() + ")"
            );
        }
        if (secondWindow.size() + cost > settings.maxPerSecond()) {
            return AcquireResult.rejected(
                QuotaWindow.SECOND,
                "per-second limit reached (" + secondWindow.size() + "/" + settings.maxPerSecond() + ")"
            );
        }

        for (int i = 0; i < cost; i++) {
            secondWindow.addLast(now);
        }
        hourCount += cost;
        dayCount += cost;
        return AcquireResult.grant();
    }

    /**
     * Retries {@link #tryAcquire(int)} with a short sleep until granted or {@code timeout}
     * elapses. Hour and day exhaustion go through the same loop; the caller decides what a
     * timed-out result means.
     */
    public AcquireResult acquire(int cost, Duration timeout) throws InterruptedException {
        requirePositiveCost(cost);
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        AcquireResult last = null;
        while (true) {
            AcquireResult attempt = tryAcquire(cost);
            if (attempt.granted()) {
                return attempt;
            }
            if (last == null || last.rejectedBy() != attempt.rejectedBy()) {
                log.debug("Rate limiter refused: {}", attempt.reason());
            }
            last = attempt;
            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0) {
                log.warn("Rate limiter acquire timed out after {} ms: {}", timeout.toMillis(), attempt.reason());
                return AcquireResult.timedOut(last);
            }
            long sleepMs = Math.min(RETRY_SLEEP_MS, Math.max(1, remainingNanos / 1_000_000));
            Thread.sleep(sleepMs);
        }
    }

    public synchronized RateLimiterStats stats() {
        roll(clock.instant());
        return new RateLimiterStats(
            secondWindow.size(),
            settings.maxPerSecond(),
            hourCount,
            settings.maxPerHour(),
            dayCount,
            settings.maxPerDay()
        );
    }

    private void roll(Instant now) {
        Instant secondCutoff = now.minus(QuotaWindow.SECOND.length());
        while (!secondWindow.isEmpty() && !secondWindow.peekFirst().isAfter(secondCutoff)) {
            secondWindow.pollFirst();
        }
        if (Duration.between(hourStart, now).compareTo(QuotaWindow.HOUR.length()) > 0) {
            hourStart = now;
            hourCount = 0;
        }
        if (Duration.between(dayStart, now).compareTo(QuotaWindow.DAY.length()) > 0) {
            log.info("Daily quota window reset ({} calls in previous window)", dayCount);
            dayStart = now;
            dayCount = 0;
        }
    }

    private static void requirePositiveCost(int cost) {
        if (cost < 1) {
            throw new IllegalArgumentException("cost must be >= 1: " + cost);
        }
    }
}
