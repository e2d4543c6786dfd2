package com.wordscout.discovery.ratelimit;

public record RateLimiterStats(
    int currentSecond,
    int maxPerSecond,
    long currentHour,
    long maxPerHour,
    long currentDay,
    long maxPerDay
) {
    public long remainingHour() {
        return Math.max(0, maxPerHour - currentHour);
    }

    public long remainingDay() {
        return Math.max(0, maxPerDay - currentDay);
    }
}
