package com.wordscout.discovery.ratelimit;

import java.time.Duration;

public enum QuotaWindow {
    SECOND(Duration.ofSeconds(1)),
    HOUR(Duration.ofHours(1)),
    DAY(Duration.ofDays(1));

    private final Duration length;

    QuotaWindow(Duration length) {
        this.length = length;
    }

    public Duration length() {
        return length;
    }
}
