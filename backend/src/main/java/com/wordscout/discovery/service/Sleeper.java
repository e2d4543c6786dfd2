package com.wordscout.discovery.service;

import java.time.Duration;

/**
 * Blocking pause used between fetch retries. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(Math.max(0, duration.toMillis()));
    }
}
