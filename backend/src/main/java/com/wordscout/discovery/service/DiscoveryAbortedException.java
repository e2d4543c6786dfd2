package com.wordscout.discovery.service;

import com.wordscout.discovery.client.FetchErrorKind;
import com.wordscout.discovery.model.DiscoveryRunSummary;

/**
 * Thrown by {@link DiscoveryScheduler#run()} after in-flight work has drained when a fetch failed
 * in a way that makes further requests pointless.
 */
public class DiscoveryAbortedException extends RuntimeException {
    private final FetchErrorKind errorKind;
    private final transient DiscoveryRunSummary summary;

    public DiscoveryAbortedException(String message, FetchErrorKind errorKind, DiscoveryRunSummary summary) {
        super(message);
        this.errorKind = errorKind;
        this.summary = summary;
    }

    public FetchErrorKind getErrorKind() {
        return errorKind;
    }

    public DiscoveryRunSummary getSummary() {
        return summary;
    }
}
