package com.wordscout.discovery.client;

/**
 * The external keyword-suggestion service. Implementations make a single attempt per call and
 * report failures through {@link FetchOutcome} instead of throwing; retries belong to the caller.
 */
public interface SuggestionClient {
    FetchOutcome fetch(SuggestionQuery query);
}
