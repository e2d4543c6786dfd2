package com.wordscout.discovery.cache;

import com.wordscout.discovery.model.SuggestionResponse;

import java.util.Optional;

/**
 * Durable store of suggestion API responses keyed by normalized phrase. Implementations never
 * throw on storage failures; a broken read is reported as a miss.
 */
public interface ResponseCache {
    Optional<SuggestionResponse> get(String key);

    void set(String key, SuggestionResponse response);

    void delete(String key);

    void clear();

    CacheStats stats();

    int sweepExpired();
}
