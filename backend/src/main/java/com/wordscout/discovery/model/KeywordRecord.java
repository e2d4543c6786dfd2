package com.wordscout.discovery.model;

import java.time.Instant;
import java.util.List;

public record KeywordRecord(
    String phrase,
    long count,
    String seed,
    int depth,
    String sourcePhrase,
    List<String> geoTokens,
    Instant discoveredAt,
    KeywordOrigin origin
) {
    public KeywordRecord {
        geoTokens = geoTokens == null ? List.of() : List.copyOf(geoTokens);
    }

    /**
     * Counts never regress: the merged record keeps the larger of the two observations and
     * everything else from the first discovery.
     */
    public KeywordRecord mergeCount(long observed) {
        if (observed <= count) {
            return this;
        }
        return new KeywordRecord(phrase, observed, seed, depth, sourcePhrase, geoTokens, discoveredAt, origin);
    }
}
