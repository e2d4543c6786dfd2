package com.wordscout.discovery.nlp;

import java.util.List;

/**
 * Outcome of applying a {@link GeoMode} to one phrase. A {@code null} phrase means the phrase
 * should be dropped.
 */
public record GeoResult(String phrase, List<String> geoTokens) {
    public GeoResult {
        geoTokens = geoTokens == null ? List.of() : List.copyOf(geoTokens);
    }

    public boolean isDropped() {
        return phrase == null;
    }
}
