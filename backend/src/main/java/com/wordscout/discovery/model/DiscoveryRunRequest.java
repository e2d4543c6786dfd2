package com.wordscout.discovery.model;

import com.wordscout.discovery.cache.CacheMode;
import com.wordscout.discovery.client.DeviceFilter;
import com.wordscout.discovery.filter.MinusWordMode;
import com.wordscout.discovery.nlp.GeoMode;

import java.util.List;

/**
 * Start request for a discovery run. Every field except {@code seeds} is optional and falls back
 * to the configured default.
 */
public record DiscoveryRunRequest(
    List<String> seeds,
    Integer maxDepth,
    Integer topN,
    Integer phrasesPerCall,
    DeviceFilter device,
    List<Integer> regions,
    GeoMode geoMode,
    Boolean expandFilteredPhrases,
    CacheMode cacheMode,
    Integer minCount,
    Integer minWords,
    Integer maxWords,
    String includePattern,
    String excludePattern,
    String excludeSubstrings,
    String minusWords,
    MinusWordMode minusWordMode
) {
    public static DiscoveryRunRequest ofSeeds(List<String> seeds) {
        return new DiscoveryRunRequest(
            seeds, null, null, null, null, null, null, null, null, null, null, null, null, null, null, null, null
        );
    }

    public static DiscoveryRunRequest defaults() {
        return ofSeeds(List.of());
    }

    /**
     * Seeds joined one per line, the form the scheduler's seeding step consumes.
     */
    public String seedText() {
        if (seeds == null || seeds.isEmpty()) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (String seed : seeds) {
            if (seed == null) {
                continue;
            }
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(seed);
        }
        return text.toString();
    }
}
