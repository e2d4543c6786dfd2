package com.wordscout.discovery.service;

import com.wordscout.config.DiscoveryProperties;
import com.wordscout.config.InvalidConfigException;
import com.wordscout.discovery.client.DeviceFilter;
import com.wordscout.discovery.nlp.GeoMode;

import java.util.List;

/**
 * Per-run discovery shape: how deep and how wide to expand, and what each API call asks for.
 */
public record DiscoveryParameters(
    int maxDepth,
    int topN,
    int phrasesPerCall,
    DeviceFilter device,
    List<Integer> regions,
    GeoMode geoMode,
    boolean expandFilteredPhrases
) {
    public static final int MIN_DEPTH = 1;
    public static final int MAX_DEPTH = 3;
    public static final int MIN_TOP_N = 1;
    public static final int MAX_TOP_N = 5;
    public static final int MIN_PHRASES_PER_CALL = 1;
    public static final int MAX_PHRASES_PER_CALL = 2000;

    public DiscoveryParameters {
        requireRange("maxDepth", maxDepth, MIN_DEPTH, MAX_DEPTH);
        requireRange("topN", topN, MIN_TOP_N, MAX_TOP_N);
        requireRange("phrasesPerCall", phrasesPerCall, MIN_PHRASES_PER_CALL, MAX_PHRASES_PER_CALL);
        device = device == null ? DeviceFilter.ALL : device;
        regions = regions == null ? List.of() : List.copyOf(regions);
        geoMode = geoMode == null ? GeoMode.OFF : geoMode;
    }

    public static DiscoveryParameters defaults() {
        return new DiscoveryParameters(2, 3, 100, DeviceFilter.ALL, List.of(), GeoMode.OFF, true);
    }

    public static DiscoveryParameters from(DiscoveryProperties.Scheduler properties) {
        return new DiscoveryParameters(
            properties.getMaxDepth(),
            properties.getTopN(),
            properties.getPhrasesPerCall(),
            properties.getDevice(),
            properties.getRegions(),
            properties.getGeoMode(),
            properties.isExpandFilteredPhrases()
        );
    }

    private static void requireRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new InvalidConfigException(name + " must be between " + min + " and " + max + ": " + value);
        }
    }
}
