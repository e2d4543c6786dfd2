package com.wordscout.discovery.client;

import java.util.List;

public record SuggestionQuery(
    String phrase,
    int maxResults,
    List<Integer> regions,
    DeviceFilter device
) {
    public SuggestionQuery {
        regions = regions == null ? List.of() : List.copyOf(regions);
        device = device == null ? DeviceFilter.ALL : device;
    }
}
