package com.wordscout.discovery.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

public record SuggestionResponse(
    List<SuggestionItem> results,
    List<SuggestionItem> associations,
    int statusCode
) {
    public SuggestionResponse {
        results = results == null ? List.of() : List.copyOf(results);
        associations = associations == null ? List.of() : List.copyOf(associations);
    }

    public static SuggestionResponse empty() {
        return new SuggestionResponse(List.of(), List.of(), 200);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return results.isEmpty() && associations.isEmpty();
    }

    /**
     * Primary results followed by associations, in API order.
     */
    public List<SuggestionItem> candidates() {
        List<SuggestionItem> merged = new ArrayList<>(results.size() + associations.size());
        merged.addAll(results);
        merged.addAll(associations);
        return merged;
    }
}
