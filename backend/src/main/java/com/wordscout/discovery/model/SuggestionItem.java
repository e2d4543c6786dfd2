package com.wordscout.discovery.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A phrase returned by the suggestion API. {@code count} is {@code null} when the API sent
 * something that is not an integer.
 */
public record SuggestionItem(String phrase, Long count) {
    @JsonIgnore
    public boolean isWellFormed() {
        return phrase != null && !phrase.isBlank() && count != null && count >= 0;
    }
}
