package com.wordscout.discovery.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One fetch of the suggestion API for a normalized phrase at a given depth.
 *
 * @param phrase       normalized phrase to query
 * @param depth        1 for seeds, parent depth + 1 for expansions
 * @param seed         root phrase the task descends from
 * @param sourcePhrase phrase whose results produced this task, {@code null} for seeds
 */
public record DiscoveryTask(
    String phrase,
    int depth,
    String seed,
    String sourcePhrase
) {
    public static DiscoveryTask seed(String phrase) {
        return new DiscoveryTask(phrase, 1, phrase, null);
    }

    public DiscoveryTask child(String childPhrase) {
        return new DiscoveryTask(childPhrase, depth + 1, seed, phrase);
    }

    @JsonIgnore
    public TaskKey key() {
        return new TaskKey(phrase, depth);
    }
}
