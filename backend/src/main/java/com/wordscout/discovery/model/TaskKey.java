package com.wordscout.discovery.model;

public record TaskKey(String phrase, int depth) {
    @Override
    public String toString() {
        return phrase + "|" + depth;
    }
}
