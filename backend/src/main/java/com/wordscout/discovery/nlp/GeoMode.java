package com.wordscout.discovery.nlp;

public enum GeoMode {
    /** Phrases pass through untouched. */
    OFF,
    /** Geographic tokens are stripped from the phrase and recorded. */
    REMOVE,
    /** Only phrases that mention a geographic token are kept. */
    EXTRACT
}
