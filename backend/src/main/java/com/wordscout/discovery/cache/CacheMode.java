package com.wordscout.discovery.cache;

/**
 * How the scheduler uses the response cache.
 */
public enum CacheMode {
    /** Read, then fetch and write on a miss. An entry without results counts as a miss. */
    ON,
    /** Neither read nor write. */
    OFF,
    /** Read only; a miss yields an empty response and the API is never called. */
    ONLY,
    /** Ignore existing entries, always fetch, write the fresh response. */
    REFRESH;

    public boolean reads() {
        return this == ON || this == ONLY;
    }

    public boolean writes() {
        return this == ON || this == REFRESH;
    }
}
