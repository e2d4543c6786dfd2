package com.wordscout.discovery.cache;

public record CacheStats(long total, long valid, long expired) {
    public static CacheStats empty() {
        return new CacheStats(0, 0, 0);
    }
}
