package com.semsort.cache;

public record CacheStats(
        long hits,
        long misses,
        int size,
        int maxSize,
        long evictions,
        long expirations,
        long ttlMs) {

    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0d : (double) hits / lookups;
    }
}
