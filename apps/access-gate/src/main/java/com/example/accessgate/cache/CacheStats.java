package com.example.accessgate.cache;

public record CacheStats(long hits, long misses, long size, double hitRate) {

    public static CacheStats of(long hits, long misses, long size) {
        long lookups = hits + misses;
        return new CacheStats(hits, misses, size, lookups == 0 ? 0.0 : (double) hits / lookups);
    }
}
