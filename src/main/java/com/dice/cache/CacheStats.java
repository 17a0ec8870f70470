package com.dice.cache;

/**
 * Snapshot of cache usage.
 *
 * @param size      Entries currently held
 * @param capacity  Maximum entries
 * @param hits      Lookups answered from the cache
 * @param misses    Lookups not found
 * @param evictions Entries removed to make room
 */
public record CacheStats(int size, int capacity, long hits, long misses, long evictions) {

    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
