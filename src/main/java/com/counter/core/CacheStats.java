package com.counter.core;

/**
 * Önbelleğin isabet, ıskalama, boyut ve tahliye sayılarının anlık görüntüsü.
 */
public record CacheStats(long hits, long misses, int size, long evictions) {

    public double hitRate() {
        long requests = hits + misses;
        return requests == 0 ? 0.0 : (double) hits / requests;
    }
}
