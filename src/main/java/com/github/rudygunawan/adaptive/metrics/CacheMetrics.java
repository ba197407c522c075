package com.github.rudygunawan.adaptive.metrics;

/**
 * Interface for cache implementations to provide metrics data.
 * This is used by MicrometerCacheMetrics to collect and expose metrics.
 */
public interface CacheMetrics {

    /**
     * Returns the current number of entries in the cache.
     */
    long size();

    /**
     * Returns the configured capacity of the cache.
     */
    int capacity();

    /**
     * Returns the total number of cache hits.
     */
    long hitCount();

    /**
     * Returns the total number of cache misses.
     */
    long missCount();

    /**
     * Returns the total number of evictions.
     */
    long evictionCount();

    /**
     * Returns the number of requests that found their key in a ghost list.
     */
    long ghostHitCount();

    /**
     * Returns the hit ratio between 0.0 and 1.0, or 0.0 before any lookup.
     */
    default double hitRatio() {
        long hits = hitCount();
        long total = hits + missCount();
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
