package com.github.rudygunawan.adaptive.impl;

import com.github.rudygunawan.adaptive.model.CacheStats;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Accumulates the counters behind {@link CacheStats}. Hits and misses are only recorded when
 * {@code recordStats} is enabled; evictions and ghost hits are always counted.
 */
final class StatsCounter {
    private final boolean recordStats;
    private final AtomicLong hitCount = new AtomicLong(0);
    private final AtomicLong missCount = new AtomicLong(0);
    private final AtomicLong evictionCount = new AtomicLong(0);
    private final AtomicLong ghostHitCount = new AtomicLong(0);

    StatsCounter(boolean recordStats) {
        this.recordStats = recordStats;
    }

    void recordHit() {
        if (recordStats) hitCount.incrementAndGet();
    }

    void recordMiss() {
        if (recordStats) missCount.incrementAndGet();
    }

    void recordEviction() {
        evictionCount.incrementAndGet();
    }

    void recordGhostHit() {
        ghostHitCount.incrementAndGet();
    }

    long evictionCount() {
        return evictionCount.get();
    }

    long ghostHitCount() {
        return ghostHitCount.get();
    }

    CacheStats snapshot() {
        return new CacheStats(hitCount.get(), missCount.get(), evictionCount.get(), ghostHitCount.get());
    }
}
