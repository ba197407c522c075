package com.github.rudygunawan.adaptive.model;

import java.util.Objects;

/**
 * Statistics about the performance of a {@link com.github.rudygunawan.adaptive.api.Cache}.
 * Instances of this class are immutable.
 *
 * <p>Cache statistics are incremented according to the following rules:
 *
 * <ul>
 *   <li>When a lookup finds a resident entry, {@code hitCount} is incremented.
 *   <li>When a lookup finds nothing, {@code missCount} is incremented.
 *   <li>When an entry is pushed out to make room, {@code evictionCount} is incremented.
 *   <li>When a request finds its key in a ghost list, {@code ghostHitCount} is incremented.
 * </ul>
 *
 * <p>Hits and misses are only recorded when the cache was built with
 * {@code recordStats()}; evictions and ghost hits are always counted.
 */
public class CacheStats {
    private static final CacheStats EMPTY = new CacheStats(0, 0, 0, 0);

    private final long hitCount;
    private final long missCount;
    private final long evictionCount;
    private final long ghostHitCount;

    /**
     * Constructs a new {@code CacheStats} instance.
     */
    public CacheStats(long hitCount, long missCount, long evictionCount, long ghostHitCount) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.evictionCount = evictionCount;
        this.ghostHitCount = ghostHitCount;
    }

    /**
     * Returns a statistics instance with all counts at zero.
     */
    public static CacheStats empty() {
        return EMPTY;
    }

    /**
     * Returns the number of lookups, defined as {@code hitCount + missCount}.
     */
    public long requestCount() {
        return hitCount + missCount;
    }

    public long hitCount() {
        return hitCount;
    }

    /**
     * Returns the ratio of lookups which were hits, or {@code 1.0} when there were no lookups.
     */
    public double hitRate() {
        long requestCount = requestCount();
        return (requestCount == 0) ? 1.0 : (double) hitCount / requestCount;
    }

    public long missCount() {
        return missCount;
    }

    /**
     * Returns the ratio of lookups which were misses, or {@code 0.0} when there were no lookups.
     */
    public double missRate() {
        long requestCount = requestCount();
        return (requestCount == 0) ? 0.0 : (double) missCount / requestCount;
    }

    /**
     * Returns the number of entries removed to make room for new ones.
     */
    public long evictionCount() {
        return evictionCount;
    }

    /**
     * Returns the number of requests for keys found in a ghost (recently evicted) list.
     */
    public long ghostHitCount() {
        return ghostHitCount;
    }

    /**
     * Returns a new {@code CacheStats} representing the difference between this {@code CacheStats}
     * and {@code other}. Negative values are clamped to zero.
     */
    public CacheStats minus(CacheStats other) {
        return new CacheStats(
                Math.max(0, hitCount - other.hitCount),
                Math.max(0, missCount - other.missCount),
                Math.max(0, evictionCount - other.evictionCount),
                Math.max(0, ghostHitCount - other.ghostHitCount));
    }

    /**
     * Returns a new {@code CacheStats} representing the sum of this {@code CacheStats} and
     * {@code other}.
     */
    public CacheStats plus(CacheStats other) {
        return new CacheStats(
                hitCount + other.hitCount,
                missCount + other.missCount,
                evictionCount + other.evictionCount,
                ghostHitCount + other.ghostHitCount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hitCount, missCount, evictionCount, ghostHitCount);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CacheStats)) {
            return false;
        }
        CacheStats other = (CacheStats) obj;
        return hitCount == other.hitCount
                && missCount == other.missCount
                && evictionCount == other.evictionCount
                && ghostHitCount == other.ghostHitCount;
    }

    @Override
    public String toString() {
        return "CacheStats{"
                + "hitCount=" + hitCount
                + ", missCount=" + missCount
                + ", evictionCount=" + evictionCount
                + ", ghostHitCount=" + ghostHitCount
                + ", hitRate=" + String.format("%.2f%%", hitRate() * 100)
                + '}';
    }
}
