package com.github.rudygunawan.adaptive.builder;

import com.github.rudygunawan.adaptive.api.Cache;
import com.github.rudygunawan.adaptive.impl.ArcCache;
import com.github.rudygunawan.adaptive.impl.LfuCache;
import com.github.rudygunawan.adaptive.impl.LruCache;
import com.github.rudygunawan.adaptive.impl.LruKCache;
import com.github.rudygunawan.adaptive.impl.ShardedCache;
import com.github.rudygunawan.adaptive.listener.RemovalListener;
import com.github.rudygunawan.adaptive.policy.EvictionPolicy;

/**
 * A builder of {@link Cache} instances for any {@link EvictionPolicy}, optionally sharded.
 *
 * <p>Usage example:
 * <pre>{@code
 * Cache<String, Profile> profiles = CacheBuilder.newBuilder()
 *     .maximumSize(10_000)
 *     .evictionPolicy(EvictionPolicy.ARC)
 *     .transformThreshold(3)
 *     .shards(0)            // one shard per available processor
 *     .recordStats()
 *     .build();
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class CacheBuilder<K, V> {
    private static final int UNSET_INT = -1;

    private int maximumSize = UNSET_INT;
    private EvictionPolicy evictionPolicy = EvictionPolicy.LRU;
    private int transformThreshold = ArcCache.DEFAULT_TRANSFORM_THRESHOLD;
    private int maxAverageFrequency = LfuCache.DEFAULT_MAX_AVERAGE_FREQUENCY;
    private int historyCapacity = UNSET_INT;
    private int admissionThreshold = LruKCache.DEFAULT_K;
    private int shards = 1;
    private boolean recordStats = false;
    private RemovalListener<? super K, ? super V> removalListener;

    private CacheBuilder() {
    }

    /**
     * Constructs a new {@code CacheBuilder} instance with default settings.
     */
    public static CacheBuilder<Object, Object> newBuilder() {
        return new CacheBuilder<>();
    }

    /**
     * Specifies the maximum number of entries the cache may contain. For {@link EvictionPolicy#ARC}
     * this is the initial capacity of each of its two parts.
     *
     * <p>When {@code size} is zero every {@code put} is ignored and every lookup misses. This can be
     * useful in testing, or to disable caching temporarily without a code change.
     *
     * @param size the maximum size of the cache
     * @return this builder instance
     * @throws IllegalArgumentException if {@code size} is negative
     */
    public CacheBuilder<K, V> maximumSize(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("maximum size must not be negative");
        }
        this.maximumSize = size;
        return this;
    }

    /**
     * Specifies the replacement policy. This option is not required; the default is
     * {@link EvictionPolicy#LRU}.
     *
     * @param policy the eviction policy to use
     * @return this builder instance
     */
    public CacheBuilder<K, V> evictionPolicy(EvictionPolicy policy) {
        if (policy == null) {
            throw new NullPointerException("eviction policy cannot be null");
        }
        this.evictionPolicy = policy;
        return this;
    }

    /**
     * Sets how many reads a key needs in the recency part of an ARC cache before it is mirrored
     * into the frequency part. Ignored by other policies. Defaults to 2.
     *
     * @param threshold the transform threshold
     * @return this builder instance
     * @throws IllegalArgumentException if {@code threshold} is not positive
     */
    public CacheBuilder<K, V> transformThreshold(int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("transform threshold must be positive");
        }
        this.transformThreshold = threshold;
        return this;
    }

    /**
     * Sets the mean access frequency above which an LFU cache ages all counters. Ignored by other
     * policies. Defaults to 10.
     *
     * @param ceiling the maximum average frequency
     * @return this builder instance
     * @throws IllegalArgumentException if {@code ceiling} is not positive
     */
    public CacheBuilder<K, V> maxAverageFrequency(int ceiling) {
        if (ceiling < 1) {
            throw new IllegalArgumentException("max average frequency must be positive");
        }
        this.maxAverageFrequency = ceiling;
        return this;
    }

    /**
     * Sets how many not-yet-admitted keys an LRU-K cache remembers. Ignored by other policies.
     * Defaults to the maximum size.
     *
     * @param capacity the history capacity
     * @return this builder instance
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public CacheBuilder<K, V> historyCapacity(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("history capacity must be positive");
        }
        this.historyCapacity = capacity;
        return this;
    }

    /**
     * Sets the number of accesses (the K of LRU-K) a key needs before it is admitted. Ignored by
     * other policies. Defaults to 2.
     *
     * @param k the admission threshold
     * @return this builder instance
     * @throws IllegalArgumentException if {@code k} is not positive
     */
    public CacheBuilder<K, V> admissionThreshold(int k) {
        if (k < 1) {
            throw new IllegalArgumentException("admission threshold must be positive");
        }
        this.admissionThreshold = k;
        return this;
    }

    /**
     * Splits the cache into independently locked shards. A value of 0 uses one shard per
     * available processor; the default of 1 builds an unsharded cache. Each shard receives
     * {@code ceil(maximumSize / shards)} entries.
     *
     * @param shards the number of shards
     * @return this builder instance
     * @throws IllegalArgumentException if {@code shards} is negative
     */
    public CacheBuilder<K, V> shards(int shards) {
        if (shards < 0) {
            throw new IllegalArgumentException("shard count must not be negative");
        }
        this.shards = shards;
        return this;
    }

    /**
     * Enables the accumulation of hit and miss counts. Without this, {@link Cache#stats} reports
     * zero hits and misses.
     *
     * @return this builder instance
     */
    public CacheBuilder<K, V> recordStats() {
        this.recordStats = true;
        return this;
    }

    /**
     * Specifies a listener notified each time an entry is evicted or invalidated.
     *
     * <p><b>Warning:</b> all exceptions thrown by {@code listener} will be logged and then swallowed.
     *
     * @param listener the removal listener to use
     * @return this builder instance
     */
    public <K1 extends K, V1 extends V> CacheBuilder<K1, V1> removalListener(
            RemovalListener<? super K1, ? super V1> listener) {
        if (listener == null) {
            throw new NullPointerException("removal listener cannot be null");
        }
        @SuppressWarnings("unchecked")
        CacheBuilder<K1, V1> me = (CacheBuilder<K1, V1>) this;
        me.removalListener = listener;
        return me;
    }

    /**
     * Builds a cache with the configured policy.
     *
     * @return a cache having the requested features
     * @throws IllegalStateException if no maximum size was specified
     */
    public <K1 extends K, V1 extends V> Cache<K1, V1> build() {
        if (maximumSize == UNSET_INT) {
            throw new IllegalStateException("maximumSize must be specified");
        }
        if (shards == 1) {
            return newPolicy(maximumSize);
        }
        return new ShardedCache<K1, V1>(maximumSize, shards, capacity -> this.<K1, V1>newPolicy(capacity));
    }

    private <K1 extends K, V1 extends V> Cache<K1, V1> newPolicy(int capacity) {
        RemovalListener<? super K1, ? super V1> listener = removalListener;
        return switch (evictionPolicy) {
            case LRU -> new LruCache<K1, V1>(capacity, recordStats, listener);
            case LRU_K -> new LruKCache<K1, V1>(capacity,
                    historyCapacity == UNSET_INT ? Math.max(1, capacity) : historyCapacity,
                    admissionThreshold, recordStats, listener);
            case LFU -> new LfuCache<K1, V1>(capacity, maxAverageFrequency, recordStats, listener);
            case ARC -> new ArcCache<K1, V1>(capacity, transformThreshold, recordStats, listener);
        };
    }

    public int getMaximumSize() {
        return maximumSize;
    }

    public EvictionPolicy getEvictionPolicy() {
        return evictionPolicy;
    }

    public int getTransformThreshold() {
        return transformThreshold;
    }

    public int getMaxAverageFrequency() {
        return maxAverageFrequency;
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public int getAdmissionThreshold() {
        return admissionThreshold;
    }

    public int getShards() {
        return shards;
    }

    public boolean isRecordingStats() {
        return recordStats;
    }
}
