package com.github.rudygunawan.adaptive.impl;

import com.github.rudygunawan.adaptive.api.Cache;
import com.github.rudygunawan.adaptive.metrics.CacheMetrics;
import com.github.rudygunawan.adaptive.model.CacheStats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Partitions the keyspace across independent caches of any policy to reduce lock contention.
 *
 * <p>A key's shard is {@code spread(key.hashCode()) mod shardCount}, which is stable for a given
 * key. Each shard is its own policy instance with its own lock; there is no coordination between
 * shards, so aggregate capacity, eviction order and statistics are per shard and only
 * approximate for the cache as a whole.
 *
 * <p><b>Architecture:</b>
 * <pre>
 * ShardedCache (N shards, capacity C)
 *   ├─ Shard 0 (keys: hash % N == 0, capacity ceil(C / N))
 *   ├─ Shard 1 (keys: hash % N == 1, capacity ceil(C / N))
 *   └─ ...
 * </pre>
 *
 * <p>Because every shard gets {@code ceil(C / N)} entries, the effective total capacity may be
 * slightly larger than requested.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class ShardedCache<K, V> implements Cache<K, V>, CacheMetrics {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.adaptive.Cache");

    private final List<Cache<K, V>> shards;
    private final int shardCapacity;

    /**
     * Creates a sharded cache.
     *
     * @param totalCapacity the requested capacity across all shards
     * @param shardCount the number of shards, or 0 to use the number of available processors
     * @param shardFactory creates one shard given its capacity
     */
    public ShardedCache(int totalCapacity, int shardCount, IntFunction<? extends Cache<K, V>> shardFactory) {
        Objects.requireNonNull(shardFactory, "shard factory cannot be null");
        if (shardCount < 0) {
            throw new IllegalArgumentException("shard count must not be negative");
        }
        int count = shardCount == 0 ? Runtime.getRuntime().availableProcessors() : shardCount;
        this.shardCapacity = shardCapacityFor(totalCapacity, count);

        List<Cache<K, V>> created = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            created.add(shardFactory.apply(shardCapacity));
        }
        this.shards = Collections.unmodifiableList(created);

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Initialized sharded cache with " + count + " shards of capacity " + shardCapacity);
        }
    }

    /**
     * Returns {@code ceil(totalCapacity / shardCount)}, or 0 for a non-positive capacity.
     */
    static int shardCapacityFor(int totalCapacity, int shardCount) {
        if (totalCapacity <= 0) {
            return 0;
        }
        return (int) (((long) totalCapacity + shardCount - 1) / shardCount);
    }

    /**
     * Spreads the high bits of a hash code into the low bits and clears the sign bit.
     */
    static int spread(int h) {
        return (h ^ (h >>> 16)) & 0x7fffffff;
    }

    /**
     * Returns the index of the shard that owns {@code key}.
     */
    public int shardIndex(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        return spread(key.hashCode()) % shards.size();
    }

    @Override
    public boolean put(K key, V value) {
        return shardFor(key).put(key, value);
    }

    @Override
    public V getIfPresent(K key) {
        return shardFor(key).getIfPresent(key);
    }

    @Override
    public void invalidate(K key) {
        shardFor(key).invalidate(key);
    }

    @Override
    public void invalidateAll() {
        for (Cache<K, V> shard : shards) {
            shard.invalidateAll();
        }
    }

    /**
     * Sums the sizes of all shards.
     */
    @Override
    public long size() {
        long sum = 0;
        for (Cache<K, V> shard : shards) {
            sum += shard.size();
        }
        return sum;
    }

    /**
     * Returns {@code shardCapacity * shardCount}, which may exceed the requested capacity.
     */
    @Override
    public int capacity() {
        return (int) Math.min(Integer.MAX_VALUE, (long) shardCapacity * shards.size());
    }

    public int shardCount() {
        return shards.size();
    }

    public int shardCapacity() {
        return shardCapacity;
    }

    /**
     * Returns the shard at {@code index}.
     */
    public Cache<K, V> shard(int index) {
        return shards.get(index);
    }

    @Override
    public CacheStats stats() {
        CacheStats total = CacheStats.empty();
        for (Cache<K, V> shard : shards) {
            total = total.plus(shard.stats());
        }
        return total;
    }

    @Override
    public long hitCount() {
        return stats().hitCount();
    }

    @Override
    public long missCount() {
        return stats().missCount();
    }

    @Override
    public long evictionCount() {
        return stats().evictionCount();
    }

    @Override
    public long ghostHitCount() {
        return stats().ghostHitCount();
    }

    private Cache<K, V> shardFor(K key) {
        return shards.get(shardIndex(key));
    }
}
