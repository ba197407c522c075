package com.github.rudygunawan.adaptive.impl;

import com.github.rudygunawan.adaptive.api.Cache;
import com.github.rudygunawan.adaptive.listener.RemovalListener;
import com.github.rudygunawan.adaptive.metrics.CacheMetrics;
import com.github.rudygunawan.adaptive.model.CacheStats;
import com.github.rudygunawan.adaptive.model.Entry;
import com.github.rudygunawan.adaptive.model.FrequencyBuckets;
import com.github.rudygunawan.adaptive.policy.RemovalCause;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Least-frequently-used cache with counter aging.
 *
 * <p>Entries are grouped into {@link FrequencyBuckets}; when full, the oldest entry of the least
 * frequent bucket is evicted. Every insert and every hit adds one to a running access total.
 * When the mean frequency ({@code totalAccesses / size}, integer division) rises above
 * {@code maxAverageFrequency}, an aging sweep subtracts half the ceiling from every entry's
 * frequency (never below 1). Aging keeps counters bounded and lets keys that were hot long ago
 * lose their protection against eviction.
 *
 * <p>All operations are serialized through one {@link ReentrantLock}. Lookups and inserts are
 * O(log bucket-count); an aging sweep is O(size).
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class LfuCache<K, V> implements Cache<K, V>, CacheMetrics {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.adaptive.Cache");

    /** Default ceiling for the mean access frequency. */
    public static final int DEFAULT_MAX_AVERAGE_FREQUENCY = 10;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<K, Entry<K, V>> index = new HashMap<>();
    private final FrequencyBuckets<K, V> buckets = new FrequencyBuckets<>();
    private final StatsCounter stats;
    private final RemovalNotifier<K, V> notifier;
    private final int capacity;
    private final int maxAverageFrequency;

    private long totalAccesses;
    private long agingSweeps;

    public LfuCache(int capacity) {
        this(capacity, DEFAULT_MAX_AVERAGE_FREQUENCY, false, null);
    }

    public LfuCache(int capacity, int maxAverageFrequency) {
        this(capacity, maxAverageFrequency, false, null);
    }

    /**
     * Creates an LFU cache.
     *
     * @param capacity the maximum number of entries; a value of 0 or less disables caching
     * @param maxAverageFrequency the mean frequency above which counters are aged
     * @param recordStats whether to record hits and misses
     * @param removalListener listener notified of evictions and invalidations, or {@code null}
     */
    public LfuCache(int capacity, int maxAverageFrequency, boolean recordStats,
                    RemovalListener<? super K, ? super V> removalListener) {
        if (capacity <= 0) {
            LOGGER.warning("LFU cache created with capacity " + capacity + "; every put will be ignored");
        }
        if (maxAverageFrequency < 1) {
            throw new IllegalArgumentException("max average frequency must be positive");
        }
        this.capacity = Math.max(0, capacity);
        this.maxAverageFrequency = maxAverageFrequency;
        this.stats = new StatsCounter(recordStats);
        this.notifier = new RemovalNotifier<>(removalListener);
    }

    @Override
    public boolean put(K key, V value) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        if (capacity == 0) {
            return false;
        }

        lock.lock();
        try {
            Entry<K, V> entry = index.get(key);
            if (entry != null) {
                entry.setValue(value);
                touch(entry);
                return true;
            }
            if (index.size() >= capacity) {
                evictLeastFrequent();
            }
            entry = new Entry<>(key, value);
            index.put(key, entry);
            buckets.add(entry);
            recordAccess();
            return true;
        } finally {
            lock.unlock();
            notifier.dispatch(lock);
        }
    }

    @Override
    public V getIfPresent(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        try {
            Entry<K, V> entry = index.get(key);
            if (entry == null) {
                stats.recordMiss();
                return null;
            }
            touch(entry);
            stats.recordHit();
            return entry.getValue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void invalidate(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        try {
            Entry<K, V> entry = index.remove(key);
            if (entry != null) {
                buckets.remove(entry);
                totalAccesses -= entry.getFrequency();
                notifier.enqueue(key, entry.getValue(), RemovalCause.EXPLICIT);
            }
        } finally {
            lock.unlock();
            notifier.dispatch(lock);
        }
    }

    @Override
    public void invalidateAll() {
        lock.lock();
        try {
            List<Entry<K, V>> removed = new ArrayList<>(index.values());
            index.clear();
            buckets.clear();
            totalAccesses = 0;
            for (Entry<K, V> entry : removed) {
                notifier.enqueue(entry.getKey(), entry.getValue(), RemovalCause.EXPLICIT);
            }
        } finally {
            lock.unlock();
            notifier.dispatch(lock);
        }
    }

    @Override
    public long size() {
        lock.lock();
        try {
            return index.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    public int maxAverageFrequency() {
        return maxAverageFrequency;
    }

    /**
     * Returns {@code totalAccesses / size} using integer division, or 0 when empty.
     */
    public long averageFrequency() {
        lock.lock();
        try {
            return currentAverage();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the current frequency of a resident key, or 0 if it is not resident.
     */
    public int frequencyOf(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        try {
            Entry<K, V> entry = index.get(key);
            return entry == null ? 0 : entry.getFrequency();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the smallest frequency held by a resident entry, or 0 when empty.
     */
    public int minFrequency() {
        lock.lock();
        try {
            return buckets.minFrequency();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns how many aging sweeps have run.
     */
    public long agingSweepCount() {
        lock.lock();
        try {
            return agingSweeps;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheStats stats() {
        return stats.snapshot();
    }

    @Override
    public long hitCount() {
        return stats.snapshot().hitCount();
    }

    @Override
    public long missCount() {
        return stats.snapshot().missCount();
    }

    @Override
    public long evictionCount() {
        return stats.evictionCount();
    }

    @Override
    public long ghostHitCount() {
        return stats.ghostHitCount();
    }

    /**
     * Subtracts half of {@code maxAverageFrequency} (at least 1) from every entry's frequency,
     * flooring at 1, and rebuilds the buckets. Relative order is kept: entries are re-added in
     * ascending old frequency, oldest first within a frequency. Caller holds the lock and has
     * checked that the mean frequency exceeds the ceiling.
     */
    void age() {
        int decay = Math.max(1, maxAverageFrequency / 2);
        List<Entry<K, V>> entries = buckets.drain();
        long total = 0;
        for (Entry<K, V> entry : entries) {
            entry.setFrequency(entry.getFrequency() - decay);
            buckets.add(entry);
            total += entry.getFrequency();
        }
        totalAccesses = total;
        agingSweeps++;
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Aged LFU frequencies by " + decay + ": entries=" + entries.size() +
                    ", averageFrequency=" + currentAverage() + ", minFrequency=" + buckets.minFrequency());
        }
    }

    private void touch(Entry<K, V> entry) {
        buckets.increment(entry);
        recordAccess();
    }

    private void recordAccess() {
        totalAccesses++;
        if (currentAverage() > maxAverageFrequency) {
            age();
        }
    }

    private long currentAverage() {
        int population = index.size();
        return population == 0 ? 0 : totalAccesses / population;
    }

    private void evictLeastFrequent() {
        Entry<K, V> victim = buckets.pollLeastFrequent();
        if (victim == null) {
            return;
        }
        index.remove(victim.getKey());
        totalAccesses -= victim.getFrequency();
        stats.recordEviction();
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Evicted least frequently used entry: key=" + victim.getKey() +
                    ", frequency=" + victim.getFrequency());
        }
        notifier.enqueue(victim.getKey(), victim.getValue(), RemovalCause.SIZE);
    }
}
