package com.github.rudygunawan.adaptive.impl;

import com.github.rudygunawan.adaptive.api.Cache;
import com.github.rudygunawan.adaptive.listener.RemovalListener;
import com.github.rudygunawan.adaptive.metrics.CacheMetrics;
import com.github.rudygunawan.adaptive.model.CacheStats;
import com.github.rudygunawan.adaptive.model.Entry;
import com.github.rudygunawan.adaptive.model.OrderedList;
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
 * Least-recently-used cache. Entries live in a hash index and an {@link OrderedList} in access
 * order; when full, the entry at the front of the list is evicted. No ghost history is kept.
 *
 * <p>All operations are serialized through one {@link ReentrantLock} and run in O(1).
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class LruCache<K, V> implements Cache<K, V>, CacheMetrics {
    static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.adaptive.Cache");

    protected final ReentrantLock lock = new ReentrantLock();
    protected final StatsCounter stats;

    private final Map<K, Entry<K, V>> index = new HashMap<>();
    private final OrderedList<K, V> accessOrder = new OrderedList<>();
    private final RemovalNotifier<K, V> notifier;
    private final int capacity;

    public LruCache(int capacity) {
        this(capacity, false, null);
    }

    /**
     * Creates an LRU cache.
     *
     * @param capacity the maximum number of entries; a value of 0 or less disables caching
     * @param recordStats whether to record hits and misses
     * @param removalListener listener notified of evictions and invalidations, or {@code null}
     */
    public LruCache(int capacity, boolean recordStats, RemovalListener<? super K, ? super V> removalListener) {
        if (capacity <= 0) {
            LOGGER.warning("LRU cache created with capacity " + capacity + "; every put will be ignored");
        }
        this.capacity = Math.max(0, capacity);
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
                accessOrder.moveToBack(entry);
                return true;
            }
            if (index.size() >= capacity) {
                evictLeastRecent();
            }
            entry = new Entry<>(key, value);
            index.put(key, entry);
            accessOrder.pushBack(entry);
            return true;
        } finally {
            lock.unlock();
            dispatchRemovals();
        }
    }

    @Override
    public V getIfPresent(K key) {
        V value = lookup(key);
        if (value != null) {
            stats.recordHit();
        } else {
            stats.recordMiss();
        }
        return value;
    }

    /**
     * Returns whether the key is resident, without counting an access.
     */
    public boolean containsKey(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        try {
            return index.containsKey(key);
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
                accessOrder.remove(entry);
                notifier.enqueue(key, entry.getValue(), RemovalCause.EXPLICIT);
            }
        } finally {
            lock.unlock();
            dispatchRemovals();
        }
    }

    @Override
    public void invalidateAll() {
        lock.lock();
        try {
            List<Entry<K, V>> removed = new ArrayList<>(index.values());
            index.clear();
            accessOrder.clear();
            for (Entry<K, V> entry : removed) {
                notifier.enqueue(entry.getKey(), entry.getValue(), RemovalCause.EXPLICIT);
            }
        } finally {
            lock.unlock();
            dispatchRemovals();
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
     * Looks up a key and marks it most recently used, without recording a hit or miss.
     */
    protected V lookup(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        try {
            Entry<K, V> entry = index.get(key);
            if (entry == null) {
                return null;
            }
            accessOrder.moveToBack(entry);
            return entry.getValue();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Delivers removal notifications queued under the lock, once the current thread has fully
     * released it.
     */
    void dispatchRemovals() {
        notifier.dispatch(lock);
    }

    private void evictLeastRecent() {
        Entry<K, V> victim = accessOrder.pollOldest();
        if (victim == null) {
            return;
        }
        index.remove(victim.getKey());
        stats.recordEviction();
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Evicted least recently used entry: key=" + victim.getKey());
        }
        notifier.enqueue(victim.getKey(), victim.getValue(), RemovalCause.SIZE);
    }
}
