package com.github.rudygunawan.adaptive.impl;

import com.github.rudygunawan.adaptive.listener.RemovalListener;

import java.util.Objects;
import java.util.logging.Level;

/**
 * LRU-K cache: an {@link LruCache} whose admission is gated by a bounded history list.
 *
 * <p>A key that is not resident is first recorded in the history list, which is itself an LRU of
 * access counts together with the most recently offered value. Each {@code put} and each missed
 * {@code getIfPresent} of that key bumps its count; once the count reaches {@code k} the key leaves
 * the history list and is admitted into the main cache. Keys touched fewer than {@code k} times
 * before falling out of the history list never displace resident entries.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class LruKCache<K, V> extends LruCache<K, V> {
    /** Default number of recorded accesses required for admission. */
    public static final int DEFAULT_K = 2;

    private final LruCache<K, History<V>> history;
    private final int k;

    public LruKCache(int capacity, int historyCapacity, int k) {
        this(capacity, historyCapacity, k, false, null);
    }

    /**
     * Creates an LRU-K cache.
     *
     * @param capacity the maximum number of resident entries
     * @param historyCapacity the maximum number of keys tracked while awaiting admission
     * @param k the number of recorded accesses after which a key is admitted
     * @param recordStats whether to record hits and misses
     * @param removalListener listener notified of evictions and invalidations, or {@code null}
     */
    public LruKCache(int capacity, int historyCapacity, int k, boolean recordStats,
                     RemovalListener<? super K, ? super V> removalListener) {
        super(capacity, recordStats, removalListener);
        this.history = new LruCache<>(Math.max(1, historyCapacity));
        this.k = Math.max(1, k);
    }

    @Override
    public boolean put(K key, V value) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        if (capacity() == 0) {
            return false;
        }

        lock.lock();
        try {
            if (containsKey(key)) {
                return super.put(key, value);
            }
            History<V> record = history.lookup(key);
            if (record == null) {
                record = new History<>();
                history.put(key, record);
            }
            record.accesses++;
            record.value = value;
            if (record.accesses >= k) {
                admit(key, value);
            }
            return true;
        } finally {
            lock.unlock();
            dispatchRemovals();
        }
    }

    @Override
    public V getIfPresent(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        try {
            V value = lookup(key);
            if (value == null) {
                value = recordMiss(key);
            }
            if (value != null) {
                stats.recordHit();
            } else {
                stats.recordMiss();
            }
            return value;
        } finally {
            lock.unlock();
            dispatchRemovals();
        }
    }

    @Override
    public void invalidate(K key) {
        lock.lock();
        try {
            super.invalidate(key);
            history.invalidate(key);
        } finally {
            lock.unlock();
            dispatchRemovals();
        }
    }

    @Override
    public void invalidateAll() {
        lock.lock();
        try {
            super.invalidateAll();
            history.invalidateAll();
        } finally {
            lock.unlock();
            dispatchRemovals();
        }
    }

    /**
     * Returns the number of keys waiting in the history list.
     */
    public long historySize() {
        return history.size();
    }

    public int k() {
        return k;
    }

    /**
     * Counts a missed read. Returns the pending value if this read completes admission.
     */
    private V recordMiss(K key) {
        History<V> record = history.lookup(key);
        if (record == null) {
            record = new History<>();
            history.put(key, record);
        }
        record.accesses++;
        if (record.accesses >= k && record.value != null) {
            V value = record.value;
            admit(key, value);
            return value;
        }
        return null;
    }

    private void admit(K key, V value) {
        history.invalidate(key);
        super.put(key, value);
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Admitted key into LRU-K main cache after " + k + " accesses: key=" + key);
        }
    }

    /** Access count and latest offered value of a key awaiting admission. */
    private static final class History<V> {
        int accesses;
        V value;
    }
}
