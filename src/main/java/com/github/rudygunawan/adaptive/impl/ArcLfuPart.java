package com.github.rudygunawan.adaptive.impl;

import com.github.rudygunawan.adaptive.model.Entry;
import com.github.rudygunawan.adaptive.model.FrequencyBuckets;

/**
 * The frequency half of an {@link ArcCache}. Resident entries are grouped into
 * {@link FrequencyBuckets}; the victim is the oldest entry of the least frequent bucket. Both
 * reads and writes to a resident entry count as an access.
 */
final class ArcLfuPart<K, V> extends ArcPart<K, V> {
    private final FrequencyBuckets<K, V> buckets = new FrequencyBuckets<>();

    ArcLfuPart(int capacity, StatsCounter stats, RemovalNotifier<K, V> notifier) {
        super("frequency", capacity, stats, notifier);
    }

    /**
     * Looks up a resident entry and promotes it to the next frequency bucket.
     *
     * @return the value, or {@code null} on a miss
     */
    V get(K key) {
        lock.lock();
        try {
            Entry<K, V> entry = mainIndex.get(key);
            if (entry == null) {
                return null;
            }
            buckets.increment(entry);
            return entry.getValue();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the value of a resident entry without counting an access.
     *
     * @return {@code true} if the key was resident
     */
    boolean updateIfPresent(K key, V value) {
        lock.lock();
        try {
            Entry<K, V> entry = mainIndex.get(key);
            if (entry == null) {
                return false;
            }
            entry.setValue(value);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the current frequency of a resident key, or 0 if it is not resident.
     */
    int frequencyOf(K key) {
        lock.lock();
        try {
            Entry<K, V> entry = mainIndex.get(key);
            return entry == null ? 0 : entry.getFrequency();
        } finally {
            lock.unlock();
        }
    }

    int minFrequency() {
        lock.lock();
        try {
            return buckets.minFrequency();
        } finally {
            lock.unlock();
        }
    }

    @Override
    void onInsert(Entry<K, V> entry) {
        buckets.add(entry);
    }

    @Override
    void onUpdate(Entry<K, V> entry) {
        buckets.increment(entry);
    }

    @Override
    void onRemove(Entry<K, V> entry) {
        buckets.remove(entry);
    }

    @Override
    Entry<K, V> pollVictim() {
        return buckets.pollLeastFrequent();
    }

    @Override
    void clearOrdering() {
        buckets.clear();
    }
}
