package com.github.rudygunawan.adaptive.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups entries by access frequency. Each bucket is an {@link OrderedList} of the entries that
 * share a frequency, oldest first, so the least-frequently-used entry is the front of the
 * {@link #minFrequency() minimum} bucket and ties are broken by insertion order.
 *
 * <p>Invariants:
 * <ul>
 *   <li>every entry sits in the bucket matching its current frequency</li>
 *   <li>an empty bucket is dropped immediately</li>
 *   <li>{@link #minFrequency()} is the smallest bucket key, or 0 when there are no entries</li>
 * </ul>
 *
 * <p>Not thread-safe; guarded by the owning policy's lock.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public final class FrequencyBuckets<K, V> {
    private final TreeMap<Integer, OrderedList<K, V>> buckets = new TreeMap<>();
    private int minFrequency;
    private int size;

    /**
     * Links the entry into the bucket for its current frequency.
     */
    public void add(Entry<K, V> entry) {
        int frequency = entry.getFrequency();
        buckets.computeIfAbsent(frequency, f -> new OrderedList<>()).pushBack(entry);
        if (size == 0 || frequency < minFrequency) {
            minFrequency = frequency;
        }
        size++;
    }

    /**
     * Unlinks the entry from its bucket, dropping the bucket if it becomes empty.
     */
    public void remove(Entry<K, V> entry) {
        int frequency = entry.getFrequency();
        unlink(entry);
        if (frequency == minFrequency && !buckets.containsKey(frequency)) {
            recomputeMinFrequency();
        }
    }

    /**
     * Moves the entry from bucket {@code f} to bucket {@code f + 1}.
     *
     * @return the entry's new frequency
     */
    public int increment(Entry<K, V> entry) {
        int oldFrequency = entry.getFrequency();
        unlink(entry);
        int newFrequency = entry.incrementFrequency();
        buckets.computeIfAbsent(newFrequency, f -> new OrderedList<>()).pushBack(entry);
        size++;
        if (oldFrequency == minFrequency && !buckets.containsKey(oldFrequency)) {
            minFrequency = newFrequency;
        }
        return newFrequency;
    }

    /**
     * Returns the oldest entry among the least frequent without removing it, or {@code null}.
     */
    public Entry<K, V> peekLeastFrequent() {
        if (size == 0) {
            return null;
        }
        return buckets.get(minFrequency).peekOldest();
    }

    /**
     * Removes and returns the oldest entry among the least frequent, or {@code null}.
     */
    public Entry<K, V> pollLeastFrequent() {
        Entry<K, V> victim = peekLeastFrequent();
        if (victim != null) {
            remove(victim);
        }
        return victim;
    }

    /**
     * Returns the smallest frequency with a non-empty bucket, or 0 if there are no entries.
     */
    public int minFrequency() {
        return minFrequency;
    }

    public int bucketCount() {
        return buckets.size();
    }

    /**
     * Returns the number of entries in the bucket for {@code frequency}.
     */
    public int bucketSize(int frequency) {
        OrderedList<K, V> bucket = buckets.get(frequency);
        return bucket == null ? 0 : bucket.size();
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Unlinks every entry and returns them ordered by ascending frequency, oldest first within a
     * frequency. The index is empty afterwards.
     */
    public List<Entry<K, V>> drain() {
        List<Entry<K, V>> entries = new ArrayList<>(size);
        for (Map.Entry<Integer, OrderedList<K, V>> bucket : buckets.entrySet()) {
            entries.addAll(bucket.getValue().toList());
            bucket.getValue().clear();
        }
        buckets.clear();
        minFrequency = 0;
        size = 0;
        return entries;
    }

    public void clear() {
        for (OrderedList<K, V> bucket : buckets.values()) {
            bucket.clear();
        }
        buckets.clear();
        minFrequency = 0;
        size = 0;
    }

    private void unlink(Entry<K, V> entry) {
        int frequency = entry.getFrequency();
        OrderedList<K, V> bucket = buckets.get(frequency);
        bucket.remove(entry);
        if (bucket.isEmpty()) {
            buckets.remove(frequency);
        }
        size--;
    }

    private void recomputeMinFrequency() {
        minFrequency = buckets.isEmpty() ? 0 : buckets.firstKey();
    }
}
