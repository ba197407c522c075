package com.github.rudygunawan.adaptive.impl;

import com.github.rudygunawan.adaptive.model.Entry;
import com.github.rudygunawan.adaptive.model.OrderedList;

/**
 * The recency half of an {@link ArcCache}. Resident entries are kept in access order; the victim
 * is the least recently used entry.
 *
 * <p>Reads count accesses. Once an entry has been accessed {@code transformThreshold} times the
 * read reports that it should be promoted, and the ARC engine mirrors it into the frequency part.
 */
final class ArcLruPart<K, V> extends ArcPart<K, V> {
    private final OrderedList<K, V> mainList = new OrderedList<>();
    private final int transformThreshold;

    ArcLruPart(int capacity, int transformThreshold, StatsCounter stats, RemovalNotifier<K, V> notifier) {
        super("recency", capacity, stats, notifier);
        this.transformThreshold = transformThreshold;
    }

    /**
     * Looks up a resident entry, marking it most recently used and counting the access.
     *
     * @return the lookup result, or {@code null} on a miss
     */
    Lookup<V> get(K key) {
        lock.lock();
        try {
            Entry<K, V> entry = mainIndex.get(key);
            if (entry == null) {
                return null;
            }
            mainList.moveToBack(entry);
            int frequency = entry.incrementFrequency();
            return new Lookup<>(entry.getValue(), frequency >= transformThreshold);
        } finally {
            lock.unlock();
        }
    }

    int transformThreshold() {
        return transformThreshold;
    }

    @Override
    void onInsert(Entry<K, V> entry) {
        mainList.pushBack(entry);
    }

    @Override
    void onUpdate(Entry<K, V> entry) {
        mainList.moveToBack(entry);
    }

    @Override
    void onRemove(Entry<K, V> entry) {
        mainList.remove(entry);
    }

    @Override
    Entry<K, V> pollVictim() {
        return mainList.pollOldest();
    }

    @Override
    void clearOrdering() {
        mainList.clear();
    }

    /**
     * A hit from the recency part: the value plus whether the key is now frequent enough to be
     * tracked by the frequency part as well.
     */
    static final class Lookup<V> {
        private final V value;
        private final boolean shouldPromote;

        Lookup(V value, boolean shouldPromote) {
            this.value = value;
            this.shouldPromote = shouldPromote;
        }

        V value() {
            return value;
        }

        boolean shouldPromote() {
            return shouldPromote;
        }
    }
}
