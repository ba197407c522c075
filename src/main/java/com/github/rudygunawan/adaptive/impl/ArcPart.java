package com.github.rudygunawan.adaptive.impl;

import com.github.rudygunawan.adaptive.model.Entry;
import com.github.rudygunawan.adaptive.model.OrderedList;
import com.github.rudygunawan.adaptive.policy.RemovalCause;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One half of an {@link ArcCache}: a capacity-bounded main index plus a ghost list of keys it
 * recently evicted. Subclasses decide how resident entries are ordered and which one is the
 * victim; everything else (ghost bookkeeping, capacity transfer, locking) lives here.
 *
 * <p>All state is guarded by a single {@link ReentrantLock}, so {@code put}, {@code get},
 * {@code checkGhost} and the capacity mutators are atomic with respect to each other on the same
 * part. Nothing spans both parts of an ARC cache.
 *
 * <p>Within one part a key is either resident, a ghost, or absent, never two at once. The ghost
 * capacity is fixed at the initial capacity and does not shrink with capacity transfers.
 */
abstract class ArcPart<K, V> {
    static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.adaptive.Cache");

    final ReentrantLock lock = new ReentrantLock();
    final Map<K, Entry<K, V>> mainIndex = new HashMap<>();

    private final Map<K, Entry<K, V>> ghostIndex = new HashMap<>();
    private final OrderedList<K, V> ghostList = new OrderedList<>();
    private final String name;
    private final int initialCapacity;
    private final int ghostCapacity;
    private final StatsCounter stats;
    private final RemovalNotifier<K, V> notifier;
    private int capacity;

    ArcPart(String name, int capacity, StatsCounter stats, RemovalNotifier<K, V> notifier) {
        this.name = name;
        this.initialCapacity = Math.max(0, capacity);
        this.ghostCapacity = this.initialCapacity;
        this.capacity = this.initialCapacity;
        this.stats = stats;
        this.notifier = notifier;
    }

    /** Links a newly created entry into the ordering. */
    abstract void onInsert(Entry<K, V> entry);

    /** Records a write to a resident entry. */
    abstract void onUpdate(Entry<K, V> entry);

    /** Unlinks an entry that is leaving the main index. */
    abstract void onRemove(Entry<K, V> entry);

    /** Unlinks and returns the next entry to evict, or {@code null} if none is resident. */
    abstract Entry<K, V> pollVictim();

    /** Drops every entry from the ordering. */
    abstract void clearOrdering();

    /**
     * Inserts or updates a resident entry, evicting one entry into the ghost list first if the
     * part is full. A ghost for the same key is discarded without a capacity signal.
     *
     * @return {@code false} if the part currently has zero capacity
     */
    boolean put(K key, V value) {
        lock.lock();
        try {
            if (capacity == 0) {
                return false;
            }
            Entry<K, V> entry = mainIndex.get(key);
            if (entry != null) {
                entry.setValue(value);
                onUpdate(entry);
                return true;
            }
            removeGhost(key);
            if (mainIndex.size() >= capacity) {
                evict();
            }
            entry = new Entry<>(key, value);
            mainIndex.put(key, entry);
            onInsert(entry);
            return true;
        } finally {
            lock.unlock();
            notifier.dispatch(lock);
        }
    }

    /**
     * Consumes the ghost entry for {@code key} if there is one.
     *
     * @return {@code true} on a ghost hit
     */
    boolean checkGhost(K key) {
        lock.lock();
        try {
            boolean hit = removeGhost(key);
            if (hit && LOGGER.isLoggable(Level.FINER)) {
                LOGGER.finer("Ghost hit in " + name + " part: key=" + key);
            }
            return hit;
        } finally {
            lock.unlock();
        }
    }

    void increaseCapacity() {
        lock.lock();
        try {
            capacity++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gives up one unit of capacity, evicting first if the part is exactly full.
     *
     * @return {@code false} if the capacity is already 0 and nothing was given up
     */
    boolean decreaseCapacity() {
        lock.lock();
        try {
            if (capacity <= 0) {
                return false;
            }
            if (mainIndex.size() == capacity) {
                evict();
            }
            capacity--;
            return true;
        } finally {
            lock.unlock();
            notifier.dispatch(lock);
        }
    }

    /**
     * Removes the key from both the main index and the ghost list.
     */
    void invalidate(K key) {
        lock.lock();
        try {
            Entry<K, V> entry = mainIndex.remove(key);
            if (entry != null) {
                onRemove(entry);
                notifier.enqueue(key, entry.getValue(), RemovalCause.EXPLICIT);
            }
            removeGhost(key);
        } finally {
            lock.unlock();
            notifier.dispatch(lock);
        }
    }

    /**
     * Clears all entries and ghosts and restores the initial capacity.
     */
    void purge() {
        lock.lock();
        try {
            List<Entry<K, V>> removed = new ArrayList<>(mainIndex.values());
            mainIndex.clear();
            clearOrdering();
            ghostIndex.clear();
            ghostList.clear();
            capacity = initialCapacity;
            for (Entry<K, V> entry : removed) {
                notifier.enqueue(entry.getKey(), entry.getValue(), RemovalCause.EXPLICIT);
            }
        } finally {
            lock.unlock();
            notifier.dispatch(lock);
        }
    }

    int size() {
        lock.lock();
        try {
            return mainIndex.size();
        } finally {
            lock.unlock();
        }
    }

    int capacity() {
        lock.lock();
        try {
            return capacity;
        } finally {
            lock.unlock();
        }
    }

    int ghostSize() {
        lock.lock();
        try {
            return ghostIndex.size();
        } finally {
            lock.unlock();
        }
    }

    int ghostCapacity() {
        return ghostCapacity;
    }

    boolean containsKey(K key) {
        lock.lock();
        try {
            return mainIndex.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    boolean inGhost(K key) {
        lock.lock();
        try {
            return ghostIndex.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    String name() {
        return name;
    }

    private void evict() {
        Entry<K, V> victim = pollVictim();
        if (victim == null) {
            return;
        }
        K key = victim.getKey();
        mainIndex.remove(key);
        addGhost(key);
        stats.recordEviction();
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Evicted entry from " + name + " part to ghost list: key=" + key +
                    ", frequency=" + victim.getFrequency() + ", capacity=" + capacity);
        }
        notifier.enqueue(key, victim.getValue(), RemovalCause.SIZE);
    }

    private void addGhost(K key) {
        if (ghostCapacity == 0) {
            return;
        }
        if (ghostIndex.size() >= ghostCapacity) {
            Entry<K, V> oldest = ghostList.pollOldest();
            ghostIndex.remove(oldest.getKey());
        }
        Entry<K, V> ghost = Entry.ghostOf(key);
        ghostList.pushBack(ghost);
        ghostIndex.put(key, ghost);
    }

    private boolean removeGhost(K key) {
        Entry<K, V> ghost = ghostIndex.remove(key);
        if (ghost == null) {
            return false;
        }
        ghostList.remove(ghost);
        return true;
    }
}
