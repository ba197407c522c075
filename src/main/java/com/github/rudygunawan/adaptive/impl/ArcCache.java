package com.github.rudygunawan.adaptive.impl;

import com.github.rudygunawan.adaptive.api.Cache;
import com.github.rudygunawan.adaptive.listener.RemovalListener;
import com.github.rudygunawan.adaptive.metrics.CacheMetrics;
import com.github.rudygunawan.adaptive.model.CacheStats;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Adaptive Replacement Cache built from a recency part ({@link ArcLruPart}) and a frequency part
 * ({@link ArcLfuPart}), each starting with the full configured capacity and each keeping a ghost
 * list of the keys it evicted.
 *
 * <p><b>Request flow:</b>
 * <ul>
 *   <li>Every {@code put} and {@code get} first checks both ghost lists. A hit in the recency
 *       ghost list asks the frequency part to give up one unit of capacity and, if it could, grows
 *       the recency part by one. A hit in the frequency ghost list works the other way round.</li>
 *   <li>{@code put} of a key that was in neither ghost list is written to the recency part and,
 *       if that succeeded, to the frequency part as well. A key returning from a ghost list is only
 *       admitted to the recency part; if the frequency part still holds a copy, that copy's value
 *       is replaced without counting an access.</li>
 *   <li>{@code get} asks the recency part first. A hit that crosses the transform threshold is
 *       mirrored into the frequency part. A recency miss falls through to the frequency part.</li>
 * </ul>
 *
 * <p><b>Capacity transfer</b> is a soft invariant: the combined capacity of the two parts only
 * changes in coupled -1/+1 steps, and a part already at capacity 0 cannot give anything up, in
 * which case no transfer happens. That outcome is normal and is not compensated by an eviction.
 *
 * <p><b>Thread safety:</b> this class holds no lock of its own. Each part serializes its own
 * operations, so every step is atomic within its part, but a request that touches both parts is
 * not atomic as a whole; a concurrent {@code put} of the same key may interleave between the
 * recency and frequency steps of a {@code get}.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class ArcCache<K, V> implements Cache<K, V>, CacheMetrics {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.adaptive.Cache");

    /** Default number of reads after which a recency entry is mirrored into the frequency part. */
    public static final int DEFAULT_TRANSFORM_THRESHOLD = 2;

    private final int capacity;
    private final ArcLruPart<K, V> recencyPart;
    private final ArcLfuPart<K, V> frequencyPart;
    private final StatsCounter stats;
    private final AtomicLong capacityTransfers = new AtomicLong(0);

    public ArcCache(int capacity) {
        this(capacity, DEFAULT_TRANSFORM_THRESHOLD, false, null);
    }

    public ArcCache(int capacity, int transformThreshold) {
        this(capacity, transformThreshold, false, null);
    }

    /**
     * Creates an ARC cache.
     *
     * @param capacity the initial capacity of each part; a value of 0 or less disables caching
     * @param transformThreshold the access count at which a recency entry is mirrored into the
     *                           frequency part
     * @param recordStats whether to record hits and misses
     * @param removalListener listener notified of evictions and invalidations, or {@code null}
     */
    public ArcCache(int capacity, int transformThreshold, boolean recordStats,
                    RemovalListener<? super K, ? super V> removalListener) {
        if (capacity <= 0) {
            LOGGER.warning("ARC cache created with capacity " + capacity + "; every put will be ignored");
        }
        this.capacity = Math.max(0, capacity);
        this.stats = new StatsCounter(recordStats);
        RemovalNotifier<K, V> notifier = new RemovalNotifier<>(removalListener);
        this.recencyPart = new ArcLruPart<>(this.capacity, transformThreshold, stats, notifier);
        this.frequencyPart = new ArcLfuPart<>(this.capacity, stats, notifier);
    }

    @Override
    public boolean put(K key, V value) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");

        boolean inGhost = checkGhostCaches(key);
        boolean written = recencyPart.put(key, value);
        if (written && !inGhost) {
            frequencyPart.put(key, value);
            return true;
        }
        // a copy left in the frequency part must not outlive this write
        boolean updated = frequencyPart.updateIfPresent(key, value);
        return written || updated;
    }

    @Override
    public V getIfPresent(K key) {
        Objects.requireNonNull(key, "key cannot be null");

        checkGhostCaches(key);

        ArcLruPart.Lookup<V> lookup = recencyPart.get(key);
        if (lookup != null) {
            if (lookup.shouldPromote()) {
                frequencyPart.put(key, lookup.value());
            }
            stats.recordHit();
            return lookup.value();
        }

        V value = frequencyPart.get(key);
        if (value != null) {
            stats.recordHit();
        } else {
            stats.recordMiss();
        }
        return value;
    }

    @Override
    public void invalidate(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        recencyPart.invalidate(key);
        frequencyPart.invalidate(key);
    }

    @Override
    public void invalidateAll() {
        recencyPart.purge();
        frequencyPart.purge();
    }

    /**
     * Returns the number of resident entries across both parts. A key mirrored into both parts is
     * counted twice.
     */
    @Override
    public long size() {
        return (long) recencyPart.size() + frequencyPart.size();
    }

    /**
     * Returns the initial capacity of each part. The two parts together hold up to twice this many
     * entries, which is why {@link #size()} may exceed it.
     */
    @Override
    public int capacity() {
        return capacity;
    }

    /**
     * Returns the current capacity of the recency part.
     */
    public int recencyCapacity() {
        return recencyPart.capacity();
    }

    /**
     * Returns the current capacity of the frequency part.
     */
    public int frequencyCapacity() {
        return frequencyPart.capacity();
    }

    /**
     * Returns how many ghost hits have moved a unit of capacity from one part to the other.
     */
    public long capacityTransferCount() {
        return capacityTransfers.get();
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

    ArcLruPart<K, V> recencyPart() {
        return recencyPart;
    }

    ArcLfuPart<K, V> frequencyPart() {
        return frequencyPart;
    }

    /**
     * Checks the recency ghost list, then the frequency ghost list, and shifts capacity toward the
     * part whose ghost list was hit.
     *
     * @return whether the key was found in either ghost list
     */
    private boolean checkGhostCaches(K key) {
        if (recencyPart.checkGhost(key)) {
            stats.recordGhostHit();
            transferCapacity(frequencyPart, recencyPart);
            return true;
        }
        if (frequencyPart.checkGhost(key)) {
            stats.recordGhostHit();
            transferCapacity(recencyPart, frequencyPart);
            return true;
        }
        return false;
    }

    /**
     * Moves one unit of capacity from {@code donor} to {@code recipient}.
     *
     * @return {@code false} if the donor had no capacity left to give
     */
    private boolean transferCapacity(ArcPart<K, V> donor, ArcPart<K, V> recipient) {
        if (!donor.decreaseCapacity()) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("No capacity transfer: " + donor.name() + " part is already at capacity 0");
            }
            return false;
        }
        recipient.increaseCapacity();
        capacityTransfers.incrementAndGet();
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Transferred one unit of capacity from " + donor.name() + " to " +
                    recipient.name() + " part: recency=" + recencyPart.capacity() +
                    ", frequency=" + frequencyPart.capacity());
        }
        return true;
    }
}
