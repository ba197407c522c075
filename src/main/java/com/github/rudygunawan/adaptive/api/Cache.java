package com.github.rudygunawan.adaptive.api;

import com.github.rudygunawan.adaptive.model.CacheStats;

/**
 * A bounded, in-memory mapping from keys to values. Entries are added with
 * {@link #put(Object, Object)} and stay until the cache's replacement policy evicts them or they
 * are manually invalidated.
 *
 * <p>Every policy in this library (LRU, LRU-K, LFU, ARC) and the sharded wrapper implement this
 * interface, so they can be swapped without touching calling code.
 *
 * <p>Implementations are thread-safe. Null keys and null values are not permitted, so a
 * {@code null} result from a lookup always means the key is absent.
 *
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of mapped values
 */
public interface Cache<K, V> {

    /**
     * Associates {@code value} with {@code key} in this cache. If the cache previously contained a
     * value associated with {@code key}, the old value is replaced by {@code value}.
     *
     * @param key the key with which the specified value is to be associated
     * @param value the value to be associated with the specified key
     * @return {@code false} if the cache has no capacity to hold the entry, {@code true} otherwise
     * @throws NullPointerException if the key or value is null
     */
    boolean put(K key, V value);

    /**
     * Returns the value associated with {@code key} in this cache, or {@code null} if there is no
     * cached value for {@code key}. A hit counts as an access for the replacement policy.
     *
     * @param key the key whose associated value is to be returned
     * @return the value to which the specified key is mapped, or {@code null} if this cache
     *         contains no mapping for the key
     * @throws NullPointerException if the key is null
     */
    V getIfPresent(K key);

    /**
     * Returns the value associated with {@code key}, or {@code defaultValue} on a miss.
     *
     * @param key the key whose associated value is to be returned
     * @param defaultValue the value to return when the key is absent
     * @return the cached value, or {@code defaultValue}
     */
    default V getOrDefault(K key, V defaultValue) {
        V value = getIfPresent(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Discards any cached value for key {@code key}, including its ghost history if the policy
     * keeps one.
     *
     * @param key the key whose mapping is to be removed from the cache
     */
    void invalidate(K key);

    /**
     * Discards all entries and all ghost history, returning the cache to its initial state.
     */
    void invalidateAll();

    /**
     * Returns the approximate number of resident entries in this cache.
     *
     * <p>This counts entries held by the policy's internal structures, not distinct keys. A policy
     * that tracks a key in more than one structure counts every copy: an ARC cache keeps a
     * frequently read key in both of its parts, so its size can reach twice {@link #capacity()}.
     *
     * @return the number of resident entries, counting each internal copy of a key
     */
    long size();

    /**
     * Returns the configured capacity of this cache.
     */
    int capacity();

    /**
     * Returns a current snapshot of this cache's cumulative statistics.
     *
     * @return the cache statistics
     */
    CacheStats stats();
}
