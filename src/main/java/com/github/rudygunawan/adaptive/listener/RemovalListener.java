package com.github.rudygunawan.adaptive.listener;

import com.github.rudygunawan.adaptive.policy.RemovalCause;

/**
 * A listener that receives notification when an entry is removed from a cache.
 *
 * <p>Implementations should be thread-safe. Notifications are delivered after the removing policy
 * has released its lock, so a listener may call back into the cache; a notification may arrive
 * on whichever thread next releases that lock.
 *
 * <p>Usage example:
 * <pre>{@code
 * Cache<String, Session> cache = CacheBuilder.newBuilder()
 *     .maximumSize(1000)
 *     .evictionPolicy(EvictionPolicy.ARC)
 *     .removalListener((String key, Session session, RemovalCause cause) -> {
 *         if (cause.wasEvicted()) {
 *             session.close();
 *         }
 *     })
 *     .build();
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
@FunctionalInterface
public interface RemovalListener<K, V> {

    /**
     * Notifies the listener that a removal occurred.
     *
     * <p>Exceptions thrown by this method are logged and swallowed.
     *
     * @param key the key of the removed entry
     * @param value the value of the removed entry
     * @param cause the reason for the removal
     */
    void onRemoval(K key, V value, RemovalCause cause);
}
