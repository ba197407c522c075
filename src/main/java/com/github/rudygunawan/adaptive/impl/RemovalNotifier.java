package com.github.rudygunawan.adaptive.impl;

import com.github.rudygunawan.adaptive.listener.RemovalListener;
import com.github.rudygunawan.adaptive.policy.RemovalCause;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivers removal notifications to an optional {@link RemovalListener}, logging and swallowing
 * anything the listener throws.
 *
 * <p>Removals are queued while the owning policy holds its lock and delivered by
 * {@link #dispatch(ReentrantLock)} once the lock is released, so a listener always sees a cache
 * whose structures are consistent and may safely call back into it. A notification may be
 * delivered by whichever thread next releases the lock.
 */
final class RemovalNotifier<K, V> {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.adaptive.Cache");

    private final RemovalListener<? super K, ? super V> listener;
    private final Queue<Removal<K, V>> pending = new ConcurrentLinkedQueue<>();

    RemovalNotifier(RemovalListener<? super K, ? super V> listener) {
        this.listener = listener;
    }

    /**
     * Queues a notification. Caller holds the policy lock.
     */
    void enqueue(K key, V value, RemovalCause cause) {
        if (listener != null) {
            pending.add(new Removal<>(key, value, cause));
        }
    }

    /**
     * Delivers queued notifications unless the current thread still holds {@code lock}.
     */
    void dispatch(ReentrantLock lock) {
        if (listener == null || lock.isHeldByCurrentThread()) {
            return;
        }
        Removal<K, V> removal;
        while ((removal = pending.poll()) != null) {
            notify(removal.key, removal.value, removal.cause);
        }
    }

    private void notify(K key, V value, RemovalCause cause) {
        try {
            listener.onRemoval(key, value, cause);
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "RemovalListener threw exception for key: " + key +
                    ", cause: " + cause, e);
        }
    }

    private static final class Removal<K, V> {
        final K key;
        final V value;
        final RemovalCause cause;

        Removal(K key, V value, RemovalCause cause) {
            this.key = key;
            this.value = value;
            this.cause = cause;
        }
    }
}
