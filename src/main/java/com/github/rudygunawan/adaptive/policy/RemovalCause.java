package com.github.rudygunawan.adaptive.policy;

/**
 * The reason why a cached entry was removed.
 */
public enum RemovalCause {
    /**
     * The entry was manually removed by the user using {@code Cache#invalidate} or
     * {@code Cache#invalidateAll}.
     */
    EXPLICIT,

    /**
     * The entry was removed because its policy needed room for another entry, or because the
     * policy's capacity was reduced.
     */
    SIZE;

    /**
     * Returns {@code true} if the removal was caused by eviction rather than manual removal.
     */
    public boolean wasEvicted() {
        return this == SIZE;
    }
}
