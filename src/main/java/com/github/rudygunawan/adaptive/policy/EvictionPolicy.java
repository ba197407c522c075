package com.github.rudygunawan.adaptive.policy;

/**
 * Replacement policy deciding which entry leaves the cache when it reaches its capacity.
 *
 * <p>Available policies:
 * <ul>
 *   <li>{@link #LRU} - Least Recently Used
 *   <li>{@link #LRU_K} - LRU with admission after K recorded accesses
 *   <li>{@link #LFU} - Least Frequently Used with counter aging
 *   <li>{@link #ARC} - Adaptive Replacement Cache (recency/frequency hybrid)
 * </ul>
 */
public enum EvictionPolicy {
    /**
     * Least Recently Used (LRU) - evicts the entry that has gone longest without access.
     * This is the default policy.
     */
    LRU,

    /**
     * LRU-K - keys are recorded in a bounded history list and only admitted to the main LRU once
     * they have been requested K times. One-off scans never reach the main list.
     */
    LRU_K,

    /**
     * Least Frequently Used (LFU) - evicts the entry with the lowest access count, oldest first
     * among ties. Counters are aged down whenever the mean frequency passes a ceiling so that
     * once-hot keys cannot pin the cache forever.
     */
    LFU,

    /**
     * Adaptive Replacement Cache - an LRU part and an LFU part, each with a ghost list of
     * recently evicted keys.
     *
     * <ul>
     *   <li>New keys enter through the LRU part</li>
     *   <li>Keys read often enough are mirrored into the LFU part</li>
     *   <li>A request that hits a ghost list moves one unit of capacity toward that part</li>
     * </ul>
     *
     * <p>Well suited to workloads whose balance between recency and frequency shifts over time.
     */
    ARC
}
