package com.github.rudygunawan.adaptive.impl;

import com.github.rudygunawan.adaptive.model.CacheStats;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LruCacheTest {

    @Test
    void testLeastRecentlyUsedIsEvicted() {
        LruCache<String, String> cache = new LruCache<>(2);
        cache.put("A", "a");
        cache.put("B", "b");
        cache.getIfPresent("A");
        cache.put("C", "c");

        assertNull(cache.getIfPresent("B"));
        assertEquals("a", cache.getIfPresent("A"));
        assertEquals("c", cache.getIfPresent("C"));
        assertEquals(1, cache.evictionCount());
    }

    @Test
    void testUpdateRefreshesRecency() {
        LruCache<String, String> cache = new LruCache<>(2);
        cache.put("A", "a");
        cache.put("B", "b");
        cache.put("A", "a2");
        cache.put("C", "c");

        assertEquals("a2", cache.getIfPresent("A"));
        assertFalse(cache.containsKey("B"));
    }

    @Test
    void testSizeNeverExceedsCapacity() {
        LruCache<Integer, Integer> cache = new LruCache<>(10);
        for (int i = 0; i < 100; i++) {
            cache.put(i, i);
            assertTrue(cache.size() <= 10);
        }
        assertEquals(10, cache.size());
        assertEquals(90, cache.evictionCount());
    }

    @Test
    void testInvalidate() {
        LruCache<String, String> cache = new LruCache<>(2);
        cache.put("A", "a");
        cache.invalidate("A");
        cache.invalidate("missing");

        assertNull(cache.getIfPresent("A"));
        assertEquals(0, cache.size());
    }

    @Test
    void testZeroCapacityIgnoresPuts() {
        LruCache<String, String> cache = new LruCache<>(0);
        assertFalse(cache.put("A", "a"));
        assertNull(cache.getIfPresent("A"));
        assertEquals(0, cache.capacity());
    }

    @Test
    void testStatsRecordedWhenEnabled() {
        LruCache<String, String> cache = new LruCache<>(2, true, null);
        cache.put("A", "a");
        cache.getIfPresent("A");
        cache.getIfPresent("B");

        CacheStats stats = cache.stats();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(0.5, stats.hitRate(), 0.0001);
    }

    @Test
    void testStatsNotRecordedByDefault() {
        LruCache<String, String> cache = new LruCache<>(2);
        cache.put("A", "a");
        cache.getIfPresent("A");

        assertEquals(0, cache.stats().requestCount());
        assertEquals(0.0, cache.hitRatio(), 0.0001);
    }
}
