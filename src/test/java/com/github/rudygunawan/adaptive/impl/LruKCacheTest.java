package com.github.rudygunawan.adaptive.impl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LruKCacheTest {

    @Test
    void testSinglePutIsNotAdmitted() {
        LruKCache<String, String> cache = new LruKCache<>(2, 4, 2);
        assertTrue(cache.put("A", "a"));

        assertEquals(0, cache.size());
        assertEquals(1, cache.historySize());
        assertFalse(cache.containsKey("A"));
    }

    @Test
    void testSecondPutAdmits() {
        LruKCache<String, String> cache = new LruKCache<>(2, 4, 2);
        cache.put("A", "a");
        cache.put("A", "a2");

        assertEquals(1, cache.size());
        assertEquals(0, cache.historySize());
        assertEquals("a2", cache.getIfPresent("A"));
    }

    @Test
    void testMissedReadCompletesAdmission() {
        LruKCache<String, String> cache = new LruKCache<>(2, 4, 2, true, null);
        cache.put("A", "a");

        assertEquals("a", cache.getIfPresent("A"));
        assertTrue(cache.containsKey("A"));
        assertEquals(1, cache.hitCount());
    }

    @Test
    void testReadBeforeWriteCountsTowardAdmission() {
        LruKCache<String, String> cache = new LruKCache<>(2, 4, 2, true, null);
        assertNull(cache.getIfPresent("A"));
        assertEquals(1, cache.missCount());

        cache.put("A", "a");

        assertTrue(cache.containsKey("A"));
    }

    @Test
    void testOneShotScanDoesNotDisplaceResidents() {
        LruKCache<String, String> cache = new LruKCache<>(2, 4, 2);
        cache.put("A", "a");
        cache.put("A", "a");
        cache.put("B", "b");
        cache.put("B", "b");

        for (char c = 'C'; c <= 'Z'; c++) {
            cache.put(String.valueOf(c), "scan");
        }

        assertTrue(cache.containsKey("A"));
        assertTrue(cache.containsKey("B"));
        assertEquals(2, cache.size());
        assertEquals(4, cache.historySize());
    }

    @Test
    void testHistoryEvictionResetsCount() {
        LruKCache<String, String> cache = new LruKCache<>(2, 1, 2);
        cache.put("A", "a");
        cache.put("B", "b");
        cache.put("A", "a");

        assertFalse(cache.containsKey("A"));
        assertEquals(1, cache.historySize());
    }

    @Test
    void testInvalidateClearsHistory() {
        LruKCache<String, String> cache = new LruKCache<>(2, 4, 3);
        cache.put("A", "a");
        cache.put("A", "a");
        cache.invalidate("A");
        cache.put("A", "a");

        assertFalse(cache.containsKey("A"));
        assertEquals(1, cache.historySize());

        cache.invalidateAll();
        assertEquals(0, cache.historySize());
    }

    @Test
    void testAdmittedKeysFollowLruOrder() {
        LruKCache<String, String> cache = new LruKCache<>(2, 4, 1);
        cache.put("A", "a");
        cache.put("B", "b");
        cache.getIfPresent("A");
        cache.put("C", "c");

        assertTrue(cache.containsKey("A"));
        assertFalse(cache.containsKey("B"));
        assertEquals(1, cache.k());
    }
}
