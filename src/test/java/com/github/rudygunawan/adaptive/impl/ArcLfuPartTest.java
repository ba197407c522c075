package com.github.rudygunawan.adaptive.impl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ArcLfuPartTest {

    private static ArcLfuPart<String, String> newPart(int capacity) {
        return new ArcLfuPart<>(capacity, new StatsCounter(true), new RemovalNotifier<>(null));
    }

    @Test
    void testEvictsLeastFrequent() {
        ArcLfuPart<String, String> part = newPart(2);
        part.put("a", "1");
        part.put("b", "2");
        part.get("a");

        part.put("c", "3");

        assertTrue(part.containsKey("a"));
        assertFalse(part.containsKey("b"));
        assertTrue(part.inGhost("b"));
    }

    @Test
    void testTiesBrokenByAge() {
        ArcLfuPart<String, String> part = newPart(2);
        part.put("a", "1");
        part.put("b", "2");

        part.put("c", "3");

        assertTrue(part.inGhost("a"));
        assertTrue(part.containsKey("b"));
    }

    @Test
    void testUpdateCountsAsAccess() {
        ArcLfuPart<String, String> part = newPart(2);
        part.put("a", "1");
        part.put("a", "2");

        assertEquals(2, part.frequencyOf("a"));
        assertEquals("2", part.get("a"));
        assertEquals(3, part.frequencyOf("a"));
    }

    @Test
    void testMinFrequencyTracksResidents() {
        ArcLfuPart<String, String> part = newPart(3);
        assertEquals(0, part.minFrequency());

        part.put("a", "1");
        part.get("a");
        assertEquals(2, part.minFrequency());

        part.put("b", "2");
        assertEquals(1, part.minFrequency());
    }

    @Test
    void testDecreaseCapacityEvictsLeastFrequent() {
        ArcLfuPart<String, String> part = newPart(2);
        part.put("a", "1");
        part.put("b", "2");
        part.get("b");

        assertTrue(part.decreaseCapacity());

        assertEquals(1, part.capacity());
        assertTrue(part.inGhost("a"));
        assertTrue(part.containsKey("b"));
    }

    @Test
    void testInvalidateRemovesResidentAndGhost() {
        ArcLfuPart<String, String> part = newPart(1);
        part.put("a", "1");
        part.put("b", "2");

        part.invalidate("a");
        part.invalidate("b");

        assertFalse(part.inGhost("a"));
        assertFalse(part.containsKey("b"));
        assertEquals(0, part.size());
    }
}
