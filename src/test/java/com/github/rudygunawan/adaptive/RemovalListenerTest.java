package com.github.rudygunawan.adaptive;

import com.github.rudygunawan.adaptive.api.Cache;
import com.github.rudygunawan.adaptive.builder.CacheBuilder;
import com.github.rudygunawan.adaptive.listener.RemovalListener;
import com.github.rudygunawan.adaptive.policy.EvictionPolicy;
import com.github.rudygunawan.adaptive.policy.RemovalCause;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for removal notifications across policies.
 */
class RemovalListenerTest {

    @Test
    void testEvictionNotifiesWithSizeCause() {
        List<String> removed = new ArrayList<>();
        RemovalListener<String, String> listener = (key, value, cause) -> removed.add(key + "=" + value + ":" + cause);

        Cache<String, String> cache = CacheBuilder.newBuilder()
                .maximumSize(2)
                .removalListener(listener)
                .build();
        cache.put("a", "1");
        cache.put("b", "2");
        cache.put("c", "3");

        assertEquals(List.of("a=1:SIZE"), removed);
        assertTrue(RemovalCause.SIZE.wasEvicted());
    }

    @Test
    void testInvalidateNotifiesWithExplicitCause() {
        List<RemovalCause> causes = new ArrayList<>();
        RemovalListener<String, String> listener = (key, value, cause) -> causes.add(cause);

        Cache<String, String> cache = CacheBuilder.newBuilder()
                .maximumSize(4)
                .evictionPolicy(EvictionPolicy.LFU)
                .removalListener(listener)
                .build();
        cache.put("a", "1");
        cache.put("b", "2");
        cache.invalidate("a");
        cache.invalidateAll();

        assertEquals(List.of(RemovalCause.EXPLICIT, RemovalCause.EXPLICIT), causes);
        assertFalse(RemovalCause.EXPLICIT.wasEvicted());
    }

    @Test
    void testArcPartsNotifyIndependently() {
        List<String> evicted = new ArrayList<>();
        RemovalListener<Integer, String> listener = (key, value, cause) -> {
            if (cause.wasEvicted()) {
                evicted.add("k" + key);
            }
        };

        Cache<Integer, String> cache = CacheBuilder.newBuilder()
                .maximumSize(2)
                .evictionPolicy(EvictionPolicy.ARC)
                .removalListener(listener)
                .build();
        cache.put(1, "a");
        cache.put(2, "b");
        cache.put(3, "c");

        // key 1 leaves the recency part and the frequency part
        assertEquals(List.of("k1", "k1"), evicted);
    }

    @Test
    void testListenerExceptionIsSwallowed() {
        RemovalListener<String, String> listener = (key, value, cause) -> {
            throw new IllegalStateException("listener failure");
        };

        Cache<String, String> cache = CacheBuilder.newBuilder()
                .maximumSize(1)
                .removalListener(listener)
                .build();
        cache.put("a", "1");

        assertDoesNotThrow(() -> cache.put("b", "2"));
        assertEquals("2", cache.getIfPresent("b"));
        assertNull(cache.getIfPresent("a"));
    }

    @Test
    void testListenerMayWriteBackIntoCache() {
        for (EvictionPolicy policy : new EvictionPolicy[] {EvictionPolicy.LRU, EvictionPolicy.LFU}) {
            AtomicReference<Cache<String, String>> self = new AtomicReference<>();
            AtomicBoolean wroteBack = new AtomicBoolean(false);
            List<Long> sizesSeen = new ArrayList<>();
            RemovalListener<String, String> listener = (key, value, cause) -> {
                sizesSeen.add(self.get().size());
                if (wroteBack.compareAndSet(false, true)) {
                    self.get().put("c", "3");
                }
            };

            Cache<String, String> cache = CacheBuilder.newBuilder()
                    .maximumSize(1)
                    .evictionPolicy(policy)
                    .removalListener(listener)
                    .build();
            self.set(cache);
            cache.put("a", "1");
            cache.put("b", "2");

            assertEquals(1, cache.size(), policy.name());
            assertEquals("3", cache.getIfPresent("c"), policy.name());
            assertNull(cache.getIfPresent("b"), policy.name());
            // a and then b were evicted; each callback saw a consistent, bounded cache
            assertEquals(2, sizesSeen.size(), policy.name());
            for (long size : sizesSeen) {
                assertTrue(size <= cache.capacity(), policy.name());
            }
        }
    }

    @Test
    void testNullListenerRejected() {
        assertThrows(NullPointerException.class,
                () -> CacheBuilder.newBuilder().removalListener(null));
    }
}
