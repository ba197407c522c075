package com.github.rudygunawan.adaptive;

import com.github.rudygunawan.adaptive.api.Cache;
import com.github.rudygunawan.adaptive.builder.CacheBuilder;
import com.github.rudygunawan.adaptive.impl.ArcCache;
import com.github.rudygunawan.adaptive.impl.LfuCache;
import com.github.rudygunawan.adaptive.impl.LruCache;
import com.github.rudygunawan.adaptive.impl.LruKCache;
import com.github.rudygunawan.adaptive.impl.ShardedCache;
import com.github.rudygunawan.adaptive.policy.EvictionPolicy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for building caches of every policy.
 */
class CacheBuilderTest {

    @Test
    void testDefaultPolicyIsLru() {
        Cache<String, String> cache = CacheBuilder.newBuilder()
                .maximumSize(10)
                .build();

        assertInstanceOf(LruCache.class, cache);
        assertEquals(10, cache.capacity());
    }

    @Test
    void testBuildsEveryPolicy() {
        Cache<String, String> lruK = CacheBuilder.newBuilder()
                .maximumSize(10)
                .evictionPolicy(EvictionPolicy.LRU_K)
                .admissionThreshold(3)
                .build();
        assertInstanceOf(LruKCache.class, lruK);
        assertEquals(3, ((LruKCache<String, String>) lruK).k());

        Cache<String, String> lfu = CacheBuilder.newBuilder()
                .maximumSize(10)
                .evictionPolicy(EvictionPolicy.LFU)
                .maxAverageFrequency(6)
                .build();
        assertInstanceOf(LfuCache.class, lfu);
        assertEquals(6, ((LfuCache<String, String>) lfu).maxAverageFrequency());

        Cache<String, String> arc = CacheBuilder.newBuilder()
                .maximumSize(10)
                .evictionPolicy(EvictionPolicy.ARC)
                .build();
        assertInstanceOf(ArcCache.class, arc);
        assertEquals(10, ((ArcCache<String, String>) arc).recencyCapacity());
        assertEquals(10, ((ArcCache<String, String>) arc).frequencyCapacity());
    }

    @Test
    void testTransformThresholdApplied() {
        Cache<String, String> cache = CacheBuilder.newBuilder()
                .maximumSize(4)
                .evictionPolicy(EvictionPolicy.ARC)
                .transformThreshold(3)
                .build();
        cache.put("a", "1");
        cache.put("b", "2");
        cache.put("c", "3");
        cache.put("d", "4");
        cache.put("e", "5");

        // a was evicted from both parts and comes back through the recency part only
        cache.put("a", "1");
        assertEquals("1", cache.getIfPresent("a"));
        assertEquals("1", cache.getIfPresent("a"));
    }

    @Test
    void testShardedBuild() {
        Cache<String, String> cache = CacheBuilder.newBuilder()
                .maximumSize(10)
                .evictionPolicy(EvictionPolicy.LFU)
                .shards(4)
                .build();

        assertInstanceOf(ShardedCache.class, cache);
        ShardedCache<String, String> sharded = (ShardedCache<String, String>) cache;
        assertEquals(4, sharded.shardCount());
        assertEquals(3, sharded.shardCapacity());
        assertInstanceOf(LfuCache.class, sharded.shard(0));

        cache.put("key", "value");
        assertEquals("value", cache.getIfPresent("key"));
    }

    @Test
    void testZeroShardsUsesProcessors() {
        Cache<String, String> cache = CacheBuilder.newBuilder()
                .maximumSize(64)
                .shards(0)
                .build();

        assertInstanceOf(ShardedCache.class, cache);
        assertEquals(Runtime.getRuntime().availableProcessors(),
                ((ShardedCache<String, String>) cache).shardCount());
    }

    @Test
    void testZeroSizeBuildsNoOpCache() {
        Cache<String, String> cache = CacheBuilder.newBuilder()
                .maximumSize(0)
                .evictionPolicy(EvictionPolicy.ARC)
                .build();

        assertFalse(cache.put("a", "1"));
        assertNull(cache.getIfPresent("a"));
    }

    @Test
    void testInvalidConfigurationRejected() {
        CacheBuilder<Object, Object> builder = CacheBuilder.newBuilder();

        assertThrows(IllegalArgumentException.class, () -> builder.maximumSize(-1));
        assertThrows(IllegalArgumentException.class, () -> builder.transformThreshold(0));
        assertThrows(IllegalArgumentException.class, () -> builder.maxAverageFrequency(0));
        assertThrows(IllegalArgumentException.class, () -> builder.historyCapacity(0));
        assertThrows(IllegalArgumentException.class, () -> builder.admissionThreshold(0));
        assertThrows(IllegalArgumentException.class, () -> builder.shards(-1));
        assertThrows(NullPointerException.class, () -> builder.evictionPolicy(null));
        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void testGettersReflectConfiguration() {
        CacheBuilder<Object, Object> builder = CacheBuilder.newBuilder()
                .maximumSize(100)
                .evictionPolicy(EvictionPolicy.LRU_K)
                .historyCapacity(50)
                .shards(2)
                .recordStats();

        assertEquals(100, builder.getMaximumSize());
        assertEquals(EvictionPolicy.LRU_K, builder.getEvictionPolicy());
        assertEquals(50, builder.getHistoryCapacity());
        assertEquals(2, builder.getShards());
        assertEquals(2, builder.getTransformThreshold());
        assertEquals(10, builder.getMaxAverageFrequency());
        assertEquals(2, builder.getAdmissionThreshold());
        assertTrue(builder.isRecordingStats());
    }

    @Test
    void testRecordStats() {
        Cache<String, String> cache = CacheBuilder.newBuilder()
                .maximumSize(10)
                .evictionPolicy(EvictionPolicy.ARC)
                .recordStats()
                .build();
        cache.put("a", "1");
        cache.getIfPresent("a");
        cache.getIfPresent("b");

        assertEquals(1, cache.stats().hitCount());
        assertEquals(1, cache.stats().missCount());
    }
}
