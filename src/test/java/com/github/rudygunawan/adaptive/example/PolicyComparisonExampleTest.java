package com.github.rudygunawan.adaptive.example;

import com.github.rudygunawan.adaptive.api.Cache;
import com.github.rudygunawan.adaptive.policy.EvictionPolicy;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PolicyComparisonExampleTest {

    @Test
    void testHotDataFavoursFrequencyAwarePolicies() {
        double lru = PolicyComparisonExample.hotData(
                PolicyComparisonExample.newCache(EvictionPolicy.LRU, 50), 20_000, new Random(7));
        double lfu = PolicyComparisonExample.hotData(
                PolicyComparisonExample.newCache(EvictionPolicy.LFU, 50), 20_000, new Random(7));

        assertTrue(lru > 0.0 && lru < 1.0);
        // 70% of reads go to 20 hot keys, which a frequency policy keeps resident
        assertTrue(lfu > 0.6, "LFU hit rate was " + lfu);
    }

    @Test
    void testEveryPolicyReplaysEveryWorkload() {
        for (EvictionPolicy policy : EvictionPolicy.values()) {
            double hot = PolicyComparisonExample.hotData(
                    PolicyComparisonExample.newCache(policy, 50), 5_000, new Random(1));
            double loop = PolicyComparisonExample.loopScan(
                    PolicyComparisonExample.newCache(policy, 50), 5_000, new Random(1));
            double shift = PolicyComparisonExample.workloadShift(
                    PolicyComparisonExample.newCache(policy, 4), 10_000, new Random(1));

            assertTrue(hot >= 0.0 && hot <= 1.0, policy + " hot " + hot);
            assertTrue(loop >= 0.0 && loop <= 1.0, policy + " loop " + loop);
            assertTrue(shift >= 0.0 && shift <= 1.0, policy + " shift " + shift);
        }
    }

    @Test
    void testStatsMatchReplay() {
        Cache<Integer, String> cache = PolicyComparisonExample.newCache(EvictionPolicy.ARC, 50);
        double hitRate = PolicyComparisonExample.loopScan(cache, 2_000, new Random(3));

        assertEquals(2_000, cache.stats().requestCount());
        assertEquals(hitRate, cache.stats().hitRate(), 0.0001);
    }

    @Test
    void testSameSeedReplaysIdentically() {
        double first = PolicyComparisonExample.workloadShift(
                PolicyComparisonExample.newCache(EvictionPolicy.ARC, 4), 5_000, new Random(9));
        double second = PolicyComparisonExample.workloadShift(
                PolicyComparisonExample.newCache(EvictionPolicy.ARC, 4), 5_000, new Random(9));

        assertEquals(first, second);
    }
}
