package com.github.rudygunawan.adaptive.example;

import com.github.rudygunawan.adaptive.api.Cache;
import com.github.rudygunawan.adaptive.builder.CacheBuilder;
import com.github.rudygunawan.adaptive.policy.EvictionPolicy;

import java.util.Random;

/**
 * Replays three synthetic workloads against every eviction policy and prints the hit rates.
 *
 * <ul>
 *   <li><b>Hot data</b>: 70% of requests go to 20 hot keys, the rest to 5000 cold keys.</li>
 *   <li><b>Loop scan</b>: a sequential scan over 500 keys mixed with random reads, 10% of them
 *       outside the scanned range.</li>
 *   <li><b>Workload shift</b>: five phases (hot set, wide random, sequential, local groups, mixed)
 *       against a tiny cache, with a random 30% of reads followed by a write.</li>
 * </ul>
 */
public class PolicyComparisonExample {

    private static final long SEED = 42L;

    public static void main(String[] args) {
        System.out.println("=== Eviction Policy Comparison ===\n");

        System.out.println("1. Hot Data Access (capacity 50)");
        System.out.println("-------------------------------");
        for (EvictionPolicy policy : EvictionPolicy.values()) {
            double hitRate = hotData(newCache(policy, 50), 500_000, new Random(SEED));
            printResult(policy, hitRate);
        }
        System.out.println();

        System.out.println("2. Loop Scan (capacity 50)");
        System.out.println("--------------------------");
        for (EvictionPolicy policy : EvictionPolicy.values()) {
            double hitRate = loopScan(newCache(policy, 50), 200_000, new Random(SEED));
            printResult(policy, hitRate);
        }
        System.out.println();

        System.out.println("3. Workload Shift (capacity 4)");
        System.out.println("------------------------------");
        for (EvictionPolicy policy : EvictionPolicy.values()) {
            double hitRate = workloadShift(newCache(policy, 4), 80_000, new Random(SEED));
            printResult(policy, hitRate);
        }
        System.out.println();
    }

    static Cache<Integer, String> newCache(EvictionPolicy policy, int capacity) {
        return CacheBuilder.newBuilder()
                .maximumSize(capacity)
                .evictionPolicy(policy)
                .recordStats()
                .build();
    }

    /**
     * Writes {@code operations} keys drawn from a hot/cold mix, then reads the same number of keys
     * from the same mix.
     *
     * @return the fraction of reads that hit
     */
    public static double hotData(Cache<Integer, String> cache, int operations, Random random) {
        final int hotKeys = 20;
        final int coldKeys = 5000;

        for (int op = 0; op < operations; op++) {
            int key = op % 100 < 70 ? random.nextInt(hotKeys) : hotKeys + random.nextInt(coldKeys);
            cache.put(key, "value" + key);
        }

        int hits = 0;
        for (int op = 0; op < operations; op++) {
            int key = op % 100 < 70 ? random.nextInt(hotKeys) : hotKeys + random.nextInt(coldKeys);
            if (cache.getIfPresent(key) != null) {
                hits++;
            }
        }
        return ratio(hits, operations);
    }

    /**
     * Fills the cache with a 500-key loop, then reads: 60% sequential, 30% random inside the loop,
     * 10% outside it.
     *
     * @return the fraction of reads that hit
     */
    public static double loopScan(Cache<Integer, String> cache, int operations, Random random) {
        final int loopSize = 500;

        for (int key = 0; key < loopSize; key++) {
            cache.put(key, "loop" + key);
        }

        int hits = 0;
        int position = 0;
        for (int op = 0; op < operations; op++) {
            int key;
            if (op % 100 < 60) {
                key = position;
                position = (position + 1) % loopSize;
            } else if (op % 100 < 90) {
                key = random.nextInt(loopSize);
            } else {
                key = loopSize + random.nextInt(loopSize);
            }
            if (cache.getIfPresent(key) != null) {
                hits++;
            }
        }
        return ratio(hits, operations);
    }

    /**
     * Seeds 1000 keys, then runs five equal phases of reads with a different access pattern each.
     * Roughly 30% of reads are followed by a write of the same key.
     *
     * @return the fraction of reads that hit
     */
    public static double workloadShift(Cache<Integer, String> cache, int operations, Random random) {
        final int phase = Math.max(1, operations / 5);

        for (int key = 0; key < 1000; key++) {
            cache.put(key, "init" + key);
        }

        int hits = 0;
        for (int op = 0; op < operations; op++) {
            int key;
            if (op < phase) {
                key = random.nextInt(5);
            } else if (op < phase * 2) {
                key = random.nextInt(1000);
            } else if (op < phase * 3) {
                key = (op - phase * 2) % 100;
            } else if (op < phase * 4) {
                int group = (op / 1000) % 10;
                key = group * 20 + random.nextInt(20);
            } else {
                int r = random.nextInt(100);
                if (r < 30) {
                    key = random.nextInt(5);
                } else if (r < 60) {
                    key = 5 + random.nextInt(95);
                } else {
                    key = 100 + random.nextInt(900);
                }
            }

            if (cache.getIfPresent(key) != null) {
                hits++;
            }
            if (random.nextInt(100) < 30) {
                cache.put(key, "new" + key);
            }
        }
        return ratio(hits, operations);
    }

    private static double ratio(int hits, int operations) {
        return operations == 0 ? 0.0 : (double) hits / operations;
    }

    private static void printResult(EvictionPolicy policy, double hitRate) {
        System.out.printf("  %-6s hit rate: %6.2f%%%n", policy, hitRate * 100);
    }
}
