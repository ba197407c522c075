package com.github.rudygunawan.adaptive.metrics;

import com.github.rudygunawan.adaptive.api.Cache;
import com.github.rudygunawan.adaptive.impl.ArcCache;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;

/**
 * Micrometer integration for cache metrics.
 * Binds cache statistics to a MeterRegistry for monitoring and observability.
 *
 * <p>Exposes the following metrics:
 * <ul>
 *   <li>cache.size - Current number of resident entries; an ARC cache counts a key held by both
 *       of its parts twice
 *   <li>cache.capacity - Configured capacity
 *   <li>cache.hits - Total number of cache hits
 *   <li>cache.misses - Total number of cache misses
 *   <li>cache.evictions - Total number of evictions
 *   <li>cache.ghost.hits - Requests that found their key in a ghost list
 *   <li>cache.hit.ratio - Cache hit rate (0.0 to 1.0)
 *   <li>cache.arc.capacity - Current capacity of each ARC part, tagged {@code part=recency} and
 *       {@code part=frequency} (ARC caches only)
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * ArcCache<String, User> cache = new ArcCache<>(1000, 2, true, null);
 *
 * MicrometerCacheMetrics.monitor(registry, cache, "userCache");
 * }</pre>
 */
public class MicrometerCacheMetrics implements MeterBinder {

    private final CacheMetrics cache;
    private final String cacheName;
    private final Iterable<Tag> tags;

    /**
     * Creates a new MicrometerCacheMetrics instance.
     *
     * @param cache the cache to monitor
     * @param cacheName the name of the cache for metric tags
     * @param tags additional tags to apply to all metrics
     */
    public MicrometerCacheMetrics(CacheMetrics cache, String cacheName, Iterable<Tag> tags) {
        this.cache = cache;
        this.cacheName = cacheName;
        this.tags = tags;
    }

    /**
     * Convenience method to monitor a cache with Micrometer.
     *
     * @param registry the meter registry
     * @param cache the cache to monitor
     * @param cacheName the name of the cache
     * @param <C> the cache type
     * @return the cache (for chaining)
     */
    public static <C extends Cache<?, ?> & CacheMetrics> C monitor(
            MeterRegistry registry, C cache, String cacheName) {
        return monitor(registry, cache, cacheName, Collections.emptyList());
    }

    /**
     * Convenience method to monitor a cache with Micrometer with additional tags.
     *
     * @param registry the meter registry
     * @param cache the cache to monitor
     * @param cacheName the name of the cache
     * @param tags additional tags
     * @param <C> the cache type
     * @return the cache (for chaining)
     */
    public static <C extends Cache<?, ?> & CacheMetrics> C monitor(
            MeterRegistry registry, C cache, String cacheName, Iterable<Tag> tags) {
        new MicrometerCacheMetrics(cache, cacheName, tags).bindTo(registry);
        return cache;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("cache", cacheName).and(tags);

        Gauge.builder("cache.size", cache, CacheMetrics::size)
                .tags(allTags)
                .description("Current number of resident entries in the cache, counting each internal copy")
                .register(registry);

        Gauge.builder("cache.capacity", cache, CacheMetrics::capacity)
                .tags(allTags)
                .description("Configured capacity of the cache")
                .register(registry);

        FunctionCounter.builder("cache.hits", cache, CacheMetrics::hitCount)
                .tags(allTags)
                .description("Total number of cache hits")
                .register(registry);

        FunctionCounter.builder("cache.misses", cache, CacheMetrics::missCount)
                .tags(allTags)
                .description("Total number of cache misses")
                .register(registry);

        FunctionCounter.builder("cache.evictions", cache, CacheMetrics::evictionCount)
                .tags(allTags)
                .description("Total number of cache evictions")
                .register(registry);

        FunctionCounter.builder("cache.ghost.hits", cache, CacheMetrics::ghostHitCount)
                .tags(allTags)
                .description("Requests whose key was found in a ghost list of recently evicted keys")
                .register(registry);

        Gauge.builder("cache.hit.ratio", cache, CacheMetrics::hitRatio)
                .tags(allTags)
                .description("Cache hit ratio (0.0 to 1.0)")
                .register(registry);

        if (cache instanceof ArcCache) {
            ArcCache<?, ?> arc = (ArcCache<?, ?>) cache;

            Gauge.builder("cache.arc.capacity", arc, ArcCache::recencyCapacity)
                    .tags(allTags.and("part", "recency"))
                    .description("Current capacity of the ARC recency part")
                    .register(registry);

            Gauge.builder("cache.arc.capacity", arc, ArcCache::frequencyCapacity)
                    .tags(allTags.and("part", "frequency"))
                    .description("Current capacity of the ARC frequency part")
                    .register(registry);
        }
    }
}
