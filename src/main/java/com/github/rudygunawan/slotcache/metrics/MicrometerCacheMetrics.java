package com.github.rudygunawan.slotcache.metrics;

import com.github.rudygunawan.slotcache.api.OrderedCache;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;

/**
 * Micrometer integration for slot cache metrics.
 * Binds cache statistics to a MeterRegistry for monitoring and observability.
 *
 * <p>Exposes the following metrics:
 * <ul>
 *   <li>cache.size - Current number of entries
 *   <li>cache.capacity - Maximum number of entries
 *   <li>cache.lookups - Total number of counted lookups
 *   <li>cache.hits - Total number of cache hits
 *   <li>cache.misses - Total number of cache misses
 *   <li>cache.expired - Lookups that found an expired entry
 *   <li>cache.evictions - Total number of size evictions
 *   <li>cache.loads - Loads through a caching loader, tagged by result
 *   <li>cache.hit.ratio - Cache hit rate (0.0 to 1.0)
 *   <li>cache.fill.ratio - Size divided by capacity (0.0 to 1.0)
 * </ul>
 *
 * <p>Counters are read from the cache when the registry polls, so a cache guarded by a lock
 * should be monitored through a wrapper that takes the same lock.
 *
 * <p>Usage example:
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * ExpiringCache<OwnedBuffer> cache = CacheBuilder.newBuilder()
 *     .maximumSize(1000)
 *     .growableValues()
 *     .expireAfterCreate(60, TimeUnit.SECONDS)
 *     .buildExpiringLru();
 *
 * MicrometerCacheMetrics.monitorCache(registry, cache, "records");
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
    public static <C extends CacheMetrics> C monitor(MeterRegistry registry, C cache, String cacheName) {
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
    public static <C extends CacheMetrics> C monitor(
            MeterRegistry registry, C cache, String cacheName, Iterable<Tag> tags) {
        new MicrometerCacheMetrics(cache, cacheName, tags).bindTo(registry);
        return cache;
    }

    /**
     * Monitors a cache built by {@code CacheBuilder}. Every cache the builder creates reports
     * {@link CacheMetrics}.
     *
     * @param registry the meter registry
     * @param cache the cache to monitor
     * @param cacheName the name of the cache
     * @param <C> the cache type
     * @return the cache (for chaining)
     * @throws IllegalArgumentException if the cache does not report metrics
     */
    public static <C extends OrderedCache<?>> C monitorCache(MeterRegistry registry, C cache, String cacheName) {
        if (!(cache instanceof CacheMetrics)) {
            throw new IllegalArgumentException("cache does not report metrics: " + cache.getClass().getName());
        }
        new MicrometerCacheMetrics((CacheMetrics) cache, cacheName, Collections.emptyList()).bindTo(registry);
        return cache;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("cache", cacheName).and(tags);

        Gauge.builder("cache.size", cache, CacheMetrics::entryCount)
                .tags(allTags)
                .description("Current number of entries in the cache")
                .register(registry);

        Gauge.builder("cache.capacity", cache, CacheMetrics::maximumEntries)
                .tags(allTags)
                .description("Maximum number of entries in the cache")
                .register(registry);

        FunctionCounter.builder("cache.lookups", cache, CacheMetrics::lookupCount)
                .tags(allTags)
                .description("Total number of counted cache lookups")
                .register(registry);

        FunctionCounter.builder("cache.hits", cache, CacheMetrics::hitCount)
                .tags(allTags)
                .description("Total number of cache hits")
                .register(registry);

        FunctionCounter.builder("cache.misses", cache, CacheMetrics::missCount)
                .tags(allTags)
                .description("Total number of cache misses")
                .register(registry);

        FunctionCounter.builder("cache.expired", cache, CacheMetrics::expiredCount)
                .tags(allTags)
                .description("Number of lookups that found an expired entry")
                .register(registry);

        FunctionCounter.builder("cache.evictions", cache, CacheMetrics::evictionCount)
                .tags(allTags)
                .description("Total number of cache evictions")
                .register(registry);

        FunctionCounter.builder("cache.loads", cache, CacheMetrics::loadSuccessCount)
                .tags(allTags.and("result", "success"))
                .description("Number of successful cache loads")
                .register(registry);

        FunctionCounter.builder("cache.loads", cache, CacheMetrics::loadFailureCount)
                .tags(allTags.and("result", "failure"))
                .description("Number of failed cache loads")
                .register(registry);

        // Derived ratios
        Gauge.builder("cache.hit.ratio", cache, c -> {
                    long lookups = c.lookupCount();
                    return lookups == 0 ? 0.0 : (double) c.hitCount() / lookups;
                })
                .tags(allTags)
                .description("Cache hit ratio (0.0 to 1.0)")
                .register(registry);

        Gauge.builder("cache.fill.ratio", cache, CacheMetrics::fillRatio)
                .tags(allTags)
                .description("Fraction of the capacity in use (0.0 to 1.0)")
                .register(registry);
    }
}
