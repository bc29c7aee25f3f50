package com.github.rudygunawan.slotcache.metrics;

/**
 * Interface for cache implementations to provide metrics data.
 * This is used by MicrometerCacheMetrics to collect and expose metrics.
 */
public interface CacheMetrics {

    /**
     * Returns the current number of entries in the cache.
     */
    long entryCount();

    /**
     * Returns the maximum number of entries the cache can hold.
     */
    long maximumEntries();

    /**
     * Returns the number of counted lookups.
     */
    long lookupCount();

    /**
     * Returns the number of counted lookups that missed, expired ones included.
     */
    long missCount();

    /**
     * Returns the number of counted lookups that found a live entry.
     */
    default long hitCount() {
        return Math.max(0, lookupCount() - missCount());
    }

    /**
     * Returns the number of lookups that found an expired entry. Zero for caches without expiry.
     */
    default long expiredCount() {
        return 0;
    }

    /**
     * Returns the total number of size evictions.
     */
    long evictionCount();

    /**
     * Returns the total number of successful loads. Zero for caches without a loader.
     */
    default long loadSuccessCount() {
        return 0;
    }

    /**
     * Returns the total number of failed loads. Zero for caches without a loader.
     */
    default long loadFailureCount() {
        return 0;
    }

    /**
     * Returns how full the cache is, from 0.0 to 1.0.
     */
    default double fillRatio() {
        long max = maximumEntries();
        return max == 0 ? 0.0 : (double) entryCount() / max;
    }
}
