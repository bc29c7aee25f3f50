package com.github.rudygunawan.slotcache.model;

import java.util.Objects;

/**
 * Statistics about the performance of an
 * {@link com.github.rudygunawan.slotcache.api.OrderedCache}. Instances of this class are
 * immutable.
 *
 * <p>Cache statistics are incremented according to the following rules:
 *
 * <ul>
 *   <li>Every lookup that tracks statistics increments {@code lookupCount}.
 *   <li>A lookup that does not find the key increments {@code missCount}.
 *   <li>A lookup that finds an entry older than its lifetime increments both
 *       {@code missCount} and {@code expiredCount}.
 *   <li>When an entry is displaced to make room for a new one, {@code evictionCount} is
 *       incremented.
 * </ul>
 *
 * <p>Lookup, miss and expiry counts are reset by {@code resetStats()}; the eviction count is not.
 */
public class CacheStats {
    private final long lookupCount;
    private final long missCount;
    private final long expiredCount;
    private final long evictionCount;

    /**
     * Constructs a new {@code CacheStats} instance.
     */
    public CacheStats(long lookupCount, long missCount, long expiredCount, long evictionCount) {
        this.lookupCount = lookupCount;
        this.missCount = missCount;
        this.expiredCount = expiredCount;
        this.evictionCount = evictionCount;
    }

    /**
     * Returns the number of lookups performed.
     */
    public long lookupCount() {
        return lookupCount;
    }

    /**
     * Returns the number of lookups that found a live entry. This is defined as
     * {@code lookupCount - missCount}.
     */
    public long hitCount() {
        return Math.max(0, lookupCount - missCount);
    }

    /**
     * Returns the ratio of lookups which were hits, or {@code 1.0} when {@code lookupCount == 0}.
     */
    public double hitRate() {
        return (lookupCount == 0) ? 1.0 : (double) hitCount() / lookupCount;
    }

    /**
     * Returns the number of lookups that did not find a live entry.
     */
    public long missCount() {
        return missCount;
    }

    /**
     * Returns the ratio of lookups which were misses, or {@code 0.0} when
     * {@code lookupCount == 0}.
     */
    public double missRate() {
        return (lookupCount == 0) ? 0.0 : (double) missCount / lookupCount;
    }

    /**
     * Returns the number of lookups that found an entry which had outlived its lifetime.
     */
    public long expiredCount() {
        return expiredCount;
    }

    /**
     * Returns the number of entries evicted to make room for new ones.
     */
    public long evictionCount() {
        return evictionCount;
    }

    /**
     * Returns a new {@code CacheStats} representing the difference between this {@code CacheStats}
     * and {@code other}.
     */
    public CacheStats minus(CacheStats other) {
        return new CacheStats(
                Math.max(0, lookupCount - other.lookupCount),
                Math.max(0, missCount - other.missCount),
                Math.max(0, expiredCount - other.expiredCount),
                Math.max(0, evictionCount - other.evictionCount));
    }

    /**
     * Returns a new {@code CacheStats} representing the sum of this {@code CacheStats} and
     * {@code other}.
     */
    public CacheStats plus(CacheStats other) {
        return new CacheStats(
                lookupCount + other.lookupCount,
                missCount + other.missCount,
                expiredCount + other.expiredCount,
                evictionCount + other.evictionCount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lookupCount, missCount, expiredCount, evictionCount);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CacheStats)) {
            return false;
        }
        CacheStats other = (CacheStats) obj;
        return lookupCount == other.lookupCount
                && missCount == other.missCount
                && expiredCount == other.expiredCount
                && evictionCount == other.evictionCount;
    }

    @Override
    public String toString() {
        return "CacheStats{"
                + "lookupCount=" + lookupCount
                + ", missCount=" + missCount
                + ", expiredCount=" + expiredCount
                + ", evictionCount=" + evictionCount
                + ", hitRate=" + String.format("%.2f%%", hitRate() * 100)
                + '}';
    }
}
