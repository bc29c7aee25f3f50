package com.github.rudygunawan.slotcache.loader;

import com.github.rudygunawan.slotcache.api.ExpiringCache;
import com.github.rudygunawan.slotcache.api.ValueRef;
import com.github.rudygunawan.slotcache.metrics.CacheMetrics;
import com.github.rudygunawan.slotcache.value.OwnedBuffer;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serves raw records from an {@link ExpiringCache}, fetching them through a {@link CacheLoader}
 * on a miss.
 *
 * <p>Records that the source does not have are cached as empty buffers, so repeated requests for
 * a missing key do not hit the source until the cache's empty lifetime has elapsed. An empty
 * record and a missing record are therefore indistinguishable: both are returned as {@code null}.
 *
 * <p>Every returned array is a fresh copy owned by the caller; it stays valid however the cache
 * changes afterwards.
 *
 * <p>Usage example:
 * <pre>{@code
 * ExpiringCache<OwnedBuffer> cache = CacheBuilder.newBuilder()
 *     .maximumSize(10_000)
 *     .growableValues()
 *     .expireAfterCreate(5, TimeUnit.MINUTES)
 *     .expireEmptyAfterCreate(10, TimeUnit.SECONDS)
 *     .buildExpiringLru();
 *
 * CachingLoader records = new CachingLoader(cache, key -> database.fetch(key));
 * byte[] record = records.get(42L);
 * }</pre>
 *
 * <p>Like the caches, this class is not thread-safe.
 */
public class CachingLoader implements CacheMetrics {

    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.slotcache.Cache");

    private final ExpiringCache<OwnedBuffer> cache;
    private final CacheLoader loader;
    private long loadSuccessCount;
    private long loadFailureCount;

    public CachingLoader(ExpiringCache<OwnedBuffer> cache, CacheLoader loader) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    /**
     * Returns a copy of the record for {@code key}, loading and caching it on a miss.
     *
     * @return the record, or {@code null} if the source has no (or an empty) record
     * @throws Exception whatever the loader threw; the key is not cached in that case
     */
    public byte[] get(long key) throws Exception {
        ValueRef<OwnedBuffer> cached = cache.get(key);
        if (cached != null) {
            OwnedBuffer buffer = cached.get();
            return buffer.length() == 0 ? null : buffer.toByteArray();
        }

        byte[] data;
        try {
            data = loader.load(key);
        } catch (Exception e) {
            loadFailureCount++;
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.log(Level.FINE, "Failed to load record: key=" + key, e);
            }
            throw e;
        }
        loadSuccessCount++;

        ValueRef<OwnedBuffer> slot = cache.create(key);
        if (slot != null) {
            OwnedBuffer buffer = slot.get();
            if (data == null) {
                buffer.clear();
            } else {
                buffer.set(data);
            }
        }
        return data == null || data.length == 0 ? null : data.clone();
    }

    /**
     * Returns the cache backing this loader.
     */
    public ExpiringCache<OwnedBuffer> cache() {
        return cache;
    }

    // ==================== CacheMetrics ====================

    @Override
    public long entryCount() {
        return cache.size();
    }

    @Override
    public long maximumEntries() {
        return cache.capacity();
    }

    @Override
    public long lookupCount() {
        return cache.lookups();
    }

    @Override
    public long missCount() {
        return cache.misses();
    }

    @Override
    public long expiredCount() {
        return cache.expiredCount();
    }

    @Override
    public long evictionCount() {
        return cache.stats().evictionCount();
    }

    @Override
    public long loadSuccessCount() {
        return loadSuccessCount;
    }

    @Override
    public long loadFailureCount() {
        return loadFailureCount;
    }
}
