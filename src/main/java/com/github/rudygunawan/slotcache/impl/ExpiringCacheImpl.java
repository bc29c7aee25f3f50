package com.github.rudygunawan.slotcache.impl;

import com.github.rudygunawan.slotcache.api.EntryState;
import com.github.rudygunawan.slotcache.api.ExpiringCache;
import com.github.rudygunawan.slotcache.api.ValueRef;
import com.github.rudygunawan.slotcache.engine.CacheEngine;
import com.github.rudygunawan.slotcache.engine.SlotRef;
import com.github.rudygunawan.slotcache.metrics.CacheMetrics;
import com.github.rudygunawan.slotcache.model.CacheStats;
import com.github.rudygunawan.slotcache.policy.RemovalCause;

import java.util.Arrays;

/**
 * Adds creation-time expiry to an access-ordered or LRU cache.
 *
 * <p>Every operation that finds an entry first compares its age with the lifetime that applies to
 * its value (the empty lifetime for empty values). An expired entry is removed on the spot with
 * cause {@link RemovalCause#EXPIRED} and the operation continues as if the key were absent.
 * Eviction order is unaffected: a full cache still evicts the least recently accessed entry, which
 * need not be the oldest one.
 *
 * <p>Iteration, {@link #first()} and {@link #last()} may still see entries that have expired but
 * were not looked up since; call {@link #cleanUp()} first if that matters.
 *
 * @param <V> the value type
 */
public class ExpiringCacheImpl<V> implements ExpiringCache<V>, CacheMetrics {

    private final AbstractTimedCache<V> delegate;
    private final CacheEngine<V> engine;
    private long lifetime;
    private long emptyLifetime;

    /**
     * Wraps {@code delegate}.
     *
     * @throws IllegalArgumentException if a lifetime is below one second
     */
    public ExpiringCacheImpl(AccessOrderedCacheImpl<V> delegate, long lifetime, long emptyLifetime) {
        this((AbstractTimedCache<V>) delegate, lifetime, emptyLifetime);
    }

    /**
     * Wraps {@code delegate}.
     *
     * @throws IllegalArgumentException if a lifetime is below one second
     */
    public ExpiringCacheImpl(LruCacheImpl<V> delegate, long lifetime, long emptyLifetime) {
        this((AbstractTimedCache<V>) delegate, lifetime, emptyLifetime);
    }

    private ExpiringCacheImpl(AbstractTimedCache<V> delegate, long lifetime, long emptyLifetime) {
        this.delegate = delegate;
        this.engine = delegate.engine();
        setLifetime(lifetime);
        setEmptyLifetime(emptyLifetime);
    }

    private static long checkLifetime(long seconds) {
        if (seconds < 1) {
            throw new IllegalArgumentException("lifetime must be at least 1 second: " + seconds);
        }
        return seconds;
    }

    /**
     * Returns whether the entry behind {@code ref} has outlived its lifetime at {@code now}. A
     * creation time after {@code now} means the clock went backwards; such entries are live.
     */
    boolean isExpired(SlotRef<V> ref, long now) {
        long created = ref.createMetric();
        if (now < created) {
            return false;
        }
        long limit = ref.isEmptyValue() ? emptyLifetime : lifetime;
        return now - created >= limit;
    }

    /**
     * Finds {@code key}, dropping it if it has expired. Does not count anything.
     */
    private SlotRef<V> findLive(long key, long now) {
        SlotRef<V> ref = delegate.find(key);
        if (ref != null && isExpired(ref, now)) {
            delegate.removeEntry(key, RemovalCause.EXPIRED);
            return null;
        }
        return ref;
    }

    // ==================== Lookups ====================

    @Override
    public ValueRef<V> get(long key) {
        long now = delegate.ticker.read();
        SlotRef<V> ref = lookup(key, now);
        if (ref != null) {
            delegate.touch(ref, now);
        }
        return ref;
    }

    @Override
    public EntryState check(long key) {
        long now = delegate.ticker.read();
        SlotRef<V> ref = delegate.find(key);
        if (ref == null) {
            engine.recordLookup(false);
            return EntryState.ABSENT;
        }
        if (isExpired(ref, now)) {
            delegate.removeEntry(key, RemovalCause.EXPIRED);
            engine.recordExpired();
            return EntryState.EXPIRED;
        }
        engine.recordLookup(true);
        delegate.touch(ref, now);
        return EntryState.LIVE;
    }

    private SlotRef<V> lookup(long key, long now) {
        SlotRef<V> ref = delegate.find(key);
        if (ref == null) {
            engine.recordLookup(false);
            return null;
        }
        if (isExpired(ref, now)) {
            delegate.removeEntry(key, RemovalCause.EXPIRED);
            engine.recordExpired();
            return null;
        }
        engine.recordLookup(true);
        return ref;
    }

    @Override
    public ValueRef<V> getOrCreate(long key) {
        long now = delegate.ticker.read();
        SlotRef<V> ref = lookup(key, now);
        if (ref != null) {
            delegate.touch(ref, now);
            return ref;
        }
        return delegate.createFresh(key, now);
    }

    @Override
    public boolean exists(long key) {
        return findLive(key, delegate.ticker.read()) != null;
    }

    // ==================== Creation ====================

    @Override
    public ValueRef<V> create(long key) {
        findLive(key, delegate.ticker.read());
        return delegate.create(key);
    }

    @Override
    public boolean put(long key, V value) {
        findLive(key, delegate.ticker.read());
        return delegate.put(key, value);
    }

    @Override
    public long accessTime(long key) {
        return delegate.accessTime(key);
    }

    @Override
    public long createTime(long key) {
        return delegate.createTime(key);
    }

    // ==================== Expiry ====================

    @Override
    public int cleanUp() {
        long now = delegate.ticker.read();
        long[] expired = new long[16];
        int count = 0;
        for (ValueRef<V> ref : engine.ascending()) {
            if (isExpired((SlotRef<V>) ref, now)) {
                if (count == expired.length) {
                    expired = Arrays.copyOf(expired, count * 2);
                }
                expired[count++] = ref.key();
            }
        }
        for (int i = 0; i < count; i++) {
            delegate.removeEntry(expired[i], RemovalCause.EXPIRED);
        }
        return count;
    }

    @Override
    public long expiredCount() {
        return engine.expiredCount();
    }

    @Override
    public long lifetime() {
        return lifetime;
    }

    @Override
    public void setLifetime(long seconds) {
        this.lifetime = checkLifetime(seconds);
    }

    @Override
    public long emptyLifetime() {
        return emptyLifetime;
    }

    @Override
    public void setEmptyLifetime(long seconds) {
        this.emptyLifetime = checkLifetime(seconds);
    }

    // ==================== Delegation ====================

    @Override
    public boolean remove(long key) {
        return delegate.remove(key);
    }

    @Override
    public void clear() {
        delegate.clear();
    }

    @Override
    public int size() {
        return delegate.size();
    }

    @Override
    public int capacity() {
        return delegate.capacity();
    }

    @Override
    public ValueRef<V> first() {
        return delegate.first();
    }

    @Override
    public ValueRef<V> last() {
        return delegate.last();
    }

    @Override
    public Iterable<ValueRef<V>> ascending() {
        return delegate.ascending();
    }

    @Override
    public Iterable<ValueRef<V>> descending() {
        return delegate.descending();
    }

    @Override
    public long lookups() {
        return engine.lookupCount();
    }

    @Override
    public long misses() {
        return engine.missCount();
    }

    @Override
    public CacheStats stats() {
        return engine.stats();
    }

    @Override
    public void resetStats() {
        engine.resetStats();
    }

    /**
     * Checks the internal consistency of the cache.
     *
     * @throws AssertionError if the indices and the slot store disagree
     */
    public void verifyIntegrity() {
        engine.verifyIntegrity();
    }

    // ==================== CacheMetrics ====================

    @Override
    public long entryCount() {
        return engine.size();
    }

    @Override
    public long maximumEntries() {
        return engine.capacity();
    }

    @Override
    public long lookupCount() {
        return engine.lookupCount();
    }

    @Override
    public long missCount() {
        return engine.missCount();
    }

    @Override
    public long evictionCount() {
        return engine.evictionCount();
    }

    @Override
    public String toString() {
        return "ExpiringCache{size=" + engine.size() + ", capacity=" + engine.capacity()
                + ", lifetime=" + lifetime + "s, emptyLifetime=" + emptyLifetime + "s, over=" + delegate + '}';
    }
}
