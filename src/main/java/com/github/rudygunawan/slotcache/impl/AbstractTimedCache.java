package com.github.rudygunawan.slotcache.impl;

import com.github.rudygunawan.slotcache.api.AccessOrderedCache;
import com.github.rudygunawan.slotcache.api.ValueRef;
import com.github.rudygunawan.slotcache.engine.CacheEngine;
import com.github.rudygunawan.slotcache.engine.SlotRef;
import com.github.rudygunawan.slotcache.metrics.CacheMetrics;
import com.github.rudygunawan.slotcache.model.CacheStats;
import com.github.rudygunawan.slotcache.policy.RemovalCause;
import com.github.rudygunawan.slotcache.time.Ticker;

import java.util.Objects;

/**
 * Shared behavior of the caches ordered by access time. Subclasses decide how entries are found,
 * created and touched; this class turns those primitives into the {@link AccessOrderedCache}
 * operations and reads the clock once per operation.
 *
 * <p>The primitives are package-private so that {@link ExpiringCacheImpl} can wrap any subclass
 * and check lifetimes between finding an entry and touching it.
 *
 * @param <V> the value type
 */
abstract class AbstractTimedCache<V> implements AccessOrderedCache<V>, CacheMetrics {

    final Ticker ticker;

    AbstractTimedCache(Ticker ticker) {
        this.ticker = Objects.requireNonNull(ticker, "ticker");
    }

    /**
     * Returns the engine that stores the entries.
     */
    abstract CacheEngine<V> engine();

    /**
     * Finds {@code key} without counting a lookup or touching it.
     */
    abstract SlotRef<V> find(long key);

    /**
     * Returns the entry for {@code key} unchanged, or creates it with access time {@code now}.
     * Does not count a lookup.
     */
    abstract SlotRef<V> createOrGet(long key, long now);

    /**
     * Sets the access time of the entry to {@code now}.
     */
    abstract void touch(SlotRef<V> ref, long now);

    final boolean removeEntry(long key, RemovalCause cause) {
        return engine().remove(key, cause);
    }

    // ==================== AccessOrderedCache ====================

    @Override
    public ValueRef<V> get(long key) {
        long now = ticker.read();
        SlotRef<V> ref = find(key);
        engine().recordLookup(ref != null);
        if (ref != null) {
            touch(ref, now);
        }
        return ref;
    }

    @Override
    public ValueRef<V> create(long key) {
        long now = ticker.read();
        SlotRef<V> ref = createOrGet(key, now);
        if (ref != null) {
            if (ref.existed()) {
                touch(ref, now);
            }
            ref.setCreateMetric(now);
        }
        return ref;
    }

    @Override
    public ValueRef<V> getOrCreate(long key) {
        long now = ticker.read();
        SlotRef<V> ref = find(key);
        engine().recordLookup(ref != null);
        if (ref != null) {
            touch(ref, now);
            return ref;
        }
        return createFresh(key, now);
    }

    @Override
    public boolean put(long key, V value) {
        long now = ticker.read();
        SlotRef<V> ref = createOrGet(key, now);
        if (ref == null) {
            return false;
        }
        if (ref.existed()) {
            touch(ref, now);
        } else {
            ref.setCreateMetric(now);
        }
        ref.set(value);
        return ref.existed();
    }

    /**
     * Creates a new entry stamped with {@code now} as both access and creation time.
     *
     * @return the new entry, or {@code null} if admission was rejected
     */
    final SlotRef<V> createFresh(long key, long now) {
        SlotRef<V> ref = createOrGet(key, now);
        if (ref != null && !ref.existed()) {
            ref.setCreateMetric(now);
        }
        return ref;
    }

    @Override
    public long accessTime(long key) {
        SlotRef<V> ref = find(key);
        return ref == null ? 0 : ref.metric();
    }

    @Override
    public long createTime(long key) {
        SlotRef<V> ref = find(key);
        return ref == null ? 0 : ref.createMetric();
    }

    // ==================== OrderedCache ====================

    @Override
    public boolean exists(long key) {
        return find(key) != null;
    }

    @Override
    public boolean remove(long key) {
        return removeEntry(key, RemovalCause.EXPLICIT);
    }

    @Override
    public void clear() {
        engine().clear();
    }

    @Override
    public int size() {
        return engine().size();
    }

    @Override
    public int capacity() {
        return engine().capacity();
    }

    @Override
    public ValueRef<V> first() {
        return engine().first();
    }

    @Override
    public ValueRef<V> last() {
        return engine().last();
    }

    @Override
    public Iterable<ValueRef<V>> ascending() {
        return engine().ascending();
    }

    @Override
    public Iterable<ValueRef<V>> descending() {
        return engine().descending();
    }

    @Override
    public long lookups() {
        return engine().lookupCount();
    }

    @Override
    public long misses() {
        return engine().missCount();
    }

    @Override
    public CacheStats stats() {
        return engine().stats();
    }

    @Override
    public void resetStats() {
        engine().resetStats();
    }

    /**
     * Checks the internal consistency of the cache.
     *
     * @throws AssertionError if the indices and the slot store disagree
     */
    public void verifyIntegrity() {
        engine().verifyIntegrity();
    }

    // ==================== CacheMetrics ====================

    @Override
    public long entryCount() {
        return engine().size();
    }

    @Override
    public long maximumEntries() {
        return engine().capacity();
    }

    @Override
    public long lookupCount() {
        return engine().lookupCount();
    }

    @Override
    public long missCount() {
        return engine().missCount();
    }

    @Override
    public long evictionCount() {
        return engine().evictionCount();
    }
}
