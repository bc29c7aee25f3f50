package com.github.rudygunawan.slotcache.impl;

import com.github.rudygunawan.slotcache.api.PriorityCache;
import com.github.rudygunawan.slotcache.api.ValueRef;
import com.github.rudygunawan.slotcache.engine.CacheEngine;
import com.github.rudygunawan.slotcache.engine.SlotRef;
import com.github.rudygunawan.slotcache.listener.RemovalListener;
import com.github.rudygunawan.slotcache.metrics.CacheMetrics;
import com.github.rudygunawan.slotcache.model.CacheStats;
import com.github.rudygunawan.slotcache.policy.AdmissionPolicy;
import com.github.rudygunawan.slotcache.policy.RemovalCause;
import com.github.rudygunawan.slotcache.value.ValueKind;

import java.util.OptionalLong;

/**
 * {@link PriorityCache} on top of a {@link CacheEngine}: the caller's priority is the metric.
 *
 * <p>Priorities are compared as signed {@code long} values.
 *
 * @param <V> the value type
 * @see LruCacheImpl
 */
public class PriorityCacheImpl<V> implements PriorityCache<V>, CacheMetrics {

    private final CacheEngine<V> engine;

    public PriorityCacheImpl(int capacity, ValueKind<V> kind, AdmissionPolicy admission,
                             RemovalListener<? super V> removalListener) {
        this.engine = new CacheEngine<>(capacity, kind, admission, removalListener);
    }

    @Override
    public ValueRef<V> get(long key) {
        return get(key, true);
    }

    @Override
    public ValueRef<V> get(long key, boolean trackMisses) {
        return ref(key, trackMisses);
    }

    @Override
    public ValueRef<V> create(long key, long priority) {
        SlotRef<V> ref = engine.createOrGet(key, priority);
        if (ref != null && ref.existed()) {
            engine.updateMetric(ref, priority);
        }
        return ref;
    }

    @Override
    public ValueRef<V> getOrCreate(long key, long priority) {
        SlotRef<V> ref = ref(key, true);
        return ref != null ? ref : engine.createOrGet(key, priority);
    }

    @Override
    public ValueRef<V> getUpdateOrCreate(long key, long priority) {
        SlotRef<V> ref = ref(key, true);
        if (ref == null) {
            return engine.createOrGet(key, priority);
        }
        engine.updateMetric(ref, priority);
        return ref;
    }

    @Override
    public ValueRef<V> updatePriority(long key, long priority) {
        SlotRef<V> ref = ref(key, true);
        if (ref != null) {
            engine.updateMetric(ref, priority);
        }
        return ref;
    }

    @Override
    public ValueRef<V> put(long key, long priority, V value) {
        ValueRef<V> ref = create(key, priority);
        if (ref != null) {
            ref.set(value);
        }
        return ref;
    }

    @Override
    public OptionalLong priorityOf(long key) {
        SlotRef<V> ref = engine.find(key);
        return ref == null ? OptionalLong.empty() : OptionalLong.of(ref.metric());
    }

    @Override
    public ValueRef<V> highest() {
        return engine.last();
    }

    @Override
    public ValueRef<V> lowest() {
        return engine.first();
    }

    @Override
    public boolean exists(long key) {
        return engine.contains(key);
    }

    @Override
    public boolean remove(long key) {
        return engine.remove(key, RemovalCause.EXPLICIT);
    }

    @Override
    public void clear() {
        engine.clear();
    }

    @Override
    public int size() {
        return engine.size();
    }

    @Override
    public int capacity() {
        return engine.capacity();
    }

    @Override
    public ValueRef<V> first() {
        return engine.first();
    }

    @Override
    public ValueRef<V> last() {
        return engine.last();
    }

    @Override
    public Iterable<ValueRef<V>> ascending() {
        return engine.ascending();
    }

    @Override
    public Iterable<ValueRef<V>> descending() {
        return engine.descending();
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

    // ==================== Package-private access for LruCacheImpl ====================

    CacheEngine<V> engine() {
        return engine;
    }

    SlotRef<V> ref(long key, boolean trackMisses) {
        return trackMisses ? engine.lookup(key) : engine.find(key);
    }

    SlotRef<V> getOrInsert(long key, long priority) {
        return engine.createOrGet(key, priority);
    }

    void reprioritize(SlotRef<V> ref, long priority) {
        engine.updateMetric(ref, priority);
    }

    @Override
    public String toString() {
        return "PriorityCache{size=" + engine.size() + ", capacity=" + engine.capacity() + '}';
    }
}
