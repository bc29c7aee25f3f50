package com.github.rudygunawan.slotcache.impl;

import com.github.rudygunawan.slotcache.engine.CacheEngine;
import com.github.rudygunawan.slotcache.engine.SlotRef;
import com.github.rudygunawan.slotcache.listener.RemovalListener;
import com.github.rudygunawan.slotcache.policy.AdmissionPolicy;
import com.github.rudygunawan.slotcache.time.Ticker;
import com.github.rudygunawan.slotcache.value.ValueKind;

/**
 * An {@link com.github.rudygunawan.slotcache.api.AccessOrderedCache} that drives a
 * {@link CacheEngine} directly, using the access time as the metric.
 *
 * <p>A lookup hit always refreshes the access time. When the clock goes backwards the refreshed
 * time may be earlier than before, which moves the entry towards eviction; this is accepted rather
 * than keeping the later time.
 *
 * @param <V> the value type
 */
public class AccessOrderedCacheImpl<V> extends AbstractTimedCache<V> {

    private final CacheEngine<V> engine;

    public AccessOrderedCacheImpl(int capacity, ValueKind<V> kind, AdmissionPolicy admission,
                                  RemovalListener<? super V> removalListener, Ticker ticker) {
        super(ticker);
        this.engine = new CacheEngine<>(capacity, kind, admission, removalListener);
    }

    @Override
    CacheEngine<V> engine() {
        return engine;
    }

    @Override
    SlotRef<V> find(long key) {
        return engine.find(key);
    }

    @Override
    SlotRef<V> createOrGet(long key, long now) {
        return engine.createOrGet(key, now);
    }

    @Override
    void touch(SlotRef<V> ref, long now) {
        engine.updateMetric(ref, now);
    }

    @Override
    public String toString() {
        return "AccessOrderedCache{size=" + engine.size() + ", capacity=" + engine.capacity() + '}';
    }
}
