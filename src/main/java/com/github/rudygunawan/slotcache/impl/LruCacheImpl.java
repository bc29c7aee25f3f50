package com.github.rudygunawan.slotcache.impl;

import com.github.rudygunawan.slotcache.api.PriorityCache;
import com.github.rudygunawan.slotcache.engine.CacheEngine;
import com.github.rudygunawan.slotcache.engine.SlotRef;
import com.github.rudygunawan.slotcache.time.Ticker;

/**
 * A least-recently-used cache built on a {@link PriorityCacheImpl}: the priority of an entry is
 * the time it was last touched, so the lowest priority is the least recently used entry.
 *
 * <p>Every touch ({@code get}, {@code getOrCreate}, {@code create}, {@code put}) raises the
 * priority to the current time. The underlying priority cache stays reachable through
 * {@link #priorities()} for callers that need its extra queries, such as
 * {@link PriorityCache#highest()}.
 *
 * @param <V> the value type
 */
public class LruCacheImpl<V> extends AbstractTimedCache<V> {

    private final PriorityCacheImpl<V> priorities;

    public LruCacheImpl(PriorityCacheImpl<V> priorities, Ticker ticker) {
        super(ticker);
        this.priorities = priorities;
    }

    /**
     * Returns the priority cache holding the entries, with access times as priorities.
     */
    public PriorityCache<V> priorities() {
        return priorities;
    }

    @Override
    CacheEngine<V> engine() {
        return priorities.engine();
    }

    @Override
    SlotRef<V> find(long key) {
        return priorities.ref(key, false);
    }

    @Override
    SlotRef<V> createOrGet(long key, long now) {
        return priorities.getOrInsert(key, now);
    }

    @Override
    void touch(SlotRef<V> ref, long now) {
        priorities.reprioritize(ref, now);
    }

    @Override
    public String toString() {
        return "LruCache{size=" + size() + ", capacity=" + capacity() + '}';
    }
}
