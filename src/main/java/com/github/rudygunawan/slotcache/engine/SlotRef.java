package com.github.rudygunawan.slotcache.engine;

import com.github.rudygunawan.slotcache.api.ValueRef;
import com.github.rudygunawan.slotcache.index.OrderIndex;

import java.util.ConcurrentModificationException;

/**
 * The {@link ValueRef} handed out by a {@link CacheEngine}. It remembers the engine's structure
 * version at the time it was made and fails fast once an entry has been removed or relocated.
 *
 * @param <V> the value type
 */
public final class SlotRef<V> implements ValueRef<V> {

    private final CacheEngine<V> engine;
    private final OrderIndex.Node node;
    private final long key;
    private final boolean existed;
    private final int version;

    SlotRef(CacheEngine<V> engine, OrderIndex.Node node, long key, boolean existed) {
        this.engine = engine;
        this.node = node;
        this.key = key;
        this.existed = existed;
        this.version = engine.structureVersion();
    }

    @Override
    public long key() {
        return key;
    }

    @Override
    public V get() {
        checkValid();
        return engine.store().value(node.slot());
    }

    @Override
    public void set(V value) {
        checkValid();
        engine.store().setValue(node.slot(), value);
    }

    @Override
    public long metric() {
        checkValid();
        return node.metric();
    }

    @Override
    public boolean existed() {
        return existed;
    }

    /**
     * Returns the creation metric recorded for the entry, or {@code 0} if none was recorded.
     */
    public long createMetric() {
        checkValid();
        return engine.store().createMetric(node.slot());
    }

    /**
     * Records the creation metric of the entry.
     */
    public void setCreateMetric(long createMetric) {
        checkValid();
        engine.store().setCreateMetric(node.slot(), createMetric);
    }

    /**
     * Returns whether the value of the entry counts as empty for its value kind.
     */
    public boolean isEmptyValue() {
        checkValid();
        return engine.store().kind().isEmpty(engine.store().value(node.slot()));
    }

    OrderIndex.Node node() {
        return node;
    }

    void checkValid() {
        if (engine.structureVersion() != version) {
            throw new ConcurrentModificationException(
                    "reference to key " + key + " used after the cache structure changed");
        }
    }

    @Override
    public String toString() {
        if (engine.structureVersion() != version) {
            return "SlotRef{key=" + key + ", stale}";
        }
        return "SlotRef{key=" + key + ", metric=" + node.metric() + ", slot=" + node.slot() + '}';
    }
}
