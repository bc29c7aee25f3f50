package com.github.rudygunawan.slotcache.engine;

import com.github.rudygunawan.slotcache.value.ValueKind;

/**
 * Dense storage for cache entries: {@code capacity} slots allocated once, of which
 * {@code [0, count)} are live.
 *
 * <p>Removing an entry moves the last live entry into the vacated slot, so the live range has no
 * holes. Value holders are swapped rather than copied, which keeps per-slot buffers (fixed byte
 * arrays, growable buffers) owned by exactly one slot at all times.
 *
 * @param <V> the value type
 */
final class SlotStore<V> {

    private final ValueKind<V> kind;
    private final long[] keys;
    private final Object[] values;
    private final long[] createMetrics;
    private int count;

    SlotStore(int capacity, ValueKind<V> kind) {
        this.kind = kind;
        this.keys = new long[capacity];
        this.values = new Object[capacity];
        this.createMetrics = new long[capacity];
        for (int i = 0; i < capacity; i++) {
            values[i] = kind.newValue();
        }
    }

    /**
     * Claims the next free slot for {@code key}.
     *
     * @throws IllegalStateException if every slot is live
     */
    int acquire(long key) {
        if (count == keys.length) {
            throw new IllegalStateException("slot store is full (" + keys.length + " slots)");
        }
        int slot = count++;
        keys[slot] = key;
        createMetrics[slot] = 0L;
        return slot;
    }

    /**
     * Releases {@code slot}. Its value is reset and, if it was not the last live slot, the last
     * live entry is moved into it.
     *
     * @return the slot the last entry was moved from, or {@code -1} if nothing moved
     */
    int release(int slot) {
        int last = count - 1;
        values[slot] = kind.reset(value(slot));
        int moved = -1;
        if (slot != last) {
            keys[slot] = keys[last];
            createMetrics[slot] = createMetrics[last];
            Object holder = values[slot];
            values[slot] = values[last];
            values[last] = holder;
            moved = last;
        }
        keys[last] = 0L;
        createMetrics[last] = 0L;
        count--;
        return moved;
    }

    /**
     * Resets every live value and empties the store.
     */
    void clear() {
        for (int i = 0; i < count; i++) {
            values[i] = kind.reset(value(i));
            keys[i] = 0L;
            createMetrics[i] = 0L;
        }
        count = 0;
    }

    long key(int slot) {
        return keys[slot];
    }

    @SuppressWarnings("unchecked")
    V value(int slot) {
        return (V) values[slot];
    }

    void setValue(int slot, V incoming) {
        values[slot] = kind.assign(value(slot), incoming);
    }

    long createMetric(int slot) {
        return createMetrics[slot];
    }

    void setCreateMetric(int slot, long metric) {
        createMetrics[slot] = metric;
    }

    int count() {
        return count;
    }

    int capacity() {
        return keys.length;
    }

    ValueKind<V> kind() {
        return kind;
    }
}
