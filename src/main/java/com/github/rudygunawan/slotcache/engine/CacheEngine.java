package com.github.rudygunawan.slotcache.engine;

import com.github.rudygunawan.slotcache.api.ValueRef;
import com.github.rudygunawan.slotcache.index.KeyIndex;
import com.github.rudygunawan.slotcache.index.OrderIndex;
import com.github.rudygunawan.slotcache.listener.RemovalListener;
import com.github.rudygunawan.slotcache.model.CacheStats;
import com.github.rudygunawan.slotcache.policy.AdmissionPolicy;
import com.github.rudygunawan.slotcache.policy.RemovalCause;
import com.github.rudygunawan.slotcache.value.ValueKind;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The core of every cache: a {@link SlotStore} of entries, a {@link KeyIndex} from key to order
 * node and an {@link OrderIndex} sorted by metric.
 *
 * <p>The engine knows nothing about priorities or clocks. It stores whatever metric the policy
 * layer hands it, evicts the entry with the lowest metric when a create finds it full, and keeps
 * the three structures consistent:
 * <ul>
 *   <li>every live slot {@code i < size()} has exactly one order node whose slot is {@code i};</li>
 *   <li>the key index maps the key stored in slot {@code i} to that node;</li>
 *   <li>nothing else is in either index.</li>
 * </ul>
 *
 * <p>Lookups never reorder. Counters are plain fields; the engine is single-threaded.
 *
 * @param <V> the value type
 */
public final class CacheEngine<V> {

    /**
     * Logger for cache operations. Logger name: "com.github.rudygunawan.slotcache.Cache"
     *
     * <p>Log levels used:
     * <ul>
     *   <li>WARNING: a removal listener threw (the operation continues)</li>
     *   <li>FINE: evictions and expirations</li>
     *   <li>FINER: less favorable entries admitted or rejected</li>
     * </ul>
     */
    static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.slotcache.Cache");

    private final SlotStore<V> store;
    private final OrderIndex order;
    private final KeyIndex keys;
    private final AdmissionPolicy admission;
    private final RemovalListener<? super V> removalListener;

    private long lookupCount;
    private long missCount;
    private long expiredCount;
    private long evictionCount;
    private int structureVersion;

    /**
     * Creates an engine with {@code capacity} pre-allocated slots.
     *
     * @param removalListener notified on removal, or {@code null}
     * @throws IllegalArgumentException if {@code capacity} is not positive or above
     *         {@link KeyIndex#MAXIMUM_CAPACITY}
     */
    public CacheEngine(int capacity, ValueKind<V> kind, AdmissionPolicy admission,
                       RemovalListener<? super V> removalListener) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.keys = new KeyIndex(capacity);
        this.store = new SlotStore<>(capacity, Objects.requireNonNull(kind, "kind"));
        this.order = new OrderIndex(capacity);
        this.admission = Objects.requireNonNull(admission, "admission");
        this.removalListener = removalListener;
    }

    // ==================== Lookup ====================

    /**
     * Returns a reference to the entry for {@code key}, or {@code null}. Statistics are not
     * touched.
     */
    public SlotRef<V> find(long key) {
        OrderIndex.Node node = keys.get(key);
        return node == null ? null : new SlotRef<>(this, node, key, true);
    }

    /**
     * Like {@link #find(long)}, but counts a lookup and, if the key is absent, a miss.
     */
    public SlotRef<V> lookup(long key) {
        SlotRef<V> ref = find(key);
        recordLookup(ref != null);
        return ref;
    }

    /**
     * Returns whether {@code key} is cached.
     */
    public boolean contains(long key) {
        return keys.containsKey(key);
    }

    // ==================== Create ====================

    /**
     * Returns the entry for {@code key} unchanged, or creates it with {@code metric}.
     *
     * <p>If the engine is full, the entry with the lowest metric is evicted first. When
     * {@code metric} is lower than that entry's metric the admission policy decides; if it
     * rejects, nothing changes and {@code null} is returned.
     *
     * @return a reference whose {@link ValueRef#existed()} tells whether the key was present, or
     *         {@code null} if the new entry was rejected
     */
    public SlotRef<V> createOrGet(long key, long metric) {
        OrderIndex.Node existing = keys.get(key);
        if (existing != null) {
            return new SlotRef<>(this, existing, key, true);
        }
        if (store.count() == store.capacity()) {
            OrderIndex.Node min = order.first();
            if (metric < min.metric()) {
                boolean accepted = admission.acceptReplacement(metric, min.metric());
                if (LOGGER.isLoggable(Level.FINER)) {
                    LOGGER.finer((accepted ? "Admitted" : "Rejected") + " key=" + key
                            + " with metric " + metric + " below the minimum " + min.metric());
                }
                if (!accepted) {
                    return null;
                }
            }
            long victim = store.key(min.slot());
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Evicted entry due to size limit: key=" + victim
                        + ", metric=" + min.metric() + ", incoming key=" + key);
            }
            evictionCount++;
            removeNode(victim, min, RemovalCause.SIZE);
        }
        int slot = store.acquire(key);
        OrderIndex.Node node = order.insert(metric, slot);
        keys.put(key, node);
        return new SlotRef<>(this, node, key, false);
    }

    // ==================== Update ====================

    /**
     * Sets the metric of the entry behind {@code ref}. Does nothing if the metric is unchanged.
     *
     * @throws ConcurrentModificationException if {@code ref} is stale
     */
    public void updateMetric(SlotRef<V> ref, long metric) {
        ref.checkValid();
        OrderIndex.Node node = ref.node();
        if (node.metric() != metric) {
            order.update(node, metric, node.slot());
        }
    }

    /**
     * Sets the metric of the entry for {@code key}, if present.
     *
     * @return {@code true} if the key is cached
     */
    public boolean updateMetric(long key, long metric) {
        OrderIndex.Node node = keys.get(key);
        if (node == null) {
            return false;
        }
        if (node.metric() != metric) {
            order.update(node, metric, node.slot());
        }
        return true;
    }

    // ==================== Remove ====================

    /**
     * Removes the entry for {@code key} and notifies the removal listener with {@code cause}.
     *
     * @return {@code true} if the key was cached
     */
    public boolean remove(long key, RemovalCause cause) {
        OrderIndex.Node node = keys.get(key);
        if (node == null) {
            return false;
        }
        if (cause == RemovalCause.EXPIRED && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Removed expired entry: key=" + key);
        }
        removeNode(key, node, cause);
        return true;
    }

    /**
     * Removes every entry and resets every value. The removal listener is not notified.
     */
    public void clear() {
        keys.clear();
        order.clear();
        store.clear();
        structureVersion++;
    }

    private void removeNode(long key, OrderIndex.Node node, RemovalCause cause) {
        int slot = node.slot();
        keys.remove(key);
        order.remove(node);
        structureVersion++;
        try {
            notifyRemoval(key, store.value(slot), cause);
        } finally {
            releaseSlot(slot);
        }
    }

    // The indices no longer know the entry, so the slot is compacted even if the listener threw.
    private void releaseSlot(int slot) {
        int movedFrom = store.release(slot);
        if (movedFrom >= 0) {
            OrderIndex.Node moved = keys.get(store.key(slot));
            if (moved == null) {
                throw new AssertionError("relocated key " + store.key(slot) + " is not indexed");
            }
            order.update(moved, moved.metric(), slot);
        }
    }

    private void notifyRemoval(long key, V value, RemovalCause cause) {
        if (removalListener != null) {
            try {
                removalListener.onRemoval(key, value, cause);
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "RemovalListener threw exception for key: " + key
                        + ", cause: " + cause, e);
            }
        }
    }

    // ==================== Order ====================

    /**
     * Returns the entry with the lowest metric, or {@code null} if empty.
     */
    public SlotRef<V> first() {
        return refTo(order.first());
    }

    /**
     * Returns the entry with the highest metric, or {@code null} if empty.
     */
    public SlotRef<V> last() {
        return refTo(order.last());
    }

    /**
     * Returns the entries in ascending metric order.
     */
    public Iterable<ValueRef<V>> ascending() {
        return () -> new EntryIterator(true);
    }

    /**
     * Returns the entries in descending metric order.
     */
    public Iterable<ValueRef<V>> descending() {
        return () -> new EntryIterator(false);
    }

    private SlotRef<V> refTo(OrderIndex.Node node) {
        return node == null ? null : new SlotRef<>(this, node, store.key(node.slot()), true);
    }

    private final class EntryIterator implements Iterator<ValueRef<V>> {
        private final boolean forward;
        private final int expectedModCount;
        private OrderIndex.Node next;

        EntryIterator(boolean forward) {
            this.forward = forward;
            this.expectedModCount = order.modCount();
            this.next = forward ? order.first() : order.last();
        }

        @Override
        public boolean hasNext() {
            checkForComodification();
            return next != null;
        }

        @Override
        public ValueRef<V> next() {
            checkForComodification();
            if (next == null) {
                throw new NoSuchElementException();
            }
            OrderIndex.Node current = next;
            next = forward ? order.next(current) : order.previous(current);
            return refTo(current);
        }

        private void checkForComodification() {
            if (order.modCount() != expectedModCount) {
                throw new ConcurrentModificationException("cache order changed during iteration");
            }
        }
    }

    // ==================== Statistics ====================

    /**
     * Counts a lookup, and a miss unless {@code found}.
     */
    public void recordLookup(boolean found) {
        lookupCount++;
        if (!found) {
            missCount++;
        }
    }

    /**
     * Counts a lookup that found an expired entry, which is also a miss.
     */
    public void recordExpired() {
        lookupCount++;
        missCount++;
        expiredCount++;
    }

    public long lookupCount() {
        return lookupCount;
    }

    public long missCount() {
        return missCount;
    }

    public long expiredCount() {
        return expiredCount;
    }

    public long evictionCount() {
        return evictionCount;
    }

    /**
     * Resets the lookup, miss and expiry counters. The eviction count is kept.
     */
    public void resetStats() {
        lookupCount = 0;
        missCount = 0;
        expiredCount = 0;
    }

    public CacheStats stats() {
        return new CacheStats(lookupCount, missCount, expiredCount, evictionCount);
    }

    // ==================== Sizing ====================

    public int size() {
        return store.count();
    }

    public int capacity() {
        return store.capacity();
    }

    public ValueKind<V> kind() {
        return store.kind();
    }

    SlotStore<V> store() {
        return store;
    }

    int structureVersion() {
        return structureVersion;
    }

    /**
     * Checks that the slot store and both indices agree with each other, and the red-black tree
     * invariants.
     *
     * @throws AssertionError on the first inconsistency found
     */
    public void verifyIntegrity() {
        order.verifyIntegrity();
        int count = store.count();
        if (count < 0 || count > store.capacity()) {
            throw new AssertionError("count " + count + " outside [0, " + store.capacity() + "]");
        }
        if (order.size() != count || keys.size() != count) {
            throw new AssertionError("sizes disagree: slots=" + count + ", order=" + order.size()
                    + ", keys=" + keys.size());
        }
        for (int slot = 0; slot < count; slot++) {
            long key = store.key(slot);
            OrderIndex.Node node = keys.get(key);
            if (node == null) {
                throw new AssertionError("key " + key + " in slot " + slot + " is not indexed");
            }
            if (node.slot() != slot) {
                throw new AssertionError("key " + key + " is in slot " + slot
                        + " but its node points at slot " + node.slot());
            }
        }
        for (OrderIndex.Node node = order.first(); node != null; node = order.next(node)) {
            if (node.slot() >= count) {
                throw new AssertionError("node " + node + " points past the live range " + count);
            }
        }
    }

    @Override
    public String toString() {
        return "CacheEngine{size=" + store.count() + ", capacity=" + store.capacity()
                + ", kind=" + store.kind() + '}';
    }
}
