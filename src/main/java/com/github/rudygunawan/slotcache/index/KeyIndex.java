package com.github.rudygunawan.slotcache.index;

import java.util.Arrays;

/**
 * A fixed-capacity hash map from {@code long} keys to {@link OrderIndex.Node} references.
 *
 * <p>Open addressing with linear probing over a power-of-two table at least twice as large as the
 * capacity, so the load factor never exceeds one half. Removal shifts the following probe run
 * back instead of leaving tombstones, which keeps lookups short however long the cache runs. The
 * table is sized once and never grows.
 */
public final class KeyIndex {

    /** The largest capacity whose table still keeps a free bucket. */
    public static final int MAXIMUM_CAPACITY = 1 << 29;

    private final long[] keys;
    private final OrderIndex.Node[] nodes;
    private final int mask;
    private final int capacity;
    private int size;

    /**
     * Creates an empty index for up to {@code capacity} keys.
     *
     * @throws IllegalArgumentException if {@code capacity} is not positive or above
     *         {@link #MAXIMUM_CAPACITY}
     */
    public KeyIndex(int capacity) {
        if (capacity <= 0 || capacity > MAXIMUM_CAPACITY) {
            throw new IllegalArgumentException(
                    "capacity must be in [1, " + MAXIMUM_CAPACITY + "]: " + capacity);
        }
        int tableSize = ceilingPowerOfTwo(2 * capacity);
        this.capacity = capacity;
        this.keys = new long[tableSize];
        this.nodes = new OrderIndex.Node[tableSize];
        this.mask = tableSize - 1;
    }

    /**
     * Returns the node mapped to {@code key}, or {@code null} if there is none.
     */
    public OrderIndex.Node get(long key) {
        int i = indexOf(key);
        while (nodes[i] != null) {
            if (keys[i] == key) {
                return nodes[i];
            }
            i = (i + 1) & mask;
        }
        return null;
    }

    /**
     * Returns whether {@code key} is mapped.
     */
    public boolean containsKey(long key) {
        return get(key) != null;
    }

    /**
     * Maps {@code key} to {@code node}, replacing any previous mapping.
     *
     * @return the previous node, or {@code null}
     * @throws IllegalStateException if the key is new and the index is full
     */
    public OrderIndex.Node put(long key, OrderIndex.Node node) {
        if (node == null) {
            throw new NullPointerException("node");
        }
        int i = indexOf(key);
        while (nodes[i] != null) {
            if (keys[i] == key) {
                OrderIndex.Node previous = nodes[i];
                nodes[i] = node;
                return previous;
            }
            i = (i + 1) & mask;
        }
        if (size == capacity) {
            throw new IllegalStateException("key index is full (" + capacity + " keys)");
        }
        keys[i] = key;
        nodes[i] = node;
        size++;
        return null;
    }

    /**
     * Removes the mapping for {@code key}.
     *
     * @return the removed node, or {@code null} if the key was not mapped
     */
    public OrderIndex.Node remove(long key) {
        int i = indexOf(key);
        while (nodes[i] != null) {
            if (keys[i] == key) {
                OrderIndex.Node removed = nodes[i];
                shiftBack(i);
                size--;
                return removed;
            }
            i = (i + 1) & mask;
        }
        return null;
    }

    /**
     * Removes every mapping.
     */
    public void clear() {
        Arrays.fill(nodes, null);
        size = 0;
    }

    /**
     * Returns the number of mapped keys.
     */
    public int size() {
        return size;
    }

    /**
     * Returns the maximum number of keys.
     */
    public int capacity() {
        return capacity;
    }

    // Backward-shift deletion: move later members of the probe run into the hole as long as
    // their home bucket does not lie cyclically between the hole and their current position.
    private void shiftBack(int hole) {
        int i = hole;
        while (true) {
            i = (i + 1) & mask;
            if (nodes[i] == null) {
                break;
            }
            int home = indexOf(keys[i]);
            boolean reachable = (hole <= i) ? (hole < home && home <= i) : (hole < home || home <= i);
            if (!reachable) {
                keys[hole] = keys[i];
                nodes[hole] = nodes[i];
                hole = i;
            }
        }
        keys[hole] = 0L;
        nodes[hole] = null;
    }

    private int indexOf(long key) {
        return spread(key) & mask;
    }

    /**
     * Applies a supplemental hash function to defend against poor quality keys, such as
     * sequential ids. The low bits of the result pick the bucket.
     */
    static int spread(long key) {
        long h = key;
        h ^= h >>> 33;
        h *= 0xff51afd7ed558ccdL;
        h ^= h >>> 33;
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= h >>> 33;
        return (int) h;
    }

    static int ceilingPowerOfTwo(int x) {
        if (x <= 1) {
            return 1;
        }
        return 1 << (32 - Integer.numberOfLeadingZeros(x - 1));
    }
}
