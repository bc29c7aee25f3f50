package com.github.rudygunawan.slotcache.api;

/**
 * A reference to the value of one live cache entry.
 *
 * <p>A reference is only valid until the next structural change of the cache that returned it:
 * a remove, a create that evicts another entry, an expiry, or a clear. Using it afterwards throws
 * {@link java.util.ConcurrentModificationException}. Metric changes (priority updates, access time
 * refreshes) do not invalidate references. Copy out anything that must be kept longer.
 *
 * <p>What {@link #get()} returns depends on the value representation of the cache:
 * <ul>
 *   <li>fixed-size bytes - the slot's own {@code byte[]}, which may be written in place;</li>
 *   <li>growable bytes - the slot's own {@link com.github.rudygunawan.slotcache.value.OwnedBuffer};</li>
 *   <li>object references - the stored object, or {@code null} if nothing was stored yet.</li>
 * </ul>
 *
 * @param <V> the value type
 */
public interface ValueRef<V> {

    /**
     * Returns the key of the entry.
     */
    long key();

    /**
     * Returns the current value of the entry.
     *
     * @throws java.util.ConcurrentModificationException if the reference is stale
     */
    V get();

    /**
     * Stores {@code value} in the entry. Byte values are copied into the slot.
     *
     * @throws IllegalArgumentException if {@code value} does not fit the slot (wrong length for
     *         fixed-size values)
     * @throws java.util.ConcurrentModificationException if the reference is stale
     */
    void set(V value);

    /**
     * Returns the ordering metric of the entry: its priority, or its last access time in seconds.
     *
     * @throws java.util.ConcurrentModificationException if the reference is stale
     */
    long metric();

    /**
     * Returns whether the entry already existed when the operation that produced this reference
     * ran. Always {@code true} for references returned by lookups and iteration.
     */
    boolean existed();
}
