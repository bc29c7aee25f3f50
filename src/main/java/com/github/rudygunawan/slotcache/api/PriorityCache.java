package com.github.rudygunawan.slotcache.api;

import java.util.OptionalLong;

/**
 * An {@link OrderedCache} whose metric is a priority supplied by the caller. When the cache is
 * full the entry with the lowest priority is evicted.
 *
 * <p>If the new entry has a lower priority than every stored entry, the configured
 * {@link com.github.rudygunawan.slotcache.policy.AdmissionPolicy} decides whether it still
 * replaces the lowest one. Operations that may create an entry return {@code null} when the
 * policy rejects it.
 *
 * @param <V> the value type
 */
public interface PriorityCache<V> extends OrderedCache<V> {

    /**
     * Looks up {@code key}, counting the lookup only if {@code trackMisses} is {@code true}.
     */
    ValueRef<V> get(long key, boolean trackMisses);

    /**
     * Creates an entry for {@code key} with {@code priority}, or sets the priority of the existing
     * entry.
     *
     * @return a reference to the value, or {@code null} if admission was rejected
     */
    ValueRef<V> create(long key, long priority);

    /**
     * Returns the existing entry for {@code key} unchanged, or creates one with {@code priority}.
     * The lookup is counted. {@link ValueRef#existed()} tells which case applied.
     *
     * @return a reference to the value, or {@code null} if a new entry was rejected
     */
    ValueRef<V> getOrCreate(long key, long priority);

    /**
     * Like {@link #getOrCreate(long, long)}, but also sets the priority of an existing entry.
     */
    ValueRef<V> getUpdateOrCreate(long key, long priority);

    /**
     * Sets the priority of the entry for {@code key}, if there is one. The lookup is counted.
     *
     * @return a reference to the value, or {@code null} if the key is not cached
     */
    ValueRef<V> updatePriority(long key, long priority);

    /**
     * Creates or updates the entry for {@code key} with {@code priority} and stores {@code value}.
     *
     * @return a reference to the stored value, or {@code null} if admission was rejected
     */
    ValueRef<V> put(long key, long priority, V value);

    /**
     * Returns the priority of {@code key} without counting a lookup.
     */
    OptionalLong priorityOf(long key);

    /**
     * Returns the entry with the highest priority, or {@code null} if the cache is empty.
     */
    ValueRef<V> highest();

    /**
     * Returns the entry with the lowest priority, or {@code null} if the cache is empty.
     */
    ValueRef<V> lowest();
}
