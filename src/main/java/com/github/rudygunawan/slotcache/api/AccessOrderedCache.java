package com.github.rudygunawan.slotcache.api;

/**
 * An {@link OrderedCache} ordered by the time of the last access, in seconds from the cache's
 * {@link com.github.rudygunawan.slotcache.time.Ticker}. Every lookup or creation sets the access
 * time of the entry to now, so a full cache evicts the least recently used entry.
 *
 * <p>Each entry also records its creation time, which expiring caches compare against their
 * lifetime.
 *
 * <p>A new entry can only be less favorable than the oldest stored one when the clock went
 * backwards. The configured admission policy decides that case; creating operations return
 * {@code null} when it rejects.
 *
 * @param <V> the value type
 */
public interface AccessOrderedCache<V> extends OrderedCache<V> {

    /**
     * Creates an entry for {@code key}, or touches the existing one. Either way the creation time
     * is set to now.
     *
     * @return a reference to the value, or {@code null} if admission was rejected
     */
    ValueRef<V> create(long key);

    /**
     * Returns the entry for {@code key}, touching it, or creates one. The creation time is set
     * only for a new entry. {@link ValueRef#existed()} tells which case applied.
     *
     * @return a reference to the value, or {@code null} if a new entry was rejected
     */
    ValueRef<V> getOrCreate(long key);

    /**
     * Stores {@code value} under {@code key}, creating the entry if needed.
     *
     * @return {@code true} if the key already existed; {@code false} if it was created or
     *         admission was rejected
     */
    boolean put(long key, V value);

    /**
     * Returns the last access time of {@code key} in seconds, or {@code 0} if it is not cached.
     * Does not touch the entry.
     */
    long accessTime(long key);

    /**
     * Returns the creation time of {@code key} in seconds, or {@code 0} if it is not cached.
     */
    long createTime(long key);
}
