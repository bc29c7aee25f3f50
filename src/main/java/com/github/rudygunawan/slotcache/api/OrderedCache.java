package com.github.rudygunawan.slotcache.api;

import com.github.rudygunawan.slotcache.model.CacheStats;

/**
 * A bounded in-memory cache of {@code long} keys whose entries are ordered by a {@code long}
 * metric. When the cache is full, creating a new entry evicts the entry with the lowest metric.
 *
 * <p>The metric is supplied by the caller ({@link PriorityCache}) or derived from the clock
 * ({@link AccessOrderedCache}). Ties are broken by slot position, so which of several entries with
 * the same lowest metric is evicted is deterministic but otherwise unspecified.
 *
 * <p>All storage is allocated when the cache is built: {@link #capacity()} slots, an order index
 * and a key index of the same capacity. Nothing grows afterwards.
 *
 * <p><b>Thread safety:</b> implementations are not thread-safe. Callers that share a cache between
 * threads must guard every call, including the use of returned {@link ValueRef}s, with one lock.
 *
 * <p><b>Basic usage:</b>
 * <pre>{@code
 * PriorityCache<String> cache = CacheBuilder.newBuilder()
 *     .maximumSize(2)
 *     .buildPriority();
 *
 * cache.put(1L, 5, "five");
 * cache.put(2L, 10, "ten");
 * cache.put(3L, 1, "one");    // evicts key 1, the lowest priority
 *
 * ValueRef<String> ref = cache.get(2L);
 * if (ref != null) {
 *     System.out.println(ref.get());
 * }
 * }</pre>
 *
 * @param <V> the value type
 */
public interface OrderedCache<V> {

    /**
     * Looks up {@code key}. The lookup is counted in the statistics.
     *
     * @return a reference to the value, or {@code null} if the key is not cached
     */
    ValueRef<V> get(long key);

    /**
     * Returns whether {@code key} is cached, without counting a lookup or changing the order.
     */
    boolean exists(long key);

    /**
     * Removes the entry for {@code key} and notifies the removal listener with cause
     * {@link com.github.rudygunawan.slotcache.policy.RemovalCause#EXPLICIT}.
     *
     * @return {@code true} if an entry was removed
     */
    boolean remove(long key);

    /**
     * Removes every entry. The removal listener is not notified.
     */
    void clear();

    /**
     * Returns the number of entries.
     */
    int size();

    /**
     * Returns the maximum number of entries.
     */
    int capacity();

    /**
     * Returns the entry with the lowest metric, which is the next eviction candidate, or
     * {@code null} if the cache is empty.
     */
    ValueRef<V> first();

    /**
     * Returns the entry with the highest metric, or {@code null} if the cache is empty.
     */
    ValueRef<V> last();

    /**
     * Returns the entries in ascending metric order. Values may be modified through the yielded
     * references; changing the cache itself during iteration makes the iterator throw
     * {@link java.util.ConcurrentModificationException}.
     */
    Iterable<ValueRef<V>> ascending();

    /**
     * Returns the entries in descending metric order. See {@link #ascending()}.
     */
    Iterable<ValueRef<V>> descending();

    /**
     * Returns the number of counted lookups since creation or the last {@link #resetStats()}.
     */
    long lookups();

    /**
     * Returns the number of counted lookups that did not find a live entry.
     */
    long misses();

    /**
     * Returns a snapshot of the statistics.
     */
    CacheStats stats();

    /**
     * Resets the lookup, miss and expiry counters.
     */
    void resetStats();
}
