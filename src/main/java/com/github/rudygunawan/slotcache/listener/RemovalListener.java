package com.github.rudygunawan.slotcache.listener;

import com.github.rudygunawan.slotcache.policy.RemovalCause;

/**
 * A listener that receives notification when an entry is removed from a cache.
 *
 * <p>The listener is invoked synchronously, after the entry has left both indices but before its
 * slot is reused. The value passed in is the live slot content: once the listener returns, the
 * cache resets it (fixed-size bytes are zeroed, growable buffers are emptied, object references
 * are dropped). Copy out anything that must outlive the call.
 *
 * <p>Implementations must not modify the cache that notified them. Exceptions thrown by the
 * listener are logged at {@code WARNING} and swallowed so the cache operation completes.
 *
 * <p>Usage example:
 * <pre>{@code
 * PriorityCache<byte[]> cache = CacheBuilder.newBuilder()
 *     .maximumSize(1024)
 *     .fixedSizeValues(32)
 *     .removalListener((key, value, cause) -> {
 *         if (cause == RemovalCause.SIZE) {
 *             spill(key, value.clone());
 *         }
 *     })
 *     .buildPriority();
 * }</pre>
 *
 * <p>{@link com.github.rudygunawan.slotcache.api.OrderedCache#clear()} does not notify.
 *
 * @param <V> the type of values
 */
@FunctionalInterface
public interface RemovalListener<V> {

    /**
     * Notifies the listener that an entry was removed.
     *
     * @param key the key of the removed entry
     * @param value the value of the removed entry; only valid for the duration of the call
     * @param cause the reason for the removal
     */
    void onRemoval(long key, V value, RemovalCause cause);
}
