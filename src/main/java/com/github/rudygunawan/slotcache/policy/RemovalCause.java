package com.github.rudygunawan.slotcache.policy;

/**
 * The reason why a cached entry was removed.
 */
public enum RemovalCause {
    /**
     * The entry was manually removed by the user using
     * {@link com.github.rudygunawan.slotcache.api.OrderedCache#remove(long)}.
     */
    EXPLICIT,

    /**
     * The entry held the least favorable metric of a full cache and made room for a new entry.
     */
    SIZE,

    /**
     * The entry was older than the configured lifetime when it was next looked up or when the
     * cache was cleaned up.
     */
    EXPIRED;

    /**
     * Returns {@code true} if the removal was caused by eviction (either SIZE or EXPIRED),
     * rather than manual removal.
     */
    public boolean wasEvicted() {
        return this == SIZE || this == EXPIRED;
    }
}
