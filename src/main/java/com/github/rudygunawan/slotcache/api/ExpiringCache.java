package com.github.rudygunawan.slotcache.api;

/**
 * An {@link AccessOrderedCache} whose entries expire a fixed number of seconds after creation.
 *
 * <p>An entry is expired once {@code now - createTime >= lifetime}. Entries whose value is empty
 * use {@link #emptyLifetime()} instead, which lets "not found" markers age out sooner than real
 * data. Expired entries are removed lazily: a lookup that finds one removes it (notifying the
 * removal listener with cause {@link com.github.rudygunawan.slotcache.policy.RemovalCause#EXPIRED})
 * and reports a miss. {@link #cleanUp()} removes all of them at once.
 *
 * <p>If the clock went backwards so that the creation time lies in the future, the entry is not
 * considered expired.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * ExpiringCache<OwnedBuffer> cache = CacheBuilder.newBuilder()
 *     .maximumSize(10_000)
 *     .growableValues()
 *     .expireAfterCreate(60, TimeUnit.SECONDS)
 *     .expireEmptyAfterCreate(5, TimeUnit.SECONDS)
 *     .buildExpiringLru();
 * }</pre>
 *
 * @param <V> the value type
 */
public interface ExpiringCache<V> extends AccessOrderedCache<V> {

    /**
     * Looks up {@code key} like {@link #get(long)} and reports whether it was live, expired (and
     * therefore removed now) or absent.
     */
    EntryState check(long key);

    /**
     * Returns the number of lookups that found an expired entry since creation or the last
     * {@link #resetStats()}.
     */
    long expiredCount();

    /**
     * Removes every expired entry.
     *
     * @return the number of entries removed
     */
    int cleanUp();

    /**
     * Returns the lifetime of non-empty entries in seconds.
     */
    long lifetime();

    /**
     * Sets the lifetime of non-empty entries.
     *
     * @throws IllegalArgumentException if {@code seconds < 1}
     */
    void setLifetime(long seconds);

    /**
     * Returns the lifetime of entries with an empty value in seconds.
     */
    long emptyLifetime();

    /**
     * Sets the lifetime of entries with an empty value.
     *
     * @throws IllegalArgumentException if {@code seconds < 1}
     */
    void setEmptyLifetime(long seconds);
}
