package com.github.rudygunawan.slotcache.loader;

/**
 * Retrieves raw records, based on a key, for use in populating a {@link CachingLoader}.
 *
 * <p>Usage example:
 * <pre>{@code
 * CacheLoader loader = key -> database.fetch(key);   // null when there is no such record
 * CachingLoader records = new CachingLoader(cache, loader);
 * }</pre>
 */
@FunctionalInterface
public interface CacheLoader {

    /**
     * Retrieves the record for {@code key} from the backing source.
     *
     * @param key the record key
     * @return the record bytes, or {@code null} if the source has no record for {@code key}. The
     *         caller copies the array, so the loader may reuse it.
     * @throws Exception if unable to reach the source; nothing is cached in that case
     */
    byte[] load(long key) throws Exception;
}
