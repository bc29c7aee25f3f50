package com.github.rudygunawan.slotcache.builder;

import com.github.rudygunawan.slotcache.api.AccessOrderedCache;
import com.github.rudygunawan.slotcache.api.ExpiringCache;
import com.github.rudygunawan.slotcache.api.PriorityCache;
import com.github.rudygunawan.slotcache.impl.AccessOrderedCacheImpl;
import com.github.rudygunawan.slotcache.impl.ExpiringCacheImpl;
import com.github.rudygunawan.slotcache.impl.LruCacheImpl;
import com.github.rudygunawan.slotcache.impl.PriorityCacheImpl;
import com.github.rudygunawan.slotcache.listener.RemovalListener;
import com.github.rudygunawan.slotcache.policy.AdmissionPolicy;
import com.github.rudygunawan.slotcache.time.Ticker;
import com.github.rudygunawan.slotcache.value.FixedBytes;
import com.github.rudygunawan.slotcache.value.GrowableBytes;
import com.github.rudygunawan.slotcache.value.ObjectValues;
import com.github.rudygunawan.slotcache.value.OwnedBuffer;
import com.github.rudygunawan.slotcache.value.ValueKind;

import java.util.concurrent.TimeUnit;

/**
 * A builder of bounded ordered caches. Every cache has a fixed maximum size and allocates all of
 * its storage when built; the terminal method picks the eviction order:
 *
 * <ul>
 *   <li>{@link #buildPriority()} - caller-supplied priorities, lowest evicted first
 *   <li>{@link #buildAccessOrdered()} - last access time, oldest evicted first
 *   <li>{@link #buildLru()} - least recently used, on top of a priority cache
 *   <li>{@link #buildExpiring()} / {@link #buildExpiringLru()} - either time order plus a lifetime
 *       measured from creation
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * ExpiringCache<OwnedBuffer> records = CacheBuilder.newBuilder()
 *     .maximumSize(10_000)
 *     .growableValues()
 *     .expireAfterCreate(5, TimeUnit.MINUTES)
 *     .expireEmptyAfterCreate(30, TimeUnit.SECONDS)
 *     .removalListener((key, value, cause) -> log(key, cause))
 *     .buildExpiringLru();
 * }</pre>
 *
 * <p>Values are plain object references unless {@link #fixedSizeValues(int)},
 * {@link #growableValues()} or {@link #values(ValueKind)} selects another representation.
 *
 * @param <V> the type of values
 */
public class CacheBuilder<V> {
    private static final long UNSET = -1;

    private int maximumSize = (int) UNSET;
    private ValueKind<?> valueKind = ObjectValues.create();
    private Ticker ticker = Ticker.systemTicker();
    private AdmissionPolicy admissionPolicy = AdmissionPolicy.alwaysAdmit();
    private RemovalListener<? super V> removalListener;
    private long lifetimeSeconds = UNSET;
    private long emptyLifetimeSeconds = UNSET;

    private CacheBuilder() {
    }

    /**
     * Constructs a new {@code CacheBuilder} instance with default settings: object values, the
     * system ticker and an admission policy that always admits.
     */
    public static CacheBuilder<Object> newBuilder() {
        return new CacheBuilder<>();
    }

    /**
     * Specifies the maximum number of entries the cache may contain. Storage for that many entries
     * is allocated when the cache is built. When the cache is full, creating an entry evicts the
     * entry with the lowest metric.
     *
     * <p>This option is required.
     *
     * @param size the maximum number of entries
     * @return this builder instance
     * @throws IllegalArgumentException if {@code size} is not positive
     * @throws IllegalStateException if the maximum size was already set
     */
    public CacheBuilder<V> maximumSize(int size) {
        if (this.maximumSize != UNSET) {
            throw new IllegalStateException("maximum size was already set to " + this.maximumSize);
        }
        if (size <= 0) {
            throw new IllegalArgumentException("maximum size must be positive: " + size);
        }
        this.maximumSize = size;
        return this;
    }

    /**
     * Specifies how values are stored in the pre-allocated slots.
     *
     * <p>The value representation decides the value type, so it must be chosen before a removal
     * listener is set.
     *
     * @param kind the value representation
     * @return this builder instance
     * @throws IllegalStateException if a removal listener was already set
     */
    public <V1> CacheBuilder<V1> values(ValueKind<V1> kind) {
        if (kind == null) {
            throw new NullPointerException("value kind cannot be null");
        }
        if (removalListener != null) {
            throw new IllegalStateException("value kind must be set before the removal listener");
        }
        @SuppressWarnings("unchecked")
        CacheBuilder<V1> me = (CacheBuilder<V1>) this;
        me.valueKind = kind;
        return me;
    }

    /**
     * Stores every value as a {@code byte[]} of exactly {@code size} bytes, allocated once per slot.
     *
     * @param size the length of every value
     * @return this builder instance
     * @throws IllegalArgumentException if {@code size} is negative
     * @throws IllegalStateException if a removal listener was already set
     */
    public CacheBuilder<byte[]> fixedSizeValues(int size) {
        return values(FixedBytes.of(size));
    }

    /**
     * Stores every value in an {@link OwnedBuffer} that copies its input and keeps its capacity
     * when the slot is reused.
     *
     * @return this builder instance
     * @throws IllegalStateException if a removal listener was already set
     */
    public CacheBuilder<OwnedBuffer> growableValues() {
        return values(GrowableBytes.instance());
    }

    /**
     * Specifies the time source of time-ordered and expiring caches. Priority caches ignore it.
     *
     * <p>This option is not required; by default {@link Ticker#systemTicker()} is used.
     *
     * @param ticker the time source
     * @return this builder instance
     */
    public CacheBuilder<V> ticker(Ticker ticker) {
        if (ticker == null) {
            throw new NullPointerException("ticker cannot be null");
        }
        this.ticker = ticker;
        return this;
    }

    /**
     * Specifies whether a new entry that is less favorable than every stored entry may still
     * displace the lowest one.
     *
     * <p>This option is not required; by default {@link AdmissionPolicy#alwaysAdmit()} is used.
     *
     * @param policy the admission policy
     * @return this builder instance
     */
    public CacheBuilder<V> admissionPolicy(AdmissionPolicy policy) {
        if (policy == null) {
            throw new NullPointerException("admission policy cannot be null");
        }
        this.admissionPolicy = policy;
        return this;
    }

    /**
     * Specifies a listener that caches notify each time an entry is removed, except by
     * {@code clear()}.
     *
     * <p><b>Warning:</b> all exceptions thrown by {@code listener} will be logged and then swallowed.
     *
     * @param listener the removal listener to use
     * @return this builder instance
     */
    public <V1 extends V> CacheBuilder<V1> removalListener(RemovalListener<? super V1> listener) {
        if (listener == null) {
            throw new NullPointerException("removal listener cannot be null");
        }
        @SuppressWarnings("unchecked")
        CacheBuilder<V1> me = (CacheBuilder<V1>) this;
        me.removalListener = listener;
        return me;
    }

    /**
     * Specifies that each entry expires once {@code duration} has elapsed since it was created.
     * Only used by {@link #buildExpiring()} and {@link #buildExpiringLru()}, which require it.
     *
     * <p>Lifetimes are measured in whole seconds; the duration is truncated to seconds.
     *
     * @param duration the lifetime of an entry
     * @param unit the unit that {@code duration} is expressed in
     * @return this builder instance
     * @throws IllegalArgumentException if the duration is shorter than one second
     */
    public CacheBuilder<V> expireAfterCreate(long duration, TimeUnit unit) {
        this.lifetimeSeconds = toLifetime(duration, unit);
        return this;
    }

    /**
     * Specifies a separate lifetime for entries whose value is empty (a {@code null} object, an
     * empty buffer or zero-length fixed values). Typically shorter than the regular lifetime so
     * that "not found" markers are retried sooner.
     *
     * <p>This option is not required; by default empty entries use the regular lifetime.
     *
     * @param duration the lifetime of an entry with an empty value
     * @param unit the unit that {@code duration} is expressed in
     * @return this builder instance
     * @throws IllegalArgumentException if the duration is shorter than one second
     */
    public CacheBuilder<V> expireEmptyAfterCreate(long duration, TimeUnit unit) {
        this.emptyLifetimeSeconds = toLifetime(duration, unit);
        return this;
    }

    private static long toLifetime(long duration, TimeUnit unit) {
        if (unit == null) {
            throw new NullPointerException("unit cannot be null");
        }
        long seconds = unit.toSeconds(duration);
        if (seconds < 1) {
            throw new IllegalArgumentException(
                    "lifetime must be at least 1 second: " + duration + " " + unit);
        }
        return seconds;
    }

    /**
     * Builds a cache ordered by caller-supplied priorities.
     *
     * @return a cache having the requested features
     * @throws IllegalStateException if no maximum size was set
     */
    public <V1 extends V> PriorityCache<V1> buildPriority() {
        return newPriorityCache();
    }

    /**
     * Builds a cache ordered by last access time.
     *
     * @return a cache having the requested features
     * @throws IllegalStateException if no maximum size was set
     */
    public <V1 extends V> AccessOrderedCache<V1> buildAccessOrdered() {
        return newAccessOrderedCache();
    }

    /**
     * Builds a least-recently-used cache. It behaves like {@link #buildAccessOrdered()}, but keeps
     * its entries in a priority cache whose priorities are the access times.
     *
     * @return a cache having the requested features
     * @throws IllegalStateException if no maximum size was set
     */
    public <V1 extends V> AccessOrderedCache<V1> buildLru() {
        return newLruCache();
    }

    /**
     * Builds an access-ordered cache whose entries expire after the configured lifetime.
     *
     * @return a cache having the requested features
     * @throws IllegalStateException if no maximum size or no lifetime was set
     */
    public <V1 extends V> ExpiringCache<V1> buildExpiring() {
        checkLifetime();
        return new ExpiringCacheImpl<>(this.<V1>newAccessOrderedCache(), lifetimeSeconds, emptyLifetime());
    }

    /**
     * Builds an LRU cache whose entries expire after the configured lifetime.
     *
     * @return a cache having the requested features
     * @throws IllegalStateException if no maximum size or no lifetime was set
     */
    public <V1 extends V> ExpiringCache<V1> buildExpiringLru() {
        checkLifetime();
        return new ExpiringCacheImpl<>(this.<V1>newLruCache(), lifetimeSeconds, emptyLifetime());
    }

    private <V1 extends V> PriorityCacheImpl<V1> newPriorityCache() {
        checkMaximumSize();
        return new PriorityCacheImpl<V1>(maximumSize, valueKind(), admissionPolicy, removalListener);
    }

    private <V1 extends V> AccessOrderedCacheImpl<V1> newAccessOrderedCache() {
        checkMaximumSize();
        return new AccessOrderedCacheImpl<V1>(maximumSize, valueKind(), admissionPolicy, removalListener, ticker);
    }

    private <V1 extends V> LruCacheImpl<V1> newLruCache() {
        return new LruCacheImpl<V1>(this.<V1>newPriorityCache(), ticker);
    }

    @SuppressWarnings("unchecked")
    private <V1 extends V> ValueKind<V1> valueKind() {
        return (ValueKind<V1>) valueKind;
    }

    private void checkMaximumSize() {
        if (maximumSize == UNSET) {
            throw new IllegalStateException("maximumSize must be set");
        }
    }

    private void checkLifetime() {
        if (lifetimeSeconds == UNSET) {
            throw new IllegalStateException("expireAfterCreate must be set for an expiring cache");
        }
    }

    private long emptyLifetime() {
        return emptyLifetimeSeconds == UNSET ? lifetimeSeconds : emptyLifetimeSeconds;
    }

    // Getters for the configured values

    public int getMaximumSize() {
        return maximumSize;
    }

    public ValueKind<?> getValueKind() {
        return valueKind;
    }

    public Ticker getTicker() {
        return ticker;
    }

    public AdmissionPolicy getAdmissionPolicy() {
        return admissionPolicy;
    }

    public RemovalListener<? super V> getRemovalListener() {
        return removalListener;
    }

    public long getLifetimeSeconds() {
        return lifetimeSeconds;
    }

    public long getEmptyLifetimeSeconds() {
        return emptyLifetime();
    }
}
