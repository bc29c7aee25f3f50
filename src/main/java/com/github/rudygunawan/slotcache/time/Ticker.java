package com.github.rudygunawan.slotcache.time;

/**
 * A time source that returns the current wall-clock time in whole seconds.
 *
 * <p>Time-ordered caches use the ticker value as the ordering metric of an entry (its last access
 * time) and as its creation time. The primary purpose of this interface is to make those caches
 * testable without relying on the system clock: tests provide a fake ticker they control.
 *
 * <p><b>Production Usage:</b>
 * <pre>{@code
 * AccessOrderedCache<byte[]> cache = CacheBuilder.newBuilder()
 *     .maximumSize(1000)
 *     .fixedSizeValues(16)
 *     .buildLru();          // uses Ticker.systemTicker()
 * }</pre>
 *
 * <p><b>Testing Usage:</b>
 * <pre>{@code
 * FakeTicker ticker = new FakeTicker();
 *
 * ExpiringCache<Object> cache = CacheBuilder.newBuilder()
 *     .maximumSize(10)
 *     .ticker(ticker)
 *     .expireAfterCreate(10, TimeUnit.SECONDS)
 *     .buildExpiring();
 *
 * cache.put(1L, "value");
 * ticker.advance(11, TimeUnit.SECONDS);
 * assertNull(cache.get(1L));
 * }</pre>
 */
@FunctionalInterface
public interface Ticker {

    /**
     * Returns the current time in seconds.
     *
     * <p>Unlike {@link System#nanoTime()} this is wall-clock time, so it may occasionally go
     * backwards (for example after a clock adjustment). Caches tolerate that: see
     * {@link com.github.rudygunawan.slotcache.policy.AdmissionPolicy}.
     *
     * @return the current time in seconds
     */
    long read();

    /**
     * Returns a ticker that reads the current time using {@link System#currentTimeMillis()}.
     *
     * <p>This is the default ticker used by caches when no custom ticker is specified.
     *
     * @return a ticker backed by the system wall clock
     */
    static Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }

    /**
     * Default system ticker implementation.
     */
    enum SystemTicker implements Ticker {
        INSTANCE;

        @Override
        public long read() {
            return System.currentTimeMillis() / 1000L;
        }

        @Override
        public String toString() {
            return "Ticker.systemTicker()";
        }
    }
}
