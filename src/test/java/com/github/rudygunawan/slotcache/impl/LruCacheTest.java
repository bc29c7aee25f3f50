package com.github.rudygunawan.slotcache.impl;

import com.github.rudygunawan.slotcache.api.AccessOrderedCache;
import com.github.rudygunawan.slotcache.api.ValueRef;
import com.github.rudygunawan.slotcache.builder.CacheBuilder;
import com.github.rudygunawan.slotcache.time.FakeTicker;
import com.google.common.cache.Cache;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the LRU cache, including a differential run against Guava's cache as a reference
 * LRU model.
 */
class LruCacheTest {

    private final FakeTicker ticker = new FakeTicker();

    private AccessOrderedCache<String> newCache(int size) {
        return CacheBuilder.newBuilder().maximumSize(size).ticker(ticker).buildLru();
    }

    @Test
    void testLeastRecentlyTouchedIsEvicted() {
        AccessOrderedCache<String> cache = newCache(2);
        ticker.setSeconds(1);
        cache.put(1L, "one");
        ticker.setSeconds(2);
        cache.put(2L, "two");
        ticker.setSeconds(3);
        assertNotNull(cache.get(1L));
        ticker.setSeconds(4);
        cache.put(3L, "three");

        assertTrue(cache.exists(1L));
        assertFalse(cache.exists(2L));
        assertTrue(cache.exists(3L));
    }

    @Test
    void testEveryTouchRefreshes() {
        AccessOrderedCache<String> cache = newCache(3);
        ticker.setSeconds(10);
        cache.put(1L, "a");
        ticker.setSeconds(20);
        cache.getOrCreate(1L);
        assertEquals(20, cache.accessTime(1L));
        ticker.setSeconds(30);
        cache.put(1L, "b");
        assertEquals(30, cache.accessTime(1L));
        ticker.setSeconds(40);
        cache.create(1L);
        assertEquals(40, cache.accessTime(1L));
        assertEquals(40, cache.createTime(1L));
    }

    @Test
    void testRecordsCreateTime() {
        AccessOrderedCache<String> cache = newCache(2);
        ticker.setSeconds(100);
        cache.put(1L, "a");
        ticker.setSeconds(150);
        cache.get(1L);
        assertEquals(100, cache.createTime(1L));
        assertEquals(150, cache.accessTime(1L));
    }

    @Test
    void testPriorityViewSeesAccessTimes() {
        LruCacheImpl<String> cache = (LruCacheImpl<String>) newCache(3);
        ticker.setSeconds(5);
        cache.put(1L, "a");
        ticker.setSeconds(6);
        cache.put(2L, "b");
        assertEquals(2L, cache.priorities().highest().key());
        assertEquals(1L, cache.priorities().lowest().key());
        cache.verifyIntegrity();
    }

    @Test
    void testIterationFromOldestToNewest() {
        AccessOrderedCache<String> cache = newCache(4);
        for (long k = 1; k <= 4; k++) {
            ticker.advance(1);
            cache.put(k, "v" + k);
        }
        ticker.advance(1);
        cache.get(2L);

        List<Long> keys = new ArrayList<>();
        for (ValueRef<String> ref : cache.ascending()) {
            keys.add(ref.key());
        }
        assertEquals(List.of(1L, 3L, 4L, 2L), keys);
    }

    @Test
    void testMatchesGuavaLruUnderRandomWorkload() {
        int capacity = 32;
        AccessOrderedCache<String> cache = newCache(capacity);
        // a single segment makes Guava's eviction strict LRU
        Cache<Long, String> reference = com.google.common.cache.CacheBuilder.newBuilder()
                .maximumSize(capacity)
                .concurrencyLevel(1)
                .build();

        Random random = new Random(99);
        for (int step = 0; step < 20_000; step++) {
            // one second per operation so that access times never tie
            ticker.advance(1);
            long key = random.nextInt(100);
            if (random.nextInt(3) == 0) {
                String value = "v" + step;
                cache.put(key, value);
                reference.put(key, value);
            } else {
                ValueRef<String> ref = cache.get(key);
                String expected = reference.getIfPresent(key);
                if (expected == null) {
                    assertNull(ref, "step " + step + " key " + key);
                } else {
                    assertNotNull(ref, "step " + step + " key " + key);
                    assertEquals(expected, ref.get());
                }
            }
        }

        Set<Long> keys = new HashSet<>();
        for (ValueRef<String> ref : cache.ascending()) {
            keys.add(ref.key());
        }
        assertEquals(reference.asMap().keySet(), keys);
        ((LruCacheImpl<String>) cache).verifyIntegrity();
    }
}
