package com.github.rudygunawan.slotcache.impl;

import com.github.rudygunawan.slotcache.api.PriorityCache;
import com.github.rudygunawan.slotcache.api.ValueRef;
import com.github.rudygunawan.slotcache.builder.CacheBuilder;
import com.github.rudygunawan.slotcache.policy.AdmissionPolicy;
import com.github.rudygunawan.slotcache.policy.RemovalCause;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the priority cache.
 */
class PriorityCacheTest {

    @Test
    void testLowestPriorityIsEvicted() {
        List<Long> evicted = new ArrayList<>();
        PriorityCache<String> cache = CacheBuilder.newBuilder()
                .maximumSize(2)
                .removalListener((key, value, cause) -> evicted.add(key))
                .buildPriority();

        cache.create(0xA, 5);
        cache.create(0xB, 10);
        // 1 is below the current minimum 5; the default policy still admits it
        assertNotNull(cache.create(0xC, 1));

        assertEquals(List.of(0xAL), evicted);
        assertFalse(cache.exists(0xA));
        assertTrue(cache.exists(0xB));
        assertTrue(cache.exists(0xC));
        assertEquals(2, cache.size());
    }

    @Test
    void testRejectLessFavorablePolicyKeepsStoredEntries() {
        PriorityCache<String> cache = CacheBuilder.newBuilder()
                .maximumSize(2)
                .admissionPolicy(AdmissionPolicy.rejectLessFavorable())
                .buildPriority();

        cache.put(1L, 5, "five");
        cache.put(2L, 10, "ten");
        assertNull(cache.put(3L, 1, "one"));
        assertNull(cache.getOrCreate(3L, 1));
        assertTrue(cache.exists(1L));
        assertTrue(cache.exists(2L));
        assertFalse(cache.exists(3L));

        assertNotNull(cache.put(4L, 7, "seven"), "a better priority is always admitted");
        assertFalse(cache.exists(1L));
    }

    @Test
    void testCreateUpdatesPriorityOfExistingEntry() {
        PriorityCache<String> cache = CacheBuilder.newBuilder().maximumSize(4).buildPriority();
        cache.put(1L, 5, "x");
        ValueRef<String> ref = cache.create(1L, 50);
        assertTrue(ref.existed());
        assertEquals("x", ref.get());
        assertEquals(OptionalLong.of(50), cache.priorityOf(1L));
    }

    @Test
    void testGetOrCreateKeepsPriorityWhileGetUpdateOrCreateChangesIt() {
        PriorityCache<String> cache = CacheBuilder.newBuilder().maximumSize(4).buildPriority();

        ValueRef<String> created = cache.getOrCreate(1L, 5);
        assertFalse(created.existed());
        ValueRef<String> existing = cache.getOrCreate(1L, 99);
        assertTrue(existing.existed());
        assertEquals(5, existing.metric());

        ValueRef<String> updated = cache.getUpdateOrCreate(1L, 99);
        assertTrue(updated.existed());
        assertEquals(99, updated.metric());

        ValueRef<String> fresh = cache.getUpdateOrCreate(2L, 3);
        assertFalse(fresh.existed());
        assertEquals(3, fresh.metric());
    }

    @Test
    void testUpdatePriority() {
        PriorityCache<String> cache = CacheBuilder.newBuilder().maximumSize(4).buildPriority();
        cache.put(1L, 1, "a");
        cache.put(2L, 2, "b");
        assertNotNull(cache.updatePriority(1L, 3));
        assertNull(cache.updatePriority(9L, 3));
        assertEquals(2L, cache.lowest().key());
        assertEquals(1L, cache.highest().key());
        assertEquals(2, cache.lookups());
        assertEquals(1, cache.misses());
    }

    @Test
    void testPriorityOfAbsentKey() {
        PriorityCache<String> cache = CacheBuilder.newBuilder().maximumSize(1).buildPriority();
        assertEquals(OptionalLong.empty(), cache.priorityOf(42L));
        assertEquals(0, cache.lookups(), "priorityOf does not count");
    }

    @Test
    void testTrackMissesFlag() {
        PriorityCache<String> cache = CacheBuilder.newBuilder().maximumSize(2).buildPriority();
        cache.put(1L, 1, "a");
        cache.get(1L);
        cache.get(2L);
        cache.get(2L, false);
        cache.get(1L, false);
        assertEquals(2, cache.lookups());
        assertEquals(1, cache.misses());
        assertEquals(1, cache.stats().hitCount());
    }

    @Test
    void testNegativePrioritiesOrderAsSignedValues() {
        PriorityCache<String> cache = CacheBuilder.newBuilder().maximumSize(3).buildPriority();
        cache.create(1L, -1);
        cache.create(2L, Long.MIN_VALUE);
        cache.create(3L, Long.MAX_VALUE);
        assertEquals(2L, cache.lowest().key());
        assertEquals(3L, cache.highest().key());

        List<Long> keys = new ArrayList<>();
        for (ValueRef<String> ref : cache.descending()) {
            keys.add(ref.key());
        }
        assertEquals(List.of(3L, 1L, 2L), keys);
    }

    @Test
    void testRemoveAbsentKeyReturnsFalse() {
        PriorityCache<String> cache = CacheBuilder.newBuilder().maximumSize(2).buildPriority();
        cache.put(1L, 1, "a");
        assertFalse(cache.remove(5L));
        assertEquals(1, cache.size());
        assertTrue(cache.remove(1L));
        assertEquals(0, cache.size());
    }

    @Test
    void testExplicitRemovalCause() {
        List<RemovalCause> causes = new ArrayList<>();
        PriorityCache<String> cache = CacheBuilder.newBuilder()
                .maximumSize(1)
                .removalListener((key, value, cause) -> causes.add(cause))
                .buildPriority();
        cache.put(1L, 1, "a");
        cache.remove(1L);
        cache.put(2L, 1, "b");
        cache.put(3L, 2, "c");
        cache.clear();
        assertEquals(List.of(RemovalCause.EXPLICIT, RemovalCause.SIZE), causes);
        assertFalse(causes.get(0).wasEvicted());
        assertTrue(causes.get(1).wasEvicted());
    }

    @Test
    void testSizeNeverExceedsCapacity() {
        PriorityCacheImpl<Long> cache = (PriorityCacheImpl<Long>) CacheBuilder.newBuilder()
                .maximumSize(10)
                .<Long>buildPriority();
        for (long k = 0; k < 1000; k++) {
            cache.put(k, (k * 7919) % 101, k);
            assertTrue(cache.size() <= cache.capacity());
        }
        cache.verifyIntegrity();
        assertEquals(10, cache.size());
        for (ValueRef<Long> ref : cache.ascending()) {
            assertEquals(ref.key(), ref.get().longValue());
        }
        assertEquals(990, cache.evictionCount());
    }
}
