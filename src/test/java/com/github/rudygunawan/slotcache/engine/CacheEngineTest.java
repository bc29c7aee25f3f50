package com.github.rudygunawan.slotcache.engine;

import com.github.rudygunawan.slotcache.api.ValueRef;
import com.github.rudygunawan.slotcache.policy.AdmissionPolicy;
import com.github.rudygunawan.slotcache.policy.RemovalCause;
import com.github.rudygunawan.slotcache.value.FixedBytes;
import com.github.rudygunawan.slotcache.value.GrowableBytes;
import com.github.rudygunawan.slotcache.value.ObjectValues;
import com.github.rudygunawan.slotcache.value.OwnedBuffer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the cache engine: slot density, eviction of the minimum, admission, removal
 * notification and fail-fast references.
 */
class CacheEngineTest {

    private static CacheEngine<String> objectEngine(int capacity, List<String> removals) {
        return new CacheEngine<>(capacity, ObjectValues.create(), AdmissionPolicy.alwaysAdmit(),
                (key, value, cause) -> removals.add(key + "=" + value + ":" + cause));
    }

    // ========== Create / Lookup ==========

    @Test
    void testCreateThenLookup() {
        CacheEngine<String> engine = objectEngine(4, new ArrayList<>());
        SlotRef<String> created = engine.createOrGet(7L, 100);
        assertNotNull(created);
        assertFalse(created.existed());
        created.set("seven");

        SlotRef<String> again = engine.createOrGet(7L, 999);
        assertTrue(again.existed());
        assertEquals(100, again.metric(), "createOrGet leaves an existing metric alone");
        assertEquals("seven", again.get());

        SlotRef<String> found = engine.lookup(7L);
        assertEquals("seven", found.get());
        assertEquals(7L, found.key());
        assertNull(engine.lookup(8L));
        assertEquals(2, engine.lookupCount());
        assertEquals(1, engine.missCount());
        engine.verifyIntegrity();
    }

    @Test
    void testFindDoesNotCount() {
        CacheEngine<String> engine = objectEngine(2, new ArrayList<>());
        engine.createOrGet(1L, 1);
        engine.find(1L);
        engine.find(2L);
        assertEquals(0, engine.lookupCount());
        assertEquals(0, engine.missCount());
    }

    @Test
    void testLookupDoesNotReorder() {
        CacheEngine<String> engine = objectEngine(3, new ArrayList<>());
        engine.createOrGet(1L, 10);
        engine.createOrGet(2L, 20);
        engine.lookup(1L);
        assertEquals(1L, engine.first().key());
    }

    // ========== Eviction ==========

    @Test
    void testFullEngineEvictsMinimum() {
        List<String> removals = new ArrayList<>();
        CacheEngine<String> engine = objectEngine(3, removals);
        engine.createOrGet(1L, 30).set("a");
        engine.createOrGet(2L, 10).set("b");
        engine.createOrGet(3L, 20).set("c");

        SlotRef<String> ref = engine.createOrGet(4L, 40);
        assertNotNull(ref);
        assertFalse(ref.existed());
        assertEquals(3, engine.size());
        assertFalse(engine.contains(2L));
        assertEquals(List.of("2=b:SIZE"), removals);
        assertEquals(1, engine.evictionCount());
        assertNull(ref.get(), "a new object slot starts empty");
        engine.verifyIntegrity();
    }

    @Test
    void testLessFavorableEntryAdmittedByDefault() {
        List<String> removals = new ArrayList<>();
        CacheEngine<String> engine = objectEngine(2, removals);
        engine.createOrGet(1L, 5);
        engine.createOrGet(2L, 10);
        assertNotNull(engine.createOrGet(3L, 1));
        assertFalse(engine.contains(1L));
        assertTrue(engine.contains(2L));
        assertTrue(engine.contains(3L));
        assertEquals(1L, removals.size());
    }

    @Test
    void testAdmissionPolicyReceivesMetricsAndCanReject() {
        List<long[]> asked = new ArrayList<>();
        List<String> removals = new ArrayList<>();
        CacheEngine<String> engine = new CacheEngine<>(2, ObjectValues.create(),
                (newMetric, min) -> {
                    asked.add(new long[] {newMetric, min});
                    return false;
                },
                (key, value, cause) -> removals.add(key + ":" + cause));
        engine.createOrGet(1L, 5);
        engine.createOrGet(2L, 10);

        assertNull(engine.createOrGet(3L, 1));
        assertEquals(1, asked.size());
        assertArrayEquals(new long[] {1, 5}, asked.get(0));
        assertEquals(2, engine.size());
        assertFalse(engine.contains(3L));
        assertTrue(removals.isEmpty());
        assertEquals(0, engine.evictionCount());

        // an equal or higher metric never asks
        assertNotNull(engine.createOrGet(4L, 5));
        assertEquals(1, asked.size());
        assertEquals(List.of("1:SIZE"), removals);
        engine.verifyIntegrity();
    }

    // ========== Remove / Clear ==========

    @Test
    void testRemoveAbsentKeyLeavesEngineUnchanged() {
        List<String> removals = new ArrayList<>();
        CacheEngine<String> engine = objectEngine(2, removals);
        engine.createOrGet(1L, 1);
        assertFalse(engine.remove(99L, RemovalCause.EXPLICIT));
        assertEquals(1, engine.size());
        assertTrue(removals.isEmpty());
    }

    @Test
    void testRemoveNotifiesAndCompacts() {
        List<String> removals = new ArrayList<>();
        CacheEngine<String> engine = objectEngine(4, removals);
        for (long k = 1; k <= 4; k++) {
            engine.createOrGet(k, k).set("v" + k);
        }
        assertTrue(engine.remove(2L, RemovalCause.EXPLICIT));
        assertEquals(List.of("2=v2:EXPLICIT"), removals);
        assertEquals(3, engine.size());
        engine.verifyIntegrity();
        // the entry moved into the hole is still intact
        assertEquals("v4", engine.find(4L).get());
        assertEquals(4, engine.find(4L).metric());
    }

    @Test
    void testClearDoesNotNotifyAndResetsValues() {
        List<String> removals = new ArrayList<>();
        CacheEngine<byte[]> engine = new CacheEngine<>(2, FixedBytes.of(3), AdmissionPolicy.alwaysAdmit(),
                (key, value, cause) -> removals.add(key + ":" + cause));
        engine.createOrGet(1L, 1).set(new byte[] {1, 2, 3});
        engine.createOrGet(2L, 2).set(new byte[] {4, 5, 6});
        engine.clear();
        assertEquals(0, engine.size());
        assertTrue(removals.isEmpty());
        assertNull(engine.find(1L));
        assertArrayEquals(new byte[3], engine.createOrGet(3L, 3).get());
        engine.verifyIntegrity();
    }

    @Test
    void testListenerSeesValueBeforeReset() {
        List<String> seen = new ArrayList<>();
        CacheEngine<OwnedBuffer> engine = new CacheEngine<>(1, GrowableBytes.instance(),
                AdmissionPolicy.alwaysAdmit(),
                (key, value, cause) -> seen.add(new String(value.toByteArray())));
        engine.createOrGet(1L, 1).set(new OwnedBuffer("hello".getBytes()));
        SlotRef<OwnedBuffer> next = engine.createOrGet(2L, 2);
        assertEquals(List.of("hello"), seen);
        assertEquals(0, next.get().length(), "the reused buffer is emptied");
    }

    @Test
    void testListenerExceptionIsLoggedAndSwallowed() {
        Logger logger = Logger.getLogger("com.github.rudygunawan.slotcache.Cache");
        List<LogRecord> records = new ArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        logger.addHandler(handler);
        try {
            CacheEngine<String> engine = new CacheEngine<>(1, ObjectValues.create(),
                    AdmissionPolicy.alwaysAdmit(), (key, value, cause) -> {
                        throw new IllegalStateException("boom");
                    });
            engine.createOrGet(1L, 1);
            assertNotNull(engine.createOrGet(2L, 2));
            assertTrue(engine.contains(2L));
            engine.verifyIntegrity();
        } finally {
            logger.removeHandler(handler);
        }
        assertTrue(records.stream().anyMatch(r -> r.getLevel() == Level.WARNING
                && r.getThrown() instanceof IllegalStateException));
    }

    @Test
    void testListenerErrorLeavesEngineConsistent() {
        CacheEngine<String> engine = new CacheEngine<>(2, ObjectValues.create(),
                AdmissionPolicy.alwaysAdmit(), (key, value, cause) -> {
                    throw new AssertionError("listener failed");
                });
        engine.createOrGet(1L, 1).set("a");
        engine.createOrGet(2L, 2).set("b");

        assertThrows(AssertionError.class, () -> engine.remove(1L, RemovalCause.EXPLICIT));

        assertEquals(1, engine.size());
        assertFalse(engine.contains(1L));
        assertEquals("b", engine.find(2L).get());
        engine.verifyIntegrity();

        engine.createOrGet(3L, 3).set("c");
        assertThrows(AssertionError.class, () -> engine.createOrGet(4L, 4));
        assertFalse(engine.contains(2L), "the evicted entry is gone even though the listener failed");
        assertEquals(1, engine.size());
        assertEquals("c", engine.find(3L).get());
        engine.verifyIntegrity();

        assertNotNull(engine.createOrGet(4L, 4));
        assertEquals(2, engine.size());
        engine.verifyIntegrity();
    }

    // ========== Metric updates ==========

    @Test
    void testUpdateMetricReorders() {
        CacheEngine<String> engine = objectEngine(3, new ArrayList<>());
        engine.createOrGet(1L, 10);
        engine.createOrGet(2L, 20);
        engine.createOrGet(3L, 30);
        assertTrue(engine.updateMetric(1L, 40));
        assertFalse(engine.updateMetric(9L, 40));
        assertEquals(2L, engine.first().key());
        assertEquals(1L, engine.last().key());
        engine.verifyIntegrity();
    }

    @Test
    void testMetricUpdateKeepsReferencesValid() {
        CacheEngine<String> engine = objectEngine(3, new ArrayList<>());
        SlotRef<String> ref = engine.createOrGet(1L, 10);
        ref.set("x");
        engine.createOrGet(2L, 20);
        engine.updateMetric(ref, 50);
        assertEquals("x", ref.get());
        assertEquals(50, ref.metric());
    }

    // ========== Fail-fast ==========

    @Test
    void testReferenceIsStaleAfterRemoval() {
        CacheEngine<String> engine = objectEngine(3, new ArrayList<>());
        SlotRef<String> ref = engine.createOrGet(1L, 10);
        engine.createOrGet(2L, 20);
        engine.remove(2L, RemovalCause.EXPLICIT);
        assertThrows(ConcurrentModificationException.class, ref::get);
        assertThrows(ConcurrentModificationException.class, () -> ref.set("y"));
        assertThrows(ConcurrentModificationException.class, ref::metric);
        assertEquals(1L, ref.key(), "the key stays readable");
    }

    @Test
    void testIteratorFailsAfterReorder() {
        CacheEngine<String> engine = objectEngine(3, new ArrayList<>());
        engine.createOrGet(1L, 10);
        engine.createOrGet(2L, 20);
        Iterator<ValueRef<String>> it = engine.ascending().iterator();
        it.next();
        engine.updateMetric(1L, 30);
        assertThrows(ConcurrentModificationException.class, it::next);
    }

    @Test
    void testIterationOrderAndValueWrites() {
        CacheEngine<String> engine = objectEngine(4, new ArrayList<>());
        engine.createOrGet(1L, 30);
        engine.createOrGet(2L, 10);
        engine.createOrGet(3L, 20);

        List<Long> ascending = new ArrayList<>();
        for (ValueRef<String> ref : engine.ascending()) {
            ascending.add(ref.key());
            ref.set("seen" + ref.key());
        }
        assertEquals(List.of(2L, 3L, 1L), ascending);

        List<Long> descending = new ArrayList<>();
        for (ValueRef<String> ref : engine.descending()) {
            descending.add(ref.key());
            assertEquals("seen" + ref.key(), ref.get());
        }
        assertEquals(List.of(1L, 3L, 2L), descending);
    }

    // ========== Statistics ==========

    @Test
    void testResetStatsKeepsEvictions() {
        CacheEngine<String> engine = objectEngine(1, new ArrayList<>());
        engine.createOrGet(1L, 1);
        engine.createOrGet(2L, 2);
        engine.lookup(3L);
        engine.recordExpired();
        engine.resetStats();
        assertEquals(0, engine.lookupCount());
        assertEquals(0, engine.missCount());
        assertEquals(0, engine.expiredCount());
        assertEquals(1, engine.evictionCount());
    }

    // ========== Integrity under churn ==========

    @Test
    void testSlotDensityUnderRandomOperations() {
        Random random = new Random(1234);
        int capacity = 64;
        CacheEngine<String> engine = objectEngine(capacity, new ArrayList<>());
        Map<Long, String> values = new HashMap<>();

        for (int step = 0; step < 30_000; step++) {
            long key = random.nextInt(200);
            switch (random.nextInt(4)) {
                case 0:
                case 1: {
                    SlotRef<String> ref = engine.createOrGet(key, random.nextInt(1000));
                    ref.set("v" + step);
                    values.put(key, "v" + step);
                    break;
                }
                case 2:
                    engine.remove(key, RemovalCause.EXPLICIT);
                    values.remove(key);
                    break;
                default:
                    engine.updateMetric(key, random.nextInt(1000));
                    break;
            }
            values.keySet().removeIf(k -> !engine.contains(k));

            assertTrue(engine.size() <= capacity);
            if (step % 250 == 0) {
                engine.verifyIntegrity();
            }
        }
        engine.verifyIntegrity();
        assertEquals(values.size(), engine.size());
        for (Map.Entry<Long, String> e : values.entrySet()) {
            assertEquals(e.getValue(), engine.find(e.getKey()).get());
        }

        long previous = Long.MIN_VALUE;
        for (ValueRef<String> ref : engine.ascending()) {
            assertTrue(ref.metric() >= previous);
            previous = ref.metric();
        }
        assertEquals(engine.first().metric(), engine.ascending().iterator().next().metric());
    }
}
