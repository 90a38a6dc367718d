/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.state;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class StateStoreTest {

    @Test
    void put_nullValueRemovesKey() {
        StateStore store = new StateStore();
        store.put("k", 1);
        assertTrue(store.contains("k"));

        store.put("k", null);

        assertFalse(store.contains("k"));
        assertNull(store.get("k"));
    }

    @Test
    void update_isAtomicUnderContention() throws Exception {
        StateStore store = new StateStore();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 1_000; i++) {
                        store.update("counter", v -> (v == null) ? 1L : (Long) v + 1L);
                    }
                }));
            }
            for (Future<?> f : futures) f.get();
        } finally {
            pool.shutdownNow();
        }

        assertEquals(8_000L, store.get("counter"));
    }

    @Test
    void computeIfAbsent_createsOnce() {
        StateStore store = new StateStore();

        Object first = store.computeIfAbsent("table", ArrayList::new);
        Object second = store.computeIfAbsent("table", ArrayList::new);

        assertSame(first, second);
        assertEquals(1, store.size());
    }

    @Test
    void snapshot_isDetachedAndReadOnly() {
        StateStore store = new StateStore();
        store.put("a", 1);

        Map<String, Object> snap = store.snapshot();
        store.put("b", 2);

        assertEquals(1, snap.size());
        assertThrows(UnsupportedOperationException.class, () -> snap.put("c", 3));
    }

    @Test
    void clear_removesEverything() {
        StateStore store = new StateStore();
        store.put("a", 1);
        store.put("b", 2);

        store.clear();

        assertEquals(0, store.size());
    }
}
