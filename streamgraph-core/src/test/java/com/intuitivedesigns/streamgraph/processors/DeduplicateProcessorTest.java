/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.processors;

import com.intuitivedesigns.streamgraph.core.ProcessingContext;
import com.intuitivedesigns.streamgraph.state.StateStore;
import com.intuitivedesigns.streamgraph.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.intuitivedesigns.streamgraph.support.Contexts.context;
import static com.intuitivedesigns.streamgraph.support.Contexts.item;
import static org.junit.jupiter.api.Assertions.*;

class DeduplicateProcessorTest {

    private final MutableClock clock = MutableClock.at("2025-01-01T00:00:00Z");
    private final StateStore state = new StateStore();
    private final DeduplicateProcessor dedupe = new DeduplicateProcessor();

    private ProcessingContext ctx(String stageId, Map<String, Object> params) {
        return context(stageId, params, state, clock);
    }

    @Test
    void secondSightingWithinWindowIsDropped() throws Exception {
        ProcessingContext ctx = ctx("d1", Map.of(ProcessorParams.WINDOW_MS, 1_000L));

        assertEquals(1, dedupe.process(item(Map.of("id", "a"), clock), ctx).size());
        clock.advanceMillis(999);
        assertTrue(dedupe.process(item(Map.of("id", "a"), clock), ctx).isEmpty());
        assertEquals(1, dedupe.process(item(Map.of("id", "b"), clock), ctx).size());
    }

    @Test
    void keyExpiresOnlyAfterWindowHasElapsed() throws Exception {
        ProcessingContext ctx = ctx("d1", Map.of(ProcessorParams.WINDOW_MS, 1_000L));

        dedupe.process(item(Map.of("id", "a"), clock), ctx);
        clock.advanceMillis(1_000);
        assertTrue(dedupe.process(item(Map.of("id", "a"), clock), ctx).isEmpty());

        clock.advanceMillis(1);
        assertEquals(1, dedupe.process(item(Map.of("id", "a"), clock), ctx).size());
    }

    @Test
    void purgeRemovesEveryExpiredKey() throws Exception {
        ProcessingContext ctx = ctx("d1", Map.of(ProcessorParams.WINDOW_MS, 1_000L));

        dedupe.process(item(Map.of("id", "a"), clock), ctx);
        clock.advanceMillis(10);
        dedupe.process(item(Map.of("id", "b"), clock), ctx);
        clock.advanceMillis(2_000);
        dedupe.process(item(Map.of("id", "c"), clock), ctx);

        SeenKeys seen = (SeenKeys) state.get(DeduplicateProcessor.stateKey("d1"));
        assertEquals(1, seen.size());
    }

    @Test
    void customKeyFieldAndPerStageState() throws Exception {
        ProcessingContext first = ctx("d1", Map.of(ProcessorParams.KEY_FIELD, "user.email"));
        ProcessingContext second = ctx("d2", Map.of(ProcessorParams.KEY_FIELD, "user.email"));
        Map<String, Object> payload = Map.of("user", Map.of("email", "x@y.z"));

        assertEquals(1, dedupe.process(item(payload, clock), first).size());
        assertTrue(dedupe.process(item(payload, clock), first).isEmpty());
        assertEquals(1, dedupe.process(item(payload, clock), second).size());

        assertTrue(state.contains(DeduplicateProcessor.stateKey("d1")));
        assertTrue(state.contains(DeduplicateProcessor.stateKey("d2")));
    }
}
