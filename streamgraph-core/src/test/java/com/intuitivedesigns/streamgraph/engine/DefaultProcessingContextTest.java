/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.engine;

import com.intuitivedesigns.streamgraph.core.StreamItem;
import com.intuitivedesigns.streamgraph.state.StateStore;
import com.intuitivedesigns.streamgraph.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultProcessingContextTest {

    private final MutableClock clock = MutableClock.at("2025-01-01T00:00:00Z");
    private final StateStore state = new StateStore();

    @Test
    void pipelineStateWinsOverStageParams() {
        state.put("threshold", 10);
        DefaultProcessingContext ctx = new DefaultProcessingContext("p", "s", Map.of("threshold", 5, "mode", "fast"), state, clock, null);

        assertEquals(10, ctx.get("threshold", Integer.class));
        assertEquals("fast", ctx.get("mode", String.class));
        assertEquals(Map.of("threshold", 10, "mode", "fast"), ctx.view());
    }

    @Test
    void typeMismatchIsRejected() {
        DefaultProcessingContext ctx = new DefaultProcessingContext("p", "s", Map.of("n", "not-a-number"), state, clock, null);

        assertThrows(IllegalArgumentException.class, () -> ctx.get("n", Number.class));
        assertNull(ctx.get("absent", String.class));
        assertEquals(3, ctx.getOrDefault("absent", Integer.class, 3));
    }

    @Test
    void stateAccessorsWriteThrough() {
        DefaultProcessingContext ctx = new DefaultProcessingContext("p", "s", Map.of(), state, clock, null);

        ctx.setState("a", 1);
        ctx.updateState("a", v -> (Integer) v + 1);

        assertEquals(2, state.get("a"));
        assertEquals(2, ctx.getState("a"));
    }

    @Test
    void timestampIsFixedButNowFollowsClock() {
        DefaultProcessingContext ctx = new DefaultProcessingContext("p", "s", Map.of(), state, clock, null);
        Instant start = ctx.timestamp();

        clock.advanceMillis(250);

        assertEquals(start, ctx.timestamp());
        assertEquals(start.plusMillis(250), ctx.now());
    }

    @Test
    void emitDelegatesToEmitter() {
        List<Object> emitted = new ArrayList<>();
        DefaultProcessingContext ctx = new DefaultProcessingContext("p", "s", Map.of(), state, clock, payload -> {
            emitted.add(payload);
            return StreamItem.create("p", payload, "emit", clock.instant());
        });

        StreamItem item = ctx.emit("child");

        assertEquals(List.of("child"), emitted);
        assertEquals("child", item.payload());
    }

    @Test
    void emitWithoutEmitterIsUnsupported() {
        DefaultProcessingContext ctx = new DefaultProcessingContext("p", "s", Map.of(), state, clock, null);
        assertThrows(UnsupportedOperationException.class, () -> ctx.emit("x"));
    }
}
