/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.window;

import com.intuitivedesigns.streamgraph.core.ProcessingContext;
import com.intuitivedesigns.streamgraph.core.StreamItem;
import com.intuitivedesigns.streamgraph.processors.ProcessorParams;
import com.intuitivedesigns.streamgraph.state.StateStore;
import com.intuitivedesigns.streamgraph.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.intuitivedesigns.streamgraph.support.Contexts.context;
import static com.intuitivedesigns.streamgraph.support.Contexts.item;
import static org.junit.jupiter.api.Assertions.*;

class WindowProcessorTest {

    private final MutableClock clock = MutableClock.at("2025-01-01T00:00:00Z");
    private final StateStore state = new StateStore();
    private final WindowProcessor window = new WindowProcessor();

    private ProcessingContext ctx(WindowSpec spec) {
        return context("w1", Map.of(ProcessorParams.WINDOW_CONFIG, spec), state, clock);
    }

    private List<StreamItem> push(ProcessingContext ctx, Object payload) throws Exception {
        return window.process(item(payload, clock), ctx);
    }

    @Test
    void tumbling_emitsClosedWindowExactlyOnce() throws Exception {
        ProcessingContext ctx = ctx(WindowSpec.tumbling(1_000));

        assertTrue(push(ctx, "a").isEmpty());
        clock.advanceMillis(400);
        assertTrue(push(ctx, "b").isEmpty());

        clock.advanceMillis(600);
        List<StreamItem> closed = push(ctx, "c");

        assertEquals(1, closed.size());
        Map<?, ?> payload = (Map<?, ?>) closed.get(0).payload();
        assertEquals(List.of("a", "b"), payload.get("window"));
        assertEquals("TUMBLING", payload.get("kind"));
        assertEquals(clock.instant(), payload.get("endTime"));

        clock.advanceMillis(10);
        assertTrue(push(ctx, "d").isEmpty());

        WindowBook book = (WindowBook) state.get(WindowProcessor.stateKey("w1"));
        assertEquals(1, book.closedCount());
        assertEquals(2, book.activeWindow().orElseThrow().items().size());
    }

    @Test
    void tumbling_newWindowStartsWithTriggeringItem() throws Exception {
        ProcessingContext ctx = ctx(WindowSpec.tumbling(100));

        push(ctx, 1);
        clock.advanceMillis(150);
        push(ctx, 2);
        clock.advanceMillis(150);
        List<StreamItem> second = push(ctx, 3);

        assertEquals(List.of(2), ((Map<?, ?>) second.get(0).payload()).get("window"));
    }

    @Test
    void sliding_evictsItemsOlderThanSize() throws Exception {
        ProcessingContext ctx = ctx(WindowSpec.sliding(1_000, 100));

        push(ctx, "a");
        clock.advanceMillis(600);
        List<StreamItem> mid = push(ctx, "b");
        clock.advanceMillis(600);
        List<StreamItem> late = push(ctx, "c");

        assertEquals(List.of("a", "b"), ((Map<?, ?>) mid.get(0).payload()).get("window"));
        assertEquals(List.of("b", "c"), ((Map<?, ?>) late.get(0).payload()).get("window"));
        assertNull(((Map<?, ?>) late.get(0).payload()).get("endTime"));
    }

    @Test
    void session_closesLikeTumbling() throws Exception {
        ProcessingContext ctx = ctx(WindowSpec.session(500));

        push(ctx, "a");
        clock.advanceMillis(500);
        List<StreamItem> closed = push(ctx, "b");

        assertEquals("SESSION", ((Map<?, ?>) closed.get(0).payload()).get("kind"));
    }

    @Test
    void missingSpecPassesThrough() throws Exception {
        StreamItem in = item("x", clock);
        assertEquals(List.of(in), window.process(in, context("w1", Map.of(), state, clock)));
    }

    @Test
    void spec_rejectsNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> WindowSpec.tumbling(0));
    }
}
