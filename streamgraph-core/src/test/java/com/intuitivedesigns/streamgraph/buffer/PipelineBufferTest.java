/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.buffer;

import com.intuitivedesigns.streamgraph.core.BackpressureStrategy;
import com.intuitivedesigns.streamgraph.core.StreamItem;
import com.intuitivedesigns.streamgraph.error.CapacityExceededException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PipelineBufferTest {

    private static StreamItem item(Object payload) {
        return StreamItem.create("p-1", payload, "push", Instant.now());
    }

    @Test
    void enqueue_neverExceedsCapacityForAnyStrategy() {
        for (BackpressureStrategy strategy : BackpressureStrategy.values()) {
            PipelineBuffer buffer = new PipelineBuffer("p-1", 3);
            int rejected = 0;
            for (int i = 0; i < 10; i++) {
                try {
                    buffer.enqueue(item(i), strategy, 5);
                } catch (CapacityExceededException e) {
                    rejected++;
                    assertEquals(3, e.capacity());
                    assertEquals("p-1", e.pipelineId());
                }
            }
            assertEquals(3, buffer.size(), strategy.name());
            assertEquals(7, rejected, strategy.name());
        }
    }

    @Test
    void drain_isFifoAndBounded() {
        PipelineBuffer buffer = new PipelineBuffer("p-1", 10);
        for (int i = 0; i < 5; i++) buffer.enqueue(item(i), BackpressureStrategy.BUFFER, 0);

        List<StreamItem> first = buffer.drain(2);
        List<StreamItem> rest = buffer.drain(10);

        assertEquals(List.of(0, 1), first.stream().map(StreamItem::payload).toList());
        assertEquals(List.of(2, 3, 4), rest.stream().map(StreamItem::payload).toList());
        assertTrue(buffer.isEmpty());
        assertTrue(buffer.drain(4).isEmpty());
    }

    @Test
    void block_waitsForTimeoutBeforeRejecting() {
        PipelineBuffer buffer = new PipelineBuffer("p-1", 1);
        buffer.enqueue(item("a"), BackpressureStrategy.BLOCK, 50);

        long t0 = System.nanoTime();
        assertThrows(CapacityExceededException.class,
                () -> buffer.enqueue(item("b"), BackpressureStrategy.BLOCK, 50));
        long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

        assertTrue(waitedMs >= 40, "waited " + waitedMs + "ms");
    }

    @Test
    void block_succeedsWhenRoomAppears() throws Exception {
        PipelineBuffer buffer = new PipelineBuffer("p-1", 1);
        buffer.enqueue(item("a"), BackpressureStrategy.BLOCK, 0);

        CompletableFuture<Void> producer = CompletableFuture.runAsync(
                () -> buffer.enqueue(item("b"), BackpressureStrategy.BLOCK, 2_000));
        Thread.sleep(50);
        buffer.drain(1);
        producer.get(3, TimeUnit.SECONDS);

        assertEquals("b", buffer.drain(1).get(0).payload());
    }

    @Test
    void offer_returnsFalseWhenFull() {
        PipelineBuffer buffer = new PipelineBuffer("p-1", 1);
        assertTrue(buffer.offer(item(1)));
        assertFalse(buffer.offer(item(2)));
    }
}
