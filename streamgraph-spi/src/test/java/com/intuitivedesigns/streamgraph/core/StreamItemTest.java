/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StreamItemTest {

    @Test
    void create_shouldPopulateFreshMetadata() {
        Instant now = Instant.parse("2025-01-01T00:00:00Z");
        StreamItem item = StreamItem.create("p-1", Map.of("amount", 5), "push", now);

        assertNotNull(item.id());
        assertEquals(now, item.createdAt());
        assertEquals("p-1", item.metadata().pipelineId());
        assertEquals("push", item.metadata().sourceLabel());
        assertFalse(item.metadata().hasStage());
        assertEquals(0, item.retryCount());
        assertTrue(item.metadata().tags().isEmpty());
        assertNotNull(item.metadata().correlationId());
    }

    @Test
    void create_shouldKeepGivenCorrelationId() {
        StreamItem item = StreamItem.create("p-1", "x", "emit", "corr-9", Instant.now());

        assertEquals("corr-9", item.metadata().correlationId());
        assertEquals("emit", item.metadata().sourceLabel());
    }

    @Test
    void withPayload_shouldPreserveIdTimestampAndMetadata() {
        Instant ts = Instant.now();
        ItemMetadata meta = new ItemMetadata("push", "p-1", "stage-a", "c-1", 2, List.of("t"));
        StreamItem original = new StreamItem("id-123", "original", meta, ts);

        StreamItem updated = original.withPayload("updated");

        assertEquals("id-123", updated.id());
        assertEquals(ts, updated.createdAt());
        assertEquals(meta, updated.metadata());
        assertEquals("updated", updated.payload());
        assertEquals("original", original.payload());
    }

    @Test
    void withTag_shouldAppendWithoutMutatingOriginal() {
        StreamItem item = StreamItem.create("p-1", "x", "push", Instant.now());

        StreamItem tagged = item.withTag("route:high").withTag("dead-letter");

        assertEquals(List.of("route:high", "dead-letter"), tagged.metadata().tags());
        assertTrue(tagged.metadata().hasTag("dead-letter"));
        assertTrue(item.metadata().tags().isEmpty());
    }

    @Test
    void metadataWithers_shouldReplaceSingleField() {
        ItemMetadata meta = new ItemMetadata("push", "p-1", "", "c-1", 0, List.of());

        ItemMetadata moved = meta.withStageId("s-2").withRetryCount(3);

        assertEquals("s-2", moved.stageId());
        assertEquals(3, moved.retryCount());
        assertEquals("c-1", moved.correlationId());
        assertTrue(moved.hasStage());
    }

    @Test
    void metadata_shouldRejectNegativeRetryCount() {
        assertThrows(IllegalArgumentException.class,
                () -> new ItemMetadata("push", "p-1", "", "c-1", -1, List.of()));
    }

    @Test
    void constructor_shouldRequireId() {
        ItemMetadata meta = new ItemMetadata("push", "p-1", "", "c-1", 0, null);
        assertThrows(NullPointerException.class, () -> new StreamItem(null, "x", meta, Instant.now()));
    }
}
