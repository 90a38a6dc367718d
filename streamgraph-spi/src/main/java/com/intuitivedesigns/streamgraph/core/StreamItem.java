/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.core;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * The unit of data flowing through a pipeline graph.
 *
 * Design Principles:
 * - Immutability: stages derive new items instead of mutating.
 * - Provenance: the correlation id survives every derivation.
 *
 * @param id        item id; derived items may keep or replace it
 * @param payload   the data; usually a {@code Map<String, Object>}
 * @param metadata  routing and retry bookkeeping
 * @param createdAt creation time of this item
 */
public record StreamItem(
        String id,
        Object payload,
        ItemMetadata metadata,
        Instant createdAt
) {

    public StreamItem {
        Objects.requireNonNull(id, "StreamItem id cannot be null");
        Objects.requireNonNull(metadata, "StreamItem metadata cannot be null");
        if (createdAt == null) createdAt = Instant.now();
    }

    // -----------------------------------------------------------------------
    // FACTORY METHODS
    // -----------------------------------------------------------------------

    public static StreamItem create(String pipelineId, Object payload, String sourceLabel, Instant now) {
        final String correlationId = UUID.randomUUID().toString();
        return create(pipelineId, payload, sourceLabel, correlationId, now);
    }

    public static StreamItem create(String pipelineId,
                                    Object payload,
                                    String sourceLabel,
                                    String correlationId,
                                    Instant now) {
        ItemMetadata meta = new ItemMetadata(sourceLabel, pipelineId, "", correlationId, 0, List.of());
        return new StreamItem(UUID.randomUUID().toString(), payload, meta, now);
    }

    // -----------------------------------------------------------------------
    // WITHER METHODS
    // -----------------------------------------------------------------------

    public StreamItem withPayload(Object newPayload) {
        return new StreamItem(id, newPayload, metadata, createdAt);
    }

    public StreamItem withMetadata(ItemMetadata newMetadata) {
        return new StreamItem(id, payload, newMetadata, createdAt);
    }

    public StreamItem withId(String newId) {
        return new StreamItem(newId, payload, metadata, createdAt);
    }

    public StreamItem withTag(String tag) {
        return withMetadata(metadata.withTag(tag));
    }

    public int retryCount() {
        return metadata.retryCount();
    }
}
