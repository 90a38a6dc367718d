/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Routing and retry bookkeeping carried by every {@link StreamItem}.
 *
 * @param sourceLabel   where the item entered the pipeline ("push", "emit")
 * @param pipelineId    owning pipeline
 * @param stageId       stage that last handled the item; empty for freshly pushed items
 * @param correlationId stable id shared by an item and everything derived from it
 * @param retryCount    failed attempts at {@code stageId}
 * @param tags          free-form labels (routing, dead-letter markers)
 */
public record ItemMetadata(
        String sourceLabel,
        String pipelineId,
        String stageId,
        String correlationId,
        int retryCount,
        List<String> tags
) {

    public ItemMetadata {
        Objects.requireNonNull(pipelineId, "pipelineId");
        Objects.requireNonNull(correlationId, "correlationId");
        if (retryCount < 0) throw new IllegalArgumentException("retryCount must be >= 0");
        sourceLabel = (sourceLabel == null) ? "" : sourceLabel;
        stageId = (stageId == null) ? "" : stageId;
        tags = (tags == null) ? List.of() : List.copyOf(tags);
    }

    public boolean hasStage() {
        return !stageId.isEmpty();
    }

    public ItemMetadata withStageId(String newStageId) {
        return new ItemMetadata(sourceLabel, pipelineId, newStageId, correlationId, retryCount, tags);
    }

    public ItemMetadata withRetryCount(int newRetryCount) {
        return new ItemMetadata(sourceLabel, pipelineId, stageId, correlationId, newRetryCount, tags);
    }

    public ItemMetadata withTag(String tag) {
        Objects.requireNonNull(tag, "tag");
        List<String> next = new ArrayList<>(tags.size() + 1);
        next.addAll(tags);
        next.add(tag);
        return new ItemMetadata(sourceLabel, pipelineId, stageId, correlationId, retryCount, next);
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }
}
