/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.processors;

import com.intuitivedesigns.streamgraph.core.ProcessingContext;
import com.intuitivedesigns.streamgraph.core.ProcessorKind;
import com.intuitivedesigns.streamgraph.core.StageProcessor;
import com.intuitivedesigns.streamgraph.core.StreamItem;

import java.util.List;

/**
 * Passes the first item per key within {@code windowMs}; later duplicates are filtered.
 * Keys older than the window are purged lazily on each call.
 */
public final class DeduplicateProcessor implements StageProcessor {

    public static final String NAME = "deduplicate";

    static final String DEFAULT_KEY_FIELD = "id";
    static final long DEFAULT_WINDOW_MS = 60_000L;

    public static String stateKey(String stageId) {
        return "dedupe:" + stageId + ":seen";
    }

    @Override
    public List<StreamItem> process(StreamItem item, ProcessingContext context) {
        final String keyField = context.getOrDefault(ProcessorParams.KEY_FIELD, String.class, DEFAULT_KEY_FIELD);
        final Number windowMs = context.getOrDefault(ProcessorParams.WINDOW_MS, Number.class, DEFAULT_WINDOW_MS);

        final SeenKeys seen = (SeenKeys) context.computeStateIfAbsent(stateKey(context.stageId()), SeenKeys::new);
        final String key = String.valueOf(PayloadFields.extract(item.payload(), keyField));

        if (!seen.firstSighting(key, () -> context.now().toEpochMilli(), windowMs.longValue())) {
            return List.of();
        }
        return List.of(item);
    }

    @Override
    public ProcessorKind kind() {
        return ProcessorKind.DEDUPLICATE;
    }
}
