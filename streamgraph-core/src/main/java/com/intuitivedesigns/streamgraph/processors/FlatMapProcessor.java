/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.processors;

import com.intuitivedesigns.streamgraph.core.ProcessingContext;
import com.intuitivedesigns.streamgraph.core.ProcessorKind;
import com.intuitivedesigns.streamgraph.core.StageProcessor;
import com.intuitivedesigns.streamgraph.core.StreamItem;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Fans one item into N children with ids {@code "{parentId}-{index}"}.
 * An empty result filters the item.
 */
public final class FlatMapProcessor implements StageProcessor {

    public static final String NAME = "flatMap";

    @Override
    @SuppressWarnings("unchecked")
    public List<StreamItem> process(StreamItem item, ProcessingContext context) {
        final Function<Object, List<?>> flatMapFn = context.get(ProcessorParams.FLAT_MAP_FUNCTION, Function.class);
        if (flatMapFn == null) return List.of(item);

        final List<?> parts = flatMapFn.apply(item.payload());
        if (parts == null || parts.isEmpty()) return List.of();

        final Instant now = context.now();
        final List<StreamItem> out = new ArrayList<>(parts.size());
        for (int i = 0; i < parts.size(); i++) {
            out.add(new StreamItem(item.id() + "-" + i, parts.get(i), item.metadata(), now));
        }
        return out;
    }

    @Override
    public ProcessorKind kind() {
        return ProcessorKind.FLAT_MAP;
    }
}
