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
import java.util.function.Function;

/**
 * Replaces the payload with {@code mapFunction(payload)}. Without a function the item passes through.
 */
public final class MapProcessor implements StageProcessor {

    public static final String NAME = "map";

    @Override
    @SuppressWarnings("unchecked")
    public List<StreamItem> process(StreamItem item, ProcessingContext context) {
        final Function<Object, Object> mapFn = context.get(ProcessorParams.MAP_FUNCTION, Function.class);
        if (mapFn == null) return List.of(item);
        return List.of(item.withPayload(mapFn.apply(item.payload())));
    }

    @Override
    public ProcessorKind kind() {
        return ProcessorKind.MAP;
    }
}
