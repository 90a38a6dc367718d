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
 * Tags the item with {@code route:<label>} from the {@code condition} classifier.
 * Branching itself is done by downstream wiring.
 */
public final class SplitProcessor implements StageProcessor {

    public static final String NAME = "split";
    public static final String ROUTE_TAG_PREFIX = "route:";

    @Override
    @SuppressWarnings("unchecked")
    public List<StreamItem> process(StreamItem item, ProcessingContext context) {
        final Function<Object, String> condition = context.get(ProcessorParams.CONDITION, Function.class);
        if (condition == null) return List.of(item);

        final String route = condition.apply(item.payload());
        return List.of(item.withTag(ROUTE_TAG_PREFIX + route));
    }

    @Override
    public ProcessorKind kind() {
        return ProcessorKind.SPLIT;
    }
}
