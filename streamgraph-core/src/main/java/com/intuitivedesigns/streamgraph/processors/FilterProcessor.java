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
import java.util.function.Predicate;

/**
 * Drops items whose payload fails {@code filterFunction}. Stateless.
 */
public final class FilterProcessor implements StageProcessor {

    public static final String NAME = "filter";

    @Override
    @SuppressWarnings("unchecked")
    public List<StreamItem> process(StreamItem item, ProcessingContext context) {
        final Predicate<Object> filterFn = context.get(ProcessorParams.FILTER_FUNCTION, Predicate.class);
        if (filterFn != null && !filterFn.test(item.payload())) {
            return List.of();
        }
        return List.of(item);
    }

    @Override
    public ProcessorKind kind() {
        return ProcessorKind.FILTER;
    }
}
