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
 * Structural pass-through. Branches converge by wiring several stages to this one;
 * items are not combined.
 */
public final class MergeProcessor implements StageProcessor {

    public static final String NAME = "merge";

    @Override
    public List<StreamItem> process(StreamItem item, ProcessingContext context) {
        return List.of(item);
    }

    @Override
    public ProcessorKind kind() {
        return ProcessorKind.MERGE;
    }
}
