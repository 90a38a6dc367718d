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
 * Used for stages declared without a processor.
 */
public final class PassThroughProcessor implements StageProcessor {

    public static final String NAME = "passThrough";
    public static final PassThroughProcessor INSTANCE = new PassThroughProcessor();

    private PassThroughProcessor() {}

    @Override
    public List<StreamItem> process(StreamItem item, ProcessingContext context) {
        return List.of(item);
    }

    @Override
    public ProcessorKind kind() {
        return ProcessorKind.PASS_THROUGH;
    }
}
