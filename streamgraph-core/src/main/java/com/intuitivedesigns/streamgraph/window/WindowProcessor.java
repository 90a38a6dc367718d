/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.window;

import com.intuitivedesigns.streamgraph.core.ProcessingContext;
import com.intuitivedesigns.streamgraph.core.ProcessorKind;
import com.intuitivedesigns.streamgraph.core.StageProcessor;
import com.intuitivedesigns.streamgraph.core.StreamItem;
import com.intuitivedesigns.streamgraph.processors.ProcessorParams;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Groups items into time windows per {@code (pipeline, stage)}.
 * Without a {@link ProcessorParams#WINDOW_CONFIG} the item passes through.
 */
public final class WindowProcessor implements StageProcessor {

    public static final String NAME = "window";

    public static String stateKey(String stageId) {
        return "window:" + stageId;
    }

    @Override
    public List<StreamItem> process(StreamItem item, ProcessingContext context) {
        final WindowSpec spec = context.get(ProcessorParams.WINDOW_CONFIG, WindowSpec.class);
        if (spec == null) return List.of(item);

        final WindowBook book = (WindowBook) context.computeStateIfAbsent(stateKey(context.stageId()), WindowBook::new);
        final Optional<Map<String, Object>> emitted = book.accept(item, spec, context.now());

        return emitted
                .map(payload -> List.of(new StreamItem(UUID.randomUUID().toString(), payload, item.metadata(), context.now())))
                .orElse(List.of());
    }

    @Override
    public ProcessorKind kind() {
        return ProcessorKind.WINDOW;
    }
}
