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
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * Merges the result of an asynchronous lookup into the payload map.
 * The wait is bounded by the stage timeout, which interrupts this call.
 */
public final class EnrichProcessor implements StageProcessor {

    public static final String NAME = "enrich";

    @Override
    @SuppressWarnings("unchecked")
    public List<StreamItem> process(StreamItem item, ProcessingContext context) throws Exception {
        final Function<Object, CompletionStage<? extends Map<String, ?>>> enrichFn =
                context.get(ProcessorParams.ENRICH_FUNCTION, Function.class);
        if (enrichFn == null) return List.of(item);

        final Map<String, ?> extra;
        try {
            extra = enrichFn.apply(item.payload()).toCompletableFuture().get();
        } catch (ExecutionException e) {
            throw (e.getCause() instanceof Exception cause) ? cause : e;
        }

        final Map<String, Object> merged = PayloadFields.toMap(item.payload());
        if (extra != null) merged.putAll(extra);
        return List.of(item.withPayload(merged));
    }

    @Override
    public ProcessorKind kind() {
        return ProcessorKind.ENRICH;
    }
}
