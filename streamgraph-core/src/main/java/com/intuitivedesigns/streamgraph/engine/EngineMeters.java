/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.engine;

/**
 * Meter names mirrored to the {@link com.intuitivedesigns.streamgraph.metrics.MetricsRuntime}.
 * Item meters carry a {@code pipeline} tag; stage latency adds a {@code stage} tag.
 */
public final class EngineMeters {

    public static final String ITEMS_INPUT = "streamgraph.items.input";
    public static final String ITEMS_OUTPUT = "streamgraph.items.output";
    public static final String ITEMS_ERRORS = "streamgraph.items.errors";
    public static final String ITEMS_REJECTED = "streamgraph.items.rejected";
    public static final String ITEMS_RETRIED = "streamgraph.items.retried";
    public static final String ITEMS_DEAD_LETTERED = "streamgraph.items.dead_lettered";
    public static final String ITEMS_DROPPED = "streamgraph.items.dropped";
    public static final String STAGE_LATENCY = "streamgraph.stage.latency";
    public static final String PIPELINES_RUNNING = "streamgraph.pipelines.running";

    public static final String TAG_PIPELINE = "pipeline";
    public static final String TAG_STAGE = "stage";

    private EngineMeters() {}

    static String[] pipelineTags(Pipeline pipeline) {
        return new String[]{TAG_PIPELINE, pipeline.name()};
    }

    static String[] stageTags(Pipeline pipeline, PipelineStage stage) {
        return new String[]{TAG_PIPELINE, pipeline.name(), TAG_STAGE, stage.name()};
    }
}
