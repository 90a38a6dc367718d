/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.spi;

import com.intuitivedesigns.streamgraph.config.EngineConfig;
import com.intuitivedesigns.streamgraph.core.StageProcessor;
import com.intuitivedesigns.streamgraph.metrics.MetricsRuntime;

/**
 * SPI Definition for stage processors.
 *
 * <p>Register implementations in
 * {@code META-INF/services/com.intuitivedesigns.streamgraph.spi.ProcessorPlugin}. The plugin id
 * becomes the processor name used by {@code addStage}.</p>
 */
public interface ProcessorPlugin extends PipelinePlugin<StageProcessor> {

    String id(); // e.g. "UPPERCASE", "LOG"

    @Override
    default PluginKind kind() {
        return PluginKind.PROCESSOR;
    }

    @Override
    StageProcessor create(EngineConfig config, MetricsRuntime metrics) throws Exception;
}
