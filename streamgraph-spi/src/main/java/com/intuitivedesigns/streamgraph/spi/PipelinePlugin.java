/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.spi;

import com.intuitivedesigns.streamgraph.config.EngineConfig;
import com.intuitivedesigns.streamgraph.metrics.MetricsRuntime;

/**
 * Base contract for everything discovered through {@link java.util.ServiceLoader}.
 *
 * @param <T> the component this plugin creates
 */
public interface PipelinePlugin<T> {

    String id();

    PluginKind kind();

    T create(EngineConfig config, MetricsRuntime metrics) throws Exception;
}
