/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.plugins;

import com.intuitivedesigns.streamgraph.config.EngineConfig;
import com.intuitivedesigns.streamgraph.core.ProcessingContext;
import com.intuitivedesigns.streamgraph.core.ProcessorKind;
import com.intuitivedesigns.streamgraph.core.StageProcessor;
import com.intuitivedesigns.streamgraph.core.StreamItem;
import com.intuitivedesigns.streamgraph.metrics.MetricsRuntime;
import com.intuitivedesigns.streamgraph.spi.ProcessorPlugin;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Upper-cases String payloads, or one String field of a Map payload when the stage sets
 * the {@code field} param. Anything else passes through unchanged.
 */
public final class UppercaseProcessorPlugin implements ProcessorPlugin {

    public static final String ID = "UPPERCASE";
    public static final String PARAM_FIELD = "field";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public StageProcessor create(EngineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        return new StageProcessor() {
            @Override
            public List<StreamItem> process(StreamItem item, ProcessingContext context) {
                final Object payload = item.payload();
                final String field = context.get(PARAM_FIELD, String.class);

                if (field == null) {
                    if (payload instanceof String s && !s.isEmpty()) {
                        return List.of(item.withPayload(s.toUpperCase(Locale.ROOT)));
                    }
                    return List.of(item);
                }

                if (payload instanceof Map<?, ?> map && map.get(field) instanceof String s) {
                    final Map<Object, Object> copy = new LinkedHashMap<>(map);
                    copy.put(field, s.toUpperCase(Locale.ROOT));
                    return List.of(item.withPayload(copy));
                }
                return List.of(item);
            }

            @Override
            public ProcessorKind kind() {
                return ProcessorKind.MAP;
            }
        };
    }
}
