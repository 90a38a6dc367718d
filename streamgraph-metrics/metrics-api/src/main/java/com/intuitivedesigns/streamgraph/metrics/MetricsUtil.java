/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.Map;

public final class MetricsUtil {

    private MetricsUtil() {}

    /**
     * Adds the configured {@code metrics.tag.*} values to every meter of the registry.
     * Must run before the first meter is registered.
     */
    public static void applyCommonTags(MeterRegistry registry, MetricsSettings settings) {
        if (registry == null || settings == null || settings.commonTags.isEmpty()) return;
        registry.config().commonTags(toTags(settings.commonTags));
    }

    /** Blank keys and values are already dropped by {@link MetricsSettings}. */
    static Tags toTags(Map<String, String> tags) {
        Tags out = Tags.empty();
        for (Map.Entry<String, String> e : tags.entrySet()) {
            out = out.and(e.getKey(), e.getValue());
        }
        return out;
    }
}
