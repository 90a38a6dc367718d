/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.metrics;

/**
 * In-process Micrometer runtime with no exporter. Meters are readable through
 * {@link MicrometerMetricsRuntime#registry()}.
 */
public final class MicrometerMetricsProvider implements MetricsProvider {

    public static final String ID = "MICROMETER";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public MetricsRuntime create(MetricsSettings settings) {
        if (settings == null || !matches(settings.providerId)) return null;

        final MicrometerMetricsRuntime runtime = new MicrometerMetricsRuntime();
        MetricsUtil.applyCommonTags(runtime.registry(), settings);
        return runtime;
    }
}
