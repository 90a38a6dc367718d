/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.metrics;

import com.intuitivedesigns.streamgraph.config.EngineConfig;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable metrics configuration read from {@link EngineConfig}.
 */
public final class MetricsSettings {

    static final String KEY_PROVIDER = "metrics.provider";
    static final String KEY_TAG_PREFIX = "metrics.tag.";
    static final String KEY_PROM_PORT = "metrics.prometheus.port";

    static final String DEFAULT_PROVIDER = "NONE";
    static final int DEFAULT_PROM_PORT = 9090;

    public final String providerId;
    public final Map<String, String> commonTags;
    public final int prometheusPort;

    private MetricsSettings(String providerId, Map<String, String> commonTags, int prometheusPort) {
        this.providerId = providerId;
        this.commonTags = commonTags;
        this.prometheusPort = prometheusPort;
    }

    public static MetricsSettings from(EngineConfig config) {
        Objects.requireNonNull(config, "config");

        final String provider = normalizeUpper(config.getString(KEY_PROVIDER, DEFAULT_PROVIDER));

        final Map<String, String> tags = new TreeMap<>();
        for (Map.Entry<String, Object> entry : config.asMap().entrySet()) {
            final String k = entry.getKey();
            if (k == null || !k.startsWith(KEY_TAG_PREFIX)) continue;

            final String tagKey = k.substring(KEY_TAG_PREFIX.length()).trim();
            final String tagValue = (entry.getValue() == null) ? "" : String.valueOf(entry.getValue()).trim();
            if (tagKey.isEmpty() || tagValue.isEmpty()) continue;

            tags.put(tagKey, tagValue);
        }

        final int promPort = clampInt(config.getInt(KEY_PROM_PORT, DEFAULT_PROM_PORT), 1, 65_535);

        return new MetricsSettings(
                (provider != null) ? provider : DEFAULT_PROVIDER,
                Collections.unmodifiableMap(tags),
                promPort);
    }

    @Override
    public String toString() {
        return "MetricsSettings{providerId='" + providerId + "', commonTags=" + commonTags
                + ", prometheusPort=" + prometheusPort + '}';
    }

    private static String normalizeUpper(String s) {
        if (s == null) return null;
        final String t = s.trim();
        return t.isEmpty() ? null : t.toUpperCase(Locale.ROOT);
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
