/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.metrics;

import com.intuitivedesigns.streamgraph.config.EngineConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricsSettingsTest {

    @Test
    void from_emptyConfig_usesDefaults() {
        MetricsSettings settings = MetricsSettings.from(EngineConfig.empty());

        assertEquals(MetricsSettings.DEFAULT_PROVIDER, settings.providerId);
        assertEquals(MetricsSettings.DEFAULT_PROM_PORT, settings.prometheusPort);
        assertTrue(settings.commonTags.isEmpty());
    }

    @Test
    void from_normalizesProviderAndCollectsTags() {
        MetricsSettings settings = MetricsSettings.from(EngineConfig.fromMap(Map.of(
                MetricsSettings.KEY_PROVIDER, "  micrometer ",
                "metrics.tag.env", " prod ",
                "metrics.tag.region", "eu-west",
                "metrics.tag.blank", "  ",
                "unrelated.key", "x")));

        assertEquals("MICROMETER", settings.providerId);
        assertEquals(Map.of("env", "prod", "region", "eu-west"), settings.commonTags);
        assertThrows(UnsupportedOperationException.class, () -> settings.commonTags.put("k", "v"));
    }

    @Test
    void from_clampsPrometheusPort() {
        MetricsSettings high = MetricsSettings.from(EngineConfig.fromMap(Map.of(MetricsSettings.KEY_PROM_PORT, "70000")));
        MetricsSettings low = MetricsSettings.from(EngineConfig.fromMap(Map.of(MetricsSettings.KEY_PROM_PORT, "0")));

        assertEquals(65_535, high.prometheusPort);
        assertEquals(1, low.prometheusPort);
    }

    @Test
    void applyCommonTags_tagsEveryMeter() {
        MetricsSettings settings = MetricsSettings.from(EngineConfig.fromMap(Map.of(
                "metrics.tag.env", "test",
                "metrics.tag.app", "streamgraph")));
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        MetricsUtil.applyCommonTags(registry, settings);
        registry.counter("items").increment();

        assertEquals(1.0, registry.get("items").tags("env", "test", "app", "streamgraph").counter().count());
    }
}
