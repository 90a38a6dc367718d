/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.metrics;

import com.intuitivedesigns.streamgraph.config.EngineConfig;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusMetricsProviderTest {

    private static final HttpClient HTTP = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(2))
            .build();

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    private static MetricsSettings settings(String provider, int port) {
        return MetricsSettings.from(EngineConfig.fromMap(Map.of(
                MetricsSettings.KEY_PROVIDER, provider,
                MetricsSettings.KEY_PROM_PORT, String.valueOf(port),
                "metrics.tag.app", "streamgraph")));
    }

    private static HttpResponse<String> scrape(int port) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + port + "/metrics"))
                .timeout(Duration.ofSeconds(5))
                .GET()
                .build();
        return HTTP.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void init_selectsPrometheusProviderFromServiceRegistration() throws Exception {
        int port = freePort();
        try (MetricsRuntime runtime = MetricsFactory.init(settings("prometheus", port))) {
            assertTrue(runtime.enabled());
            assertEquals(PrometheusMetricsProvider.ID, runtime.type());
        }
    }

    @Test
    void registry_includesPrometheusRegistryWithCommonTags() throws Exception {
        int port = freePort();
        try (MetricsRuntime runtime = new PrometheusMetricsProvider().create(settings("PROMETHEUS", port))) {
            runtime.increment("orders.seen", "region", "emea");

            CompositeMeterRegistry composite = (CompositeMeterRegistry) runtime.registry();
            PrometheusMeterRegistry prom = composite.getRegistries().stream()
                    .filter(PrometheusMeterRegistry.class::isInstance)
                    .map(PrometheusMeterRegistry.class::cast)
                    .findFirst()
                    .orElseThrow();

            assertEquals(1.0, prom.get("orders.seen").tags("app", "streamgraph", "region", "emea").counter().count());
        }
    }

    @Test
    void scrapeEndpoint_servesMetersInTextFormat() throws Exception {
        int port = freePort();
        try (MetricsRuntime runtime = new PrometheusMetricsProvider().create(settings("PROMETHEUS", port))) {
            runtime.add("orders.seen", 3, "region", "emea");
            runtime.gauge("orders.pending", 7, "region", "emea");
            runtime.recordMillis("orders.latency", 12.0);

            HttpResponse<String> response = scrape(port);

            assertEquals(200, response.statusCode());
            assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("text/plain"));

            String body = response.body();
            assertTrue(body.contains("orders_seen_total{"), body);
            assertTrue(body.contains("region=\"emea\""), body);
            assertTrue(body.contains("app=\"streamgraph\""), body);
            assertTrue(body.contains("orders_pending{"), body);
            assertTrue(body.contains("orders_latency_seconds_count"), body);
        }
    }

    @Test
    void close_stopsScrapeEndpoint() throws Exception {
        int port = freePort();
        MetricsRuntime runtime = new PrometheusMetricsProvider().create(settings("PROMETHEUS", port));
        assertEquals(200, scrape(port).statusCode());

        runtime.close();

        assertThrows(IOException.class, () -> scrape(port));
    }

    @Test
    void create_ignoresOtherProviders() {
        assertNull(new PrometheusMetricsProvider().create(settings("MICROMETER", 1)));
        assertNull(new PrometheusMetricsProvider().create(null));
    }
}
