/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.metrics;

import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Exposes engine meters in the Prometheus text format on {@code http://host:port/metrics}.
 */
public final class PrometheusMetricsProvider implements MetricsProvider {

    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsProvider.class);

    public static final String ID = "PROMETHEUS";
    private static final String PATH = "/metrics";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        if (s == null || !matches(s.providerId)) {
            return null;
        }

        final PrometheusMeterRegistry prom = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        MetricsUtil.applyCommonTags(prom, s);

        final MicrometerMetricsRuntime runtime = new MicrometerMetricsRuntime(ID).addRegistry(prom);
        final ServerHandle handle = start(prom, s.prometheusPort);

        log.info("Prometheus Metrics Active (port={}, path={})", s.prometheusPort, PATH);
        return new PrometheusRuntime(runtime, handle);
    }

    private static ServerHandle start(PrometheusMeterRegistry registry, int port) {
        Objects.requireNonNull(registry, "registry");

        final HttpServer server;
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start Prometheus metrics server on port " + port, e);
        }

        final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "metrics-http-server");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext(PATH, exchange -> {
            try {
                final byte[] bytes = registry.scrape().getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
                exchange.sendResponseHeaders(200, bytes.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
            } catch (IOException | RuntimeException e) {
                log.warn("Prometheus scrape failed: {}", e.toString());
                exchange.sendResponseHeaders(500, -1);
            } finally {
                exchange.close();
            }
        });

        server.start();
        return new ServerHandle(server, executor);
    }

    /**
     * Micrometer runtime that also owns the HTTP endpoint.
     */
    private static final class PrometheusRuntime implements MetricsRuntime {
        private final MicrometerMetricsRuntime delegate;
        private final ServerHandle handle;

        PrometheusRuntime(MicrometerMetricsRuntime delegate, ServerHandle handle) {
            this.delegate = delegate;
            this.handle = handle;
        }

        @Override public Object registry() { return delegate.registry(); }
        @Override public boolean enabled() { return true; }
        @Override public String type() { return ID; }
        @Override public void add(String name, double amount, String... tags) { delegate.add(name, amount, tags); }
        @Override public void recordMillis(String name, double millis, String... tags) { delegate.recordMillis(name, millis, tags); }
        @Override public void gauge(String name, double value, String... tags) { delegate.gauge(name, value, tags); }

        @Override
        public void close() {
            handle.close();
            delegate.close();
        }
    }

    private static final class ServerHandle implements AutoCloseable {
        private final HttpServer server;
        private final ExecutorService executor;

        private ServerHandle(HttpServer server, ExecutorService executor) {
            this.server = server;
            this.executor = executor;
        }

        @Override
        public void close() {
            server.stop(0);
            executor.shutdownNow();
        }
    }
}
