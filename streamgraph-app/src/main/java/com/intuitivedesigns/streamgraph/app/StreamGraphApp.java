/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.app;

import com.intuitivedesigns.streamgraph.config.EngineConfig;
import com.intuitivedesigns.streamgraph.engine.StreamEngine;
import com.intuitivedesigns.streamgraph.metrics.EngineStats;
import com.intuitivedesigns.streamgraph.metrics.MetricsFactory;
import com.intuitivedesigns.streamgraph.metrics.MetricsRuntime;
import com.intuitivedesigns.streamgraph.metrics.MetricsSettings;
import com.intuitivedesigns.streamgraph.metrics.PipelineMetricsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public final class StreamGraphApp {

    private static final Logger log = LoggerFactory.getLogger(StreamGraphApp.class);

    // --- Config Keys ---
    private static final String CFG_SPEEDOMETER_ENABLED = "app.speedometer.enabled";
    private static final String CFG_SPEEDOMETER_WINDOW_SECONDS = "app.speedometer.window.seconds";

    // --- Defaults ---
    private static final int DEFAULT_WINDOW_SECONDS = 10;
    private static final int MIN_WINDOW_SECONDS = 1;
    private static final int MAX_WINDOW_SECONDS = 60;

    private StreamGraphApp() {}

    public static void main(String[] args) {
        log.info("=== Booting StreamGraph ===");

        final EngineConfig config = EngineConfig.load();

        MetricsRuntime metrics = null;
        StreamEngine engine = null;
        ScheduledExecutorService scheduler = null;

        final CountDownLatch shutdownLatch = new CountDownLatch(1);
        final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

        try {
            // 1. Metrics
            metrics = MetricsFactory.init(MetricsSettings.from(config));

            // 2. Engine + demo graph
            engine = new StreamEngine(config, metrics);
            log.info("Processors: {}", engine.processorNames());

            final OrderPipeline orders = OrderPipeline.build(engine, config);
            final SyntheticOrderSource source = new SyntheticOrderSource(engine, orders.id(), config);

            // 3. Background tasks
            scheduler = Executors.newScheduledThreadPool(2, new NamedDaemonThreadFactory("sg-app"));

            final boolean speedometerEnabled = config.getBoolean(CFG_SPEEDOMETER_ENABLED, true);
            final int windowSeconds = clampInt(
                    config.getInt(CFG_SPEEDOMETER_WINDOW_SECONDS, DEFAULT_WINDOW_SECONDS),
                    MIN_WINDOW_SECONDS,
                    MAX_WINDOW_SECONDS);
            if (speedometerEnabled) {
                startSpeedometer(scheduler, engine, orders, source, windowSeconds);
            }

            // 4. Shutdown hook
            final MetricsRuntime finalMetrics = metrics;
            final StreamEngine finalEngine = engine;
            final ScheduledExecutorService finalScheduler = scheduler;

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (!shutdownStarted.compareAndSet(false, true)) return;

                log.info("Shutdown signal received.");
                try {
                    finalScheduler.shutdownNow();
                    finalEngine.close();
                } finally {
                    closeQuietly(finalMetrics);
                    shutdownLatch.countDown();
                }
            }, "sg-shutdown"));

            // 5. Launch
            engine.start(orders.id());
            source.start(scheduler);

            shutdownLatch.await();
        } catch (Throwable t) {
            log.error("Fatal application error", t);

            if (shutdownStarted.compareAndSet(false, true)) {
                if (scheduler != null) scheduler.shutdownNow();
                closeQuietly(engine);
                closeQuietly(metrics);
            }
            System.exit(1);
        }
    }

    private static void startSpeedometer(ScheduledExecutorService scheduler,
                                         StreamEngine engine,
                                         OrderPipeline orders,
                                         SyntheticOrderSource source,
                                         int windowSeconds) {
        log.info("Speedometer active ({}s window)", windowSeconds);

        scheduler.scheduleAtFixedRate(new Runnable() {
            private long lastTimeNs = System.nanoTime();
            private long lastOutput = 0;

            @Override
            public void run() {
                try {
                    final long nowNs = System.nanoTime();
                    final double seconds = (nowNs - lastTimeNs) / 1_000_000_000.0;
                    if (seconds <= 0) return;

                    final PipelineMetricsSnapshot m = engine.getMetrics(orders.id());
                    final EngineStats stats = engine.getStats();
                    final double eps = (m.totalOutput() - lastOutput) / seconds;

                    log.info(String.format(
                            Locale.US,
                            "AVG %ds | SPEED: %,.0f eps | IN: %,d | OUT: %,d | ERR: %,d | BUFFERED: %,d | REJECTED: %,d | LATENCY: %.2f ms | RUNNING: %d",
                            windowSeconds,
                            eps,
                            m.totalInput(),
                            m.totalOutput(),
                            m.totalErrors(),
                            m.bufferedItems(),
                            source.rejected(),
                            m.avgLatencyMs(),
                            stats.runningPipelines()));

                    lastOutput = m.totalOutput();
                    lastTimeNs = nowNs;
                } catch (RuntimeException e) {
                    log.warn("Speedometer error", e);
                }
            }
        }, windowSeconds, windowSeconds, TimeUnit.SECONDS);
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Failed to close {}", resource.getClass().getSimpleName(), e);
        }
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }

    private static final class NamedDaemonThreadFactory implements ThreadFactory {
        private final String name;

        private NamedDaemonThreadFactory(String name) {
            this.name = name;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        }
    }
}
