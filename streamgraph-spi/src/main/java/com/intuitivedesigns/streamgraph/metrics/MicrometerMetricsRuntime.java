/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * {@link MetricsRuntime} backed by a Micrometer composite registry.
 *
 * <p>An in-memory {@link SimpleMeterRegistry} is always attached so meters can be read back
 * in-process; exporters (Prometheus) are added with {@link #addRegistry}. Engine gauges are
 * pushed rather than polled, so each gauge reads from a holder updated by {@link #gauge}.</p>
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final CompositeMeterRegistry registry = new CompositeMeterRegistry();
    private final Map<GaugeKey, GaugeValue> gauges = new ConcurrentHashMap<>();
    private final String type;

    public MicrometerMetricsRuntime() {
        this("MICROMETER");
    }

    public MicrometerMetricsRuntime(String type) {
        this.type = type;
        registry.add(new SimpleMeterRegistry());
    }

    public MicrometerMetricsRuntime addRegistry(MeterRegistry exporter) {
        registry.add(exporter);
        return this;
    }

    @Override
    public CompositeMeterRegistry registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public void add(String name, double amount, String... tags) {
        if (amount <= 0) return;
        registry.counter(name, Tags.of(tags)).increment(amount);
    }

    @Override
    public void recordMillis(String name, double millis, String... tags) {
        registry.timer(name, Tags.of(tags)).record((long) (millis * 1_000_000L), TimeUnit.NANOSECONDS);
    }

    @Override
    public void gauge(String name, double value, String... tags) {
        final Tags t = Tags.of(tags);
        gauges.computeIfAbsent(new GaugeKey(name, t), key -> {
            final GaugeValue holder = new GaugeValue();
            Gauge.builder(name, holder, GaugeValue::get).tags(t).register(registry);
            return holder;
        }).set(value);
    }

    @Override
    public void close() {
        registry.close();
        log.info("Micrometer runtime closed ({} gauges)", gauges.size());
    }

    private record GaugeKey(String name, Tags tags) {}

    private static final class GaugeValue {
        private volatile double value;

        void set(double v) {
            this.value = v;
        }

        double get() {
            return value;
        }
    }
}
