/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.metrics;

/**
 * Export side of engine metrics.
 *
 * <p>The engine answers metric queries from its own counters. A runtime only mirrors those
 * events to an external registry, so every recording method defaults to a no-op and
 * {@link #NOOP} is a complete implementation.</p>
 *
 * <p>Tags are passed as alternating key/value strings, e.g.
 * {@code increment("streamgraph.items.input", "pipeline", "orders")}.</p>
 */
public interface MetricsRuntime extends AutoCloseable {

    MetricsRuntime NOOP = () -> null;

    /**
     * Backend registry (a Micrometer {@code MeterRegistry} for the bundled runtimes), or
     * {@code null}. Typed as Object so the SPI does not leak a metrics library to callers.
     */
    Object registry();

    default boolean enabled() {
        return false;
    }

    /** Provider id, e.g. "MICROMETER"; "NOOP" when nothing is exported. */
    default String type() {
        return "NOOP";
    }

    default void increment(String name, String... tags) {
        add(name, 1.0, tags);
    }

    /** Adds {@code amount} to a monotonic counter; non-positive amounts are ignored. */
    default void add(String name, double amount, String... tags) {}

    default void recordMillis(String name, double millis, String... tags) {}

    /** Publishes the current value of a gauge; the last value written wins. */
    default void gauge(String name, double value, String... tags) {}

    @Override
    default void close() {}
}
