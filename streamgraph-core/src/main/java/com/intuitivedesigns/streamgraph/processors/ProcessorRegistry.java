/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.processors;

import com.intuitivedesigns.streamgraph.aggregate.AggregateProcessor;
import com.intuitivedesigns.streamgraph.config.EngineConfig;
import com.intuitivedesigns.streamgraph.core.StageProcessor;
import com.intuitivedesigns.streamgraph.error.ProcessorNotFoundException;
import com.intuitivedesigns.streamgraph.metrics.MetricsRuntime;
import com.intuitivedesigns.streamgraph.spi.PluginIds;
import com.intuitivedesigns.streamgraph.spi.ProcessorPlugin;
import com.intuitivedesigns.streamgraph.spi.ServicePluginRegistry;
import com.intuitivedesigns.streamgraph.window.WindowProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name -> processor table consulted by {@code addStage}.
 *
 * <p>Names are case-insensitive ({@code "flatMap"} == {@code "FLATMAP"}). Registering an
 * existing name replaces it for future stages; stages already added keep their processor.</p>
 */
public final class ProcessorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProcessorRegistry.class);

    private final Map<String, StageProcessor> byName = new ConcurrentHashMap<>();

    /**
     * Registry holding only the built-in processors.
     */
    public static ProcessorRegistry withBuiltIns() {
        ProcessorRegistry registry = new ProcessorRegistry();
        registry.register(MapProcessor.NAME, new MapProcessor());
        registry.register(FlatMapProcessor.NAME, new FlatMapProcessor());
        registry.register(FilterProcessor.NAME, new FilterProcessor());
        registry.register(AggregateProcessor.NAME, new AggregateProcessor());
        registry.register(WindowProcessor.NAME, new WindowProcessor());
        registry.register(DeduplicateProcessor.NAME, new DeduplicateProcessor());
        registry.register(EnrichProcessor.NAME, new EnrichProcessor());
        registry.register(SplitProcessor.NAME, new SplitProcessor());
        registry.register(MergeProcessor.NAME, new MergeProcessor());
        return registry;
    }

    /**
     * Built-ins plus every {@link ProcessorPlugin} visible to the class loader.
     */
    public static ProcessorRegistry discover(EngineConfig config, MetricsRuntime metrics, ClassLoader cl) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final ProcessorRegistry registry = withBuiltIns();
        final int builtIns = registry.size();
        final ServicePluginRegistry<ProcessorPlugin> plugins = new ServicePluginRegistry<>(ProcessorPlugin.class, cl);

        for (ProcessorPlugin plugin : plugins.plugins()) {
            registry.register(plugin.id(), createSafe(plugin, config, metrics));
        }
        log.info("Processor Registry Loaded: builtIns={} plugins={}", builtIns, plugins.ids());
        return registry;
    }

    public void register(String name, StageProcessor processor) {
        Objects.requireNonNull(processor, "processor");
        final String key = PluginIds.requireValid(name, "Processor name");
        if (byName.put(key, processor) != null) {
            log.info("Processor '{}' replaced by {}", key, processor.getClass().getName());
        }
    }

    public StageProcessor require(String name) {
        return find(name).orElseThrow(() -> new ProcessorNotFoundException(name, names()));
    }

    public Optional<StageProcessor> find(String name) {
        return Optional.ofNullable(byName.get(PluginIds.normalize(name)));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(byName.keySet()));
    }

    public int size() {
        return byName.size();
    }

    private static StageProcessor createSafe(ProcessorPlugin plugin, EngineConfig config, MetricsRuntime metrics) {
        try {
            return Objects.requireNonNull(plugin.create(config, metrics), "plugin returned null processor");
        } catch (Exception e) {
            throw new RuntimeException("Failed creating Processor [" + plugin.id() + "]", e);
        }
    }
}
