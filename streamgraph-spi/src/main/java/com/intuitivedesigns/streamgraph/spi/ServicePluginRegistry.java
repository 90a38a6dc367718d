/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * ServiceLoader scan for one plugin type, keyed by normalized id.
 *
 * <p>The classpath is scanned once, in the constructor. Two plugins claiming the same id
 * fail the scan: a processor name must resolve to exactly one implementation.</p>
 *
 * @param <T> the SPI type, e.g. {@link ProcessorPlugin}
 */
public final class ServicePluginRegistry<T extends PipelinePlugin<?>> {

    private static final Logger log = LoggerFactory.getLogger(ServicePluginRegistry.class);

    private final Class<T> spiType;
    private final Map<String, T> byId;

    public ServicePluginRegistry(Class<T> spiType, ClassLoader cl) {
        this.spiType = spiType;

        final Map<String, T> found = new LinkedHashMap<>();
        for (T plugin : ServiceLoader.load(spiType, cl)) {
            final String id = PluginIds.requireValid(plugin.id(), "Plugin id of " + plugin.getClass().getName());
            final T previous = found.putIfAbsent(id, plugin);
            if (previous != null) {
                throw new IllegalStateException(String.format(
                        "Duplicate %s id '%s': %s and %s",
                        spiType.getSimpleName(), id, previous.getClass().getName(), plugin.getClass().getName()));
            }
            log.debug("Discovered {} '{}' ({})", spiType.getSimpleName(), id, plugin.getClass().getName());
        }
        this.byId = Collections.unmodifiableMap(found);
    }

    public Set<String> ids() {
        return byId.keySet();
    }

    /** Plugins in discovery order. */
    public List<T> plugins() {
        return new ArrayList<>(byId.values());
    }

    @Override
    public String toString() {
        return spiType.getSimpleName() + "s" + byId.keySet();
    }
}
