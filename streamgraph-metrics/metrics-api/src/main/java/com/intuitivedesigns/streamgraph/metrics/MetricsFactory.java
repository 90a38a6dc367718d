/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.ServiceLoader;

public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    private MetricsFactory() {}

    /**
     * Returns the runtime of the first provider accepting the settings, or
     * {@link MetricsRuntime#NOOP}.
     */
    public static MetricsRuntime init(MetricsSettings settings) {
        return init(settings, resolveClassLoader());
    }

    public static MetricsRuntime init(MetricsSettings settings, ClassLoader cl) {
        Objects.requireNonNull(settings, "settings");

        final ServiceLoader<MetricsProvider> loader = ServiceLoader.load(MetricsProvider.class, cl);
        for (MetricsProvider p : loader) {
            try {
                final MetricsRuntime rt = p.create(settings);
                if (rt != null) {
                    log.info("Metrics Runtime initialized: {} ({})", p.id(), p.getClass().getName());
                    return rt;
                }
            } catch (Throwable t) {
                // NoClassDefFoundError/LinkageError when a provider's backend is missing
                log.warn("Failed to initialize metrics provider [{}]: {}", p.getClass().getName(), t.getMessage());
                log.debug("Provider init stack trace:", t);
            }
        }

        log.info("Metrics disabled or no provider matches '{}' (NOOP active).", settings.providerId);
        return MetricsRuntime.NOOP;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader threadCl = Thread.currentThread().getContextClassLoader();
        return (threadCl != null) ? threadCl : MetricsFactory.class.getClassLoader();
    }
}
