/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.plugins;

import com.intuitivedesigns.streamgraph.config.EngineConfig;
import com.intuitivedesigns.streamgraph.core.ProcessingContext;
import com.intuitivedesigns.streamgraph.core.ProcessorKind;
import com.intuitivedesigns.streamgraph.core.StageProcessor;
import com.intuitivedesigns.streamgraph.core.StreamItem;
import com.intuitivedesigns.streamgraph.metrics.MetricsRuntime;
import com.intuitivedesigns.streamgraph.spi.ProcessorPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Sink-style processor that logs every item and passes it on. Typically wired as an error
 * handler stage so dead-lettered items leave a trace.
 */
public final class LogProcessorPlugin implements ProcessorPlugin {

    private static final Logger log = LoggerFactory.getLogger(LogProcessorPlugin.class);

    public static final String ID = "LOG";

    // Config keys
    static final String CFG_LOG_LEVEL = "processor.log.level";
    static final String CFG_MAX_LOG_CHARS = "processor.log.max.chars";
    static final String CFG_LOG_PAYLOAD = "processor.log.payload.enabled";
    static final String CFG_METRIC_NAME = "processor.log.metric.name";

    // Defaults
    private static final String DEFAULT_LOG_LEVEL = "INFO";
    private static final int DEFAULT_MAX_LOG_CHARS = 1024;
    private static final String DEFAULT_METRIC_NAME = "streamgraph.log.items";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public StageProcessor create(EngineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");

        final String level = normalizeUpper(config.getString(CFG_LOG_LEVEL, DEFAULT_LOG_LEVEL));
        final int maxChars = clampInt(config.getInt(CFG_MAX_LOG_CHARS, DEFAULT_MAX_LOG_CHARS), 0, 1_048_576);
        final boolean logPayload = config.getBoolean(CFG_LOG_PAYLOAD, true);
        final String metricName = config.getString(CFG_METRIC_NAME, DEFAULT_METRIC_NAME);
        final MetricsRuntime safeMetrics = (metrics != null) ? metrics : MetricsRuntime.NOOP;

        log.info("Initialized LOG processor (Level={}, MaxChars={}, Metric={})", level, maxChars, metricName);

        return new StageProcessor() {
            @Override
            public List<StreamItem> process(StreamItem item, ProcessingContext context) {
                safeMetrics.increment(metricName, "stage", context.stageId());

                if (shouldLog(level)) {
                    final String content = logPayload ? truncate(String.valueOf(item.payload()), maxChars) : "[payload logging disabled]";
                    logAtLevel(level, "[{}] item={} tags={} payload={}",
                            context.stageId(), item.id(), item.metadata().tags(), content);
                }
                return List.of(item);
            }

            @Override
            public ProcessorKind kind() {
                return ProcessorKind.PASS_THROUGH;
            }
        };
    }

    // --- Helpers ---

    static String truncate(String raw, int maxChars) {
        return (raw.length() > maxChars) ? raw.substring(0, maxChars) + "... [TRUNCATED]" : raw;
    }

    private static boolean shouldLog(String level) {
        return switch (level) {
            case "ERROR" -> log.isErrorEnabled();
            case "WARN"  -> log.isWarnEnabled();
            case "DEBUG" -> log.isDebugEnabled();
            case "TRACE" -> log.isTraceEnabled();
            case "OFF"   -> false;
            default      -> log.isInfoEnabled();
        };
    }

    private static void logAtLevel(String level, String fmt, Object... args) {
        switch (level) {
            case "ERROR" -> log.error(fmt, args);
            case "WARN"  -> log.warn(fmt, args);
            case "DEBUG" -> log.debug(fmt, args);
            case "TRACE" -> log.trace(fmt, args);
            case "OFF"   -> { }
            default      -> log.info(fmt, args);
        }
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }

    private static String normalizeUpper(String s) {
        if (s == null || s.isBlank()) return DEFAULT_LOG_LEVEL;
        return s.trim().toUpperCase(Locale.ROOT);
    }
}
