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
import com.intuitivedesigns.streamgraph.engine.DefaultProcessingContext;
import com.intuitivedesigns.streamgraph.metrics.MetricsRuntime;
import com.intuitivedesigns.streamgraph.processors.ProcessorRegistry;
import com.intuitivedesigns.streamgraph.state.StateStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TextProcessorPluginsTest {

    private static final EngineConfig CONFIG = EngineConfig.empty();

    private static ProcessingContext context(Map<String, Object> params) {
        return new DefaultProcessingContext("p-1", "s-1", params, new StateStore(), Clock.systemUTC(), null);
    }

    private static StreamItem item(Object payload) {
        return StreamItem.create("p-1", payload, "push", Instant.now());
    }

    @Test
    void uppercase_stringPayload_shouldBeUppercased() throws Exception {
        StageProcessor upper = new UppercaseProcessorPlugin().create(CONFIG, MetricsRuntime.NOOP);

        StreamItem in = item("hello world");
        List<StreamItem> out = upper.process(in, context(Map.of()));

        assertEquals(1, out.size());
        assertEquals("HELLO WORLD", out.get(0).payload());
        assertEquals(in.id(), out.get(0).id());
        assertEquals(ProcessorKind.MAP, upper.kind());
    }

    @Test
    void uppercase_mapField_shouldOnlyTouchThatField() throws Exception {
        StageProcessor upper = new UppercaseProcessorPlugin().create(CONFIG, MetricsRuntime.NOOP);
        Map<String, Object> payload = Map.of("region", "emea", "note", "keep");

        List<StreamItem> out = upper.process(item(payload),
                context(Map.of(UppercaseProcessorPlugin.PARAM_FIELD, "region")));

        assertEquals(Map.of("region", "EMEA", "note", "keep"), out.get(0).payload());
        assertEquals("emea", payload.get("region"));
    }

    @Test
    void uppercase_unsupportedPayload_shouldPassThrough() throws Exception {
        StageProcessor upper = new UppercaseProcessorPlugin().create(CONFIG, MetricsRuntime.NOOP);

        StreamItem number = item(42);
        StreamItem missingField = item(Map.of("amount", 10));

        assertSame(number, upper.process(number, context(Map.of())).get(0));
        assertSame(missingField, upper.process(missingField,
                context(Map.of(UppercaseProcessorPlugin.PARAM_FIELD, "region"))).get(0));
    }

    @Test
    void log_shouldPassItemThroughAndCount() throws Exception {
        CountingMetrics metrics = new CountingMetrics();
        StageProcessor logger = new LogProcessorPlugin().create(
                EngineConfig.fromMap(Map.of(LogProcessorPlugin.CFG_MAX_LOG_CHARS, "8")), metrics);

        StreamItem in = item("a payload longer than eight characters");
        List<StreamItem> out = logger.process(in, context(Map.of()));

        assertEquals(List.of(in), out);
        assertEquals(1, metrics.count);
        assertEquals(ProcessorKind.PASS_THROUGH, logger.kind());
    }

    @Test
    void log_truncate_shouldMarkCutPayloads() {
        assertEquals("abc", LogProcessorPlugin.truncate("abc", 8));
        assertEquals("abcd... [TRUNCATED]", LogProcessorPlugin.truncate("abcdefgh", 4));
    }

    @Test
    void discover_shouldRegisterPluginsUnderUppercaseIds() {
        ProcessorRegistry registry = ProcessorRegistry.discover(CONFIG, MetricsRuntime.NOOP,
                Thread.currentThread().getContextClassLoader());

        assertTrue(registry.names().contains(UppercaseProcessorPlugin.ID));
        assertTrue(registry.names().contains(LogProcessorPlugin.ID));
        assertTrue(registry.find("uppercase").isPresent());
    }

    private static final class CountingMetrics implements MetricsRuntime {
        int count;

        @Override
        public Object registry() {
            return null;
        }

        @Override
        public void add(String name, double amount, String... tags) {
            count += (int) amount;
        }
    }
}
