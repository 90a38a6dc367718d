/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.processors;

import com.intuitivedesigns.streamgraph.config.EngineConfig;
import com.intuitivedesigns.streamgraph.core.StageProcessor;
import com.intuitivedesigns.streamgraph.error.ProcessorNotFoundException;
import com.intuitivedesigns.streamgraph.metrics.MetricsRuntime;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProcessorRegistryTest {

    @Test
    void builtIns_areRegisteredUnderNormalizedNames() {
        ProcessorRegistry registry = ProcessorRegistry.withBuiltIns();

        assertEquals(Set.of("MAP", "FLATMAP", "FILTER", "AGGREGATE", "WINDOW", "DEDUPLICATE", "ENRICH", "SPLIT", "MERGE"),
                registry.names());
        assertEquals(9, registry.size());
    }

    @Test
    void lookup_isCaseInsensitive() {
        ProcessorRegistry registry = ProcessorRegistry.withBuiltIns();

        assertSame(registry.require("flatMap"), registry.require("FLATMAP"));
        assertTrue(registry.find(" filter ").isPresent());
    }

    @Test
    void require_unknownNameListsAvailable() {
        ProcessorRegistry registry = ProcessorRegistry.withBuiltIns();

        ProcessorNotFoundException e = assertThrows(ProcessorNotFoundException.class, () -> registry.require("nope"));
        assertTrue(e.getMessage().contains("nope"));
        assertTrue(e.getMessage().contains("FILTER"));
    }

    @Test
    void register_replacesExistingName() {
        ProcessorRegistry registry = ProcessorRegistry.withBuiltIns();
        StageProcessor custom = (item, ctx) -> List.of(item);

        registry.register("Map", custom);

        assertSame(custom, registry.require("map"));
        assertEquals(9, registry.size());
    }

    @Test
    void register_rejectsBlankName() {
        ProcessorRegistry registry = new ProcessorRegistry();
        assertThrows(IllegalArgumentException.class, () -> registry.register("  ", (item, ctx) -> List.of()));
    }

    @Test
    void discover_withoutPluginsYieldsBuiltIns() {
        ProcessorRegistry registry = ProcessorRegistry.discover(
                EngineConfig.empty(), MetricsRuntime.NOOP, getClass().getClassLoader());

        assertEquals(ProcessorRegistry.withBuiltIns().names(), registry.names());
    }
}
