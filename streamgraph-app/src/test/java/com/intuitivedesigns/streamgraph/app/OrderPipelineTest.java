/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.app;

import com.intuitivedesigns.streamgraph.aggregate.AggregateProcessor;
import com.intuitivedesigns.streamgraph.aggregate.AggregateTable;
import com.intuitivedesigns.streamgraph.config.EngineConfig;
import com.intuitivedesigns.streamgraph.core.PipelineSettings;
import com.intuitivedesigns.streamgraph.core.StreamItem;
import com.intuitivedesigns.streamgraph.engine.PipelineStage;
import com.intuitivedesigns.streamgraph.engine.StreamEngine;
import com.intuitivedesigns.streamgraph.metrics.MetricsRuntime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class OrderPipelineTest {

    private EngineConfig config;
    private StreamEngine engine;

    @BeforeEach
    void setUp() {
        config = EngineConfig.fromMap(Map.of(
                StreamEngine.CFG_TICK_INTERVAL_MS, "5",
                PipelineSettings.CFG_PARALLELISM, "1",
                OrderPipeline.CFG_MIN_AMOUNT, "1000",
                SyntheticOrderSource.CFG_REGIONS, "emea, amer"));
        engine = new StreamEngine(config, MetricsRuntime.NOOP);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void build_wiresPluginsAndDeadLetterStage() {
        OrderPipeline orders = OrderPipeline.build(engine, config);

        List<String> names = orders.pipeline().stages().stream().map(PipelineStage::name).toList();
        assertEquals(List.of("dead-letters", "orders-in", "normalize", "large-orders", "region-totals", "report"), names);

        PipelineStage deadLetters = orders.pipeline().stages().get(0);
        assertEquals(deadLetters.id(), orders.totals().errorHandlerStageId().orElseThrow());
        assertEquals(OrderPipeline.LOG_PROCESSOR, deadLetters.processorName());
        assertEquals(OrderPipeline.UPPERCASE_PROCESSOR, orders.pipeline().stages().get(2).processorName());
        assertEquals(1, orders.pipeline().entryStages().size());
    }

    @Test
    void orders_areTotalledPerNormalizedRegion() {
        OrderPipeline orders = OrderPipeline.build(engine, config);
        engine.start(orders.id());

        engine.push(orders.id(), new Order("o-1", "emea", 500).toPayload());
        engine.push(orders.id(), new Order("o-2", "emea", 2000).toPayload());
        engine.push(orders.id(), new Order("o-3", "amer", 3000).toPayload());
        engine.push(orders.id(), new Order("o-4", "emea", 1500).toPayload());

        String stateKey = AggregateProcessor.stateKey(orders.totals().id());
        await().atMost(Duration.ofSeconds(5)).until(() -> {
            AggregateTable table = (AggregateTable) engine.getState(orders.id(), stateKey);
            return table != null && Long.valueOf(3500L).equals(table.group("EMEA").get("total"));
        });

        AggregateTable table = (AggregateTable) engine.getState(orders.id(), stateKey);
        assertEquals(2, table.groupCount());
        assertEquals(2L, table.group("EMEA").get("orders"));
        assertEquals(3000L, table.group("AMER").get("total"));
        assertTrue(table.group("emea").isEmpty());

        await().atMost(Duration.ofSeconds(5)).until(() ->
                engine.getStageMetrics(orders.id(), orders.totals().id()).outputCount() == 3);
        assertEquals(4, engine.getMetrics(orders.id()).totalInput());
    }

    @Test
    void syntheticSource_staysWithinConfiguredRegions() {
        SyntheticOrderSource source = new SyntheticOrderSource(engine, "unused", config);

        for (int i = 0; i < 50; i++) {
            Order o = source.next();
            assertTrue(List.of("emea", "amer").contains(o.region()), o.region());
            assertTrue(o.amount() >= 1 && o.amount() <= 5_000, String.valueOf(o.amount()));
        }
        assertEquals("ord-51", source.next().orderId());
    }

    @Test
    void render_writesPayloadAsJson() {
        StreamItem item = StreamItem.create("p", new Order("o-9", "apac", 42).toPayload(), "push", Instant.now());

        assertEquals("{\"orderId\":\"o-9\",\"region\":\"apac\",\"amount\":42}", OrderPipeline.render(item));
    }
}
