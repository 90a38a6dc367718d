/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.streamgraph.aggregate.Aggregation;
import com.intuitivedesigns.streamgraph.aggregate.AggregateProcessor;
import com.intuitivedesigns.streamgraph.config.EngineConfig;
import com.intuitivedesigns.streamgraph.core.StageConfig;
import com.intuitivedesigns.streamgraph.core.StageType;
import com.intuitivedesigns.streamgraph.core.StreamItem;
import com.intuitivedesigns.streamgraph.engine.Pipeline;
import com.intuitivedesigns.streamgraph.engine.PipelineStage;
import com.intuitivedesigns.streamgraph.engine.StageDefinition;
import com.intuitivedesigns.streamgraph.engine.StreamEngine;
import com.intuitivedesigns.streamgraph.processors.FilterProcessor;
import com.intuitivedesigns.streamgraph.processors.PassThroughProcessor;
import com.intuitivedesigns.streamgraph.processors.PayloadFields;
import com.intuitivedesigns.streamgraph.processors.ProcessorParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Demo graph: orders-in → normalize → large-orders → region-totals → report,
 * with a dead-letter stage behind the aggregation.
 */
public final class OrderPipeline {

    private static final Logger log = LoggerFactory.getLogger(OrderPipeline.class);

    static final String CFG_MIN_AMOUNT = "app.orders.min.amount";
    static final long DEFAULT_MIN_AMOUNT = 1000L;

    static final String UPPERCASE_PROCESSOR = "UPPERCASE";
    static final String LOG_PROCESSOR = "LOG";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Pipeline pipeline;
    private final PipelineStage totals;

    private OrderPipeline(Pipeline pipeline, PipelineStage totals) {
        this.pipeline = pipeline;
        this.totals = totals;
    }

    public static OrderPipeline build(StreamEngine engine, EngineConfig config) {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(config, "config");

        final long minAmount = config.getLong(CFG_MIN_AMOUNT, DEFAULT_MIN_AMOUNT);
        final Pipeline p = engine.createPipeline("orders", "Regional totals of large orders", null);

        final PipelineStage deadLetters = engine.addStage(p.id(),
                StageDefinition.builder("dead-letters", StageType.SINK)
                        .processor(available(engine, LOG_PROCESSOR))
                        .autoChain(false)
                        .build());

        engine.addStage(p.id(), StageDefinition.builder("orders-in", StageType.SOURCE).build());

        engine.addStage(p.id(), StageDefinition.builder("normalize", StageType.TRANSFORM)
                .processor(available(engine, UPPERCASE_PROCESSOR))
                .config(StageConfig.builder().param("field", Order.REGION).build())
                .build());

        final Predicate<Object> large = payload -> {
            final Object amount = PayloadFields.extract(payload, Order.AMOUNT);
            return amount instanceof Number n && n.longValue() >= minAmount;
        };
        engine.addStage(p.id(), StageDefinition.builder("large-orders", StageType.FILTER)
                .processor(FilterProcessor.NAME)
                .config(StageConfig.builder().param(ProcessorParams.FILTER_FUNCTION, large).build())
                .build());

        final PipelineStage totals = engine.addStage(p.id(), StageDefinition.builder("region-totals", StageType.AGGREGATE)
                .processor(AggregateProcessor.NAME)
                .config(StageConfig.builder()
                        .param(ProcessorParams.GROUP_KEY, Order.REGION)
                        .param(ProcessorParams.AGGREGATIONS, List.of(
                                Aggregation.sum(Order.AMOUNT, "total"),
                                Aggregation.count("orders"),
                                Aggregation.avg(Order.AMOUNT, "avgAmount"),
                                Aggregation.max(Order.AMOUNT, "largest")))
                        .build())
                .errorHandler(deadLetters.id())
                .build());

        engine.addStage(p.id(), StageDefinition.builder("report", StageType.SINK)
                .processor((item, ctx) -> {
                    if (log.isDebugEnabled()) log.debug("[report] {}", render(item));
                    return List.of(item);
                })
                .build());

        log.info("Order pipeline ready: {} stages, minAmount={}", p.stages().size(), minAmount);
        return new OrderPipeline(p, totals);
    }

    public Pipeline pipeline() {
        return pipeline;
    }

    public String id() {
        return pipeline.id();
    }

    /** Stage id of the aggregation, for state lookups. */
    public PipelineStage totals() {
        return totals;
    }

    static String render(StreamItem item) {
        try {
            return MAPPER.writeValueAsString(item.payload());
        } catch (JsonProcessingException e) {
            return String.valueOf(item.payload());
        }
    }

    private static String available(StreamEngine engine, String processorName) {
        if (engine.processorNames().contains(processorName)) return processorName;
        log.info("Processor {} not on the classpath, using {}", processorName, PassThroughProcessor.NAME);
        return null;
    }
}
