/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.app;

import com.intuitivedesigns.streamgraph.config.EngineConfig;
import com.intuitivedesigns.streamgraph.engine.StreamEngine;
import com.intuitivedesigns.streamgraph.error.CapacityExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Pushes random orders into a pipeline at a fixed rate. Rejected pushes are counted, not
 * retried.
 */
final class SyntheticOrderSource {

    private static final Logger log = LoggerFactory.getLogger(SyntheticOrderSource.class);

    static final String CFG_RATE_PER_SECOND = "app.orders.rate.per.second";
    static final String CFG_REGIONS = "app.orders.regions";
    static final String CFG_MAX_AMOUNT = "app.orders.max.amount";

    private static final int DEFAULT_RATE_PER_SECOND = 500;
    private static final String DEFAULT_REGIONS = "emea,amer,apac";
    private static final long DEFAULT_MAX_AMOUNT = 5_000L;

    private static final long PERIOD_MS = 100L;

    private final StreamEngine engine;
    private final String pipelineId;
    private final int perTick;
    private final List<String> regions;
    private final long maxAmount;

    private final SplittableRandom random = new SplittableRandom();
    private final AtomicLong sequence = new AtomicLong();
    private final LongAdder pushed = new LongAdder();
    private final LongAdder rejected = new LongAdder();

    SyntheticOrderSource(StreamEngine engine, String pipelineId, EngineConfig config) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.pipelineId = Objects.requireNonNull(pipelineId, "pipelineId");

        final int rate = Math.max(1, config.getInt(CFG_RATE_PER_SECOND, DEFAULT_RATE_PER_SECOND));
        this.perTick = Math.max(1, (int) (rate * PERIOD_MS / 1000L));
        this.regions = Arrays.stream(config.getString(CFG_REGIONS, DEFAULT_REGIONS).split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        if (regions.isEmpty()) throw new IllegalArgumentException(CFG_REGIONS + " must list at least one region");
        this.maxAmount = Math.max(1L, config.getLong(CFG_MAX_AMOUNT, DEFAULT_MAX_AMOUNT));
    }

    void start(ScheduledExecutorService scheduler) {
        log.info("Synthetic orders: {} per {}ms across regions {}", perTick, PERIOD_MS, regions);
        scheduler.scheduleAtFixedRate(this::emitBatch, 0, PERIOD_MS, TimeUnit.MILLISECONDS);
    }

    Order next() {
        final String id = "ord-" + sequence.incrementAndGet();
        final String region = regions.get(random.nextInt(regions.size()));
        return new Order(id, region, 1 + random.nextLong(maxAmount));
    }

    long pushed() {
        return pushed.sum();
    }

    long rejected() {
        return rejected.sum();
    }

    private void emitBatch() {
        try {
            for (int i = 0; i < perTick; i++) {
                try {
                    engine.push(pipelineId, next().toPayload());
                    pushed.increment();
                } catch (CapacityExceededException e) {
                    rejected.increment();
                }
            }
        } catch (RuntimeException e) {
            log.warn("Synthetic source error", e);
        }
    }
}
