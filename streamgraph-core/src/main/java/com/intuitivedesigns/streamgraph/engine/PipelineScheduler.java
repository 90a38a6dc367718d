/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.engine;

import com.intuitivedesigns.streamgraph.core.PipelineStatus;
import com.intuitivedesigns.streamgraph.core.StreamItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one pipeline: a fixed-delay tick drains up to {@code parallelism} buffered items
 * and processes them concurrently on the pipeline's worker pool.
 *
 * Guarantees:
 * - Ticks never overlap (fixed delay, batch awaited inside the tick)
 * - Cancelling the tick lets an in-flight batch complete
 * - Shutdown waits for in-flight work before forcing the pools down
 */
final class PipelineScheduler {

    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);

    private final Pipeline pipeline;
    private final StageGraphExecutor executor;
    private final long tickIntervalMs;
    private final int parallelism;

    private final ScheduledExecutorService ticker;
    private final ExecutorService workers;

    // Guarded by this
    private ScheduledFuture<?> tickHandle;

    private final AtomicInteger inFlight = new AtomicInteger();

    PipelineScheduler(Pipeline pipeline, StageGraphExecutor executor, long tickIntervalMs) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.executor = Objects.requireNonNull(executor, "executor");
        if (tickIntervalMs <= 0) throw new IllegalArgumentException("tickIntervalMs must be > 0");
        this.tickIntervalMs = tickIntervalMs;
        this.parallelism = pipeline.settings().parallelism();

        final String label = "sg-" + pipeline.name();
        this.ticker = Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory(label + "-tick"));
        this.workers = Executors.newFixedThreadPool(parallelism, new NamedDaemonThreadFactory(label + "-worker"));
    }

    synchronized void start() {
        if (tickHandle != null) return;
        tickHandle = ticker.scheduleWithFixedDelay(this::safeTick, 0, tickIntervalMs, TimeUnit.MILLISECONDS);
        log.debug("Scheduler started for pipeline '{}' (tick={}ms, parallelism={})",
                pipeline.name(), tickIntervalMs, parallelism);
    }

    /** Stops future ticks; a tick already running finishes its batch. */
    synchronized void cancel() {
        if (tickHandle == null) return;
        tickHandle.cancel(false);
        tickHandle = null;
    }

    synchronized boolean isScheduled() {
        return tickHandle != null;
    }

    int inFlight() {
        return inFlight.get();
    }

    void shutdown(long timeoutMs) {
        cancel();
        ticker.shutdown();
        workers.shutdown();
        try {
            if (!ticker.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)
                    || !workers.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Pipeline '{}' did not drain within {}ms ({} in flight); forcing shutdown",
                        pipeline.name(), timeoutMs, inFlight.get());
                ticker.shutdownNow();
                workers.shutdownNow();
            }
        } catch (InterruptedException ie) {
            ticker.shutdownNow();
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            // An exception escaping here would silently cancel the schedule
            log.error("Tick failed for pipeline '{}'", pipeline.name(), e);
        }
    }

    void tick() {
        if (pipeline.status() != PipelineStatus.RUNNING) return;

        final List<StreamItem> batch = pipeline.buffer().drain(parallelism);
        if (batch.isEmpty()) return;

        final List<Future<?>> pending = new ArrayList<>(batch.size());
        for (StreamItem item : batch) {
            inFlight.incrementAndGet();
            pending.add(workers.submit(() -> {
                try {
                    executor.processItem(pipeline, item);
                } finally {
                    inFlight.decrementAndGet();
                }
            }));
        }

        for (Future<?> f : pending) {
            try {
                f.get();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            } catch (ExecutionException ee) {
                log.error("Worker failed in pipeline '{}'", pipeline.name(), ee.getCause());
            }
        }
    }
}
