/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.engine;

import com.intuitivedesigns.streamgraph.core.BackpressureStrategy;
import com.intuitivedesigns.streamgraph.core.ErrorPolicy;
import com.intuitivedesigns.streamgraph.core.ItemMetadata;
import com.intuitivedesigns.streamgraph.core.StreamItem;
import com.intuitivedesigns.streamgraph.error.CapacityExceededException;
import com.intuitivedesigns.streamgraph.error.ProcessorTimeoutException;
import com.intuitivedesigns.streamgraph.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Walks one item through a pipeline's stage graph.
 *
 * <p>Processor calls run on the shared processor pool so the stage timeout can be enforced
 * with {@link Future#get(long, TimeUnit)}. Failures are retried by requeueing the input at
 * the tail of the pipeline buffer; exhausted items go to the stage's error handler or are
 * dropped.</p>
 */
final class StageGraphExecutor {

    private static final Logger log = LoggerFactory.getLogger(StageGraphExecutor.class);

    static final String DEAD_LETTER_TAG = "dead-letter";
    static final String FAILED_STAGE_TAG_PREFIX = "failed-stage:";
    static final String EMIT_LABEL = "emit";

    /** Buffer entry point shared with {@code push}. */
    @FunctionalInterface
    interface Admission {
        StreamItem admit(Pipeline pipeline, Object payload, String sourceLabel, String correlationId,
                         BackpressureStrategy strategy);
    }

    /** Invoked when a fail-fast pipeline sees a processor failure. */
    @FunctionalInterface
    interface FailureListener {
        void onFailure(Pipeline pipeline, PipelineStage stage, Exception cause);
    }

    private final ExecutorService processorPool;
    private final Clock clock;
    private final MetricsRuntime metrics;
    private final Admission admission;
    private final FailureListener failFast;

    StageGraphExecutor(ExecutorService processorPool,
                       Clock clock,
                       MetricsRuntime metrics,
                       Admission admission,
                       FailureListener failFast) {
        this.processorPool = Objects.requireNonNull(processorPool, "processorPool");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.admission = Objects.requireNonNull(admission, "admission");
        this.failFast = Objects.requireNonNull(failFast, "failFast");
    }

    /**
     * Processes a buffered item. A requeued item resumes at the stage that failed it;
     * everything else enters at the pipeline's entry stages.
     */
    void processItem(Pipeline pipeline, StreamItem item) {
        final long t0 = System.nanoTime();
        try {
            final List<PipelineStage> entry = new ArrayList<>(1);
            if (item.metadata().hasStage()) {
                pipeline.stage(item.metadata().stageId()).ifPresent(entry::add);
            }
            if (entry.isEmpty()) entry.addAll(pipeline.entryStages());

            for (PipelineStage stage : entry) {
                processStage(pipeline, stage, item);
            }
        } catch (RuntimeException e) {
            pipeline.metrics().recordError();
            metrics.increment(EngineMeters.ITEMS_ERRORS, EngineMeters.pipelineTags(pipeline));
            log.error("Unexpected failure processing item {} in pipeline '{}'", item.id(), pipeline.name(), e);
        } finally {
            pipeline.metrics().recordItemLatency(elapsedMs(t0));
        }
    }

    void processStage(Pipeline pipeline, PipelineStage stage, StreamItem item) {
        stage.metrics().recordInput();

        final DefaultProcessingContext ctx = new DefaultProcessingContext(
                pipeline.id(),
                stage.id(),
                stage.config().params(),
                pipeline.state(),
                clock,
                payload -> emit(pipeline, stage, item, payload)
        );

        final long t0 = System.nanoTime();
        final List<StreamItem> outputs;
        try {
            outputs = invoke(stage, item, ctx);
        } catch (Exception e) {
            recordLatency(pipeline, stage, t0);
            onFailure(pipeline, stage, item, e);
            return;
        }
        recordLatency(pipeline, stage, t0);

        if (outputs == null || outputs.isEmpty()) return;

        final List<StreamItem> advanced = new ArrayList<>(outputs.size());
        for (StreamItem out : outputs) {
            if (out == null) continue;
            advanced.add(out.withMetadata(out.metadata().withStageId(stage.id()).withRetryCount(0)));
        }
        if (advanced.isEmpty()) return;

        stage.metrics().recordOutput(advanced.size());
        pipeline.metrics().recordOutput(advanced.size());
        metrics.add(EngineMeters.ITEMS_OUTPUT, advanced.size(), EngineMeters.pipelineTags(pipeline));

        for (String nextId : stage.nextStageIds()) {
            final PipelineStage next = pipeline.stage(nextId).orElse(null);
            if (next == null) continue;
            for (StreamItem out : advanced) {
                processStage(pipeline, next, out);
            }
        }
    }

    /**
     * Runs the processor under the stage's permit. The permit is returned when the processor
     * call ends, so a timed-out call that ignores interruption keeps holding it.
     */
    private List<StreamItem> invoke(PipelineStage stage, StreamItem item, DefaultProcessingContext ctx) throws Exception {
        stage.acquire();

        // Set by whichever side owns the permit first: the task when it starts, or the caller on abandon
        final AtomicBoolean claimed = new AtomicBoolean(false);
        final Future<List<StreamItem>> call;
        try {
            call = processorPool.submit(() -> {
                if (!claimed.compareAndSet(false, true)) return List.of();
                try {
                    return stage.processor().process(item, ctx);
                } finally {
                    stage.release();
                }
            });
        } catch (RuntimeException e) {
            stage.release();
            throw e;
        }

        final long timeoutMs = stage.config().timeoutMs();
        try {
            return call.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            abandon(stage, call, claimed);
            throw new ProcessorTimeoutException(stage.name(), timeoutMs);
        } catch (InterruptedException ie) {
            abandon(stage, call, claimed);
            Thread.currentThread().interrupt();
            throw ie;
        } catch (ExecutionException ee) {
            final Throwable cause = ee.getCause();
            if (cause instanceof Exception) throw (Exception) cause;
            throw ee;
        }
    }

    private static void abandon(PipelineStage stage, Future<?> call, AtomicBoolean claimed) {
        call.cancel(true);
        // Never started: the task will not release, so do it here
        if (claimed.compareAndSet(false, true)) stage.release();
    }

    private void onFailure(Pipeline pipeline, PipelineStage stage, StreamItem item, Exception e) {
        stage.metrics().recordError();
        pipeline.metrics().recordError();
        metrics.increment(EngineMeters.ITEMS_ERRORS, EngineMeters.pipelineTags(pipeline));

        final ErrorPolicy policy = pipeline.settings().errorPolicy();
        if (policy.failFast()) {
            failFast.onFailure(pipeline, stage, e);
        }

        final int attempt = item.retryCount();
        if (attempt < stage.config().retries()) {
            final StreamItem retry = item.withMetadata(
                    item.metadata().withStageId(stage.id()).withRetryCount(attempt + 1));
            if (pipeline.buffer().offer(retry)) {
                pipeline.metrics().recordRetry();
                metrics.increment(EngineMeters.ITEMS_RETRIED, EngineMeters.pipelineTags(pipeline));
                log.debug("Stage '{}' failed item {} (attempt {}), requeued: {}",
                        stage.name(), item.id(), attempt + 1, e.toString());
                return;
            }
            pipeline.metrics().recordBackpressure();
            metrics.increment(EngineMeters.ITEMS_REJECTED, EngineMeters.pipelineTags(pipeline));
            log.warn("Requeue of item {} rejected, buffer of pipeline '{}' is full", item.id(), pipeline.name());
        }

        exhausted(pipeline, stage, item, e, policy);
    }

    private void exhausted(Pipeline pipeline, PipelineStage stage, StreamItem item, Exception e, ErrorPolicy policy) {
        final PipelineStage handler = policy.deadLetterEnabled()
                ? stage.errorHandlerStageId().flatMap(pipeline::stage).orElse(null)
                : null;

        if (handler == null) {
            pipeline.metrics().recordDropped();
            metrics.increment(EngineMeters.ITEMS_DROPPED, EngineMeters.pipelineTags(pipeline));
            log.warn("Item {} dropped after {} attempt(s) at stage '{}': {}",
                    item.id(), item.retryCount() + 1, stage.name(), e.toString());
            return;
        }

        pipeline.metrics().recordDeadLetter();
        metrics.increment(EngineMeters.ITEMS_DEAD_LETTERED, EngineMeters.pipelineTags(pipeline));
        log.warn("Item {} routed to error handler '{}' after failing at stage '{}': {}",
                item.id(), handler.name(), stage.name(), e.toString());

        final ItemMetadata meta = item.metadata()
                .withStageId(stage.id())
                .withRetryCount(0)
                .withTag(DEAD_LETTER_TAG)
                .withTag(FAILED_STAGE_TAG_PREFIX + stage.id());
        processStage(pipeline, handler, item.withMetadata(meta));
    }

    private StreamItem emit(Pipeline pipeline, PipelineStage stage, StreamItem parent, Object payload) {
        try {
            return admission.admit(pipeline, payload, EMIT_LABEL, parent.metadata().correlationId(),
                    stage.config().backpressure());
        } catch (CapacityExceededException e) {
            if (stage.config().backpressure() == BackpressureStrategy.DROP) {
                log.debug("Stage '{}' dropped an emitted item: {}", stage.name(), e.getMessage());
                return null;
            }
            throw e;
        }
    }

    private void recordLatency(Pipeline pipeline, PipelineStage stage, long t0) {
        final double ms = elapsedMs(t0);
        stage.metrics().recordLatency(ms, clock.instant());
        metrics.recordMillis(EngineMeters.STAGE_LATENCY, ms, EngineMeters.stageTags(pipeline, stage));
    }

    private static double elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000.0;
    }
}
