/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.engine;

import com.intuitivedesigns.streamgraph.config.EngineConfig;
import com.intuitivedesigns.streamgraph.core.BackpressureStrategy;
import com.intuitivedesigns.streamgraph.core.PipelineSettings;
import com.intuitivedesigns.streamgraph.core.PipelineStatus;
import com.intuitivedesigns.streamgraph.core.StageConfig;
import com.intuitivedesigns.streamgraph.core.StageProcessor;
import com.intuitivedesigns.streamgraph.core.StageType;
import com.intuitivedesigns.streamgraph.core.StreamItem;
import com.intuitivedesigns.streamgraph.error.CapacityExceededException;
import com.intuitivedesigns.streamgraph.error.PipelineNotFoundException;
import com.intuitivedesigns.streamgraph.error.PipelineStateException;
import com.intuitivedesigns.streamgraph.error.StageNotFoundException;
import com.intuitivedesigns.streamgraph.metrics.EngineStats;
import com.intuitivedesigns.streamgraph.metrics.MetricsRuntime;
import com.intuitivedesigns.streamgraph.metrics.PipelineMetricsSnapshot;
import com.intuitivedesigns.streamgraph.metrics.StageMetricsSnapshot;
import com.intuitivedesigns.streamgraph.processors.PassThroughProcessor;
import com.intuitivedesigns.streamgraph.processors.ProcessorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point of the engine: owns the pipelines, the processor registry and the shared
 * processor pool.
 *
 * <pre>{@code
 * try (StreamEngine engine = new StreamEngine()) {
 *     Pipeline p = engine.createPipeline("orders", PipelineSettings.defaults());
 *     engine.addStage(p.id(), StageDefinition.builder("in", StageType.SOURCE).build());
 *     engine.start(p.id());
 *     engine.push(p.id(), Map.of("amount", 10));
 * }
 * }</pre>
 *
 * <p>All operations are thread-safe. Wiring and lifecycle changes on a pipeline are
 * serialized on that pipeline.</p>
 */
public final class StreamEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StreamEngine.class);

    public static final String CFG_TICK_INTERVAL_MS = "engine.tick.interval.ms";
    public static final String CFG_SHUTDOWN_TIMEOUT_MS = "engine.shutdown.timeout.ms";
    public static final String CFG_STAGE_TIMEOUT_MS = "stage.timeout.ms";

    public static final long DEFAULT_TICK_INTERVAL_MS = 10L;
    public static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 5_000L;

    static final String PUSH_LABEL = "push";

    private final MetricsRuntime metrics;
    private final Clock clock;
    private final ProcessorRegistry processors;
    private final PipelineSettings defaultSettings;
    private final long tickIntervalMs;
    private final long shutdownTimeoutMs;
    private final long defaultStageTimeoutMs;

    private final Map<String, Pipeline> pipelines = new ConcurrentHashMap<>();
    private final ExecutorService processorPool;
    private final StageGraphExecutor executor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public StreamEngine() {
        this(EngineConfig.empty(), MetricsRuntime.NOOP);
    }

    public StreamEngine(EngineConfig config, MetricsRuntime metrics) {
        this(config, metrics, Clock.systemUTC());
    }

    public StreamEngine(EngineConfig config, MetricsRuntime metrics, Clock clock) {
        this(config, metrics, clock,
                ProcessorRegistry.discover(config, metrics, Thread.currentThread().getContextClassLoader()));
    }

    public StreamEngine(EngineConfig config, MetricsRuntime metrics, Clock clock, ProcessorRegistry processors) {
        Objects.requireNonNull(config, "config");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.processors = Objects.requireNonNull(processors, "processors");

        this.defaultSettings = PipelineSettings.from(config);
        this.tickIntervalMs = Math.max(1L, config.getLong(CFG_TICK_INTERVAL_MS, DEFAULT_TICK_INTERVAL_MS));
        this.shutdownTimeoutMs = Math.max(0L, config.getLong(CFG_SHUTDOWN_TIMEOUT_MS, DEFAULT_SHUTDOWN_TIMEOUT_MS));
        this.defaultStageTimeoutMs = config.getLong(CFG_STAGE_TIMEOUT_MS, StageConfig.DEFAULT_TIMEOUT_MS);

        this.processorPool = Executors.newCachedThreadPool(new NamedDaemonThreadFactory("sg-processor"));
        this.executor = new StageGraphExecutor(processorPool, clock, metrics, this::admit, this::failFast);

        log.info("StreamEngine ready: tick={}ms processors={} metrics={}",
                tickIntervalMs, processors.size(), metrics.type());
    }

    // ---------------------------------------------------------------------
    // Pipelines
    // ---------------------------------------------------------------------

    public Pipeline createPipeline(String name, PipelineSettings settings) {
        return createPipeline(name, "", settings);
    }

    /**
     * Creates an IDLE pipeline with an empty graph.
     *
     * @param settings {@code null} uses the settings read from the engine configuration
     */
    public Pipeline createPipeline(String name, String description, PipelineSettings settings) {
        ensureOpen();
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Pipeline name must not be blank");

        final Pipeline pipeline = new Pipeline(
                UUID.randomUUID().toString(),
                name,
                description,
                (settings != null) ? settings : defaultSettings,
                clock.instant());
        pipeline.attach(new PipelineScheduler(pipeline, executor, tickIntervalMs));
        pipelines.put(pipeline.id(), pipeline);

        log.info("Pipeline created: '{}' id={} settings={}", name, pipeline.id(), pipeline.settings());
        return pipeline;
    }

    public Pipeline getPipeline(String pipelineId) {
        return require(pipelineId);
    }

    public Optional<Pipeline> findPipeline(String pipelineId) {
        if (pipelineId == null) return Optional.empty();
        return Optional.ofNullable(pipelines.get(pipelineId));
    }

    /** All pipelines in creation order. */
    public List<Pipeline> getPipelines() {
        final List<Pipeline> out = new ArrayList<>(pipelines.values());
        out.sort(Comparator.comparing(Pipeline::createdAt));
        return out;
    }

    /**
     * Stops the pipeline and discards its buffer and state.
     */
    public Pipeline removePipeline(String pipelineId) {
        final Pipeline pipeline = require(pipelineId);
        synchronized (pipeline) {
            if (pipeline.status() != PipelineStatus.COMPLETED) {
                pipeline.transition(PipelineStatus.COMPLETED, clock.instant());
            }
            pipeline.scheduler().cancel();
            pipelines.remove(pipelineId);
        }
        pipeline.scheduler().shutdown(shutdownTimeoutMs);
        pipeline.buffer().clear();
        pipeline.state().clear();
        publishRunningGauge();
        log.info("Pipeline removed: '{}' id={}", pipeline.name(), pipelineId);
        return pipeline;
    }

    // ---------------------------------------------------------------------
    // Graph
    // ---------------------------------------------------------------------

    /**
     * Adds a stage. Non-SOURCE stages are linked from the previously declared stage unless
     * the definition disables auto-chaining.
     *
     * @throws StageNotFoundException if a referenced stage does not exist
     * @throws com.intuitivedesigns.streamgraph.error.ProcessorNotFoundException for an unknown processor name
     * @throws com.intuitivedesigns.streamgraph.error.InvalidStageGraphException if the stage would close a cycle
     */
    public PipelineStage addStage(String pipelineId, StageDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        final Pipeline pipeline = require(pipelineId);

        synchronized (pipeline) {
            for (String next : definition.nextStageIds()) requireStage(pipeline, next);
            if (definition.errorHandlerStageId() != null) requireStage(pipeline, definition.errorHandlerStageId());

            final StageConfig declared = (definition.config() != null) ? definition.config() : StageConfig.builder().build();
            final StageConfig config = declared.withDefaults(
                    pipeline.settings().errorPolicy().maxRetries(), defaultStageTimeoutMs);

            final PipelineStage stage = new PipelineStage(
                    UUID.randomUUID().toString(),
                    definition.name(),
                    definition.type(),
                    processorNameOf(definition),
                    resolveProcessor(definition),
                    config);
            definition.nextStageIds().forEach(stage::addNext);
            if (definition.errorHandlerStageId() != null) stage.setErrorHandler(definition.errorHandlerStageId());

            final PipelineStage upstream = (definition.autoChain() && definition.type() != StageType.SOURCE)
                    ? pipeline.lastStage().orElse(null)
                    : null;

            final StageGraph graph = StageGraph.of(pipeline.stages()).node(stage.id());
            stage.nextStageIds().forEach(n -> graph.edge(stage.id(), n));
            stage.errorHandlerStageId().ifPresent(h -> graph.edge(stage.id(), h));
            if (upstream != null) graph.edge(upstream.id(), stage.id());
            graph.requireAcyclic(pipelineId);

            pipeline.addStage(stage);
            if (upstream != null) upstream.addNext(stage.id());
            pipeline.touch(clock.instant());

            log.info("Stage added to '{}': '{}' type={} processor={} id={}",
                    pipeline.name(), stage.name(), stage.type(), stage.processorName(), stage.id());
            return stage;
        }
    }

    /**
     * Adds a downstream link. Linking twice is a no-op.
     */
    public PipelineStage connect(String pipelineId, String fromStageId, String toStageId) {
        final Pipeline pipeline = require(pipelineId);
        synchronized (pipeline) {
            final PipelineStage from = requireStage(pipeline, fromStageId);
            requireStage(pipeline, toStageId);

            StageGraph.of(pipeline.stages()).edge(fromStageId, toStageId).requireAcyclic(pipelineId);

            from.addNext(toStageId);
            pipeline.touch(clock.instant());
            return from;
        }
    }

    /**
     * Sets the stage that receives items exhausting their retries at {@code stageId}.
     */
    public PipelineStage setErrorHandler(String pipelineId, String stageId, String handlerStageId) {
        final Pipeline pipeline = require(pipelineId);
        synchronized (pipeline) {
            final PipelineStage stage = requireStage(pipeline, stageId);
            requireStage(pipeline, handlerStageId);

            final StageGraph graph = StageGraph.of(pipeline.stages());
            graph.edge(stageId, handlerStageId).requireAcyclic(pipelineId);

            stage.setErrorHandler(handlerStageId);
            pipeline.touch(clock.instant());
            return stage;
        }
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Starts (or resumes) processing. Starting a running pipeline is a no-op.
     *
     * @throws PipelineStateException if the pipeline was stopped
     */
    public Pipeline start(String pipelineId) {
        ensureOpen();
        final Pipeline pipeline = require(pipelineId);
        synchronized (pipeline) {
            final PipelineStatus current = pipeline.status();
            if (current == PipelineStatus.RUNNING) return pipeline;
            if (!current.canStart()) {
                throw new PipelineStateException("Pipeline '" + pipeline.name() + "' is " + current + " and cannot be started");
            }
            pipeline.markStarted(clock.instant());
            pipeline.scheduler().start();
            log.info("Pipeline started: '{}' (from {})", pipeline.name(), current);
        }
        publishRunningGauge();
        return pipeline;
    }

    /**
     * Stops ticking; buffered items stay buffered. Pausing a paused pipeline is a no-op.
     *
     * @throws PipelineStateException unless the pipeline is RUNNING or PAUSED
     */
    public Pipeline pause(String pipelineId) {
        final Pipeline pipeline = require(pipelineId);
        synchronized (pipeline) {
            final PipelineStatus current = pipeline.status();
            if (current == PipelineStatus.PAUSED) return pipeline;
            if (current != PipelineStatus.RUNNING) {
                throw new PipelineStateException("Pipeline '" + pipeline.name() + "' is " + current + " and cannot be paused");
            }
            pipeline.scheduler().cancel();
            pipeline.transition(PipelineStatus.PAUSED, clock.instant());
            log.info("Pipeline paused: '{}' buffered={}", pipeline.name(), pipeline.bufferedItems());
        }
        publishRunningGauge();
        return pipeline;
    }

    /**
     * Moves the pipeline to COMPLETED after in-flight items finish. Buffered items are kept
     * but never processed.
     */
    public Pipeline stop(String pipelineId) {
        final Pipeline pipeline = require(pipelineId);
        synchronized (pipeline) {
            if (pipeline.status() == PipelineStatus.COMPLETED) return pipeline;
            pipeline.transition(PipelineStatus.COMPLETED, clock.instant());
            pipeline.scheduler().cancel();
        }
        // Drain outside the lock: a worker may need it to report a fail-fast failure
        pipeline.scheduler().shutdown(shutdownTimeoutMs);
        log.info("Pipeline stopped: '{}' buffered={}", pipeline.name(), pipeline.bufferedItems());
        publishRunningGauge();
        return pipeline;
    }

    // ---------------------------------------------------------------------
    // Data
    // ---------------------------------------------------------------------

    /**
     * Buffers a new item for the pipeline. Accepted in every lifecycle state.
     *
     * @throws CapacityExceededException if the buffer is full (after waiting, for BLOCK)
     */
    public StreamItem push(String pipelineId, Object payload) {
        final Pipeline pipeline = require(pipelineId);
        return admit(pipeline, payload, PUSH_LABEL, UUID.randomUUID().toString(), pipeline.settings().backpressure());
    }

    /** Seeds or replaces a pipeline state value; {@code null} removes it. */
    public void putState(String pipelineId, String key, Object value) {
        require(pipelineId).state().put(key, value);
    }

    public Object getState(String pipelineId, String key) {
        return require(pipelineId).state().get(key);
    }

    private StreamItem admit(Pipeline pipeline,
                             Object payload,
                             String sourceLabel,
                             String correlationId,
                             BackpressureStrategy strategy) {
        final StreamItem item = StreamItem.create(pipeline.id(), payload, sourceLabel, correlationId, clock.instant());
        try {
            pipeline.buffer().enqueue(item, strategy, pipeline.settings().blockTimeoutMs());
        } catch (CapacityExceededException e) {
            pipeline.metrics().recordBackpressure();
            metrics.increment(EngineMeters.ITEMS_REJECTED, EngineMeters.pipelineTags(pipeline));
            log.debug("Backpressure on pipeline '{}' ({}): {}", pipeline.name(), strategy, e.getMessage());
            throw e;
        }
        pipeline.metrics().recordInput();
        metrics.increment(EngineMeters.ITEMS_INPUT, EngineMeters.pipelineTags(pipeline));
        return item;
    }

    // ---------------------------------------------------------------------
    // Processors
    // ---------------------------------------------------------------------

    /**
     * Registers (or replaces) a named processor. Existing stages keep the processor they were
     * created with.
     */
    public void registerProcessor(String name, StageProcessor processor) {
        processors.register(name, processor);
    }

    public Set<String> processorNames() {
        return processors.names();
    }

    // ---------------------------------------------------------------------
    // Metrics
    // ---------------------------------------------------------------------

    public PipelineMetricsSnapshot getMetrics(String pipelineId) {
        return require(pipelineId).metricsSnapshot(clock.instant());
    }

    public StageMetricsSnapshot getStageMetrics(String pipelineId, String stageId) {
        final Pipeline pipeline = require(pipelineId);
        final PipelineStage stage = requireStage(pipeline, stageId);
        return stage.metrics().snapshot(stage.id(), stage.name(), pipeline.startedAt().orElse(null), clock.instant());
    }

    public EngineStats getStats() {
        final Instant now = clock.instant();
        int running = 0;
        long input = 0;
        long output = 0;
        long errors = 0;
        double throughputSum = 0.0;

        final List<Pipeline> all = new ArrayList<>(pipelines.values());
        for (Pipeline p : all) {
            final PipelineMetricsSnapshot m = p.metricsSnapshot(now);
            input += m.totalInput();
            output += m.totalOutput();
            errors += m.totalErrors();
            if (p.status() == PipelineStatus.RUNNING) {
                running++;
                throughputSum += m.throughput();
            }
        }
        return new EngineStats(
                all.size(),
                running,
                input,
                output,
                errors,
                (running == 0) ? 0.0 : throughputSum / running,
                processors.size());
    }

    // ---------------------------------------------------------------------
    // Shutdown
    // ---------------------------------------------------------------------

    /**
     * Stops every pipeline and releases the processor pool. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        log.info("StreamEngine shutting down ({} pipelines)...", pipelines.size());
        for (Pipeline p : new ArrayList<>(pipelines.values())) {
            try {
                stop(p.id());
            } catch (RuntimeException e) {
                log.warn("Failed to stop pipeline '{}'", p.name(), e);
            }
        }

        processorPool.shutdown();
        try {
            if (!processorPool.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                processorPool.shutdownNow();
            }
        } catch (InterruptedException ie) {
            processorPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("StreamEngine stopped.");
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void failFast(Pipeline pipeline, PipelineStage stage, Exception cause) {
        synchronized (pipeline) {
            if (pipeline.status() != PipelineStatus.RUNNING) return;
            pipeline.scheduler().cancel();
            pipeline.transition(PipelineStatus.ERROR, clock.instant());
        }
        publishRunningGauge();
        log.error("Pipeline '{}' halted: stage '{}' failed and fail-fast is enabled",
                pipeline.name(), stage.name(), cause);
    }

    private StageProcessor resolveProcessor(StageDefinition definition) {
        if (definition.processor() != null) return definition.processor();
        if (definition.processorName() != null) return processors.require(definition.processorName());
        return PassThroughProcessor.INSTANCE;
    }

    private static String processorNameOf(StageDefinition definition) {
        if (definition.processor() != null) return definition.processorName();
        if (definition.processorName() != null) return definition.processorName();
        return PassThroughProcessor.NAME;
    }

    private Pipeline require(String pipelineId) {
        final Pipeline pipeline = (pipelineId == null) ? null : pipelines.get(pipelineId);
        if (pipeline == null) throw new PipelineNotFoundException(pipelineId);
        return pipeline;
    }

    private static PipelineStage requireStage(Pipeline pipeline, String stageId) {
        return pipeline.stage(stageId).orElseThrow(() -> new StageNotFoundException(pipeline.id(), stageId));
    }

    private void publishRunningGauge() {
        long running = pipelines.values().stream().filter(p -> p.status() == PipelineStatus.RUNNING).count();
        metrics.gauge(EngineMeters.PIPELINES_RUNNING, running);
    }

    private void ensureOpen() {
        if (closed.get()) throw new IllegalStateException("StreamEngine is closed");
    }
}
