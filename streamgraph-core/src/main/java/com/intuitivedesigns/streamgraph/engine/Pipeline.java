/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.engine;

import com.intuitivedesigns.streamgraph.buffer.PipelineBuffer;
import com.intuitivedesigns.streamgraph.core.PipelineSettings;
import com.intuitivedesigns.streamgraph.core.PipelineStatus;
import com.intuitivedesigns.streamgraph.core.StageType;
import com.intuitivedesigns.streamgraph.metrics.PipelineMetrics;
import com.intuitivedesigns.streamgraph.metrics.PipelineMetricsSnapshot;
import com.intuitivedesigns.streamgraph.metrics.StageMetricsSnapshot;
import com.intuitivedesigns.streamgraph.state.StateStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A named stage graph with its own buffer, state and metrics.
 *
 * <p>Read accessors are public; lifecycle and wiring changes go through {@link StreamEngine}.</p>
 */
public final class Pipeline {

    private final String id;
    private final String name;
    private final String description;
    private final PipelineSettings settings;
    private final Instant createdAt;

    private volatile PipelineStatus status = PipelineStatus.IDLE;
    private volatile Instant updatedAt;
    private volatile Instant startedAt;

    // Declaration order
    private final List<PipelineStage> stages = new CopyOnWriteArrayList<>();
    private final Map<String, PipelineStage> stagesById = new ConcurrentHashMap<>();

    private final PipelineBuffer buffer;
    private final StateStore state = new StateStore();
    private final PipelineMetrics metrics = new PipelineMetrics();

    private PipelineScheduler scheduler;

    Pipeline(String id, String name, String description, PipelineSettings settings, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.description = (description == null) ? "" : description;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = createdAt;
        this.buffer = new PipelineBuffer(id, settings.bufferSize());
    }

    public String id() { return id; }
    public String name() { return name; }
    public String description() { return description; }
    public PipelineSettings settings() { return settings; }
    public PipelineStatus status() { return status; }
    public Instant createdAt() { return createdAt; }
    public Instant updatedAt() { return updatedAt; }
    public Optional<Instant> startedAt() { return Optional.ofNullable(startedAt); }
    public int bufferedItems() { return buffer.size(); }

    public List<PipelineStage> stages() {
        return Collections.unmodifiableList(stages);
    }

    public Optional<PipelineStage> stage(String stageId) {
        if (stageId == null) return Optional.empty();
        return Optional.ofNullable(stagesById.get(stageId));
    }

    /**
     * Entry stages for fresh items: all SOURCE stages, or the first declared stage if none.
     */
    public List<PipelineStage> entryStages() {
        final List<PipelineStage> sources = new ArrayList<>();
        for (PipelineStage s : stages) {
            if (s.type() == StageType.SOURCE) sources.add(s);
        }
        if (!sources.isEmpty()) return sources;
        return stages.isEmpty() ? List.of() : List.of(stages.get(0));
    }

    PipelineMetricsSnapshot metricsSnapshot(Instant now) {
        final Map<String, StageMetricsSnapshot> perStage = new LinkedHashMap<>();
        for (PipelineStage s : stages) {
            perStage.put(s.id(), s.metrics().snapshot(s.id(), s.name(), startedAt, now));
        }
        return metrics.snapshot(id, buffer.size(), startedAt, now, Collections.unmodifiableMap(perStage));
    }

    PipelineBuffer buffer() { return buffer; }
    StateStore state() { return state; }
    PipelineMetrics metrics() { return metrics; }
    PipelineScheduler scheduler() { return scheduler; }

    void attach(PipelineScheduler value) {
        this.scheduler = value;
    }

    void addStage(PipelineStage stage) {
        stagesById.put(stage.id(), stage);
        stages.add(stage);
    }

    Optional<PipelineStage> lastStage() {
        return stages.isEmpty() ? Optional.empty() : Optional.of(stages.get(stages.size() - 1));
    }

    void transition(PipelineStatus next, Instant now) {
        this.status = next;
        this.updatedAt = now;
    }

    void markStarted(Instant now) {
        this.startedAt = now;
        transition(PipelineStatus.RUNNING, now);
    }

    void touch(Instant now) {
        this.updatedAt = now;
    }

    @Override
    public String toString() {
        return "Pipeline{id='" + id + "', name='" + name + "', status=" + status + ", stages=" + stages.size() + '}';
    }
}
