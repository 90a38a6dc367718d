/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.engine;

import com.intuitivedesigns.streamgraph.core.StageConfig;
import com.intuitivedesigns.streamgraph.core.StageProcessor;
import com.intuitivedesigns.streamgraph.core.StageType;
import com.intuitivedesigns.streamgraph.metrics.StageMetrics;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;

/**
 * One node of a pipeline graph. Wiring is mutated only by {@link StreamEngine}.
 */
public final class PipelineStage {

    private final String id;
    private final String name;
    private final StageType type;
    private final String processorName;
    private final StageProcessor processor;
    private final StageConfig config;
    private final List<String> nextStageIds = new CopyOnWriteArrayList<>();
    private volatile String errorHandlerStageId;

    private final StageMetrics metrics = new StageMetrics();

    // Bounds concurrent invocations of this stage's processor
    private final Semaphore permits;

    PipelineStage(String id,
                  String name,
                  StageType type,
                  String processorName,
                  StageProcessor processor,
                  StageConfig config) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.processorName = processorName;
        this.processor = Objects.requireNonNull(processor, "processor");
        this.config = Objects.requireNonNull(config, "config");
        this.permits = new Semaphore(config.parallelism(), true);
    }

    public String id() { return id; }
    public String name() { return name; }
    public StageType type() { return type; }
    public StageConfig config() { return config; }
    public StageMetrics metrics() { return metrics; }

    /** Registry name, or the processor class name for inline processors. */
    public String processorName() {
        return (processorName != null) ? processorName : processor.getClass().getSimpleName();
    }

    public List<String> nextStageIds() {
        return Collections.unmodifiableList(nextStageIds);
    }

    public Optional<String> errorHandlerStageId() {
        return Optional.ofNullable(errorHandlerStageId);
    }

    StageProcessor processor() {
        return processor;
    }

    void addNext(String stageId) {
        if (!nextStageIds.contains(stageId)) nextStageIds.add(stageId);
    }

    void setErrorHandler(String stageId) {
        this.errorHandlerStageId = stageId;
    }

    void acquire() throws InterruptedException {
        permits.acquire();
    }

    void release() {
        permits.release();
    }

    int availablePermits() {
        return permits.availablePermits();
    }

    @Override
    public String toString() {
        return "PipelineStage{id='" + id + "', name='" + name + "', type=" + type + ", next=" + nextStageIds + '}';
    }
}
