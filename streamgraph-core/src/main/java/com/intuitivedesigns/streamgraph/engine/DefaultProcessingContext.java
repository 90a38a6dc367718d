/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.engine;

import com.intuitivedesigns.streamgraph.core.ProcessingContext;
import com.intuitivedesigns.streamgraph.core.StreamItem;
import com.intuitivedesigns.streamgraph.state.StateStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Per-invocation context handed to a processor. Stage params are fixed; state is the live
 * pipeline {@link StateStore}.
 */
public final class DefaultProcessingContext implements ProcessingContext {

    private final String pipelineId;
    private final String stageId;
    private final Map<String, Object> params;
    private final StateStore state;
    private final Clock clock;
    private final Instant timestamp;
    private final Function<Object, StreamItem> emitter;

    /**
     * @param emitter buffer entry point for {@link #emit}; {@code null} disables emission
     */
    public DefaultProcessingContext(String pipelineId,
                                    String stageId,
                                    Map<String, Object> params,
                                    StateStore state,
                                    Clock clock,
                                    Function<Object, StreamItem> emitter) {
        this.pipelineId = Objects.requireNonNull(pipelineId, "pipelineId");
        this.stageId = Objects.requireNonNull(stageId, "stageId");
        this.params = (params == null) ? Map.of() : params;
        this.state = Objects.requireNonNull(state, "state");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timestamp = clock.instant();
        this.emitter = emitter;
    }

    @Override public String pipelineId() { return pipelineId; }
    @Override public String stageId() { return stageId; }
    @Override public Instant timestamp() { return timestamp; }
    @Override public Instant now() { return clock.instant(); }

    @Override
    public <T> T get(String key, Class<T> type) {
        Objects.requireNonNull(type, "type");
        Object v = state.get(key);
        if (v == null) v = params.get(key);
        if (v == null) return null;
        if (!type.isInstance(v)) {
            throw new IllegalArgumentException("Context value '" + key + "' is " + v.getClass().getName()
                    + ", expected " + type.getName());
        }
        return type.cast(v);
    }

    @Override
    public Map<String, Object> view() {
        final Map<String, Object> merged = new LinkedHashMap<>(params);
        merged.putAll(state.snapshot());
        return Collections.unmodifiableMap(merged);
    }

    @Override
    public Object getState(String key) {
        return state.get(key);
    }

    @Override
    public void setState(String key, Object value) {
        state.put(key, value);
    }

    @Override
    public Object updateState(String key, UnaryOperator<Object> updater) {
        return state.update(key, updater);
    }

    @Override
    public Object computeStateIfAbsent(String key, Supplier<?> factory) {
        return state.computeIfAbsent(key, factory);
    }

    @Override
    public StreamItem emit(Object payload) {
        if (emitter == null) {
            throw new UnsupportedOperationException("emit is not available for stage " + stageId);
        }
        return emitter.apply(payload);
    }
}
