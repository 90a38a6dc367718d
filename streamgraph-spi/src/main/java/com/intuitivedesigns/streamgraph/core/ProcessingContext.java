/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.core;

import java.time.Instant;
import java.util.Map;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * The view a processor gets of its stage and pipeline for one invocation.
 *
 * <p>Lookups through {@link #get(String, Class)} see the stage parameters merged with the
 * live pipeline state; pipeline state wins when both define a key.</p>
 *
 * <p><b>Thread-safety Contract:</b> state accessors are safe for concurrent use. Compound
 * read-modify-write must go through {@link #updateState} or {@link #computeStateIfAbsent}.</p>
 */
public interface ProcessingContext {

    String pipelineId();

    String stageId();

    /** Invocation time from the engine clock. */
    Instant timestamp();

    /** Current time from the engine clock. */
    Instant now();

    /**
     * Typed lookup over stage params + pipeline state.
     *
     * @return the value, or {@code null} if absent
     * @throws IllegalArgumentException if the value has an incompatible type
     */
    <T> T get(String key, Class<T> type);

    default <T> T getOrDefault(String key, Class<T> type, T defaultValue) {
        T v = get(key, type);
        return (v != null) ? v : defaultValue;
    }

    /** Immutable snapshot of the merged view. */
    Map<String, Object> view();

    Object getState(String key);

    void setState(String key, Object value);

    /** Atomically replaces a state value; a {@code null} result removes the key. */
    Object updateState(String key, UnaryOperator<Object> updater);

    Object computeStateIfAbsent(String key, Supplier<?> factory);

    /**
     * Re-enters the pipeline buffer with a new payload.
     *
     * @return the buffered item, or {@code null} if the stage drops on backpressure
     * @throws com.intuitivedesigns.streamgraph.error.CapacityExceededException if the buffer is full
     */
    StreamItem emit(Object payload);
}
