/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.core;

import com.intuitivedesigns.streamgraph.config.EngineConfig;

import java.util.Objects;

/**
 * Immutable per-pipeline tuning.
 *
 * @param parallelism    max items drained per scheduler tick (and worker threads)
 * @param bufferSize     hard capacity of the pipeline buffer
 * @param backpressure   behavior of {@code push} when the buffer is full
 * @param blockTimeoutMs wait budget for {@link BackpressureStrategy#BLOCK}
 * @param errorPolicy    retry / dead-letter / fail-fast policy
 */
public record PipelineSettings(
        int parallelism,
        int bufferSize,
        BackpressureStrategy backpressure,
        long blockTimeoutMs,
        ErrorPolicy errorPolicy
) {

    // Config keys
    public static final String CFG_PARALLELISM = "pipeline.parallelism";
    public static final String CFG_BUFFER_SIZE = "pipeline.buffer.size";
    public static final String CFG_BACKPRESSURE = "pipeline.backpressure";
    public static final String CFG_BLOCK_TIMEOUT_MS = "pipeline.block.timeout.ms";
    public static final String CFG_MAX_RETRIES = "pipeline.error.max.retries";
    public static final String CFG_DEAD_LETTER = "pipeline.error.dead.letter.enabled";
    public static final String CFG_FAIL_FAST = "pipeline.error.fail.fast";

    // Defaults
    public static final int DEFAULT_PARALLELISM = 4;
    public static final int DEFAULT_BUFFER_SIZE = 1000;
    public static final BackpressureStrategy DEFAULT_BACKPRESSURE = BackpressureStrategy.BUFFER;
    public static final long DEFAULT_BLOCK_TIMEOUT_MS = 100L;

    public PipelineSettings {
        if (parallelism <= 0) throw new IllegalArgumentException("parallelism must be > 0");
        if (bufferSize <= 0) throw new IllegalArgumentException("bufferSize must be > 0");
        if (blockTimeoutMs < 0) throw new IllegalArgumentException("blockTimeoutMs must be >= 0");
        backpressure = (backpressure == null) ? DEFAULT_BACKPRESSURE : backpressure;
        errorPolicy = (errorPolicy == null) ? ErrorPolicy.defaults() : errorPolicy;
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(DEFAULT_PARALLELISM, DEFAULT_BUFFER_SIZE, DEFAULT_BACKPRESSURE,
                DEFAULT_BLOCK_TIMEOUT_MS, ErrorPolicy.defaults());
    }

    public static PipelineSettings from(EngineConfig config) {
        Objects.requireNonNull(config, "config");

        final ErrorPolicy policy = new ErrorPolicy(
                Math.max(0, config.getInt(CFG_MAX_RETRIES, ErrorPolicy.DEFAULT_MAX_RETRIES)),
                config.getBoolean(CFG_DEAD_LETTER, true),
                config.getBoolean(CFG_FAIL_FAST, false)
        );

        return new PipelineSettings(
                Math.max(1, config.getInt(CFG_PARALLELISM, DEFAULT_PARALLELISM)),
                Math.max(1, config.getInt(CFG_BUFFER_SIZE, DEFAULT_BUFFER_SIZE)),
                BackpressureStrategy.parse(config.getString(CFG_BACKPRESSURE, null), DEFAULT_BACKPRESSURE),
                Math.max(0L, config.getLong(CFG_BLOCK_TIMEOUT_MS, DEFAULT_BLOCK_TIMEOUT_MS)),
                policy
        );
    }

    public PipelineSettings withParallelism(int value) {
        return new PipelineSettings(value, bufferSize, backpressure, blockTimeoutMs, errorPolicy);
    }

    public PipelineSettings withBufferSize(int value) {
        return new PipelineSettings(parallelism, value, backpressure, blockTimeoutMs, errorPolicy);
    }

    public PipelineSettings withBackpressure(BackpressureStrategy value) {
        return new PipelineSettings(parallelism, bufferSize, value, blockTimeoutMs, errorPolicy);
    }

    public PipelineSettings withBlockTimeoutMs(long value) {
        return new PipelineSettings(parallelism, bufferSize, backpressure, value, errorPolicy);
    }

    public PipelineSettings withErrorPolicy(ErrorPolicy value) {
        return new PipelineSettings(parallelism, bufferSize, backpressure, blockTimeoutMs, value);
    }
}
