/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable per-stage tuning plus processor parameters.
 *
 * <p>{@code params} may hold functions (map/filter callbacks, aggregation lists) and is
 * therefore not copied deeply.</p>
 *
 * <p>Retries and timeout may be left unset; the engine fills them from the pipeline's
 * error policy and its configured stage timeout via {@link #withDefaults(int, long)}.</p>
 */
public final class StageConfig {

    public static final int DEFAULT_PARALLELISM = 1;
    public static final int DEFAULT_BATCH_SIZE = 1;
    public static final long DEFAULT_TIMEOUT_MS = 30_000L;

    private final int parallelism;
    private final int batchSize;
    private final Long timeoutMs;
    private final Integer retries;
    private final BackpressureStrategy backpressure;
    private final Map<String, Object> params;

    private StageConfig(Builder b) {
        if (b.parallelism <= 0) throw new IllegalArgumentException("parallelism must be > 0");
        if (b.batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
        if (b.timeoutMs != null && b.timeoutMs <= 0) throw new IllegalArgumentException("timeoutMs must be > 0");
        if (b.retries != null && b.retries < 0) throw new IllegalArgumentException("retries must be >= 0");
        this.parallelism = b.parallelism;
        this.batchSize = b.batchSize;
        this.timeoutMs = b.timeoutMs;
        this.retries = b.retries;
        this.backpressure = (b.backpressure == null) ? BackpressureStrategy.BUFFER : b.backpressure;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(b.params));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy whose unset retries and timeout take the given values.
     * Explicitly configured values are kept.
     */
    public StageConfig withDefaults(int defaultRetries, long defaultTimeoutMs) {
        if (retries != null && timeoutMs != null) return this;
        final Builder b = toBuilder();
        if (retries == null) b.retries(defaultRetries);
        if (timeoutMs == null) b.timeoutMs(defaultTimeoutMs);
        return b.build();
    }

    public int parallelism() { return parallelism; }
    public int batchSize() { return batchSize; }
    public long timeoutMs() { return (timeoutMs != null) ? timeoutMs : DEFAULT_TIMEOUT_MS; }
    public int retries() { return (retries != null) ? retries : ErrorPolicy.DEFAULT_MAX_RETRIES; }

    public boolean hasTimeout() { return timeoutMs != null; }
    public boolean hasRetries() { return retries != null; }
    public BackpressureStrategy backpressure() { return backpressure; }
    public Map<String, Object> params() { return params; }

    public Builder toBuilder() {
        Builder b = new Builder()
                .parallelism(parallelism)
                .batchSize(batchSize)
                .backpressure(backpressure);
        b.timeoutMs = timeoutMs;
        b.retries = retries;
        b.params.putAll(params);
        return b;
    }

    @Override
    public String toString() {
        return "StageConfig{" +
                "parallelism=" + parallelism +
                ", batchSize=" + batchSize +
                ", timeoutMs=" + timeoutMs +
                ", retries=" + retries +
                ", backpressure=" + backpressure +
                ", params=" + params.keySet() +
                '}';
    }

    public static final class Builder {
        private int parallelism = DEFAULT_PARALLELISM;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private Long timeoutMs;
        private Integer retries;
        private BackpressureStrategy backpressure = BackpressureStrategy.BUFFER;
        private final Map<String, Object> params = new LinkedHashMap<>();

        private Builder() {}

        public Builder parallelism(int v) { this.parallelism = v; return this; }
        public Builder batchSize(int v) { this.batchSize = v; return this; }
        public Builder timeoutMs(long v) { this.timeoutMs = v; return this; }
        public Builder retries(int v) { this.retries = v; return this; }
        public Builder backpressure(BackpressureStrategy v) { this.backpressure = v; return this; }

        public Builder param(String key, Object value) {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
            this.params.put(key, value);
            return this;
        }

        public Builder params(Map<String, ?> values) {
            if (values != null) values.forEach(this::param);
            return this;
        }

        public StageConfig build() {
            return new StageConfig(this);
        }
    }
}
