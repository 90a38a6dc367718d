/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.metrics;

import java.time.Instant;
import java.util.concurrent.atomic.LongAdder;

/**
 * Live counters of one stage, updated on the processing path.
 */
public final class StageMetrics {

    private final LongAdder inputCount = new LongAdder();
    private final LongAdder outputCount = new LongAdder();
    private final LongAdder errorCount = new LongAdder();

    // Guarded by this
    private long latencySamples;
    private double avgLatencyMs;

    private volatile Instant lastProcessed;

    public void recordInput() {
        inputCount.increment();
    }

    public void recordOutput(int count) {
        if (count > 0) outputCount.add(count);
    }

    public void recordError() {
        errorCount.increment();
    }

    /**
     * Running mean; no exponential decay.
     */
    public synchronized void recordLatency(double latencyMs, Instant at) {
        latencySamples++;
        avgLatencyMs += (latencyMs - avgLatencyMs) / latencySamples;
        lastProcessed = at;
    }

    public long inputCount() {
        return inputCount.sum();
    }

    public long outputCount() {
        return outputCount.sum();
    }

    public long errorCount() {
        return errorCount.sum();
    }

    public synchronized double avgLatencyMs() {
        return avgLatencyMs;
    }

    public StageMetricsSnapshot snapshot(String stageId, String stageName, Instant startedAt, Instant now) {
        final long out = outputCount();
        return new StageMetricsSnapshot(
                stageId,
                stageName,
                inputCount(),
                out,
                errorCount(),
                avgLatencyMs(),
                Rates.perSecond(out, startedAt, now),
                lastProcessed
        );
    }
}
