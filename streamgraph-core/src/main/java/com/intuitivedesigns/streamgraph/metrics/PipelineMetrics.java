/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.metrics;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Live pipeline-wide counters, updated synchronously on the push and processing paths.
 */
public final class PipelineMetrics {

    private final LongAdder totalInput = new LongAdder();
    private final LongAdder totalOutput = new LongAdder();
    private final LongAdder totalErrors = new LongAdder();
    private final LongAdder backpressureEvents = new LongAdder();
    private final LongAdder retried = new LongAdder();
    private final LongAdder deadLettered = new LongAdder();
    private final LongAdder dropped = new LongAdder();

    // Guarded by this
    private long latencySamples;
    private double avgLatencyMs;

    public void recordInput() { totalInput.increment(); }
    public void recordOutput(int count) { if (count > 0) totalOutput.add(count); }
    public void recordError() { totalErrors.increment(); }
    public void recordBackpressure() { backpressureEvents.increment(); }
    public void recordRetry() { retried.increment(); }
    public void recordDeadLetter() { deadLettered.increment(); }
    public void recordDropped() { dropped.increment(); }

    public synchronized void recordItemLatency(double latencyMs) {
        latencySamples++;
        avgLatencyMs += (latencyMs - avgLatencyMs) / latencySamples;
    }

    public long totalInput() { return totalInput.sum(); }
    public long totalOutput() { return totalOutput.sum(); }
    public long totalErrors() { return totalErrors.sum(); }
    public long backpressureEvents() { return backpressureEvents.sum(); }

    public synchronized double avgLatencyMs() {
        return avgLatencyMs;
    }

    public PipelineMetricsSnapshot snapshot(String pipelineId,
                                            int bufferedItems,
                                            Instant startedAt,
                                            Instant now,
                                            Map<String, StageMetricsSnapshot> stages) {
        final long out = totalOutput();
        return new PipelineMetricsSnapshot(
                pipelineId,
                totalInput(),
                out,
                totalErrors(),
                avgLatencyMs(),
                Rates.perSecond(out, startedAt, now),
                backpressureEvents(),
                retried.sum(),
                deadLettered.sum(),
                dropped.sum(),
                bufferedItems,
                Rates.uptimeMs(startedAt, now),
                stages
        );
    }
}
