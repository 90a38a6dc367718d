/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.metrics;

import java.util.Map;

/**
 * Point-in-time view of one pipeline.
 *
 * @param totalInput         items accepted by push or emit (rejections excluded)
 * @param totalOutput        items produced by all stages
 * @param totalErrors        failed processor invocations, retries included
 * @param avgLatencyMs       running mean of whole-item processing time
 * @param throughput         totalOutput per second since start
 * @param backpressureEvents pushes, emits and requeues rejected by a full buffer
 * @param retried            items requeued for another attempt
 * @param deadLettered       exhausted items routed to an error-handler stage
 * @param dropped            exhausted items discarded
 * @param bufferedItems      items waiting in the buffer
 * @param uptimeMs           time since the pipeline was last started
 * @param stages             per-stage views, in declaration order
 */
public record PipelineMetricsSnapshot(
        String pipelineId,
        long totalInput,
        long totalOutput,
        long totalErrors,
        double avgLatencyMs,
        double throughput,
        long backpressureEvents,
        long retried,
        long deadLettered,
        long dropped,
        int bufferedItems,
        long uptimeMs,
        Map<String, StageMetricsSnapshot> stages
) {

    public PipelineMetricsSnapshot {
        stages = (stages == null) ? Map.of() : stages;
    }
}
