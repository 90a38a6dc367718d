/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.metrics;

import java.time.Instant;

/**
 * Point-in-time view of one stage.
 *
 * @param throughput outputs per second since the pipeline started
 * @param lastProcessed completion time of the latest invocation, or {@code null}
 */
public record StageMetricsSnapshot(
        String stageId,
        String stageName,
        long inputCount,
        long outputCount,
        long errorCount,
        double avgLatencyMs,
        double throughput,
        Instant lastProcessed
) {}
