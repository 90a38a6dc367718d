/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.metrics;

/**
 * Engine-wide totals.
 *
 * @param avgThroughput mean throughput of the running pipelines; 0 when none runs
 */
public record EngineStats(
        int totalPipelines,
        int runningPipelines,
        long totalInput,
        long totalOutput,
        long totalErrors,
        double avgThroughput,
        int registeredProcessors
) {}
