/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.error;

/**
 * A push was rejected because the pipeline buffer is at capacity.
 * Reported synchronously; the engine never retries it.
 */
public class CapacityExceededException extends StreamGraphException {

    private final String pipelineId;
    private final int capacity;

    public CapacityExceededException(String pipelineId, int capacity) {
        super("Buffer full for pipeline '" + pipelineId + "' (capacity=" + capacity + ") - item dropped");
        this.pipelineId = pipelineId;
        this.capacity = capacity;
    }

    public String pipelineId() {
        return pipelineId;
    }

    public int capacity() {
        return capacity;
    }
}
