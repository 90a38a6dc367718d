/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.error;

public class PipelineNotFoundException extends StreamGraphException {

    public PipelineNotFoundException(String pipelineId) {
        super("Pipeline '" + pipelineId + "' not found");
    }
}
