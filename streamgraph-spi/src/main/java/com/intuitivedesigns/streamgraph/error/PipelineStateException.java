/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.error;

/**
 * A lifecycle call is not valid from the pipeline's current status.
 */
public class PipelineStateException extends StreamGraphException {

    public PipelineStateException(String message) {
        super(message);
    }
}
