/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.error;

public class StageNotFoundException extends StreamGraphException {

    public StageNotFoundException(String pipelineId, String stageId) {
        super("Stage '" + stageId + "' not found in pipeline '" + pipelineId + "'");
    }
}
