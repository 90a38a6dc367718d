/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.error;

/**
 * A wiring change would make the stage graph cyclic.
 */
public class InvalidStageGraphException extends StreamGraphException {

    public InvalidStageGraphException(String message) {
        super(message);
    }
}
