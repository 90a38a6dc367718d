/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.error;

/**
 * A processor exceeded its stage timeout. Handled exactly like a processor exception.
 */
public class ProcessorTimeoutException extends StreamGraphException {

    public ProcessorTimeoutException(String stageName, long timeoutMs) {
        super("Stage '" + stageName + "' timed out after " + timeoutMs + "ms");
    }
}
