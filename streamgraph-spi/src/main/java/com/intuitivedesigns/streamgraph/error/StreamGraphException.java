/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.error;

/**
 * Base type for every error the engine reports to its callers.
 */
public class StreamGraphException extends RuntimeException {

    public StreamGraphException(String message) {
        super(message);
    }

    public StreamGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
