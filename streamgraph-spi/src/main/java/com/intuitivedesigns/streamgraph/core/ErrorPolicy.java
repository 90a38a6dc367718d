/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.core;

/**
 * Pipeline-wide failure handling.
 *
 * @param maxRetries        retry limit for stages added without an explicit config
 * @param deadLetterEnabled route exhausted items to the stage error handler, if any
 * @param failFast          move the pipeline to ERROR on the first processor failure
 */
public record ErrorPolicy(int maxRetries, boolean deadLetterEnabled, boolean failFast) {

    public static final int DEFAULT_MAX_RETRIES = 3;

    public ErrorPolicy {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
    }

    public static ErrorPolicy defaults() {
        return new ErrorPolicy(DEFAULT_MAX_RETRIES, true, false);
    }

    public ErrorPolicy withMaxRetries(int value) {
        return new ErrorPolicy(value, deadLetterEnabled, failFast);
    }

    public ErrorPolicy withDeadLetterEnabled(boolean value) {
        return new ErrorPolicy(maxRetries, value, failFast);
    }

    public ErrorPolicy withFailFast(boolean value) {
        return new ErrorPolicy(maxRetries, deadLetterEnabled, value);
    }
}
