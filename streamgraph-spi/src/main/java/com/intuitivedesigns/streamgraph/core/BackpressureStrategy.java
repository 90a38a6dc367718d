/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.core;

import java.util.Locale;

/**
 * What happens when a pipeline buffer is full.
 * The buffer never grows past its capacity; strategies only differ in how the rejection is delivered.
 */
public enum BackpressureStrategy {
    /** Reject immediately. */
    DROP,
    /** Reject once the hard capacity is reached. */
    BUFFER,
    /** Wait up to the pipeline block timeout for room, then reject. */
    BLOCK,
    /** Reject immediately; sampling under load is not implemented. */
    SAMPLE;

    public static BackpressureStrategy parse(String raw, BackpressureStrategy fallback) {
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
