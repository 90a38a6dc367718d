/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.core;

/**
 * Pipeline lifecycle: IDLE -> RUNNING -> {PAUSED, ERROR, COMPLETED}; PAUSED -> RUNNING.
 * COMPLETED is terminal.
 */
public enum PipelineStatus {
    IDLE,
    RUNNING,
    PAUSED,
    ERROR,
    COMPLETED;

    public boolean canStart() {
        return this != COMPLETED;
    }
}
