/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.core;

public enum StageType {
    SOURCE,
    TRANSFORM,
    FILTER,
    AGGREGATE,
    JOIN,
    WINDOW,
    SINK
}
