/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.core;

/**
 * The closed set of built-in processor behaviors, plus {@link #CUSTOM} for plugins.
 */
public enum ProcessorKind {
    PASS_THROUGH,
    MAP,
    FLAT_MAP,
    FILTER,
    AGGREGATE,
    WINDOW,
    DEDUPLICATE,
    ENRICH,
    SPLIT,
    MERGE,
    CUSTOM
}
