/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.processors;

/**
 * Parameter keys read by the built-in processors, from stage params or pipeline state.
 */
public final class ProcessorParams {

    private ProcessorParams() {}

    /** {@code Function<Object, Object>} */
    public static final String MAP_FUNCTION = "mapFunction";

    /** {@code Function<Object, ? extends List<?>>} */
    public static final String FLAT_MAP_FUNCTION = "flatMapFunction";

    /** {@code Predicate<Object>} */
    public static final String FILTER_FUNCTION = "filterFunction";

    /** {@code List<Aggregation>} */
    public static final String AGGREGATIONS = "aggregations";

    /** Dotted field path of the group key; {@code "all"} groups when absent. */
    public static final String GROUP_KEY = "groupKey";

    /** {@code WindowSpec} */
    public static final String WINDOW_CONFIG = "windowConfig";

    /** Dotted field path of the dedupe key; defaults to {@code "id"}. */
    public static final String KEY_FIELD = "keyField";

    /** Dedupe time-to-live in milliseconds ({@code Number}); defaults to 60000. */
    public static final String WINDOW_MS = "windowMs";

    /** {@code Function<Object, ? extends CompletionStage<? extends Map<String, ?>>>} */
    public static final String ENRICH_FUNCTION = "enrichFunction";

    /** {@code Function<Object, String>} */
    public static final String CONDITION = "condition";
}
