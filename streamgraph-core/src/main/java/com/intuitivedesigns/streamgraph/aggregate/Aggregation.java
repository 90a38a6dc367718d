/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.aggregate;

import java.util.Objects;

/**
 * One running aggregate: {@code operation(field)} reported as {@code alias}.
 *
 * @param field dotted payload path; ignored by COUNT
 */
public record Aggregation(String field, AggregationOperation operation, String alias) {

    public Aggregation {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(alias, "alias");
        if (alias.isBlank()) throw new IllegalArgumentException("alias must not be blank");
    }

    public static Aggregation count(String alias) { return new Aggregation(null, AggregationOperation.COUNT, alias); }
    public static Aggregation sum(String field, String alias) { return new Aggregation(field, AggregationOperation.SUM, alias); }
    public static Aggregation avg(String field, String alias) { return new Aggregation(field, AggregationOperation.AVG, alias); }
    public static Aggregation min(String field, String alias) { return new Aggregation(field, AggregationOperation.MIN, alias); }
    public static Aggregation max(String field, String alias) { return new Aggregation(field, AggregationOperation.MAX, alias); }
    public static Aggregation first(String field, String alias) { return new Aggregation(field, AggregationOperation.FIRST, alias); }
    public static Aggregation last(String field, String alias) { return new Aggregation(field, AggregationOperation.LAST, alias); }
    public static Aggregation collect(String field, String alias) { return new Aggregation(field, AggregationOperation.COLLECT, alias); }
}
