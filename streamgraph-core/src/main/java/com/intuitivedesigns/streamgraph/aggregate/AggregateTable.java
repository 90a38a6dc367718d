/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.aggregate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * All groups of one aggregate stage, stored in the pipeline state store.
 */
public final class AggregateTable {

    // Raw group values; a missing group field shares one group
    private static final Object NO_KEY = new Object();

    private final Map<Object, GroupAccumulator> groups = new HashMap<>();

    /**
     * Folds one payload into its group and returns the group's updated values.
     */
    public synchronized Map<String, Object> accumulate(Object groupKey, List<Aggregation> aggregations, Object payload) {
        final GroupAccumulator group = groups.computeIfAbsent(keyOf(groupKey), k -> new GroupAccumulator(groupKey));
        group.accept(aggregations, payload);
        return group.snapshot();
    }

    public synchronized Map<String, Object> group(Object groupKey) {
        final GroupAccumulator group = groups.get(keyOf(groupKey));
        return (group == null) ? Map.of() : group.snapshot();
    }

    public synchronized int groupCount() {
        return groups.size();
    }

    private static Object keyOf(Object groupKey) {
        return (groupKey == null) ? NO_KEY : groupKey;
    }
}
