/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.aggregate;

import com.intuitivedesigns.streamgraph.processors.PayloadFields;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Running aggregate values of one group, keyed by alias. Not thread-safe; guarded by {@link AggregateTable}.
 */
final class GroupAccumulator {

    private final Object groupKey;
    private final Map<String, Object> values = new LinkedHashMap<>();

    // Hidden AVG state: alias -> {sum, count}. Never emitted.
    private final Map<String, AvgState> averages = new HashMap<>();

    GroupAccumulator(Object groupKey) {
        this.groupKey = groupKey;
    }

    void accept(List<Aggregation> aggregations, Object payload) {
        for (Aggregation agg : aggregations) {
            final Object value = (agg.field() == null) ? null : PayloadFields.extract(payload, agg.field());
            apply(agg, value);
        }
    }

    private void apply(Aggregation agg, Object value) {
        final String alias = agg.alias();
        final Object current = values.get(alias);

        switch (agg.operation()) {
            case COUNT -> values.put(alias, (current == null) ? 1L : ((Number) current).longValue() + 1L);
            case SUM -> values.put(alias, Numbers.add((current == null) ? 0L : (Number) current, Numbers.coerce(value)));
            case AVG -> {
                final AvgState st = averages.computeIfAbsent(alias, k -> new AvgState());
                st.sum = Numbers.add(st.sum, Numbers.coerce(value));
                st.count++;
                values.put(alias, st.sum.doubleValue() / st.count);
            }
            case MIN -> {
                if (value == null) return;
                final Number n = Numbers.coerce(value);
                values.put(alias, (current == null) ? n : Numbers.min((Number) current, n));
            }
            case MAX -> {
                if (value == null) return;
                final Number n = Numbers.coerce(value);
                values.put(alias, (current == null) ? n : Numbers.max((Number) current, n));
            }
            case FIRST -> {
                if (current == null && value != null) values.put(alias, value);
            }
            case LAST -> values.put(alias, value);
            case COLLECT -> {
                @SuppressWarnings("unchecked")
                List<Object> list = (current instanceof List<?>) ? (List<Object>) current : new ArrayList<>();
                list.add(value);
                values.put(alias, list);
            }
        }
    }

    /**
     * Result payload: {@code {key, <alias>: value, ...}}. Collected lists are copied.
     */
    Map<String, Object> snapshot() {
        final Map<String, Object> out = new LinkedHashMap<>();
        out.put("key", groupKey);
        values.forEach((alias, v) -> out.put(alias,
                (v instanceof List<?> l) ? Collections.unmodifiableList(new ArrayList<>(l)) : v));
        return out;
    }

    private static final class AvgState {
        Number sum = 0L;
        long count;
    }
}
