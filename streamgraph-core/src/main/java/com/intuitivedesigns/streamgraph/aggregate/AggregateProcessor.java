/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.aggregate;

import com.intuitivedesigns.streamgraph.core.ProcessingContext;
import com.intuitivedesigns.streamgraph.core.ProcessorKind;
import com.intuitivedesigns.streamgraph.core.StageProcessor;
import com.intuitivedesigns.streamgraph.core.StreamItem;
import com.intuitivedesigns.streamgraph.processors.PayloadFields;
import com.intuitivedesigns.streamgraph.processors.ProcessorParams;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Continuously updating grouped aggregate: every input emits one result item carrying the
 * running values of its group.
 *
 * <p>Params: {@link ProcessorParams#AGGREGATIONS} (required, otherwise pass-through) and
 * {@link ProcessorParams#GROUP_KEY} (optional; all items share group {@code "all"}).</p>
 */
public final class AggregateProcessor implements StageProcessor {

    public static final String NAME = "aggregate";
    public static final String DEFAULT_GROUP = "all";

    public static String stateKey(String stageId) {
        return "aggregate:" + stageId;
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<StreamItem> process(StreamItem item, ProcessingContext context) {
        final List<Aggregation> aggregations = context.get(ProcessorParams.AGGREGATIONS, List.class);
        if (aggregations == null || aggregations.isEmpty()) return List.of(item);

        final String groupField = context.get(ProcessorParams.GROUP_KEY, String.class);
        final Object groupKey = (groupField == null) ? DEFAULT_GROUP : PayloadFields.extract(item.payload(), groupField);

        final AggregateTable table = (AggregateTable) context.computeStateIfAbsent(
                stateKey(context.stageId()), AggregateTable::new);
        final Map<String, Object> result = table.accumulate(groupKey, aggregations, item.payload());

        return List.of(new StreamItem(UUID.randomUUID().toString(), result, item.metadata(), context.now()));
    }

    @Override
    public ProcessorKind kind() {
        return ProcessorKind.AGGREGATE;
    }
}
