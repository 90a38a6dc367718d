/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.support;

import com.intuitivedesigns.streamgraph.core.StreamItem;
import com.intuitivedesigns.streamgraph.engine.DefaultProcessingContext;
import com.intuitivedesigns.streamgraph.state.StateStore;

import java.time.Clock;
import java.util.Map;

public final class Contexts {

    public static final String PIPELINE_ID = "p-test";

    private Contexts() {}

    public static DefaultProcessingContext context(String stageId, Map<String, Object> params, StateStore state, Clock clock) {
        return new DefaultProcessingContext(PIPELINE_ID, stageId, params, state, clock, null);
    }

    public static DefaultProcessingContext context(Map<String, Object> params) {
        return context("stage-1", params, new StateStore(), Clock.systemUTC());
    }

    public static StreamItem item(Object payload, Clock clock) {
        return StreamItem.create(PIPELINE_ID, payload, "push", clock.instant());
    }

    public static StreamItem item(Object payload) {
        return item(payload, Clock.systemUTC());
    }
}
