/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.app;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A synthetic order. Pushed into the engine as a map so text processors can rewrite fields.
 */
public record Order(String orderId, String region, long amount) {

    public static final String ID = "orderId";
    public static final String REGION = "region";
    public static final String AMOUNT = "amount";

    public Map<String, Object> toPayload() {
        final Map<String, Object> m = new LinkedHashMap<>();
        m.put(ID, orderId);
        m.put(REGION, region);
        m.put(AMOUNT, amount);
        return m;
    }
}
