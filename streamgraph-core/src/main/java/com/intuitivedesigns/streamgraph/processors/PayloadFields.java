/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.processors;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dotted-path access into item payloads.
 *
 * <p>Maps are walked directly. Other objects (POJOs, records) are converted to a map with
 * Jackson first; scalars and collections have no fields.</p>
 */
public final class PayloadFields {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private PayloadFields() {}

    /**
     * @return the value at {@code path} (e.g. {@code "order.amount"}), or {@code null} if any hop is missing
     */
    public static Object extract(Object payload, String path) {
        if (payload == null || path == null || path.isBlank()) return null;

        Object current = payload;
        for (String part : path.split("\\.")) {
            if (current == null) return null;
            final Map<?, ?> map = asFieldMap(current);
            if (map == null) return null;
            current = map.get(part);
        }
        return current;
    }

    /**
     * Mutable copy of the payload as a field map. Scalars are wrapped under {@code "value"}.
     */
    public static Map<String, Object> toMap(Object payload) {
        final Map<String, Object> out = new LinkedHashMap<>();
        if (payload == null) return out;

        final Map<?, ?> map = asFieldMap(payload);
        if (map == null) {
            out.put("value", payload);
            return out;
        }
        map.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    private static Map<?, ?> asFieldMap(Object value) {
        if (value instanceof Map<?, ?> m) return m;
        if (isScalar(value) || value instanceof Collection<?> || value.getClass().isArray()) return null;
        try {
            return MAPPER.convertValue(value, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static boolean isScalar(Object value) {
        return value instanceof CharSequence
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof Character
                || value instanceof Enum<?>;
    }
}
