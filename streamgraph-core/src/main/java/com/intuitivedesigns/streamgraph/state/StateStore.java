/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Key/value state scoped to one pipeline and shared by all of its stages.
 *
 * Characteristics:
 * - Thread-safe (ConcurrentHashMap); compound updates are atomic per key
 * - Never shared across pipelines
 * - Destroyed with the owning pipeline
 */
public final class StateStore {

    private final Map<String, Object> values = new ConcurrentHashMap<>();

    public Object get(String key) {
        if (key == null) return null;
        return values.get(key);
    }

    /**
     * Stores a value; {@code null} removes the key.
     */
    public void put(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    public Object update(String key, UnaryOperator<Object> updater) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(updater, "updater");
        return values.compute(key, (k, current) -> updater.apply(current));
    }

    public Object computeIfAbsent(String key, Supplier<?> factory) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(factory, "factory");
        return values.computeIfAbsent(key, k -> factory.get());
    }

    public boolean contains(String key) {
        return key != null && values.containsKey(key);
    }

    public void remove(String key) {
        if (key == null) return;
        values.remove(key);
    }

    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public int size() {
        return values.size();
    }

    public void clear() {
        values.clear();
    }
}
