/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.spi;

import java.util.Locale;

/**
 * Plugin ids and processor names are matched case-insensitively, in upper case.
 */
public final class PluginIds {
    private PluginIds() {}

    /** Trimmed, upper-cased id; {@code null} becomes the empty string. */
    public static String normalize(String id) {
        return (id == null) ? "" : id.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * @param what describes the id in the error message, e.g. "Processor name"
     * @throws IllegalArgumentException if the id is null or blank
     */
    public static String requireValid(String id, String what) {
        final String key = normalize(id);
        if (key.isEmpty()) throw new IllegalArgumentException(what + " must not be blank");
        return key;
    }
}
