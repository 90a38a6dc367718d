/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.window;

import java.util.Objects;

/**
 * Window stage configuration.
 *
 * @param slideMs carried for sliding windows; emission happens on every item regardless
 */
public record WindowSpec(WindowKind kind, long sizeMs, Long slideMs) {

    public WindowSpec {
        Objects.requireNonNull(kind, "kind");
        if (sizeMs <= 0) throw new IllegalArgumentException("sizeMs must be > 0");
        if (slideMs != null && slideMs <= 0) throw new IllegalArgumentException("slideMs must be > 0");
    }

    public static WindowSpec tumbling(long sizeMs) {
        return new WindowSpec(WindowKind.TUMBLING, sizeMs, null);
    }

    public static WindowSpec sliding(long sizeMs, long slideMs) {
        return new WindowSpec(WindowKind.SLIDING, sizeMs, slideMs);
    }

    public static WindowSpec session(long sizeMs) {
        return new WindowSpec(WindowKind.SESSION, sizeMs, null);
    }
}
