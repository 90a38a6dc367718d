/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.window;

import com.intuitivedesigns.streamgraph.core.StreamItem;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Window bookkeeping of one window stage. Only the open window is retained; closed
 * windows are handed out once and forgotten.
 */
public final class WindowBook {

    private Window active;
    private long closedCount;

    /**
     * Adds an item and returns the payload to emit, if any.
     *
     * <ul>
     * <li>TUMBLING / SESSION: an item arriving at or after {@code start + size} closes the open
     * window, which is emitted exactly once; the item starts the next window.</li>
     * <li>SLIDING: items older than {@code size} are evicted, then the whole window is emitted.</li>
     * </ul>
     */
    public synchronized Optional<Map<String, Object>> accept(StreamItem item, WindowSpec spec, Instant now) {
        if (spec.kind() == WindowKind.SLIDING) {
            if (active == null) active = new Window(spec, now);
            active.evictOlderThan(now.minusMillis(spec.sizeMs()));
            active.add(item);
            return Optional.of(active.toPayload());
        }

        Map<String, Object> closed = null;
        if (active != null && active.hasElapsed(now)) {
            active.close(now);
            closed = active.toPayload();
            closedCount++;
            active = null;
        }
        if (active == null) active = new Window(spec, now);
        active.add(item);
        return Optional.ofNullable(closed);
    }

    public synchronized Optional<Window> activeWindow() {
        return Optional.ofNullable(active);
    }

    public synchronized long closedCount() {
        return closedCount;
    }
}
