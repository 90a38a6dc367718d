/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.window;

import com.intuitivedesigns.streamgraph.core.StreamItem;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One window instance. Mutable; owned by a {@link WindowBook}.
 */
public final class Window {

    private final String id = UUID.randomUUID().toString();
    private final WindowSpec spec;
    private final Instant startTime;
    private final List<StreamItem> items = new ArrayList<>();
    private Instant endTime;

    Window(WindowSpec spec, Instant startTime) {
        this.spec = spec;
        this.startTime = startTime;
    }

    public String id() { return id; }
    public WindowKind kind() { return spec.kind(); }
    public long sizeMs() { return spec.sizeMs(); }
    public Long slideMs() { return spec.slideMs(); }
    public Instant startTime() { return startTime; }
    public Instant endTime() { return endTime; }
    public List<StreamItem> items() { return List.copyOf(items); }

    public boolean isOpen() {
        return endTime == null;
    }

    boolean hasElapsed(Instant now) {
        return now.toEpochMilli() - startTime.toEpochMilli() >= spec.sizeMs();
    }

    void add(StreamItem item) {
        items.add(item);
    }

    void evictOlderThan(Instant cutoff) {
        items.removeIf(i -> i.createdAt().isBefore(cutoff));
    }

    void close(Instant at) {
        this.endTime = at;
    }

    /**
     * Emitted payload: window identity plus the payloads it holds, in arrival order.
     */
    Map<String, Object> toPayload() {
        final List<Object> payloads = new ArrayList<>(items.size());
        for (StreamItem i : items) payloads.add(i.payload());

        final Map<String, Object> out = new LinkedHashMap<>();
        out.put("windowId", id);
        out.put("kind", spec.kind().name());
        out.put("startTime", startTime);
        out.put("endTime", endTime);
        out.put("window", payloads);
        return out;
    }
}
