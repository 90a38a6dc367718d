/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.processors;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Recently seen dedupe keys with a sliding time-to-live. One instance per dedupe stage.
 */
final class SeenKeys {

    // key -> first-seen epoch millis; insertion order == age order
    private final Map<String, Long> seenAt = new LinkedHashMap<>();

    /**
     * Purges keys older than {@code windowMs}, then records {@code key} if it is new.
     * A key seen exactly {@code windowMs} ago is still a duplicate.
     *
     * @param clockMs read under the lock so insertion order matches timestamps
     * @return true on the first sighting within the window
     */
    synchronized boolean firstSighting(String key, LongSupplier clockMs, long windowMs) {
        final long nowMs = clockMs.getAsLong();
        final Iterator<Map.Entry<String, Long>> it = seenAt.entrySet().iterator();
        while (it.hasNext()) {
            if (nowMs - it.next().getValue() > windowMs) {
                it.remove();
            } else {
                break;
            }
        }

        if (seenAt.containsKey(key)) return false;
        seenAt.put(key, nowMs);
        return true;
    }

    synchronized int size() {
        return seenAt.size();
    }
}
