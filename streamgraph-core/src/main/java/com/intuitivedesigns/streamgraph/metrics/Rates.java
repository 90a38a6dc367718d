/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.metrics;

import java.time.Duration;
import java.time.Instant;

final class Rates {

    private Rates() {}

    /**
     * Events per second since {@code since}; 0 when not started or no time has elapsed.
     */
    static double perSecond(long count, Instant since, Instant now) {
        if (since == null || now == null) return 0.0;
        final long elapsedMs = Duration.between(since, now).toMillis();
        if (elapsedMs <= 0) return 0.0;
        return count / (elapsedMs / 1000.0);
    }

    static long uptimeMs(Instant since, Instant now) {
        if (since == null || now == null) return 0L;
        return Math.max(0L, Duration.between(since, now).toMillis());
    }
}
