/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.window;

public enum WindowKind {
    TUMBLING,
    SLIDING,
    /** Closes by the tumbling rule; gap-based sessions are not implemented. */
    SESSION
}
