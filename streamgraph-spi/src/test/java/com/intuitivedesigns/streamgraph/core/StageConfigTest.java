/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StageConfigTest {

    @Test
    void builder_shouldLeaveRetriesAndTimeoutUnset() {
        StageConfig c = StageConfig.builder().param("k", "v").build();

        assertFalse(c.hasRetries());
        assertFalse(c.hasTimeout());
        assertEquals(ErrorPolicy.DEFAULT_MAX_RETRIES, c.retries());
        assertEquals(StageConfig.DEFAULT_TIMEOUT_MS, c.timeoutMs());
    }

    @Test
    void withDefaults_shouldFillOnlyUnsetValues() {
        StageConfig onlyRetries = StageConfig.builder().retries(1).param("k", "v").build();

        StageConfig resolved = onlyRetries.withDefaults(0, 250L);

        assertEquals(1, resolved.retries());
        assertEquals(250L, resolved.timeoutMs());
        assertTrue(resolved.hasTimeout());
        assertEquals("v", resolved.params().get("k"));
    }

    @Test
    void withDefaults_shouldReturnSameInstanceWhenFullySet() {
        StageConfig c = StageConfig.builder().retries(0).timeoutMs(10).build();

        assertSame(c, c.withDefaults(5, 99L));
    }

    @Test
    void builder_shouldRejectInvalidExplicitValues() {
        assertThrows(IllegalArgumentException.class, () -> StageConfig.builder().retries(-1).build());
        assertThrows(IllegalArgumentException.class, () -> StageConfig.builder().timeoutMs(0).build());
        assertThrows(IllegalArgumentException.class, () -> StageConfig.builder().parallelism(0).build());
    }
}
