/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.engine;

import com.intuitivedesigns.streamgraph.error.InvalidStageGraphException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StageGraphTest {

    @Test
    void acyclicDiamondIsAccepted() {
        StageGraph g = new StageGraph()
                .edge("a", "b").edge("a", "c")
                .edge("b", "d").edge("c", "d");

        assertDoesNotThrow(() -> g.requireAcyclic("p"));
    }

    @Test
    void cycleIsReportedWithItsPath() {
        StageGraph g = new StageGraph()
                .edge("a", "b").edge("b", "c").edge("c", "a")
                .edge("x", "a");

        InvalidStageGraphException e = assertThrows(InvalidStageGraphException.class, () -> g.requireAcyclic("p"));
        assertTrue(e.getMessage().contains("a"), e.getMessage());
        assertTrue(e.getMessage().contains("c"), e.getMessage());
    }

    @Test
    void selfLoopIsACycle() {
        StageGraph g = new StageGraph().edge("a", "a");
        assertThrows(InvalidStageGraphException.class, () -> g.requireAcyclic("p"));
    }
}
