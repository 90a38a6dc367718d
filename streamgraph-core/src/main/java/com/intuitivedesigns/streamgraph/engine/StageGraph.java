/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.engine;

import com.intuitivedesigns.streamgraph.error.InvalidStageGraphException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Edge set of a pipeline used to validate wiring changes before they are applied.
 * Downstream links and error-handler links both count as edges.
 */
final class StageGraph {

    private final Map<String, Set<String>> edges = new LinkedHashMap<>();

    static StageGraph of(Collection<PipelineStage> stages) {
        final StageGraph g = new StageGraph();
        for (PipelineStage s : stages) {
            g.node(s.id());
            for (String next : s.nextStageIds()) g.edge(s.id(), next);
            s.errorHandlerStageId().ifPresent(h -> g.edge(s.id(), h));
        }
        return g;
    }

    StageGraph node(String id) {
        edges.computeIfAbsent(id, k -> new LinkedHashSet<>());
        return this;
    }

    StageGraph edge(String from, String to) {
        node(to);
        edges.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
        return this;
    }

    /**
     * @throws InvalidStageGraphException naming the stages of the first cycle found
     */
    void requireAcyclic(String pipelineId) {
        final Map<String, Integer> state = new HashMap<>(); // 1 = on stack, 2 = done
        for (String root : edges.keySet()) {
            if (state.containsKey(root)) continue;

            final Deque<String> path = new ArrayDeque<>();
            final Deque<Iterator<String>> iters = new ArrayDeque<>();
            path.push(root);
            iters.push(edges.get(root).iterator());
            state.put(root, 1);

            while (!path.isEmpty()) {
                final Iterator<String> it = iters.peek();
                if (!it.hasNext()) {
                    state.put(path.pop(), 2);
                    iters.pop();
                    continue;
                }
                final String next = it.next();
                final Integer s = state.get(next);
                if (s == null) {
                    state.put(next, 1);
                    path.push(next);
                    iters.push(edges.get(next).iterator());
                } else if (s == 1) {
                    throw new InvalidStageGraphException("Stage graph of pipeline '" + pipelineId
                            + "' would contain a cycle: " + cycle(path, next));
                }
            }
        }
    }

    private static List<String> cycle(Deque<String> path, String repeated) {
        final List<String> out = new ArrayList<>();
        final Iterator<String> it = path.descendingIterator();
        boolean inCycle = false;
        while (it.hasNext()) {
            final String id = it.next();
            if (id.equals(repeated)) inCycle = true;
            if (inCycle) out.add(id);
        }
        out.add(repeated);
        return out;
    }
}
