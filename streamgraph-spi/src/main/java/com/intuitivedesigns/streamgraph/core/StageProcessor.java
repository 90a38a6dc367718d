/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.core;

import java.util.List;

/**
 * The behavior of one pipeline stage.
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li><b>Output:</b> return one or more items to pass downstream.</li>
 * <li><b>Filtering:</b> return {@code null} or an empty list to stop propagation.</li>
 * <li><b>Failure:</b> throwing triggers the stage retry / dead-letter flow.</li>
 * <li><b>State:</b> keep cross-item state in the {@link ProcessingContext}, never in fields;
 * one processor instance may serve many stages and pipelines.</li>
 * </ul>
 */
@FunctionalInterface
public interface StageProcessor {

    List<StreamItem> process(StreamItem item, ProcessingContext context) throws Exception;

    default ProcessorKind kind() {
        return ProcessorKind.CUSTOM;
    }
}
