/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.engine;

import com.intuitivedesigns.streamgraph.core.StageConfig;
import com.intuitivedesigns.streamgraph.core.StageProcessor;
import com.intuitivedesigns.streamgraph.core.StageType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything {@code addStage} needs to create a stage.
 *
 * @param processorName       registry name; ignored when {@code processor} is set
 * @param processor           inline processor; neither set means pass-through
 * @param config              {@code null} uses the pipeline error policy's retry limit
 * @param nextStageIds        explicit downstream stages; must already exist
 * @param errorHandlerStageId dead-letter target; must already exist
 * @param autoChain           link the previously declared stage to this one (ignored for SOURCE stages)
 */
public record StageDefinition(
        String name,
        StageType type,
        String processorName,
        StageProcessor processor,
        StageConfig config,
        List<String> nextStageIds,
        String errorHandlerStageId,
        boolean autoChain
) {

    public StageDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        nextStageIds = (nextStageIds == null) ? List.of() : List.copyOf(nextStageIds);
    }

    public static Builder builder(String name, StageType type) {
        return new Builder(name, type);
    }

    public static final class Builder {
        private final String name;
        private final StageType type;
        private String processorName;
        private StageProcessor processor;
        private StageConfig config;
        private final List<String> nextStageIds = new ArrayList<>();
        private String errorHandlerStageId;
        private boolean autoChain = true;

        private Builder(String name, StageType type) {
            this.name = name;
            this.type = type;
        }

        public Builder processor(String registeredName) { this.processorName = registeredName; return this; }
        public Builder processor(StageProcessor inline) { this.processor = inline; return this; }
        public Builder config(StageConfig value) { this.config = value; return this; }
        public Builder next(String stageId) { this.nextStageIds.add(stageId); return this; }
        public Builder next(List<String> stageIds) { this.nextStageIds.addAll(stageIds); return this; }
        public Builder errorHandler(String stageId) { this.errorHandlerStageId = stageId; return this; }
        public Builder autoChain(boolean value) { this.autoChain = value; return this; }

        public StageDefinition build() {
            return new StageDefinition(name, type, processorName, processor, config, nextStageIds, errorHandlerStageId, autoChain);
        }
    }
}
