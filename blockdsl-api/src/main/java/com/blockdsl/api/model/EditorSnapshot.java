/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.api.model;

import com.blockdsl.tree.BlockNode;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Read-only projection of an editor session for rendering.
 */
public record EditorSnapshot(
    @JsonProperty("mode") EditorMode mode,
    @JsonProperty("state") SessionState state,
    @JsonProperty("meta") EditorMeta meta,
    @JsonProperty("statements") List<BlockNode> statements,
    @JsonProperty("preconditions") List<LogicBlock> preconditions,
    @JsonProperty("generated_source") String generatedSource
) {

    public EditorSnapshot {
        statements = List.copyOf(statements);
        preconditions = List.copyOf(preconditions);
    }
}
