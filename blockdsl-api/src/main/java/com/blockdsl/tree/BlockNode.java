/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.tree;

import com.blockdsl.api.model.LogicBlock;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Nested, read-only view of one forest entry and its children.
 * Only FOR blocks have non-empty {@code children}.
 */
public record BlockNode(
    @JsonProperty("block") LogicBlock block,
    @JsonProperty("children") List<BlockNode> children
) {

    public BlockNode {
        children = List.copyOf(children);
    }
}
