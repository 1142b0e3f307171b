/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.api.model;

import com.blockdsl.tree.BlockForest;
import com.blockdsl.tree.PreconditionList;

/**
 * Output of parsing DSL text.
 *
 * @param statements    statement tree
 * @param preconditions precondition list; always empty in RULE mode
 * @param droppedLines  number of non-blank, non-comment lines that matched no
 *                      known shape and were left out of the tree
 */
public record ParseResult(
    BlockForest statements,
    PreconditionList preconditions,
    int droppedLines
) {

    public static ParseResult empty() {
        return new ParseResult(BlockForest.empty(), PreconditionList.empty(), 0);
    }
}
