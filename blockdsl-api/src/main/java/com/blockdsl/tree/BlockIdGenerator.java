/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.tree;

import java.util.function.Predicate;

/**
 * Source of opaque block ids.
 */
@FunctionalInterface
public interface BlockIdGenerator {

    String nextId();

    /**
     * Draws ids until one is not taken.
     */
    default String nextIdNotIn(Predicate<String> taken) {
        String id = nextId();
        while (taken.test(id) || BlockForest.ROOT.equals(id)) {
            id = nextId();
        }
        return id;
    }
}
