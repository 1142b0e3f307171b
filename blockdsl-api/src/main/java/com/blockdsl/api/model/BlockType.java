/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.api.model;

/**
 * Kinds of logic blocks that make up a statement tree.
 */
public enum BlockType {
    /**
     * Property assignment: {@code SET target = value;}
     */
    SET,

    /**
     * Invocation of another action: {@code TRIGGER Entity.action ON target;}
     */
    TRIGGER,

    /**
     * Loop over entities: {@code FOR (v: Entity WHERE cond) { ... }}.
     * The only kind that owns children.
     */
    FOR,

    /**
     * Guard checked before an action's effects. Lives in the precondition
     * list, never inside the statement tree.
     */
    PRECONDITION,

    /**
     * Call into an external data product method: {@code CALL product.method({ a: 1 });}
     */
    CALL;

    public boolean isContainer() {
        return this == FOR;
    }

    public boolean isStatement() {
        return this != PRECONDITION;
    }
}
