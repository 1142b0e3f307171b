/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.api.model;

/**
 * Lifecycle of an editor session.
 */
public enum SessionState {
    /** Created, no source opened yet. */
    UNINITIALIZED,

    /** Tree is a fresh parse of the last supplied source. */
    SYNCED,

    /** Tree was edited visually; generated text is derived from the tree. */
    DIRTY,

    /** Session closed; all state dropped. */
    CLOSED
}
