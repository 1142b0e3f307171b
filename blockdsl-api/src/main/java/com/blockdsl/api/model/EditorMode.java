/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.api.model;

/**
 * DSL variant being edited.
 */
public enum EditorMode {
    /**
     * Trigger header and a statement body. No preconditions.
     */
    RULE,

    /**
     * Optional preconditions and an {@code EFFECT}-wrapped statement body.
     */
    ACTION
}
