/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.api;

/**
 * Receives regenerated DSL text after every effective edit of a session.
 *
 * <p>Called synchronously on the thread that performed the edit. The text is
 * the host's to persist or display; the session never reads it back.
 */
@FunctionalInterface
public interface DslChangeListener {

    /**
     * @param dsl the full generated DSL text
     */
    void onDslChange(String dsl);

    DslChangeListener NONE = dsl -> { };
}
