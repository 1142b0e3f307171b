/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.api.model;

/**
 * Header of a RULE read back from DSL text.
 *
 * @param name     rule name
 * @param priority declared priority
 * @param trigger  the {@code ON ...} clause, or {@code null} when absent
 */
public record RuleSignature(String name, int priority, EditorMeta.Trigger trigger) {

    public EditorMeta toMeta() {
        return EditorMeta.forRule(name, priority, trigger);
    }
}
