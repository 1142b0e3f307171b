/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.api.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Editable text fields of a {@link LogicBlock}.
 *
 * <p>Each field belongs to one or more block types; updating a field on a block
 * that does not carry it leaves the block unchanged. CALL arguments are not a
 * text field and are edited through {@link LogicBlock#withArgs(java.util.List)}.
 */
public enum BlockField {
    TARGET("target", BlockType.SET, BlockType.TRIGGER),
    VALUE("value", BlockType.SET),
    ACTION_ENTITY("actionEntity", BlockType.TRIGGER),
    ACTION_NAME("actionName", BlockType.TRIGGER),
    VARIABLE("variable", BlockType.FOR),
    ENTITY("entity", BlockType.FOR),
    CONDITIONS("conditions", BlockType.FOR, BlockType.PRECONDITION),
    LABEL("label", BlockType.PRECONDITION),
    ON_FAILURE("onFailure", BlockType.PRECONDITION),
    DATA_PRODUCT("dataProduct", BlockType.CALL),
    METHOD_NAME("methodName", BlockType.CALL);

    private final String key;
    private final Set<BlockType> owners;

    BlockField(String key, BlockType first, BlockType... rest) {
        this.key = key;
        this.owners = EnumSet.of(first, rest);
    }

    /**
     * Field name as used by editor front ends (camelCase).
     */
    public String key() {
        return key;
    }

    public boolean appliesTo(BlockType type) {
        return owners.contains(type);
    }

    /**
     * Looks up a field by its front-end key, e.g. {@code "actionEntity"}.
     */
    public static Optional<BlockField> fromKey(String key) {
        return Arrays.stream(values())
                .filter(f -> f.key.equals(key))
                .findFirst();
    }
}
