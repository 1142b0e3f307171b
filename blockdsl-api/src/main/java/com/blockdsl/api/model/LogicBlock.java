/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * One node of the visual statement tree, or one entry of the precondition list.
 *
 * <p>A logic block is a discriminated union keyed by {@link #type()}. Only the
 * fields that belong to the block's type are meaningful:
 * <ul>
 *   <li>SET: {@code target}, {@code value}</li>
 *   <li>TRIGGER: {@code actionEntity}, {@code actionName}, {@code target}</li>
 *   <li>FOR: {@code variable}, {@code entity}, {@code conditions}</li>
 *   <li>PRECONDITION: {@code label}, {@code conditions}, {@code onFailure}</li>
 *   <li>CALL: {@code dataProduct}, {@code methodName}, {@code args}</li>
 * </ul>
 *
 * <p>Blocks are immutable. Children of a FOR block are owned by the
 * {@link com.blockdsl.tree.BlockForest} arena, not by the record, so a block can
 * be replaced without copying its subtree.
 *
 * <h2>Usage</h2>
 * <pre>
 * LogicBlock set = LogicBlock.set("b1", "order.status", "\"Shipped\"");
 * LogicBlock renamed = set.with(BlockField.TARGET, "order.state");
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogicBlock(
    @JsonProperty("id") String id,
    @JsonProperty("type") BlockType type,

    // SET / TRIGGER
    @JsonProperty("target") String target,
    @JsonProperty("value") String value,
    @JsonProperty("action_entity") String actionEntity,
    @JsonProperty("action_name") String actionName,

    // FOR / PRECONDITION
    @JsonProperty("variable") String variable,
    @JsonProperty("entity") String entity,
    @JsonProperty("conditions") String conditions,
    @JsonProperty("label") String label,
    @JsonProperty("on_failure") String onFailure,

    // CALL
    @JsonProperty("data_product") String dataProduct,
    @JsonProperty("method_name") String methodName,
    @JsonProperty("args") List<CallArgument> args
) implements Serializable {

    public LogicBlock {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        if (type == BlockType.CALL) {
            args = args == null ? List.of() : List.copyOf(args);
        } else {
            args = null;
        }
    }

    public static LogicBlock set(String id, String target, String value) {
        return new LogicBlock(id, BlockType.SET, target, value,
            null, null, null, null, null, null, null, null, null, null);
    }

    public static LogicBlock trigger(String id, String actionEntity, String actionName, String target) {
        return new LogicBlock(id, BlockType.TRIGGER, target, null,
            actionEntity, actionName, null, null, null, null, null, null, null, null);
    }

    public static LogicBlock forEach(String id, String variable, String entity, String conditions) {
        return new LogicBlock(id, BlockType.FOR, null, null,
            null, null, variable, entity, conditions, null, null, null, null, null);
    }

    public static LogicBlock precondition(String id, String label, String conditions, String onFailure) {
        return new LogicBlock(id, BlockType.PRECONDITION, null, null,
            null, null, null, null, conditions, label, onFailure, null, null, null);
    }

    public static LogicBlock call(String id, String dataProduct, String methodName, List<CallArgument> args) {
        return new LogicBlock(id, BlockType.CALL, null, null,
            null, null, null, null, null, null, null, dataProduct, methodName, args);
    }

    /**
     * Creates a fresh block of the given type with the defaults a newly added
     * editor block starts with.
     */
    public static LogicBlock empty(String id, BlockType type) {
        return switch (type) {
            case SET -> set(id, "", "");
            case TRIGGER -> trigger(id, "", "", "");
            case FOR -> forEach(id, "", "", "");
            case PRECONDITION -> precondition(id, "check", "", null);
            case CALL -> call(id, "", "", List.of());
        };
    }

    @JsonIgnore
    public boolean isContainer() {
        return type.isContainer();
    }

    /**
     * Returns the value of a text field, or {@code null} when the field is unset
     * or does not belong to this block's type.
     */
    public String get(BlockField field) {
        if (!field.appliesTo(type)) {
            return null;
        }
        return switch (field) {
            case TARGET -> target;
            case VALUE -> value;
            case ACTION_ENTITY -> actionEntity;
            case ACTION_NAME -> actionName;
            case VARIABLE -> variable;
            case ENTITY -> entity;
            case CONDITIONS -> conditions;
            case LABEL -> label;
            case ON_FAILURE -> onFailure;
            case DATA_PRODUCT -> dataProduct;
            case METHOD_NAME -> methodName;
        };
    }

    /**
     * Returns a copy with one text field replaced. Fields that do not belong to
     * this block's type are ignored and {@code this} is returned.
     */
    public LogicBlock with(BlockField field, String newValue) {
        if (!field.appliesTo(type) || Objects.equals(get(field), newValue)) {
            return this;
        }
        return new LogicBlock(
            id, type,
            field == BlockField.TARGET ? newValue : target,
            field == BlockField.VALUE ? newValue : value,
            field == BlockField.ACTION_ENTITY ? newValue : actionEntity,
            field == BlockField.ACTION_NAME ? newValue : actionName,
            field == BlockField.VARIABLE ? newValue : variable,
            field == BlockField.ENTITY ? newValue : entity,
            field == BlockField.CONDITIONS ? newValue : conditions,
            field == BlockField.LABEL ? newValue : label,
            field == BlockField.ON_FAILURE ? newValue : onFailure,
            field == BlockField.DATA_PRODUCT ? newValue : dataProduct,
            field == BlockField.METHOD_NAME ? newValue : methodName,
            args
        );
    }

    /**
     * Returns a copy with the argument list replaced. Only CALL blocks carry
     * arguments; any other type returns {@code this}.
     */
    public LogicBlock withArgs(List<CallArgument> newArgs) {
        if (type != BlockType.CALL || Objects.equals(args, newArgs)) {
            return this;
        }
        return new LogicBlock(
            id, type, target, value, actionEntity, actionName,
            variable, entity, conditions, label, onFailure,
            dataProduct, methodName, newArgs
        );
    }
}
