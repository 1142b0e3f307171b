/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.tree;

import com.blockdsl.api.model.BlockField;
import com.blockdsl.api.model.BlockType;
import com.blockdsl.api.model.LogicBlock;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Flat, ordered, immutable list of PRECONDITION blocks of an ACTION.
 *
 * <p>Mutators follow the same contract as {@link BlockForest}: they are pure and
 * return {@code this} when nothing changes.
 */
public final class PreconditionList {

    private static final PreconditionList EMPTY = new PreconditionList(ImmutableList.of());

    private final ImmutableList<LogicBlock> items;

    private PreconditionList(ImmutableList<LogicBlock> items) {
        this.items = items;
    }

    public static PreconditionList empty() {
        return EMPTY;
    }

    /**
     * Builds a list from blocks, skipping non-PRECONDITION blocks and repeated ids.
     */
    public static PreconditionList of(List<LogicBlock> blocks) {
        PreconditionList list = EMPTY;
        for (LogicBlock block : blocks) {
            list = list.add(block);
        }
        return list;
    }

    public List<LogicBlock> asList() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public boolean contains(String id) {
        return indexOf(id) >= 0;
    }

    public Optional<LogicBlock> find(String id) {
        int index = indexOf(id);
        return index < 0 ? Optional.empty() : Optional.of(items.get(index));
    }

    private int indexOf(String id) {
        if (id == null) {
            return -1;
        }
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Appends a precondition. Anything that is not a PRECONDITION block, or whose
     * id is already present, leaves the list unchanged.
     */
    public PreconditionList add(LogicBlock block) {
        if (block == null || block.type() != BlockType.PRECONDITION || contains(block.id())) {
            return this;
        }
        return new PreconditionList(ImmutableList.<LogicBlock>builderWithExpectedSize(items.size() + 1)
            .addAll(items)
            .add(block)
            .build());
    }

    public PreconditionList update(String id, UnaryOperator<LogicBlock> change) {
        int index = indexOf(id);
        if (index < 0) {
            return this;
        }
        LogicBlock current = items.get(index);
        LogicBlock updated = change.apply(current);
        if (current.equals(updated)) {
            return this;
        }
        if (!current.id().equals(updated.id()) || updated.type() != BlockType.PRECONDITION) {
            throw new IllegalArgumentException("Precondition update must keep id and type: " + id);
        }
        List<LogicBlock> copy = new ArrayList<>(items);
        copy.set(index, updated);
        return new PreconditionList(ImmutableList.copyOf(copy));
    }

    public PreconditionList updateField(String id, BlockField field, String value) {
        return update(id, block -> block.with(field, value));
    }

    public PreconditionList remove(String id) {
        int index = indexOf(id);
        if (index < 0) {
            return this;
        }
        List<LogicBlock> copy = new ArrayList<>(items);
        copy.remove(index);
        return copy.isEmpty() ? EMPTY : new PreconditionList(ImmutableList.copyOf(copy));
    }

    public PreconditionList reorder(String activeId, String overId) {
        int from = indexOf(activeId);
        int to = indexOf(overId);
        if (from < 0 || to < 0 || from == to) {
            return this;
        }
        List<LogicBlock> copy = new ArrayList<>(items);
        LogicBlock moved = copy.remove(from);
        copy.add(to, moved);
        return new PreconditionList(ImmutableList.copyOf(copy));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof PreconditionList other && items.equals(other.items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return "PreconditionList" + items;
    }
}
