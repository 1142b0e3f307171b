/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.tree;

import com.blockdsl.api.model.BlockField;
import com.blockdsl.api.model.BlockType;
import com.blockdsl.api.model.CallArgument;
import com.blockdsl.api.model.LogicBlock;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Immutable statement tree stored as an arena keyed by block id.
 *
 * <p>The forest keeps three flat maps instead of nested composites:
 * <ul>
 *   <li>{@code blocks}: id to block</li>
 *   <li>{@code children}: container id to ordered child ids. The top level is the
 *       container {@link #ROOT}; every FOR block has an entry, possibly empty.</li>
 *   <li>{@code parents}: id to the container that holds it</li>
 * </ul>
 *
 * <p>Lookups by id are O(1). Mutators are pure: they return a new forest and
 * share every untouched block with the input. A mutation that changes nothing
 * (unknown id, non-container parent, non-sibling reorder, ...) returns
 * {@code this}, so callers can detect change by identity.
 *
 * <p>Invariants held by construction:
 * <ol>
 *   <li>ids are unique and never equal to {@link #ROOT}</li>
 *   <li>PRECONDITION blocks are never part of a forest</li>
 *   <li>only FOR blocks own children</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * BlockForest forest = BlockForest.empty()
 *     .add(BlockForest.ROOT, LogicBlock.forEach("loop", "o", "Order", "o.total &gt; 100"))
 *     .add("loop", LogicBlock.set("s1", "o.flag", "true"));
 *
 * forest = forest.updateField("s1", BlockField.VALUE, "false");
 * </pre>
 */
public final class BlockForest {

    /**
     * Container id of the top-level statement list.
     */
    public static final String ROOT = "$root";

    private static final BlockForest EMPTY = new BlockForest(
        ImmutableMap.of(),
        ImmutableMap.of(ROOT, ImmutableList.of()),
        ImmutableMap.of()
    );

    private final ImmutableMap<String, LogicBlock> blocks;
    private final ImmutableMap<String, ImmutableList<String>> children;
    private final ImmutableMap<String, String> parents;

    private BlockForest(ImmutableMap<String, LogicBlock> blocks,
                        ImmutableMap<String, ImmutableList<String>> children,
                        ImmutableMap<String, String> parents) {
        this.blocks = blocks;
        this.children = children;
        this.parents = parents;
    }

    public static BlockForest empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    public int size() {
        return blocks.size();
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public boolean contains(String id) {
        return id != null && blocks.containsKey(id);
    }

    public Optional<LogicBlock> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(blocks.get(id));
    }

    public Set<String> ids() {
        return blocks.keySet();
    }

    /**
     * Top-level statements in order.
     */
    public List<LogicBlock> roots() {
        return childrenOf(ROOT);
    }

    /**
     * Ordered children of a container ({@link #ROOT} or a FOR block id).
     * Empty for unknown ids and non-containers.
     */
    public List<LogicBlock> childrenOf(String containerId) {
        ImmutableList<String> ids = children.get(containerId);
        if (ids == null) {
            return List.of();
        }
        List<LogicBlock> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            result.add(blocks.get(id));
        }
        return result;
    }

    public List<String> childIds(String containerId) {
        ImmutableList<String> ids = children.get(containerId);
        return ids == null ? List.of() : ids;
    }

    /**
     * Container holding the block: {@link #ROOT} for top-level blocks, the FOR
     * block id otherwise.
     */
    public Optional<String> parentOf(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(parents.get(id));
    }

    /**
     * All blocks in pre-order (a FOR block precedes its children).
     */
    public List<LogicBlock> depthFirst() {
        List<LogicBlock> result = new ArrayList<>(blocks.size());
        collect(ROOT, result);
        return result;
    }

    private void collect(String containerId, List<LogicBlock> out) {
        for (String id : childIds(containerId)) {
            LogicBlock block = blocks.get(id);
            out.add(block);
            if (block.isContainer()) {
                collect(id, out);
            }
        }
    }

    /**
     * Nested read-only projection of the forest, for rendering.
     */
    public List<BlockNode> toTree() {
        return nodesOf(ROOT);
    }

    private List<BlockNode> nodesOf(String containerId) {
        List<BlockNode> nodes = new ArrayList<>();
        for (String id : childIds(containerId)) {
            LogicBlock block = blocks.get(id);
            nodes.add(new BlockNode(block, block.isContainer() ? nodesOf(id) : List.of()));
        }
        return nodes;
    }

    // ========================================================================
    // MUTATORS
    // ========================================================================

    /**
     * Replaces one block. The change must keep the block's id and type.
     *
     * @return a new forest, or {@code this} when the id is unknown or the block is unchanged
     * @throws IllegalArgumentException if the change alters the id or the type
     */
    public BlockForest update(String id, UnaryOperator<LogicBlock> change) {
        LogicBlock current = id == null ? null : blocks.get(id);
        if (current == null) {
            return this;
        }
        LogicBlock updated = change.apply(current);
        if (updated == current || current.equals(updated)) {
            return this;
        }
        if (!current.id().equals(updated.id()) || current.type() != updated.type()) {
            throw new IllegalArgumentException(
                "Block update must keep id and type: " + current.id() + "/" + current.type());
        }
        return new BlockForest(replace(blocks, id, updated), children, parents);
    }

    public BlockForest updateField(String id, BlockField field, String value) {
        return update(id, block -> block.with(field, value));
    }

    public BlockForest updateArguments(String id, List<CallArgument> args) {
        return update(id, block -> block.withArgs(args));
    }

    /**
     * Appends a block to the end of a container.
     *
     * @param parentId {@link #ROOT} (or {@code null}) for the top level, otherwise a FOR block id
     * @param block    freshly created block
     * @return a new forest, or {@code this} when the parent is absent or not a
     *         container, the id is already used, or the block is a PRECONDITION
     */
    public BlockForest add(String parentId, LogicBlock block) {
        String containerId = parentId == null ? ROOT : parentId;
        ImmutableList<String> siblings = children.get(containerId);
        if (siblings == null || !canInsert(block)) {
            return this;
        }
        ImmutableList<String> appended = ImmutableList.<String>builderWithExpectedSize(siblings.size() + 1)
            .addAll(siblings)
            .add(block.id())
            .build();

        ImmutableMap<String, ImmutableList<String>> newChildren = replace(children, containerId, appended);
        if (block.isContainer()) {
            newChildren = replace(newChildren, block.id(), ImmutableList.of());
        }
        return new BlockForest(
            replace(blocks, block.id(), block),
            newChildren,
            replace(parents, block.id(), containerId)
        );
    }

    private boolean canInsert(LogicBlock block) {
        return block != null
            && block.type().isStatement()
            && !ROOT.equals(block.id())
            && !blocks.containsKey(block.id());
    }

    /**
     * Removes a block wherever it is nested. A FOR block takes its whole
     * subtree with it.
     *
     * @return a new forest, or {@code this} when the id is unknown
     */
    public BlockForest remove(String id) {
        String containerId = id == null ? null : parents.get(id);
        if (containerId == null) {
            return this;
        }
        Set<String> doomed = subtreeIds(id);

        ImmutableMap.Builder<String, LogicBlock> newBlocks = ImmutableMap.builder();
        blocks.forEach((key, block) -> {
            if (!doomed.contains(key)) newBlocks.put(key, block);
        });

        ImmutableMap.Builder<String, ImmutableList<String>> newChildren = ImmutableMap.builder();
        children.forEach((key, ids) -> {
            if (doomed.contains(key)) {
                return;
            }
            if (key.equals(containerId)) {
                newChildren.put(key, ids.stream()
                    .filter(child -> !child.equals(id))
                    .collect(ImmutableList.toImmutableList()));
            } else {
                newChildren.put(key, ids);
            }
        });

        ImmutableMap.Builder<String, String> newParents = ImmutableMap.builder();
        parents.forEach((key, parent) -> {
            if (!doomed.contains(key)) newParents.put(key, parent);
        });

        return new BlockForest(newBlocks.build(), newChildren.build(), newParents.build());
    }

    private Set<String> subtreeIds(String id) {
        Set<String> ids = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.push(id);
        while (!pending.isEmpty()) {
            String next = pending.pop();
            ids.add(next);
            ImmutableList<String> nested = children.get(next);
            if (nested != null) {
                nested.forEach(pending::push);
            }
        }
        return ids;
    }

    /**
     * Moves {@code activeId} to the index of {@code overId} within their common
     * sibling list (remove, then insert). Cross-level moves are not supported.
     *
     * @return a new forest, or {@code this} when the ids are equal, unknown, or not siblings
     */
    public BlockForest reorder(String activeId, String overId) {
        if (activeId == null || activeId.equals(overId)) {
            return this;
        }
        String containerId = parents.get(activeId);
        if (containerId == null || !containerId.equals(parents.get(overId))) {
            return this;
        }
        ImmutableList<String> siblings = children.get(containerId);
        int from = siblings.indexOf(activeId);
        int to = siblings.indexOf(overId);

        List<String> moved = new ArrayList<>(siblings);
        moved.remove(from);
        moved.add(to, activeId);
        return new BlockForest(blocks, replace(children, containerId, ImmutableList.copyOf(moved)), parents);
    }

    private static <V> ImmutableMap<String, V> replace(ImmutableMap<String, V> map, String key, V value) {
        ImmutableMap.Builder<String, V> builder = ImmutableMap.builderWithExpectedSize(map.size() + 1);
        boolean replaced = false;
        for (Map.Entry<String, V> entry : map.entrySet()) {
            if (entry.getKey().equals(key)) {
                builder.put(key, value);
                replaced = true;
            } else {
                builder.put(entry);
            }
        }
        if (!replaced) {
            builder.put(key, value);
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlockForest other)) return false;
        return blocks.equals(other.blocks) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(blocks, children);
    }

    @Override
    public String toString() {
        return String.format("BlockForest[blocks=%d, roots=%d]", blocks.size(), childIds(ROOT).size());
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    /**
     * Mutable builder for bulk construction, e.g. while parsing. Appends follow
     * the same rules as {@link #add(String, LogicBlock)}.
     */
    public static final class Builder {
        private final Map<String, LogicBlock> blocks = new LinkedHashMap<>();
        private final Map<String, List<String>> children = new LinkedHashMap<>();
        private final Map<String, String> parents = new LinkedHashMap<>();

        private Builder() {
            children.put(ROOT, new ArrayList<>());
        }

        public boolean contains(String id) {
            return blocks.containsKey(id);
        }

        /**
         * @return {@code true} if the block was appended
         */
        public boolean append(String parentId, LogicBlock block) {
            String containerId = parentId == null ? ROOT : parentId;
            List<String> siblings = children.get(containerId);
            if (siblings == null || block == null || !block.type().isStatement()
                || ROOT.equals(block.id()) || blocks.containsKey(block.id())) {
                return false;
            }
            siblings.add(block.id());
            blocks.put(block.id(), block);
            parents.put(block.id(), containerId);
            if (block.isContainer()) {
                children.put(block.id(), new ArrayList<>());
            }
            return true;
        }

        public BlockForest build() {
            if (blocks.isEmpty()) {
                return EMPTY;
            }
            ImmutableMap.Builder<String, ImmutableList<String>> frozen = ImmutableMap.builder();
            children.forEach((key, ids) -> frozen.put(key, ImmutableList.copyOf(ids)));
            return new BlockForest(ImmutableMap.copyOf(blocks), frozen.build(), ImmutableMap.copyOf(parents));
        }
    }
}
