package com.blockdsl.api;

import com.blockdsl.api.model.BlockField;
import com.blockdsl.api.model.BlockType;
import com.blockdsl.api.model.CallArgument;
import com.blockdsl.api.model.EditorMeta;
import com.blockdsl.api.model.EditorMode;
import com.blockdsl.api.model.EditorSnapshot;
import com.blockdsl.api.model.SessionState;
import com.blockdsl.tree.BlockForest;
import com.blockdsl.tree.PreconditionList;

import java.util.List;
import java.util.Optional;

/**
 * Contract for an editing session over one rule or action.
 *
 * <p>The session owns the statement tree and precondition list. Every effective
 * mutation regenerates the DSL text and pushes it to the session's
 * {@link DslChangeListener}. Text edited by the host is only read back into
 * the tree through {@link #resync()}.
 */
public interface IEditorSession {

    EditorMode mode();

    SessionState state();

    /**
     * Opens the session on initial DSL text (may be {@code null} or empty).
     */
    void open(String initialDsl);

    /**
     * Records text edited outside the visual editor. Does not touch the tree.
     */
    void updateSource(String dsl);

    /**
     * Replaces the tree with a fresh parse of the last supplied source,
     * discarding visual edits.
     */
    void resync();

    /**
     * Adds a fresh block with default fields.
     *
     * @param parentId {@link BlockForest#ROOT} (or {@code null}) for the top level, or a FOR block id
     * @param type     block type; PRECONDITION goes to the precondition list
     * @return the new block id, or empty when nothing was added
     */
    Optional<String> addStatement(String parentId, BlockType type);

    void updateField(String id, BlockField field, String value);

    void updateArguments(String id, List<CallArgument> args);

    void remove(String id);

    void reorder(String activeId, String overId);

    void updateMeta(EditorMeta meta);

    BlockForest statements();

    PreconditionList preconditions();

    String generatedSource();

    EditorSnapshot snapshot();

    /**
     * Drops all state. In-flight schema lookups become stale.
     */
    void close();
}
