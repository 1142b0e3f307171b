/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.editor;

import com.blockdsl.api.DslChangeListener;
import com.blockdsl.api.IDslGenerator;
import com.blockdsl.api.IDslParser;
import com.blockdsl.api.IEditorSession;
import com.blockdsl.api.MethodSchemaProvider;
import com.blockdsl.api.model.ActionSignature;
import com.blockdsl.api.model.BlockField;
import com.blockdsl.api.model.BlockType;
import com.blockdsl.api.model.CallArgument;
import com.blockdsl.api.model.EditorMeta;
import com.blockdsl.api.model.EditorMode;
import com.blockdsl.api.model.EditorSnapshot;
import com.blockdsl.api.model.LogicBlock;
import com.blockdsl.api.model.ParseResult;
import com.blockdsl.api.model.RuleSignature;
import com.blockdsl.api.model.SessionState;
import com.blockdsl.compiler.DslGenerator;
import com.blockdsl.compiler.DslParser;
import com.blockdsl.editor.call.ArgumentEditMode;
import com.blockdsl.editor.call.CallArgumentResolver;
import com.blockdsl.editor.call.CallEditorState;
import com.blockdsl.infra.config.EditorConfig;
import com.blockdsl.tree.BlockForest;
import com.blockdsl.tree.BlockIdGenerator;
import com.blockdsl.tree.PreconditionList;
import com.blockdsl.tree.RandomBlockIdGenerator;
import com.google.common.util.concurrent.MoreExecutors;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Editing session over one rule or action.
 *
 * <p>The session owns the statement tree and the precondition list. The tree
 * is authoritative once the session is open: each effective mutation
 * regenerates the DSL text and pushes it to the {@link DslChangeListener}.
 * Text edited by the host is recorded with {@link #updateSource(String)} and
 * only enters the tree through {@link #resync()}.
 *
 * <pre>
 * UNINITIALIZED --open--&gt; SYNCED --mutation--&gt; DIRTY --resync--&gt; SYNCED
 *                                  any --close--&gt; CLOSED
 * </pre>
 *
 * <p>Mutations that change nothing (unknown ids, non-container parents,
 * cross-level reorders, edits before {@code open} or after {@code close}) are
 * silent no-ops and push nothing.
 *
 * <p><b>Thread Safety:</b> Not thread-safe. A session is confined to the
 * host's editing thread; schema lookup results are delivered through the
 * callback executor, which should run on that same thread.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EditorSession session = EditorSession.builder(EditorMode.RULE)
 *     .meta(EditorMeta.forRule("AutoShip", 100, new EditorMeta.Trigger("UPDATE", "Order", "status")))
 *     .listener(text -> editor.setText(text))
 *     .schemaProvider(provider)
 *     .build();
 *
 * session.open(storedText);
 * session.addStatement(BlockForest.ROOT, BlockType.SET).ifPresent(id ->
 *     session.updateField(id, BlockField.TARGET, "order.status"));
 * }</pre>
 */
public class EditorSession implements IEditorSession {

    private static final Logger logger = Logger.getLogger(EditorSession.class.getName());

    private final EditorMode mode;
    private final IDslParser parser;
    private final IDslGenerator generator;
    private final BlockIdGenerator idGenerator;
    private final DslChangeListener listener;
    private final CallArgumentResolver resolver;
    private final Tracer tracer;

    private SessionState state = SessionState.UNINITIALIZED;
    private EditorMeta meta;
    private String source;
    private BlockForest statements = BlockForest.empty();
    private PreconditionList preconditions = PreconditionList.empty();
    private String generatedSource = "";

    private EditorSession(Builder builder) {
        this.mode = builder.mode;
        this.parser = builder.parser;
        this.generator = builder.generator;
        this.idGenerator = builder.idGenerator;
        this.listener = builder.listener;
        this.tracer = builder.tracer;
        this.meta = builder.meta;
        this.resolver = new CallArgumentResolver(
            builder.schemaProvider, builder.config.getSchemaFetchTimeout(), builder.callbackExecutor);
        this.resolver.setTracer(tracer);
        this.parser.setTracer(tracer);
        this.generator.setTracer(tracer);
    }

    public static Builder builder(EditorMode mode) {
        return new Builder(mode);
    }

    // ========================================================================
    // LIFECYCLE
    // ========================================================================

    @Override
    public EditorMode mode() {
        return mode;
    }

    @Override
    public SessionState state() {
        return state;
    }

    /**
     * Opens the session. When no metadata was supplied, it is read from the
     * source's RULE or ACTION header.
     */
    @Override
    public void open(String initialDsl) {
        if (state == SessionState.CLOSED) {
            logger.warning("Ignoring open on a closed " + mode + " session");
            return;
        }
        this.source = initialDsl;
        if (meta == null) {
            meta = readMeta(initialDsl).orElse(null);
        }
        reload();
    }

    private Optional<EditorMeta> readMeta(String text) {
        if (mode == EditorMode.ACTION) {
            return parser.parseActionSignature(text).map(ActionSignature::toMeta);
        }
        return parser.parseRuleSignature(text).map(RuleSignature::toMeta);
    }

    @Override
    public void updateSource(String dsl) {
        if (state == SessionState.CLOSED) {
            return;
        }
        this.source = dsl;
    }

    @Override
    public void resync() {
        if (!isOpen()) {
            logger.fine("Ignoring resync of a session in state " + state);
            return;
        }
        reload();
    }

    private void reload() {
        Span span = tracer.spanBuilder("resync-session").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("mode", mode.name());

            ParseResult result = parser.parse(source, mode);
            statements = result.statements();
            preconditions = result.preconditions();
            resolver.clear();
            state = SessionState.SYNCED;

            span.setAttribute("statementCount", statements.size());
            span.setAttribute("droppedLines", result.droppedLines());
            if (result.droppedLines() > 0) {
                logger.fine("Resync dropped " + result.droppedLines() + " unrecognized lines");
            }

            resolveCallSchemas();
            regenerate();
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private void resolveCallSchemas() {
        for (LogicBlock block : statements.depthFirst()) {
            if (block.type() == BlockType.CALL && !isBlank(block.dataProduct()) && !isBlank(block.methodName())) {
                resolver.select(block.id(), block.dataProduct(), block.methodName());
            }
        }
    }

    @Override
    public void close() {
        if (state == SessionState.CLOSED) {
            return;
        }
        resolver.clear();
        statements = BlockForest.empty();
        preconditions = PreconditionList.empty();
        generatedSource = "";
        source = null;
        state = SessionState.CLOSED;
        logger.fine("Closed " + mode + " session");
    }

    private boolean isOpen() {
        return state == SessionState.SYNCED || state == SessionState.DIRTY;
    }

    // ========================================================================
    // MUTATIONS
    // ========================================================================

    @Override
    public Optional<String> addStatement(String parentId, BlockType type) {
        if (!isOpen() || type == null) {
            return Optional.empty();
        }
        String id = idGenerator.nextIdNotIn(candidate -> statements.contains(candidate)
            || preconditions.contains(candidate));
        LogicBlock block = LogicBlock.empty(id, type);

        if (type == BlockType.PRECONDITION) {
            if (mode != EditorMode.ACTION) {
                return Optional.empty();
            }
            return apply(statements, preconditions.add(block)) ? Optional.of(id) : Optional.empty();
        }
        return apply(statements.add(parentId, block), preconditions) ? Optional.of(id) : Optional.empty();
    }

    @Override
    public void updateField(String id, BlockField field, String value) {
        if (!isOpen() || field == null) {
            return;
        }
        if (statements.contains(id)) {
            apply(statements.updateField(id, field, value), preconditions);
        } else {
            apply(statements, preconditions.updateField(id, field, value));
        }
    }

    @Override
    public void updateArguments(String id, List<CallArgument> args) {
        if (!isOpen() || args == null) {
            return;
        }
        apply(statements.updateArguments(id, args), preconditions);
    }

    @Override
    public void remove(String id) {
        if (!isOpen()) {
            return;
        }
        if (statements.contains(id)) {
            BlockForest before = statements;
            if (apply(before.remove(id), preconditions)) {
                before.ids().stream()
                    .filter(removed -> !statements.contains(removed))
                    .forEach(resolver::forget);
            }
        } else {
            apply(statements, preconditions.remove(id));
        }
    }

    @Override
    public void reorder(String activeId, String overId) {
        if (!isOpen()) {
            return;
        }
        if (statements.contains(activeId)) {
            apply(statements.reorder(activeId, overId), preconditions);
        } else {
            apply(statements, preconditions.reorder(activeId, overId));
        }
    }

    @Override
    public void updateMeta(EditorMeta newMeta) {
        if (!isOpen() || Objects.equals(meta, newMeta)) {
            return;
        }
        meta = newMeta;
        state = SessionState.DIRTY;
        regenerate();
    }

    /**
     * Commits a new tree and precondition list when either changed.
     *
     * @return whether anything changed
     */
    private boolean apply(BlockForest newStatements, PreconditionList newPreconditions) {
        if (newStatements == statements && newPreconditions == preconditions) {
            return false;
        }
        statements = newStatements;
        preconditions = newPreconditions;
        state = SessionState.DIRTY;
        regenerate();
        return true;
    }

    private void regenerate() {
        generatedSource = generator.generate(mode, meta, statements, preconditions);
        try {
            listener.onDslChange(generatedSource);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "DSL change listener failed", e);
        }
    }

    // ========================================================================
    // CALL EDITING
    // ========================================================================

    /**
     * Chooses the product method of a CALL block. Existing arguments are
     * cleared and the method's inputs are resolved.
     */
    public void selectCallMethod(String id, String product, String method) {
        if (!isOpen() || !isCall(id)) {
            return;
        }
        apply(statements.update(id, block -> block
            .with(BlockField.DATA_PRODUCT, product)
            .with(BlockField.METHOD_NAME, method)
            .withArgs(List.of())), preconditions);
        resolver.select(id, product, method);
    }

    /**
     * Binds one argument by name, as typed into a schema form input.
     */
    public void setCallArgument(String id, String name, String value) {
        if (!isOpen() || !isCall(id) || isBlank(name)) {
            return;
        }
        LogicBlock block = statements.find(id).orElseThrow();
        apply(statements.updateArguments(id, CallArgumentResolver.applyFieldEdit(block.args(), name, value)),
            preconditions);
    }

    /**
     * Replaces all arguments with a parse of {@code name: value, ...} text.
     */
    public void setCallArgumentsText(String id, String raw) {
        if (!isOpen() || !isCall(id)) {
            return;
        }
        apply(statements.updateArguments(id, CallArgumentResolver.applyFreeText(raw)), preconditions);
    }

    public CallEditorState toggleManualArguments(String id) {
        if (!isOpen() || !isCall(id)) {
            return CallEditorState.idle();
        }
        return resolver.toggleManual(id);
    }

    public CallEditorState callEditorState(String id) {
        return resolver.state(id);
    }

    /**
     * How the arguments of a CALL block should be edited right now.
     */
    public Optional<ArgumentEditMode> argumentEditMode(String id) {
        return statements.find(id)
            .filter(block -> block.type() == BlockType.CALL)
            .map(block -> resolver.state(id).editMode(block.args()));
    }

    /**
     * Observes schema resolution progress, e.g. to re-render a CALL block.
     */
    public void setCallStateListener(CallArgumentResolver.StateListener stateListener) {
        resolver.setListener(stateListener);
    }

    private boolean isCall(String id) {
        return statements.find(id).map(block -> block.type() == BlockType.CALL).orElse(false);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    public EditorMeta meta() {
        return meta;
    }

    /**
     * Last text supplied through {@link #open(String)} or {@link #updateSource(String)}.
     */
    public String source() {
        return source;
    }

    @Override
    public BlockForest statements() {
        return statements;
    }

    @Override
    public PreconditionList preconditions() {
        return preconditions;
    }

    @Override
    public String generatedSource() {
        return generatedSource;
    }

    @Override
    public EditorSnapshot snapshot() {
        return new EditorSnapshot(mode, state, meta, statements.toTree(), preconditions.asList(), generatedSource);
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static class Builder {
        private final EditorMode mode;
        private IDslParser parser;
        private IDslGenerator generator;
        private BlockIdGenerator idGenerator = new RandomBlockIdGenerator();
        private DslChangeListener listener = DslChangeListener.NONE;
        private MethodSchemaProvider schemaProvider = (product, method) -> CompletableFuture.completedFuture(List.of());
        private Executor callbackExecutor = MoreExecutors.directExecutor();
        private Tracer tracer = OpenTelemetry.noop().getTracer("blockdsl-editor");
        private EditorConfig config;
        private EditorMeta meta;

        private Builder(EditorMode mode) {
            this.mode = mode == null ? EditorMode.RULE : mode;
        }

        public Builder parser(IDslParser parser) {
            this.parser = parser;
            return this;
        }

        public Builder generator(IDslGenerator generator) {
            this.generator = generator;
            return this;
        }

        public Builder idGenerator(BlockIdGenerator idGenerator) {
            this.idGenerator = idGenerator;
            return this;
        }

        public Builder listener(DslChangeListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder schemaProvider(MethodSchemaProvider schemaProvider) {
            this.schemaProvider = schemaProvider;
            return this;
        }

        /**
         * Executor that receives schema lookup results; normally the host's
         * event loop. Defaults to running them on the completing thread.
         */
        public Builder callbackExecutor(Executor callbackExecutor) {
            this.callbackExecutor = callbackExecutor;
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public Builder config(EditorConfig config) {
            this.config = config;
            return this;
        }

        public Builder meta(EditorMeta meta) {
            this.meta = meta;
            return this;
        }

        public EditorSession build() {
            if (parser == null) {
                parser = new DslParser(tracer);
            }
            if (generator == null) {
                generator = new DslGenerator(tracer);
            }
            if (config == null) {
                config = EditorConfig.fromEnvironment();
            }
            Objects.requireNonNull(idGenerator, "idGenerator");
            Objects.requireNonNull(listener, "listener");
            Objects.requireNonNull(schemaProvider, "schemaProvider");
            Objects.requireNonNull(callbackExecutor, "callbackExecutor");
            return new EditorSession(this);
        }
    }
}
