/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.editor.call;

import com.blockdsl.api.MethodSchemaProvider;
import com.blockdsl.api.exceptions.SchemaLookupException;
import com.blockdsl.api.model.CallArgument;
import com.blockdsl.api.model.MethodInputField;
import com.blockdsl.compiler.CallArgumentCodec;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves the declared inputs of the method chosen on a CALL block and keeps
 * the per-block {@link CallEditorState}.
 *
 * <p>Every {@link #select(String, String, String)} issues a new selection key.
 * Lookups run asynchronously, bounded by the fetch timeout, and their results
 * are handed to the callback executor. A result whose key is no longer the
 * block's current key (newer selection, {@link #forget(String)},
 * {@link #clear()}) is discarded. The key check and the state change happen
 * as one step per block, so a result can neither overwrite a newer selection
 * nor undo a concurrent {@link #toggleManual(String)}.
 *
 * <p>Argument edits are pure functions over the canonical argument list and do
 * not depend on lookup state.
 */
public class CallArgumentResolver {

    private static final Logger logger = Logger.getLogger(CallArgumentResolver.class.getName());

    /**
     * Shared by all resolvers; only runs timeout tasks. Cancelled timers leave
     * the queue immediately.
     */
    private static final ScheduledThreadPoolExecutor TIMEOUTS = timeoutScheduler();

    /**
     * Receives state changes of CALL blocks, on the callback executor for
     * lookup results and on the caller's thread otherwise. With the default
     * direct executor that is whichever thread completed the lookup.
     */
    @FunctionalInterface
    public interface StateListener {
        void onStateChange(String blockId, CallEditorState state);
    }

    private final MethodSchemaProvider provider;
    private final Duration fetchTimeout;
    private final Executor callbackExecutor;
    private final AtomicLong generation = new AtomicLong();
    private final Map<String, SelectionKey> currentKeys = new ConcurrentHashMap<>();
    private final Map<String, CallEditorState> states = new ConcurrentHashMap<>();

    private Tracer tracer = OpenTelemetry.noop().getTracer("blockdsl-editor");
    private StateListener listener = (blockId, state) -> { };

    public CallArgumentResolver(MethodSchemaProvider provider, Duration fetchTimeout) {
        this(provider, fetchTimeout, MoreExecutors.directExecutor());
    }

    public CallArgumentResolver(MethodSchemaProvider provider, Duration fetchTimeout, Executor callbackExecutor) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.fetchTimeout = Objects.requireNonNull(fetchTimeout, "fetchTimeout");
        this.callbackExecutor = Objects.requireNonNull(callbackExecutor, "callbackExecutor");
    }

    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    public void setListener(StateListener listener) {
        this.listener = listener == null ? (blockId, state) -> { } : listener;
    }

    // ========================================================================
    // SCHEMA LOOKUP
    // ========================================================================

    /**
     * Starts resolving the inputs of {@code product.method} for a block. A blank
     * product or method resets the block to IDLE. Any lookup still in flight
     * for the block becomes stale.
     */
    public void select(String blockId, String product, String method) {
        SelectionKey key = new SelectionKey(blockId, product, method, generation.incrementAndGet());
        currentKeys.put(blockId, key);

        if (isBlank(product) || isBlank(method)) {
            transition(key, current -> current.manual() ? CallEditorState.idle().toggled() : CallEditorState.idle());
            return;
        }
        if (transition(key, CallEditorState::loading) == null) {
            // superseded before the lookup started
            return;
        }

        Span span = tracer.spanBuilder("resolve-method-schema").startSpan();
        span.setAttribute("product", product);
        span.setAttribute("method", method);

        CompletableFuture<List<MethodInputField>> lookup;
        try {
            lookup = provider.getMethodInputFields(product, method);
        } catch (RuntimeException e) {
            lookup = CompletableFuture.failedFuture(e);
        }
        if (lookup == null) {
            lookup = CompletableFuture.failedFuture(
                new SchemaLookupException(product, method, "Schema provider returned no result"));
        }

        withTimeout(lookup, key).whenCompleteAsync((fields, error) -> {
            try {
                complete(key, fields, error, span);
            } finally {
                span.end();
            }
        }, callbackExecutor);
    }

    private CompletableFuture<List<MethodInputField>> withTimeout(CompletableFuture<List<MethodInputField>> lookup,
                                                                  SelectionKey key) {
        CompletableFuture<List<MethodInputField>> bounded = new CompletableFuture<>();
        ScheduledFuture<?> timer = TIMEOUTS.schedule(
            () -> bounded.completeExceptionally(new TimeoutException(
                "Schema lookup for " + key.product() + "." + key.method() + " timed out after "
                    + fetchTimeout.toMillis() + "ms")),
            fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        lookup.whenComplete((fields, error) -> {
            timer.cancel(false);
            if (error != null) {
                bounded.completeExceptionally(error);
            } else {
                bounded.complete(fields);
            }
        });
        return bounded;
    }

    private void complete(SelectionKey key, List<MethodInputField> fields, Throwable error, Span span) {
        if (error != null) {
            Throwable cause = unwrap(error);
            if (transition(key, current -> current.failed(describe(cause))) == null) {
                discard(key, span);
                return;
            }
            span.recordException(cause);
            logger.log(Level.WARNING, "Schema lookup failed for " + key.product() + "." + key.method()
                + " (block " + key.blockId() + ")", cause);
            return;
        }
        List<MethodInputField> declared = fields == null ? List.of() : fields;
        if (transition(key, current -> current.ready(declared)) == null) {
            discard(key, span);
            return;
        }
        span.setAttribute("fieldCount", declared.size());
    }

    private static void discard(SelectionKey key, Span span) {
        span.setAttribute("stale", true);
        logger.fine("Discarding stale schema result for block " + key.blockId());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    // ========================================================================
    // PER-BLOCK STATE
    // ========================================================================

    public CallEditorState state(String blockId) {
        return states.getOrDefault(blockId, CallEditorState.idle());
    }

    /**
     * Flips between the schema form and free-text editing for a block.
     */
    public CallEditorState toggleManual(String blockId) {
        return transition(blockId, null, CallEditorState::toggled);
    }

    /**
     * Drops a block's state; an in-flight lookup for it becomes stale.
     */
    public void forget(String blockId) {
        currentKeys.remove(blockId);
        states.remove(blockId);
    }

    /**
     * Drops all state; every in-flight lookup becomes stale.
     */
    public void clear() {
        currentKeys.clear();
        states.clear();
    }

    private CallEditorState transition(SelectionKey key, UnaryOperator<CallEditorState> change) {
        return transition(key.blockId(), key, change);
    }

    /**
     * Applies {@code change} to the block's current state, but only while
     * {@code key} (when given) is still the block's current selection.
     *
     * @return the new state, or {@code null} when the key was stale
     */
    private CallEditorState transition(String blockId, SelectionKey key, UnaryOperator<CallEditorState> change) {
        AtomicReference<CallEditorState> applied = new AtomicReference<>();
        states.compute(blockId, (id, current) -> {
            if (key != null && !key.equals(currentKeys.get(id))) {
                return current;
            }
            CallEditorState next = change.apply(current == null ? CallEditorState.idle() : current);
            applied.set(next);
            return next;
        });
        CallEditorState next = applied.get();
        if (next != null) {
            listener.onStateChange(blockId, next);
        }
        return next;
    }

    // ========================================================================
    // ARGUMENT EDITS
    // ========================================================================

    /**
     * Binds a value to an argument by name: updated in place when present,
     * appended otherwise.
     */
    public static List<CallArgument> applyFieldEdit(List<CallArgument> args, String name, String value) {
        List<CallArgument> updated = new ArrayList<>(args == null ? List.of() : args);
        for (int i = 0; i < updated.size(); i++) {
            if (Objects.equals(updated.get(i).name(), name)) {
                updated.set(i, new CallArgument(name, value));
                return updated;
            }
        }
        updated.add(new CallArgument(name, value));
        return updated;
    }

    /**
     * Re-reads the whole list from free text. No schema validation.
     */
    public static List<CallArgument> applyFreeText(String raw) {
        return CallArgumentCodec.parse(raw);
    }

    private static ScheduledThreadPoolExecutor timeoutScheduler() {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, new ThreadFactoryBuilder()
            .setNameFormat("schema-fetch-timeout-%d")
            .setDaemon(true)
            .build());
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    static int pendingTimeouts() {
        return TIMEOUTS.getQueue().size();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /**
     * Identity of one lookup request.
     */
    record SelectionKey(String blockId, String product, String method, long generation) {
    }
}
