package com.blockdsl.api;

import com.blockdsl.api.model.EditorMeta;
import com.blockdsl.api.model.EditorMode;
import com.blockdsl.tree.BlockForest;
import com.blockdsl.tree.PreconditionList;

import io.opentelemetry.api.trace.Tracer;

/**
 * Contract for rendering a statement tree back to DSL text.
 */
public interface IDslGenerator {

    /**
     * Generates DSL text. The result is a pure function of the arguments:
     * identical inputs always produce byte-identical text.
     *
     * @param mode          RULE or ACTION
     * @param meta          header metadata
     * @param statements    statement tree
     * @param preconditions precondition list, ignored in RULE mode
     * @return well-formed DSL text
     */
    String generate(EditorMode mode, EditorMeta meta, BlockForest statements, PreconditionList preconditions);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }
}
