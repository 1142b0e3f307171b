package com.blockdsl.api;

import com.blockdsl.api.model.ActionSignature;
import com.blockdsl.api.model.EditorMode;
import com.blockdsl.api.model.ParseResult;
import com.blockdsl.api.model.RuleSignature;

import io.opentelemetry.api.trace.Tracer;
import java.util.Optional;

/**
 * Contract for turning DSL text into a statement tree and precondition list.
 *
 * <p>Parsing is lossy by design: lines that match no known statement shape are
 * dropped. Implementations never throw on any input, including {@code null}.
 */
public interface IDslParser {

    /**
     * Parses DSL text.
     *
     * @param source raw DSL text, may be {@code null}
     * @param mode   RULE or ACTION
     * @return statements, preconditions and the number of dropped lines
     */
    ParseResult parse(String source, EditorMode mode);

    /**
     * Reads the {@code RULE <name> PRIORITY <n> {} header and its {@code ON ...} line.
     */
    Optional<RuleSignature> parseRuleSignature(String source);

    /**
     * Reads the {@code ACTION <Entity>.<name>(...)} header and its DESCRIPTION line.
     */
    Optional<ActionSignature> parseActionSignature(String source);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }
}
