/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.compiler;

import com.blockdsl.api.IDslGenerator;
import com.blockdsl.api.model.CallArgument;
import com.blockdsl.api.model.EditorMeta;
import com.blockdsl.api.model.EditorMode;
import com.blockdsl.api.model.LogicBlock;
import com.blockdsl.tree.BlockForest;
import com.blockdsl.tree.PreconditionList;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders a statement tree and its header metadata as DSL text.
 *
 * <p>Output is deterministic and uses four spaces per indentation level.
 * Every field is written on a single line, and blank fields are replaced by a
 * placeholder, so the result always parses back into the same tree shape.
 * Fields that the parser reads as identifiers (loop variables and entities,
 * trigger actions, precondition labels, method and argument names) are
 * reduced to identifier characters, and {@code =} never appears in a SET target.
 *
 * <h2>RULE layout</h2>
 * <pre>
 * RULE Demo PRIORITY 100 {
 *     ON UPDATE(Order.status)
 *
 *     SET order.status = "Shipped";
 * }
 * </pre>
 *
 * <h2>ACTION layout</h2>
 * <pre>
 * ACTION Order.ship(carrier: String) {
 *     DESCRIPTION: "Ships the order"
 *
 *     PRECONDITION paid: order.paid == true
 *         ON_FAILURE: "Order must be paid"
 *     EFFECT {
 *         SET order.status = "Shipped";
 *     }
 * }
 * </pre>
 */
public class DslGenerator implements IDslGenerator {

    private static final Logger logger = Logger.getLogger(DslGenerator.class.getName());

    public static final String DEFAULT_RULE_NAME = "UntitledRule";
    public static final int DEFAULT_PRIORITY = 100;

    private static final Pattern LINE_BREAKS = Pattern.compile("\\R");
    private static final Pattern NON_WORD = Pattern.compile("\\W");
    private static final Pattern NON_PATH = Pattern.compile("[^\\w.]");
    private static final Pattern EMPTY_SEGMENTS = Pattern.compile("\\.{2,}");

    private static final EditorMeta NO_META = new EditorMeta(null, null, null, null, null, null);

    private Tracer tracer;

    public DslGenerator() {
        this(OpenTelemetry.noop().getTracer("blockdsl-compiler"));
    }

    public DslGenerator(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public String generate(EditorMode mode, EditorMeta meta, BlockForest statements, PreconditionList preconditions) {
        EditorMeta header = meta == null ? NO_META : meta;
        BlockForest forest = statements == null ? BlockForest.empty() : statements;
        PreconditionList checks = preconditions == null ? PreconditionList.empty() : preconditions;

        Span span = tracer.spanBuilder("generate-dsl").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("mode", String.valueOf(mode));
            span.setAttribute("statementCount", forest.size());

            StringBuilder out = new StringBuilder(256);
            if (mode == EditorMode.ACTION) {
                renderAction(header, forest, checks, out);
            } else {
                renderRule(header, forest, out);
            }

            span.setAttribute("length", out.length());
            if (logger.isLoggable(Level.FINEST)) {
                logger.finest("Generated DSL (" + out.length() + " chars) for " + forest.size() + " statements");
            }
            return out.toString();
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private void renderRule(EditorMeta meta, BlockForest forest, StringBuilder out) {
        out.append("RULE ").append(text(meta.name(), DEFAULT_RULE_NAME))
            .append(" PRIORITY ").append(meta.priority() == null ? DEFAULT_PRIORITY : meta.priority())
            .append(" {\n");

        EditorMeta.Trigger trigger = meta.trigger();
        if (trigger != null) {
            out.append(DslSyntax.INDENT).append("ON ")
                .append(text(trigger.type(), "UPDATE"))
                .append('(').append(text(trigger.entity(), "Entity"));
            String property = text(trigger.property(), "");
            if (trigger.isUpdate() && !property.isEmpty()) {
                out.append('.').append(property);
            }
            out.append(")\n\n");
        }

        renderLevel(forest, BlockForest.ROOT, 1, out);
        out.append('}');
    }

    private void renderAction(EditorMeta meta, BlockForest forest, PreconditionList preconditions, StringBuilder out) {
        out.append("ACTION ")
            .append(text(meta.entityType(), "Entity")).append('.')
            .append(text(meta.name(), "action"));
        if (!meta.parameters().isEmpty()) {
            out.append('(').append(meta.parameters().stream()
                .map(p -> p.name() + ": " + p.type() + (p.optional() ? "?" : ""))
                .collect(Collectors.joining(", "))).append(')');
        }
        out.append(" {\n");

        String description = text(meta.description(), "");
        if (!description.isEmpty()) {
            out.append(DslSyntax.INDENT).append(DslSyntax.KW_DESCRIPTION).append(" \"")
                .append(description.replace("\"", "\\\"")).append("\"\n\n");
        }

        for (LogicBlock check : preconditions.asList()) {
            out.append(DslSyntax.INDENT).append("PRECONDITION ")
                .append(identifier(check.label(), "check", NON_WORD)).append(": ")
                .append(text(check.conditions(), "true")).append('\n');
            String onFailure = text(check.onFailure(), "");
            if (!onFailure.isEmpty()) {
                out.append(DslSyntax.INDENT).append(DslSyntax.INDENT)
                    .append("ON_FAILURE: \"").append(onFailure).append("\"\n");
            }
        }

        out.append(DslSyntax.INDENT).append("EFFECT {\n");
        renderLevel(forest, BlockForest.ROOT, 2, out);
        out.append(DslSyntax.INDENT).append("}\n");
        out.append('}');
    }

    private void renderLevel(BlockForest forest, String containerId, int depth, StringBuilder out) {
        String indent = DslSyntax.INDENT.repeat(depth);
        for (LogicBlock block : forest.childrenOf(containerId)) {
            switch (block.type()) {
                case SET -> out.append(indent).append("SET ")
                    .append(text(block.target(), "entity.prop").replace('=', '_')).append(" = ")
                    .append(text(block.value(), "\"\"")).append(";\n");
                case TRIGGER -> out.append(indent).append("TRIGGER ")
                    .append(triggerAction(block)).append(" ON ")
                    .append(text(block.target(), "target")).append(";\n");
                case CALL -> out.append(indent).append("CALL ")
                    .append(product(block.dataProduct())).append('.')
                    .append(path(block.methodName(), "Method"))
                    .append('(').append(arguments(block.args())).append(");\n");
                case FOR -> {
                    out.append('\n').append(indent).append("FOR (")
                        .append(identifier(block.variable(), "v", NON_WORD)).append(": ")
                        .append(identifier(block.entity(), "Entity", NON_WORD));
                    String conditions = text(block.conditions(), "");
                    if (!conditions.isEmpty()) {
                        out.append(" WHERE ").append(conditions);
                    }
                    out.append(") {\n");
                    renderLevel(forest, block.id(), depth + 1, out);
                    out.append(indent).append("}\n");
                }
                case PRECONDITION -> logger.fine("Skipping precondition block inside statement tree: " + block.id());
            }
        }
    }

    private static String triggerAction(LogicBlock block) {
        String entity = identifier(block.actionEntity(), "", NON_WORD);
        String action = identifier(block.actionName(), "", NON_WORD);
        return entity.isEmpty() || action.isEmpty() ? "Action.unknown" : entity + "." + action;
    }

    private static String product(String raw) {
        String product = text(raw, "Product").replace('"', '\'');
        return DslSyntax.PLAIN_PRODUCT.matcher(product).matches() ? product : "\"" + product + "\"";
    }

    private static String arguments(List<CallArgument> args) {
        String body = args.stream()
            .filter(arg -> !path(arg.name(), "").isEmpty())
            .map(arg -> path(arg.name(), "") + ": " + text(arg.value(), "\"\""))
            .collect(Collectors.joining(", "));
        return body.isEmpty() ? "{}" : "{ " + body + " }";
    }

    /**
     * Single-line, trimmed field text, or the placeholder when blank.
     */
    static String text(String raw, String placeholder) {
        if (raw == null) {
            return placeholder;
        }
        String line = LINE_BREAKS.matcher(raw).replaceAll(" ").trim();
        return line.isEmpty() ? placeholder : line;
    }

    /**
     * Dotted name of the form {@code a.b.c}: illegal characters become '_',
     * empty segments and outer dots are removed.
     */
    private static String path(String raw, String placeholder) {
        String cleaned = EMPTY_SEGMENTS.matcher(identifier(raw, "", NON_PATH)).replaceAll(".");
        int from = cleaned.startsWith(".") ? 1 : 0;
        int to = cleaned.endsWith(".") ? cleaned.length() - 1 : cleaned.length();
        String path = from >= to ? "" : cleaned.substring(from, to);
        return path.isEmpty() ? placeholder : path;
    }

    private static String identifier(String raw, String placeholder, Pattern illegal) {
        String line = text(raw, "");
        if (line.isEmpty()) {
            return placeholder;
        }
        return illegal.matcher(line).replaceAll("_");
    }
}
