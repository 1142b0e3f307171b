/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.compiler;

import com.blockdsl.api.IDslParser;
import com.blockdsl.api.model.ActionSignature;
import com.blockdsl.api.model.EditorMeta;
import com.blockdsl.api.model.EditorMode;
import com.blockdsl.api.model.LogicBlock;
import com.blockdsl.api.model.ParseResult;
import com.blockdsl.api.model.RuleSignature;
import com.blockdsl.tree.BlockForest;
import com.blockdsl.tree.BlockIdGenerator;
import com.blockdsl.tree.PreconditionList;
import com.blockdsl.tree.RandomBlockIdGenerator;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;

/**
 * Line-oriented, stack-based parser from DSL text to a statement tree.
 *
 * <p>The parser recognizes a fixed set of statement shapes (see {@link DslSyntax})
 * and silently drops every other line. It never throws: text that is also
 * edited by hand outside the visual editor must never prevent the editor from
 * opening, so the worst outcome is an empty or partial tree.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Split into trimmed, non-empty lines; skip {@code //} comments.</li>
 *   <li>Keep a stack of open containers, seeded with {@link BlockForest#ROOT}.</li>
 *   <li>ACTION mode: statements are only read after the {@code EFFECT} line;
 *       {@code PRECONDITION} lines and their {@code ON_FAILURE} follow-up go to the
 *       precondition list wherever they appear.</li>
 *   <li>{@code FOR} pushes the new loop; a bare {@code }} pops one level and is
 *       ignored at the top level.</li>
 * </ol>
 *
 * <p>Every parse assigns fresh block ids.
 */
public class DslParser implements IDslParser {

    private static final Logger logger = Logger.getLogger(DslParser.class.getName());

    private final BlockIdGenerator idGenerator;
    private Tracer tracer;

    public DslParser() {
        this(OpenTelemetry.noop().getTracer("blockdsl-compiler"));
    }

    public DslParser(Tracer tracer) {
        this(tracer, new RandomBlockIdGenerator());
    }

    public DslParser(Tracer tracer, BlockIdGenerator idGenerator) {
        this.tracer = tracer;
        this.idGenerator = idGenerator;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public ParseResult parse(String source, EditorMode mode) {
        if (source == null || source.isBlank()) {
            return ParseResult.empty();
        }
        EditorMode effectiveMode = mode == null ? EditorMode.RULE : mode;

        Span span = tracer.spanBuilder("parse-dsl").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("mode", effectiveMode.name());
            List<String> lines = significantLines(source);
            span.setAttribute("lineCount", lines.size());

            ParseResult result = new ParseRun(lines, effectiveMode).run();

            span.setAttribute("statementCount", result.statements().size());
            span.setAttribute("preconditionCount", result.preconditions().size());
            span.setAttribute("droppedLines", result.droppedLines());
            if (result.droppedLines() > 0 && logger.isLoggable(Level.FINE)) {
                logger.fine(String.format("Parsed %d statements, dropped %d unrecognized lines",
                    result.statements().size(), result.droppedLines()));
            }
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            logger.log(Level.WARNING, "Unexpected failure while parsing DSL, returning an empty tree", e);
            return ParseResult.empty();
        } finally {
            span.end();
        }
    }

    @Override
    public Optional<RuleSignature> parseRuleSignature(String source) {
        if (source == null) {
            return Optional.empty();
        }
        List<String> lines = significantLines(source);
        for (int i = 0; i < lines.size(); i++) {
            Matcher header = DslSyntax.RULE_HEADER.matcher(lines.get(i));
            if (!header.lookingAt()) {
                continue;
            }
            int priority;
            try {
                priority = Integer.parseInt(header.group(2));
            } catch (NumberFormatException e) {
                logger.fine("Rule priority out of range: " + header.group(2));
                return Optional.empty();
            }
            return Optional.of(new RuleSignature(header.group(1), priority, readTrigger(lines, i + 1)));
        }
        return Optional.empty();
    }

    private static EditorMeta.Trigger readTrigger(List<String> lines, int from) {
        for (int i = from; i < lines.size(); i++) {
            Matcher trigger = DslSyntax.RULE_TRIGGER.matcher(lines.get(i));
            if (trigger.lookingAt()) {
                return new EditorMeta.Trigger(trigger.group(1), trigger.group(2), trigger.group(3));
            }
        }
        return null;
    }

    @Override
    public Optional<ActionSignature> parseActionSignature(String source) {
        if (source == null) {
            return Optional.empty();
        }
        List<String> lines = significantLines(source);
        Optional<Matcher> header = lines.stream()
            .filter(line -> line.startsWith("ACTION"))
            .findFirst()
            .map(DslSyntax.ACTION_HEADER::matcher)
            .filter(Matcher::lookingAt);
        if (header.isEmpty()) {
            return Optional.empty();
        }

        String[] path = header.get().group(1).split("\\.");
        String entityType = path[0];
        String actionName = path.length > 1 ? path[1] : "";

        List<EditorMeta.Parameter> parameters = new ArrayList<>();
        String params = header.get().group(2);
        if (params != null) {
            for (String part : params.split(",")) {
                Matcher param = DslSyntax.ACTION_PARAMETER.matcher(part.trim());
                if (param.find()) {
                    parameters.add(new EditorMeta.Parameter(param.group(1), param.group(2), param.group(3) != null));
                }
            }
        }

        String description = lines.stream()
            .filter(line -> line.startsWith(DslSyntax.KW_DESCRIPTION))
            .findFirst()
            .map(DslSyntax.DESCRIPTION::matcher)
            .filter(Matcher::find)
            .map(m -> m.group(1).replace("\\\"", "\""))
            .orElse(null);

        return Optional.of(new ActionSignature(entityType, actionName, parameters, description));
    }

    // Drops one leading '{' and one trailing '}' around CALL arguments.
    private static String unbrace(String args) {
        String body = args.trim();
        if (body.startsWith("{")) {
            body = body.substring(1);
        }
        if (body.endsWith("}")) {
            body = body.substring(0, body.length() - 1);
        }
        return body;
    }

    private static List<String> significantLines(String source) {
        List<String> lines = new ArrayList<>();
        for (String raw : source.split("\\R")) {
            String line = raw.trim();
            if (!line.isEmpty() && !line.startsWith(DslSyntax.COMMENT_PREFIX)) {
                lines.add(line);
            }
        }
        return lines;
    }

    /**
     * State of a single parse.
     */
    private final class ParseRun {
        private final List<String> lines;
        private final EditorMode mode;
        private final BlockForest.Builder statements = BlockForest.builder();
        private final List<LogicBlock> preconditions = new ArrayList<>();
        private final Set<String> preconditionIds = new HashSet<>();
        private final Deque<String> containers = new ArrayDeque<>();
        private boolean inEffect;
        private int dropped;

        ParseRun(List<String> lines, EditorMode mode) {
            this.lines = lines;
            this.mode = mode;
            this.inEffect = mode == EditorMode.RULE;
            containers.push(BlockForest.ROOT);
        }

        ParseResult run() {
            for (int i = 0; i < lines.size(); i++) {
                readLine(i);
            }
            return new ParseResult(statements.build(), PreconditionList.of(preconditions), dropped);
        }

        private void readLine(int index) {
            String line = lines.get(index);
            boolean action = mode == EditorMode.ACTION;

            if (action && line.startsWith(DslSyntax.KW_DESCRIPTION)) {
                return;
            }
            if (action && line.startsWith(DslSyntax.KW_PRECONDITION)) {
                readPrecondition(line, index);
                return;
            }
            if (line.startsWith(DslSyntax.KW_ON_FAILURE)) {
                return;
            }
            if (action && line.startsWith(DslSyntax.KW_EFFECT)) {
                inEffect = true;
                return;
            }
            if (!inEffect || isRuleHeader(line)) {
                return;
            }
            readStatement(line);
        }

        private boolean isRuleHeader(String line) {
            return mode == EditorMode.RULE
                && (DslSyntax.RULE_HEADER.matcher(line).lookingAt() || DslSyntax.RULE_TRIGGER.matcher(line).lookingAt());
        }

        private void readPrecondition(String line, int index) {
            Matcher m = DslSyntax.PRECONDITION.matcher(line);
            if (!m.lookingAt()) {
                drop(line);
                return;
            }
            String onFailure = null;
            if (index + 1 < lines.size() && lines.get(index + 1).startsWith(DslSyntax.KW_ON_FAILURE)) {
                Matcher failure = DslSyntax.ON_FAILURE.matcher(lines.get(index + 1));
                if (failure.find()) {
                    onFailure = failure.group(1);
                }
            }
            String id = freshId();
            preconditionIds.add(id);
            preconditions.add(LogicBlock.precondition(id, m.group(1), m.group(2).trim(), onFailure));
        }

        private void readStatement(String line) {
            if (line.startsWith(DslSyntax.KW_SET)) {
                Matcher m = DslSyntax.SET.matcher(line);
                if (m.lookingAt()) {
                    append(LogicBlock.set(freshId(), m.group(1).trim(), m.group(2).trim()));
                    return;
                }
            } else if (line.startsWith(DslSyntax.KW_TRIGGER)) {
                Matcher m = DslSyntax.TRIGGER.matcher(line);
                if (m.lookingAt()) {
                    String[] action = m.group(1).split("\\.");
                    append(LogicBlock.trigger(freshId(),
                        action.length > 0 ? action[0] : "",
                        action.length > 1 ? action[1] : "",
                        m.group(2).trim()));
                    return;
                }
            } else if (line.startsWith(DslSyntax.KW_FOR)) {
                Matcher m = DslSyntax.FOR.matcher(line);
                if (m.lookingAt()) {
                    LogicBlock loop = LogicBlock.forEach(freshId(),
                        m.group(1).trim(),
                        m.group(2).trim(),
                        m.group(3) == null ? "" : m.group(3).trim());
                    append(loop);
                    containers.push(loop.id());
                    return;
                }
            } else if (line.startsWith(DslSyntax.KW_CALL)) {
                Matcher m = DslSyntax.CALL.matcher(line);
                if (m.lookingAt()) {
                    String product = m.group(1) != null ? m.group(1) : m.group(2);
                    append(LogicBlock.call(freshId(), product, m.group(3), CallArgumentCodec.parse(unbrace(m.group(4)))));
                    return;
                }
            } else if (line.equals(DslSyntax.BLOCK_END)) {
                // a stray brace at the top level is ignored
                if (containers.size() > 1) {
                    containers.pop();
                }
                return;
            }
            drop(line);
        }

        private void append(LogicBlock block) {
            statements.append(containers.peek(), block);
        }

        private String freshId() {
            return idGenerator.nextIdNotIn(id -> statements.contains(id) || preconditionIds.contains(id));
        }

        private void drop(String line) {
            dropped++;
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Dropping unrecognized DSL line: " + line);
            }
        }
    }
}
