/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.compiler;

import java.util.regex.Pattern;

/**
 * Fixed textual shapes recognized by {@link DslParser} and produced by
 * {@link DslGenerator}.
 *
 * <p>These are surface patterns, not a grammar. Patterns are applied with
 * {@link java.util.regex.Matcher#lookingAt()}, so anything after the matched
 * prefix (for example a trailing comment) is ignored.
 */
final class DslSyntax {

    static final String COMMENT_PREFIX = "//";
    static final String INDENT = "    ";

    static final String KW_SET = "SET";
    static final String KW_TRIGGER = "TRIGGER";
    static final String KW_FOR = "FOR";
    static final String KW_CALL = "CALL";
    static final String KW_PRECONDITION = "PRECONDITION";
    static final String KW_ON_FAILURE = "ON_FAILURE";
    static final String KW_EFFECT = "EFFECT";
    static final String KW_DESCRIPTION = "DESCRIPTION:";
    static final String BLOCK_END = "}";

    /** {@code SET target = value;} */
    static final Pattern SET = Pattern.compile("SET\\s+([^=]+)\\s*=\\s*(.*);");

    /** {@code TRIGGER Entity.action ON target;} */
    static final Pattern TRIGGER = Pattern.compile("TRIGGER\\s+([\\w.]+)\\s+ON\\s+(.*);");

    /** {@code FOR (v: Entity WHERE cond) {} */
    static final Pattern FOR = Pattern.compile("FOR\\s*\\(([^:]+):\\s*(\\w+)(?:\\s+WHERE\\s+(.*))?\\)\\s*\\{");

    /**
     * {@code CALL product.method({ a: 1 });} or {@code CALL "Product Name".method(...);}
     * The argument group runs to the last {@code );} on the line and still holds
     * the optional braces.
     */
    static final Pattern CALL = Pattern.compile(
        "CALL\\s+(?:\"([^\"]+)\"|([\\w.]+))\\.([\\w.]+)\\s*\\((.*)\\);");

    /** {@code PRECONDITION label: condition} */
    static final Pattern PRECONDITION = Pattern.compile("PRECONDITION\\s+(\\w+):\\s*(.*)");

    /** {@code ON_FAILURE: "message"}, searched anywhere in the line. */
    static final Pattern ON_FAILURE = Pattern.compile("ON_FAILURE:\\s*\"(.*)\"");

    /** {@code RULE Name PRIORITY 100 {} */
    static final Pattern RULE_HEADER = Pattern.compile("RULE\\s+(\\S+)\\s+PRIORITY\\s+(-?\\d+)\\s*\\{");

    /** {@code ON UPDATE(Order.status)} */
    static final Pattern RULE_TRIGGER = Pattern.compile("ON\\s+(\\w+)\\s*\\(\\s*(\\w+)(?:\\.(\\w+))?\\s*\\)");

    /** {@code ACTION Entity.name(p: Type?, ...) {} */
    static final Pattern ACTION_HEADER = Pattern.compile("ACTION\\s+([\\w.]+)\\s*(?:\\((.*)\\))?\\s*\\{");

    /** {@code name: Type} or {@code name: Type?} */
    static final Pattern ACTION_PARAMETER = Pattern.compile("(\\w+):\\s*(\\w+)(\\?)?");

    /** {@code DESCRIPTION: "text with \" escapes"} */
    static final Pattern DESCRIPTION = Pattern.compile("DESCRIPTION:\\s*\"(.*)\"");

    /** Product identifiers that can be written without quotes. */
    static final Pattern PLAIN_PRODUCT = Pattern.compile("\\w+(?:\\.\\w+)*");

    private DslSyntax() {
    }
}
