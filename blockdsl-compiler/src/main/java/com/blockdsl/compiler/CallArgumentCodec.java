/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.compiler;

import com.blockdsl.api.model.CallArgument;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts CALL argument lists to and from their flat text form
 * {@code name: value, name: value}.
 *
 * <p>Pairs are split on commas that sit outside parentheses, brackets, braces
 * and double-quoted strings, and each pair on its first colon, so values such as
 * {@code max(a, b)} or {@code "a, b"} stay whole. A fragment without a colon
 * belongs to the value before it. No schema validation happens here.
 */
public final class CallArgumentCodec {

    private CallArgumentCodec() {
    }

    /**
     * Parses {@code name: value} pairs. Fragments with a blank name, or without a
     * colon and no preceding pair, are skipped.
     *
     * @param text free text, may be {@code null}
     * @return ordered arguments
     */
    public static List<CallArgument> parse(String text) {
        List<CallArgument> args = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return args;
        }
        for (String fragment : splitTopLevel(text)) {
            if (fragment.isBlank()) {
                continue;
            }
            int colon = fragment.indexOf(':');
            if (colon < 0) {
                if (!args.isEmpty()) {
                    CallArgument last = args.remove(args.size() - 1);
                    args.add(new CallArgument(last.name(), last.value() + ", " + fragment.trim()));
                }
                continue;
            }
            String name = fragment.substring(0, colon).trim();
            if (name.isEmpty()) {
                continue;
            }
            args.add(new CallArgument(name, fragment.substring(colon + 1).trim()));
        }
        return args;
    }

    /**
     * Formats arguments as one free-text line, e.g. {@code orderId: o.id, qty: 2}.
     */
    public static String format(List<CallArgument> args) {
        if (args == null || args.isEmpty()) {
            return "";
        }
        return args.stream()
            .map(arg -> arg.name() + ": " + arg.value())
            .collect(Collectors.joining(", "));
    }

    // Commas nested in (), [], {} or inside "..." do not separate pairs.
    // Unbalanced closers are clamped so a stray ')' cannot hide later commas.
    static List<String> splitTopLevel(String text) {
        List<String> fragments = new ArrayList<>();
        int depth = 0;
        boolean quoted = false;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (quoted) {
                continue;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                fragments.add(text.substring(start, i));
                start = i + 1;
            }
        }
        fragments.add(text.substring(start));
        return fragments;
    }
}
