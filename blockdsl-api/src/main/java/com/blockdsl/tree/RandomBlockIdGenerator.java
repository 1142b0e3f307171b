/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.tree;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates short random base-36 ids, e.g. {@code "k3f9x0q2m"}.
 */
public final class RandomBlockIdGenerator implements BlockIdGenerator {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int DEFAULT_LENGTH = 9;

    private final int length;

    public RandomBlockIdGenerator() {
        this(DEFAULT_LENGTH);
    }

    public RandomBlockIdGenerator(int length) {
        if (length < 4) {
            throw new IllegalArgumentException("Id length must be at least 4, got: " + length);
        }
        this.length = length;
    }

    @Override
    public String nextId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder id = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            id.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return id.toString();
    }
}
