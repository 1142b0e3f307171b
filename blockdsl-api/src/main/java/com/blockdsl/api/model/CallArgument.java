/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * One {@code name: value} pair of a CALL block's argument list.
 * The value is an unparsed expression.
 */
public record CallArgument(
    @JsonProperty("name") String name,
    @JsonProperty("value") String value
) implements Serializable {

    public CallArgument {
        Objects.requireNonNull(name, "name");
        if (value == null) value = "";
    }

    public CallArgument withValue(String newValue) {
        return new CallArgument(name, newValue);
    }
}
