/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * One declared input of an external product method, used to render the
 * structured argument form of a CALL block.
 *
 * @param name argument name, bound by name into the block's argument list
 * @param type declared type, shown as an input hint
 */
public record MethodInputField(
    @JsonProperty("name") String name,
    @JsonProperty("type") String type
) implements Serializable {
}
