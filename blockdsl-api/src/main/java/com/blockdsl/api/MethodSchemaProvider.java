/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.api;

import com.blockdsl.api.model.MethodInputField;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * External capability that describes the input of a data product method.
 *
 * <p>Implementations typically call a remote schema/introspection service. The
 * returned future may complete on any thread and may fail, usually with a
 * {@link com.blockdsl.api.exceptions.SchemaLookupException}.
 */
@FunctionalInterface
public interface MethodSchemaProvider {

    /**
     * @param product data product identifier
     * @param method  method name
     * @return ordered input fields of the method
     */
    CompletableFuture<List<MethodInputField>> getMethodInputFields(String product, String method);
}
