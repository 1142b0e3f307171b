/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.infra.store;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for rule and action definitions.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@link InMemoryDefinitionStore}: process-local, for tests and embedding</li>
 *   <li>{@link JsonFileDefinitionStore}: a JSON array file</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> Implementations must be thread-safe.
 */
public interface DefinitionStore {

    /**
     * Find a definition by name.
     *
     * @param name definition name
     * @return the definition, or empty if not found
     */
    Optional<DslDefinition> find(String name);

    /**
     * All definitions, ordered by name.
     */
    List<DslDefinition> findAll();

    /**
     * Save a new definition or replace an existing one. The stored copy gets a
     * fresh {@code updatedAt}.
     *
     * @return the stored definition
     */
    DslDefinition save(DslDefinition definition);

    /**
     * Replace only the DSL text of an existing definition, verbatim.
     *
     * @param name    definition name
     * @param dslText generated DSL text
     * @return the updated definition, or empty if no definition has this name
     */
    Optional<DslDefinition> saveDsl(String name, String dslText);

    /**
     * Delete a definition by name.
     *
     * @return true if the definition existed
     */
    boolean delete(String name);

    default boolean exists(String name) {
        return find(name).isPresent();
    }
}
