/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.infra.store;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link DefinitionStore} backed by a
 * {@link ConcurrentHashMap}. Definitions are lost when the process exits.
 *
 * <p><b>Thread Safety:</b> All operations are thread-safe.
 */
public class InMemoryDefinitionStore implements DefinitionStore {

    private final ConcurrentMap<String, DslDefinition> definitions = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryDefinitionStore() {
        this(Clock.systemUTC());
    }

    public InMemoryDefinitionStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<DslDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    @Override
    public List<DslDefinition> findAll() {
        return definitions.values().stream()
            .sorted(Comparator.comparing(DslDefinition::name))
            .toList();
    }

    @Override
    public DslDefinition save(DslDefinition definition) {
        DslDefinition stored = definition.withUpdatedAt(clock.instant());
        definitions.put(stored.name(), stored);
        return stored;
    }

    @Override
    public Optional<DslDefinition> saveDsl(String name, String dslText) {
        return Optional.ofNullable(definitions.computeIfPresent(name,
            (key, existing) -> existing.withDslText(dslText, clock.instant())));
    }

    @Override
    public boolean delete(String name) {
        return definitions.remove(name) != null;
    }

    /**
     * Replaces the whole content, e.g. with definitions read from a file.
     */
    public void loadDefinitions(List<DslDefinition> list) {
        definitions.clear();
        for (DslDefinition definition : list) {
            definitions.put(definition.name(), definition);
        }
    }
}
