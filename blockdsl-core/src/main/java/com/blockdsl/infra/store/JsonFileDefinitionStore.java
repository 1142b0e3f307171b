/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.infra.store;

import com.blockdsl.infra.config.EditorConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link DefinitionStore} persisted as a JSON array file.
 *
 * <p>The file is read once on construction; every change rewrites the whole
 * file through a temporary sibling and an atomic move. A missing file is an
 * empty store and is created on the first write.
 *
 * <p>File format:
 * <pre>
 * [
 *   {
 *     "name": "AutoShip",
 *     "mode": "RULE",
 *     "dsl_text": "RULE AutoShip PRIORITY 100 {\n}",
 *     "priority": 100,
 *     "active": true,
 *     "updated_at": "2025-01-01T00:00:00Z"
 *   }
 * ]
 * </pre>
 *
 * <p><b>Thread Safety:</b> Reads are lock-free; writes are serialized.
 */
public class JsonFileDefinitionStore implements DefinitionStore {

    private static final Logger logger = Logger.getLogger(JsonFileDefinitionStore.class.getName());

    private static final TypeReference<List<DslDefinition>> DEFINITION_LIST = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;
    private final InMemoryDefinitionStore delegate;

    public JsonFileDefinitionStore(EditorConfig config) {
        this(config.getDefinitionsFile(), Clock.systemUTC());
    }

    public JsonFileDefinitionStore(Path file, Clock clock) {
        this.file = file;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);
        this.delegate = new InMemoryDefinitionStore(clock);
        this.delegate.loadDefinitions(read());
    }

    private List<DslDefinition> read() {
        if (!Files.exists(file)) {
            logger.info("Definitions file " + file + " does not exist yet, starting empty");
            return List.of();
        }
        try {
            List<DslDefinition> definitions = objectMapper.readValue(file.toFile(), DEFINITION_LIST);
            if (definitions == null) {
                return List.of();
            }
            logger.info("Loaded " + definitions.size() + " definitions from " + file);
            return definitions;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to read definitions from " + file, e);
            throw new DefinitionStoreException("Failed to read definitions from " + file, e);
        }
    }

    private void write() {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(temp.toFile(), delegate.findAll());
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to write definitions to " + file, e);
            throw new DefinitionStoreException("Failed to write definitions to " + file, e);
        }
    }

    @Override
    public Optional<DslDefinition> find(String name) {
        return delegate.find(name);
    }

    @Override
    public List<DslDefinition> findAll() {
        return delegate.findAll();
    }

    @Override
    public synchronized DslDefinition save(DslDefinition definition) {
        DslDefinition stored = delegate.save(definition);
        write();
        return stored;
    }

    @Override
    public synchronized Optional<DslDefinition> saveDsl(String name, String dslText) {
        Optional<DslDefinition> updated = delegate.saveDsl(name, dslText);
        if (updated.isPresent()) {
            write();
        }
        return updated;
    }

    @Override
    public synchronized boolean delete(String name) {
        boolean deleted = delegate.delete(name);
        if (deleted) {
            write();
        }
        return deleted;
    }

    public Path getFile() {
        return file;
    }
}
