/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.infra.store;

import com.blockdsl.api.model.EditorMode;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A stored rule or action: its name, mode and DSL text plus a few host-side
 * attributes.
 *
 * <p>The DSL text is the single source of truth for the logic. The editor
 * reads it when a session opens and writes the generated text back verbatim
 * on commit; {@code priority} and {@code entityType} mirror the header so that
 * listings do not need to parse.
 *
 * <h2>Usage</h2>
 * <pre>
 * DslDefinition rule = DslDefinition.rule("AutoShip", "RULE AutoShip PRIORITY 100 {\n}");
 * </pre>
 */
public record DslDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("mode") EditorMode mode,
    @JsonProperty("dsl_text") String dslText,
    @JsonProperty("priority") Integer priority,
    @JsonProperty("entity_type") String entityType,
    @JsonProperty("active") Boolean active,
    @JsonProperty("updated_at") Instant updatedAt
) implements Serializable {

    public DslDefinition {
        Objects.requireNonNull(name, "name");
        if (mode == null) mode = EditorMode.RULE;
        if (dslText == null) dslText = "";
        if (active == null) active = true;
    }

    public static DslDefinition rule(String name, String dslText) {
        return new DslDefinition(name, EditorMode.RULE, dslText, null, null, true, null);
    }

    public static DslDefinition action(String name, String entityType, String dslText) {
        return new DslDefinition(name, EditorMode.ACTION, dslText, null, entityType, true, null);
    }

    public DslDefinition withDslText(String newText, Instant when) {
        return new DslDefinition(name, mode, newText, priority, entityType, active, when);
    }

    public DslDefinition withPriority(Integer newPriority) {
        return new DslDefinition(name, mode, dslText, newPriority, entityType, active, updatedAt);
    }

    public DslDefinition withUpdatedAt(Instant when) {
        return new DslDefinition(name, mode, dslText, priority, entityType, active, when);
    }
}
