/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Host-supplied descriptive data echoed verbatim into generated DSL headers.
 *
 * <p>RULE sessions use {@code name}, {@code priority} and {@code trigger}.
 * ACTION sessions use {@code name}, {@code entityType}, {@code description}
 * and {@code parameters}. The editor never modifies metadata on its own.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EditorMeta(
    @JsonProperty("name") String name,
    @JsonProperty("priority") Integer priority,
    @JsonProperty("trigger") Trigger trigger,
    @JsonProperty("entity_type") String entityType,
    @JsonProperty("description") String description,
    @JsonProperty("parameters") List<Parameter> parameters
) implements Serializable {

    public EditorMeta {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public static EditorMeta forRule(String name, Integer priority, Trigger trigger) {
        return new EditorMeta(name, priority, trigger, null, null, null);
    }

    public static EditorMeta forAction(String name, String entityType, String description, List<Parameter> parameters) {
        return new EditorMeta(name, null, null, entityType, description, parameters);
    }

    public EditorMeta withDescription(String newDescription) {
        return new EditorMeta(name, priority, trigger, entityType, newDescription, parameters);
    }

    /**
     * Rule trigger: {@code ON <type>(<entity>[.<property>])}.
     *
     * @param type     trigger type, e.g. "UPDATE", "CREATE", "DELETE"
     * @param entity   entity type the rule listens on
     * @param property watched property; only rendered for UPDATE triggers
     */
    public record Trigger(
        @JsonProperty("type") String type,
        @JsonProperty("entity") String entity,
        @JsonProperty("property") String property
    ) implements Serializable {

        @JsonIgnore
        public boolean isUpdate() {
            return "UPDATE".equals(type);
        }
    }

    /**
     * Typed action parameter: {@code name: Type} or {@code name: Type?} when optional.
     */
    public record Parameter(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("optional") boolean optional
    ) implements Serializable {
    }
}
