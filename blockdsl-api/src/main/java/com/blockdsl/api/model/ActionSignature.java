/*
 * Copyright (c) 2025 BlockDSL
 * Licensed under the Apache License, Version 2.0
 */
package com.blockdsl.api.model;

import java.util.List;

/**
 * Header of an ACTION read back from DSL text.
 *
 * @param entityType  entity the action is declared on
 * @param actionName  action name
 * @param parameters  declared parameters, in order
 * @param description unescaped DESCRIPTION text, or {@code null}
 */
public record ActionSignature(
    String entityType,
    String actionName,
    List<EditorMeta.Parameter> parameters,
    String description
) {

    public ActionSignature {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public EditorMeta toMeta() {
        return EditorMeta.forAction(actionName, entityType, description, parameters);
    }
}
