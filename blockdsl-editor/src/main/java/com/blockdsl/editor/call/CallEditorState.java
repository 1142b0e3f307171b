package com.blockdsl.editor.call;

import com.blockdsl.api.model.CallArgument;
import com.blockdsl.api.model.MethodInputField;

import java.util.List;

/**
 * Schema resolution state of one CALL block.
 *
 * @param status lookup progress
 * @param fields declared input fields; empty unless READY
 * @param error  failure message; {@code null} unless FAILED
 * @param manual whether the user asked for free-text editing
 */
public record CallEditorState(Status status, List<MethodInputField> fields, String error, boolean manual) {

    public enum Status {
        /** No product/method selected. */
        IDLE,
        LOADING,
        READY,
        FAILED
    }

    private static final CallEditorState IDLE = new CallEditorState(Status.IDLE, List.of(), null, false);

    public CallEditorState {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public static CallEditorState idle() {
        return IDLE;
    }

    CallEditorState loading() {
        return new CallEditorState(Status.LOADING, List.of(), null, manual);
    }

    CallEditorState ready(List<MethodInputField> declared) {
        return new CallEditorState(Status.READY, declared, null, manual);
    }

    CallEditorState failed(String message) {
        return new CallEditorState(Status.FAILED, List.of(), message, manual);
    }

    CallEditorState toggled() {
        return new CallEditorState(status, fields, error, !manual);
    }

    /**
     * The form is shown only for a resolved schema outside manual mode;
     * every other state falls back to free text.
     */
    public ArgumentEditMode editMode(List<CallArgument> args) {
        if (status == Status.READY && !manual) {
            return new ArgumentEditMode.Structured(fields, args);
        }
        return ArgumentEditMode.FreeText.of(args);
    }
}
