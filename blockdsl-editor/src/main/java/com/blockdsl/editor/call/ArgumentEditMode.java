package com.blockdsl.editor.call;

import com.blockdsl.api.model.CallArgument;
import com.blockdsl.api.model.MethodInputField;
import com.blockdsl.compiler.CallArgumentCodec;

import java.util.List;
import java.util.Objects;

/**
 * How the arguments of a CALL block are presented for editing.
 *
 * <p>Both variants view the same canonical ordered argument list, so switching
 * between them never changes the block.
 */
public interface ArgumentEditMode {

    /**
     * The canonical arguments behind this view.
     */
    List<CallArgument> args();

    /**
     * One input per declared method field, bound to arguments by name.
     */
    record Structured(List<MethodInputField> fields, List<CallArgument> args) implements ArgumentEditMode {

        public Structured {
            fields = List.copyOf(fields);
            args = List.copyOf(args);
        }

        /**
         * Value bound to a declared field, or an empty string when the
         * argument has not been created yet.
         */
        public String valueOf(String fieldName) {
            return args.stream()
                .filter(arg -> Objects.equals(arg.name(), fieldName))
                .map(CallArgument::value)
                .findFirst()
                .orElse("");
        }
    }

    /**
     * The whole list as one {@code name: value, name: value} line.
     */
    record FreeText(String raw) implements ArgumentEditMode {

        public FreeText {
            raw = raw == null ? "" : raw;
        }

        public static FreeText of(List<CallArgument> args) {
            return new FreeText(CallArgumentCodec.format(args));
        }

        @Override
        public List<CallArgument> args() {
            return CallArgumentCodec.parse(raw);
        }
    }
}
