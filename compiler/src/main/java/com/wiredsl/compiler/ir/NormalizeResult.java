package com.wiredsl.compiler.ir;

import java.util.List;

/**
 * Result of {@link IrGenerator#normalize}.
 */
public sealed interface NormalizeResult {

    record Success(IrDocument document, List<SemanticError> warnings) implements NormalizeResult {
        public Success {
            warnings = List.copyOf(warnings);
        }
    }

    /**
     * @param errors   fatal problems, never empty
     * @param warnings non-fatal problems collected before generation stopped
     */
    record Failure(List<SemanticError> errors, List<SemanticError> warnings) implements NormalizeResult {
        public Failure {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default IrDocument documentOrNull() {
        return this instanceof Success s ? s.document() : null;
    }

    default List<SemanticError> errors() {
        return this instanceof Failure f ? f.errors() : List.of();
    }

    default List<SemanticError> warnings() {
        if (this instanceof Success s) {
            return s.warnings();
        }
        return ((Failure) this).warnings();
    }
}
