package com.wiredsl.compiler;

import com.wiredsl.compiler.diagnostics.Diagnostic;
import com.wiredsl.compiler.ir.IrDocument;

import java.util.List;

/**
 * Outcome of compiling wire source to IR.
 */
public sealed interface CompileResult {

    record Success(IrDocument document, List<Diagnostic> warnings) implements CompileResult {
        public Success {
            warnings = List.copyOf(warnings);
        }
    }

    /**
     * @param diagnostics errors first, then any warnings collected before the failing stage stopped
     */
    record Failure(List<Diagnostic> diagnostics) implements CompileResult {
        public Failure {
            diagnostics = List.copyOf(diagnostics);
        }

        public List<Diagnostic> errors() {
            return diagnostics.stream().filter(Diagnostic::isError).toList();
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * Return the document, or throw {@link WireCompileException} carrying the diagnostics.
     */
    default IrDocument orThrow() {
        if (this instanceof Success s) {
            return s.document();
        }
        throw new WireCompileException(((Failure) this).diagnostics());
    }

    default List<Diagnostic> diagnostics() {
        if (this instanceof Success s) {
            return s.warnings();
        }
        return ((Failure) this).diagnostics();
    }
}
