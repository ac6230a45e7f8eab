package com.wiredsl.compiler;

import com.wiredsl.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown by {@link CompileResult#orThrow()} when compilation failed.
 */
public class WireCompileException extends RuntimeException {

    private final List<Diagnostic> diagnostics;

    public WireCompileException(List<Diagnostic> diagnostics) {
        super(summarize(diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    private static String summarize(List<Diagnostic> diagnostics) {
        long errors = diagnostics.stream().filter(Diagnostic::isError).count();
        StringBuilder sb = new StringBuilder("Compilation failed with ").append(errors).append(" error(s)");
        for (Diagnostic d : diagnostics) {
            if (d.isError()) {
                sb.append("\n  ").append(d.format());
            }
        }
        return sb.toString();
    }
}
