package com.wiredsl.compiler.parser;

import com.wiredsl.compiler.diagnostics.Diagnostic;

/**
 * A syntax error reported by {@link SourceParser}.
 *
 * @param line     1-based line of the offending token
 * @param column   1-based column of the offending token
 * @param expected the token set the parser expected, e.g. {@code {'}', 'component'}}
 * @param found    text of the offending token
 * @param message  the parser's description of the problem
 */
public record ParseError(int line, int column, String expected, String found, String message) {

    public Diagnostic toDiagnostic() {
        Diagnostic d = Diagnostic.error("PARSE", message, line, column);
        if (expected != null && !expected.isEmpty()) {
            d = d.withSuggestion("expected " + expected);
        }
        return d;
    }
}
