package com.wiredsl.compiler.lexer;

import com.wiredsl.compiler.diagnostics.Diagnostic;

/**
 * An unrecognized character in the source text. Lexing stops at the first one.
 *
 * @param line           1-based line
 * @param column         1-based column
 * @param offset         0-based character offset in the source
 * @param unexpectedChar the offending character
 */
public record LexError(int line, int column, int offset, char unexpectedChar) {

    public String message() {
        return "Unexpected character '" + printable(unexpectedChar) + "'";
    }

    public Diagnostic toDiagnostic() {
        Diagnostic diagnostic = Diagnostic.error("LEX", message(), line, column);
        if (unexpectedChar == '"') {
            return diagnostic.withSuggestion("Close the string literal with a matching '\"'");
        }
        return diagnostic.withSuggestion("Remove the character or quote it inside a string");
    }

    private static String printable(char c) {
        return switch (c) {
            case '\n' -> "\\n";
            case '\t' -> "\\t";
            case '\r' -> "\\r";
            default -> String.valueOf(c);
        };
    }
}
