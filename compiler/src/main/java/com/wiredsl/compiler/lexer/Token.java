package com.wiredsl.compiler.lexer;

/**
 * A single lexical token. Line and column are 1-based.
 */
public record Token(TokenKind kind, String lexeme, int line, int column) {

    public static Token eof(int line, int column) {
        return new Token(TokenKind.EOF, "<EOF>", line, column);
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return kind + "('" + lexeme + "') at " + line + ":" + column;
    }
}
