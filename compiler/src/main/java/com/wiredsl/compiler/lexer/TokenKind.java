package com.wiredsl.compiler.lexer;

import com.wiredsl.compiler.parser.WireLexer;

/**
 * Lexical categories of the wire language.
 * Each kind maps onto the token type of the generated {@link WireLexer}.
 */
public enum TokenKind {
    // Keywords
    PROJECT(WireLexer.PROJECT, true),
    SCREEN(WireLexer.SCREEN, true),
    LAYOUT(WireLexer.LAYOUT, true),
    COMPONENT(WireLexer.COMPONENT, true),
    COMPONENT_KW(WireLexer.COMPONENT_KW, true),
    CELL(WireLexer.CELL, true),
    THEME(WireLexer.THEME, true),
    COLORS(WireLexer.COLORS, true),
    MOCKS(WireLexer.MOCKS, true),
    DEFINE(WireLexer.DEFINE, true),

    // Punctuation
    LBRACE(WireLexer.LBRACE, false),
    RBRACE(WireLexer.RBRACE, false),
    LPAREN(WireLexer.LPAREN, false),
    RPAREN(WireLexer.RPAREN, false),
    COLON(WireLexer.COLON, false),
    COMMA(WireLexer.COMMA, false),

    // Literals
    STRING(WireLexer.STRING, false),
    NUMBER(WireLexer.NUMBER, false),
    HEX_COLOR(WireLexer.HEX_COLOR, false),
    IDENTIFIER(WireLexer.IDENTIFIER, false),

    EOF(org.antlr.v4.runtime.Token.EOF, false);

    private final int antlrType;
    private final boolean keyword;

    TokenKind(int antlrType, boolean keyword) {
        this.antlrType = antlrType;
        this.keyword = keyword;
    }

    public int antlrType() {
        return antlrType;
    }

    public boolean isKeyword() {
        return keyword;
    }

    /**
     * Look up the kind for a generated token type, or null for skipped/error types.
     */
    public static TokenKind fromAntlrType(int type) {
        for (TokenKind kind : values()) {
            if (kind.antlrType == type) {
                return kind;
            }
        }
        return null;
    }
}
