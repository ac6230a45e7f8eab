package com.wiredsl.compiler.lexer;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

/**
 * Unit tests for the tokenizer.
 */
class TokenizerTest {

    private final Tokenizer tokenizer = new Tokenizer();

    private List<Token> lex(String source) {
        LexResult result = tokenizer.tokenize(source);
        assertTrue(result.isSuccess(), () -> "lex failed: " + result);
        return result.tokens();
    }

    @Test
    void testProjectHeader() {
        List<Token> tokens = lex("project \"Admin\" { }");

        assertEquals(5, tokens.size());
        assertEquals(TokenKind.PROJECT, tokens.get(0).kind());
        assertEquals(TokenKind.STRING, tokens.get(1).kind());
        assertEquals("\"Admin\"", tokens.get(1).lexeme());
        assertEquals(TokenKind.LBRACE, tokens.get(2).kind());
        assertEquals(TokenKind.RBRACE, tokens.get(3).kind());
        assertEquals(TokenKind.EOF, tokens.get(4).kind());
    }

    @Test
    void testKeywordsAndIdentifiers() {
        List<Token> tokens = lex("component Component screens cell define colors mocks");

        assertEquals(TokenKind.COMPONENT, tokens.get(0).kind());
        assertEquals(TokenKind.COMPONENT_KW, tokens.get(1).kind());
        // Longest match wins over the keyword prefix
        assertEquals(TokenKind.IDENTIFIER, tokens.get(2).kind());
        assertEquals(TokenKind.CELL, tokens.get(3).kind());
        assertEquals(TokenKind.DEFINE, tokens.get(4).kind());
        assertEquals(TokenKind.COLORS, tokens.get(5).kind());
        assertEquals(TokenKind.MOCKS, tokens.get(6).kind());
        assertTrue(tokens.get(0).kind().isKeyword());
        assertFalse(tokens.get(2).kind().isKeyword());
    }

    @Test
    void testThemeAliases() {
        List<Token> tokens = lex("theme tokens style");

        assertEquals(TokenKind.THEME, tokens.get(0).kind());
        assertEquals(TokenKind.THEME, tokens.get(1).kind());
        assertEquals(TokenKind.THEME, tokens.get(2).kind());
    }

    @Test
    void testLiterals() {
        List<Token> tokens = lex("columns: 12 ratio: 1.5 color: #3B82F6 label: \"Say \\\"hi\\\"\"");

        assertEquals(TokenKind.IDENTIFIER, tokens.get(0).kind());
        assertEquals(TokenKind.COLON, tokens.get(1).kind());
        assertEquals(TokenKind.NUMBER, tokens.get(2).kind());
        assertEquals("12", tokens.get(2).lexeme());
        assertEquals(TokenKind.NUMBER, tokens.get(5).kind());
        assertEquals("1.5", tokens.get(5).lexeme());
        assertEquals(TokenKind.HEX_COLOR, tokens.get(8).kind());
        assertEquals(TokenKind.STRING, tokens.get(11).kind());
        assertEquals("\"Say \\\"hi\\\"\"", tokens.get(11).lexeme());
    }

    @Test
    void testCommentsAndPositions() {
        List<Token> tokens = lex("// header\n/* block\n comment */ screen Main");

        assertEquals(TokenKind.SCREEN, tokens.get(0).kind());
        assertEquals(3, tokens.get(0).line());
        assertEquals(13, tokens.get(0).column());
        assertEquals(TokenKind.IDENTIFIER, tokens.get(1).kind());
        assertEquals(20, tokens.get(1).column());
    }

    @Test
    void testEmptySource() {
        List<Token> tokens = lex("");

        assertEquals(1, tokens.size());
        assertTrue(tokens.get(0).is(TokenKind.EOF));
    }

    @Test
    void testUnexpectedCharacter() {
        LexResult result = tokenizer.tokenize("project \"A\" {\n  @ }");

        assertFalse(result.isSuccess());
        LexError error = ((LexResult.Failure) result).error();
        assertEquals('@', error.unexpectedChar());
        assertEquals(2, error.line());
        assertEquals(3, error.column());
        assertEquals("LEX", error.toDiagnostic().code());
        assertTrue(result.tokens().isEmpty());
    }

    @Test
    void testUnterminatedString() {
        LexResult result = tokenizer.tokenize("project \"Admin");

        assertFalse(result.isSuccess());
        LexError error = ((LexResult.Failure) result).error();
        assertEquals('"', error.unexpectedChar());
        assertEquals(9, error.column());
        assertNotNull(error.toDiagnostic().suggestion());
    }
}
