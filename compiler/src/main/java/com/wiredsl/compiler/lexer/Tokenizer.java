package com.wiredsl.compiler.lexer;

import com.wiredsl.compiler.parser.WireLexer;

import org.antlr.v4.runtime.CharStreams;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts wire source text into tokens.
 * Wraps the generated {@link WireLexer}; whitespace and comments are skipped by the grammar,
 * and the first {@code ERROR_CHAR} token aborts tokenizing.
 * <p>
 * Instances hold no state, but each call builds a fresh lexer so concurrent use is safe.
 */
public class Tokenizer {

    public LexResult tokenize(String source) {
        WireLexer lexer = new WireLexer(CharStreams.fromString(source == null ? "" : source));
        lexer.removeErrorListeners();

        List<Token> tokens = new ArrayList<>();
        while (true) {
            org.antlr.v4.runtime.Token raw = lexer.nextToken();
            int line = raw.getLine();
            int column = raw.getCharPositionInLine() + 1;

            if (raw.getType() == org.antlr.v4.runtime.Token.EOF) {
                tokens.add(Token.eof(line, column));
                return new LexResult.Success(tokens);
            }
            if (raw.getType() == WireLexer.ERROR_CHAR) {
                char c = raw.getText().isEmpty() ? '\0' : raw.getText().charAt(0);
                return new LexResult.Failure(new LexError(line, column, raw.getStartIndex(), c));
            }

            TokenKind kind = TokenKind.fromAntlrType(raw.getType());
            if (kind != null) {
                tokens.add(new Token(kind, raw.getText(), line, column));
            }
        }
    }
}
