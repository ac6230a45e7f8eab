package com.wiredsl.compiler.parser;

import com.wiredsl.compiler.lexer.Token;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ListTokenSource;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a token list into a concrete syntax tree using the generated {@link WireParser}.
 * <p>
 * A new parser is built for every call. ANTLR's default error strategy recovers from
 * syntax errors, so a single call can report several of them.
 */
public class SourceParser {

    public ParseResult parse(List<Token> tokens) {
        List<org.antlr.v4.runtime.Token> antlrTokens = new ArrayList<>(tokens.size() + 1);
        for (Token token : tokens) {
            antlrTokens.add(toAntlrToken(token, antlrTokens.size()));
        }
        if (antlrTokens.isEmpty() || antlrTokens.get(antlrTokens.size() - 1).getType() != org.antlr.v4.runtime.Token.EOF) {
            Token last = tokens.isEmpty() ? Token.eof(1, 1) : tokens.get(tokens.size() - 1);
            antlrTokens.add(toAntlrToken(Token.eof(last.line(), last.column()), antlrTokens.size()));
        }

        WireParser parser = new WireParser(new CommonTokenStream(new ListTokenSource(antlrTokens)));
        parser.removeErrorListeners();
        CollectingErrorListener listener = new CollectingErrorListener();
        parser.addErrorListener(listener);

        WireParser.ProjectContext tree = parser.project();

        if (!listener.errors.isEmpty()) {
            return new ParseResult.Failure(listener.errors);
        }
        return new ParseResult.Success(tree);
    }

    private static org.antlr.v4.runtime.Token toAntlrToken(Token token, int index) {
        CommonToken t = new CommonToken(token.kind().antlrType(), token.lexeme());
        t.setLine(token.line());
        t.setCharPositionInLine(token.column() - 1);
        t.setTokenIndex(index);
        return t;
    }

    private static final class CollectingErrorListener extends BaseErrorListener {
        private final List<ParseError> errors = new ArrayList<>();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            String found = "<EOF>";
            if (offendingSymbol instanceof org.antlr.v4.runtime.Token t && t.getType() != org.antlr.v4.runtime.Token.EOF) {
                found = t.getText();
            }
            String expected = "";
            if (recognizer instanceof Parser p) {
                expected = p.getExpectedTokens().toString(p.getVocabulary());
            }
            errors.add(new ParseError(line, charPositionInLine + 1, expected, found, msg));
        }
    }
}
