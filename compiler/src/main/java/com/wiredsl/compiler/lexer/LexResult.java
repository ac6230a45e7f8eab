package com.wiredsl.compiler.lexer;

import java.util.List;

/**
 * Outcome of {@link Tokenizer#tokenize(String)}.
 */
public sealed interface LexResult {
    record Success(List<Token> tokens) implements LexResult {
        public Success {
            tokens = List.copyOf(tokens);
        }
    }

    record Failure(LexError error) implements LexResult {}

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default List<Token> tokens() {
        return this instanceof Success s ? s.tokens() : List.of();
    }
}
