package com.wiredsl.compiler.parser;

import java.util.List;

/**
 * Result of parsing a token list.
 */
public sealed interface ParseResult {

    record Success(WireParser.ProjectContext tree) implements ParseResult {}

    record Failure(List<ParseError> errors) implements ParseResult {
        public Failure {
            errors = List.copyOf(errors);
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default List<ParseError> errors() {
        return this instanceof Failure f ? f.errors() : List.of();
    }
}
