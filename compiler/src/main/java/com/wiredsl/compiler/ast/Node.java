package com.wiredsl.compiler.ast;

/**
 * Base sealed interface for all AST nodes of a wire document.
 * The AST is produced once per parse and is immutable.
 */
public sealed interface Node permits ProjectNode, DefinitionNode, ScreenNode, LayoutChild {

    /**
     * Accept a visitor for AST traversal.
     */
    <T> T accept(NodeVisitor<T> visitor);

    /**
     * Get the source location of the node's first token, or null when built by hand.
     */
    SourceLocation location();

    /**
     * Source location in the original text (1-based).
     */
    record SourceLocation(int line, int column) {
        public static SourceLocation of(int line, int column) {
            return new SourceLocation(line, column);
        }

        @Override
        public String toString() {
            return line + ":" + column;
        }
    }
}
