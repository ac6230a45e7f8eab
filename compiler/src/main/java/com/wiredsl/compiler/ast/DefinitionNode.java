package com.wiredsl.compiler.ast;

import java.util.List;

/**
 * {@code define Component "Name" { body }}: a reusable subtree expanded at every reference.
 */
public record DefinitionNode(
    String name,
    List<CellChild> body,
    Node.SourceLocation loc
) implements Node {

    public DefinitionNode {
        body = List.copyOf(body);
    }

    public static DefinitionNode of(String name, CellChild body) {
        return new DefinitionNode(name, List.of(body), null);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitDefinition(this);
    }

    @Override
    public SourceLocation location() {
        return loc;
    }
}
