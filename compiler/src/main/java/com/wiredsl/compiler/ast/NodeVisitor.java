package com.wiredsl.compiler.ast;

/**
 * Visitor interface for traversing wire AST nodes.
 * Adding a node kind adds a method here, so every visitor must handle it.
 *
 * @param <T> The return type of the visit methods
 */
public interface NodeVisitor<T> {

    T visitProject(ProjectNode node);
    T visitDefinition(DefinitionNode node);
    T visitScreen(ScreenNode node);

    T visitLayout(LayoutNode node);
    T visitCell(CellNode node);
    T visitComponent(ComponentNode node);
}
