package com.wiredsl.compiler.ast;

/**
 * Anything that may appear inside a {@code cell} block or a component definition body.
 */
public sealed interface CellChild extends LayoutChild permits LayoutNode, ComponentNode {
}
