package com.wiredsl.compiler.ast;

/**
 * Anything that may appear inside a {@code layout} block: a component, a nested layout or a cell.
 */
public sealed interface LayoutChild extends Node permits CellChild, CellNode {
}
