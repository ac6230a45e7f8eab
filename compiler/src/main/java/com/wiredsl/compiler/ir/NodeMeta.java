package com.wiredsl.compiler.ir;

/**
 * Provenance of an IR node.
 *
 * @param sourceNodeId {@code kind@line:column} of the AST node it came from
 * @param expandedFrom name of the definition it was expanded from, or null
 * @param line         1-based source line, 0 when unknown
 * @param column       1-based source column, 0 when unknown
 */
public record NodeMeta(String sourceNodeId, String expandedFrom, int line, int column) {

    public static NodeMeta of(String kind, int line, int column, String expandedFrom) {
        String source = line > 0 ? kind + "@" + line + ":" + column : null;
        return new NodeMeta(source, expandedFrom, line, column);
    }
}
