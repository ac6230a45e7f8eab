package com.wiredsl.compiler.ir;

/**
 * Reference from a container to one of its children.
 *
 * @param slot {@code child}, {@code cell}, {@code left} or {@code right}
 * @param ref  id of the child node
 * @param span grid span for cell slots, null otherwise
 */
public record ChildRef(String slot, String ref, Integer span) {

    public static final String CHILD = "child";
    public static final String CELL = "cell";
    public static final String LEFT = "left";
    public static final String RIGHT = "right";

    public static ChildRef child(String ref) {
        return new ChildRef(CHILD, ref, null);
    }

    public static ChildRef cell(String ref, int span) {
        return new ChildRef(CELL, ref, span);
    }

    public int spanOrOne() {
        return span == null ? 1 : span;
    }
}
