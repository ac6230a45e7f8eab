package com.wiredsl.compiler.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code cell span: 4 { children }}. Cells may hold components and layouts but not other cells.
 */
public record CellNode(
    Map<String, PropValue> props,
    List<CellChild> children,
    Node.SourceLocation loc
) implements LayoutChild {

    public CellNode {
        props = Collections.unmodifiableMap(new LinkedHashMap<>(props));
        children = List.copyOf(children);
    }

    public static CellNode of(Map<String, PropValue> props, List<CellChild> children) {
        return new CellNode(props, children, null);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitCell(this);
    }

    @Override
    public SourceLocation location() {
        return loc;
    }
}
