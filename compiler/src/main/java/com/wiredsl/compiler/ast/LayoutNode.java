package com.wiredsl.compiler.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code layout type(params) { children }}.
 */
public record LayoutNode(
    String layoutType,
    Map<String, PropValue> params,
    List<LayoutChild> children,
    Node.SourceLocation loc
) implements CellChild {

    public LayoutNode {
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        children = List.copyOf(children);
    }

    public static LayoutNode of(String layoutType, Map<String, PropValue> params, List<LayoutChild> children) {
        return new LayoutNode(layoutType, params, children, null);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitLayout(this);
    }

    @Override
    public SourceLocation location() {
        return loc;
    }
}
