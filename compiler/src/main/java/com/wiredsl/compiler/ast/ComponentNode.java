package com.wiredsl.compiler.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code component Type key: value ...}. The type may name a built-in or a defined component.
 */
public record ComponentNode(
    String componentType,
    Map<String, PropValue> props,
    Node.SourceLocation loc
) implements CellChild {

    public ComponentNode {
        props = Collections.unmodifiableMap(new LinkedHashMap<>(props));
    }

    public static ComponentNode of(String componentType, Map<String, PropValue> props) {
        return new ComponentNode(componentType, props, null);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitComponent(this);
    }

    @Override
    public SourceLocation location() {
        return loc;
    }
}
