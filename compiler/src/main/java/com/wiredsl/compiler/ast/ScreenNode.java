package com.wiredsl.compiler.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code screen Name(params) { layout ... }}.
 * The grammar accepts any number of layouts so the IR generator can report the
 * "exactly one root layout" rule instead of the parser.
 */
public record ScreenNode(
    String name,
    Map<String, PropValue> params,
    List<LayoutNode> layouts,
    Node.SourceLocation loc
) implements Node {

    public ScreenNode {
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        layouts = List.copyOf(layouts);
    }

    public static ScreenNode of(String name, LayoutNode rootLayout) {
        return new ScreenNode(name, Map.of(), List.of(rootLayout), null);
    }

    /**
     * The root layout, or null if the screen declares none.
     */
    public LayoutNode rootLayout() {
        return layouts.isEmpty() ? null : layouts.get(0);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitScreen(this);
    }

    @Override
    public SourceLocation location() {
        return loc;
    }
}
