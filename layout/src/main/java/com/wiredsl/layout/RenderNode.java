package com.wiredsl.layout;

import java.util.List;

/**
 * A positioned box for one IR node. Coordinates are absolute within the screen.
 *
 * @param id       {@code screenId:ref}, unique within a render tree
 * @param overflow true when the box leaves its parent's content box, or its own content does not fit
 * @param ref      id of the IR node this box was computed for
 */
public record RenderNode(
    String id,
    double x,
    double y,
    double width,
    double height,
    boolean overflow,
    String ref,
    List<RenderNode> children
) {

    public RenderNode {
        children = List.copyOf(children);
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    /**
     * Find the box for an IR node in this subtree, or null.
     */
    public RenderNode find(String irRef) {
        if (ref.equals(irRef)) {
            return this;
        }
        for (RenderNode child : children) {
            RenderNode found = child.find(irRef);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * This node and all descendants in pre-order.
     */
    public List<RenderNode> flatten() {
        List<RenderNode> out = new java.util.ArrayList<>();
        collect(this, out);
        return out;
    }

    private static void collect(RenderNode node, List<RenderNode> out) {
        out.add(node);
        for (RenderNode child : node.children) {
            collect(child, out);
        }
    }
}
