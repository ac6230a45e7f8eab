package com.wiredsl.layout;

/**
 * Raised inside the layout engine when the IR is internally inconsistent.
 * The engine catches it, records it on the render tree and emits a zero box instead.
 */
public class LayoutInvariantViolation extends RuntimeException {

    private final String nodeRef;

    public LayoutInvariantViolation(String message, String nodeRef) {
        super(message + " [" + nodeRef + "]");
        this.nodeRef = nodeRef;
    }

    public String getNodeRef() {
        return nodeRef;
    }

    public static LayoutInvariantViolation unresolvedRef(String ref) {
        return new LayoutInvariantViolation("Child reference does not resolve to a node", ref);
    }

    public static LayoutInvariantViolation cycle(String ref) {
        return new LayoutInvariantViolation("Node is its own ancestor", ref);
    }

    public static LayoutInvariantViolation nonFinite(String what, String ref) {
        return new LayoutInvariantViolation("Computed " + what + " is not finite", ref);
    }
}
