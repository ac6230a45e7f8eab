package com.wiredsl.compiler.ir;

/**
 * Sizing policy for one axis of a node.
 */
public sealed interface Size {

    /** Exact pixel size. */
    record Fixed(double px) implements Size {}

    /** Share of the space left over by non-fill siblings. */
    record Fill() implements Size {}

    /** Intrinsic size of the node's content. */
    record Content() implements Size {}

    /** Percentage of the parent's content box. */
    record Percent(double pct) implements Size {}

    Size FILL = new Fill();
    Size CONTENT = new Content();

    static Size fixed(double px) {
        return new Fixed(px);
    }

    static Size percent(double pct) {
        return new Percent(pct);
    }

    /**
     * Source-style rendering: {@code 120}, {@code fill}, {@code content}, {@code 50%}.
     */
    default String describe() {
        if (this instanceof Fixed f) {
            return com.wiredsl.compiler.ast.PropValue.formatNumber(f.px());
        } else if (this instanceof Percent p) {
            return com.wiredsl.compiler.ast.PropValue.formatNumber(p.pct()) + "%";
        } else if (this instanceof Fill) {
            return "fill";
        }
        return "content";
    }
}
