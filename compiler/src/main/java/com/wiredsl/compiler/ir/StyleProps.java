package com.wiredsl.compiler.ir;

/**
 * Resolved presentational properties of a node.
 * A null width or height leaves the choice to the parent container.
 */
public record StyleProps(
    double padding,
    double gap,
    Align align,
    Justify justify,
    Size width,
    Size height,
    String background
) {

    public static final StyleProps NONE = new StyleProps(0, 0, null, null, null, null, null);

    public static StyleProps sized(Size width, Size height) {
        return new StyleProps(0, 0, null, null, width, height, null);
    }
}
