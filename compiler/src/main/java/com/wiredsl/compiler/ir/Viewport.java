package com.wiredsl.compiler.ir;

/**
 * Width and height in pixels that a screen is laid out against.
 */
public record Viewport(double width, double height) {

    public static Viewport of(double width, double height) {
        return new Viewport(width, height);
    }
}
