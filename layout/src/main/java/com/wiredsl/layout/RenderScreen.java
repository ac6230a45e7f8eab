package com.wiredsl.layout;

import com.wiredsl.compiler.ir.Viewport;

/**
 * Layout result for one screen.
 */
public record RenderScreen(String screenId, String name, Viewport viewport, RenderNode root) {
}
