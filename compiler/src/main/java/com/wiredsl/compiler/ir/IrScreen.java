package com.wiredsl.compiler.ir;

/**
 * A screen of the IR. The root reference points into {@link IrProject#nodes()}.
 */
public record IrScreen(String id, String name, Viewport viewport, String background, String rootRef) {
}
