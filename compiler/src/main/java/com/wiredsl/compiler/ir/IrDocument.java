package com.wiredsl.compiler.ir;

/**
 * Top-level IR contract handed to the layout engine and renderers.
 */
public record IrDocument(String irVersion, IrProject project) {

    public static final String VERSION = "1.0";

    public static IrDocument of(IrProject project) {
        return new IrDocument(VERSION, project);
    }
}
