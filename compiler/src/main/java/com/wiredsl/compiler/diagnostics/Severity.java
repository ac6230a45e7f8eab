package com.wiredsl.compiler.diagnostics;

/**
 * Severity of a reported problem. Only errors block compilation.
 */
public enum Severity {
    ERROR,
    WARNING;

    public String label() {
        return name().toLowerCase();
    }
}
