package com.wiredsl.compiler.ir;

/**
 * Cross-axis placement of children that do not fill their container.
 */
public enum Align {
    START("start"),
    CENTER("center"),
    END("end"),
    STRETCH("stretch");

    private final String id;

    Align(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Align fromName(String name) {
        for (Align a : values()) {
            if (a.id.equals(name)) {
                return a;
            }
        }
        return null;
    }
}
