package com.wiredsl.compiler.ir;

/**
 * Main-axis distribution of leftover space in a stack.
 */
public enum Justify {
    STRETCH("stretch"),
    START("start"),
    CENTER("center"),
    END("end"),
    SPACE_BETWEEN("spaceBetween"),
    SPACE_AROUND("spaceAround");

    private final String id;

    Justify(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Justify fromName(String name) {
        for (Justify j : values()) {
            if (j.id.equals(name)) {
                return j;
            }
        }
        return null;
    }
}
