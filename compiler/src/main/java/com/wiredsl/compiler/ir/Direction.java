package com.wiredsl.compiler.ir;

public enum Direction {
    VERTICAL,
    HORIZONTAL;

    public String id() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }

    public static Direction fromName(String name) {
        return "horizontal".equals(name) ? HORIZONTAL : VERTICAL;
    }
}
