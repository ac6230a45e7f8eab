package com.wiredsl.compiler.ir;

/**
 * Theme density. Scales fixed control heights in the layout engine.
 */
public enum Density {
    COMPACT("compact", 0.8),
    NORMAL("normal", 1.0),
    COMFORTABLE("comfortable", 1.25);

    private final String id;
    private final double factor;

    Density(String id, double factor) {
        this.id = id;
        this.factor = factor;
    }

    public String id() {
        return id;
    }

    public double factor() {
        return factor;
    }

    public static Density fromName(String name) {
        for (Density d : values()) {
            if (d.id.equals(name)) {
                return d;
            }
        }
        return null;
    }
}
