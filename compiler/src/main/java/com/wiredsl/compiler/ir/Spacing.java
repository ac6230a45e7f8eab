package com.wiredsl.compiler.ir;

/**
 * Named spacing tokens and their pixel values.
 */
public enum Spacing {
    NONE("none", 0),
    XS("xs", 4),
    SM("sm", 8),
    MD("md", 16),
    LG("lg", 24),
    XL("xl", 32);

    private final String token;
    private final int px;

    Spacing(String token, int px) {
        this.token = token;
        this.px = px;
    }

    public String token() {
        return token;
    }

    public int px() {
        return px;
    }

    /**
     * Resolve a token name, or null if it is not a spacing token.
     */
    public static Spacing fromToken(String token) {
        for (Spacing s : values()) {
            if (s.token.equals(token)) {
                return s;
            }
        }
        return null;
    }
}
