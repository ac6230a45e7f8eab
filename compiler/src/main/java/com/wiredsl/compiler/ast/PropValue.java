package com.wiredsl.compiler.ast;

/**
 * Literal value of a property: {@code key: value}.
 */
public sealed interface PropValue {

    /**
     * Double-quoted string, quotes stripped and escapes resolved.
     */
    record Str(String value) implements PropValue {
        @Override
        public String asString() {
            return value;
        }
    }

    /**
     * Numeric literal. The source text is kept for messages.
     */
    record Num(double value, String raw) implements PropValue {
        public static Num of(double value) {
            return new Num(value, formatNumber(value));
        }

        @Override
        public String asString() {
            return raw;
        }

        public boolean isInteger() {
            return value == Math.rint(value) && !Double.isInfinite(value);
        }
    }

    /**
     * Bare identifier, treated as an enum value.
     */
    record Ident(String name) implements PropValue {
        @Override
        public String asString() {
            return name;
        }
    }

    /**
     * Hex color such as {@code #3B82F6}.
     */
    record Hex(String color) implements PropValue {
        @Override
        public String asString() {
            return color;
        }
    }

    String asString();

    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
