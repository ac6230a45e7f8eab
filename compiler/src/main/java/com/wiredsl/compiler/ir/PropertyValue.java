package com.wiredsl.compiler.ir;

/**
 * A component property value after validation against the catalog.
 */
public sealed interface PropertyValue {

    record Text(String value) implements PropertyValue {}

    record Number(double value) implements PropertyValue {}

    record Flag(boolean value) implements PropertyValue {}

    /** An enum member from the property's declared options. */
    record Choice(String value) implements PropertyValue {}

    /**
     * Text form of the value, as a renderer would print it.
     */
    default String asText() {
        if (this instanceof Text t) {
            return t.value();
        } else if (this instanceof Number n) {
            return com.wiredsl.compiler.ast.PropValue.formatNumber(n.value());
        } else if (this instanceof Flag f) {
            return Boolean.toString(f.value());
        }
        return ((Choice) this).value();
    }

    /**
     * Numeric form, or the fallback when the value is not numeric.
     */
    default double asNumber(double fallback) {
        if (this instanceof Number n) {
            return n.value();
        }
        if (this instanceof Text t) {
            try {
                return Double.parseDouble(t.value().trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    default boolean asFlag() {
        return this instanceof Flag f && f.value();
    }
}
