package com.wiredsl.compiler.catalog;

import java.util.List;

/**
 * Declared shape of one property of a component or layout.
 *
 * @param name     property name as written in source
 * @param type     accepted value kind
 * @param required whether the property must be present
 * @param options  allowed identifiers for {@link PropertyType#ENUM}, empty otherwise
 * @param min      lower bound for numbers, or null
 * @param max      inclusive upper bound for numbers, or null
 * @param minExclusive whether {@code min} itself is rejected
 */
public record PropertyRule(
    String name,
    PropertyType type,
    boolean required,
    List<String> options,
    Double min,
    Double max,
    boolean minExclusive
) {

    public PropertyRule {
        options = List.copyOf(options);
    }

    public static PropertyRule string(String name) {
        return new PropertyRule(name, PropertyType.STRING, false, List.of(), null, null, false);
    }

    public static PropertyRule number(String name) {
        return new PropertyRule(name, PropertyType.NUMBER, false, List.of(), null, null, false);
    }

    public static PropertyRule number(String name, Double min, Double max) {
        return new PropertyRule(name, PropertyType.NUMBER, false, List.of(), min, max, false);
    }

    /**
     * Whole number within inclusive bounds.
     */
    public static PropertyRule integer(String name, Double min, Double max) {
        return new PropertyRule(name, PropertyType.INTEGER, false, List.of(), min, max, false);
    }

    /**
     * Number strictly greater than zero.
     */
    public static PropertyRule positive(String name) {
        return new PropertyRule(name, PropertyType.NUMBER, false, List.of(), 0.0, null, true);
    }

    public static PropertyRule bool(String name) {
        return new PropertyRule(name, PropertyType.BOOLEAN, false, List.of(), null, null, false);
    }

    public static PropertyRule choice(String name, List<String> options) {
        return new PropertyRule(name, PropertyType.ENUM, false, options, null, null, false);
    }

    public static PropertyRule choice(String name, String... options) {
        return choice(name, List.of(options));
    }

    public static PropertyRule color(String name) {
        return new PropertyRule(name, PropertyType.COLOR, false, List.of(), null, null, false);
    }

    public static PropertyRule spacing(String name) {
        return new PropertyRule(name, PropertyType.SPACING, false, List.of(), null, null, false);
    }

    public static PropertyRule size(String name) {
        return new PropertyRule(name, PropertyType.SIZE, false, List.of(), null, null, false);
    }

    public PropertyRule asRequired() {
        return new PropertyRule(name, type, true, options, min, max, minExclusive);
    }

    /**
     * Short human description of what the property accepts, used in diagnostics.
     */
    public String describe() {
        return switch (type) {
            case STRING -> "a string";
            case NUMBER -> min != null && max != null
                ? "a number between " + fmt(min) + " and " + fmt(max)
                : min != null ? "a number " + (minExclusive ? "> " : ">= ") + fmt(min) : "a number";
            case INTEGER -> min != null && max != null
                ? "a whole number between " + fmt(min) + " and " + fmt(max)
                : min != null ? "a whole number >= " + fmt(min) : "a whole number";
            case BOOLEAN -> "true or false";
            case ENUM -> "one of " + String.join(", ", options);
            case COLOR -> "a color";
            case SPACING -> "a spacing token (none, xs, sm, md, lg, xl) or a number";
            case SIZE -> "a number, fill, content or a percentage like \"50%\"";
        };
    }

    /**
     * Whether a finite number lies within the bounds.
     */
    public boolean inRange(double value) {
        if (min != null && (minExclusive ? value <= min : value < min)) {
            return false;
        }
        return max == null || value <= max;
    }

    private static String fmt(double v) {
        return v == Math.rint(v) ? Long.toString((long) v) : Double.toString(v);
    }
}
