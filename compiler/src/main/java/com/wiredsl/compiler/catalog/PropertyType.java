package com.wiredsl.compiler.catalog;

/**
 * Value kinds accepted by catalog properties.
 */
public enum PropertyType {
    /** Any literal, kept as text. */
    STRING,
    /** Numeric literal, optionally range-checked. */
    NUMBER,
    /** Whole numeric literal, optionally range-checked. */
    INTEGER,
    /** {@code true}/{@code false} or {@code 1}/{@code 0}. */
    BOOLEAN,
    /** One of a fixed set of identifiers. */
    ENUM,
    /** Hex color, named color or {@code true}/{@code false}. */
    COLOR,
    /** Spacing token ({@code none..xl}) or a pixel number. */
    SPACING,
    /** Number (fixed px), {@code fill}, {@code content} or {@code "N%"}. */
    SIZE
}
