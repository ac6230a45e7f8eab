package com.wiredsl.compiler.ir;

import com.wiredsl.compiler.ast.Node.SourceLocation;
import com.wiredsl.compiler.ast.PropValue;
import com.wiredsl.compiler.catalog.PropertyRule;
import com.wiredsl.compiler.catalog.PropertyType;
import com.wiredsl.compiler.catalog.Suggestions;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates literal properties against catalog rules and converts them to typed values.
 * <p>
 * Spacing values come out as {@link PropertyValue.Choice} (token) or {@link PropertyValue.Number} (px).
 * Size values come out as {@link PropertyValue.Number} (px), {@link PropertyValue.Choice}
 * ({@code fill}/{@code content}) or {@link PropertyValue.Text} ({@code "N%"}).
 */
class PropertyChecker {

    private static final Pattern PERCENT = Pattern.compile("\\d+(\\.\\d+)?%");
    private static final List<String> SPACING_TOKENS = List.of("none", "xs", "sm", "md", "lg", "xl");

    private final List<SemanticError> errors;

    PropertyChecker(List<SemanticError> errors) {
        this.errors = errors;
    }

    /**
     * Check every property and every required rule.
     *
     * @param owner     name used in messages, e.g. {@code Button} or {@code layout grid}
     * @param rules     accepted properties
     * @param values    properties as written, after argument binding
     * @param unbound   required properties already reported as missing arguments
     * @param location  where to report problems
     * @return the valid properties converted to typed values, in source order
     */
    Map<String, PropertyValue> check(String owner, Map<String, PropertyRule> rules, Map<String, PropValue> values,
                                     Set<String> unbound, SourceLocation location) {
        Map<String, PropertyValue> typed = new LinkedHashMap<>();

        for (Map.Entry<String, PropValue> entry : values.entrySet()) {
            PropertyRule rule = rules.get(entry.getKey());
            if (rule == null) {
                errors.add(new SemanticError.UnknownProperty(owner, entry.getKey(),
                    Suggestions.closest(entry.getKey(), rules.keySet()), location));
                continue;
            }
            PropertyValue value = coerce(owner, rule, entry.getValue(), location);
            if (value != null) {
                typed.put(entry.getKey(), value);
            }
        }

        for (PropertyRule rule : rules.values()) {
            if (rule.required() && !values.containsKey(rule.name()) && !unbound.contains(rule.name())) {
                errors.add(new SemanticError.MissingProperty(owner, rule.name(), location));
            }
        }
        return typed;
    }

    /**
     * Convert one literal, or report it and return null.
     */
    PropertyValue coerce(String owner, PropertyRule rule, PropValue raw, SourceLocation location) {
        String text = raw.asString();
        switch (rule.type()) {
            case STRING:
                return new PropertyValue.Text(text);

            case NUMBER:
            case INTEGER: {
                Double number = toNumber(raw);
                if (number == null || (rule.type() == PropertyType.INTEGER && number != Math.rint(number))) {
                    return invalid(owner, rule, text, location);
                }
                if (!rule.inRange(number)) {
                    if (rule.minExclusive() && number <= rule.min()) {
                        return invalid(owner, rule, text, location);
                    }
                    errors.add(new SemanticError.OutOfRange(owner, rule.name(), number, rule.min(), rule.max(), location));
                    return null;
                }
                return new PropertyValue.Number(number);
            }

            case BOOLEAN:
                if ("true".equals(text) || "1".equals(text)) {
                    return new PropertyValue.Flag(true);
                }
                if ("false".equals(text) || "0".equals(text)) {
                    return new PropertyValue.Flag(false);
                }
                return invalid(owner, rule, text, location);

            case ENUM:
                if (!(raw instanceof PropValue.Num) && rule.options().contains(text)) {
                    return new PropertyValue.Choice(text);
                }
                return invalid(owner, rule, text, location);

            case COLOR:
                if (raw instanceof PropValue.Num) {
                    return invalid(owner, rule, text, location);
                }
                return new PropertyValue.Text(text);

            case SPACING: {
                if (SPACING_TOKENS.contains(text)) {
                    return new PropertyValue.Choice(text);
                }
                Double number = toNumber(raw);
                if (number != null && number >= 0) {
                    return new PropertyValue.Number(number);
                }
                return invalid(owner, rule, text, location);
            }

            case SIZE: {
                if ("fill".equals(text) || "content".equals(text)) {
                    return new PropertyValue.Choice(text);
                }
                if (PERCENT.matcher(text).matches()) {
                    return new PropertyValue.Text(text);
                }
                Double number = toNumber(raw);
                if (number != null && number >= 0) {
                    return new PropertyValue.Number(number);
                }
                return invalid(owner, rule, text, location);
            }

            default:
                return invalid(owner, rule, text, location);
        }
    }

    private PropertyValue invalid(String owner, PropertyRule rule, String text, SourceLocation location) {
        errors.add(new SemanticError.InvalidValue(owner, rule.name(), text, rule.describe(), location));
        return null;
    }

    private static Double toNumber(PropValue raw) {
        double value;
        if (raw instanceof PropValue.Num num) {
            value = num.value();
        } else if (raw instanceof PropValue.Str str) {
            try {
                value = Double.parseDouble(str.value().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        // "NaN", "Infinity" and overflowing literals parse but never make a usable size
        return Double.isFinite(value) ? value : null;
    }

    // --- Typed value helpers used when building style props ---

    /**
     * Pixels for a spacing value, or the fallback when absent.
     */
    static double spacingPx(PropertyValue value, double fallback) {
        if (value instanceof PropertyValue.Number n) {
            return n.value();
        }
        if (value instanceof PropertyValue.Choice c) {
            Spacing spacing = Spacing.fromToken(c.value());
            return spacing == null ? fallback : spacing.px();
        }
        return fallback;
    }

    /**
     * Size policy for a size value, or null when absent.
     */
    static Size size(PropertyValue value) {
        if (value instanceof PropertyValue.Number n) {
            return Size.fixed(n.value());
        }
        if (value instanceof PropertyValue.Choice c) {
            return "fill".equals(c.value()) ? Size.FILL : Size.CONTENT;
        }
        if (value instanceof PropertyValue.Text t && t.value().endsWith("%")) {
            return Size.percent(Double.parseDouble(t.value().substring(0, t.value().length() - 1)));
        }
        return null;
    }
}
