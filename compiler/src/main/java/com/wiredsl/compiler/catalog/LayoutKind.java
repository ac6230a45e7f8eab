package com.wiredsl.compiler.catalog;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.wiredsl.compiler.catalog.PropertyRule.*;

/**
 * Built-in layout containers and the parameters each accepts.
 * Cells are not a layout kind; their rules live in {@link #CELL_RULES}.
 */
public enum LayoutKind {
    STACK("stack",
        choice("direction", "vertical", "horizontal"),
        spacing("gap"),
        spacing("padding"),
        choice("align", "start", "center", "end", "stretch"),
        choice("justify", "stretch", "start", "center", "end", "spaceBetween", "spaceAround"),
        color("background")),
    GRID("grid",
        integer("columns", 1.0, 12.0).asRequired(),
        spacing("gap"),
        spacing("padding"),
        integer("rowHeight", 0.0, null),
        choice("justify", "stretch", "start", "center", "end", "spaceBetween", "spaceAround"),
        color("background")),
    SPLIT("split",
        positive("sidebar").asRequired(),
        spacing("gap"),
        spacing("padding"),
        color("background"),
        bool("border")),
    PANEL("panel",
        spacing("padding"),
        spacing("gap"),
        color("background"),
        bool("border")),
    CARD("card",
        spacing("padding"),
        spacing("gap"),
        choice("radius", "none", "sm", "md", "lg"),
        bool("border"),
        color("background"));

    /**
     * Properties a {@code cell} accepts inside a grid.
     */
    public static final Map<String, PropertyRule> CELL_RULES;

    private static final Map<String, LayoutKind> BY_NAME = new HashMap<>();

    static {
        for (LayoutKind kind : values()) {
            BY_NAME.put(kind.typeName, kind);
        }
        Map<String, PropertyRule> cell = new LinkedHashMap<>();
        cell.put("span", integer("span", 1.0, 12.0));
        cell.put("align", choice("align", "start", "center", "end", "stretch"));
        cell.put("width", size("width"));
        cell.put("height", size("height"));
        CELL_RULES = Collections.unmodifiableMap(cell);
    }

    private final String typeName;
    private final Map<String, PropertyRule> properties;

    LayoutKind(String typeName, PropertyRule... rules) {
        this.typeName = typeName;
        Map<String, PropertyRule> map = new LinkedHashMap<>();
        for (PropertyRule rule : rules) {
            map.put(rule.name(), rule);
        }
        map.put("width", size("width"));
        map.put("height", size("height"));
        this.properties = Collections.unmodifiableMap(map);
    }

    public String typeName() {
        return typeName;
    }

    public Map<String, PropertyRule> properties() {
        return properties;
    }

    public PropertyRule rule(String property) {
        return properties.get(property);
    }

    /**
     * Look up a layout by its source name, or null if unknown.
     */
    public static LayoutKind fromName(String name) {
        return BY_NAME.get(name);
    }

    public static String suggest(String name) {
        return Suggestions.closest(name, BY_NAME.keySet());
    }
}
