package com.wiredsl.compiler.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalog entry for a built-in component kind.
 */
public record ComponentSpec(String name, ComponentCategory category, Map<String, PropertyRule> properties) {

    public ComponentSpec {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public PropertyRule rule(String property) {
        return properties.get(property);
    }

    public List<PropertyRule> requiredProperties() {
        List<PropertyRule> required = new ArrayList<>();
        for (PropertyRule rule : properties.values()) {
            if (rule.required()) {
                required.add(rule);
            }
        }
        return required;
    }

    static ComponentSpec of(String name, ComponentCategory category, PropertyRule... rules) {
        Map<String, PropertyRule> map = new LinkedHashMap<>();
        for (PropertyRule rule : rules) {
            map.put(rule.name(), rule);
        }
        // Every node may size itself explicitly
        map.putIfAbsent("width", PropertyRule.size("width"));
        map.putIfAbsent("height", PropertyRule.size("height"));
        return new ComponentSpec(name, category, map);
    }
}
