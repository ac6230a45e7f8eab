package com.wiredsl.compiler.ir;

import java.util.HashMap;
import java.util.Map;

/**
 * Assigns {@code prefix-N} ids with an independent counter per prefix, starting at 1.
 */
public class IdGenerator {

    private final Map<String, Integer> counters = new HashMap<>();

    public String next(String prefix) {
        int n = counters.merge(prefix, 1, Integer::sum);
        return prefix + "-" + n;
    }

    public String layout(String layoutType) {
        return next("layout-" + layoutType);
    }

    public String component(String componentType) {
        return next("component-" + componentType.toLowerCase(java.util.Locale.ROOT));
    }

    public String cell(String parentLayoutType) {
        return next("cell-" + parentLayoutType);
    }

    public void reset() {
        counters.clear();
    }
}
