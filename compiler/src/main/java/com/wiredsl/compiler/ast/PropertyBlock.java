package com.wiredsl.compiler.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entries of a {@code theme}, {@code colors} or {@code mocks} block, in declaration order.
 */
public record PropertyBlock(Map<String, PropValue> entries, Node.SourceLocation location) {

    public PropertyBlock {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static PropertyBlock of(Map<String, PropValue> entries) {
        return new PropertyBlock(entries, null);
    }
}
