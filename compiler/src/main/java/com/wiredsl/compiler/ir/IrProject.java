package com.wiredsl.compiler.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalized project: theme, data tables, screens and the flat node table.
 */
public record IrProject(
    String id,
    String name,
    ThemeConfig config,
    Map<String, String> colors,
    Map<String, String> mocks,
    List<IrScreen> screens,
    Map<String, IrNode> nodes
) {

    public IrProject {
        colors = Collections.unmodifiableMap(new LinkedHashMap<>(colors));
        mocks = Collections.unmodifiableMap(new LinkedHashMap<>(mocks));
        screens = List.copyOf(screens);
        nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    public IrNode node(String id) {
        return nodes.get(id);
    }

    public IrScreen screen(String name) {
        for (IrScreen screen : screens) {
            if (screen.name().equals(name)) {
                return screen;
            }
        }
        return null;
    }
}
