package com.wiredsl.layout;

import java.util.List;

/**
 * Complete layout of a document: one render root per screen, in IR order.
 * Immutable, so it may be shared with renderers on other threads.
 *
 * @param violations internal inconsistencies the engine recovered from by emitting zero boxes
 */
public record RenderTree(List<RenderScreen> screens, List<String> violations) {

    public RenderTree {
        screens = List.copyOf(screens);
        violations = List.copyOf(violations);
    }

    public RenderScreen screen(String name) {
        for (RenderScreen screen : screens) {
            if (screen.name().equals(name)) {
                return screen;
            }
        }
        return null;
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }
}
