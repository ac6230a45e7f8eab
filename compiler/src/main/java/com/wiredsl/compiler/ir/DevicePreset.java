package com.wiredsl.compiler.ir;

import java.util.Locale;

/**
 * Standard viewports selectable with the theme's {@code device} key.
 * The height is a baseline; content may extend past it.
 */
public enum DevicePreset {
    MOBILE("mobile", 375, 812),
    TABLET("tablet", 768, 1024),
    DESKTOP("desktop", 1280, 720),
    PRINT("print", 794, 1123),
    A4("a4", 794, 1123);

    private final String id;
    private final int width;
    private final int minHeight;

    DevicePreset(String id, int width, int minHeight) {
        this.id = id;
        this.width = width;
        this.minHeight = minHeight;
    }

    public String id() {
        return id;
    }

    public Viewport viewport() {
        return new Viewport(width, minHeight);
    }

    /**
     * Case-insensitive lookup, or null if the name is not a preset.
     */
    public static DevicePreset fromName(String name) {
        if (name == null) {
            return null;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (DevicePreset p : values()) {
            if (p.id.equals(lower)) {
                return p;
            }
        }
        return null;
    }
}
