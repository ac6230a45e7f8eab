package com.wiredsl.compiler.ir;

/**
 * Resolved project-wide theme.
 *
 * @param density    control density
 * @param spacing    default gap/padding token
 * @param radius     corner radius token
 * @param stroke     line weight token
 * @param font       base font size token
 * @param background default screen background, or null
 * @param scheme     color scheme ({@code light}/{@code dark}), or null
 * @param device     device preset that sizes each screen
 */
public record ThemeConfig(
    Density density,
    Spacing spacing,
    String radius,
    String stroke,
    String font,
    String background,
    String scheme,
    DevicePreset device
) {

    public static ThemeConfig defaults() {
        return new ThemeConfig(Density.NORMAL, Spacing.MD, "md", "normal", "base", null, null, DevicePreset.DESKTOP);
    }

    public ThemeConfig withDevice(DevicePreset device) {
        return new ThemeConfig(density, spacing, radius, stroke, font, background, scheme, device);
    }
}
