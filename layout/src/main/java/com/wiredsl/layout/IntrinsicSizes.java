package com.wiredsl.layout;

import com.wiredsl.compiler.ir.Density;
import com.wiredsl.compiler.ir.IrNode.ComponentLeaf;
import com.wiredsl.compiler.ir.PropertyValue;
import com.wiredsl.compiler.ir.Spacing;

import java.util.Map;

/**
 * Natural (content) size of each component kind at a given density.
 * Heights that depend on wrapped text take the width the component will be given.
 */
public class IntrinsicSizes {

    private static final double DEFAULT_TEXT_WIDTH = 200;

    // Indexed by density: compact, normal, comfortable
    private static final Map<String, int[]> CONTROL_HEIGHTS = Map.of(
        "xs", new int[] {24, 32, 36},
        "sm", new int[] {28, 36, 40},
        "md", new int[] {32, 40, 48},
        "lg", new int[] {36, 48, 56},
        "xl", new int[] {44, 56, 64});

    private static final Map<String, int[]> BUTTON_HEIGHTS = Map.of(
        "xs", new int[] {22, 28, 34},
        "sm", new int[] {26, 32, 40},
        "md", new int[] {29, 36, 45},
        "lg", new int[] {35, 44, 55},
        "xl", new int[] {42, 52, 65});

    private static final Map<String, int[]> ICON_SIZES = Map.of(
        "xs", new int[] {10, 12, 14},
        "sm", new int[] {12, 14, 16},
        "md", new int[] {16, 18, 20},
        "lg", new int[] {20, 24, 28},
        "xl", new int[] {28, 32, 36});

    private static final Map<String, int[]> ICON_BUTTON_SIZES = Map.of(
        "xs", new int[] {24, 32, 36},
        "sm", new int[] {28, 36, 40},
        "md", new int[] {32, 40, 48},
        "lg", new int[] {36, 48, 56},
        "xl", new int[] {44, 56, 64});

    private static final Map<String, Double> HEADING_SCALE = Map.of(
        "h1", 1.4, "h2", 1.0, "h3", 0.85, "h4", 0.75, "h5", 0.65, "h6", 0.55);

    private static final Map<String, Double> IMAGE_RATIOS = Map.of(
        "landscape", 16.0 / 9.0, "portrait", 2.0 / 3.0, "square", 1.0, "icon", 1.0, "avatar", 1.0);

    private static final Map<String, Double> IMAGE_WIDTHS = Map.of(
        "landscape", 300.0, "portrait", 200.0, "square", 200.0, "icon", 64.0, "avatar", 64.0);

    private final Density density;

    public IntrinsicSizes(Density density) {
        this.density = density;
    }

    /**
     * Default height of a single control row: 32, 40 or 48 by density.
     */
    public double controlHeight() {
        return pick(CONTROL_HEIGHTS, "md");
    }

    public double height(ComponentLeaf leaf, double availableWidth) {
        double width = availableWidth > 0 ? availableWidth : DEFAULT_TEXT_WIDTH;

        switch (leaf.componentType()) {
            case "Heading": {
                double fontSize = headingFontSize(leaf.text("level", "h2"));
                double lineHeight = Math.ceil(fontSize * 1.25);
                int lines = TextMetrics.lineCount(leaf.text("text", ""), width, fontSize);
                return Math.max(controlHeight(), lines * lineHeight);
            }
            case "Text":
            case "Paragraph": {
                double fontSize = textFontSize();
                double lineHeight = Math.ceil(fontSize * textLineHeight());
                int lines = TextMetrics.lineCount(leaf.text("text", ""), width, fontSize);
                return Math.max(Math.round(32 * density.factor()), lines * lineHeight);
            }
            case "Label":
            case "Link":
            case "Breadcrumbs":
            case "Checkbox":
            case "Radio":
            case "Toggle":
                return 24;
            case "Badge":
                return switch (leaf.text("size", "md")) {
                    case "xs" -> 18;
                    case "sm" -> 20;
                    case "lg" -> 28;
                    case "xl" -> 32;
                    default -> 24;
                };
            case "Button":
                return pick(BUTTON_HEIGHTS, leaf.text("size", "md"));
            case "Input":
            case "Select":
                return pick(CONTROL_HEIGHTS, leaf.text("size", "md"));
            case "Textarea": {
                PropertyValue rows = leaf.prop("rows");
                return rows == null ? 100 : Math.max(controlHeight(), rows.asNumber(4) * 20 + 20);
            }
            case "IconButton":
                return pick(ICON_BUTTON_SIZES, leaf.text("size", "md"));
            case "Icon":
                return pick(ICON_SIZES, leaf.text("size", "md"));
            case "Topbar":
                return switch (leaf.text("size", "md")) {
                    case "sm" -> 48;
                    case "lg" -> 64;
                    default -> 56;
                };
            case "Tabs":
                return switch (leaf.text("size", "md")) {
                    case "sm" -> 36;
                    case "lg" -> 52;
                    default -> 44;
                };
            case "SidebarMenu":
                return Math.max(controlHeight(), itemCount(leaf, 3) * 40);
            case "Sidebar":
                return (leaf.prop("title") != null ? 48 : 0) + itemCount(leaf, 3) * 40;
            case "List":
                return (leaf.prop("title") != null ? 40 : 0) + itemCount(leaf, 4) * 40;
            case "Table": {
                double rows = leaf.prop("rows") != null ? leaf.prop("rows").asNumber(5) : 5;
                double title = leaf.prop("title") != null ? 32 : 0;
                double pagination = flag(leaf, "pagination") ? 64 : 0;
                return title + 44 + rows * 36 + pagination;
            }
            case "Image": {
                double ratio = IMAGE_RATIOS.getOrDefault(leaf.text("placeholder", "landscape"), 16.0 / 9.0);
                return availableWidth > 0 ? availableWidth / ratio : 200;
            }
            case "Chart":
                return 250;
            case "Card":
            case "Stat":
                return 120;
            case "Modal":
                return 300;
            case "Alert":
                return alertHeight(leaf, availableWidth);
            case "Code": {
                String code = leaf.text("code", "");
                return code.split("\n", -1).length * 20 + 24;
            }
            case "Divider":
                return 1;
            case "Separate":
                return separateSize(leaf);
            default:
                return controlHeight();
        }
    }

    public double width(ComponentLeaf leaf) {
        switch (leaf.componentType()) {
            case "Icon":
                return pick(ICON_SIZES, leaf.text("size", "md"));
            case "IconButton":
                return pick(ICON_BUTTON_SIZES, leaf.text("size", "md"));
            case "Checkbox":
            case "Radio":
                return 24 + labelWidth(leaf.text("label", ""));
            case "Toggle":
                return 44 + labelWidth(leaf.text("label", ""));
            case "Separate":
                return separateSize(leaf);
            case "Button":
            case "Link":
                return Math.max(80, leaf.text("text", "").length() * 8 + 32);
            case "Label":
            case "Text":
            case "Paragraph":
                return Math.max(60, leaf.text("text", "").length() * 8 + 16);
            case "Heading":
                return Math.max(80, leaf.text("text", "").length() * 12 + 16);
            case "Input":
            case "Select":
            case "Textarea":
                return 200;
            case "Image":
                return IMAGE_WIDTHS.getOrDefault(leaf.text("placeholder", "landscape"), 300.0);
            case "Table":
            case "Chart":
            case "Topbar":
            case "Modal":
                return 400;
            case "Card":
            case "Stat":
            case "Alert":
                return 280;
            case "SidebarMenu":
            case "Sidebar":
                return 260;
            case "List":
                return 240;
            case "Tabs":
                return itemCount(leaf, 3) * 100;
            case "Breadcrumbs":
                return Math.max(120, leaf.text("items", "").length() * 8 + 24);
            case "Badge":
                return Math.max(50, leaf.text("text", "").length() * 7 + 16);
            case "Code": {
                int longest = 0;
                for (String line : leaf.text("code", "").split("\n", -1)) {
                    longest = Math.max(longest, line.length());
                }
                return Math.max(120, longest * 8 + 24);
            }
            default:
                return 120;
        }
    }

    private double alertHeight(ComponentLeaf leaf, double availableWidth) {
        double fontSize = 13;
        double titleLine = Math.ceil(fontSize * 1.25);
        double textLine = Math.ceil(fontSize * 1.4);
        double maxWidth = Math.max(40, (availableWidth > 0 ? availableWidth : 280) - 24);

        String title = leaf.text("title", "");
        int titleLines = title.isBlank() ? 0 : TextMetrics.lineCount(title, maxWidth, fontSize);
        int textLines = TextMetrics.lineCount(leaf.text("text", "Alert message"), maxWidth, fontSize);

        double wrapped = 12 + titleLines * titleLine + (titleLines > 0 ? 6 : 0) + textLines * textLine + 12;
        return Math.max(controlHeight(), wrapped);
    }

    private double separateSize(ComponentLeaf leaf) {
        PropertyValue size = leaf.prop("size");
        if (size instanceof PropertyValue.Number n) {
            return n.value();
        }
        Spacing spacing = size == null ? Spacing.MD : Spacing.fromToken(size.asText());
        return Math.round((spacing == null ? Spacing.MD : spacing).px() * density.factor());
    }

    private double headingFontSize(String level) {
        double base = switch (density) {
            case COMPACT -> 16;
            case COMFORTABLE -> 24;
            default -> 20;
        };
        return Math.max(10, Math.round(base * HEADING_SCALE.getOrDefault(level, 1.0)));
    }

    private double textFontSize() {
        return switch (density) {
            case COMPACT -> 12;
            case COMFORTABLE -> 16;
            default -> 14;
        };
    }

    private double textLineHeight() {
        return switch (density) {
            case COMPACT -> 1.4;
            case COMFORTABLE -> 1.6;
            default -> 1.5;
        };
    }

    private double pick(Map<String, int[]> table, String size) {
        int[] row = table.getOrDefault(size, table.get("md"));
        return row[density.ordinal()];
    }

    private static double labelWidth(String label) {
        return label.isEmpty() ? 0 : 8 + label.length() * 8;
    }

    private static int itemCount(ComponentLeaf leaf, int fallback) {
        String items = leaf.text("items", "");
        int count = 0;
        for (String item : items.split(",")) {
            if (!item.isBlank()) {
                count++;
            }
        }
        if (count > 0) {
            return count;
        }
        PropertyValue mock = leaf.prop("itemsMock");
        return mock != null ? (int) mock.asNumber(fallback) : fallback;
    }

    private static boolean flag(ComponentLeaf leaf, String name) {
        PropertyValue value = leaf.prop(name);
        return value != null && value.asFlag();
    }
}
