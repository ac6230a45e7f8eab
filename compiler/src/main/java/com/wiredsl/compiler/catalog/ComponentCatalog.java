package com.wiredsl.compiler.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.wiredsl.compiler.catalog.ComponentCategory.*;
import static com.wiredsl.compiler.catalog.PropertyRule.*;

/**
 * The fixed set of built-in component kinds and their property rules.
 */
public final class ComponentCatalog {

    private ComponentCatalog() {}

    public static final List<String> SPACING_TOKENS = List.of("none", "xs", "sm", "md", "lg", "xl");

    static final List<String> VARIANTS = List.of(
        "primary", "secondary", "success", "warning", "danger", "info",
        "red", "pink", "purple", "deep_purple", "indigo", "blue", "light_blue",
        "cyan", "teal", "green", "light_green", "lime", "yellow", "amber",
        "orange", "deep_orange", "brown", "grey", "blue_grey");

    static final List<String> VARIANTS_WITH_DEFAULT;

    static {
        List<String> withDefault = new java.util.ArrayList<>();
        withDefault.add("default");
        withDefault.addAll(VARIANTS);
        VARIANTS_WITH_DEFAULT = List.copyOf(withDefault);
    }

    private static final List<String> TEXT_SIZES = List.of("xs", "sm", "md", "lg", "xl");
    private static final List<String> TEXT_ALIGN = List.of("left", "center", "right");

    private static final Map<String, ComponentSpec> COMPONENTS = new LinkedHashMap<>();

    static {
        // Text
        register(ComponentSpec.of("Heading", TEXT,
            string("text").asRequired(),
            choice("level", "h1", "h2", "h3", "h4", "h5", "h6"),
            choice("spacing", SPACING_TOKENS),
            choice("variant", VARIANTS_WITH_DEFAULT)));
        register(ComponentSpec.of("Text", TEXT,
            string("text").asRequired(),
            choice("size", TEXT_SIZES),
            bool("bold"),
            bool("italic")));
        register(ComponentSpec.of("Label", TEXT,
            string("text").asRequired()));
        register(ComponentSpec.of("Paragraph", TEXT,
            string("text").asRequired(),
            choice("align", TEXT_ALIGN),
            choice("size", TEXT_SIZES),
            bool("bold"),
            bool("italic")));
        register(ComponentSpec.of("Code", TEXT,
            string("code").asRequired()));

        // Actions
        register(ComponentSpec.of("Button", ACTION,
            string("text").asRequired(),
            choice("variant", VARIANTS_WITH_DEFAULT),
            choice("size", TEXT_SIZES),
            string("icon"),
            choice("iconAlign", "left", "right"),
            choice("align", TEXT_ALIGN),
            bool("labelSpace"),
            choice("padding", SPACING_TOKENS),
            bool("block"),
            bool("disabled")));
        register(ComponentSpec.of("Link", ACTION,
            string("text").asRequired(),
            choice("variant", VARIANTS),
            choice("size", TEXT_SIZES)));
        register(ComponentSpec.of("IconButton", ACTION,
            string("icon").asRequired(),
            choice("size", TEXT_SIZES),
            choice("variant", VARIANTS_WITH_DEFAULT),
            bool("disabled"),
            bool("labelSpace"),
            choice("padding", SPACING_TOKENS)));

        // Inputs
        register(ComponentSpec.of("Input", INPUT,
            string("label"),
            string("placeholder"),
            choice("size", TEXT_SIZES),
            string("iconLeft"),
            string("iconRight"),
            bool("disabled")));
        register(ComponentSpec.of("Textarea", INPUT,
            string("label"),
            string("placeholder"),
            number("rows", 1.0, null)));
        register(ComponentSpec.of("Select", INPUT,
            string("label"),
            string("placeholder"),
            string("items"),
            choice("size", TEXT_SIZES),
            string("iconLeft"),
            string("iconRight"),
            bool("disabled")));
        register(ComponentSpec.of("Checkbox", INPUT,
            string("label").asRequired(),
            bool("checked"),
            bool("disabled")));
        register(ComponentSpec.of("Radio", INPUT,
            string("label").asRequired(),
            bool("checked"),
            bool("disabled")));
        register(ComponentSpec.of("Toggle", INPUT,
            string("label").asRequired(),
            bool("enabled"),
            bool("disabled")));

        // Navigation
        register(ComponentSpec.of("Topbar", NAVIGATION,
            string("title").asRequired(),
            string("subtitle"),
            string("icon"),
            bool("avatar"),
            string("actions"),
            string("user"),
            choice("variant", VARIANTS_WITH_DEFAULT),
            bool("border"),
            color("background"),
            choice("radius", "none", "sm", "md", "lg", "xl"),
            choice("size", "sm", "md", "lg")));
        register(ComponentSpec.of("SidebarMenu", NAVIGATION,
            string("items").asRequired(),
            string("icons"),
            number("active", 0.0, null),
            choice("variant", VARIANTS_WITH_DEFAULT)));
        register(ComponentSpec.of("Sidebar", NAVIGATION,
            string("title"),
            string("items").asRequired(),
            string("active"),
            number("itemsMock", 0.0, null)));
        register(ComponentSpec.of("Breadcrumbs", NAVIGATION,
            string("items").asRequired(),
            string("separator")));
        register(ComponentSpec.of("Tabs", NAVIGATION,
            string("items").asRequired(),
            number("active", 0.0, null),
            choice("variant", VARIANTS_WITH_DEFAULT),
            choice("radius", "none", "sm", "md", "lg", "full"),
            choice("size", "sm", "md", "lg"),
            string("icons"),
            bool("flat")));

        // Data
        register(ComponentSpec.of("Table", DATA,
            string("title"),
            string("columns").asRequired(),
            number("rows", 0.0, null),
            number("rowsMock", 0.0, null),
            string("mock"),
            bool("random"),
            bool("pagination"),
            number("pages", 1.0, null),
            choice("paginationAlign", TEXT_ALIGN),
            string("actions"),
            string("caption"),
            choice("captionAlign", TEXT_ALIGN),
            bool("border"),
            bool("innerBorder"),
            bool("background")));
        register(ComponentSpec.of("List", DATA,
            string("title"),
            string("items"),
            number("itemsMock", 0.0, null),
            string("mock"),
            bool("random")));
        register(ComponentSpec.of("Stat", DATA,
            string("title").asRequired(),
            string("value").asRequired(),
            string("caption"),
            string("icon"),
            choice("variant", VARIANTS_WITH_DEFAULT)));
        register(ComponentSpec.of("Chart", DATA,
            choice("type", "bar", "line", "pie", "area").asRequired()));

        // Media
        register(ComponentSpec.of("Image", MEDIA,
            choice("placeholder", "landscape", "portrait", "square", "icon", "avatar"),
            string("icon"),
            choice("variant", VARIANTS_WITH_DEFAULT),
            bool("circle")));
        register(ComponentSpec.of("Icon", MEDIA,
            string("icon").asRequired(),
            choice("size", "sm", "md", "lg"),
            choice("variant", VARIANTS_WITH_DEFAULT),
            bool("circle")));

        // Layout helpers
        register(ComponentSpec.of("Card", LAYOUT,
            string("title"),
            string("text")));
        register(ComponentSpec.of("Divider", LAYOUT));
        register(ComponentSpec.of("Separate", LAYOUT,
            spacing("size")));

        // Feedback
        register(ComponentSpec.of("Badge", FEEDBACK,
            string("text").asRequired(),
            choice("variant", VARIANTS_WITH_DEFAULT),
            choice("size", TEXT_SIZES),
            number("padding", 0.0, null)));
        register(ComponentSpec.of("Alert", FEEDBACK,
            choice("variant", VARIANTS),
            string("title"),
            string("text")));
        register(ComponentSpec.of("Modal", FEEDBACK,
            string("title").asRequired(),
            bool("visible")));
    }

    private static void register(ComponentSpec spec) {
        COMPONENTS.put(spec.name(), spec);
    }

    /**
     * Look up a built-in component, or null if the name is not built in.
     */
    public static ComponentSpec get(String name) {
        return COMPONENTS.get(name);
    }

    public static boolean isBuiltIn(String name) {
        return COMPONENTS.containsKey(name);
    }

    public static Collection<ComponentSpec> all() {
        return Collections.unmodifiableCollection(COMPONENTS.values());
    }

    /**
     * Nearest built-in name by edit distance, or null if nothing is close.
     */
    public static String suggest(String name) {
        return Suggestions.closest(name, COMPONENTS.keySet());
    }
}
