package com.wiredsl.compiler.ir;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.Map;

/**
 * Serializes the IR contract to JSON for renderers and tooling.
 */
public final class IrJson {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private IrJson() {}

    public static String toJsonString(IrDocument document) {
        return GSON.toJson(toJson(document));
    }

    public static JsonObject toJson(IrDocument document) {
        JsonObject json = new JsonObject();
        json.addProperty("irVersion", document.irVersion());
        json.add("project", project(document.project()));
        return json;
    }

    private static JsonObject project(IrProject project) {
        JsonObject json = new JsonObject();
        json.addProperty("id", project.id());
        json.addProperty("name", project.name());
        json.add("config", config(project.config()));
        json.add("colors", strings(project.colors()));
        json.add("mocks", strings(project.mocks()));

        JsonArray screens = new JsonArray();
        for (IrScreen screen : project.screens()) {
            screens.add(screen(screen));
        }
        json.add("screens", screens);

        JsonObject nodes = new JsonObject();
        for (IrNode node : project.nodes().values()) {
            nodes.add(node.id(), node(node));
        }
        json.add("nodes", nodes);
        return json;
    }

    private static JsonObject config(ThemeConfig config) {
        JsonObject json = new JsonObject();
        json.addProperty("density", config.density().id());
        json.addProperty("spacing", config.spacing().token());
        json.addProperty("radius", config.radius());
        json.addProperty("stroke", config.stroke());
        json.addProperty("font", config.font());
        if (config.background() != null) {
            json.addProperty("background", config.background());
        }
        if (config.scheme() != null) {
            json.addProperty("theme", config.scheme());
        }
        json.addProperty("device", config.device().id());
        return json;
    }

    private static JsonObject screen(IrScreen screen) {
        JsonObject json = new JsonObject();
        json.addProperty("id", screen.id());
        json.addProperty("name", screen.name());

        JsonObject viewport = new JsonObject();
        viewport.addProperty("width", number(screen.viewport().width()));
        viewport.addProperty("height", number(screen.viewport().height()));
        json.add("viewport", viewport);

        if (screen.background() != null) {
            json.addProperty("background", screen.background());
        }
        JsonObject root = new JsonObject();
        root.addProperty("ref", screen.rootRef());
        json.add("root", root);
        return json;
    }

    static JsonObject node(IrNode node) {
        JsonObject json = new JsonObject();
        json.addProperty("id", node.id());

        if (node instanceof IrNode.ContainerNode container) {
            json.addProperty("kind", "container");
            json.add("layout", layout(container.layout()));
            json.add("style", style(container.style()));

            JsonArray children = new JsonArray();
            for (ChildRef child : container.children()) {
                JsonObject ref = new JsonObject();
                ref.addProperty("slot", child.slot());
                ref.addProperty("ref", child.ref());
                if (child.span() != null) {
                    ref.addProperty("span", child.span());
                }
                children.add(ref);
            }
            json.add("children", children);
        } else if (node instanceof IrNode.ComponentLeaf leaf) {
            json.addProperty("kind", "component");
            json.addProperty("componentType", leaf.componentType());

            JsonObject props = new JsonObject();
            for (Map.Entry<String, PropertyValue> entry : leaf.props().entrySet()) {
                addValue(props, entry.getKey(), entry.getValue());
            }
            json.add("props", props);
            json.add("style", style(leaf.style()));
        }

        json.add("meta", meta(node.meta()));
        return json;
    }

    private static JsonObject layout(LayoutSpec spec) {
        JsonObject props = new JsonObject();
        if (spec instanceof LayoutSpec.Stack stack) {
            props.addProperty("direction", stack.direction().id());
        } else if (spec instanceof LayoutSpec.Grid grid) {
            props.addProperty("columns", grid.columns());
            if (grid.rowHeight() != null) {
                props.addProperty("rowHeight", grid.rowHeight());
            }
        } else if (spec instanceof LayoutSpec.Split split) {
            props.addProperty("sidebar", number(split.sidebar()));
            props.addProperty("border", split.border());
        } else if (spec instanceof LayoutSpec.Panel panel) {
            props.addProperty("border", panel.border());
        } else if (spec instanceof LayoutSpec.Card card) {
            props.addProperty("radius", card.radius());
            props.addProperty("border", card.border());
        } else if (spec instanceof LayoutSpec.Cell cell) {
            props.addProperty("span", cell.span());
        }

        JsonObject json = new JsonObject();
        json.addProperty("type", spec.type());
        json.add("props", props);
        return json;
    }

    private static JsonObject style(StyleProps style) {
        JsonObject json = new JsonObject();
        json.addProperty("padding", number(style.padding()));
        json.addProperty("gap", number(style.gap()));
        if (style.align() != null) {
            json.addProperty("align", style.align().id());
        }
        if (style.justify() != null) {
            json.addProperty("justify", style.justify().id());
        }
        if (style.width() != null) {
            json.addProperty("width", style.width().describe());
        }
        if (style.height() != null) {
            json.addProperty("height", style.height().describe());
        }
        if (style.background() != null) {
            json.addProperty("background", style.background());
        }
        return json;
    }

    private static JsonObject meta(NodeMeta meta) {
        JsonObject json = new JsonObject();
        if (meta.sourceNodeId() != null) {
            json.addProperty("sourceNodeId", meta.sourceNodeId());
        }
        if (meta.expandedFrom() != null) {
            json.addProperty("expandedFrom", meta.expandedFrom());
        }
        return json;
    }

    private static void addValue(JsonObject json, String key, PropertyValue value) {
        if (value instanceof PropertyValue.Number n) {
            json.addProperty(key, number(n.value()));
        } else if (value instanceof PropertyValue.Flag f) {
            json.addProperty(key, f.value());
        } else {
            json.addProperty(key, value.asText());
        }
    }

    private static JsonObject strings(Map<String, String> values) {
        JsonObject json = new JsonObject();
        values.forEach(json::addProperty);
        return json;
    }

    /**
     * Whole numbers are written without a fraction.
     */
    static Number number(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return (long) value;
        }
        return value;
    }
}
