package com.wiredsl.layout;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Serializes a render tree for renderers. Each screen carries a flat node map keyed by render id;
 * nodes list their children by id.
 */
public final class RenderTreeJson {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private RenderTreeJson() {}

    public static String toJsonString(RenderTree tree) {
        return GSON.toJson(toJson(tree));
    }

    public static JsonObject toJson(RenderTree tree) {
        JsonArray screens = new JsonArray();
        for (RenderScreen screen : tree.screens()) {
            screens.add(screen(screen));
        }

        JsonArray violations = new JsonArray();
        tree.violations().forEach(violations::add);

        JsonObject json = new JsonObject();
        json.add("screens", screens);
        json.add("violations", violations);
        return json;
    }

    private static JsonObject screen(RenderScreen screen) {
        JsonObject json = new JsonObject();
        json.addProperty("screenId", screen.screenId());
        json.addProperty("name", screen.name());

        JsonObject viewport = new JsonObject();
        viewport.addProperty("width", number(screen.viewport().width()));
        viewport.addProperty("height", number(screen.viewport().height()));
        json.add("viewport", viewport);

        json.addProperty("root", screen.root().id());
        JsonObject nodes = new JsonObject();
        for (RenderNode node : screen.root().flatten()) {
            nodes.add(node.id(), node(node));
        }
        json.add("nodes", nodes);
        return json;
    }

    private static JsonObject node(RenderNode node) {
        JsonObject json = new JsonObject();
        json.addProperty("id", node.id());
        json.addProperty("x", number(node.x()));
        json.addProperty("y", number(node.y()));
        json.addProperty("width", number(node.width()));
        json.addProperty("height", number(node.height()));
        json.addProperty("overflow", node.overflow());
        json.addProperty("ref", node.ref());

        JsonArray children = new JsonArray();
        for (RenderNode child : node.children()) {
            children.add(child.id());
        }
        json.add("children", children);
        return json;
    }

    private static Number number(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return (long) value;
        }
        return value;
    }
}
