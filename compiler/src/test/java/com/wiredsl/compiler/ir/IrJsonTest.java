package com.wiredsl.compiler.ir;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.wiredsl.compiler.CompilerOptions;
import com.wiredsl.compiler.WireCompiler;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class IrJsonTest {

    private static final String SOURCE = """
        project "Admin" {
          theme { density: comfortable }
          colors { primary: #3B82F6 }
          define Component "Field" { component Input label: prop_label }
          screen Users(background: "#FAFAFA") {
            layout grid(columns: 12, gap: md) {
              cell span: 8 { component Field label: "Search" }
              cell span: 4 { component Button text: "Add" variant: primary width: 120 }
            }
          }
        }
        """;

    private static JsonObject compile() {
        IrDocument document = new WireCompiler(CompilerOptions.defaults()).compile(SOURCE).orThrow();
        return JsonParser.parseString(IrJson.toJsonString(document)).getAsJsonObject();
    }

    @Test
    void testDocumentShape() {
        JsonObject json = compile();

        assertEquals("1.0", json.get("irVersion").getAsString());
        JsonObject project = json.getAsJsonObject("project");
        assertEquals("admin", project.get("id").getAsString());
        assertEquals("Admin", project.get("name").getAsString());
        assertEquals("comfortable", project.getAsJsonObject("config").get("density").getAsString());
        assertEquals("#3B82F6", project.getAsJsonObject("colors").get("primary").getAsString());
    }

    @Test
    void testScreens() {
        JsonArray screens = compile().getAsJsonObject("project").getAsJsonArray("screens");

        assertEquals(1, screens.size());
        JsonObject screen = screens.get(0).getAsJsonObject();
        assertEquals("screen-users", screen.get("id").getAsString());
        assertEquals("#FAFAFA", screen.get("background").getAsString());
        assertEquals(1280, screen.getAsJsonObject("viewport").get("width").getAsInt());
        assertEquals("layout-grid-1", screen.getAsJsonObject("root").get("ref").getAsString());
    }

    @Test
    void testContainerNode() {
        JsonObject nodes = compile().getAsJsonObject("project").getAsJsonObject("nodes");
        JsonObject grid = nodes.getAsJsonObject("layout-grid-1");

        assertEquals("container", grid.get("kind").getAsString());
        assertEquals("grid", grid.getAsJsonObject("layout").get("type").getAsString());
        assertEquals(12, grid.getAsJsonObject("layout").getAsJsonObject("props").get("columns").getAsInt());
        assertEquals(16, grid.getAsJsonObject("style").get("gap").getAsInt());

        JsonObject first = grid.getAsJsonArray("children").get(0).getAsJsonObject();
        assertEquals("cell", first.get("slot").getAsString());
        assertEquals("cell-grid-1", first.get("ref").getAsString());
        assertEquals(8, first.get("span").getAsInt());
    }

    @Test
    void testComponentNode() {
        JsonObject nodes = compile().getAsJsonObject("project").getAsJsonObject("nodes");

        JsonObject button = nodes.getAsJsonObject("component-button-1");
        assertEquals("component", button.get("kind").getAsString());
        assertEquals("Button", button.get("componentType").getAsString());
        assertEquals("primary", button.getAsJsonObject("props").get("variant").getAsString());
        assertEquals("120", button.getAsJsonObject("style").get("width").getAsString());
        assertTrue(button.getAsJsonObject("meta").get("sourceNodeId").getAsString().startsWith("component@"));

        JsonObject input = nodes.getAsJsonObject("component-input-1");
        assertEquals("Search", input.getAsJsonObject("props").get("label").getAsString());
        assertEquals("Field", input.getAsJsonObject("meta").get("expandedFrom").getAsString());
    }
}
