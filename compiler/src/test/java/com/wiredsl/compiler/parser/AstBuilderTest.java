package com.wiredsl.compiler.parser;

import com.wiredsl.compiler.ast.*;
import com.wiredsl.compiler.lexer.Tokenizer;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for parse tree to AST conversion.
 */
class AstBuilderTest {

    private ProjectNode build(String source) {
        ParseResult result = new SourceParser().parse(new Tokenizer().tokenize(source).tokens());
        assertTrue(result.isSuccess(), () -> "parse failed: " + result.errors());
        return new AstBuilder().build(((ParseResult.Success) result).tree());
    }

    @Test
    void testProjectBlocks() {
        ProjectNode project = build("""
            project "Admin Panel" {
              theme { density: compact spacing: sm }
              colors { primary: #3B82F6 }
              colors { accent: "#F59E0B" }
              mocks { users: "Ann,Bob" }
              screen Main { layout stack { component Divider } }
            }
            """);

        assertEquals("Admin Panel", project.name());
        assertEquals(1, project.themeBlocks().size());
        assertEquals(2, project.colorBlocks().size());
        assertEquals(new PropValue.Ident("compact"), project.themeProps().get("density"));
        assertEquals(new PropValue.Hex("#3B82F6"), project.colorsProps().get("primary"));
        assertEquals(new PropValue.Str("#F59E0B"), project.colorsProps().get("accent"));
        assertEquals("Ann,Bob", project.mocksProps().get("users").asString());
        assertEquals(1, project.screens().size());
    }

    @Test
    void testLiteralCoercion() {
        ProjectNode project = build("""
            project "A" {
              screen Main {
                layout stack {
                  component Table columns: "Name,Email" rows: 5 title: "Users" variant: primary
                }
              }
            }
            """);

        LayoutNode root = project.screens().get(0).rootLayout();
        ComponentNode table = (ComponentNode) root.children().get(0);

        assertEquals("Table", table.componentType());
        assertEquals(new PropValue.Str("Name,Email"), table.props().get("columns"));
        PropValue.Num rows = (PropValue.Num) table.props().get("rows");
        assertEquals(5.0, rows.value());
        assertEquals("5", rows.raw());
        assertTrue(rows.isInteger());
        assertEquals(new PropValue.Ident("primary"), table.props().get("variant"));
    }

    @Test
    void testNestedLayoutsAndCells() {
        ProjectNode project = build("""
            project "A" {
              screen Main(background: white) {
                layout grid(columns: 12, gap: md) {
                  cell span: 8 {
                    component Heading text: "Left"
                    layout stack(direction: horizontal) { component Button text: "Go" }
                  }
                  cell span: 4 { component Text text: "Right" }
                }
              }
            }
            """);

        ScreenNode screen = project.screens().get(0);
        assertEquals("Main", screen.name());
        assertEquals(new PropValue.Ident("white"), screen.params().get("background"));

        LayoutNode grid = screen.rootLayout();
        assertEquals("grid", grid.layoutType());
        assertEquals(12.0, ((PropValue.Num) grid.params().get("columns")).value());
        assertEquals(2, grid.children().size());

        CellNode first = (CellNode) grid.children().get(0);
        assertEquals(8.0, ((PropValue.Num) first.props().get("span")).value());
        assertEquals(2, first.children().size());
        assertInstanceOf(ComponentNode.class, first.children().get(0));
        assertInstanceOf(LayoutNode.class, first.children().get(1));
    }

    @Test
    void testDefinitions() {
        ProjectNode project = build("""
            project "A" {
              define Component "Field" {
                component Input label: prop_label
              }
              screen Main { layout stack { component Field label: "Email" } }
            }
            """);

        DefinitionNode def = project.definitions().get(0);
        assertEquals("Field", def.name());
        assertEquals(1, def.body().size());
        ComponentNode input = (ComponentNode) def.body().get(0);
        assertEquals(new PropValue.Ident("prop_label"), input.props().get("label"));
    }

    @Test
    void testLaterDuplicatePropertyWins() {
        ProjectNode project = build(
            "project \"A\" { screen Main { layout stack { component Button text: \"One\" text: \"Two\" } } }");

        ComponentNode button = (ComponentNode) project.screens().get(0).rootLayout().children().get(0);
        assertEquals(1, button.props().size());
        assertEquals("Two", button.props().get("text").asString());
    }

    @Test
    void testThemeKeywordAsPropertyKey() {
        ProjectNode project = build(
            "project \"A\" { theme { theme: dark } screen Main { layout stack { component Divider } } }");

        assertEquals(new PropValue.Ident("dark"), project.themeProps().get("theme"));
    }

    @Test
    void testSourceLocations() {
        ProjectNode project = build("project \"A\" {\n  screen Main {\n    layout stack { component Divider }\n  }\n}");

        ScreenNode screen = project.screens().get(0);
        assertEquals(new Node.SourceLocation(2, 3), screen.location());
        assertEquals(new Node.SourceLocation(3, 5), screen.rootLayout().location());
        assertEquals(new Node.SourceLocation(3, 20), screen.rootLayout().children().get(0).location());
    }

    @Test
    void testUnquote() {
        assertEquals("plain", AstBuilder.unquote("\"plain\""));
        assertEquals("say \"hi\"", AstBuilder.unquote("\"say \\\"hi\\\"\""));
        assertEquals("a\nb\tc", AstBuilder.unquote("\"a\\nb\\tc\""));
        assertEquals("back\\slash", AstBuilder.unquote("\"back\\\\slash\""));
        assertEquals("q", AstBuilder.unquote("\"\\q\""));
    }

    @Test
    void testVisitorDispatch() {
        ProjectNode project = build("project \"A\" { screen Main { layout stack { component Divider } } }");

        String kind = project.screens().get(0).rootLayout().accept(new NodeVisitor<String>() {
            @Override
            public String visitProject(ProjectNode node) {
                return "project";
            }

            @Override
            public String visitDefinition(DefinitionNode node) {
                return "definition";
            }

            @Override
            public String visitScreen(ScreenNode node) {
                return "screen";
            }

            @Override
            public String visitLayout(LayoutNode node) {
                return "layout";
            }

            @Override
            public String visitCell(CellNode node) {
                return "cell";
            }

            @Override
            public String visitComponent(ComponentNode node) {
                return "component";
            }
        });
        assertEquals("layout", kind);
    }
}
