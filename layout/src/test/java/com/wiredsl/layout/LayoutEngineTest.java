package com.wiredsl.layout;

import com.wiredsl.compiler.CompilerOptions;
import com.wiredsl.compiler.WireCompiler;
import com.wiredsl.compiler.ir.ChildRef;
import com.wiredsl.compiler.ir.Direction;
import com.wiredsl.compiler.ir.IrDocument;
import com.wiredsl.compiler.ir.IrNode;
import com.wiredsl.compiler.ir.IrProject;
import com.wiredsl.compiler.ir.IrScreen;
import com.wiredsl.compiler.ir.LayoutSpec;
import com.wiredsl.compiler.ir.NodeMeta;
import com.wiredsl.compiler.ir.StyleProps;
import com.wiredsl.compiler.ir.ThemeConfig;
import com.wiredsl.compiler.ir.Viewport;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

class LayoutEngineTest {

    private static final double DELTA = 0.001;

    private final LayoutEngine engine = new LayoutEngine();

    private static IrDocument compile(String source) {
        return new WireCompiler(CompilerOptions.defaults()).compile(source).orThrow();
    }

    private static String screen(String layout) {
        return "project \"Test\" { screen Main { " + layout + " } }";
    }

    private RenderNode layoutMain(String layout, double width, double height) {
        RenderTree tree = engine.layout(compile(screen(layout)), Viewport.of(width, height));
        assertFalse(tree.hasViolations(), () -> "violations: " + tree.violations());
        return tree.screen("Main").root();
    }

    private static void assertBox(RenderNode node, double x, double y, double width, double height) {
        assertEquals(x, node.x(), DELTA, node.id() + " x");
        assertEquals(y, node.y(), DELTA, node.id() + " y");
        assertEquals(width, node.width(), DELTA, node.id() + " width");
        assertEquals(height, node.height(), DELTA, node.id() + " height");
    }

    @Test
    void testRoundTrip() {
        RenderTree tree = engine.layout(compile("""
            project "Demo" {
              screen Main {
                layout stack {
                  component Heading text: "Hello"
                }
              }
            }
            """), Viewport.of(800, 600));

        RenderNode root = tree.screens().get(0).root();
        assertBox(root, 0, 0, 800, 600);
        assertEquals("screen-main:layout-stack-1", root.id());
        assertFalse(root.overflow());

        RenderNode heading = root.children().get(0);
        assertEquals("screen-main:component-heading-1", heading.id());
        assertEquals("component-heading-1", heading.ref());
        assertBox(heading, 16, 16, 768, 40);
        assertFalse(heading.overflow());
    }

    @Test
    void testStackFillDistribution() {
        RenderNode root = layoutMain("""
            layout stack(padding: none, gap: md) {
              component Card title: "Top" height: fill
              component Input label: "Search"
              component Card title: "Bottom" height: fill
            }
            """, 800, 300);

        assertBox(root.children().get(0), 0, 0, 800, 114);
        assertBox(root.children().get(1), 0, 130, 800, 40);
        assertBox(root.children().get(2), 0, 186, 800, 114);
        assertFalse(root.overflow());
    }

    @Test
    void testSplitGeometry() {
        RenderNode root = layoutMain("""
            layout split(sidebar: 260, gap: md, padding: none) {
              component SidebarMenu items: "Home,Users,Settings"
              layout stack { component Heading text: "Users" }
            }
            """, 1280, 720);

        assertBox(root.children().get(0), 0, 0, 260, 720);
        assertBox(root.children().get(1), 276, 0, 1004, 720);
        assertBox(root.children().get(1).children().get(0), 292, 16, 972, 40);
    }

    @Test
    void testGridRowWrap() {
        RenderNode root = layoutMain("""
            layout grid(columns: 12, gap: md, padding: none) {
              cell span: 8 { component Heading text: "Overview" }
              cell span: 4 { component Text text: "Side" }
              cell span: 8 { component Text text: "Footer" }
            }
            """, 1280, 720);

        List<RenderNode> cells = root.children();
        assertBox(cells.get(0), 0, 0, 848, 40);
        assertBox(cells.get(1), 864, 0, 416, 40);
        assertBox(cells.get(2), 0, 56, 848, 32);
        assertEquals("cell-grid-3", cells.get(2).ref());
    }

    @Test
    void testGridFixedRowHeight() {
        RenderNode root = layoutMain("""
            layout grid(columns: 2, gap: sm, padding: none, rowHeight: 100) {
              cell { component Text text: "A" }
              cell { component Text text: "B" }
              cell { component Text text: "C" }
            }
            """, 400, 720);

        List<RenderNode> cells = root.children();
        assertBox(cells.get(0), 0, 0, 196, 100);
        assertBox(cells.get(1), 204, 0, 196, 100);
        assertBox(cells.get(2), 0, 108, 196, 100);
    }

    @Test
    void testHorizontalStackStretches() {
        RenderNode root = layoutMain("""
            layout stack(direction: horizontal, padding: none, gap: md) {
              component Button text: "Save"
              component Button text: "Cancel"
            }
            """, 800, 300);

        assertBox(root.children().get(0), 0, 0, 392, 300);
        assertBox(root.children().get(1), 408, 0, 392, 300);
    }

    @Test
    void testCrossAxisAlignment() {
        RenderNode root = layoutMain("""
            layout stack(direction: horizontal, justify: start, align: center, padding: none) {
              component Button text: "Go"
            }
            """, 800, 300);

        assertBox(root.children().get(0), 0, 132, 80, 36);
    }

    @Test
    void testJustifyCenter() {
        RenderNode root = layoutMain("""
            layout stack(justify: center, padding: none, gap: none) {
              component Input label: "Email"
            }
            """, 800, 300);

        assertBox(root.children().get(0), 0, 130, 800, 40);
    }

    @Test
    void testJustifySpaceBetween() {
        RenderNode root = layoutMain("""
            layout stack(justify: spaceBetween, padding: none, gap: none) {
              component Input label: "A"
              component Input label: "B"
              component Input label: "C"
            }
            """, 800, 300);

        assertEquals(0, root.children().get(0).y(), DELTA);
        assertEquals(130, root.children().get(1).y(), DELTA);
        assertEquals(260, root.children().get(2).y(), DELTA);
    }

    @Test
    void testZeroSizeSpacerKeepsGap() {
        RenderNode root = layoutMain("""
            layout stack(padding: none, gap: md) {
              component Input label: "A"
              component Separate size: none
              component Input label: "B"
            }
            """, 800, 600);

        assertBox(root.children().get(1), 0, 56, 800, 0);
        assertEquals(72, root.children().get(2).y(), DELTA);
    }

    @Test
    void testPercentAndFixedSizes() {
        RenderNode root = layoutMain("""
            layout stack(padding: none, gap: none, align: start) {
              component Button text: "Half" width: "50%"
              component Button text: "Fixed" width: 120 height: 60
            }
            """, 800, 600);

        assertBox(root.children().get(0), 0, 0, 400, 36);
        assertBox(root.children().get(1), 0, 36, 120, 60);
    }

    @Test
    void testPanelAndCard() {
        RenderNode root = layoutMain("""
            layout panel(padding: md) {
              layout card(padding: sm) {
                component Text text: "Inside"
              }
            }
            """, 800, 600);

        RenderNode card = root.children().get(0);
        assertBox(card, 16, 16, 768, 568);
        assertBox(card.children().get(0), 24, 24, 752, 32);
    }

    @Test
    void testContentSizedRoot() {
        RenderNode root = layoutMain("""
            layout stack(padding: sm, gap: none, height: content) {
              component Input label: "A"
              component Input label: "B"
            }
            """, 800, 600);

        assertBox(root, 0, 0, 800, 96);
    }

    @Test
    void testOverflowFlagged() {
        RenderNode root = layoutMain("""
            layout stack(padding: none) {
              component Chart type: bar height: 500
            }
            """, 800, 300);

        RenderNode chart = root.children().get(0);
        assertEquals(500, chart.height(), DELTA);
        assertTrue(chart.overflow());
        assertTrue(root.overflow());
    }

    @Test
    void testZeroViewportIsTotal() {
        RenderTree tree = engine.layout(compile(screen("""
            layout stack {
              component Heading text: "Hello"
              layout grid(columns: 3) { cell { component Button text: "A" } }
              layout split(sidebar: 200) { component Text text: "L" component Text text: "R" }
            }
            """)), Viewport.of(0, 0));

        assertFalse(tree.hasViolations());
        RenderNode root = tree.screen("Main").root();
        assertTrue(root.overflow());
        assertTrue(root.children().get(0).overflow());
        for (RenderNode node : root.flatten()) {
            assertTrue(Double.isFinite(node.x()) && Double.isFinite(node.y()), node.id());
            assertTrue(node.width() >= 0 && node.height() >= 0, node.id());
        }
    }

    @Test
    void testDeterministic() {
        IrDocument document = compile(screen("""
            layout grid(columns: 12) {
              cell span: 6 { component Table columns: "Name,Email" rows: 4 }
              cell span: 6 { component Chart type: line }
            }
            """));

        assertEquals(engine.layout(document, Viewport.of(1024, 768)), engine.layout(document, Viewport.of(1024, 768)));
        assertEquals(engine.layout(document, Viewport.of(1024, 768)),
            new LayoutEngine().layout(document, Viewport.of(1024, 768)));
    }

    @Test
    void testScreensUseDeviceViewport() {
        RenderTree tree = engine.layout(compile("""
            project "Phone" {
              theme { device: mobile }
              screen Home { layout stack { component Heading text: "Home" } }
              screen Profile { layout stack { component Heading text: "Profile" } }
            }
            """));

        assertEquals(2, tree.screens().size());
        assertEquals("screen-profile", tree.screens().get(1).screenId());
        assertBox(tree.screen("Home").root(), 0, 0, 375, 812);
        assertEquals(new Viewport(375, 812), tree.screen("Profile").viewport());
    }

    @Test
    void testFindAndFlatten() {
        RenderNode root = layoutMain("""
            layout stack {
              layout card { component Button text: "A" }
              component Divider
            }
            """, 800, 600);

        assertEquals(4, root.flatten().size());
        assertEquals("screen-main:component-button-1", root.find("component-button-1").id());
        assertNull(root.find("component-button-9"));
    }

    // --- Inconsistent IR ---

    private static IrDocument handBuilt(Map<String, IrNode> nodes) {
        IrScreen screen = new IrScreen("screen-main", "Main", Viewport.of(800, 600), null, "root");
        IrProject project = new IrProject("test", "Test", ThemeConfig.defaults(), Map.of(), Map.of(),
            List.of(screen), nodes);
        return IrDocument.of(project);
    }

    private static IrNode.ContainerNode stack(String id, String... children) {
        List<ChildRef> refs = new java.util.ArrayList<>();
        for (String child : children) {
            refs.add(ChildRef.child(child));
        }
        return new IrNode.ContainerNode(id, new LayoutSpec.Stack(Direction.VERTICAL), StyleProps.NONE, refs,
            NodeMeta.of("layout", 0, 0, null));
    }

    @Test
    void testDanglingReference() {
        Map<String, IrNode> nodes = new LinkedHashMap<>();
        nodes.put("root", stack("root", "missing"));

        RenderTree tree = engine.layout(handBuilt(nodes));

        assertEquals(1, tree.violations().size());
        assertTrue(tree.violations().get(0).contains("missing"));
        RenderNode ghost = tree.screen("Main").root().children().get(0);
        assertEquals(0, ghost.width(), DELTA);
        assertEquals(0, ghost.height(), DELTA);
    }

    @Test
    void testCycleInIr() {
        Map<String, IrNode> nodes = new LinkedHashMap<>();
        nodes.put("root", stack("root", "inner"));
        nodes.put("inner", stack("inner", "root"));

        RenderTree tree = engine.layout(handBuilt(nodes));

        assertTrue(tree.hasViolations());
        assertNotNull(tree.screen("Main").root());
    }
}
