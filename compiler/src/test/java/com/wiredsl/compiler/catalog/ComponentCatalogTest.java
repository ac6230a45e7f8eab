package com.wiredsl.compiler.catalog;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

class ComponentCatalogTest {

    @Test
    void testBuiltInComponents() {
        assertEquals(31, ComponentCatalog.all().size());
        assertTrue(ComponentCatalog.isBuiltIn("Button"));
        assertTrue(ComponentCatalog.isBuiltIn("SidebarMenu"));
        assertFalse(ComponentCatalog.isBuiltIn("button"));
        assertNull(ComponentCatalog.get("Sparkline"));
    }

    @Test
    void testRequiredProperties() {
        ComponentSpec chart = ComponentCatalog.get("Chart");

        assertEquals(ComponentCategory.DATA, chart.category());
        assertEquals(List.of("type"), chart.requiredProperties().stream().map(PropertyRule::name).toList());
        assertEquals(PropertyType.ENUM, chart.rule("type").type());
        assertTrue(chart.rule("type").options().contains("pie"));
    }

    @Test
    void testEveryComponentAcceptsSize() {
        for (ComponentSpec spec : ComponentCatalog.all()) {
            assertEquals(PropertyType.SIZE, spec.rule("width").type(), spec.name());
            assertEquals(PropertyType.SIZE, spec.rule("height").type(), spec.name());
        }
    }

    @Test
    void testLayoutKinds() {
        assertEquals(LayoutKind.GRID, LayoutKind.fromName("grid"));
        assertNull(LayoutKind.fromName("flex"));
        assertTrue(LayoutKind.GRID.rule("columns").required());
        assertTrue(LayoutKind.SPLIT.rule("sidebar").required());
        assertEquals(12.0, LayoutKind.GRID.rule("columns").max());
        assertEquals(PropertyType.SPACING, LayoutKind.CARD.rule("padding").type());
        assertEquals(PropertyType.INTEGER, LayoutKind.CELL_RULES.get("span").type());
        assertEquals(PropertyType.INTEGER, LayoutKind.GRID.rule("columns").type());
        assertFalse(LayoutKind.SPLIT.rule("sidebar").inRange(0));
        assertTrue(LayoutKind.SPLIT.rule("sidebar").inRange(0.5));
    }

    @Test
    void testSuggestions() {
        assertEquals("Button", ComponentCatalog.suggest("Buton"));
        assertEquals("Heading", ComponentCatalog.suggest("heading"));
        assertNull(ComponentCatalog.suggest("Xylophone"));
        assertEquals("split", LayoutKind.suggest("splt"));
    }

    @Test
    void testEditDistance() {
        assertEquals(0, Suggestions.distance("stack", "stack"));
        assertEquals(1, Suggestions.distance("stak", "stack"));
        assertEquals(3, Suggestions.distance("kitten", "sitting"));
        assertNull(Suggestions.closest("", List.of("a")));
    }
}
