package com.wiredsl.compiler.ir;

import com.wiredsl.compiler.ast.CellNode;
import com.wiredsl.compiler.ast.ComponentNode;
import com.wiredsl.compiler.ast.DefinitionNode;
import com.wiredsl.compiler.ast.LayoutNode;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

class DefinitionGraphTest {

    private static DefinitionNode def(String name, String... uses) {
        List<com.wiredsl.compiler.ast.LayoutChild> children = new java.util.ArrayList<>();
        for (String use : uses) {
            children.add(ComponentNode.of(use, Map.of()));
        }
        return DefinitionNode.of(name, LayoutNode.of("stack", Map.of(), children));
    }

    private static Map<String, DefinitionNode> defs(DefinitionNode... nodes) {
        Map<String, DefinitionNode> map = new LinkedHashMap<>();
        for (DefinitionNode node : nodes) {
            map.put(node.name(), node);
        }
        return map;
    }

    @Test
    void testAcyclic() {
        DefinitionGraph graph = new DefinitionGraph(defs(
            def("Page", "Header", "Footer", "Button"),
            def("Header", "Logo"),
            def("Logo"),
            def("Footer", "Logo")));

        assertNull(graph.findCycle());
        // Built-ins are not edges
        assertEquals(List.of("Header", "Footer"), graph.references("Page"));
        assertEquals(List.of(), graph.references("Unknown"));
    }

    @Test
    void testCyclePathLength() {
        assertEquals(List.of("A", "A"), new DefinitionGraph(defs(def("A", "A"))).findCycle());
        assertEquals(List.of("A", "B", "A"), new DefinitionGraph(defs(def("A", "B"), def("B", "A"))).findCycle());
        assertEquals(List.of("A", "B", "C", "A"),
            new DefinitionGraph(defs(def("A", "B"), def("B", "C"), def("C", "A"))).findCycle());
    }

    @Test
    void testCycleBehindAcyclicPrefix() {
        List<String> cycle = new DefinitionGraph(defs(
            def("Root", "Mid"),
            def("Mid", "Leaf"),
            def("Leaf", "Mid"))).findCycle();

        assertEquals(List.of("Mid", "Leaf", "Mid"), cycle);
    }

    @Test
    void testReferencesInsideCells() {
        DefinitionNode grid = DefinitionNode.of("Dashboard", LayoutNode.of("grid", Map.of(), List.of(
            CellNode.of(Map.of(), List.of(ComponentNode.of("Widget", Map.of()))))));

        DefinitionGraph graph = new DefinitionGraph(defs(grid, def("Widget")));
        assertEquals(List.of("Widget"), graph.references("Dashboard"));
    }
}
