package com.wiredsl.compiler.ir;

import com.wiredsl.compiler.ast.CellChild;
import com.wiredsl.compiler.ast.CellNode;
import com.wiredsl.compiler.ast.ComponentNode;
import com.wiredsl.compiler.ast.DefinitionNode;
import com.wiredsl.compiler.ast.LayoutChild;
import com.wiredsl.compiler.ast.LayoutNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reference graph between component definitions.
 * An edge A -> B exists when the body of A uses component B and B is a definition.
 */
public class DefinitionGraph {

    private enum Mark { UNVISITED, ON_PATH, DONE }

    private final Map<String, List<String>> edges = new LinkedHashMap<>();

    /**
     * @param definitions definitions in declaration order, keyed by name
     */
    public DefinitionGraph(Map<String, DefinitionNode> definitions) {
        for (DefinitionNode def : definitions.values()) {
            List<String> refs = new ArrayList<>();
            for (CellChild child : def.body()) {
                collect(child, definitions, refs);
            }
            edges.put(def.name(), refs);
        }
    }

    public List<String> references(String name) {
        return edges.getOrDefault(name, List.of());
    }

    /**
     * Depth-first search in declaration order.
     *
     * @return the first cycle found as a path whose first and last entries are equal
     *         (a cycle through k definitions has k + 1 entries), or null if the graph is acyclic
     */
    public List<String> findCycle() {
        Map<String, Mark> marks = new HashMap<>();
        for (String name : edges.keySet()) {
            marks.put(name, Mark.UNVISITED);
        }

        List<String> path = new ArrayList<>();
        for (String name : edges.keySet()) {
            if (marks.get(name) == Mark.UNVISITED) {
                List<String> cycle = visit(name, marks, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        return null;
    }

    private List<String> visit(String name, Map<String, Mark> marks, List<String> path) {
        marks.put(name, Mark.ON_PATH);
        path.add(name);

        for (String next : references(name)) {
            Mark mark = marks.get(next);
            if (mark == Mark.ON_PATH) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                return cycle;
            }
            if (mark == Mark.UNVISITED) {
                List<String> cycle = visit(next, marks, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }

        path.remove(path.size() - 1);
        marks.put(name, Mark.DONE);
        return null;
    }

    private static void collect(LayoutChild node, Map<String, DefinitionNode> definitions, List<String> refs) {
        if (node instanceof ComponentNode component) {
            if (definitions.containsKey(component.componentType())) {
                refs.add(component.componentType());
            }
        } else if (node instanceof LayoutNode layout) {
            for (LayoutChild child : layout.children()) {
                collect(child, definitions, refs);
            }
        } else if (node instanceof CellNode cell) {
            for (CellChild child : cell.children()) {
                collect(child, definitions, refs);
            }
        }
    }
}
