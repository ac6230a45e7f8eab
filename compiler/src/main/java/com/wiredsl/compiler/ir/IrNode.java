package com.wiredsl.compiler.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of the normalized IR: either a container with children or a component leaf.
 */
public sealed interface IrNode {

    String id();

    StyleProps style();

    NodeMeta meta();

    /**
     * A layout container or a grid cell.
     */
    record ContainerNode(
        String id,
        LayoutSpec layout,
        StyleProps style,
        List<ChildRef> children,
        NodeMeta meta
    ) implements IrNode {
        public ContainerNode {
            children = List.copyOf(children);
        }
    }

    /**
     * A built-in component with validated properties.
     */
    record ComponentLeaf(
        String id,
        String componentType,
        Map<String, PropertyValue> props,
        StyleProps style,
        NodeMeta meta
    ) implements IrNode {
        public ComponentLeaf {
            props = Collections.unmodifiableMap(new LinkedHashMap<>(props));
        }

        public PropertyValue prop(String name) {
            return props.get(name);
        }

        public String text(String name, String fallback) {
            PropertyValue v = props.get(name);
            return v == null ? fallback : v.asText();
        }
    }
}
