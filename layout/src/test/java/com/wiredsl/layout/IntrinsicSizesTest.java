package com.wiredsl.layout;

import com.wiredsl.compiler.ir.Density;
import com.wiredsl.compiler.ir.IrNode.ComponentLeaf;
import com.wiredsl.compiler.ir.NodeMeta;
import com.wiredsl.compiler.ir.PropertyValue;
import com.wiredsl.compiler.ir.StyleProps;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.Map;

class IntrinsicSizesTest {

    private final IntrinsicSizes normal = new IntrinsicSizes(Density.NORMAL);

    private static ComponentLeaf leaf(String type, Object... props) {
        Map<String, PropertyValue> values = new LinkedHashMap<>();
        for (int i = 0; i < props.length; i += 2) {
            Object value = props[i + 1];
            if (value instanceof Number n) {
                values.put((String) props[i], new PropertyValue.Number(n.doubleValue()));
            } else if (value instanceof Boolean b) {
                values.put((String) props[i], new PropertyValue.Flag(b));
            } else {
                values.put((String) props[i], new PropertyValue.Text((String) value));
            }
        }
        return new ComponentLeaf("component-" + type.toLowerCase() + "-1", type, values, StyleProps.NONE,
            NodeMeta.of("component", 0, 0, null));
    }

    @Test
    void testControlHeightsByDensity() {
        assertEquals(32, new IntrinsicSizes(Density.COMPACT).controlHeight());
        assertEquals(40, normal.controlHeight());
        assertEquals(48, new IntrinsicSizes(Density.COMFORTABLE).height(leaf("Input"), 300));
    }

    @Test
    void testFixedHeights() {
        assertEquals(36, normal.height(leaf("Button", "text", "Save"), 300));
        assertEquals(44, normal.height(leaf("Button", "text", "Save", "size", "lg"), 300));
        assertEquals(24, normal.height(leaf("Checkbox", "label", "Agree"), 300));
        assertEquals(1, normal.height(leaf("Divider"), 300));
        assertEquals(250, normal.height(leaf("Chart", "type", "bar"), 300));
        assertEquals(56, normal.height(leaf("Topbar", "title", "App"), 300));
    }

    @Test
    void testTextWraps() {
        assertEquals(40, normal.height(leaf("Heading", "text", "Hi"), 800));
        // 14px text, 8.4px per character: "aaaa bbbb" wraps to two 21px lines at 50px
        assertEquals(42, normal.height(leaf("Paragraph", "text", "aaaa bbbb"), 50), 0.001);
        assertEquals(32, normal.height(leaf("Text", "text", "short"), 800));
    }

    @Test
    void testDataComponents() {
        assertEquals(32 + 44 + 36 * 3 + 64,
            normal.height(leaf("Table", "columns", "A,B", "rows", 3, "title", "Users", "pagination", true), 600));
        assertEquals(120, normal.height(leaf("List", "items", "a,b,c"), 300));
        assertEquals(160, normal.height(leaf("SidebarMenu", "items", "Home,Users,Reports,Settings"), 300));
    }

    @Test
    void testImageKeepsAspectRatio() {
        assertEquals(180, normal.height(leaf("Image", "placeholder", "landscape"), 320), 0.001);
        assertEquals(300, normal.height(leaf("Image", "placeholder", "square"), 300), 0.001);
    }

    @Test
    void testWidths() {
        assertEquals(80, normal.width(leaf("Button", "text", "Go")));
        assertEquals(200, normal.width(leaf("Button", "text", "Twenty one characters")));
        assertEquals(200, normal.width(leaf("Input")));
        assertEquals(18, normal.width(leaf("Icon", "icon", "star")));
    }

    @Test
    void testSpacerSize() {
        assertEquals(0, normal.height(leaf("Separate", "size", "none"), 300));
        assertEquals(24, normal.height(leaf("Separate", "size", "lg"), 300));
        assertEquals(30, normal.width(leaf("Separate", "size", 30)));
    }
}
