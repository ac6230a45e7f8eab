package com.wiredsl.compiler.ast;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root node representing a complete wire document.
 * Declaration blocks are kept as lists; merging and "exactly one" checks belong to the IR generator.
 */
public record ProjectNode(
    String name,
    List<PropertyBlock> themeBlocks,
    List<PropertyBlock> colorBlocks,
    List<PropertyBlock> mockBlocks,
    List<DefinitionNode> definitions,
    List<ScreenNode> screens,
    Node.SourceLocation loc
) implements Node {

    public ProjectNode {
        themeBlocks = List.copyOf(themeBlocks);
        colorBlocks = List.copyOf(colorBlocks);
        mockBlocks = List.copyOf(mockBlocks);
        definitions = List.copyOf(definitions);
        screens = List.copyOf(screens);
    }

    /**
     * Theme properties of all theme blocks, later keys overriding earlier ones.
     */
    public Map<String, PropValue> themeProps() {
        return merge(themeBlocks);
    }

    public Map<String, PropValue> colorsProps() {
        return merge(colorBlocks);
    }

    public Map<String, PropValue> mocksProps() {
        return merge(mockBlocks);
    }

    private static Map<String, PropValue> merge(List<PropertyBlock> blocks) {
        Map<String, PropValue> merged = new LinkedHashMap<>();
        for (PropertyBlock block : blocks) {
            merged.putAll(block.entries());
        }
        return merged;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitProject(this);
    }

    @Override
    public SourceLocation location() {
        return loc;
    }

    /**
     * Builder for constructing a ProjectNode incrementally.
     */
    public static class Builder {
        private final String name;
        private final List<PropertyBlock> themeBlocks = new java.util.ArrayList<>();
        private final List<PropertyBlock> colorBlocks = new java.util.ArrayList<>();
        private final List<PropertyBlock> mockBlocks = new java.util.ArrayList<>();
        private final List<DefinitionNode> definitions = new java.util.ArrayList<>();
        private final List<ScreenNode> screens = new java.util.ArrayList<>();
        private Node.SourceLocation location;

        private Builder(String name) {
            this.name = name;
        }

        public Builder addTheme(PropertyBlock block) {
            themeBlocks.add(block);
            return this;
        }

        public Builder addColors(PropertyBlock block) {
            colorBlocks.add(block);
            return this;
        }

        public Builder addMocks(PropertyBlock block) {
            mockBlocks.add(block);
            return this;
        }

        public Builder addDefinition(DefinitionNode definition) {
            definitions.add(definition);
            return this;
        }

        public Builder addScreen(ScreenNode screen) {
            screens.add(screen);
            return this;
        }

        public Builder setLocation(Node.SourceLocation location) {
            this.location = location;
            return this;
        }

        public ProjectNode build() {
            return new ProjectNode(name, themeBlocks, colorBlocks, mockBlocks, definitions, screens, location);
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }
}
