package com.wiredsl.compiler.ir;

/**
 * Typed parameters of a container, one variant per layout kind.
 */
public sealed interface LayoutSpec {

    record Stack(Direction direction) implements LayoutSpec {
        @Override
        public String type() {
            return "stack";
        }
    }

    /**
     * @param rowHeight fixed row height in px, or null for content-sized rows
     */
    record Grid(int columns, Integer rowHeight) implements LayoutSpec {
        @Override
        public String type() {
            return "grid";
        }
    }

    record Split(double sidebar, boolean border) implements LayoutSpec {
        @Override
        public String type() {
            return "split";
        }
    }

    record Panel(boolean border) implements LayoutSpec {
        @Override
        public String type() {
            return "panel";
        }
    }

    record Card(String radius, boolean border) implements LayoutSpec {
        @Override
        public String type() {
            return "card";
        }
    }

    /** A grid cell. */
    record Cell(int span) implements LayoutSpec {
        @Override
        public String type() {
            return "cell";
        }
    }

    String type();
}
