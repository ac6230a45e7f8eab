package com.wiredsl.layout;

import com.wiredsl.compiler.ir.Align;
import com.wiredsl.compiler.ir.ChildRef;
import com.wiredsl.compiler.ir.Direction;
import com.wiredsl.compiler.ir.IrDocument;
import com.wiredsl.compiler.ir.IrNode;
import com.wiredsl.compiler.ir.IrNode.ComponentLeaf;
import com.wiredsl.compiler.ir.IrNode.ContainerNode;
import com.wiredsl.compiler.ir.IrProject;
import com.wiredsl.compiler.ir.IrScreen;
import com.wiredsl.compiler.ir.Justify;
import com.wiredsl.compiler.ir.LayoutSpec;
import com.wiredsl.compiler.ir.Size;
import com.wiredsl.compiler.ir.StyleProps;
import com.wiredsl.compiler.ir.Viewport;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.DoubleSupplier;

/**
 * Computes absolute boxes for every IR node of every screen.
 * <p>
 * Each axis of a node is sized by its {@link Size} policy: fixed pixels, a percentage of the
 * parent's content box, its intrinsic content size, or an equal share of the space its
 * siblings leave over. Containers then place their children:
 * <ul>
 *   <li>stack, card, cell - sequentially along the main axis with a gap after every child but the last</li>
 *   <li>grid - columns of equal width, cells wrapping to a new row when their span does not fit</li>
 *   <li>split - fixed-width sidebar on the left, the rest on the right</li>
 *   <li>panel - single child filling the padded box</li>
 * </ul>
 * The engine never throws for a well-formed IR: sizes are clamped at zero and overflow is
 * flagged on the render node instead. Inconsistent IR (dangling refs, cycles) is recorded on
 * the {@link RenderTree} and replaced by zero boxes.
 * <p>
 * The engine holds no per-call state; one instance may be shared between threads.
 */
public class LayoutEngine {

    private static final double EPSILON = 0.01;

    private boolean debugEnabled = false;

    public void setDebugEnabled(boolean enabled) {
        this.debugEnabled = enabled;
    }

    /**
     * Lay out every screen against the same viewport.
     */
    public RenderTree layout(IrDocument ir, Viewport viewport) {
        return run(ir, viewport);
    }

    /**
     * Lay out every screen against its own device viewport.
     */
    public RenderTree layout(IrDocument ir) {
        return run(ir, null);
    }

    private RenderTree run(IrDocument ir, Viewport override) {
        IrProject project = ir.project();
        Pass pass = new Pass(project);

        List<RenderScreen> screens = new ArrayList<>();
        for (IrScreen screen : project.screens()) {
            Viewport viewport = override != null ? override : screen.viewport();
            screens.add(pass.layoutScreen(screen, viewport));
        }
        return new RenderTree(screens, pass.violations);
    }

    private void debugLog(String message) {
        if (debugEnabled) {
            System.out.println("[LayoutEngine] " + message);
        }
    }

    /**
     * Axis-aligned rectangle.
     */
    private record Box(double x, double y, double w, double h) {
        Box inset(double padding) {
            return new Box(x + padding, y + padding, Math.max(0, w - 2 * padding), Math.max(0, h - 2 * padding));
        }

        boolean contains(Box other) {
            return other.x >= x - EPSILON
                && other.y >= y - EPSILON
                && other.x + other.w <= x + w + EPSILON
                && other.y + other.h <= y + h + EPSILON;
        }
    }

    /**
     * Main- and cross-axis sizes of a stack's children.
     */
    private record StackPlan(double[] main, double[] cross, boolean[] fillCross, int fillCount, double remaining) {}

    /**
     * Offsets (relative to the content box) and sizes of a grid's cells.
     */
    private record GridPlan(double[] x, double[] y, double[] w, double[] h, double contentHeight) {}

    /**
     * State of one layout call.
     */
    private final class Pass {
        private final IrProject project;
        private final IntrinsicSizes sizes;
        private final List<String> violations = new ArrayList<>();
        private final Set<String> placing = new HashSet<>();
        private final Set<String> measuring = new HashSet<>();
        private String screenId;

        Pass(IrProject project) {
            this.project = project;
            this.sizes = new IntrinsicSizes(project.config().density());
        }

        RenderScreen layoutScreen(IrScreen screen, Viewport viewport) {
            screenId = screen.id();
            double vw = Math.max(0, viewport.width());
            double vh = Math.max(0, viewport.height());
            Box viewportBox = new Box(0, 0, vw, vh);

            IrNode root = project.node(screen.rootRef());
            Box rootBox = viewportBox;
            if (root != null) {
                try {
                    double w = axis(root.style().width(), vw, () -> widthOf(root));
                    double h = axis(root.style().height(), vh, () -> measureHeight(root, w));
                    rootBox = new Box(0, 0, w, h);
                } catch (LayoutInvariantViolation e) {
                    violations.add(e.getMessage());
                    debugLog("violation: " + e.getMessage());
                }
            }

            RenderNode node = place(screen.rootRef(), rootBox, viewportBox);
            debugLog("screen " + screen.name() + " laid out at " + vw + "x" + vh);
            return new RenderScreen(screen.id(), screen.name(), viewport, node);
        }

        // --- Placement ---

        private RenderNode place(String ref, Box box, Box parentContent) {
            String id = screenId + ":" + ref;
            boolean entered = false;
            try {
                if (!placing.add(ref)) {
                    throw LayoutInvariantViolation.cycle(ref);
                }
                entered = true;
                IrNode node = project.node(ref);
                if (node == null) {
                    throw LayoutInvariantViolation.unresolvedRef(ref);
                }
                checkFinite(box, ref);

                List<RenderNode> children = List.of();
                boolean contentOverflow = false;
                if (node instanceof ContainerNode container) {
                    Box inner = box.inset(container.style().padding());
                    List<Box> childBoxes = childBoxes(container, inner);
                    List<RenderNode> placed = new ArrayList<>();
                    for (int i = 0; i < childBoxes.size(); i++) {
                        Box childBox = childBoxes.get(i);
                        placed.add(place(container.children().get(i).ref(), childBox, inner));
                        if (!inner.contains(childBox)) {
                            contentOverflow = true;
                        }
                    }
                    children = placed;
                }

                boolean overflow = contentOverflow || !parentContent.contains(box);
                return new RenderNode(id, box.x(), box.y(), box.w(), box.h(), overflow, ref, children);
            } catch (LayoutInvariantViolation e) {
                violations.add(e.getMessage());
                debugLog("violation: " + e.getMessage());
                return new RenderNode(id, box.x(), box.y(), 0, 0, false, ref, List.of());
            } finally {
                if (entered) {
                    placing.remove(ref);
                }
            }
        }

        private List<Box> childBoxes(ContainerNode container, Box inner) {
            LayoutSpec spec = container.layout();
            if (spec instanceof LayoutSpec.Grid grid) {
                return gridBoxes(container, grid, inner);
            } else if (spec instanceof LayoutSpec.Split split) {
                return splitBoxes(container, split, inner);
            } else if (spec instanceof LayoutSpec.Panel) {
                List<Box> boxes = new ArrayList<>();
                for (int i = 0; i < container.children().size(); i++) {
                    boxes.add(inner);
                }
                return boxes;
            }
            return stackBoxes(container, inner);
        }

        private List<Box> stackBoxes(ContainerNode container, Box inner) {
            boolean vertical = direction(container) == Direction.VERTICAL;
            StackPlan plan = planStack(container, inner.w(), inner.h());
            StyleProps style = container.style();
            int n = container.children().size();

            double innerCross = vertical ? inner.w() : inner.h();

            double offset = 0;
            double between = style.gap();
            if (plan.fillCount() == 0 && plan.remaining() > 0) {
                double leftover = plan.remaining();
                Justify justify = style.justify() == null ? Justify.START : style.justify();
                switch (justify) {
                    case CENTER -> offset = leftover / 2;
                    case END -> offset = leftover;
                    case SPACE_BETWEEN -> between += n > 1 ? leftover / (n - 1) : 0;
                    case SPACE_AROUND -> {
                        double around = leftover / n;
                        offset = around / 2;
                        between += around;
                    }
                    default -> { }
                }
            }

            List<Box> boxes = new ArrayList<>();
            double cursor = (vertical ? inner.y() : inner.x()) + offset;
            for (int i = 0; i < n; i++) {
                double main = plan.main()[i];
                double cross = plan.cross()[i];
                double crossOffset = plan.fillCross()[i] ? 0 : alignOffset(style.align(), innerCross, cross);

                if (vertical) {
                    boxes.add(new Box(inner.x() + crossOffset, cursor, cross, main));
                } else {
                    boxes.add(new Box(cursor, inner.y() + crossOffset, main, cross));
                }
                // The gap follows every child but the last, even zero-size ones
                cursor += main + (i < n - 1 ? between : 0);
            }
            return boxes;
        }

        private List<Box> gridBoxes(ContainerNode container, LayoutSpec.Grid grid, Box inner) {
            GridPlan plan = planGrid(container, grid, inner.w());
            List<Box> boxes = new ArrayList<>();
            for (int i = 0; i < plan.x().length; i++) {
                boxes.add(new Box(inner.x() + plan.x()[i], inner.y() + plan.y()[i], plan.w()[i], plan.h()[i]));
            }
            return boxes;
        }

        private List<Box> splitBoxes(ContainerNode container, LayoutSpec.Split split, Box inner) {
            double gap = container.style().gap();
            double left = Math.max(0, split.sidebar());
            double right = Math.max(0, inner.w() - left - gap);

            List<Box> boxes = new ArrayList<>();
            for (int i = 0; i < container.children().size(); i++) {
                ChildRef child = container.children().get(i);
                if (ChildRef.RIGHT.equals(child.slot()) || (i > 0 && !ChildRef.LEFT.equals(child.slot()))) {
                    boxes.add(new Box(inner.x() + left + gap, inner.y(), right, inner.h()));
                } else {
                    boxes.add(new Box(inner.x(), inner.y(), left, inner.h()));
                }
            }
            return boxes;
        }

        // --- Planning ---

        /**
         * Size a stack's children. A NaN inner height means the height is being measured,
         * in which case fill and percent heights fall back to content size.
         */
        private StackPlan planStack(ContainerNode container, double innerW, double innerH) {
            boolean vertical = direction(container) == Direction.VERTICAL;
            StyleProps style = container.style();
            List<ChildRef> refs = container.children();
            int n = refs.size();

            double innerMain = vertical ? innerH : innerW;
            double innerCross = vertical ? innerW : innerH;
            boolean crossDefaultsToFill = style.align() == null || style.align() == Align.STRETCH;
            boolean mainDefaultsToFill = style.justify() == Justify.STRETCH;

            double[] main = new double[n];
            double[] cross = new double[n];
            boolean[] fillMain = new boolean[n];
            boolean[] fillCross = new boolean[n];

            for (int i = 0; i < n; i++) {
                IrNode child = project.node(refs.get(i).ref());
                if (child == null) {
                    continue;
                }
                Size mainSize = mainSize(child, vertical, mainDefaultsToFill);
                Size crossSize = crossSize(child, vertical, crossDefaultsToFill);
                fillCross[i] = crossSize instanceof Size.Fill;

                if (vertical) {
                    cross[i] = axis(crossSize, innerCross, () -> widthOf(child));
                    double width = cross[i];
                    if (mainSize instanceof Size.Fill && !Double.isNaN(innerMain)) {
                        fillMain[i] = true;
                    } else {
                        main[i] = axis(mainSize, innerMain, () -> measureHeight(child, width));
                    }
                } else if (mainSize instanceof Size.Fill) {
                    fillMain[i] = true;
                } else {
                    main[i] = axis(mainSize, innerMain, () -> widthOf(child));
                }
            }

            double used = 0;
            int fillCount = 0;
            for (int i = 0; i < n; i++) {
                if (fillMain[i]) {
                    fillCount++;
                } else {
                    used += main[i];
                }
            }
            double gaps = n > 1 ? style.gap() * (n - 1) : 0;
            double remaining = Double.isNaN(innerMain) ? 0 : innerMain - used - gaps;
            double share = fillCount > 0 ? Math.max(0, remaining / fillCount) : 0;
            for (int i = 0; i < n; i++) {
                if (fillMain[i]) {
                    main[i] = share;
                }
            }

            if (!vertical) {
                for (int i = 0; i < n; i++) {
                    IrNode child = project.node(refs.get(i).ref());
                    if (child == null) {
                        continue;
                    }
                    double width = main[i];
                    cross[i] = axis(crossSize(child, false, crossDefaultsToFill), innerCross,
                        () -> measureHeight(child, width));
                }
            }
            return new StackPlan(main, cross, fillCross, fillCount, remaining);
        }

        private GridPlan planGrid(ContainerNode container, LayoutSpec.Grid grid, double innerW) {
            List<ChildRef> refs = container.children();
            int n = refs.size();
            int columns = Math.max(1, grid.columns());
            double gap = container.style().gap();
            double colW = Math.max(0, (innerW - gap * (columns - 1)) / columns);

            double[] x = new double[n];
            double[] y = new double[n];
            double[] w = new double[n];
            double[] h = new double[n];
            int[] row = new int[n];

            int currentRow = 0;
            int runningSpan = 0;
            for (int i = 0; i < n; i++) {
                int span = Math.min(columns, Math.max(1, refs.get(i).spanOrOne()));
                if (runningSpan > 0 && runningSpan + span > columns) {
                    currentRow++;
                    runningSpan = 0;
                }
                row[i] = currentRow;
                x[i] = runningSpan * (colW + gap);
                w[i] = colW * span + gap * (span - 1);
                runningSpan += span;
            }

            int rows = n == 0 ? 0 : currentRow + 1;
            double[] rowHeights = new double[rows];
            for (int i = 0; i < n; i++) {
                double cellHeight;
                if (grid.rowHeight() != null) {
                    cellHeight = grid.rowHeight();
                } else {
                    IrNode child = project.node(refs.get(i).ref());
                    cellHeight = child == null ? 0 : heightOf(child, w[i]);
                }
                rowHeights[row[i]] = Math.max(rowHeights[row[i]], cellHeight);
            }

            double[] rowTop = new double[rows];
            double cursor = 0;
            for (int r = 0; r < rows; r++) {
                rowTop[r] = cursor;
                cursor += rowHeights[r] + (r < rows - 1 ? gap : 0);
            }
            for (int i = 0; i < n; i++) {
                y[i] = rowTop[row[i]];
                h[i] = rowHeights[row[i]];
            }
            return new GridPlan(x, y, w, h, cursor);
        }

        // --- Measurement ---

        private double widthOf(IrNode node) {
            Size width = node.style().width();
            if (width instanceof Size.Fixed fixed) {
                return Math.max(0, fixed.px());
            }
            return measureWidth(node);
        }

        private double heightOf(IrNode node, double width) {
            Size height = node.style().height();
            if (height instanceof Size.Fixed fixed) {
                return Math.max(0, fixed.px());
            }
            return measureHeight(node, width);
        }

        private double measureWidth(IrNode node) {
            if (node instanceof ComponentLeaf leaf) {
                return sizes.width(leaf);
            }
            ContainerNode container = (ContainerNode) node;
            enterMeasure(container.id());
            try {
                StyleProps style = container.style();
                double padding = 2 * style.padding();
                List<IrNode> children = resolvedChildren(container);
                LayoutSpec spec = container.layout();

                if (spec instanceof LayoutSpec.Grid grid) {
                    int columns = Math.max(1, grid.columns());
                    double column = 0;
                    for (ChildRef ref : container.children()) {
                        IrNode child = project.node(ref.ref());
                        if (child != null) {
                            column = Math.max(column, widthOf(child) / Math.max(1, ref.spanOrOne()));
                        }
                    }
                    return column * columns + style.gap() * (columns - 1) + padding;
                }
                if (spec instanceof LayoutSpec.Split split) {
                    double right = children.size() > 1 ? widthOf(children.get(1)) : 0;
                    return split.sidebar() + style.gap() + right + padding;
                }
                if (direction(container) == Direction.HORIZONTAL) {
                    double sum = 0;
                    for (IrNode child : children) {
                        sum += widthOf(child);
                    }
                    return sum + gaps(style, children.size()) + padding;
                }
                double max = 0;
                for (IrNode child : children) {
                    max = Math.max(max, widthOf(child));
                }
                return max + padding;
            } finally {
                measuring.remove(container.id());
            }
        }

        private double measureHeight(IrNode node, double width) {
            if (node instanceof ComponentLeaf leaf) {
                return sizes.height(leaf, width);
            }
            ContainerNode container = (ContainerNode) node;
            enterMeasure(container.id());
            try {
                StyleProps style = container.style();
                double innerW = Math.max(0, width - 2 * style.padding());
                LayoutSpec spec = container.layout();

                double content;
                if (spec instanceof LayoutSpec.Grid grid) {
                    content = planGrid(container, grid, innerW).contentHeight();
                } else if (spec instanceof LayoutSpec.Split split) {
                    List<IrNode> children = resolvedChildren(container);
                    double left = Math.max(0, split.sidebar());
                    double right = Math.max(0, innerW - left - style.gap());
                    content = 0;
                    for (int i = 0; i < children.size(); i++) {
                        content = Math.max(content, heightOf(children.get(i), i == 0 ? left : right));
                    }
                } else if (spec instanceof LayoutSpec.Panel) {
                    content = 0;
                    for (IrNode child : resolvedChildren(container)) {
                        content = Math.max(content, heightOf(child, innerW));
                    }
                } else {
                    StackPlan plan = planStack(container, innerW, Double.NaN);
                    content = 0;
                    if (direction(container) == Direction.VERTICAL) {
                        for (double main : plan.main()) {
                            content += main;
                        }
                        content += gaps(style, plan.main().length);
                    } else {
                        for (double cross : plan.cross()) {
                            content = Math.max(content, cross);
                        }
                    }
                }
                return content + 2 * style.padding();
            } finally {
                measuring.remove(container.id());
            }
        }

        private void enterMeasure(String id) {
            if (!measuring.add(id)) {
                throw LayoutInvariantViolation.cycle(id);
            }
        }

        private List<IrNode> resolvedChildren(ContainerNode container) {
            List<IrNode> children = new ArrayList<>();
            for (ChildRef ref : container.children()) {
                IrNode child = project.node(ref.ref());
                if (child != null) {
                    children.add(child);
                }
            }
            return children;
        }
    }

    // --- Sizing helpers ---

    /**
     * Resolve one axis. A NaN parent size means the parent is itself being measured,
     * so fill and percent sizes fall back to content size.
     */
    private static double axis(Size size, double parent, DoubleSupplier content) {
        double value;
        if (size instanceof Size.Fixed fixed) {
            value = fixed.px();
        } else if (size instanceof Size.Percent percent && !Double.isNaN(parent)) {
            value = parent * percent.pct() / 100.0;
        } else if ((size == null || size instanceof Size.Fill) && !Double.isNaN(parent)) {
            value = parent;
        } else {
            value = content.getAsDouble();
        }
        return Math.max(0, value);
    }

    private static Size mainSize(IrNode child, boolean vertical, boolean defaultFill) {
        Size size = vertical ? child.style().height() : child.style().width();
        if (size != null) {
            return size;
        }
        return defaultFill ? Size.FILL : Size.CONTENT;
    }

    private static Size crossSize(IrNode child, boolean vertical, boolean defaultFill) {
        Size size = vertical ? child.style().width() : child.style().height();
        if (size != null) {
            return size;
        }
        return defaultFill ? Size.FILL : Size.CONTENT;
    }

    private static double alignOffset(Align align, double available, double size) {
        if (align == null) {
            return 0;
        }
        return switch (align) {
            case CENTER -> (available - size) / 2;
            case END -> available - size;
            default -> 0;
        };
    }

    private static Direction direction(ContainerNode container) {
        if (container.layout() instanceof LayoutSpec.Stack stack) {
            return stack.direction();
        }
        // Cards and cells stack vertically
        return Direction.VERTICAL;
    }

    private static double gaps(StyleProps style, int count) {
        return count > 1 ? style.gap() * (count - 1) : 0;
    }

    private static void checkFinite(Box box, String ref) {
        if (!Double.isFinite(box.x()) || !Double.isFinite(box.y())) {
            throw LayoutInvariantViolation.nonFinite("position", ref);
        }
        if (!Double.isFinite(box.w()) || !Double.isFinite(box.h())) {
            throw LayoutInvariantViolation.nonFinite("size", ref);
        }
    }
}
