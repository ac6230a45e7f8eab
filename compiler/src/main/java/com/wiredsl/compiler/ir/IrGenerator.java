package com.wiredsl.compiler.ir;

import com.wiredsl.compiler.ast.CellChild;
import com.wiredsl.compiler.ast.CellNode;
import com.wiredsl.compiler.ast.ComponentNode;
import com.wiredsl.compiler.ast.DefinitionNode;
import com.wiredsl.compiler.ast.LayoutChild;
import com.wiredsl.compiler.ast.LayoutNode;
import com.wiredsl.compiler.ast.Node.SourceLocation;
import com.wiredsl.compiler.ast.ProjectNode;
import com.wiredsl.compiler.ast.PropValue;
import com.wiredsl.compiler.ast.PropertyBlock;
import com.wiredsl.compiler.ast.ScreenNode;
import com.wiredsl.compiler.catalog.ComponentCatalog;
import com.wiredsl.compiler.catalog.ComponentSpec;
import com.wiredsl.compiler.catalog.LayoutKind;
import com.wiredsl.compiler.catalog.PropertyRule;
import com.wiredsl.compiler.catalog.Suggestions;
import com.wiredsl.compiler.diagnostics.Severity;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static com.wiredsl.compiler.catalog.PropertyRule.*;

/**
 * Normalizes a {@link ProjectNode} into an {@link IrDocument}.
 * <p>
 * Resolves the theme, expands component definitions, validates every node against the
 * catalog, assigns ids and enforces the structural rules. Errors accumulate across screens
 * and definitions; a definition cycle stops generation before anything is expanded.
 * <p>
 * Not thread-safe: use one instance per thread, or a new instance per call.
 */
public class IrGenerator {

    private static final String BINDING_PREFIX = "prop_";
    private static final Pattern PASCAL_CASE = Pattern.compile("[A-Z][A-Za-z0-9]*");

    static final Map<String, PropertyRule> THEME_RULES;
    static final Map<String, PropertyRule> SCREEN_RULES;

    static {
        Map<String, PropertyRule> theme = new LinkedHashMap<>();
        theme.put("density", choice("density", "compact", "normal", "comfortable"));
        theme.put("spacing", choice("spacing", ComponentCatalog.SPACING_TOKENS));
        theme.put("radius", choice("radius", "none", "sm", "md", "lg", "full"));
        theme.put("stroke", choice("stroke", "thin", "normal", "thick"));
        theme.put("font", choice("font", "sm", "base", "lg"));
        theme.put("background", color("background"));
        theme.put("theme", choice("theme", "light", "dark"));
        theme.put("device", choice("device", "mobile", "tablet", "desktop", "print", "a4"));
        THEME_RULES = java.util.Collections.unmodifiableMap(theme);

        Map<String, PropertyRule> screen = new LinkedHashMap<>();
        screen.put("background", color("background"));
        SCREEN_RULES = java.util.Collections.unmodifiableMap(screen);
    }

    private boolean strictUnknownComponents = true;
    private boolean debugEnabled = false;
    private DevicePreset defaultDevice = DevicePreset.DESKTOP;

    // Per-run state, reset by normalize()
    private final IdGenerator ids = new IdGenerator();
    private final Map<String, IrNode> nodes = new LinkedHashMap<>();
    private final Map<String, DefinitionNode> definitions = new LinkedHashMap<>();
    private final List<SemanticError> errors = new ArrayList<>();
    private final List<SemanticError> warnings = new ArrayList<>();
    private ThemeConfig theme = ThemeConfig.defaults();

    /**
     * When false, unknown component names are reported as warnings and emitted as unvalidated leaves.
     */
    public void setStrictUnknownComponents(boolean strict) {
        this.strictUnknownComponents = strict;
    }

    /**
     * Device used for screens when the theme does not name one.
     */
    public void setDefaultDevice(DevicePreset device) {
        this.defaultDevice = device;
    }

    public void setDebugEnabled(boolean enabled) {
        this.debugEnabled = enabled;
    }

    public NormalizeResult normalize(ProjectNode project) {
        ids.reset();
        nodes.clear();
        definitions.clear();
        errors.clear();
        warnings.clear();

        if (project.themeBlocks().size() > 1) {
            report(new SemanticError.StructuralViolation("MULTIPLE_THEMES",
                "Only one theme block is allowed, found " + project.themeBlocks().size(),
                project.themeBlocks().get(1).location()));
        }
        theme = resolveTheme(project.themeBlocks());
        debugLog("theme: density=" + theme.density().id() + " spacing=" + theme.spacing().token()
            + " device=" + theme.device().id());

        registerDefinitions(project.definitions());

        List<String> cycle = new DefinitionGraph(definitions).findCycle();
        if (cycle != null) {
            DefinitionNode first = definitions.get(cycle.get(0));
            report(new SemanticError.CircularDefinition(cycle, first.location()));
            debugLog("definition cycle: " + String.join(" -> ", cycle));
            return new NormalizeResult.Failure(errors, warnings);
        }

        if (project.screens().isEmpty()) {
            report(new SemanticError.StructuralViolation("NO_SCREENS",
                "A project must declare at least one screen", project.location()));
        }

        List<IrScreen> screens = new ArrayList<>();
        Set<String> screenNames = new HashSet<>();
        for (ScreenNode screen : project.screens()) {
            if (!screenNames.add(screen.name())) {
                report(new SemanticError.StructuralViolation("DUPLICATE_SCREEN",
                    "Screen \"" + screen.name() + "\" is declared more than once", screen.location()));
                continue;
            }
            IrScreen irScreen = convertScreen(screen);
            if (irScreen != null) {
                screens.add(irScreen);
            }
        }

        if (!errors.isEmpty()) {
            debugLog("normalization failed with " + errors.size() + " error(s)");
            return new NormalizeResult.Failure(errors, warnings);
        }

        IrProject irProject = new IrProject(
            sanitizeId(project.name()),
            project.name(),
            theme,
            toStrings(project.colorsProps()),
            toStrings(project.mocksProps()),
            screens,
            nodes);
        debugLog("generated " + nodes.size() + " node(s) for " + screens.size() + " screen(s)");
        return new NormalizeResult.Success(IrDocument.of(irProject), warnings);
    }

    // --- Theme ---

    private ThemeConfig resolveTheme(List<PropertyBlock> blocks) {
        ThemeConfig defaults = ThemeConfig.defaults().withDevice(defaultDevice);
        if (blocks.isEmpty()) {
            return defaults;
        }
        PropertyBlock block = blocks.get(0);
        Map<String, PropertyValue> props = new PropertyChecker(errors)
            .check("theme", THEME_RULES, block.entries(), Set.of(), block.location());

        Density density = props.containsKey("density")
            ? Density.fromName(props.get("density").asText()) : defaults.density();
        Spacing spacing = props.containsKey("spacing")
            ? Spacing.fromToken(props.get("spacing").asText()) : defaults.spacing();
        DevicePreset device = props.containsKey("device")
            ? DevicePreset.fromName(props.get("device").asText()) : defaults.device();

        return new ThemeConfig(
            density,
            spacing,
            textOr(props, "radius", defaults.radius()),
            textOr(props, "stroke", defaults.stroke()),
            textOr(props, "font", defaults.font()),
            textOr(props, "background", null),
            textOr(props, "theme", null),
            device);
    }

    // --- Definitions ---

    private void registerDefinitions(List<DefinitionNode> defs) {
        for (DefinitionNode def : defs) {
            if (ComponentCatalog.isBuiltIn(def.name())) {
                report(new SemanticError.ShadowedBuiltIn(def.name(), def.location()));
                continue;
            }
            if (definitions.containsKey(def.name())) {
                report(new SemanticError.DuplicateDefinition(def.name(), def.location()));
                continue;
            }
            if (!PASCAL_CASE.matcher(def.name()).matches()) {
                report(new SemanticError.NamingStyle(def.name(), def.location()));
            }
            if (def.body().size() != 1) {
                report(new SemanticError.StructuralViolation("DEFINITION_BODY",
                    "Definition \"" + def.name() + "\" must contain exactly one layout or component, found "
                        + def.body().size(), def.location()));
                if (def.body().isEmpty()) {
                    continue;
                }
            }
            definitions.put(def.name(), def);
        }
    }

    // --- Screens ---

    private IrScreen convertScreen(ScreenNode screen) {
        Map<String, PropertyValue> params = new PropertyChecker(errors)
            .check("screen " + screen.name(), SCREEN_RULES, screen.params(), Set.of(), screen.location());

        if (screen.layouts().size() != 1) {
            report(new SemanticError.StructuralViolation("ROOT_LAYOUT",
                "Screen \"" + screen.name() + "\" must contain exactly one root layout, found "
                    + screen.layouts().size(), screen.location()));
            if (screen.layouts().isEmpty()) {
                return null;
            }
        }

        String rootId = convertLayout(screen.rootLayout(), null);
        if (rootId == null) {
            return null;
        }

        String background = params.containsKey("background") ? params.get("background").asText() : theme.background();
        return new IrScreen("screen-" + sanitizeId(screen.name()), screen.name(), theme.device().viewport(),
            background, rootId);
    }

    // --- Layout tree ---

    private String convertChild(LayoutChild child, Expansion ctx) {
        if (child instanceof ComponentNode component) {
            return convertComponent(component, ctx);
        } else if (child instanceof LayoutNode layout) {
            return convertLayout(layout, ctx);
        }
        // Cells outside a grid behave like plain vertical containers
        return convertCell((CellNode) child, null, ctx);
    }

    private String convertLayout(LayoutNode layout, Expansion ctx) {
        LayoutKind kind = LayoutKind.fromName(layout.layoutType());
        if (kind == null) {
            report(new SemanticError.UnknownLayout(layout.layoutType(), LayoutKind.suggest(layout.layoutType()),
                layout.location()));
            // Keep walking so errors further down are reported in the same pass
            for (LayoutChild child : layout.children()) {
                convertChild(child, ctx);
            }
            return null;
        }

        String owner = "layout " + kind.typeName();
        Set<String> unbound = new HashSet<>();
        Map<String, PropValue> bound = bind(layout.params(), ctx, owner, kind.properties(), unbound, layout.location());
        Map<String, PropertyValue> params = new PropertyChecker(errors)
            .check(owner, kind.properties(), bound, unbound, layout.location());

        checkChildCount(kind, layout);

        String id = ids.layout(kind.typeName());
        LayoutSpec spec = layoutSpec(kind, params);

        List<ChildRef> children = new ArrayList<>();
        int index = 0;
        for (LayoutChild child : layout.children()) {
            String ref;
            int span = 1;
            if (child instanceof CellNode cell) {
                ref = convertCell(cell, spec instanceof LayoutSpec.Grid grid ? grid : null, ctx);
                if (ref != null && nodes.get(ref) instanceof IrNode.ContainerNode container
                        && container.layout() instanceof LayoutSpec.Cell cellSpec) {
                    span = cellSpec.span();
                }
            } else {
                ref = convertChild(child, ctx);
            }
            if (ref != null) {
                children.add(childRef(kind, ref, span, index));
            }
            index++;
        }

        Direction direction = spec instanceof LayoutSpec.Stack stack ? stack.direction() : Direction.VERTICAL;
        StyleProps style = new StyleProps(
            PropertyChecker.spacingPx(params.get("padding"), theme.spacing().px()),
            PropertyChecker.spacingPx(params.get("gap"), theme.spacing().px()),
            params.containsKey("align") ? Align.fromName(params.get("align").asText()) : null,
            resolveJustify(kind, direction, params),
            PropertyChecker.size(params.get("width")),
            PropertyChecker.size(params.get("height")),
            textOr(params, "background", null));

        nodes.put(id, new IrNode.ContainerNode(id, spec, style, children,
            meta("layout", layout.location(), ctx)));
        return id;
    }

    private String convertCell(CellNode cell, LayoutSpec.Grid grid, Expansion ctx) {
        Set<String> unbound = new HashSet<>();
        Map<String, PropValue> bound = bind(cell.props(), ctx, "cell", LayoutKind.CELL_RULES, unbound, cell.location());
        Map<String, PropertyValue> props = new PropertyChecker(errors)
            .check("cell", LayoutKind.CELL_RULES, bound, unbound, cell.location());

        int span = (int) props.getOrDefault("span", new PropertyValue.Number(1)).asNumber(1);
        if (grid != null && span > grid.columns()) {
            report(new SemanticError.OutOfRange("cell", "span", span, 1.0, (double) grid.columns(), cell.location()));
            span = grid.columns();
        }

        if (cell.children().isEmpty()) {
            report(new SemanticError.StructuralViolation("EMPTY_CELL",
                "cell must contain at least one component or layout", cell.location()));
        }

        String id = ids.cell(grid != null ? "grid" : "stack");
        List<ChildRef> children = new ArrayList<>();
        for (CellChild child : cell.children()) {
            String ref = convertChild(child, ctx);
            if (ref != null) {
                children.add(ChildRef.child(ref));
            }
        }

        StyleProps style = new StyleProps(
            0,
            theme.spacing().px(),
            props.containsKey("align") ? Align.fromName(props.get("align").asText()) : null,
            Justify.START,
            PropertyChecker.size(props.get("width")),
            PropertyChecker.size(props.get("height")),
            null);

        nodes.put(id, new IrNode.ContainerNode(id, new LayoutSpec.Cell(span), style, children,
            meta("cell", cell.location(), ctx)));
        return id;
    }

    private String convertComponent(ComponentNode component, Expansion ctx) {
        String type = component.componentType();
        ComponentSpec spec = ComponentCatalog.get(type);
        DefinitionNode definition = spec == null ? definitions.get(type) : null;

        Set<String> unbound = new HashSet<>();
        Map<String, PropertyRule> rules = spec != null ? spec.properties() : Map.of();
        Map<String, PropValue> bound = bind(component.props(), ctx, type, rules, unbound, component.location());

        if (definition != null) {
            return expand(definition, bound, component.location());
        }

        if (spec == null) {
            Severity severity = strictUnknownComponents ? Severity.ERROR : Severity.WARNING;
            report(new SemanticError.UndefinedComponent(type,
                Suggestions.closest(type, allComponentNames()), severity, component.location()));
            if (strictUnknownComponents) {
                return null;
            }
            Map<String, PropertyValue> raw = new LinkedHashMap<>();
            for (Map.Entry<String, PropValue> e : bound.entrySet()) {
                raw.put(e.getKey(), new PropertyValue.Text(e.getValue().asString()));
            }
            return addLeaf(type, raw, StyleProps.NONE, component.location(), ctx);
        }

        Map<String, PropertyValue> props = new PropertyChecker(errors)
            .check(type, spec.properties(), bound, unbound, component.location());
        Size width = PropertyChecker.size(props.remove("width"));
        Size height = PropertyChecker.size(props.remove("height"));
        return addLeaf(type, props, StyleProps.sized(width, height), component.location(), ctx);
    }

    private String addLeaf(String type, Map<String, PropertyValue> props, StyleProps style,
                           SourceLocation location, Expansion ctx) {
        String id = ids.component(type);
        nodes.put(id, new IrNode.ComponentLeaf(id, type, props, style, meta("component", location, ctx)));
        return id;
    }

    // --- Macro expansion ---

    private String expand(DefinitionNode definition, Map<String, PropValue> args, SourceLocation callSite) {
        debugLog("expanding " + definition.name() + " at " + callSite);
        Expansion ctx = new Expansion(definition.name(), args);

        String id = convertChild(definition.body().get(0), ctx);

        for (String arg : args.keySet()) {
            if (!ctx.used.contains(arg)) {
                report(new SemanticError.UnusedArgument(definition.name(), arg, callSite));
            }
        }
        return id;
    }

    /**
     * Replace {@code prop_x} values with the matching call-site argument.
     * Outside an expansion values are left untouched.
     */
    private Map<String, PropValue> bind(Map<String, PropValue> values, Expansion ctx, String owner,
                                        Map<String, PropertyRule> rules, Set<String> unbound,
                                        SourceLocation location) {
        if (ctx == null) {
            return values;
        }
        Map<String, PropValue> bound = new LinkedHashMap<>();
        for (Map.Entry<String, PropValue> entry : values.entrySet()) {
            PropValue value = entry.getValue();
            boolean binding = (value instanceof PropValue.Ident || value instanceof PropValue.Str)
                && value.asString().startsWith(BINDING_PREFIX);
            if (!binding) {
                bound.put(entry.getKey(), value);
                continue;
            }

            String argName = value.asString().substring(BINDING_PREFIX.length());
            if (ctx.args.containsKey(argName)) {
                ctx.used.add(argName);
                bound.put(entry.getKey(), ctx.args.get(argName));
                continue;
            }

            PropertyRule rule = rules.get(entry.getKey());
            boolean required = rule != null && rule.required();
            if (required) {
                unbound.add(entry.getKey());
            }
            report(new SemanticError.MissingArgument(ctx.definition, argName, owner, entry.getKey(), required, location));
        }
        return bound;
    }

    // --- Structure ---

    private static String describe(LayoutChild child) {
        if (child instanceof ComponentNode component) {
            return "component " + component.componentType();
        }
        if (child instanceof LayoutNode nested) {
            return "layout " + nested.layoutType();
        }
        return "child";
    }

    private void checkChildCount(LayoutKind kind, LayoutNode layout) {
        int count = layout.children().size();
        switch (kind) {
            case SPLIT -> {
                if (count != 2) {
                    report(new SemanticError.StructuralViolation("SPLIT_CHILDREN",
                        "split layout requires exactly 2 children, found " + count, layout.location()));
                }
            }
            case PANEL -> {
                if (count != 1) {
                    report(new SemanticError.StructuralViolation("PANEL_CHILDREN",
                        "panel layout requires exactly 1 child, found " + count, layout.location()));
                }
            }
            case GRID -> {
                int cells = 0;
                for (LayoutChild child : layout.children()) {
                    if (child instanceof CellNode) {
                        cells++;
                    } else {
                        report(new SemanticError.StructuralViolation("GRID_CHILD",
                            "grid children must be cells, wrap this " + describe(child) + " in cell { ... }",
                            child.location()));
                    }
                }
                if (cells == 0) {
                    report(new SemanticError.StructuralViolation("GRID_CELLS",
                        "grid layout requires at least one cell", layout.location()));
                }
            }
            default -> {
                if (count == 0) {
                    report(new SemanticError.StructuralViolation("EMPTY_LAYOUT",
                        kind.typeName() + " layout requires at least one child", layout.location()));
                }
            }
        }
    }

    private static ChildRef childRef(LayoutKind kind, String ref, int span, int index) {
        if (kind == LayoutKind.GRID) {
            return ChildRef.cell(ref, span);
        }
        if (kind == LayoutKind.SPLIT) {
            return new ChildRef(index == 0 ? ChildRef.LEFT : ChildRef.RIGHT, ref, null);
        }
        return ChildRef.child(ref);
    }

    private LayoutSpec layoutSpec(LayoutKind kind, Map<String, PropertyValue> params) {
        return switch (kind) {
            case STACK -> new LayoutSpec.Stack(Direction.fromName(textOr(params, "direction", "vertical")));
            case GRID -> new LayoutSpec.Grid(
                (int) params.getOrDefault("columns", new PropertyValue.Number(12)).asNumber(12),
                params.containsKey("rowHeight") ? (int) params.get("rowHeight").asNumber(0) : null);
            case SPLIT -> new LayoutSpec.Split(
                params.getOrDefault("sidebar", new PropertyValue.Number(260)).asNumber(260),
                flag(params, "border"));
            case PANEL -> new LayoutSpec.Panel(flag(params, "border"));
            case CARD -> new LayoutSpec.Card(textOr(params, "radius", theme.radius()), flag(params, "border"));
        };
    }

    private static Justify resolveJustify(LayoutKind kind, Direction direction, Map<String, PropertyValue> params) {
        if (params.containsKey("justify")) {
            return Justify.fromName(params.get("justify").asText());
        }
        if (kind == LayoutKind.STACK && direction == Direction.HORIZONTAL) {
            return Justify.STRETCH;
        }
        return Justify.START;
    }

    // --- Helpers ---

    private NodeMeta meta(String kind, SourceLocation location, Expansion ctx) {
        String expandedFrom = ctx == null ? null : ctx.definition;
        if (location == null) {
            return NodeMeta.of(kind, 0, 0, expandedFrom);
        }
        return NodeMeta.of(kind, location.line(), location.column(), expandedFrom);
    }

    private void report(SemanticError problem) {
        if (problem.isError()) {
            errors.add(problem);
        } else {
            warnings.add(problem);
        }
    }

    private List<String> allComponentNames() {
        List<String> names = new ArrayList<>();
        ComponentCatalog.all().forEach(spec -> names.add(spec.name()));
        names.addAll(definitions.keySet());
        return names;
    }

    private static String textOr(Map<String, PropertyValue> props, String key, String fallback) {
        PropertyValue value = props.get(key);
        return value == null ? fallback : value.asText();
    }

    private static boolean flag(Map<String, PropertyValue> props, String key) {
        PropertyValue value = props.get(key);
        return value != null && value.asFlag();
    }

    private static Map<String, String> toStrings(Map<String, PropValue> values) {
        Map<String, String> out = new LinkedHashMap<>();
        values.forEach((k, v) -> out.put(k, v.asString()));
        return out;
    }

    static String sanitizeId(String name) {
        return name.toLowerCase(Locale.ROOT)
            .replaceAll("\\s+", "_")
            .replaceAll("[^a-z0-9_]", "");
    }

    private void debugLog(String message) {
        if (debugEnabled) {
            System.out.println("[IrGenerator] " + message);
        }
    }

    /**
     * Arguments of one definition expansion and which of them were consumed.
     */
    private static final class Expansion {
        final String definition;
        final Map<String, PropValue> args;
        final Set<String> used = new HashSet<>();

        Expansion(String definition, Map<String, PropValue> args) {
            this.definition = definition;
            this.args = args;
        }
    }
}
