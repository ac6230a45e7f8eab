package com.wiredsl.compiler.parser;

import com.wiredsl.compiler.ast.*;

import org.antlr.v4.runtime.ParserRuleContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds AST nodes from the ANTLR parse tree.
 * Extends the generated WireBaseVisitor; literals are coerced here, nothing is validated.
 */
public class AstBuilder extends WireBaseVisitor<Node> {

    /**
     * Build the AST for a whole document.
     */
    public ProjectNode build(WireParser.ProjectContext ctx) {
        return (ProjectNode) visitProject(ctx);
    }

    // --- Document Structure ---

    @Override
    public Node visitProject(WireParser.ProjectContext ctx) {
        ProjectNode.Builder builder = ProjectNode.builder(unquote(ctx.STRING().getText()))
            .setLocation(loc(ctx));

        for (WireParser.ProjectItemContext item : ctx.projectItem()) {
            if (item.themeDecl() != null) {
                builder.addTheme(new PropertyBlock(properties(item.themeDecl().property()), loc(item.themeDecl())));
            } else if (item.colorsDecl() != null) {
                builder.addColors(new PropertyBlock(properties(item.colorsDecl().property()), loc(item.colorsDecl())));
            } else if (item.mocksDecl() != null) {
                builder.addMocks(new PropertyBlock(properties(item.mocksDecl().property()), loc(item.mocksDecl())));
            } else if (item.defineDecl() != null) {
                builder.addDefinition((DefinitionNode) visitDefineDecl(item.defineDecl()));
            } else if (item.screen() != null) {
                builder.addScreen((ScreenNode) visitScreen(item.screen()));
            }
        }

        return builder.build();
    }

    @Override
    public Node visitDefineDecl(WireParser.DefineDeclContext ctx) {
        String name = unquote(ctx.STRING().getText());

        List<CellChild> body = new ArrayList<>();
        for (WireParser.DefineBodyContext item : ctx.defineBody()) {
            if (item.layout() != null) {
                body.add((LayoutNode) visitLayout(item.layout()));
            } else if (item.component() != null) {
                body.add((ComponentNode) visitComponent(item.component()));
            }
        }

        return new DefinitionNode(name, body, loc(ctx));
    }

    @Override
    public Node visitScreen(WireParser.ScreenContext ctx) {
        List<LayoutNode> layouts = new ArrayList<>();
        for (WireParser.LayoutContext layoutCtx : ctx.layout()) {
            layouts.add((LayoutNode) visitLayout(layoutCtx));
        }
        return new ScreenNode(ctx.IDENTIFIER().getText(), params(ctx.paramList()), layouts, loc(ctx));
    }

    // --- Layout Tree ---

    @Override
    public Node visitLayout(WireParser.LayoutContext ctx) {
        List<LayoutChild> children = new ArrayList<>();
        for (WireParser.LayoutItemContext item : ctx.layoutItem()) {
            if (item.component() != null) {
                children.add((ComponentNode) visitComponent(item.component()));
            } else if (item.layout() != null) {
                children.add((LayoutNode) visitLayout(item.layout()));
            } else if (item.cell() != null) {
                children.add((CellNode) visitCell(item.cell()));
            }
        }
        return new LayoutNode(ctx.IDENTIFIER().getText(), params(ctx.paramList()), children, loc(ctx));
    }

    @Override
    public Node visitCell(WireParser.CellContext ctx) {
        List<CellChild> children = new ArrayList<>();
        for (WireParser.CellItemContext item : ctx.cellItem()) {
            if (item.component() != null) {
                children.add((ComponentNode) visitComponent(item.component()));
            } else if (item.layout() != null) {
                children.add((LayoutNode) visitLayout(item.layout()));
            }
        }
        return new CellNode(properties(ctx.property()), children, loc(ctx));
    }

    @Override
    public Node visitComponent(WireParser.ComponentContext ctx) {
        return new ComponentNode(ctx.IDENTIFIER().getText(), properties(ctx.property()), loc(ctx));
    }

    // --- Properties and Literals ---

    private Map<String, PropValue> params(WireParser.ParamListContext ctx) {
        if (ctx == null) {
            return Map.of();
        }
        return properties(ctx.property());
    }

    private Map<String, PropValue> properties(List<WireParser.PropertyContext> ctxs) {
        Map<String, PropValue> props = new LinkedHashMap<>();
        for (WireParser.PropertyContext prop : ctxs) {
            // Later duplicates win, matching object-literal semantics of the source format
            props.put(prop.propertyKey().getText(), value(prop.value()));
        }
        return props;
    }

    private PropValue value(WireParser.ValueContext ctx) {
        String text = ctx.getText();
        if (ctx.STRING() != null) {
            return new PropValue.Str(unquote(text));
        } else if (ctx.NUMBER() != null) {
            return new PropValue.Num(Double.parseDouble(text), text);
        } else if (ctx.HEX_COLOR() != null) {
            return new PropValue.Hex(text);
        }
        return new PropValue.Ident(text);
    }

    /**
     * Strip the surrounding quotes and resolve {@code \" \\ \n \t} escapes.
     * Unknown escapes keep the escaped character.
     */
    static String unquote(String literal) {
        String body = literal;
        if (body.length() >= 2 && body.startsWith("\"") && body.endsWith("\"")) {
            body = body.substring(1, body.length() - 1);
        }
        if (body.indexOf('\\') < 0) {
            return body;
        }

        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char next = body.charAt(++i);
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static Node.SourceLocation loc(ParserRuleContext ctx) {
        return new Node.SourceLocation(ctx.getStart().getLine(), ctx.getStart().getCharPositionInLine() + 1);
    }
}
