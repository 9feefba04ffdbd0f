package org.iconoglott.compiler.frontend.parser.features.graph;

import org.iconoglott.compiler.api.CompilerErrorCode;
import org.iconoglott.compiler.diagnostics.DiagnosticsEngine;
import org.iconoglott.compiler.diagnostics.RecoveryAction;
import org.iconoglott.compiler.frontend.lexer.Token;
import org.iconoglott.compiler.frontend.lexer.TokenType;
import org.iconoglott.compiler.frontend.parser.IStatementHandler;
import org.iconoglott.compiler.frontend.parser.Literals;
import org.iconoglott.compiler.frontend.parser.ParsingContext;
import org.iconoglott.compiler.frontend.parser.ast.AstNode;
import org.iconoglott.compiler.frontend.parser.ast.Point;
import org.iconoglott.compiler.frontend.parser.ast.Size;
import org.iconoglott.compiler.frontend.parser.features.layout.LayoutDirection;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeBuilder;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeKind;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeProps;
import org.iconoglott.compiler.frontend.parser.features.style.Style;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Handles the parsing of the <code>graph</code> statement.
 * <p>
 * The header is <code>graph [hierarchical|grid|manual] [vertical|horizontal] [spacing &lt;n&gt;]</code>.
 * Its block contains <code>node</code> and <code>edge</code> entries and the <code>layout</code>,
 * <code>direction</code> and <code>spacing</code> settings. Node ids are unique within a graph;
 * a repeated id is reported and the later node is dropped:
 * <pre>
 * graph hierarchical
 *   node "a" label "Start"
 *   node "b" shape diamond
 *   edge "a" -&gt; "b" curved label "next"
 * </pre>
 */
public class GraphStatementHandler implements IStatementHandler {

    private static final double DEFAULT_SPACING = 50;

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        GraphSettings settings = new GraphSettings();

        while (context.check(TokenType.IDENTIFIER)) {
            String option = context.advance().text();
            Optional<GraphLayout> layout = GraphLayout.fromName(option);
            Optional<LayoutDirection> direction = LayoutDirection.fromName(option);
            if (layout.isPresent()) {
                settings.layout = layout.get();
            } else if (direction.isPresent()) {
                settings.direction = direction.get();
            } else if ("spacing".equals(option) && context.check(TokenType.NUMBER)) {
                settings.spacing = Literals.number(context.advance());
            }
        }
        context.skipRestOfLine();

        List<GraphNodeDef> nodes = new ArrayList<>();
        List<GraphEdgeDef> edges = new ArrayList<>();
        subBlock(context, key -> {
            switch (key.text()) {
                case "node":
                    GraphNodeDef node = node(context);
                    if (nodes.stream().anyMatch(n -> n.id().equals(node.id()))) {
                        context.getDiagnostics().reportWarning(CompilerErrorCode.INVALID_PROPERTY,
                                "Duplicate node id '" + node.id() + "'; the first definition is kept.",
                                key.line(), key.column(), RecoveryAction.SKIP);
                    } else {
                        nodes.add(node);
                    }
                    break;
                case "edge":
                    edges.add(edge(context));
                    break;
                case "layout":
                    Token layoutName = settingValue(context, key);
                    if (layoutName != null) {
                        Optional<GraphLayout> layout = GraphLayout.fromName(layoutName.text());
                        if (layout.isPresent()) {
                            settings.layout = layout.get();
                        } else {
                            invalidSetting(context, key, layoutName, "Valid layouts: hierarchical, grid, manual");
                        }
                    }
                    break;
                case "direction":
                    Token directionName = settingValue(context, key);
                    if (directionName != null) {
                        Optional<LayoutDirection> direction = LayoutDirection.fromName(directionName.text());
                        if (direction.isPresent()) {
                            settings.direction = direction.get();
                        } else {
                            invalidSetting(context, key, directionName, "Use 'vertical' or 'horizontal'");
                        }
                    }
                    break;
                case "spacing":
                    if (context.check(TokenType.NUMBER)) {
                        settings.spacing = Literals.number(context.advance());
                    } else {
                        report(context, CompilerErrorCode.EXPECTED_NUMBER, "Expected a number after 'spacing'.");
                    }
                    break;
                default:
                    context.getDiagnostics().reportError(CompilerErrorCode.INVALID_PROPERTY,
                            "Unknown graph property '" + key.text() + "'. Valid graph properties: node, edge, layout, direction, spacing",
                            key.line(), key.column(), RecoveryAction.SKIP);
                    context.skipRestOfLine();
                    break;
            }
        });

        ShapeBuilder graph = new ShapeBuilder(ShapeKind.GRAPH, keyword.line());
        return graph.build(new ShapeProps.GraphProps(settings.layout, settings.direction, settings.spacing, nodes, edges));
    }

    private GraphNodeDef node(ParsingContext context) {
        NodeBuilder node = new NodeBuilder(id(context, "node"));

        while (!context.isAtLineEnd()) {
            Token token = context.peek();
            if (token.type() == TokenType.PAIR) {
                if (node.at == null) {
                    node.at = Literals.point(context.advance());
                } else if (node.size == null) {
                    node.size = Literals.size(context.advance());
                } else {
                    context.advance();
                }
            } else if (token.type() == TokenType.COLOR || token.type() == TokenType.VARIABLE) {
                node.style.fill(context.resolveText(context.advance()));
            } else if (token.type() == TokenType.IDENTIFIER) {
                String key = context.advance().text();
                if ("at".equals(key) && context.check(TokenType.PAIR)) {
                    node.at = Literals.point(context.advance());
                } else if ("size".equals(key) && context.check(TokenType.PAIR)) {
                    node.size = Literals.size(context.advance());
                } else {
                    nodeProperty(context, key, node, false);
                }
            } else {
                context.advance();
            }
        }

        subBlock(context, key -> nodeProperty(context, key.text(), node, true));
        return new GraphNodeDef(node.id, node.shape, node.at, node.size, node.label, node.style.build());
    }

    private void nodeProperty(ParsingContext context, String key, NodeBuilder node, boolean inBlock) {
        if ("shape".equals(key) && context.check(TokenType.IDENTIFIER)) {
            NodeShape.fromName(context.advance().text()).ifPresent(s -> node.shape = s);
        } else if ("label".equals(key) && context.check(TokenType.STRING)) {
            node.label = Literals.string(context.advance());
        } else if (inBlock && "fill".equals(key) && isColor(context)) {
            node.style.fill(context.resolveText(context.advance()));
        } else if (inBlock && "stroke".equals(key) && isColor(context)) {
            node.style.stroke(context.resolveText(context.advance()));
        }
    }

    private GraphEdgeDef edge(ParsingContext context) {
        String from = id(context, "edge");
        context.match(TokenType.ARROW);
        String to = id(context, "edge target");
        EdgeBuilder edge = new EdgeBuilder();

        while (!context.isAtLineEnd()) {
            Token token = context.peek();
            if (token.type() == TokenType.COLOR || token.type() == TokenType.VARIABLE) {
                edge.stroke = context.resolveText(context.advance());
            } else if (token.type() == TokenType.NUMBER) {
                edge.strokeWidth = Literals.number(context.advance());
            } else if (token.type() == TokenType.IDENTIFIER) {
                edgeProperty(context, context.advance().text(), edge);
            } else {
                context.advance();
            }
        }

        subBlock(context, key -> edgeProperty(context, key.text(), edge));
        return new GraphEdgeDef(from, to, edge.style, edge.arrow, edge.label, edge.stroke, edge.strokeWidth);
    }

    private void edgeProperty(ParsingContext context, String key, EdgeBuilder edge) {
        if ("style".equals(key) && context.check(TokenType.IDENTIFIER)) {
            EdgeStyle.fromName(context.advance().text()).ifPresent(s -> edge.style = s);
        } else if ("arrow".equals(key) && context.check(TokenType.IDENTIFIER)) {
            ArrowKind.fromName(context.advance().text()).ifPresent(a -> edge.arrow = a);
        } else if ("label".equals(key) && context.check(TokenType.STRING)) {
            edge.label = Literals.string(context.advance());
        } else if ("stroke".equals(key) && isColor(context)) {
            edge.stroke = context.resolveText(context.advance());
        } else if ("width".equals(key) && context.check(TokenType.NUMBER)) {
            edge.strokeWidth = Literals.number(context.advance());
        } else {
            EdgeStyle.fromName(key).ifPresent(s -> edge.style = s);
            ArrowKind.fromName(key).ifPresent(a -> edge.arrow = a);
        }
    }

    private String id(ParsingContext context, String what) {
        if (context.check(TokenType.STRING)) {
            return Literals.string(context.advance());
        }
        report(context, CompilerErrorCode.EXPECTED_STRING, "Expected a quoted id for the " + what + ".");
        return "";
    }

    private Token settingValue(ParsingContext context, Token key) {
        if (!context.check(TokenType.IDENTIFIER)) {
            report(context, CompilerErrorCode.EXPECTED_VALUE, "Expected a value after '" + key.text() + "'.");
            return null;
        }
        return context.advance();
    }

    private void invalidSetting(ParsingContext context, Token key, Token value, String hint) {
        context.getDiagnostics().reportError(CompilerErrorCode.INVALID_PROPERTY,
                "Invalid " + key.text() + " '" + value.text() + "'. " + hint,
                value.line(), value.column(), RecoveryAction.USE_DEFAULT);
    }

    /**
     * Runs {@code onKey} for every identifier that starts an entry of the indented block
     * following the current line. The identifier is consumed before the callback runs.
     */
    private void subBlock(ParsingContext context, Consumer<Token> onKey) {
        context.skipNewlines();
        if (!context.match(TokenType.INDENT)) {
            return;
        }
        int depth = 0;
        while (!context.isAtEnd()) {
            if (context.match(TokenType.NEWLINE)) {
                continue;
            }
            if (context.match(TokenType.DEDENT)) {
                if (depth == 0) {
                    return;
                }
                depth--;
                continue;
            }
            if (context.match(TokenType.INDENT)) {
                depth++;
                continue;
            }
            if (context.check(TokenType.IDENTIFIER)) {
                onKey.accept(context.advance());
            } else {
                Token unexpected = context.advance();
                context.getDiagnostics().reportError(CompilerErrorCode.UNEXPECTED_TOKEN,
                        "Unexpected " + unexpected.type() + " in graph block.",
                        unexpected.line(), unexpected.column(), RecoveryAction.RESUME_AT_NEXT_TOKEN);
            }
        }
    }

    private static boolean isColor(ParsingContext context) {
        return context.check(TokenType.COLOR) || context.check(TokenType.VARIABLE);
    }

    private static void report(ParsingContext context, CompilerErrorCode code, String message) {
        Token at = context.peek();
        DiagnosticsEngine diagnostics = context.getDiagnostics();
        diagnostics.reportError(code, message, at.line(), at.column(), RecoveryAction.RESUME_AT_NEXT_TOKEN);
    }

    private static final class GraphSettings {
        GraphLayout layout = GraphLayout.MANUAL;
        LayoutDirection direction = LayoutDirection.VERTICAL;
        double spacing = DEFAULT_SPACING;
    }

    private static final class NodeBuilder {
        final String id;
        final Style.Builder style = Style.builder();
        NodeShape shape = NodeShape.RECT;
        Point at;
        Size size;
        String label;

        NodeBuilder(String id) {
            this.id = id;
        }
    }

    private static final class EdgeBuilder {
        EdgeStyle style = EdgeStyle.STRAIGHT;
        ArrowKind arrow = ArrowKind.FORWARD;
        String label;
        String stroke = GraphEdgeDef.DEFAULT_STROKE;
        double strokeWidth = GraphEdgeDef.DEFAULT_STROKE_WIDTH;
    }
}
