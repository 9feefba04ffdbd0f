package org.iconoglott.compiler.frontend.parser;

import org.iconoglott.compiler.api.CompilerErrorCode;
import org.iconoglott.compiler.api.Severity;
import org.iconoglott.compiler.diagnostics.Diagnostic;
import org.iconoglott.compiler.diagnostics.DiagnosticsEngine;
import org.iconoglott.compiler.diagnostics.RecoveryAction;
import org.iconoglott.compiler.frontend.lexer.Lexer;
import org.iconoglott.compiler.frontend.lexer.Token;
import org.iconoglott.compiler.frontend.lexer.TokenValue;
import org.iconoglott.compiler.frontend.parser.ast.AstNode;
import org.iconoglott.compiler.frontend.parser.ast.Point;
import org.iconoglott.compiler.frontend.parser.ast.SceneNode;
import org.iconoglott.compiler.frontend.parser.ast.Size;
import org.iconoglott.compiler.frontend.parser.features.canvas.CanvasNode;
import org.iconoglott.compiler.frontend.parser.features.canvas.CanvasTier;
import org.iconoglott.compiler.frontend.parser.features.graph.ArrowKind;
import org.iconoglott.compiler.frontend.parser.features.graph.EdgeStyle;
import org.iconoglott.compiler.frontend.parser.features.graph.GraphEdgeDef;
import org.iconoglott.compiler.frontend.parser.features.graph.GraphLayout;
import org.iconoglott.compiler.frontend.parser.features.graph.GraphNodeDef;
import org.iconoglott.compiler.frontend.parser.features.graph.NodeShape;
import org.iconoglott.compiler.frontend.parser.features.layout.Alignment;
import org.iconoglott.compiler.frontend.parser.features.layout.Justify;
import org.iconoglott.compiler.frontend.parser.features.layout.LayoutDirection;
import org.iconoglott.compiler.frontend.parser.features.layout.Padding;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeKind;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeNode;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeProps;
import org.iconoglott.compiler.frontend.parser.features.style.GradientDef;
import org.iconoglott.compiler.frontend.parser.features.style.GradientKind;
import org.iconoglott.compiler.frontend.parser.features.style.ShadowDef;
import org.iconoglott.compiler.frontend.parser.features.style.Style;
import org.iconoglott.compiler.frontend.parser.features.symbol.SymbolNode;
import org.iconoglott.compiler.frontend.parser.features.symbol.ViewBox;
import org.iconoglott.compiler.frontend.parser.features.transform.Transform;
import org.iconoglott.compiler.frontend.parser.features.variable.VariableNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the {@link Parser}: statement dispatch, positional property inference, blocks,
 * variable binding and the recovery action recorded for each error.
 */
@Tag("unit")
public class ParserTest {

    private DiagnosticsEngine diagnostics;

    private SceneNode parse(String source) {
        diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(source).scanTokens();
        return new Parser(tokens, diagnostics).parse();
    }

    private List<ShapeNode> shapes(SceneNode scene) {
        return scene.statements().stream()
                .filter(ShapeNode.class::isInstance)
                .map(ShapeNode.class::cast)
                .toList();
    }

    @Test
    void testRectWithPositionalPairsAndFillBlock() {
        // Act
        SceneNode scene = parse("rect at 10,10 size 100x50\n  fill #f00");

        // Assert
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(shapes(scene)).hasSize(1);
        ShapeNode rect = shapes(scene).get(0);
        assertThat(rect.kind()).isEqualTo(ShapeKind.RECT);
        assertThat(rect.props()).isEqualTo(new ShapeProps.RectProps(new Point(10, 10), new Size(100, 50)));
        assertThat(rect.style().fill()).isEqualTo("#f00");
        assertThat(rect.line()).isEqualTo(1);
    }

    @Test
    void testUnlabelledPairsAreAssignedInOrder() {
        // Act
        SceneNode scene = parse("rect 5,6 7x8 #abc");

        // Assert
        ShapeNode rect = shapes(scene).get(0);
        assertThat(rect.props()).isEqualTo(new ShapeProps.RectProps(new Point(5, 6), new Size(7, 8)));
        assertThat(rect.style().fill()).isEqualTo("#abc");
    }

    @Test
    void testUnknownCommandIsSkippedWithOneError() {
        // Act
        SceneNode scene = parse("unknown_shape at 50,50");

        // Assert
        assertThat(shapes(scene)).isEmpty();
        assertThat(diagnostics.getDiagnostics()).hasSize(1);
        Diagnostic error = diagnostics.getDiagnostics().get(0);
        assertThat(error.code()).isEqualTo(CompilerErrorCode.UNKNOWN_COMMAND);
        assertThat(error.recovery()).isEqualTo(RecoveryAction.SKIP);
        assertThat(error.line()).isEqualTo(1);
        assertThat(error.column()).isEqualTo(1);
    }

    @Test
    void testUnknownCommandSkipsItsBlockAndParsingContinues() {
        // Arrange
        String source = String.join("\n",
                "rect at 0,0 size 10x10",
                "foo bar",
                "  baz 1",
                "circle at 5,5 10");

        // Act
        SceneNode scene = parse(source);

        // Assert
        assertThat(shapes(scene)).extracting(ShapeNode::kind).containsExactly(ShapeKind.RECT, ShapeKind.CIRCLE);
        assertThat(shapes(scene).get(1).props()).isEqualTo(new ShapeProps.CircleProps(new Point(5, 5), 10.0));
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code, Diagnostic::line)
                .containsExactly(org.assertj.core.groups.Tuple.tuple(CompilerErrorCode.UNKNOWN_COMMAND, 2));
    }

    @Test
    void testNonIdentifierAtStatementStartResumesAtNextToken() {
        // Act
        SceneNode scene = parse("\"hello\"\nrect");

        // Assert
        assertThat(shapes(scene)).hasSize(1);
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(CompilerErrorCode.UNEXPECTED_TOKEN);
            assertThat(d.recovery()).isEqualTo(RecoveryAction.RESUME_AT_NEXT_TOKEN);
        });
    }

    @Test
    void testUnterminatedPointListKeepsCollectedPoints() {
        // Act
        SceneNode scene = parse("polygon points [0,0 100,0");

        // Assert
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.MISSING_BRACKET);
        ShapeNode polygon = shapes(scene).get(0);
        assertThat(polygon.props()).isEqualTo(
                new ShapeProps.PolygonProps(List.of(new Point(0, 0), new Point(100, 0))));
    }

    @Test
    void testPolygonWithInlineBracket() {
        // Act
        SceneNode scene = parse("polygon [0,0 10,0 5,5]");

        // Assert
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(shapes(scene).get(0).props()).isEqualTo(new ShapeProps.PolygonProps(
                List.of(new Point(0, 0), new Point(10, 0), new Point(5, 5))));
    }

    @Test
    void testUndefinedVariablePassesThroughAsLiteral() {
        // Act
        SceneNode scene = parse("rect $undefined");

        // Assert
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(CompilerErrorCode.UNDEFINED_VAR);
            assertThat(d.recovery()).isEqualTo(RecoveryAction.PASS_THROUGH_LITERAL);
            assertThat(d.column()).isEqualTo(6);
        });
        assertThat(shapes(scene).get(0).style().fill()).isEqualTo("$undefined");
    }

    @Test
    void testVariablesAreVisibleOnlyAfterTheirBinding() {
        // Arrange
        String source = String.join("\n",
                "rect $accent",
                "$accent = #f00",
                "circle 10 $accent");

        // Act
        SceneNode scene = parse(source);

        // Assert
        List<ShapeNode> shapes = shapes(scene);
        assertThat(shapes.get(0).style().fill()).isEqualTo("$accent");
        assertThat(shapes.get(1).style().fill()).isEqualTo("#f00");
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code, Diagnostic::line)
                .containsExactly(org.assertj.core.groups.Tuple.tuple(CompilerErrorCode.UNDEFINED_VAR, 1));
    }

    @Test
    void testChainedVariablesResolveAtBindingTime() {
        // Arrange
        String source = String.join("\n",
                "$base = #0f0",
                "$accent = $base",
                "$base = #00f",
                "rect $accent");
        diagnostics = new DiagnosticsEngine();
        Parser parser = new Parser(new Lexer(source).scanTokens(), diagnostics);

        // Act
        SceneNode scene = parser.parse();

        // Assert
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(shapes(scene).get(0).style().fill()).isEqualTo("#0f0");
        assertThat(scene.statements().get(1)).isEqualTo(new VariableNode("accent", new TokenValue.Color("#0f0")));
        assertThat(parser.getVariables()).containsOnlyKeys("base", "accent");
        assertThat(parser.getVariables().get("base")).isEqualTo(new TokenValue.Color("#00f"));
    }

    @Test
    void testAssignmentWithoutEquals() {
        // Act
        parse("$accent #f00");

        // Assert
        assertThat(diagnostics.getDiagnostics()).isNotEmpty();
        Diagnostic first = diagnostics.getDiagnostics().get(0);
        assertThat(first.code()).isEqualTo(CompilerErrorCode.MISSING_EQUALS);
        assertThat(first.recovery()).isEqualTo(RecoveryAction.RESUME_AT_NEXT_TOKEN);
    }

    @Test
    void testAssignmentWithoutValue() {
        // Act
        SceneNode scene = parse("$accent =");

        // Assert
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.EMPTY_VALUE);
        assertThat(scene.statements()).containsExactly(new VariableNode("accent", null));
    }

    @Test
    void testParsingIsTotalOnGarbage() {
        // Arrange
        String source = "]] [[ -> : = 5\n  $x\n\t@@@ 'open\n        rect [1,1";
        List<Token> tokens = new Lexer(source).scanTokens();
        diagnostics = new DiagnosticsEngine();

        // Act
        SceneNode scene = new Parser(tokens, diagnostics).parse();

        // Assert
        assertThat(scene).isNotNull();
        assertThat(diagnostics.getDiagnostics()).isNotEmpty();
        assertThat(diagnostics.getDiagnostics().size()).isLessThanOrEqualTo(tokens.size());
    }

    @Test
    void testEmptyTokenListYieldsEmptyScene() {
        // Act
        SceneNode scene = new Parser(List.of(), new DiagnosticsEngine()).parse();

        // Assert
        assertThat(scene.statements()).isEmpty();
    }

    @Test
    void testStyleBlock() {
        // Arrange
        String source = String.join("\n",
                "rect at 0,0 size 10x10",
                "  fill #00f",
                "  stroke #000 2",
                "  opacity 0.5",
                "  corner 4",
                "  shadow 2,3 6 #0008",
                "  gradient radial #fff #000 45",
                "  blur 3");

        // Act
        SceneNode scene = parse(source);

        // Assert
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        Style style = shapes(scene).get(0).style();
        assertThat(style.fill()).isEqualTo("#00f");
        assertThat(style.stroke()).isEqualTo("#000");
        assertThat(style.strokeWidth()).isEqualTo(2);
        assertThat(style.opacity()).isEqualTo(0.5);
        assertThat(style.corner()).isEqualTo(4);
        assertThat(style.shadow()).isEqualTo(new ShadowDef(2, 3, 6, "#0008"));
        assertThat(style.gradient()).isEqualTo(new GradientDef(GradientKind.RADIAL, "#fff", "#000", 45));
        assertThat(style.blur()).isEqualTo(3.0);
    }

    @Test
    void testShadowDefaultsAndStrokeWidthKeyword() {
        // Act
        SceneNode scene = parse("circle 10\n  stroke #123 width 3\n  shadow");

        // Assert
        Style style = shapes(scene).get(0).style();
        assertThat(style.strokeWidth()).isEqualTo(3);
        assertThat(style.shadow()).isEqualTo(ShadowDef.DEFAULT);
    }

    @Test
    void testMissingStyleValueIsReported() {
        // Act
        parse("rect\n  opacity");

        // Assert
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.EXPECTED_NUMBER);
    }

    @Test
    void testTransformBlock() {
        // Act
        SceneNode scene = parse("rect\n  translate 5,5\n  rotate 45\n  scale 2\n  origin 5,5");

        // Assert
        assertThat(shapes(scene).get(0).transform())
                .isEqualTo(new Transform(new Point(5, 5), 45, new Size(2, 2), new Point(5, 5)));
    }

    @Test
    void testTextShape() {
        // Act
        SceneNode scene = parse("text \"Hi\" at 10,20\n  font \"Inter\" 24\n  bold\n  center");

        // Assert
        ShapeNode text = shapes(scene).get(0);
        assertThat(text.props()).isEqualTo(new ShapeProps.TextProps(new Point(10, 20), "Hi"));
        assertThat(text.style().fontFamily()).isEqualTo("Inter");
        assertThat(text.style().fontSize()).isEqualTo(24);
        assertThat(text.style().fontWeight()).isEqualTo("bold");
        assertThat(text.style().textAnchor()).isEqualTo("middle");
    }

    @Test
    void testLineAndEllipseLabels() {
        // Act
        SceneNode scene = parse("line from 0,0 to 10,20\nellipse at 50,50 radius 40x20");

        // Assert
        assertThat(shapes(scene)).extracting(ShapeNode::props).containsExactly(
                new ShapeProps.LineProps(new Point(0, 0), new Point(10, 20)),
                new ShapeProps.EllipseProps(new Point(50, 50), null, new Size(40, 20)));
    }

    @Test
    void testStackWithModifiersAndChildren() {
        // Arrange
        String source = String.join("\n",
                "stack gap 10 at 5,5",
                "  rect size 50x30",
                "  rect size 50x30");

        // Act
        SceneNode scene = parse(source);

        // Assert
        ShapeNode stack = shapes(scene).get(0);
        assertThat(stack.kind()).isEqualTo(ShapeKind.LAYOUT);
        assertThat(stack.props()).isEqualTo(new ShapeProps.LayoutProps(LayoutDirection.VERTICAL, 10, new Point(5, 5)));
        assertThat(stack.children()).hasSize(2).allSatisfy(c -> assertThat(c.kind()).isEqualTo(ShapeKind.RECT));
    }

    @Test
    void testRowDefaultsAndBlockGap() {
        // Act
        SceneNode scene = parse("row\n  gap 4\n  circle 5\n  circle 5");

        // Assert
        ShapeNode row = shapes(scene).get(0);
        assertThat(row.props()).isEqualTo(new ShapeProps.LayoutProps(LayoutDirection.HORIZONTAL, 4, Point.ORIGIN));
        assertThat(row.children()).hasSize(2);
    }

    @Test
    void testLayoutOptionsOnHeaderAndInBlock() {
        // Arrange
        String source = String.join("\n",
                "row size 200x40 justify space-between padding 4 8",
                "  align center",
                "  wrap",
                "  circle 8");

        // Act
        SceneNode scene = parse(source);

        // Assert
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        ShapeNode row = shapes(scene).get(0);
        assertThat(row.props()).isEqualTo(new ShapeProps.LayoutProps(LayoutDirection.HORIZONTAL, 0, Point.ORIGIN,
                new Size(200, 40), Justify.SPACE_BETWEEN, Alignment.CENTER, new Padding(4, 8, 4, 8), true));
        assertThat(row.children()).hasSize(1);
    }

    @Test
    void testCenterInLayoutBlockCentersBothAxes() {
        // Act
        SceneNode scene = parse("stack\n  center\n  rect");

        // Assert
        ShapeProps.LayoutProps stack = (ShapeProps.LayoutProps) shapes(scene).get(0).props();
        assertThat(stack.justify()).isEqualTo(Justify.CENTER);
        assertThat(stack.align()).isEqualTo(Alignment.CENTER);
        assertThat(shapes(scene).get(0).style()).isEqualTo(Style.DEFAULT);
    }

    @Test
    void testInvalidJustifyFallsBackToDefault() {
        // Act
        SceneNode scene = parse("row justify sideways\n  rect");

        // Assert
        ShapeProps.LayoutProps row = (ShapeProps.LayoutProps) shapes(scene).get(0).props();
        assertThat(row.justify()).isEqualTo(Justify.START);
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(CompilerErrorCode.INVALID_PROPERTY);
            assertThat(d.recovery()).isEqualTo(RecoveryAction.USE_DEFAULT);
            assertThat(d.line()).isEqualTo(1);
            assertThat(d.column()).isEqualTo(13);
        });
    }

    @Test
    void testPaddingWithoutValueIsReported() {
        // Act
        SceneNode scene = parse("stack padding\n  rect");

        // Assert
        ShapeProps.LayoutProps stack = (ShapeProps.LayoutProps) shapes(scene).get(0).props();
        assertThat(stack.padding()).isEqualTo(Padding.ZERO);
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.EXPECTED_NUMBER);
    }

    @Test
    void testCurvePointsAndModifiers() {
        // Act
        SceneNode scene = parse("curve [0,0 10,10 20,0] sharp closed\ncurve points [0,0 5,5]\ncurve\n  points [1,1 2,2]\n  closed");

        // Assert
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        List<ShapeNode> curves = shapes(scene);
        assertThat(curves).extracting(ShapeNode::kind).containsOnly(ShapeKind.CURVE);
        assertThat(curves.get(0).props()).isEqualTo(new ShapeProps.CurveProps(
                List.of(new Point(0, 0), new Point(10, 10), new Point(20, 0)), false, true));
        assertThat(curves.get(1).props()).isEqualTo(new ShapeProps.CurveProps(
                List.of(new Point(0, 0), new Point(5, 5)), true, false));
        assertThat(curves.get(2).props()).isEqualTo(new ShapeProps.CurveProps(
                List.of(new Point(1, 1), new Point(2, 2)), true, true));
    }

    @Test
    void testSymbolWithViewBoxAndShapes() {
        // Act
        SceneNode scene = parse("symbol \"dot\" viewbox 0,0 24,24\n  circle 12,12 10\n  rect");

        // Assert
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(scene.statements()).singleElement().isInstanceOf(SymbolNode.class);
        SymbolNode symbol = (SymbolNode) scene.statements().get(0);
        assertThat(symbol.id()).isEqualTo("dot");
        assertThat(symbol.viewBox()).isEqualTo(new ViewBox(0, 0, 24, 24));
        assertThat(symbol.children()).extracting(ShapeNode::kind).containsExactly(ShapeKind.CIRCLE, ShapeKind.RECT);
    }

    @Test
    void testSymbolBlockOnlyTakesShapes() {
        // Act
        SceneNode scene = parse("symbol \"s\" viewbox 24,24\n  fill #f00\n  rect");

        // Assert
        SymbolNode symbol = (SymbolNode) scene.statements().get(0);
        assertThat(symbol.viewBox()).isEqualTo(new ViewBox(0, 0, 24, 24));
        assertThat(symbol.children()).extracting(ShapeNode::kind).containsExactly(ShapeKind.RECT);
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(CompilerErrorCode.INVALID_PROPERTY);
            assertThat(d.recovery()).isEqualTo(RecoveryAction.SKIP);
            assertThat(d.line()).isEqualTo(2);
        });
    }

    @Test
    void testUseWithPositionSizeAndFill() {
        // Act
        SceneNode scene = parse("use \"dot\" 10,20 48x48 #f00\n  opacity 0.5");

        // Assert
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        ShapeNode use = shapes(scene).get(0);
        assertThat(use.kind()).isEqualTo(ShapeKind.USE);
        assertThat(use.props()).isEqualTo(new ShapeProps.UseProps("dot", new Point(10, 20), new Size(48, 48)));
        assertThat(use.style().fill()).isEqualTo("#f00");
        assertThat(use.style().opacity()).isEqualTo(0.5);
    }

    @Test
    void testUseWithoutSymbolIdIsReported() {
        // Act
        SceneNode scene = parse("use at 5,5");

        // Assert
        assertThat(shapes(scene).get(0).props()).isEqualTo(new ShapeProps.UseProps("", new Point(5, 5), null));
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.EXPECTED_STRING);
    }

    @Test
    void testNamedGroup() {
        // Act
        SceneNode scene = parse("group \"icons\"\n  rect\n  circle 4\n    fill #f00");

        // Assert
        ShapeNode group = shapes(scene).get(0);
        assertThat(group.props()).isEqualTo(new ShapeProps.GroupProps("icons"));
        assertThat(group.children()).extracting(ShapeNode::kind).containsExactly(ShapeKind.RECT, ShapeKind.CIRCLE);
        assertThat(group.children().get(1).style().fill()).isEqualTo("#f00");
    }

    @Test
    void testGraphNodesAndEdges() {
        // Arrange
        String source = String.join("\n",
                "graph hierarchical horizontal spacing 30",
                "  node \"a\" at 10,10 size 60x30 shape circle label \"A\" #f00",
                "  node \"b\"",
                "  edge \"a\" -> \"b\" curved both label \"x\" #00f 3");

        // Act
        SceneNode scene = parse(source);

        // Assert
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        ShapeProps.GraphProps graph = (ShapeProps.GraphProps) shapes(scene).get(0).props();
        assertThat(graph.layout()).isEqualTo(GraphLayout.HIERARCHICAL);
        assertThat(graph.direction()).isEqualTo(LayoutDirection.HORIZONTAL);
        assertThat(graph.spacing()).isEqualTo(30);

        GraphNodeDef a = graph.nodes().get(0);
        assertThat(a.id()).isEqualTo("a");
        assertThat(a.shape()).isEqualTo(NodeShape.CIRCLE);
        assertThat(a.at()).isEqualTo(new Point(10, 10));
        assertThat(a.size()).isEqualTo(new Size(60, 30));
        assertThat(a.label()).isEqualTo("A");
        assertThat(a.style().fill()).isEqualTo("#f00");

        GraphNodeDef b = graph.nodes().get(1);
        assertThat(b.shape()).isEqualTo(NodeShape.RECT);
        assertThat(b.at()).isNull();
        assertThat(b.size()).isNull();

        assertThat(graph.edges()).containsExactly(
                new GraphEdgeDef("a", "b", EdgeStyle.CURVED, ArrowKind.BOTH, "x", "#00f", 3));
    }

    @Test
    void testGraphDefaults() {
        // Act
        SceneNode scene = parse("graph\n  node \"a\"\n  edge \"a\" -> \"a\"");

        // Assert
        ShapeProps.GraphProps graph = (ShapeProps.GraphProps) shapes(scene).get(0).props();
        assertThat(graph.layout()).isEqualTo(GraphLayout.MANUAL);
        assertThat(graph.direction()).isEqualTo(LayoutDirection.VERTICAL);
        assertThat(graph.spacing()).isEqualTo(50);
        assertThat(graph.edges()).containsExactly(new GraphEdgeDef("a", "a", EdgeStyle.STRAIGHT, ArrowKind.FORWARD,
                null, GraphEdgeDef.DEFAULT_STROKE, GraphEdgeDef.DEFAULT_STROKE_WIDTH));
    }

    @Test
    void testDuplicateGraphNodeIdKeepsTheFirstDefinition() {
        // Act
        SceneNode scene = parse("graph\n  node \"a\" label \"first\"\n  node \"a\" label \"second\"");

        // Assert
        ShapeProps.GraphProps graph = (ShapeProps.GraphProps) shapes(scene).get(0).props();
        assertThat(graph.nodes()).singleElement().satisfies(n -> assertThat(n.label()).isEqualTo("first"));
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(CompilerErrorCode.INVALID_PROPERTY);
            assertThat(d.severity()).isEqualTo(Severity.WARNING);
            assertThat(d.recovery()).isEqualTo(RecoveryAction.SKIP);
            assertThat(d.line()).isEqualTo(3);
        });
    }

    @Test
    void testInvalidGraphLayoutFallsBackToDefault() {
        // Act
        SceneNode scene = parse("graph\n  layout spiral");

        // Assert
        ShapeProps.GraphProps graph = (ShapeProps.GraphProps) shapes(scene).get(0).props();
        assertThat(graph.layout()).isEqualTo(GraphLayout.MANUAL);
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(CompilerErrorCode.INVALID_PROPERTY);
            assertThat(d.recovery()).isEqualTo(RecoveryAction.USE_DEFAULT);
            assertThat(d.line()).isEqualTo(2);
            assertThat(d.column()).isEqualTo(10);
        });
    }

    @Test
    void testUnknownGraphPropertyIsSkipped() {
        // Act
        SceneNode scene = parse("graph\n  colour red\n  node \"a\"");

        // Assert
        ShapeProps.GraphProps graph = (ShapeProps.GraphProps) shapes(scene).get(0).props();
        assertThat(graph.nodes()).hasSize(1);
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(CompilerErrorCode.INVALID_PROPERTY);
            assertThat(d.recovery()).isEqualTo(RecoveryAction.SKIP);
        });
    }

    @Test
    void testCanvasTierAndFill() {
        // Act
        SceneNode scene = parse("canvas giant fill #1a1a2e");

        // Assert
        assertThat(scene.statements()).containsExactly(new CanvasNode(CanvasTier.GIANT, "#1a1a2e"));
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    void testUnknownCanvasPropertyIsAWarning() {
        // Act
        SceneNode scene = parse("canvas large sparkle");

        // Assert
        assertThat(scene.statements()).containsExactly(new CanvasNode(CanvasTier.LARGE, null));
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(CompilerErrorCode.INVALID_PROPERTY);
            assertThat(d.severity()).isEqualTo(Severity.WARNING);
            assertThat(d.recovery()).isEqualTo(RecoveryAction.SKIP);
        });
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void testCanvasIsNotAllowedInsideABlock() {
        // Act
        SceneNode scene = parse("group\n  canvas tiny\n  rect");

        // Assert
        List<AstNode> statements = scene.statements();
        assertThat(statements).hasSize(1);
        assertThat(((ShapeNode) statements.get(0)).children()).extracting(ShapeNode::kind)
                .containsExactly(ShapeKind.RECT);
    }
}
