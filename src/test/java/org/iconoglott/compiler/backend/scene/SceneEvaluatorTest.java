package org.iconoglott.compiler.backend.scene;

import org.iconoglott.compiler.api.CompilerErrorCode;
import org.iconoglott.compiler.api.Severity;
import org.iconoglott.compiler.config.CompilerSettings;
import org.iconoglott.compiler.diagnostics.Diagnostic;
import org.iconoglott.compiler.diagnostics.DiagnosticsEngine;
import org.iconoglott.compiler.diagnostics.RecoveryAction;
import org.iconoglott.compiler.frontend.lexer.Lexer;
import org.iconoglott.compiler.frontend.parser.Parser;
import org.iconoglott.compiler.frontend.parser.ast.Point;
import org.iconoglott.compiler.frontend.parser.ast.SceneNode;
import org.iconoglott.compiler.frontend.parser.features.canvas.CanvasTier;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeKind;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeNode;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeProps;
import org.iconoglott.compiler.frontend.parser.features.style.Style;
import org.iconoglott.compiler.frontend.parser.features.symbol.SymbolNode;
import org.iconoglott.compiler.frontend.parser.features.transform.Transform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class SceneEvaluatorTest {

    private SceneEvaluator evaluator;
    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        evaluator = new SceneEvaluator(CompilerSettings.defaults());
        diagnostics = new DiagnosticsEngine();
    }

    private SceneState evaluate(String source) {
        SceneNode document = new Parser(new Lexer(source).scanTokens(), diagnostics).parse();
        return evaluator.evaluate(document, diagnostics);
    }

    @Test
    void testDefaultCanvas() {
        // Act
        SceneState scene = evaluate("rect");

        // Assert
        assertThat(scene.getTier()).isEqualTo(CanvasTier.MEDIUM);
        assertThat(scene.getFill()).isEqualTo("#fff");
        assertThat(scene.getShapes()).hasSize(1);
        assertThat(scene.getResources().isEmpty()).isTrue();
    }

    @Test
    void testLaterCanvasReplacesEarlierOne() {
        // Act
        SceneState scene = evaluate("canvas large fill #000\nrect\ncanvas tiny");

        // Assert
        assertThat(scene.getTier()).isEqualTo(CanvasTier.TINY);
        assertThat(scene.getFill()).isEqualTo("#fff");
    }

    @Test
    void testShapesKeepDocumentOrderAndLayoutsAreResolved() {
        // Arrange
        String source = String.join("\n",
                "circle 5",
                "stack gap 10",
                "  rect size 50x30",
                "  rect size 50x30",
                "line");

        // Act
        SceneState scene = evaluate(source);

        // Assert
        assertThat(scene.getShapes()).extracting(ShapeNode::kind)
                .containsExactly(ShapeKind.CIRCLE, ShapeKind.LAYOUT, ShapeKind.LINE);
        ShapeNode second = scene.getShapes().get(1).children().get(1);
        assertThat(((ShapeProps.RectProps) second.props()).at()).isEqualTo(new Point(0, 40));
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    void testShapeThatFailsToEvaluateIsReportedAndSkipped() {
        // Arrange
        ShapeNode broken = new ShapeNode(ShapeKind.LAYOUT, new ShapeProps.GroupProps("x"),
                Style.DEFAULT, Transform.IDENTITY, List.of(), 4);
        ShapeNode rect = new ShapeNode(ShapeKind.RECT, new ShapeProps.RectProps(Point.ORIGIN, null),
                Style.DEFAULT, Transform.IDENTITY, List.of(), 5);
        SceneNode document = new SceneNode(List.of(broken, rect));

        // Act
        SceneState scene = evaluator.evaluate(document, diagnostics);

        // Assert
        assertThat(scene.getShapes()).containsExactly(rect);
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(CompilerErrorCode.INVALID_SHAPE);
            assertThat(d.line()).isEqualTo(4);
            assertThat(d.recovery()).isEqualTo(RecoveryAction.SKIP);
            assertThat(d.message()).startsWith("Evaluation error in layout");
        });
    }

    @Test
    void testParseDiagnosticsAreKept() {
        // Act
        SceneState scene = evaluate("unknown_shape at 50,50\nrect");

        // Assert
        assertThat(scene.getShapes()).hasSize(1);
        assertThat(scene.getDiagnostics().getDiagnostics()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.UNKNOWN_COMMAND);
    }

    @Test
    void testSymbolsAreDefinedInDocumentOrderAndResolved() {
        // Arrange
        String source = String.join("\n",
                "symbol \"bars\"",
                "  stack gap 2",
                "    rect size 10x4",
                "    rect size 10x4",
                "symbol \"dot\"",
                "  circle 3",
                "use \"bars\" 5,5");

        // Act
        SceneState scene = evaluate(source);

        // Assert
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(scene.getSymbols()).extracting(SymbolNode::id).containsExactly("bars", "dot");
        ShapeNode secondBar = scene.getSymbols().get(0).children().get(0).children().get(1);
        assertThat(((ShapeProps.RectProps) secondBar.props()).at()).isEqualTo(new Point(0, 6));
        assertThat(scene.getShapes()).extracting(ShapeNode::kind).containsExactly(ShapeKind.USE);
    }

    @Test
    void testUseBeforeItsSymbolIsReportedAndDropped() {
        // Arrange
        String source = String.join("\n",
                "group",
                "  use \"dot\"",
                "  rect",
                "symbol \"dot\"",
                "  circle 3",
                "use \"dot\"");

        // Act
        SceneState scene = evaluate(source);

        // Assert
        assertThat(scene.getShapes()).extracting(ShapeNode::kind).containsExactly(ShapeKind.GROUP, ShapeKind.USE);
        assertThat(scene.getShapes().get(0).children()).extracting(ShapeNode::kind).containsExactly(ShapeKind.RECT);
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(CompilerErrorCode.UNDEFINED_SYMBOL);
            assertThat(d.recovery()).isEqualTo(RecoveryAction.SKIP);
            assertThat(d.line()).isEqualTo(2);
            assertThat(d.message()).isEqualTo("Undefined symbol: dot");
        });
    }

    @Test
    void testDuplicateSymbolKeepsTheFirstDefinition() {
        // Act
        SceneState scene = evaluate("symbol \"s\"\n  rect\nsymbol \"s\"\n  circle 4");

        // Assert
        assertThat(scene.getSymbols()).singleElement().satisfies(symbol ->
                assertThat(symbol.children()).extracting(ShapeNode::kind).containsExactly(ShapeKind.RECT));
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(CompilerErrorCode.DUPLICATE_SYMBOL);
            assertThat(d.severity()).isEqualTo(Severity.WARNING);
            assertThat(d.line()).isEqualTo(3);
        });
    }

    @Test
    void testSymbolCannotReferToItself() {
        // Act
        SceneState scene = evaluate("symbol \"loop\"\n  use \"loop\"\n  rect");

        // Assert
        assertThat(scene.getSymbols().get(0).children()).extracting(ShapeNode::kind).containsExactly(ShapeKind.RECT);
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.UNDEFINED_SYMBOL);
    }
}
