package org.iconoglott.compiler.backend.layout;

import org.iconoglott.compiler.frontend.parser.ast.Point;
import org.iconoglott.compiler.frontend.parser.ast.Size;
import org.iconoglott.compiler.frontend.parser.features.graph.ArrowKind;
import org.iconoglott.compiler.frontend.parser.features.graph.EdgeStyle;
import org.iconoglott.compiler.frontend.parser.features.graph.GraphEdgeDef;
import org.iconoglott.compiler.frontend.parser.features.graph.GraphLayout;
import org.iconoglott.compiler.frontend.parser.features.graph.GraphNodeDef;
import org.iconoglott.compiler.frontend.parser.features.graph.NodeShape;
import org.iconoglott.compiler.frontend.parser.features.layout.LayoutDirection;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeProps;
import org.iconoglott.compiler.frontend.parser.features.style.Style;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests anchor selection, path data and arrowhead geometry of the {@link EdgeRouter}.
 */
@Tag("unit")
public class EdgeRouterTest {

    private final EdgeRouter router = new EdgeRouter();

    private static GraphNodeDef node(String id, double x, double y) {
        return new GraphNodeDef(id, NodeShape.RECT, new Point(x, y), new Size(80, 40), null, Style.DEFAULT);
    }

    private static GraphEdgeDef edge(String from, String to, EdgeStyle style, ArrowKind arrow) {
        return new GraphEdgeDef(from, to, style, arrow, null, "#333", 2);
    }

    private static RoutedGraph.Edge routeSingle(List<GraphNodeDef> nodes, GraphEdgeDef edge) {
        ShapeProps.GraphProps graph = new ShapeProps.GraphProps(GraphLayout.MANUAL, LayoutDirection.VERTICAL, 50,
                nodes, List.of(edge));
        RoutedGraph routed = new EdgeRouter().route(graph);
        assertThat(routed.edges()).hasSize(1);
        return routed.edges().get(0);
    }

    private static List<GraphNodeDef> stacked() {
        return List.of(node("a", 100, 50), node("b", 100, 200));
    }

    private static List<GraphNodeDef> sideBySide() {
        return List.of(node("a", 50, 100), node("b", 250, 120));
    }

    @Test
    void testStraightEdgeBetweenStackedNodesUsesTopAndBottomAnchors() {
        // Act
        RoutedGraph.Edge edge = routeSingle(stacked(), edge("a", "b", EdgeStyle.STRAIGHT, ArrowKind.FORWARD));

        // Assert
        assertThat(edge.start()).isEqualTo(new Point(100, 70));
        assertThat(edge.end()).isEqualTo(new Point(100, 180));
        assertThat(edge.pathData()).isEqualTo("M 100 70 L 100 180");
        assertThat(edge.labelPosition()).isEqualTo(new Point(100, 125));
        assertThat(edge.arrowHeads()).containsExactly(
                List.of(new Point(100, 180), new Point(95, 170), new Point(105, 170)));
    }

    @Test
    void testCurvedEdgeBetweenStackedNodes() {
        // Act
        RoutedGraph.Edge edge = routeSingle(stacked(), edge("a", "b", EdgeStyle.CURVED, ArrowKind.NONE));

        // Assert
        assertThat(edge.pathData()).isEqualTo("M 100 70 Q 100 125 100 180");
        assertThat(edge.arrowHeads()).isEmpty();
    }

    @Test
    void testOrthogonalEdgeBetweenSideBySideNodes() {
        // Act
        RoutedGraph.Edge edge = routeSingle(sideBySide(), edge("a", "b", EdgeStyle.ORTHOGONAL, ArrowKind.FORWARD));

        // Assert
        assertThat(edge.pathData()).isEqualTo("M 90 100 L 150 100 L 150 120 L 210 120");
        assertThat(edge.arrowHeads()).containsExactly(
                List.of(new Point(210, 120), new Point(200, 125), new Point(200, 115)));
    }

    @Test
    void testCurvedEdgeBetweenSideBySideNodes() {
        // Act
        RoutedGraph.Edge edge = routeSingle(sideBySide(), edge("a", "b", EdgeStyle.CURVED, ArrowKind.FORWARD));

        // Assert
        assertThat(edge.pathData()).isEqualTo("M 90 100 Q 150 100 210 120");
    }

    @Test
    void testBothArrowsPointOutwards() {
        // Act
        RoutedGraph.Edge edge = routeSingle(stacked(), edge("a", "b", EdgeStyle.STRAIGHT, ArrowKind.BOTH));

        // Assert
        assertThat(edge.arrowHeads()).hasSize(2);
        assertThat(edge.arrowHeads().get(1)).containsExactly(
                new Point(100, 70), new Point(105, 80), new Point(95, 80));
    }

    @Test
    void testEdgesWithUnknownNodesAreDropped() {
        // Arrange
        ShapeProps.GraphProps graph = new ShapeProps.GraphProps(GraphLayout.MANUAL, LayoutDirection.VERTICAL, 50,
                stacked(), List.of(
                        edge("a", "missing", EdgeStyle.STRAIGHT, ArrowKind.FORWARD),
                        edge("a", "b", EdgeStyle.STRAIGHT, ArrowKind.FORWARD)));

        // Act
        RoutedGraph routed = router.route(graph);

        // Assert
        assertThat(routed.nodes()).hasSize(2);
        assertThat(routed.edges()).extracting(e -> e.definition().to()).containsExactly("b");
    }
}
