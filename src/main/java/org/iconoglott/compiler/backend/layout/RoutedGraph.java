package org.iconoglott.compiler.backend.layout;

import org.iconoglott.compiler.frontend.parser.ast.Point;
import org.iconoglott.compiler.frontend.parser.features.graph.GraphEdgeDef;
import org.iconoglott.compiler.frontend.parser.features.graph.GraphNodeDef;

import java.util.List;

/**
 * A placed graph whose edges have been resolved to concrete connector geometry.
 *
 * @param nodes The nodes with center and size set, in authored order.
 * @param edges The edges whose endpoints both exist, in authored order.
 */
public record RoutedGraph(List<GraphNodeDef> nodes, List<Edge> edges) {

    public RoutedGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    /**
     * A connector between two node anchors.
     *
     * @param definition The authored edge.
     * @param start The anchor on the source node.
     * @param end The anchor on the target node.
     * @param pathData The connector as SVG path data.
     * @param labelPosition The midpoint between the anchors.
     * @param arrowHeads The triangles drawn at the arrow ends, each as three points.
     */
    public record Edge(
            GraphEdgeDef definition,
            Point start,
            Point end,
            String pathData,
            Point labelPosition,
            List<List<Point>> arrowHeads
    ) {
        public Edge {
            arrowHeads = List.copyOf(arrowHeads);
        }
    }
}
