package org.iconoglott.compiler.backend.layout;

import org.iconoglott.compiler.frontend.parser.ast.Point;
import org.iconoglott.compiler.frontend.parser.features.graph.ArrowKind;
import org.iconoglott.compiler.frontend.parser.features.graph.GraphEdgeDef;
import org.iconoglott.compiler.frontend.parser.features.graph.GraphNodeDef;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeProps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.iconoglott.compiler.frontend.lexer.NumberText.format;

/**
 * Turns the edges of a placed graph into connector geometry.
 * <p>
 * An edge leaves and enters its nodes on the side facing the other node: when the vertical
 * distance between the centers dominates, the anchors are on the top or bottom edges,
 * otherwise on the left or right edges.
 */
public final class EdgeRouter {

    private static final Logger LOG = LoggerFactory.getLogger(EdgeRouter.class);

    static final double ARROW_LENGTH = 10;
    static final double ARROW_HALF_WIDTH = 5;

    /**
     * @param graph A graph whose nodes all have a center and a size.
     * @return The routed graph. Edges naming an unknown node are dropped.
     */
    public RoutedGraph route(ShapeProps.GraphProps graph) {
        Map<String, GraphNodeDef> byId = new LinkedHashMap<>();
        for (GraphNodeDef node : graph.nodes()) {
            byId.putIfAbsent(node.id(), node);
        }

        List<RoutedGraph.Edge> edges = new ArrayList<>(graph.edges().size());
        for (GraphEdgeDef edge : graph.edges()) {
            GraphNodeDef from = byId.get(edge.from());
            GraphNodeDef to = byId.get(edge.to());
            if (from == null || to == null) {
                LOG.debug("Dropping edge '{}' -> '{}': unknown node id.", edge.from(), edge.to());
                continue;
            }
            edges.add(connect(edge, from, to));
        }
        return new RoutedGraph(graph.nodes(), edges);
    }

    private RoutedGraph.Edge connect(GraphEdgeDef edge, GraphNodeDef from, GraphNodeDef to) {
        double dx = to.at().x() - from.at().x();
        double dy = to.at().y() - from.at().y();
        boolean verticalDominant = Math.abs(dy) > Math.abs(dx);

        Point start;
        Point end;
        if (verticalDominant) {
            double sign = Math.signum(dy);
            start = from.at().plus(0, sign * from.size().height() / 2);
            end = to.at().plus(0, -sign * to.size().height() / 2);
        } else {
            double sign = dx < 0 ? -1 : 1;
            start = from.at().plus(sign * from.size().width() / 2, 0);
            end = to.at().plus(-sign * to.size().width() / 2, 0);
        }

        List<Point> controls = new ArrayList<>();
        String path;
        switch (edge.style()) {
            case CURVED:
                Point control = verticalDominant
                        ? new Point(start.x(), (start.y() + end.y()) / 2)
                        : new Point((start.x() + end.x()) / 2, start.y());
                controls.add(control);
                path = "M " + coords(start) + " Q " + coords(control) + " " + coords(end);
                break;
            case ORTHOGONAL:
                double midX = (start.x() + end.x()) / 2;
                Point first = new Point(midX, start.y());
                Point second = new Point(midX, end.y());
                controls.add(first);
                controls.add(second);
                path = "M " + coords(start) + " L " + coords(first) + " L " + coords(second) + " L " + coords(end);
                break;
            default:
                path = "M " + coords(start) + " L " + coords(end);
                break;
        }

        List<Point> polyline = new ArrayList<>();
        polyline.add(start);
        polyline.addAll(controls);
        polyline.add(end);

        List<List<Point>> heads = new ArrayList<>();
        if (edge.arrow() == ArrowKind.FORWARD || edge.arrow() == ArrowKind.BOTH) {
            addHead(heads, end, precedingPoint(polyline));
        }
        if (edge.arrow() == ArrowKind.BACKWARD || edge.arrow() == ArrowKind.BOTH) {
            addHead(heads, start, precedingPoint(reversed(polyline)));
        }

        Point label = new Point((start.x() + end.x()) / 2, (start.y() + end.y()) / 2);
        return new RoutedGraph.Edge(edge, start, end, path, label, heads);
    }

    /**
     * @return The last point of the polyline that differs from its final point, or {@code null}.
     */
    private static Point precedingPoint(List<Point> polyline) {
        Point tip = polyline.get(polyline.size() - 1);
        for (int i = polyline.size() - 2; i >= 0; i--) {
            if (!polyline.get(i).equals(tip)) {
                return polyline.get(i);
            }
        }
        return null;
    }

    private static List<Point> reversed(List<Point> points) {
        List<Point> copy = new ArrayList<>(points);
        Collections.reverse(copy);
        return copy;
    }

    private static void addHead(List<List<Point>> heads, Point tip, Point behind) {
        if (behind == null) {
            return;
        }
        double vx = tip.x() - behind.x();
        double vy = tip.y() - behind.y();
        double length = Math.hypot(vx, vy);
        double ux = vx / length;
        double uy = vy / length;
        Point base = tip.plus(-ux * ARROW_LENGTH, -uy * ARROW_LENGTH);
        heads.add(List.of(
                tip,
                base.plus(-uy * ARROW_HALF_WIDTH, ux * ARROW_HALF_WIDTH),
                base.plus(uy * ARROW_HALF_WIDTH, -ux * ARROW_HALF_WIDTH)));
    }

    private static String coords(Point p) {
        return format(p.x()) + " " + format(p.y());
    }
}
