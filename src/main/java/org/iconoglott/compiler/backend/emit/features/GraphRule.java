package org.iconoglott.compiler.backend.emit.features;

import org.iconoglott.compiler.backend.emit.EmissionContext;
import org.iconoglott.compiler.backend.emit.IEmissionRule;
import org.iconoglott.compiler.backend.emit.TransformComposer;
import org.iconoglott.compiler.backend.layout.EdgeRouter;
import org.iconoglott.compiler.backend.layout.RoutedGraph;
import org.iconoglott.compiler.frontend.parser.ast.Point;
import org.iconoglott.compiler.frontend.parser.ast.Size;
import org.iconoglott.compiler.frontend.parser.features.graph.GraphNodeDef;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeKind;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeNode;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeProps;
import org.iconoglott.compiler.frontend.parser.features.style.Style;
import org.iconoglott.compiler.frontend.parser.features.transform.Transform;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands a placed graph into primitive shapes inside a <code>g</code> element.
 * Connectors, their arrow heads and labels come first so that nodes are drawn on top.
 */
public class GraphRule implements IEmissionRule {

    static final String NODE_FILL = "#fff";
    static final String NODE_STROKE = "#333";
    static final String EDGE_LABEL_FILL = "#333";
    static final double EDGE_LABEL_SIZE = 12;
    static final double NODE_LABEL_SIZE = 14;

    private final EdgeRouter router;

    public GraphRule() {
        this(new EdgeRouter());
    }

    public GraphRule(EdgeRouter router) {
        this.router = router;
    }

    @Override
    public void emit(ShapeNode shape, EmissionContext context) {
        RoutedGraph graph = router.route((ShapeProps.GraphProps) shape.props());
        context.out().append("<g").append(TransformComposer.attribute(shape.transform())).append('>');
        for (ShapeNode primitive : expand(graph, shape.line())) {
            context.emit(primitive);
        }
        context.out().append("</g>");
    }

    /**
     * @param graph The routed graph.
     * @param line The source line the primitives are attributed to.
     * @return The primitives in drawing order.
     */
    List<ShapeNode> expand(RoutedGraph graph, int line) {
        List<ShapeNode> shapes = new ArrayList<>();
        for (RoutedGraph.Edge edge : graph.edges()) {
            String stroke = edge.definition().stroke();
            Style connector = Style.builder()
                    .fill("none")
                    .stroke(stroke)
                    .strokeWidth(edge.definition().strokeWidth())
                    .build();
            shapes.add(primitive(ShapeKind.PATH, new ShapeProps.PathProps(edge.pathData()), connector, line));
            for (List<Point> head : edge.arrowHeads()) {
                shapes.add(primitive(ShapeKind.POLYGON, new ShapeProps.PolygonProps(head),
                        Style.builder().fill(stroke).build(), line));
            }
            if (edge.definition().label() != null) {
                Style label = Style.builder().fill(EDGE_LABEL_FILL).fontSize(EDGE_LABEL_SIZE).textAnchor("middle").build();
                shapes.add(primitive(ShapeKind.TEXT,
                        new ShapeProps.TextProps(edge.labelPosition(), edge.definition().label()), label, line));
            }
        }
        for (GraphNodeDef node : graph.nodes()) {
            shapes.add(outline(node, line));
            if (node.label() != null) {
                Style label = Style.builder().fontSize(NODE_LABEL_SIZE).textAnchor("middle").build();
                shapes.add(primitive(ShapeKind.TEXT, new ShapeProps.TextProps(node.at(), node.label()), label, line));
            }
        }
        return shapes;
    }

    private static ShapeNode outline(GraphNodeDef node, int line) {
        Style.Builder style = node.style().toBuilder();
        if (node.style().fill() == null) {
            style.fill(NODE_FILL);
        }
        if (node.style().stroke() == null) {
            style.stroke(NODE_STROKE);
        }
        Point c = node.at();
        Size size = node.size();
        double halfW = size.width() / 2;
        double halfH = size.height() / 2;
        switch (node.shape()) {
            case CIRCLE:
                return primitive(ShapeKind.CIRCLE,
                        new ShapeProps.CircleProps(c, Math.min(halfW, halfH)), style.build(), line);
            case ELLIPSE:
                return primitive(ShapeKind.ELLIPSE,
                        new ShapeProps.EllipseProps(c, null, new Size(halfW, halfH)), style.build(), line);
            case DIAMOND:
                return primitive(ShapeKind.POLYGON, new ShapeProps.PolygonProps(List.of(
                        c.plus(0, -halfH), c.plus(halfW, 0), c.plus(0, halfH), c.plus(-halfW, 0))),
                        style.build(), line);
            default:
                return primitive(ShapeKind.RECT,
                        new ShapeProps.RectProps(c.plus(-halfW, -halfH), size), style.build(), line);
        }
    }

    private static ShapeNode primitive(ShapeKind kind, ShapeProps props, Style style, int line) {
        return new ShapeNode(kind, props, style, Transform.IDENTITY, List.of(), line);
    }
}
