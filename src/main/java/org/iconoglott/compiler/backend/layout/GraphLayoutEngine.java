package org.iconoglott.compiler.backend.layout;

import org.iconoglott.compiler.config.CompilerSettings;
import org.iconoglott.compiler.frontend.parser.ast.Point;
import org.iconoglott.compiler.frontend.parser.ast.Size;
import org.iconoglott.compiler.frontend.parser.features.graph.GraphNodeDef;
import org.iconoglott.compiler.frontend.parser.features.layout.LayoutDirection;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeProps;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns a center and a size to every node of a graph.
 * <ul>
 *     <li><b>hierarchical</b>: nodes follow each other along the graph direction, each
 *     advancing the cursor by its own extent plus the spacing.</li>
 *     <li><b>grid</b>: nodes fill rows of ⌈√n⌉ square cells sized by the largest node.</li>
 *     <li><b>manual</b>: authored centers are kept; nodes without one sit at the origin.</li>
 * </ul>
 */
public final class GraphLayoutEngine {

    private final CompilerSettings settings;

    public GraphLayoutEngine(CompilerSettings settings) {
        this.settings = settings;
    }

    /**
     * @param graph The graph as parsed.
     * @return The same graph with every node's center and size set.
     */
    public ShapeProps.GraphProps place(ShapeProps.GraphProps graph) {
        List<GraphNodeDef> nodes;
        switch (graph.layout()) {
            case HIERARCHICAL:
                nodes = hierarchical(graph);
                break;
            case GRID:
                nodes = grid(graph);
                break;
            default:
                nodes = manual(graph);
                break;
        }
        return new ShapeProps.GraphProps(graph.layout(), graph.direction(), graph.spacing(), nodes, graph.edges());
    }

    private List<GraphNodeDef> hierarchical(ShapeProps.GraphProps graph) {
        boolean vertical = graph.direction() == LayoutDirection.VERTICAL;
        double spacing = graph.spacing();
        double cursor = spacing;
        List<GraphNodeDef> placed = new ArrayList<>(graph.nodes().size());
        for (GraphNodeDef node : graph.nodes()) {
            Size size = sizeOf(node);
            Point center = vertical
                    ? new Point(spacing + size.width() / 2, cursor + size.height() / 2)
                    : new Point(cursor + size.width() / 2, spacing + size.height() / 2);
            placed.add(withGeometry(node, center, size));
            cursor += (vertical ? size.height() : size.width()) + spacing;
        }
        return placed;
    }

    private List<GraphNodeDef> grid(ShapeProps.GraphProps graph) {
        int count = graph.nodes().size();
        int columns = Math.max(1, (int) Math.ceil(Math.sqrt(count)));
        double cell = 0;
        for (GraphNodeDef node : graph.nodes()) {
            Size size = sizeOf(node);
            cell = Math.max(cell, Math.max(size.width(), size.height()));
        }
        double spacing = graph.spacing();
        double pitch = cell + spacing;
        List<GraphNodeDef> placed = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            GraphNodeDef node = graph.nodes().get(i);
            int column = i % columns;
            int row = i / columns;
            Point center = new Point(spacing + column * pitch + cell / 2, spacing + row * pitch + cell / 2);
            placed.add(withGeometry(node, center, sizeOf(node)));
        }
        return placed;
    }

    private List<GraphNodeDef> manual(ShapeProps.GraphProps graph) {
        List<GraphNodeDef> placed = new ArrayList<>(graph.nodes().size());
        for (GraphNodeDef node : graph.nodes()) {
            placed.add(withGeometry(node, node.at() != null ? node.at() : Point.ORIGIN, sizeOf(node)));
        }
        return placed;
    }

    private Size sizeOf(GraphNodeDef node) {
        return node.size() != null ? node.size() : new Size(settings.nodeWidth(), settings.nodeHeight());
    }

    private static GraphNodeDef withGeometry(GraphNodeDef node, Point center, Size size) {
        return new GraphNodeDef(node.id(), node.shape(), center, size, node.label(), node.style());
    }
}
