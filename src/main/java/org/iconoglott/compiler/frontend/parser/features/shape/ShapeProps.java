package org.iconoglott.compiler.frontend.parser.features.shape;

import org.iconoglott.compiler.frontend.parser.ast.Point;
import org.iconoglott.compiler.frontend.parser.ast.Size;
import org.iconoglott.compiler.frontend.parser.features.graph.GraphEdgeDef;
import org.iconoglott.compiler.frontend.parser.features.graph.GraphLayout;
import org.iconoglott.compiler.frontend.parser.features.graph.GraphNodeDef;
import org.iconoglott.compiler.frontend.parser.features.layout.Alignment;
import org.iconoglott.compiler.frontend.parser.features.layout.Justify;
import org.iconoglott.compiler.frontend.parser.features.layout.LayoutDirection;
import org.iconoglott.compiler.frontend.parser.features.layout.Padding;

import java.util.ArrayList;
import java.util.List;

/**
 * The geometry of a shape, one variant per {@link ShapeKind}. Optional components are
 * {@code null} when the source did not set them; the renderer supplies defaults.
 */
public sealed interface ShapeProps {

    /**
     * Returns these properties moved by an offset. Kinds without a position return themselves.
     * @param dx The horizontal offset.
     * @param dy The vertical offset.
     * @return The moved properties.
     */
    ShapeProps translated(double dx, double dy);

    record RectProps(Point at, Size size) implements ShapeProps {
        @Override
        public ShapeProps translated(double dx, double dy) {
            return new RectProps(at.plus(dx, dy), size);
        }
    }

    record CircleProps(Point at, Double radius) implements ShapeProps {
        @Override
        public ShapeProps translated(double dx, double dy) {
            return new CircleProps(at.plus(dx, dy), radius);
        }
    }

    /**
     * @param radius Explicit per-axis radii; takes precedence over {@code size}.
     * @param size Radii given through {@code size}.
     */
    record EllipseProps(Point at, Size size, Size radius) implements ShapeProps {
        @Override
        public ShapeProps translated(double dx, double dy) {
            return new EllipseProps(at.plus(dx, dy), size, radius);
        }
    }

    record LineProps(Point from, Point to) implements ShapeProps {
        @Override
        public ShapeProps translated(double dx, double dy) {
            return new LineProps(from == null ? null : from.plus(dx, dy), to == null ? null : to.plus(dx, dy));
        }
    }

    /** Path data cannot be moved without parsing it, so paths keep their coordinates. */
    record PathProps(String d) implements ShapeProps {
        @Override
        public ShapeProps translated(double dx, double dy) {
            return this;
        }
    }

    record PolygonProps(List<Point> points) implements ShapeProps {
        public PolygonProps {
            points = List.copyOf(points);
        }

        @Override
        public ShapeProps translated(double dx, double dy) {
            List<Point> moved = new ArrayList<>(points.size());
            for (Point p : points) {
                moved.add(p.plus(dx, dy));
            }
            return new PolygonProps(moved);
        }
    }

    /**
     * @param smooth {@code true} to pass through the points on a smooth curve, {@code false}
     *               for straight segments.
     * @param closed {@code true} to join the last point back to the first.
     */
    record CurveProps(List<Point> points, boolean smooth, boolean closed) implements ShapeProps {
        public CurveProps {
            points = List.copyOf(points);
        }

        @Override
        public ShapeProps translated(double dx, double dy) {
            List<Point> moved = new ArrayList<>(points.size());
            for (Point p : points) {
                moved.add(p.plus(dx, dy));
            }
            return new CurveProps(moved, smooth, closed);
        }
    }

    record TextProps(Point at, String content) implements ShapeProps {
        @Override
        public ShapeProps translated(double dx, double dy) {
            return new TextProps(at.plus(dx, dy), content);
        }
    }

    record ImageProps(Point at, Size size, String href) implements ShapeProps {
        @Override
        public ShapeProps translated(double dx, double dy) {
            return new ImageProps(at.plus(dx, dy), size, href);
        }
    }

    record GroupProps(String name) implements ShapeProps {
        @Override
        public ShapeProps translated(double dx, double dy) {
            return this;
        }
    }

    /**
     * @param size The outer size, or {@code null} to size the layout to its children.
     *             Justification and wrapping need a size to have any effect.
     */
    record LayoutProps(
            LayoutDirection direction,
            double gap,
            Point at,
            Size size,
            Justify justify,
            Alignment align,
            Padding padding,
            boolean wrap
    ) implements ShapeProps {

        /** A layout sized to its children, with start justification and alignment. */
        public LayoutProps(LayoutDirection direction, double gap, Point at) {
            this(direction, gap, at, null, Justify.START, Alignment.START, Padding.ZERO, false);
        }

        @Override
        public ShapeProps translated(double dx, double dy) {
            return new LayoutProps(direction, gap, at.plus(dx, dy), size, justify, align, padding, wrap);
        }
    }

    /**
     * A placed instance of a symbol.
     * @param href The id of the symbol.
     * @param size The drawn size, or {@code null} for the symbol's own size.
     */
    record UseProps(String href, Point at, Size size) implements ShapeProps {
        @Override
        public ShapeProps translated(double dx, double dy) {
            return new UseProps(href, at.plus(dx, dy), size);
        }
    }

    /** Graph coordinates are absolute; a graph inside a layout is not moved. */
    record GraphProps(
            GraphLayout layout,
            LayoutDirection direction,
            double spacing,
            List<GraphNodeDef> nodes,
            List<GraphEdgeDef> edges
    ) implements ShapeProps {
        public GraphProps {
            nodes = List.copyOf(nodes);
            edges = List.copyOf(edges);
        }

        @Override
        public ShapeProps translated(double dx, double dy) {
            return this;
        }
    }

    /**
     * Builds the typed properties of a primitive shape from the collected property set.
     * @param kind A primitive kind.
     * @param set The collected properties.
     * @return The typed properties.
     */
    static ShapeProps of(ShapeKind kind, PropertySet set) {
        Point at = set.at != null ? set.at : Point.ORIGIN;
        switch (kind) {
            case RECT:
                return new RectProps(at, set.size);
            case CIRCLE:
                return new CircleProps(at, set.radius != null ? set.radius
                        : set.radiusPair != null ? Double.valueOf(set.radiusPair.width()) : null);
            case ELLIPSE:
                Size radius = set.radiusPair != null ? set.radiusPair
                        : set.radius != null ? new Size(set.radius, set.radius) : null;
                return new EllipseProps(at, set.size, radius);
            case LINE:
                return new LineProps(set.from, set.to);
            case PATH:
                return new PathProps(set.d != null ? set.d : set.content != null ? set.content : "");
            case POLYGON:
                return new PolygonProps(set.points != null ? set.points : List.of());
            case CURVE:
                return new CurveProps(set.points != null ? set.points : List.of(),
                        set.smooth == null || set.smooth, set.closed);
            case TEXT:
                return new TextProps(at, set.content != null ? set.content : "");
            case IMAGE:
                return new ImageProps(at, set.size, set.href != null ? set.href : "");
            default:
                throw new IllegalArgumentException("Not a primitive shape: " + kind);
        }
    }
}
