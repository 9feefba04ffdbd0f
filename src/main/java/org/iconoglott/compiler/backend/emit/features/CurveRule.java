package org.iconoglott.compiler.backend.emit.features;

import org.iconoglott.compiler.backend.emit.EmissionContext;
import org.iconoglott.compiler.backend.emit.IEmissionRule;
import org.iconoglott.compiler.backend.emit.StyleAttributes;
import org.iconoglott.compiler.backend.emit.TransformComposer;
import org.iconoglott.compiler.frontend.parser.ast.Point;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeNode;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeProps;

import java.util.List;

import static org.iconoglott.compiler.backend.emit.Markup.attr;
import static org.iconoglott.compiler.frontend.lexer.NumberText.format;

/**
 * Emits a curve through its points as a <code>path</code> element.
 * <p>
 * A sharp curve joins the points with straight segments. A smooth curve is a Catmull-Rom
 * spline through every point, written as one cubic Bezier segment per pair of neighbours;
 * the end points of an open curve act as their own outer neighbours. A closed curve returns
 * to its first point. An open curve is not filled unless it has a fill of its own.
 */
public class CurveRule implements IEmissionRule {

    @Override
    public void emit(ShapeNode shape, EmissionContext context) {
        ShapeProps.CurveProps props = (ShapeProps.CurveProps) shape.props();
        context.out().append("<path")
                .append(attr("d", pathData(props.points(), props.smooth(), props.closed())))
                .append(StyleAttributes.filled(shape.style(), context.resources(), props.closed() ? null : "none"))
                .append(TransformComposer.attribute(shape.transform()))
                .append("/>");
    }

    /**
     * Builds the path data of a curve.
     * @param points The points the curve passes through.
     * @param smooth {@code true} for cubic segments, {@code false} for straight ones.
     * @param closed {@code true} to return to the first point.
     * @return The path data, empty for no points.
     */
    static String pathData(List<Point> points, boolean smooth, boolean closed) {
        if (points.isEmpty()) {
            return "";
        }
        StringBuilder d = new StringBuilder("M ").append(xy(points.get(0)));
        int n = points.size();
        int segments = closed && n > 2 ? n : n - 1;
        for (int i = 0; i < segments; i++) {
            Point p1 = points.get(i);
            Point p2 = points.get((i + 1) % n);
            if (!smooth) {
                if (i + 1 < n) {
                    d.append(" L ").append(xy(p2));
                }
                continue;
            }
            Point p0 = closed ? points.get((i - 1 + n) % n) : points.get(Math.max(i - 1, 0));
            Point p3 = closed ? points.get((i + 2) % n) : points.get(Math.min(i + 2, n - 1));
            Point c1 = new Point(p1.x() + (p2.x() - p0.x()) / 6, p1.y() + (p2.y() - p0.y()) / 6);
            Point c2 = new Point(p2.x() - (p3.x() - p1.x()) / 6, p2.y() - (p3.y() - p1.y()) / 6);
            d.append(" C ").append(xy(c1)).append(' ').append(xy(c2)).append(' ').append(xy(p2));
        }
        if (closed) {
            d.append(" Z");
        }
        return d.toString();
    }

    private static String xy(Point p) {
        return format(p.x()) + " " + format(p.y());
    }
}
