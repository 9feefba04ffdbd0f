package org.iconoglott.compiler.backend.emit.features;

import org.iconoglott.compiler.backend.emit.EmissionContext;
import org.iconoglott.compiler.backend.emit.StyleAttributes;
import org.iconoglott.compiler.backend.emit.TransformComposer;
import org.iconoglott.compiler.frontend.parser.ast.Point;
import org.iconoglott.compiler.frontend.parser.ast.Size;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeNode;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeProps;

import java.util.ArrayList;
import java.util.List;

import static org.iconoglott.compiler.backend.emit.Markup.attr;
import static org.iconoglott.compiler.frontend.lexer.NumberText.format;

/**
 * Emission rules for the self-closing primitive shapes. Missing geometry falls back to
 * fixed defaults: a 100x100 rect or image, a circle of radius 50, an ellipse of radii 50 and
 * 30, and a line from 0,0 to 100,100.
 */
public final class PrimitiveRules {

    private static final Size DEFAULT_BOX = new Size(100, 100);
    private static final Size DEFAULT_ELLIPSE_RADII = new Size(50, 30);
    private static final double DEFAULT_RADIUS = 50;

    private PrimitiveRules() {
        // Rules are registered as method references
    }

    public static void rect(ShapeNode shape, EmissionContext context) {
        ShapeProps.RectProps props = (ShapeProps.RectProps) shape.props();
        Size size = props.size() != null ? props.size() : DEFAULT_BOX;
        StringBuilder out = context.out();
        out.append("<rect")
                .append(attr("x", props.at().x()))
                .append(attr("y", props.at().y()))
                .append(attr("width", size.width()))
                .append(attr("height", size.height()));
        if (shape.style().corner() > 0) {
            out.append(attr("rx", shape.style().corner()));
        }
        close(shape, context);
    }

    public static void circle(ShapeNode shape, EmissionContext context) {
        ShapeProps.CircleProps props = (ShapeProps.CircleProps) shape.props();
        context.out().append("<circle")
                .append(attr("cx", props.at().x()))
                .append(attr("cy", props.at().y()))
                .append(attr("r", props.radius() != null ? props.radius() : DEFAULT_RADIUS));
        close(shape, context);
    }

    public static void ellipse(ShapeNode shape, EmissionContext context) {
        ShapeProps.EllipseProps props = (ShapeProps.EllipseProps) shape.props();
        Size radii = props.radius() != null ? props.radius()
                : props.size() != null ? props.size() : DEFAULT_ELLIPSE_RADII;
        context.out().append("<ellipse")
                .append(attr("cx", props.at().x()))
                .append(attr("cy", props.at().y()))
                .append(attr("rx", radii.width()))
                .append(attr("ry", radii.height()));
        close(shape, context);
    }

    public static void line(ShapeNode shape, EmissionContext context) {
        ShapeProps.LineProps props = (ShapeProps.LineProps) shape.props();
        Point from = props.from() != null ? props.from() : Point.ORIGIN;
        Point to = props.to() != null ? props.to() : new Point(100, 100);
        context.out().append("<line")
                .append(attr("x1", from.x()))
                .append(attr("y1", from.y()))
                .append(attr("x2", to.x()))
                .append(attr("y2", to.y()))
                .append(StyleAttributes.stroked(shape.style(), context.resources()))
                .append(TransformComposer.attribute(shape.transform()))
                .append("/>");
    }

    public static void path(ShapeNode shape, EmissionContext context) {
        ShapeProps.PathProps props = (ShapeProps.PathProps) shape.props();
        context.out().append("<path").append(attr("d", props.d()));
        close(shape, context);
    }

    public static void polygon(ShapeNode shape, EmissionContext context) {
        ShapeProps.PolygonProps props = (ShapeProps.PolygonProps) shape.props();
        List<String> points = new ArrayList<>(props.points().size());
        for (Point p : props.points()) {
            points.add(format(p.x()) + "," + format(p.y()));
        }
        context.out().append("<polygon").append(attr("points", String.join(" ", points)));
        close(shape, context);
    }

    public static void image(ShapeNode shape, EmissionContext context) {
        ShapeProps.ImageProps props = (ShapeProps.ImageProps) shape.props();
        Size size = props.size() != null ? props.size() : DEFAULT_BOX;
        context.out().append("<image")
                .append(attr("x", props.at().x()))
                .append(attr("y", props.at().y()))
                .append(attr("width", size.width()))
                .append(attr("height", size.height()))
                .append(attr("href", props.href()))
                .append(TransformComposer.attribute(shape.transform()))
                .append("/>");
    }

    private static void close(ShapeNode shape, EmissionContext context) {
        context.out()
                .append(StyleAttributes.filled(shape.style(), context.resources(), null))
                .append(TransformComposer.attribute(shape.transform()))
                .append("/>");
    }
}
