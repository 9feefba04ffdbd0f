package org.iconoglott.compiler.frontend.parser.features.shape;

import org.iconoglott.compiler.frontend.parser.ast.Point;
import org.iconoglott.compiler.frontend.parser.ast.Size;

import java.util.List;

/**
 * The untyped properties collected from a shape statement before they are turned into
 * the typed {@link ShapeProps} of its kind. Positional inference happens here:
 * the first unlabeled pair is the position, the second the size.
 */
final class PropertySet {

    Point at;
    Size size;
    Double radius;
    Size radiusPair;
    Double width;
    String content;
    Point from;
    Point to;
    String d;
    List<Point> points;
    String href;
    Boolean smooth;
    boolean closed;

    void positionalPair(double x, double y) {
        if (at == null) {
            at = new Point(x, y);
        } else if (size == null) {
            size = new Size(x, y);
        }
    }

    void curveModifier(String modifier) {
        switch (modifier) {
            case "smooth":
                smooth = true;
                break;
            case "sharp":
                smooth = false;
                break;
            case "closed":
                closed = true;
                break;
            default:
                break;
        }
    }

    void positionalNumber(ShapeKind kind, double value) {
        if (kind == ShapeKind.CIRCLE && radius == null) {
            radius = value;
        } else if (width == null) {
            // Not read by any shape kind; kept so a second number does not replace the first.
            width = value;
        }
    }
}
