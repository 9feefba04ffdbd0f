package org.iconoglott.compiler.backend.layout;

import org.iconoglott.compiler.config.CompilerSettings;
import org.iconoglott.compiler.frontend.parser.ast.Size;
import org.iconoglott.compiler.frontend.parser.features.layout.Alignment;
import org.iconoglott.compiler.frontend.parser.features.layout.Justify;
import org.iconoglott.compiler.frontend.parser.features.layout.LayoutDirection;
import org.iconoglott.compiler.frontend.parser.features.layout.Padding;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeNode;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeProps;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the positions of shapes inside <code>stack</code> and <code>row</code> layouts
 * and places graph nodes. Children of a layout are moved along the primary axis, starting at
 * the layout origin inside its padding and advancing by each child's measured extent plus
 * the gap.
 * <p>
 * A layout with an explicit size distributes its free primary space by its justification,
 * aligns children across the inner size, and with <code>wrap</code> breaks into further
 * lines, each stacked one gap after the widest child of the line before. Without a size
 * there is no free space and children are aligned across the widest child.
 * <p>
 * Measurement is structural. An explicit size wins, radius-based shapes report twice the
 * radius, text is estimated from its character count and font size, nested layouts add up
 * their children, and everything else is a fixed placeholder square.
 */
public final class LayoutEngine {

    private final CompilerSettings settings;
    private final GraphLayoutEngine graphLayout;

    public LayoutEngine(CompilerSettings settings) {
        this(settings, new GraphLayoutEngine(settings));
    }

    public LayoutEngine(CompilerSettings settings, GraphLayoutEngine graphLayout) {
        this.settings = settings;
        this.graphLayout = graphLayout;
    }

    /**
     * Resolves a shape and its subtree top-down: layout children are placed first, then
     * nested layouts, groups and graphs inside them are resolved.
     * @param shape The shape to resolve.
     * @return The shape with absolute child positions.
     */
    public ShapeNode resolve(ShapeNode shape) {
        switch (shape.kind()) {
            case LAYOUT:
                return resolveLayout(shape, (ShapeProps.LayoutProps) shape.props());
            case GROUP:
                List<ShapeNode> children = new ArrayList<>(shape.children().size());
                for (ShapeNode child : shape.children()) {
                    children.add(resolve(child));
                }
                return shape.withChildren(children);
            case GRAPH:
                return shape.withProps(graphLayout.place((ShapeProps.GraphProps) shape.props()));
            default:
                return shape;
        }
    }

    private ShapeNode resolveLayout(ShapeNode layout, ShapeProps.LayoutProps props) {
        boolean vertical = props.direction() == LayoutDirection.VERTICAL;
        Padding padding = props.padding();
        double originX = props.at().x() + padding.left();
        double originY = props.at().y() + padding.top();
        Double available = null;
        Double availableCross = null;
        if (props.size() != null) {
            double innerWidth = props.size().width() - padding.horizontal();
            double innerHeight = props.size().height() - padding.vertical();
            available = vertical ? innerHeight : innerWidth;
            availableCross = vertical ? innerWidth : innerHeight;
        }

        List<List<Measured>> lines = lines(layout.children(), props, vertical, available);
        List<ShapeNode> placed = new ArrayList<>(layout.children().size());
        double lineOffset = 0;
        for (List<Measured> line : lines) {
            double extent = 0;
            double lineCross = 0;
            for (Measured item : line) {
                extent += item.main();
                lineCross = Math.max(lineCross, item.cross());
            }
            extent += props.gap() * (line.size() - 1);
            double free = available != null ? Math.max(0, available - extent) : 0;
            double crossSpace = availableCross != null && lines.size() == 1 ? availableCross : lineCross;

            double position = leadingSpace(props.justify(), free, line.size());
            double between = spaceBetween(props.justify(), free, line.size());
            for (Measured item : line) {
                double crossPosition = lineOffset + crossOffset(props.align(), crossSpace, item.cross());
                ShapeNode moved = vertical
                        ? item.shape().translated(originX + crossPosition, originY + position)
                        : item.shape().translated(originX + position, originY + crossPosition);
                placed.add(resolve(moved));
                position += item.main() + props.gap() + between;
            }
            lineOffset += lineCross + props.gap();
        }
        return layout.withChildren(placed);
    }

    /**
     * Splits the children into lines. Without wrapping, or without an explicit size, all
     * children share one line. A child that does not fit starts a new line unless it is the
     * first of its line.
     */
    private List<List<Measured>> lines(List<ShapeNode> children, ShapeProps.LayoutProps props,
                                       boolean vertical, Double available) {
        List<List<Measured>> lines = new ArrayList<>();
        List<Measured> current = new ArrayList<>();
        double extent = 0;
        for (ShapeNode child : children) {
            Size size = measure(child);
            Measured item = vertical
                    ? new Measured(child, size.height(), size.width())
                    : new Measured(child, size.width(), size.height());
            double needed = current.isEmpty() ? item.main() : extent + props.gap() + item.main();
            if (props.wrap() && available != null && !current.isEmpty() && needed > available) {
                lines.add(current);
                current = new ArrayList<>();
                needed = item.main();
            }
            current.add(item);
            extent = needed;
        }
        if (!current.isEmpty()) {
            lines.add(current);
        }
        return lines;
    }

    private static double leadingSpace(Justify justify, double free, int count) {
        switch (justify) {
            case END:
                return free;
            case CENTER:
                return free / 2;
            case SPACE_AROUND:
                return free / count / 2;
            case SPACE_EVENLY:
                return free / (count + 1);
            default:
                return 0;
        }
    }

    private static double spaceBetween(Justify justify, double free, int count) {
        switch (justify) {
            case SPACE_BETWEEN:
                return count > 1 ? free / (count - 1) : 0;
            case SPACE_AROUND:
                return free / count;
            case SPACE_EVENLY:
                return free / (count + 1);
            default:
                return 0;
        }
    }

    private static double crossOffset(Alignment align, double space, double extent) {
        switch (align) {
            case CENTER:
                return (space - extent) / 2;
            case END:
                return space - extent;
            default:
                return 0;
        }
    }

    private record Measured(ShapeNode shape, double main, double cross) {
    }

    /**
     * Measures the extent a shape occupies in a layout.
     * @param shape The shape to measure.
     * @return The width and height.
     */
    public Size measure(ShapeNode shape) {
        ShapeProps props = shape.props();
        if (props instanceof ShapeProps.RectProps rect && rect.size() != null) {
            return rect.size();
        }
        if (props instanceof ShapeProps.ImageProps image && image.size() != null) {
            return image.size();
        }
        if (props instanceof ShapeProps.CircleProps circle && circle.radius() != null) {
            return new Size(circle.radius() * 2, circle.radius() * 2);
        }
        if (props instanceof ShapeProps.EllipseProps ellipse) {
            Size radii = ellipse.radius() != null ? ellipse.radius() : ellipse.size();
            if (radii != null) {
                return new Size(radii.width() * 2, radii.height() * 2);
            }
        }
        if (props instanceof ShapeProps.TextProps text) {
            double fontSize = shape.style().fontSize();
            int characters = text.content().codePointCount(0, text.content().length());
            return new Size(characters * fontSize * settings.textWidthFactor(),
                    fontSize * settings.textHeightFactor());
        }
        if (props instanceof ShapeProps.UseProps use && use.size() != null) {
            return use.size();
        }
        if (props instanceof ShapeProps.LayoutProps layout) {
            return layout.size() != null ? layout.size() : measureLayout(shape.children(), layout);
        }
        return new Size(settings.placeholderSize(), settings.placeholderSize());
    }

    private Size measureLayout(List<ShapeNode> children, ShapeProps.LayoutProps layout) {
        boolean vertical = layout.direction() == LayoutDirection.VERTICAL;
        double primary = 0;
        double cross = 0;
        for (ShapeNode child : children) {
            Size extent = measure(child);
            primary += (vertical ? extent.height() : extent.width()) + layout.gap();
            cross = Math.max(cross, vertical ? extent.width() : extent.height());
        }
        Padding padding = layout.padding();
        return vertical
                ? new Size(cross + padding.horizontal(), primary + padding.vertical())
                : new Size(primary + padding.horizontal(), cross + padding.vertical());
    }
}
