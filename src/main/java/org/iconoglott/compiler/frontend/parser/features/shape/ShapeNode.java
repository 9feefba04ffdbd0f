package org.iconoglott.compiler.frontend.parser.features.shape;

import org.iconoglott.compiler.frontend.parser.ast.AstNode;
import org.iconoglott.compiler.frontend.parser.features.style.Style;
import org.iconoglott.compiler.frontend.parser.features.transform.Transform;

import java.util.ArrayList;
import java.util.List;

/**
 * An AST node for a shape, group, layout or graph. A shape owns its children.
 *
 * @param kind The shape kind.
 * @param props The kind-specific geometry.
 * @param style The visual attributes.
 * @param transform The geometric transform.
 * @param children The nested shapes; only groups and layouts have any.
 * @param line The 1-based line of the statement keyword.
 */
public record ShapeNode(
        ShapeKind kind,
        ShapeProps props,
        Style style,
        Transform transform,
        List<ShapeNode> children,
        int line
) implements AstNode {

    public ShapeNode {
        children = List.copyOf(children);
    }

    /**
     * Returns this shape moved by an offset, including all of its children.
     * @param dx The horizontal offset.
     * @param dy The vertical offset.
     * @return The moved shape.
     */
    public ShapeNode translated(double dx, double dy) {
        if (dx == 0 && dy == 0) {
            return this;
        }
        List<ShapeNode> moved = children;
        if (kind == ShapeKind.GROUP) {
            moved = new ArrayList<>(children.size());
            for (ShapeNode child : children) {
                moved.add(child.translated(dx, dy));
            }
        }
        return new ShapeNode(kind, props.translated(dx, dy), style, transform, moved, line);
    }

    /**
     * @param newChildren The replacement children.
     * @return A copy of this shape with other children.
     */
    public ShapeNode withChildren(List<ShapeNode> newChildren) {
        return new ShapeNode(kind, props, style, transform, newChildren, line);
    }

    /**
     * @param newProps The replacement properties.
     * @return A copy of this shape with other properties.
     */
    public ShapeNode withProps(ShapeProps newProps) {
        return new ShapeNode(kind, newProps, style, transform, children, line);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(children);
    }
}
