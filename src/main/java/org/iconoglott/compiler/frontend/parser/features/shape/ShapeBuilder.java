package org.iconoglott.compiler.frontend.parser.features.shape;

import org.iconoglott.compiler.frontend.parser.features.layout.LayoutOptions;
import org.iconoglott.compiler.frontend.parser.features.style.Style;
import org.iconoglott.compiler.frontend.parser.features.transform.Transform;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects everything a shape statement and its block declare before the immutable
 * {@link ShapeNode} is built.
 */
public final class ShapeBuilder {

    private final ShapeKind kind;
    private final int line;
    private final PropertySet properties = new PropertySet();
    private final Style.Builder style = Style.builder();
    private final Transform.Builder transform = Transform.builder();
    private final List<ShapeNode> children = new ArrayList<>();
    private final LayoutOptions layout;

    public ShapeBuilder(ShapeKind kind, int line) {
        this(kind, line, null);
    }

    /**
     * @param kind The shape kind.
     * @param line The line of the statement keyword.
     * @param layout The options a layout block may update, or {@code null} for other kinds.
     */
    public ShapeBuilder(ShapeKind kind, int line, LayoutOptions layout) {
        this.kind = kind;
        this.line = line;
        this.layout = layout;
    }

    public ShapeKind kind() {
        return kind;
    }

    PropertySet properties() {
        return properties;
    }

    public Style.Builder style() {
        return style;
    }

    public Transform.Builder transform() {
        return transform;
    }

    /**
     * @return The layout options, or {@code null} if this is not a layout.
     */
    public LayoutOptions layout() {
        return layout;
    }

    public void addChild(ShapeNode child) {
        children.add(child);
    }

    /**
     * Builds a primitive shape from the collected properties.
     * @return The shape node.
     */
    public ShapeNode build() {
        return build(ShapeProps.of(kind, properties));
    }

    /**
     * Builds a container shape with explicit properties.
     * @param props The properties of the container.
     * @return The shape node.
     */
    public ShapeNode build(ShapeProps props) {
        return new ShapeNode(kind, props, style.build(), transform.build(), children, line);
    }
}
