package org.iconoglott.compiler.frontend.parser.features.shape;

/**
 * All kinds of shapes a scene can contain.
 */
public enum ShapeKind {
    RECT("rect"),
    CIRCLE("circle"),
    ELLIPSE("ellipse"),
    LINE("line"),
    PATH("path"),
    POLYGON("polygon"),
    CURVE("curve"),
    TEXT("text"),
    IMAGE("image"),
    GROUP("group"),
    LAYOUT("layout"),
    GRAPH("graph"),
    USE("use");

    private final String keyword;

    ShapeKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * @return {@code true} for kinds parsed by the generic shape statement and built from
     * positional and labeled values.
     */
    public boolean isPrimitive() {
        return this != GROUP && this != LAYOUT && this != GRAPH && this != USE;
    }
}
