package org.iconoglott.compiler.frontend.parser.features.graph;

import java.util.Locale;
import java.util.Optional;

/**
 * The outline drawn for a graph node.
 */
public enum NodeShape {
    RECT,
    CIRCLE,
    ELLIPSE,
    DIAMOND;

    /**
     * @param name The lower-case name as written in source.
     * @return The constant, or empty if the name is unknown.
     */
    public static Optional<NodeShape> fromName(String name) {
        for (NodeShape value : values()) {
            if (value.name().toLowerCase(Locale.ROOT).equals(name)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
