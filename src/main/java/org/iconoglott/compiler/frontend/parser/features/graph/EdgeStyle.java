package org.iconoglott.compiler.frontend.parser.features.graph;

import java.util.Locale;
import java.util.Optional;

/**
 * How a graph edge connects its two anchors.
 */
public enum EdgeStyle {
    STRAIGHT,
    CURVED,
    ORTHOGONAL;

    /**
     * @param name The lower-case name as written in source.
     * @return The constant, or empty if the name is unknown.
     */
    public static Optional<EdgeStyle> fromName(String name) {
        for (EdgeStyle value : values()) {
            if (value.name().toLowerCase(Locale.ROOT).equals(name)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
