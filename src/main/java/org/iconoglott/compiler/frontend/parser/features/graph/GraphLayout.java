package org.iconoglott.compiler.frontend.parser.features.graph;

import java.util.Locale;
import java.util.Optional;

/**
 * The automatic placement strategies of a graph.
 */
public enum GraphLayout {
    HIERARCHICAL,
    GRID,
    MANUAL;

    /**
     * @param name The lower-case name as written in source.
     * @return The constant, or empty if the name is unknown.
     */
    public static Optional<GraphLayout> fromName(String name) {
        for (GraphLayout value : values()) {
            if (value.name().toLowerCase(Locale.ROOT).equals(name)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
