package org.iconoglott.compiler.frontend.parser.features.graph;

import java.util.Locale;
import java.util.Optional;

/**
 * The ends of a graph edge that carry an arrow head.
 */
public enum ArrowKind {
    NONE,
    FORWARD,
    BACKWARD,
    BOTH;

    /**
     * @param name The lower-case name as written in source.
     * @return The constant, or empty if the name is unknown.
     */
    public static Optional<ArrowKind> fromName(String name) {
        for (ArrowKind value : values()) {
            if (value.name().toLowerCase(Locale.ROOT).equals(name)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
