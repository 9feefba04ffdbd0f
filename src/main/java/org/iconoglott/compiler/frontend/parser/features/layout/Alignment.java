package org.iconoglott.compiler.frontend.parser.features.layout;

import java.util.Optional;

/**
 * Where a layout places each child on its cross axis.
 */
public enum Alignment {
    START,
    CENTER,
    END;

    /**
     * @param name {@code start}, {@code center} or {@code end}.
     * @return The value, or empty for any other name.
     */
    public static Optional<Alignment> fromName(String name) {
        switch (name) {
            case "start":
                return Optional.of(START);
            case "center":
                return Optional.of(CENTER);
            case "end":
                return Optional.of(END);
            default:
                return Optional.empty();
        }
    }
}
