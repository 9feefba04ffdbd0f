package org.iconoglott.compiler.frontend.parser.features.layout;

import java.util.Optional;

/**
 * The primary axis along which children or graph nodes are placed.
 */
public enum LayoutDirection {
    VERTICAL,
    HORIZONTAL;

    /**
     * @param name {@code vertical} or {@code horizontal}.
     * @return The direction, or empty for any other name.
     */
    public static Optional<LayoutDirection> fromName(String name) {
        if ("vertical".equals(name)) return Optional.of(VERTICAL);
        if ("horizontal".equals(name)) return Optional.of(HORIZONTAL);
        return Optional.empty();
    }
}
