package org.iconoglott.compiler.frontend.parser.features.layout;

import java.util.Optional;

/**
 * How a layout distributes free space along its primary axis. Free space exists only when
 * the layout has an explicit <code>size</code>.
 */
public enum Justify {
    START,
    END,
    CENTER,
    SPACE_BETWEEN,
    SPACE_AROUND,
    SPACE_EVENLY;

    /**
     * @param name A name such as {@code center} or {@code space-between}; the hyphen is optional.
     * @return The value, or empty for an unknown name.
     */
    public static Optional<Justify> fromName(String name) {
        switch (name.replace("-", "")) {
            case "start":
                return Optional.of(START);
            case "end":
                return Optional.of(END);
            case "center":
                return Optional.of(CENTER);
            case "spacebetween":
                return Optional.of(SPACE_BETWEEN);
            case "spacearound":
                return Optional.of(SPACE_AROUND);
            case "spaceevenly":
                return Optional.of(SPACE_EVENLY);
            default:
                return Optional.empty();
        }
    }
}
