package org.iconoglott.compiler.frontend.parser.features.canvas;

import java.util.Locale;
import java.util.Optional;

/**
 * The named canvas sizes. Every tier is a square of {@link #pixels()} units.
 */
public enum CanvasTier {
    NANO(16),
    MICRO(24),
    TINY(32),
    SMALL(48),
    MEDIUM(64),
    LARGE(96),
    XLARGE(128),
    HUGE(192),
    MASSIVE(256),
    GIANT(512);

    private final int pixels;

    CanvasTier(int pixels) {
        this.pixels = pixels;
    }

    /**
     * @return The edge length of the square canvas.
     */
    public int pixels() {
        return pixels;
    }

    /**
     * Looks up a tier by name, ignoring case. {@code xl} is accepted for {@link #XLARGE}.
     * @param name The tier name as written in source.
     * @return The tier, or empty if the name is not a tier.
     */
    public static Optional<CanvasTier> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.toUpperCase(Locale.ROOT);
        if ("XL".equals(normalized)) {
            return Optional.of(XLARGE);
        }
        for (CanvasTier tier : values()) {
            if (tier.name().equals(normalized)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
