package org.iconoglott.compiler.frontend.parser.features.transform;

import org.iconoglott.compiler.frontend.parser.ast.Point;
import org.iconoglott.compiler.frontend.parser.ast.Size;

/**
 * The geometric transform of a shape. Components are applied as translate, rotate, scale.
 *
 * @param translate The translation, or {@code null}.
 * @param rotate The rotation in degrees.
 * @param scale The per-axis scale, or {@code null}.
 * @param origin The rotation pivot, or {@code null} to rotate about the origin.
 */
public record Transform(Point translate, double rotate, Size scale, Point origin) {

    public static final Transform IDENTITY = new Transform(null, 0, null, null);

    /**
     * @return {@code true} if no component changes the geometry.
     */
    public boolean isIdentity() {
        return translate == null && rotate == 0 && scale == null;
    }

    /**
     * @return A builder initialised with the identity transform.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects transform properties while a block is parsed.
     */
    public static final class Builder {
        private Point translate;
        private double rotate;
        private Size scale;
        private Point origin;

        private Builder() {
        }

        public Builder translate(Point translate) {
            this.translate = translate;
            return this;
        }

        public Builder rotate(double rotate) {
            this.rotate = rotate;
            return this;
        }

        public Builder scale(Size scale) {
            this.scale = scale;
            return this;
        }

        public Builder origin(Point origin) {
            this.origin = origin;
            return this;
        }

        public Transform build() {
            return new Transform(translate, rotate, scale, origin);
        }
    }
}
