package org.iconoglott.compiler.frontend.parser.features.style;

/**
 * The visual attributes of a shape. Text attributes are only used by text shapes.
 *
 * @param fill The fill colour, or {@code null} for none.
 * @param stroke The stroke colour, or {@code null} for none.
 * @param strokeWidth The stroke width.
 * @param opacity The opacity between 0 and 1.
 * @param corner The corner radius of rectangles.
 * @param fontFamily The font family.
 * @param fontSize The font size.
 * @param fontWeight The font weight.
 * @param textAnchor The text anchor.
 * @param shadow The drop shadow, or {@code null}.
 * @param gradient The gradient fill, or {@code null}.
 * @param blur The gaussian blur radius, or {@code null}.
 */
public record Style(
        String fill,
        String stroke,
        double strokeWidth,
        double opacity,
        double corner,
        String fontFamily,
        double fontSize,
        String fontWeight,
        String textAnchor,
        ShadowDef shadow,
        GradientDef gradient,
        Double blur
) {

    public static final String DEFAULT_FONT = "system-ui";

    public static final Style DEFAULT = builder().build();

    /**
     * @return A builder initialised with the default style.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return A builder initialised with the values of this style.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.fill = fill;
        builder.stroke = stroke;
        builder.strokeWidth = strokeWidth;
        builder.opacity = opacity;
        builder.corner = corner;
        builder.fontFamily = fontFamily;
        builder.fontSize = fontSize;
        builder.fontWeight = fontWeight;
        builder.textAnchor = textAnchor;
        builder.shadow = shadow;
        builder.gradient = gradient;
        builder.blur = blur;
        return builder;
    }

    /**
     * Collects style properties while a statement and its block are parsed.
     */
    public static final class Builder {
        private String fill;
        private String stroke;
        private double strokeWidth = 1.0;
        private double opacity = 1.0;
        private double corner = 0;
        private String fontFamily = DEFAULT_FONT;
        private double fontSize = 16;
        private String fontWeight = "normal";
        private String textAnchor = "start";
        private ShadowDef shadow;
        private GradientDef gradient;
        private Double blur;

        private Builder() {
        }

        public boolean hasFill() {
            return fill != null;
        }

        public Builder fill(String fill) {
            this.fill = fill;
            return this;
        }

        public Builder stroke(String stroke) {
            this.stroke = stroke;
            return this;
        }

        public Builder strokeWidth(double strokeWidth) {
            this.strokeWidth = strokeWidth;
            return this;
        }

        public Builder opacity(double opacity) {
            this.opacity = opacity;
            return this;
        }

        public Builder corner(double corner) {
            this.corner = corner;
            return this;
        }

        public Builder fontFamily(String fontFamily) {
            this.fontFamily = fontFamily;
            return this;
        }

        public Builder fontSize(double fontSize) {
            this.fontSize = fontSize;
            return this;
        }

        public Builder fontWeight(String fontWeight) {
            this.fontWeight = fontWeight;
            return this;
        }

        public Builder textAnchor(String textAnchor) {
            this.textAnchor = textAnchor;
            return this;
        }

        public Builder shadow(ShadowDef shadow) {
            this.shadow = shadow;
            return this;
        }

        public Builder gradient(GradientDef gradient) {
            this.gradient = gradient;
            return this;
        }

        public Builder blur(Double blur) {
            this.blur = blur;
            return this;
        }

        public Style build() {
            return new Style(fill, stroke, strokeWidth, opacity, corner, fontFamily, fontSize,
                    fontWeight, textAnchor, shadow, gradient, blur);
        }
    }
}
