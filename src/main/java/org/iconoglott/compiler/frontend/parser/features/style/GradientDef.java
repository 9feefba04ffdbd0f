package org.iconoglott.compiler.frontend.parser.features.style;

/**
 * A two-stop gradient used as a shape fill.
 *
 * @param kind The gradient geometry.
 * @param from The start colour.
 * @param to The end colour.
 * @param angle The direction in degrees; only used by linear gradients.
 */
public record GradientDef(GradientKind kind, String from, String to, double angle) {

    public static final GradientDef DEFAULT = new GradientDef(GradientKind.LINEAR, "#fff", "#000", 90);
}
