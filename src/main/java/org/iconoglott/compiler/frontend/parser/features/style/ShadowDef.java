package org.iconoglott.compiler.frontend.parser.features.style;

/**
 * A drop shadow attached to a shape.
 *
 * @param x The horizontal offset.
 * @param y The vertical offset.
 * @param blur The blur radius.
 * @param color The shadow colour.
 */
public record ShadowDef(double x, double y, double blur, String color) {

    public static final ShadowDef DEFAULT = new ShadowDef(0, 4, 8, "#0004");
}
