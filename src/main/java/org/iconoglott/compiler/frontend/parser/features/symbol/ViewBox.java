package org.iconoglott.compiler.frontend.parser.features.symbol;

/**
 * The coordinate system of a symbol, written as the <code>viewBox</code> attribute.
 */
public record ViewBox(double x, double y, double width, double height) {
}
