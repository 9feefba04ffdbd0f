package org.iconoglott.compiler.frontend.parser.ast;

/**
 * A width and height pair, also used for per-axis radii and scale factors.
 *
 * @param width The horizontal extent.
 * @param height The vertical extent.
 */
public record Size(double width, double height) {
}
