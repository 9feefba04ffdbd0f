package org.iconoglott.compiler.frontend.parser.ast;

/**
 * A coordinate in canvas units.
 *
 * @param x The horizontal coordinate.
 * @param y The vertical coordinate.
 */
public record Point(double x, double y) {

    public static final Point ORIGIN = new Point(0, 0);

    /**
     * @param dx The horizontal offset.
     * @param dy The vertical offset.
     * @return This point moved by the offset.
     */
    public Point plus(double dx, double dy) {
        return new Point(x + dx, y + dy);
    }
}
