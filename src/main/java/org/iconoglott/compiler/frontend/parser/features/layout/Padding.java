package org.iconoglott.compiler.frontend.parser.features.layout;

import java.util.List;

/**
 * The inner spacing of a layout, per edge.
 */
public record Padding(double top, double right, double bottom, double left) {

    public static final Padding ZERO = new Padding(0, 0, 0, 0);

    /**
     * Expands one to four values the way CSS does: one value for all edges, two for
     * vertical and horizontal, three for top, horizontal and bottom, four clockwise from the top.
     * @param values Between one and four values.
     * @return The padding.
     * @throws IllegalArgumentException for an empty list or more than four values.
     */
    public static Padding of(List<Double> values) {
        switch (values.size()) {
            case 1:
                return new Padding(values.get(0), values.get(0), values.get(0), values.get(0));
            case 2:
                return new Padding(values.get(0), values.get(1), values.get(0), values.get(1));
            case 3:
                return new Padding(values.get(0), values.get(1), values.get(2), values.get(1));
            case 4:
                return new Padding(values.get(0), values.get(1), values.get(2), values.get(3));
            default:
                throw new IllegalArgumentException("Padding takes one to four values, got " + values.size());
        }
    }

    public double horizontal() {
        return left + right;
    }

    public double vertical() {
        return top + bottom;
    }
}
