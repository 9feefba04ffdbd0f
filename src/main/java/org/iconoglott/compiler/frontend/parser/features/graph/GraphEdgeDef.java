package org.iconoglott.compiler.frontend.parser.features.graph;

/**
 * An edge between two graph nodes, referenced by id.
 *
 * @param from The id of the source node.
 * @param to The id of the target node.
 * @param style The connector geometry.
 * @param arrow The ends that carry arrow heads.
 * @param label The text drawn at the midpoint, or {@code null}.
 * @param stroke The connector colour.
 * @param strokeWidth The connector width.
 */
public record GraphEdgeDef(
        String from,
        String to,
        EdgeStyle style,
        ArrowKind arrow,
        String label,
        String stroke,
        double strokeWidth
) {
    public static final String DEFAULT_STROKE = "#333";
    public static final double DEFAULT_STROKE_WIDTH = 2;
}
