package org.iconoglott.compiler.frontend.parser.features.graph;

import org.iconoglott.compiler.frontend.parser.ast.Point;
import org.iconoglott.compiler.frontend.parser.ast.Size;
import org.iconoglott.compiler.frontend.parser.features.style.Style;

/**
 * A node of a graph.
 *
 * @param id The key edges refer to. Unique within its graph.
 * @param shape The outline.
 * @param at The authored center, or {@code null} if only automatic layout places the node.
 * @param size The authored size, or {@code null} for the configured default.
 * @param label The text drawn at the center, or {@code null}.
 * @param style The fill and stroke of the outline.
 */
public record GraphNodeDef(String id, NodeShape shape, Point at, Size size, String label, Style style) {
}
