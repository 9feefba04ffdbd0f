package org.iconoglott.compiler.frontend.parser.features.canvas;

import org.iconoglott.compiler.frontend.parser.ast.AstNode;

/**
 * An AST node that represents a <code>canvas</code> statement.
 *
 * @param tier The declared tier, or {@code null} to use the configured default.
 * @param fill The declared background, or {@code null} to use the configured default.
 */
public record CanvasNode(CanvasTier tier, String fill) implements AstNode {
}
