package org.iconoglott.compiler.frontend.parser.features.variable;

import org.iconoglott.compiler.frontend.lexer.TokenValue;
import org.iconoglott.compiler.frontend.parser.ast.AstNode;

/**
 * An AST node that represents a variable assignment. The binding itself is applied while
 * parsing; the node only records it.
 *
 * @param name The variable name without its leading '$'.
 * @param value The bound value, or {@code null} if the assignment was malformed.
 */
public record VariableNode(String name, TokenValue value) implements AstNode {
}
