package org.iconoglott.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The root of a parsed document.
 *
 * @param statements The top-level statements in document order.
 */
public record SceneNode(List<AstNode> statements) implements AstNode {

    public SceneNode {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return statements;
    }
}
