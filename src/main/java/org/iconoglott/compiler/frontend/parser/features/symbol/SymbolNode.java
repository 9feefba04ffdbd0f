package org.iconoglott.compiler.frontend.parser.features.symbol;

import org.iconoglott.compiler.frontend.parser.ast.AstNode;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeNode;

import java.util.ArrayList;
import java.util.List;

/**
 * An AST node that represents a <code>symbol</code> definition: shapes drawn only where a
 * <code>use</code> statement places them.
 *
 * @param id The id that <code>use</code> statements refer to.
 * @param viewBox The coordinate system, or {@code null} for none.
 * @param children The shapes of the symbol.
 * @param line The 1-based line of the statement keyword.
 */
public record SymbolNode(String id, ViewBox viewBox, List<ShapeNode> children, int line) implements AstNode {

    public SymbolNode {
        children = List.copyOf(children);
    }

    /**
     * @param newChildren The replacement children.
     * @return A copy of this symbol with other children.
     */
    public SymbolNode withChildren(List<ShapeNode> newChildren) {
        return new SymbolNode(id, viewBox, newChildren, line);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(children);
    }
}
