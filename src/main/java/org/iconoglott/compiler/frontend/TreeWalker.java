package org.iconoglott.compiler.frontend;

import org.iconoglott.compiler.frontend.parser.ast.AstNode;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * A generic class for traversing an Abstract Syntax Tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * to minimize coupling between compiler phases and the AST structure.
 */
public class TreeWalker {

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers;
    private final Set<Class<? extends AstNode>> opaqueTypes;

    /**
     * Constructs a new TreeWalker that descends into every node.
     * @param handlers A map from AST node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers) {
        this(handlers, Set.of());
    }

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from AST node classes to their corresponding handlers.
     * @param opaqueTypes Node classes whose handler takes responsibility for the whole subtree.
     *                    The walker does not descend into their children.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers,
                      Set<Class<? extends AstNode>> opaqueTypes) {
        this.handlers = handlers;
        this.opaqueTypes = opaqueTypes;
    }

    /**
     * Walks a list of AST nodes.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<AstNode> nodes) {
        for (AstNode node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a single AST node and, unless its type is opaque, its children recursively.
     * @param node The node to walk.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }

        handlers.getOrDefault(node.getClass(), n -> {}).accept(node);

        if (opaqueTypes.contains(node.getClass())) {
            return;
        }
        for (AstNode child : node.getChildren()) {
            walk(child);
        }
    }
}
