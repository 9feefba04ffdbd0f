package org.iconoglott.compiler.frontend.parser;

import org.iconoglott.compiler.frontend.parser.ast.AstNode;

/**
 * The base interface for all statement handlers.
 * Each handler is responsible for parsing the statements introduced by one keyword.
 */
public interface IStatementHandler {

    /**
     * Parses the statement. The current token is the statement keyword.
     *
     * @param context The context that provides access to the token stream.
     * @return The AST node for the statement, or {@code null} if it produces none.
     */
    AstNode parse(ParsingContext context);

    /**
     * @return {@code true} if the statement may appear inside the block of another shape.
     */
    default boolean isNestable() {
        return true;
    }
}
