package org.iconoglott.compiler.frontend.parser;

import org.iconoglott.compiler.diagnostics.DiagnosticsEngine;
import org.iconoglott.compiler.frontend.lexer.Token;
import org.iconoglott.compiler.frontend.lexer.TokenType;
import org.iconoglott.compiler.frontend.lexer.TokenValue;
import org.iconoglott.compiler.frontend.parser.ast.AstNode;

/**
 * An interface that encapsulates the contextual state during parsing.
 * It provides statement handlers with access to the token stream and other necessary services
 * without coupling them directly to a specific implementation like the parser.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Checks if the token after the current one is of the given type.
     * @param type The token type to check.
     * @return true if the next token is of the given type, false otherwise.
     */
    boolean checkNext(TokenType type);

    /**
     * Checks if the current token carries a literal value (identifier, number, string,
     * pair, colour or variable reference).
     * @return true if the current token is a value token.
     */
    boolean checkValue();

    /**
     * Checks if the current token is the identifier {@code keyword}.
     * @param keyword The keyword.
     * @return true on a match.
     */
    boolean checkKeyword(String keyword);

    /**
     * Consumes the current token and returns it. At the end of input the end token is
     * returned and the position does not move.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();

    /**
     * Checks if the current token ends the current line (newline or end of input).
     * @return true at the end of a line.
     */
    boolean isAtLineEnd();

    /**
     * Skips any newline tokens.
     */
    void skipNewlines();

    /**
     * Skips all tokens up to, but not including, the next newline.
     */
    void skipRestOfLine();

    /**
     * Resolves the value of a token. Variable references are replaced by their bound value;
     * an unbound reference is reported and returned unchanged, so its text is the literal
     * reference.
     * @param token A value token.
     * @return The resolved value.
     */
    TokenValue resolve(Token token);

    /**
     * Resolves the value of a token as text.
     * @param token A value token.
     * @return The text of the resolved value.
     * @see #resolve(Token)
     */
    default String resolveText(Token token) {
        return resolve(token).asText();
    }

    /**
     * Checks if the current token starts a statement that may be nested in a block.
     * @return true if a nestable statement handler is registered for the current identifier.
     */
    boolean checkNestedStatement();

    /**
     * Parses one statement starting at the current token.
     * @return The statement node, or {@code null} if the statement produced none.
     */
    AstNode statement();

    /**
     * Gets the diagnostics engine for reporting errors and warnings.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();
}
