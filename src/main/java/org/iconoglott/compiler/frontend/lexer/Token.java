package org.iconoglott.compiler.frontend.lexer;

/**
 * Represents a single token that is produced by the lexer.
 * A token is an immutable atomic unit of the source code, such as a keyword, a number or a colour.
 *
 * @param type The type of the token (e.g., {@link TokenType#IDENTIFIER}).
 * @param text The exact source text of the token (empty for block tokens).
 * @param value The literal payload, or {@code null} for structural tokens.
 * @param line The 1-based line number where the token occurs.
 * @param column The 1-based column number where the token starts.
 */
public record Token(
        TokenType type,
        String text,
        TokenValue value,
        int line,
        int column
) {
}
