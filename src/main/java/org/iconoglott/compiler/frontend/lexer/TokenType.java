package org.iconoglott.compiler.frontend.lexer;

/**
 * Defines all possible types of tokens that the lexer can produce.
 */
public enum TokenType {
    // Literals
    IDENTIFIER, NUMBER, STRING, PAIR, COLOR, VARIABLE,

    // Punctuation and operators
    LEFT_BRACKET, RIGHT_BRACKET, COLON, EQUALS, ARROW,

    // Block structure
    INDENT, DEDENT, NEWLINE,

    END_OF_INPUT
}
