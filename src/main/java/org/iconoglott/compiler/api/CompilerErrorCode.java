package org.iconoglott.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur while a document
 * is compiled. This decouples the test logic from the error messages.
 */
public enum CompilerErrorCode {
    // region Lexer
    /** A character that starts no token was dropped. */
    LEXER_UNKNOWN_CHARACTER(1001),
    // endregion

    // region Parser
    /** A statement started with a token that cannot start a statement. */
    UNEXPECTED_TOKEN(2001),
    /** A value of any kind was expected. */
    EXPECTED_VALUE(2002),
    /** A variable was referenced before it was bound. */
    UNDEFINED_VAR(2003),
    /** A statement keyword is not known. */
    UNKNOWN_COMMAND(2004),
    /** A bracketed list was not closed. */
    MISSING_BRACKET(2005),
    /** A property name or value is not valid in its context. */
    INVALID_PROPERTY(2006),
    /** A colour literal or variable was expected. */
    EXPECTED_COLOR(2007),
    /** A number was expected. */
    EXPECTED_NUMBER(2008),
    /** A coordinate pair was expected. */
    EXPECTED_PAIR(2009),
    /** A quoted string was expected. */
    EXPECTED_STRING(2010),
    /** A variable assignment is missing its '='. */
    MISSING_EQUALS(2011),
    /** A variable assignment has nothing after its '='. */
    EMPTY_VALUE(2012),
    // endregion

    // region Evaluation
    /** A shape could not be evaluated. */
    INVALID_SHAPE(3001),
    /** A <code>use</code> refers to a symbol that is not defined before it. */
    UNDEFINED_SYMBOL(3002),
    /** A symbol id is defined a second time. */
    DUPLICATE_SYMBOL(3003),
    // endregion

    // region Transport
    /** A transport message has an unknown type or cannot be read. */
    INVALID_MESSAGE(4001),
    /** A transport message carries an unusable payload. */
    INVALID_PAYLOAD(4002),
    // endregion

    // region Render
    /** Serializing the scene failed; a fallback document was produced. */
    RENDER_FAILED(5003);
    // endregion

    private final int code;

    CompilerErrorCode(int code) {
        this.code = code;
    }

    /**
     * @return The stable numeric code.
     */
    public int code() {
        return code;
    }

    /**
     * @return The pipeline stage this code belongs to.
     */
    public ErrorCategory category() {
        return ErrorCategory.fromCode(code);
    }
}
