package org.iconoglott.compiler.api;

/**
 * The pipeline stage an error belongs to. The category of an error code is its
 * thousands digit.
 */
public enum ErrorCategory {
    LEXER(1, "lexer"),
    PARSER(2, "parser"),
    RUNTIME(3, "runtime"),
    TRANSPORT(4, "transport"),
    RENDER(5, "render");

    private final int prefix;
    private final String label;

    ErrorCategory(int prefix, String label) {
        this.prefix = prefix;
        this.label = label;
    }

    /**
     * @return The lower-case name used when errors are serialized.
     */
    public String label() {
        return label;
    }

    /**
     * Derives the category from a numeric error code.
     * @param code The numeric code, e.g. 2004.
     * @return The category whose prefix equals {@code code / 1000}.
     * @throws IllegalArgumentException if no category owns the prefix.
     */
    public static ErrorCategory fromCode(int code) {
        int prefix = code / 1000;
        for (ErrorCategory category : values()) {
            if (category.prefix == prefix) {
                return category;
            }
        }
        throw new IllegalArgumentException("No error category for code " + code);
    }
}
