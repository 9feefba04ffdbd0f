package org.iconoglott.compiler.diagnostics;

/**
 * The non-fatal response applied after an error, so that processing of a document
 * always makes progress.
 */
public enum RecoveryAction {
    /** The offending input (a character, a command and its line, or a key) was dropped. */
    SKIP,
    /** An unresolvable reference was kept as its literal text. */
    PASS_THROUGH_LITERAL,
    /** Parsing resumed at the next token. */
    RESUME_AT_NEXT_TOKEN,
    /** A default value was used in place of the invalid one. */
    USE_DEFAULT,
    /** A minimal error document replaced the rendered output. */
    FALLBACK_DOCUMENT
}
