package org.iconoglott.compiler.api;

import java.util.Locale;

/**
 * Severity of a reported error.
 */
public enum Severity {
    /** Informational, nothing was lost. */
    INFO,
    /** Input was ignored or replaced by a default. */
    WARNING,
    /** Input could not be understood; a recovery action was applied. */
    ERROR,
    /** Processing of the document was abandoned. */
    FATAL;

    /**
     * @return The lower-case name used when errors are serialized.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
