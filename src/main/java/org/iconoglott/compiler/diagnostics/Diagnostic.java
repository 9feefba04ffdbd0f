package org.iconoglott.compiler.diagnostics;

import org.iconoglott.compiler.api.CompilerErrorCode;
import org.iconoglott.compiler.api.ErrorCategory;
import org.iconoglott.compiler.api.Severity;

/**
 * Represents a single structured error, warning or informational message.
 *
 * @param code The error code.
 * @param message The human-readable message.
 * @param line The 1-based source line, or 0 when the error has no position.
 * @param column The 1-based source column, or 0 when the error has no position.
 * @param severity The severity.
 * @param context Optional extra text, such as the offending source fragment. May be null.
 * @param recovery The recovery action that was applied.
 */
public record Diagnostic(
        CompilerErrorCode code,
        String message,
        int line,
        int column,
        Severity severity,
        String context,
        RecoveryAction recovery
) {
    /**
     * @return The pipeline stage the error belongs to.
     */
    public ErrorCategory category() {
        return code.category();
    }

    @Override
    public String toString() {
        return String.format("[%s %d] %d:%d: %s", severity, code.code(), line, column, message);
    }
}
