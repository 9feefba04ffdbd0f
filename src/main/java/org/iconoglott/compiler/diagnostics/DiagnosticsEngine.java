package org.iconoglott.compiler.diagnostics;

import org.iconoglott.compiler.api.CompilerErrorCode;
import org.iconoglott.compiler.api.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An engine for collecting diagnostic messages that occur while a document is
 * processed. Entries are only ever appended.
 * <p>
 * This decouples error reporting from the actual pipeline logic (parser, evaluator, renderer).
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code     The error code.
     * @param message  The error message.
     * @param line     The 1-based line of the error.
     * @param column   The 1-based column of the error.
     * @param recovery The recovery action that was applied.
     */
    public void reportError(CompilerErrorCode code, String message, int line, int column, RecoveryAction recovery) {
        diagnostics.add(new Diagnostic(code, message, line, column, Severity.ERROR, null, recovery));
    }

    /**
     * Reports a warning.
     *
     * @param code     The error code.
     * @param message  The warning message.
     * @param line     The 1-based line of the warning.
     * @param column   The 1-based column of the warning.
     * @param recovery The recovery action that was applied.
     */
    public void reportWarning(CompilerErrorCode code, String message, int line, int column, RecoveryAction recovery) {
        diagnostics.add(new Diagnostic(code, message, line, column, Severity.WARNING, null, recovery));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error or fatal entry exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR || d.severity() == Severity.FATAL);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
