package org.iconoglott.compiler.api;

/**
 * An exception that is thrown when a pipeline stage fails internally.
 * <p>
 * It never escapes the public entry points of {@link ICompiler}; the renderer turns it
 * into a render diagnostic and a fallback document.
 */
public class CompilationException extends Exception {

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
