package org.iconoglott.compiler.api;

/**
 * Defines the public, clean interface for the iconoglott compiler.
 * <p>
 * None of the methods throw for malformed input. Problems in the source are returned as
 * diagnostics next to a best-effort result.
 */
public interface ICompiler {

    /**
     * Lexes, parses and evaluates a document.
     *
     * @param source The DSL source text.
     * @return The scene and the diagnostics collected so far.
     */
    EvaluationResult evaluate(String source);

    /**
     * Runs the whole pipeline.
     *
     * @param source The DSL source text.
     * @return The document, the diagnostics and the registered resources.
     */
    RenderResult compile(String source);

    /**
     * Runs the whole pipeline and returns only the document. This method never throws;
     * internal failures produce the error document.
     *
     * @param source The DSL source text.
     * @return The SVG document.
     */
    String render(String source);
}
