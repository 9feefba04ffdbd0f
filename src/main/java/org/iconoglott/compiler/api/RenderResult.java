package org.iconoglott.compiler.api;

import org.iconoglott.compiler.backend.scene.ResourceRegistry;
import org.iconoglott.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * A rendered document.
 *
 * @param document The SVG markup. It is the error document if rendering failed.
 * @param diagnostics All diagnostics of the pipeline.
 * @param resources The shared definitions referenced by the document, in id order.
 */
public record RenderResult(String document, List<Diagnostic> diagnostics, List<ResourceRegistry.Resource> resources) {

    public RenderResult {
        diagnostics = List.copyOf(diagnostics);
        resources = List.copyOf(resources);
    }

    /**
     * @return {@code true} if any diagnostic is an error or worse.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR || d.severity() == Severity.FATAL);
    }
}
