package org.iconoglott.compiler.api;

import org.iconoglott.compiler.backend.scene.SceneState;
import org.iconoglott.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The scene of a document together with the diagnostics of parsing and evaluation.
 *
 * @param scene The evaluated scene.
 * @param diagnostics All diagnostics in the order they were reported.
 */
public record EvaluationResult(SceneState scene, List<Diagnostic> diagnostics) {

    public EvaluationResult {
        diagnostics = List.copyOf(diagnostics);
    }
}
