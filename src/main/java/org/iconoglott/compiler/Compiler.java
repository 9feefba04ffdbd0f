package org.iconoglott.compiler;

import org.iconoglott.compiler.api.EvaluationResult;
import org.iconoglott.compiler.api.ICompiler;
import org.iconoglott.compiler.api.RenderResult;
import org.iconoglott.compiler.backend.emit.SvgRenderer;
import org.iconoglott.compiler.backend.scene.SceneEvaluator;
import org.iconoglott.compiler.backend.scene.SceneState;
import org.iconoglott.compiler.config.CompilerSettings;
import org.iconoglott.compiler.diagnostics.Diagnostic;
import org.iconoglott.compiler.diagnostics.DiagnosticsEngine;
import org.iconoglott.compiler.frontend.lexer.Lexer;
import org.iconoglott.compiler.frontend.lexer.Token;
import org.iconoglott.compiler.frontend.parser.Parser;
import org.iconoglott.compiler.frontend.parser.ast.SceneNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the pipeline from source text
 * to SVG document: lexing, parsing, scene evaluation and rendering.
 * <p>
 * Every call builds fresh pipeline instances, so one compiler may be shared between threads.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final CompilerSettings settings;

    /**
     * Creates a compiler with the settings of the bundled <code>reference.conf</code>.
     */
    public Compiler() {
        this(CompilerSettings.defaults());
    }

    public Compiler(CompilerSettings settings) {
        this.settings = settings;
    }

    @Override
    public EvaluationResult evaluate(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexical Analysis
        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.scanTokens();
        for (Diagnostic recovery : lexer.getRecoveries()) {
            LOG.debug("Lexer skipped input: {}", recovery);
        }
        LOG.debug("Lexed {} tokens.", tokens.size());

        // Phase 2: Parsing (builds AST, folds variables)
        Parser parser = new Parser(tokens, diagnostics);
        SceneNode document = parser.parse();
        LOG.debug("Parsed {} statements with {} diagnostics.",
                document.statements().size(), diagnostics.getDiagnostics().size());

        // Phase 3: Scene evaluation (layout and graph placement)
        SceneState scene = new SceneEvaluator(settings).evaluate(document, diagnostics);
        return new EvaluationResult(scene, diagnostics.getDiagnostics());
    }

    @Override
    public RenderResult compile(String source) {
        SceneState scene = evaluate(source).scene();

        // Phase 4: Rendering
        String document = new SvgRenderer(settings).render(scene);
        LOG.debug("Rendered {} characters, {} resources.", document.length(), scene.getResources().getEntries().size());
        return new RenderResult(document, scene.getDiagnostics().getDiagnostics(), scene.getResources().getEntries());
    }

    @Override
    public String render(String source) {
        try {
            return compile(source).document();
        } catch (RuntimeException e) {
            LOG.error("Pipeline failed: {}", e.getMessage(), e);
            return new SvgRenderer(settings).errorDocument(settings.defaultTier().pixels(), String.valueOf(e.getMessage()));
        }
    }
}
