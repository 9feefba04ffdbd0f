package org.iconoglott.compiler.backend.scene;

import org.iconoglott.compiler.api.CompilerErrorCode;
import org.iconoglott.compiler.backend.layout.LayoutEngine;
import org.iconoglott.compiler.config.CompilerSettings;
import org.iconoglott.compiler.diagnostics.DiagnosticsEngine;
import org.iconoglott.compiler.diagnostics.RecoveryAction;
import org.iconoglott.compiler.frontend.TreeWalker;
import org.iconoglott.compiler.frontend.parser.ast.AstNode;
import org.iconoglott.compiler.frontend.parser.ast.SceneNode;
import org.iconoglott.compiler.frontend.parser.features.canvas.CanvasNode;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeKind;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeNode;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeProps;
import org.iconoglott.compiler.frontend.parser.features.symbol.SymbolNode;
import org.iconoglott.compiler.frontend.parser.features.variable.VariableNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Walks a parsed document and builds its {@link SceneState}.
 * <p>
 * Canvas statements replace the canvas, shape statements are resolved by the
 * {@link LayoutEngine} and appended in document order, and variable statements were
 * already folded into the tree by the parser. A shape that fails to evaluate is reported
 * as {@link CompilerErrorCode#INVALID_SHAPE} and left out; the rest of the scene is kept.
 * <p>
 * Symbols are defined in document order and their shapes are resolved like top-level ones.
 * A <code>use</code> must follow the definition of its symbol; one that does not is reported
 * as {@link CompilerErrorCode#UNDEFINED_SYMBOL} and dropped. A second definition of an id is
 * reported as {@link CompilerErrorCode#DUPLICATE_SYMBOL} and ignored, so references cannot
 * form cycles.
 */
public class SceneEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(SceneEvaluator.class);

    private final CompilerSettings settings;
    private final LayoutEngine layoutEngine;

    public SceneEvaluator(CompilerSettings settings) {
        this(settings, new LayoutEngine(settings));
    }

    public SceneEvaluator(CompilerSettings settings, LayoutEngine layoutEngine) {
        this.settings = settings;
        this.layoutEngine = layoutEngine;
    }

    /**
     * Evaluates a document.
     * @param document The root of the parsed document.
     * @param diagnostics The engine holding the diagnostics of earlier phases; evaluation
     *                    diagnostics are appended to it.
     * @return The scene.
     */
    public SceneState evaluate(SceneNode document, DiagnosticsEngine diagnostics) {
        SceneState scene = new SceneState(settings.defaultTier(), settings.defaultFill(), diagnostics);

        Map<Class<? extends AstNode>, Consumer<AstNode>> handlers = new HashMap<>();
        handlers.put(CanvasNode.class, node -> applyCanvas(scene, (CanvasNode) node));
        handlers.put(ShapeNode.class, node -> addShape(scene, (ShapeNode) node));
        handlers.put(SymbolNode.class, node -> defineSymbol(scene, (SymbolNode) node));
        handlers.put(VariableNode.class, node -> { });

        // Shapes and symbols own their children; the layout engine resolves the whole subtree.
        TreeWalker walker = new TreeWalker(handlers, Set.of(ShapeNode.class, SymbolNode.class));
        walker.walk(document.statements());

        LOG.debug("Evaluated scene: {} shapes and {} symbols on a {} canvas.",
                scene.getShapes().size(), scene.getSymbols().size(), scene.getTier());
        return scene;
    }

    private void applyCanvas(SceneState scene, CanvasNode canvas) {
        scene.setCanvas(
                canvas.tier() != null ? canvas.tier() : settings.defaultTier(),
                canvas.fill() != null ? canvas.fill() : settings.defaultFill());
    }

    private void addShape(SceneState scene, ShapeNode shape) {
        ShapeNode evaluated = evaluateShape(scene, shape);
        if (evaluated != null) {
            scene.addShape(evaluated);
        }
    }

    private void defineSymbol(SceneState scene, SymbolNode symbol) {
        if (symbol.id().isEmpty()) {
            // The missing id was reported by the parser.
            return;
        }
        if (scene.hasSymbol(symbol.id())) {
            scene.getDiagnostics().reportWarning(CompilerErrorCode.DUPLICATE_SYMBOL,
                    "Symbol '" + symbol.id() + "' is already defined; the first definition is kept.",
                    symbol.line(), 1, RecoveryAction.SKIP);
            return;
        }
        List<ShapeNode> children = new ArrayList<>(symbol.children().size());
        for (ShapeNode child : symbol.children()) {
            ShapeNode evaluated = evaluateShape(scene, child);
            if (evaluated != null) {
                children.add(evaluated);
            }
        }
        scene.defineSymbol(symbol.withChildren(children));
    }

    /**
     * @return The resolved shape, or {@code null} if it was dropped.
     */
    private ShapeNode evaluateShape(SceneState scene, ShapeNode shape) {
        ShapeNode checked = dropUndefinedUses(scene, shape);
        if (checked == null) {
            return null;
        }
        try {
            return layoutEngine.resolve(checked);
        } catch (RuntimeException e) {
            LOG.debug("Failed to evaluate {} at line {}.", shape.kind().keyword(), shape.line(), e);
            scene.getDiagnostics().reportError(CompilerErrorCode.INVALID_SHAPE,
                    "Evaluation error in " + shape.kind().keyword() + ": " + e.getMessage(),
                    shape.line(), 1, RecoveryAction.SKIP);
            return null;
        }
    }

    private ShapeNode dropUndefinedUses(SceneState scene, ShapeNode shape) {
        if (shape.kind() == ShapeKind.USE) {
            String href = ((ShapeProps.UseProps) shape.props()).href();
            if (scene.hasSymbol(href)) {
                return shape;
            }
            if (!href.isEmpty()) {
                scene.getDiagnostics().reportError(CompilerErrorCode.UNDEFINED_SYMBOL,
                        "Undefined symbol: " + href, shape.line(), 1, RecoveryAction.SKIP);
            }
            return null;
        }
        if (shape.children().isEmpty()) {
            return shape;
        }
        List<ShapeNode> children = new ArrayList<>(shape.children().size());
        for (ShapeNode child : shape.children()) {
            ShapeNode checked = dropUndefinedUses(scene, child);
            if (checked != null) {
                children.add(checked);
            }
        }
        return children.size() == shape.children().size() ? shape : shape.withChildren(children);
    }
}
