package org.iconoglott.compiler.backend.scene;

import org.iconoglott.compiler.diagnostics.DiagnosticsEngine;
import org.iconoglott.compiler.frontend.parser.features.canvas.CanvasTier;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeNode;
import org.iconoglott.compiler.frontend.parser.features.symbol.SymbolNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The result of evaluating one document: the resolved canvas, the top-level shapes and the
 * symbol definitions in document order, the diagnostics of all phases so far and the
 * resources of the last render.
 * <p>
 * A scene is owned by a single evaluation call and is not thread-safe.
 */
public class SceneState {

    private final DiagnosticsEngine diagnostics;
    private final List<ShapeNode> shapes = new ArrayList<>();
    private final Map<String, SymbolNode> symbols = new LinkedHashMap<>();
    private CanvasTier tier;
    private String fill;
    private ResourceRegistry resources = new ResourceRegistry();

    /**
     * Creates a scene with the default canvas.
     * @param tier The default canvas tier.
     * @param fill The default background.
     * @param diagnostics The engine that collects diagnostics for this document.
     */
    public SceneState(CanvasTier tier, String fill, DiagnosticsEngine diagnostics) {
        this.tier = tier;
        this.fill = fill;
        this.diagnostics = diagnostics;
    }

    public CanvasTier getTier() {
        return tier;
    }

    public String getFill() {
        return fill;
    }

    /**
     * Replaces the canvas.
     * @param tier The new tier.
     * @param fill The new background.
     */
    public void setCanvas(CanvasTier tier, String fill) {
        this.tier = tier;
        this.fill = fill;
    }

    public void addShape(ShapeNode shape) {
        shapes.add(shape);
    }

    public List<ShapeNode> getShapes() {
        return Collections.unmodifiableList(shapes);
    }

    /**
     * Defines a symbol unless its id is taken.
     * @param symbol The evaluated symbol.
     * @return {@code false} if a symbol with the same id was defined earlier; it is kept.
     */
    public boolean defineSymbol(SymbolNode symbol) {
        return symbols.putIfAbsent(symbol.id(), symbol) == null;
    }

    public boolean hasSymbol(String id) {
        return symbols.containsKey(id);
    }

    public List<SymbolNode> getSymbols() {
        return List.copyOf(symbols.values());
    }

    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    public ResourceRegistry getResources() {
        return resources;
    }

    /**
     * Installs the registry filled by a render pass, dropping the previous one.
     * @param resources The new registry.
     */
    public void replaceResources(ResourceRegistry resources) {
        this.resources = resources;
    }
}
