package org.iconoglott.compiler.backend.emit;

import org.iconoglott.compiler.backend.scene.ResourceRegistry;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeNode;

/**
 * The state of one shape emission pass: the markup written so far and the resources
 * registered by it. Rules call {@link #emit(ShapeNode)} to emit nested shapes.
 */
public final class EmissionContext {

    private final EmissionRegistry registry;
    private final ResourceRegistry resources = new ResourceRegistry();
    private final StringBuilder out = new StringBuilder();

    EmissionContext(EmissionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Emits a shape with the rule registered for its kind.
     * @param shape The shape.
     */
    public void emit(ShapeNode shape) {
        registry.resolve(shape.kind()).emit(shape, this);
    }

    public StringBuilder out() {
        return out;
    }

    public ResourceRegistry resources() {
        return resources;
    }
}
