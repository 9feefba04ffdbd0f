package org.iconoglott.compiler.backend.emit;

import org.iconoglott.compiler.frontend.parser.features.shape.ShapeNode;

/**
 * Writes the markup for one kind of shape.
 */
public interface IEmissionRule {

    /**
     * Appends the markup of a shape to the context.
     *
     * @param shape   The shape to emit. Its kind is one the rule was registered for.
     * @param context The emission context of the current render pass.
     */
    void emit(ShapeNode shape, EmissionContext context);
}
