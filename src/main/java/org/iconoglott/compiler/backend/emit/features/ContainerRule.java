package org.iconoglott.compiler.backend.emit.features;

import org.iconoglott.compiler.backend.emit.EmissionContext;
import org.iconoglott.compiler.backend.emit.IEmissionRule;
import org.iconoglott.compiler.backend.emit.StyleAttributes;
import org.iconoglott.compiler.backend.emit.TransformComposer;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeNode;

/**
 * Emits groups and layouts as <code>g</code> elements wrapping their children.
 * Layout children arrive already placed by the layout engine. The container's own style is
 * written on the <code>g</code> element, where children inherit it.
 */
public class ContainerRule implements IEmissionRule {

    @Override
    public void emit(ShapeNode shape, EmissionContext context) {
        context.out().append("<g")
                .append(StyleAttributes.filled(shape.style(), context.resources(), null))
                .append(TransformComposer.attribute(shape.transform()))
                .append('>');
        for (ShapeNode child : shape.children()) {
            context.emit(child);
        }
        context.out().append("</g>");
    }
}
