package org.iconoglott.compiler.backend.emit.features;

import org.iconoglott.compiler.backend.emit.EmissionContext;
import org.iconoglott.compiler.backend.emit.IEmissionRule;
import org.iconoglott.compiler.backend.emit.StyleAttributes;
import org.iconoglott.compiler.backend.emit.TransformComposer;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeNode;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeProps;

import static org.iconoglott.compiler.backend.emit.Markup.attr;

/**
 * Emits a placed symbol as a <code>use</code> element. Width and height are written only
 * when the statement gave a size.
 */
public class UseRule implements IEmissionRule {

    @Override
    public void emit(ShapeNode shape, EmissionContext context) {
        ShapeProps.UseProps props = (ShapeProps.UseProps) shape.props();
        StringBuilder out = context.out();
        out.append("<use")
                .append(attr("href", "#" + props.href()))
                .append(attr("x", props.at().x()))
                .append(attr("y", props.at().y()));
        if (props.size() != null) {
            out.append(attr("width", props.size().width()))
                    .append(attr("height", props.size().height()));
        }
        out.append(StyleAttributes.filled(shape.style(), context.resources(), null))
                .append(TransformComposer.attribute(shape.transform()))
                .append("/>");
    }
}
