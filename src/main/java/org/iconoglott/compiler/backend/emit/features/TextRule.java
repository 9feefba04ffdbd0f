package org.iconoglott.compiler.backend.emit.features;

import org.iconoglott.compiler.backend.emit.EmissionContext;
import org.iconoglott.compiler.backend.emit.IEmissionRule;
import org.iconoglott.compiler.backend.emit.Markup;
import org.iconoglott.compiler.backend.emit.StyleAttributes;
import org.iconoglott.compiler.backend.emit.TransformComposer;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeNode;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeProps;
import org.iconoglott.compiler.frontend.parser.features.style.Style;

import static org.iconoglott.compiler.backend.emit.Markup.attr;

/**
 * Emits <code>text</code> elements. The font attributes are always written; the fill
 * defaults to black.
 */
public class TextRule implements IEmissionRule {

    private static final String DEFAULT_FILL = "#000";

    @Override
    public void emit(ShapeNode shape, EmissionContext context) {
        ShapeProps.TextProps props = (ShapeProps.TextProps) shape.props();
        Style style = shape.style();
        context.out().append("<text")
                .append(attr("x", props.at().x()))
                .append(attr("y", props.at().y()))
                .append(attr("font-family", style.fontFamily()))
                .append(attr("font-size", style.fontSize()))
                .append(attr("font-weight", style.fontWeight()))
                .append(attr("text-anchor", style.textAnchor()))
                .append(StyleAttributes.filled(style, context.resources(), DEFAULT_FILL))
                .append(TransformComposer.attribute(shape.transform()))
                .append('>')
                .append(Markup.escapeText(props.content()))
                .append("</text>");
    }
}
