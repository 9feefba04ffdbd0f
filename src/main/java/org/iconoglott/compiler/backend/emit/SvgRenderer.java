package org.iconoglott.compiler.backend.emit;

import org.iconoglott.compiler.api.CompilationException;
import org.iconoglott.compiler.api.CompilerErrorCode;
import org.iconoglott.compiler.backend.scene.ResourceRegistry;
import org.iconoglott.compiler.backend.scene.SceneState;
import org.iconoglott.compiler.config.CompilerSettings;
import org.iconoglott.compiler.diagnostics.RecoveryAction;
import org.iconoglott.compiler.frontend.parser.features.style.GradientDef;
import org.iconoglott.compiler.frontend.parser.features.style.GradientKind;
import org.iconoglott.compiler.frontend.parser.features.style.ShadowDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

import static org.iconoglott.compiler.backend.emit.Markup.attr;

/**
 * Renders a {@link SceneState} to an SVG document in two passes.
 * <ol>
 *     <li>The {@link ShapeEmitter} writes all symbols and shapes and returns the resources they registered.</li>
 *     <li>The document is assembled: root element, background, the <code>defs</code> block with
 *     gradients, filters and symbols in that order, then the shape markup.</li>
 * </ol>
 * A failure in either pass is recorded as {@link CompilerErrorCode#RENDER_FAILED} and answered
 * with a minimal error document. This class never throws from {@link #render(SceneState)}.
 */
public class SvgRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(SvgRenderer.class);
    private static final String SVG_NAMESPACE = "http://www.w3.org/2000/svg";

    private final CompilerSettings settings;
    private final ShapeEmitter shapeEmitter;

    public SvgRenderer(CompilerSettings settings) {
        this(settings, new ShapeEmitter());
    }

    public SvgRenderer(CompilerSettings settings, ShapeEmitter shapeEmitter) {
        this.settings = settings;
        this.shapeEmitter = shapeEmitter;
    }

    /**
     * Renders a scene. The scene's resource registry is replaced by the one built in this call.
     * @param scene The scene to render.
     * @return The document, or the error document if rendering failed.
     */
    public String render(SceneState scene) {
        int size = scene.getTier().pixels();
        try {
            ShapeEmitter.Result shapes = shapeEmitter.emitAll(scene.getSymbols(), scene.getShapes());
            scene.replaceResources(shapes.resources());
            return assemble(size, scene.getFill(), shapes);
        } catch (CompilationException | RuntimeException e) {
            LOG.error("Rendering failed: {}", e.getMessage(), e);
            scene.getDiagnostics().reportError(CompilerErrorCode.RENDER_FAILED,
                    "Render failed: " + e.getMessage(), 0, 0, RecoveryAction.FALLBACK_DOCUMENT);
            return errorDocument(size, String.valueOf(e.getMessage()));
        }
    }

    /**
     * Builds the fallback document showing an error message.
     * @param size The edge length of the document.
     * @param message The message; it is escaped.
     * @return The error document.
     */
    public String errorDocument(int size, String message) {
        return "<svg" + attr("xmlns", SVG_NAMESPACE) + attr("width", size) + attr("height", size) + ">"
                + "<rect width=\"100%\" height=\"100%\"" + attr("fill", settings.errorBackground()) + "/>"
                + "<text x=\"20\" y=\"30\"" + attr("fill", settings.errorForeground())
                + " font-family=\"monospace\" font-size=\"12\">Render Error: "
                + Markup.escapeText(message) + "</text></svg>";
    }

    private String assemble(int size, String fill, ShapeEmitter.Result shapes) {
        StringBuilder sb = new StringBuilder();
        sb.append("<svg").append(attr("xmlns", SVG_NAMESPACE))
                .append(attr("width", size)).append(attr("height", size)).append('>');
        sb.append("<rect width=\"100%\" height=\"100%\"").append(attr("fill", fill)).append("/>");
        appendDefinitions(sb, shapes.resources(), shapes.symbols());
        sb.append(shapes.markup());
        sb.append("</svg>");
        return sb.toString();
    }

    private void appendDefinitions(StringBuilder sb, ResourceRegistry resources, String symbols) {
        if (resources.isEmpty() && symbols.isEmpty()) {
            return;
        }
        sb.append("<defs>");
        for (ResourceRegistry.Resource resource : resources.getEntries()) {
            if (resource instanceof ResourceRegistry.Gradient gradient) {
                appendGradient(sb, gradient.id(), gradient.definition());
            }
        }
        for (ResourceRegistry.Resource resource : resources.getEntries()) {
            if (resource instanceof ResourceRegistry.Filter filter) {
                appendFilter(sb, filter);
            }
        }
        sb.append(symbols);
        sb.append("</defs>");
    }

    private static void appendGradient(StringBuilder sb, String id, GradientDef gradient) {
        String element;
        if (gradient.kind() == GradientKind.RADIAL) {
            element = "radialGradient";
            sb.append('<').append(element).append(attr("id", id)).append('>');
        } else {
            element = "linearGradient";
            double radians = Math.toRadians(gradient.angle() - 90);
            String x2 = String.format(Locale.ROOT, "%.1f", 50 + 50 * Math.cos(radians));
            String y2 = String.format(Locale.ROOT, "%.1f", 50 + 50 * Math.sin(radians));
            sb.append('<').append(element).append(attr("id", id))
                    .append(" x1=\"0%\" y1=\"0%\" x2=\"").append(x2).append("%\" y2=\"").append(y2).append("%\">");
        }
        sb.append("<stop offset=\"0%\"").append(attr("stop-color", gradient.from())).append("/>");
        sb.append("<stop offset=\"100%\"").append(attr("stop-color", gradient.to())).append("/>");
        sb.append("</").append(element).append('>');
    }

    private static void appendFilter(StringBuilder sb, ResourceRegistry.Filter filter) {
        ShadowDef shadow = filter.shadow();
        if (shadow == null) {
            sb.append("<filter").append(attr("id", filter.id())).append('>')
                    .append("<feGaussianBlur").append(attr("stdDeviation", filter.blur())).append("/>")
                    .append("</filter>");
            return;
        }
        sb.append("<filter").append(attr("id", filter.id()))
                .append(" x=\"-50%\" y=\"-50%\" width=\"200%\" height=\"200%\">");
        String shadowInput = "";
        if (filter.blur() != null) {
            sb.append("<feGaussianBlur in=\"SourceGraphic\"").append(attr("stdDeviation", filter.blur()))
                    .append(" result=\"blurred\"/>");
            shadowInput = " in=\"blurred\"";
        }
        sb.append("<feDropShadow").append(shadowInput)
                .append(attr("dx", shadow.x()))
                .append(attr("dy", shadow.y()))
                .append(attr("stdDeviation", shadow.blur()))
                .append(attr("flood-color", shadow.color()))
                .append("/>");
        sb.append("</filter>");
    }
}
