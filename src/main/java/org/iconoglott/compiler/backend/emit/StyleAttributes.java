package org.iconoglott.compiler.backend.emit;

import org.iconoglott.compiler.backend.scene.ResourceRegistry;
import org.iconoglott.compiler.frontend.parser.features.style.Style;

import static org.iconoglott.compiler.backend.emit.Markup.attr;

/**
 * Writes the presentation attributes of a {@link Style}. Gradients and filters are registered
 * in the {@link ResourceRegistry} as they are encountered, the gradient first.
 */
public final class StyleAttributes {

    private StyleAttributes() {
        // Utility class
    }

    /**
     * Writes fill, stroke, opacity and filter attributes for a filled shape.
     * @param style The style.
     * @param resources The registry receiving gradients and filters.
     * @param defaultFill The fill used when the style has none, or {@code null} to omit it.
     * @return The attributes, each with a leading space.
     */
    public static String filled(Style style, ResourceRegistry resources, String defaultFill) {
        StringBuilder sb = new StringBuilder();
        String fill = style.fill() != null ? style.fill() : defaultFill;
        if (style.gradient() != null) {
            fill = "url(#" + resources.registerGradient(style.gradient()) + ")";
        }
        String filter = registerFilter(style, resources);
        if (fill != null) {
            sb.append(attr("fill", fill));
        }
        if (style.stroke() != null) {
            sb.append(attr("stroke", style.stroke())).append(attr("stroke-width", style.strokeWidth()));
        }
        appendEffects(sb, style, filter);
        return sb.toString();
    }

    /**
     * Writes stroke, opacity and filter attributes for a line. Lines always carry a stroke.
     * @param style The style.
     * @param resources The registry receiving filters.
     * @return The attributes, each with a leading space.
     */
    public static String stroked(Style style, ResourceRegistry resources) {
        StringBuilder sb = new StringBuilder();
        String filter = registerFilter(style, resources);
        sb.append(attr("stroke", style.stroke() != null ? style.stroke() : "#000"));
        sb.append(attr("stroke-width", style.strokeWidth()));
        appendEffects(sb, style, filter);
        return sb.toString();
    }

    private static String registerFilter(Style style, ResourceRegistry resources) {
        if (style.shadow() == null && style.blur() == null) {
            return null;
        }
        return resources.registerFilter(style.shadow(), style.blur());
    }

    private static void appendEffects(StringBuilder sb, Style style, String filter) {
        if (style.opacity() < 1.0) {
            sb.append(attr("opacity", style.opacity()));
        }
        if (filter != null) {
            sb.append(attr("filter", "url(#" + filter + ")"));
        }
    }
}
