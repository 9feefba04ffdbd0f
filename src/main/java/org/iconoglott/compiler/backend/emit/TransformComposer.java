package org.iconoglott.compiler.backend.emit;

import org.iconoglott.compiler.frontend.parser.features.transform.Transform;

import java.util.ArrayList;
import java.util.List;

import static org.iconoglott.compiler.frontend.lexer.NumberText.format;

/**
 * Writes a {@link Transform} as a <code>transform</code> attribute. The components are
 * always composed as translate, rotate, scale.
 */
public final class TransformComposer {

    private TransformComposer() {
        // Utility class
    }

    /**
     * @param transform The transform, may be {@code null}.
     * @return The attribute with a leading space, or an empty string for the identity.
     */
    public static String attribute(Transform transform) {
        String value = compose(transform);
        return value.isEmpty() ? "" : " transform=\"" + value + "\"";
    }

    /**
     * @param transform The transform, may be {@code null}.
     * @return The space-separated transform list, empty for the identity.
     */
    public static String compose(Transform transform) {
        if (transform == null || transform.isIdentity()) {
            return "";
        }
        List<String> parts = new ArrayList<>(3);
        if (transform.translate() != null) {
            parts.add("translate(" + format(transform.translate().x()) + "," + format(transform.translate().y()) + ")");
        }
        if (transform.rotate() != 0) {
            if (transform.origin() != null) {
                parts.add("rotate(" + format(transform.rotate()) + "," + format(transform.origin().x())
                        + "," + format(transform.origin().y()) + ")");
            } else {
                parts.add("rotate(" + format(transform.rotate()) + ")");
            }
        }
        if (transform.scale() != null) {
            parts.add("scale(" + format(transform.scale().width()) + "," + format(transform.scale().height()) + ")");
        }
        return String.join(" ", parts);
    }
}
