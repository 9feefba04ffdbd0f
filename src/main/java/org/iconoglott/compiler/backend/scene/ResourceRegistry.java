package org.iconoglott.compiler.backend.scene;

import org.iconoglott.compiler.frontend.parser.features.style.GradientDef;
import org.iconoglott.compiler.frontend.parser.features.style.ShadowDef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The shared definitions referenced by shapes, keyed by sequentially allocated ids
 * <code>d1</code>, <code>d2</code>, ... The registry is append-only; a new registry starts
 * counting at <code>d1</code> again.
 */
public class ResourceRegistry {

    private static final String ID_PREFIX = "d";

    private final List<Resource> entries = new ArrayList<>();
    private int nextId = 1;

    /**
     * A registered definition.
     */
    public sealed interface Resource {
        String id();
    }

    /**
     * A linear or radial gradient used as a fill.
     */
    public record Gradient(String id, GradientDef definition) implements Resource {
    }

    /**
     * A filter combining an optional drop shadow and an optional gaussian blur.
     * At least one of the two is set.
     */
    public record Filter(String id, ShadowDef shadow, Double blur) implements Resource {
    }

    /**
     * Registers a gradient under the next id.
     * @param gradient The gradient definition.
     * @return The allocated id.
     */
    public String registerGradient(GradientDef gradient) {
        String id = allocate();
        entries.add(new Gradient(id, gradient));
        return id;
    }

    /**
     * Registers a filter under the next id.
     * @param shadow The drop shadow, or {@code null}.
     * @param blur The blur deviation, or {@code null}.
     * @return The allocated id.
     * @throws IllegalArgumentException if neither a shadow nor a blur is given.
     */
    public String registerFilter(ShadowDef shadow, Double blur) {
        if (shadow == null && blur == null) {
            throw new IllegalArgumentException("A filter needs a shadow or a blur.");
        }
        String id = allocate();
        entries.add(new Filter(id, shadow, blur));
        return id;
    }

    /**
     * @return All registrations in allocation order.
     */
    public List<Resource> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private String allocate() {
        return ID_PREFIX + nextId++;
    }
}
