package org.iconoglott.compiler.backend.emit;

import org.iconoglott.compiler.backend.emit.features.ContainerRule;
import org.iconoglott.compiler.backend.emit.features.CurveRule;
import org.iconoglott.compiler.backend.emit.features.GraphRule;
import org.iconoglott.compiler.backend.emit.features.PrimitiveRules;
import org.iconoglott.compiler.backend.emit.features.TextRule;
import org.iconoglott.compiler.backend.emit.features.UseRule;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Registry of emission rules by shape kind.
 */
public final class EmissionRegistry {

    private final Map<ShapeKind, IEmissionRule> rules = new EnumMap<>(ShapeKind.class);

    /**
     * Registers a rule for a shape kind, replacing any earlier one.
     * @param kind The shape kind.
     * @param rule The rule to register.
     */
    public void register(ShapeKind kind, IEmissionRule rule) {
        rules.put(kind, rule);
    }

    /**
     * @param kind The shape kind.
     * @return The rule for the kind.
     * @throws IllegalStateException if no rule is registered for the kind.
     */
    public IEmissionRule resolve(ShapeKind kind) {
        IEmissionRule rule = rules.get(kind);
        if (rule == null) {
            throw new IllegalStateException("No emission rule for shape kind " + kind);
        }
        return rule;
    }

    /**
     * Initializes a new emission registry with the default rules.
     * @return A new registry with a rule for every shape kind.
     */
    public static EmissionRegistry initializeWithDefaults() {
        EmissionRegistry reg = new EmissionRegistry();
        reg.register(ShapeKind.RECT, PrimitiveRules::rect);
        reg.register(ShapeKind.CIRCLE, PrimitiveRules::circle);
        reg.register(ShapeKind.ELLIPSE, PrimitiveRules::ellipse);
        reg.register(ShapeKind.LINE, PrimitiveRules::line);
        reg.register(ShapeKind.PATH, PrimitiveRules::path);
        reg.register(ShapeKind.POLYGON, PrimitiveRules::polygon);
        reg.register(ShapeKind.CURVE, new CurveRule());
        reg.register(ShapeKind.IMAGE, PrimitiveRules::image);
        reg.register(ShapeKind.TEXT, new TextRule());
        ContainerRule container = new ContainerRule();
        reg.register(ShapeKind.GROUP, container);
        reg.register(ShapeKind.LAYOUT, container);
        reg.register(ShapeKind.GRAPH, new GraphRule());
        reg.register(ShapeKind.USE, new UseRule());
        return reg;
    }
}
