package org.iconoglott.compiler.backend.emit;

import org.iconoglott.compiler.api.CompilationException;
import org.iconoglott.compiler.backend.scene.ResourceRegistry;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeNode;
import org.iconoglott.compiler.frontend.parser.features.symbol.SymbolNode;
import org.iconoglott.compiler.frontend.parser.features.symbol.ViewBox;

import java.util.List;

import static org.iconoglott.compiler.backend.emit.Markup.attr;
import static org.iconoglott.compiler.frontend.lexer.NumberText.format;

/**
 * The first render pass: writes the symbol definitions and then the markup of all shapes,
 * and collects the resources both register. Every call starts with an empty registry, so
 * ids restart at <code>d1</code>.
 */
public class ShapeEmitter {

    private final EmissionRegistry registry;

    public ShapeEmitter() {
        this(EmissionRegistry.initializeWithDefaults());
    }

    public ShapeEmitter(EmissionRegistry registry) {
        this.registry = registry;
    }

    /**
     * The markup of a scene and the resources it references.
     *
     * @param symbols The <code>symbol</code> elements, to be placed in <code>defs</code>.
     * @param markup The concatenated shape elements.
     * @param resources The registrations made while writing both.
     */
    public record Result(String symbols, String markup, ResourceRegistry resources) {
    }

    /**
     * Emits symbols and shapes in order.
     * @param symbols The symbol definitions.
     * @param shapes The top-level shapes.
     * @return The markup and the resources.
     * @throws CompilationException if a shape cannot be written.
     */
    public Result emitAll(List<SymbolNode> symbols, List<ShapeNode> shapes) throws CompilationException {
        EmissionContext context = new EmissionContext(registry);
        StringBuilder out = context.out();
        for (SymbolNode symbol : symbols) {
            out.append("<symbol").append(attr("id", symbol.id()));
            ViewBox box = symbol.viewBox();
            if (box != null) {
                out.append(attr("viewBox", format(box.x()) + " " + format(box.y()) + " "
                        + format(box.width()) + " " + format(box.height())));
            }
            out.append('>');
            emit(context, symbol.children());
            out.append("</symbol>");
        }
        int symbolsEnd = out.length();
        emit(context, shapes);
        return new Result(out.substring(0, symbolsEnd), out.substring(symbolsEnd), context.resources());
    }

    private static void emit(EmissionContext context, List<ShapeNode> shapes) throws CompilationException {
        for (ShapeNode shape : shapes) {
            try {
                context.emit(shape);
            } catch (RuntimeException e) {
                throw new CompilationException("Failed to emit " + shape.kind().keyword()
                        + " at line " + shape.line() + ": " + e.getMessage(), e);
            }
        }
    }
}
