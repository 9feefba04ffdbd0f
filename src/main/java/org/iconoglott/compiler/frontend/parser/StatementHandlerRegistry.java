package org.iconoglott.compiler.frontend.parser;

import org.iconoglott.compiler.frontend.parser.features.canvas.CanvasStatementHandler;
import org.iconoglott.compiler.frontend.parser.features.graph.GraphStatementHandler;
import org.iconoglott.compiler.frontend.parser.features.group.GroupStatementHandler;
import org.iconoglott.compiler.frontend.parser.features.layout.LayoutStatementHandler;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeKind;
import org.iconoglott.compiler.frontend.parser.features.shape.ShapeStatementHandler;
import org.iconoglott.compiler.frontend.parser.features.symbol.SymbolStatementHandler;
import org.iconoglott.compiler.frontend.parser.features.symbol.UseStatementHandler;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for statement handlers. This class holds a map of statement keywords
 * to their corresponding handlers.
 */
public class StatementHandlerRegistry {
    private final Map<String, IStatementHandler> handlers = new HashMap<>();

    /**
     * Registers a new statement handler.
     * @param keyword The keyword that introduces the statement (e.g., "rect").
     * @param handler The handler for the statement.
     */
    public void register(String keyword, IStatementHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * Gets the handler for a given keyword. Keywords are case-sensitive.
     * @param keyword The statement keyword.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IStatementHandler> get(String keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    /**
     * Initializes the statement handler registry with all the built-in handlers.
     * @return A new instance of {@link StatementHandlerRegistry} with all handlers registered.
     */
    public static StatementHandlerRegistry initialize() {
        StatementHandlerRegistry registry = new StatementHandlerRegistry();
        registry.register("canvas", new CanvasStatementHandler());
        registry.register("group", new GroupStatementHandler());
        LayoutStatementHandler layoutHandler = new LayoutStatementHandler();
        registry.register("stack", layoutHandler);
        registry.register("row", layoutHandler);
        registry.register("graph", new GraphStatementHandler());
        registry.register("symbol", new SymbolStatementHandler());
        registry.register("use", new UseStatementHandler());

        for (ShapeKind kind : ShapeKind.values()) {
            if (kind.isPrimitive()) {
                registry.register(kind.keyword(), new ShapeStatementHandler(kind));
            }
        }
        return registry;
    }
}
