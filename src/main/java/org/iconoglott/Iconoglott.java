package org.iconoglott;

import com.typesafe.config.Config;
import org.iconoglott.compiler.Compiler;
import org.iconoglott.compiler.config.CompilerSettings;
import org.iconoglott.compiler.config.ConfigLoader;
import org.iconoglott.compiler.config.LoggingConfigurator;
import org.iconoglott.tools.RenderTool;
import org.iconoglott.transport.RenderTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the compiler and its boundary adapters from one configuration. A host application
 * (a websocket server, a tool integration) creates one instance and shares it.
 */
public final class Iconoglott implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Iconoglott.class);

    private final Compiler compiler;
    private final RenderTransport transport;
    private final RenderTool renderTool;

    /**
     * @param config The fully resolved application configuration.
     */
    public Iconoglott(final Config config) {
        final CompilerSettings settings = CompilerSettings.fromConfig(config);
        this.compiler = new Compiler(settings);
        this.transport = new RenderTransport(compiler, config);
        this.renderTool = new RenderTool(compiler);
        LOGGER.debug("Initialized with default canvas {} and fill {}.", settings.defaultTier(), settings.defaultFill());
    }

    /**
     * Loads the configuration with {@link ConfigLoader}, applies its logging section and
     * creates an instance from it.
     * @return The new instance.
     */
    public static Iconoglott fromEnvironment() {
        final Config config = ConfigLoader.load();
        LoggingConfigurator.configure(config);
        return new Iconoglott(config);
    }

    public Compiler compiler() {
        return compiler;
    }

    public RenderTransport transport() {
        return transport;
    }

    public RenderTool renderTool() {
        return renderTool;
    }

    @Override
    public void close() {
        transport.close();
    }
}
