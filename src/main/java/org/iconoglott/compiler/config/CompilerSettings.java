package org.iconoglott.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.iconoglott.compiler.frontend.parser.features.canvas.CanvasTier;

/**
 * The tunable constants of the pipeline, read from the <code>iconoglott</code> section of
 * the configuration.
 *
 * @param defaultTier The canvas tier used when a document declares none.
 * @param defaultFill The canvas background used when a document declares none.
 * @param textWidthFactor Text width per character as a multiple of the font size.
 * @param textHeightFactor Text height as a multiple of the font size.
 * @param placeholderSize The extent of shapes that carry no size information.
 * @param nodeWidth The default width of graph nodes.
 * @param nodeHeight The default height of graph nodes.
 * @param errorBackground The background of the fallback error document.
 * @param errorForeground The text colour of the fallback error document.
 */
public record CompilerSettings(
        CanvasTier defaultTier,
        String defaultFill,
        double textWidthFactor,
        double textHeightFactor,
        double placeholderSize,
        double nodeWidth,
        double nodeHeight,
        String errorBackground,
        String errorForeground
) {

    private static final String ROOT = "iconoglott";

    /**
     * Reads the settings from a configuration.
     * @param config A resolved configuration containing the <code>iconoglott</code> section.
     * @return The settings.
     * @throws ConfigException.BadValue if the default tier is not a known tier name.
     */
    public static CompilerSettings fromConfig(Config config) {
        Config root = config.getConfig(ROOT);
        String tierName = root.getString("canvas.default-tier");
        CanvasTier tier = CanvasTier.fromName(tierName).orElseThrow(() ->
                new ConfigException.BadValue(root.origin(), "canvas.default-tier", "Unknown canvas tier: " + tierName));
        return new CompilerSettings(
                tier,
                root.getString("canvas.default-fill"),
                root.getDouble("measure.text-width-factor"),
                root.getDouble("measure.text-height-factor"),
                root.getDouble("measure.placeholder-size"),
                root.getDouble("graph.node-width"),
                root.getDouble("graph.node-height"),
                root.getString("error-document.background"),
                root.getString("error-document.foreground"));
    }

    /**
     * @return The settings defined by the bundled <code>reference.conf</code>.
     */
    public static CompilerSettings defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }
}
