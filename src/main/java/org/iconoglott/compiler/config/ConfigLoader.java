package org.iconoglott.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds the configuration of an iconoglott instance. Sources, highest precedence first:
 * <ol>
 *     <li>environment variables</li>
 *     <li>system properties, e.g. <code>-Diconoglott.canvas.default-tier=large</code></li>
 *     <li>an override file, <code>iconoglott.conf</code> in the working directory unless the
 *     <code>iconoglott.config-file</code> system property names another one</li>
 *     <li><code>reference.conf</code></li>
 * </ol>
 * The merged <code>iconoglott</code> section is checked against the types in
 * <code>reference.conf</code>, so a misspelt value fails at startup rather than at the
 * first render.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    static final String FILE_PROPERTY = "iconoglott.config-file";
    private static final String DEFAULT_FILE = "iconoglott.conf";
    private static final String ROOT_PATH = "iconoglott";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * @return The resolved configuration, using the default override file location.
     * @throws com.typesafe.config.ConfigException if a source cannot be parsed or a value has the wrong type.
     */
    public static Config load() {
        return load(Path.of(System.getProperty(FILE_PROPERTY, DEFAULT_FILE)));
    }

    /**
     * @param overrideFile The override file. A missing file, or a path that is not a regular
     *                     file, contributes nothing.
     * @return The resolved configuration.
     * @throws com.typesafe.config.ConfigException if a source cannot be parsed or a value has the wrong type.
     */
    public static Config load(final Path overrideFile) {
        final Config fileConfig;
        if (Files.isRegularFile(overrideFile)) {
            LOG.info("Reading iconoglott overrides from {}", overrideFile.toAbsolutePath());
            fileConfig = ConfigFactory.parseFile(overrideFile.toFile());
        } else {
            LOG.debug("No iconoglott override file at {}", overrideFile);
            fileConfig = ConfigFactory.empty();
        }

        final Config reference = ConfigFactory.defaultReference();
        final Config config = ConfigFactory.systemEnvironment()
                .withFallback(ConfigFactory.systemProperties())
                .withFallback(fileConfig)
                .withFallback(reference)
                .resolve();
        config.checkValid(reference, ROOT_PATH);
        return config;
    }
}
