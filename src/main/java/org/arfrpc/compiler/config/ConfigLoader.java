package org.arfrpc.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;

/**
 * Composes HOCON configuration for the compiler with the following precedence
 * (highest to lowest):
 * <ol>
 *   <li>Java system properties ({@code -Darf.compiler.cycle-detection=DIRECT})</li>
 *   <li>Environment variables</li>
 *   <li>An optional user configuration file</li>
 *   <li>Default reference configuration ({@code reference.conf} on the classpath)</li>
 * </ol>
 * <p>
 * Uses {@link ConfigFactory#defaultReferenceUnresolved()} to defer substitution resolution
 * until after all layers are composed, so overrides propagate to values that reference them.
 */
public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a file, merged with classpath defaults.
     *
     * @param configFile the configuration file to load.
     * @return the fully resolved {@link Config}.
     * @throws IllegalArgumentException if the file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config loadFromFile(final File configFile) {
        if (!configFile.exists()) {
            throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
        }
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads configuration from classpath defaults only (no user config file).
     *
     * @return the fully resolved {@link Config}.
     */
    public static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads the compiler options, honoring system property and environment overrides.
     *
     * @param configFile an optional user configuration file, or {@code null}.
     * @return the compiler options.
     */
    public static CompilerOptions loadOptions(final File configFile) {
        Config config = configFile == null ? loadDefaults() : loadFromFile(configFile);
        return CompilerOptions.fromConfig(config);
    }
}
