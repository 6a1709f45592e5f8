package org.arfrpc.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.Locale;

/**
 * Immutable compiler settings, read from the {@code arf.compiler} block of the configuration.
 *
 * @param fileExtension     The extension appended to import literals lacking it.
 * @param cycleDetection    How cyclic struct references are searched for.
 * @param allowStructMapKeys Whether a struct may be used as a map key.
 */
public record CompilerOptions(String fileExtension, CycleDetection cycleDetection, boolean allowStructMapKeys) {

    /** The configuration path of the compiler block. */
    public static final String CONFIG_PATH = "arf.compiler";

    /**
     * Scope of the cyclic reference check.
     */
    public enum CycleDetection {
        /** Every cycle of direct struct references, however long. */
        FULL,
        /** Only self references and two-struct cycles. */
        DIRECT
    }

    public CompilerOptions {
        if (fileExtension == null || fileExtension.isBlank()) {
            throw new IllegalArgumentException("fileExtension must not be blank");
        }
        if (cycleDetection == null) {
            throw new IllegalArgumentException("cycleDetection must not be null");
        }
    }

    /**
     * Reads the options from a resolved configuration.
     *
     * @param config A configuration containing the {@code arf.compiler} block.
     * @return The options.
     * @throws com.typesafe.config.ConfigException If a value is missing or has the wrong type.
     * @throws IllegalArgumentException If {@code cycle-detection} names an unknown mode.
     */
    public static CompilerOptions fromConfig(Config config) {
        Config compiler = config.getConfig(CONFIG_PATH);
        String mode = compiler.getString("cycle-detection").toUpperCase(Locale.ROOT);
        return new CompilerOptions(
                compiler.getString("file-extension"),
                CycleDetection.valueOf(mode),
                compiler.getBoolean("map-keys.allow-structs"));
    }

    /**
     * @return The options defined by {@code reference.conf} alone.
     */
    public static CompilerOptions defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }
}
