// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.exporter.config;

import edu.umd.cs.findbugs.annotations.NonNull;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import java.util.Map;
import java.util.Objects;

/**
 * Loads {@link ExporterConfig} with SmallRye Config.
 * <p>
 * Values come from system properties, environment variables and {@code META-INF/microprofile-config.properties}
 * with the usual MicroProfile ordinals. Explicit overrides take precedence over all of them.
 */
public final class ExporterConfigs {

    /** Ordinal of explicit overrides, above system properties (400). */
    static final int OVERRIDES_ORDINAL = 500;

    static final int MAX_PORT = 65535;
    static final int MAX_BUFFER_SIZE = 2097152;

    private ExporterConfigs() {}

    /**
     * @return the configuration from the default sources
     * @throws IllegalArgumentException if a value is out of range
     */
    @NonNull
    public static ExporterConfig load() {
        return load(Map.of());
    }

    /**
     * @param overrides property values taking precedence over the default sources, keyed by full property name,
     *                  e.g. {@code prometric.exporter.port}
     * @return the validated configuration
     * @throws IllegalArgumentException if a value is out of range
     */
    @NonNull
    public static ExporterConfig load(@NonNull Map<String, String> overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        final SmallRyeConfig config = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withSources(new PropertiesConfigSource(overrides, "prometric-overrides", OVERRIDES_ORDINAL))
                .withMapping(ExporterConfig.class)
                .build();
        return validate(config.getConfigMapping(ExporterConfig.class));
    }

    @NonNull
    static ExporterConfig validate(@NonNull ExporterConfig config) {
        checkRange("port", config.port(), 0, MAX_PORT);
        checkRange("bufferSize", config.bufferSize(), 0, MAX_BUFFER_SIZE);
        return config;
    }

    private static void checkRange(String property, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(ExporterConfig.PREFIX + "." + property + " must be between " + min
                    + " and " + max + ", but was: " + value);
        }
    }
}
