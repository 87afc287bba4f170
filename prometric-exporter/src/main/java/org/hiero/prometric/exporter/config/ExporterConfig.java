// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.exporter.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import java.util.Optional;

/**
 * Configuration of the metrics HTTP endpoint, read from properties prefixed with {@code prometric.exporter}.
 * <ul>
 *     <li>{@code enabled}: whether the endpoint is installed (default: true)</li>
 *     <li>{@code hostname}: the hostname to bind to (default: 0.0.0.0)</li>
 *     <li>{@code port}: the port to listen on (default: 9090, range: 0-65535, 0 = any free port)</li>
 *     <li>{@code path}: the path to serve metrics on (default: root path)</li>
 *     <li>{@code globalPrefix}: prefix for every served metric name (default: none)</li>
 *     <li>{@code bufferSize}: response buffer size (default: 1024, range: 0-2mb, 0 = no buffering)</li>
 * </ul>
 * Instances are created by {@link ExporterConfigs}, which also validates the ranges.
 */
@ConfigMapping(prefix = ExporterConfig.PREFIX, namingStrategy = ConfigMapping.NamingStrategy.VERBATIM)
public interface ExporterConfig {

    String PREFIX = "prometric.exporter";

    @WithDefault("true")
    boolean enabled();

    @WithDefault("0.0.0.0")
    String hostname();

    @WithDefault("9090")
    int port();

    Optional<String> path();

    Optional<String> globalPrefix();

    @WithDefault("1024")
    int bufferSize();
}
