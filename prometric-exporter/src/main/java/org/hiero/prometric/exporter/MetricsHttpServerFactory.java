// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.exporter;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.net.InetSocketAddress;
import java.util.Objects;
import org.hiero.prometric.core.MetricRegistry;
import org.hiero.prometric.exporter.config.ExporterConfig;
import org.hiero.prometric.exporter.config.ExporterConfigs;

/**
 * Creates a {@link MetricsHttpServer} from {@link ExporterConfig}.
 */
public final class MetricsHttpServerFactory {

    /**
     * Installs an endpoint for the registry configured from the default config sources.
     *
     * @return the running server, or {@code null} if the endpoint is disabled
     */
    @Nullable
    public MetricsHttpServer createExporter(@NonNull MetricRegistry registry) throws ExporterException {
        return createExporter(registry, ExporterConfigs.load());
    }

    /**
     * @return the running server, or {@code null} if the endpoint is disabled
     * @throws ExporterException if the configured path is invalid or the address cannot be bound
     */
    @Nullable
    public MetricsHttpServer createExporter(@NonNull MetricRegistry registry, @NonNull ExporterConfig config)
            throws ExporterException {
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (!config.enabled()) {
            return null;
        }

        final ExporterBuilder builder = new ExporterBuilder()
                .withRegistry(registry)
                .withAddress(new InetSocketAddress(config.hostname(), config.port()))
                .withBufferSize(config.bufferSize());
        config.path().ifPresent(builder::withPath);
        config.globalPrefix().ifPresent(builder::withGlobalPrefix);
        return builder.install();
    }
}
