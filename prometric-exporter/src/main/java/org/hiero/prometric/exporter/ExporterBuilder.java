// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.exporter;

import com.sun.net.httpserver.HttpServer;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.UnresolvedAddressException;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.hiero.prometric.core.MetricRegistry;
import org.hiero.prometric.core.MetricUtils;

/**
 * Configures and installs a {@link MetricsHttpServer}.
 * <pre>{@code
 * MetricsHttpServer server = new ExporterBuilder()
 *         .withAddress("127.0.0.1:9100")
 *         .withPath("/metrics")
 *         .withNamespace("node")
 *         .install();
 * }</pre>
 * Defaults: address {@code 0.0.0.0:9090}, root path {@code /}, no prefix, the
 * {@link MetricRegistry#defaultRegistry() default registry} and a server owned daemon thread pool.
 */
public final class ExporterBuilder {

    public static final String DEFAULT_HOSTNAME = "0.0.0.0";
    public static final int DEFAULT_PORT = 9090;
    public static final int DEFAULT_BUFFER_SIZE = 1024;

    static final int DEFAULT_THREADS = 4;
    private static final int MAX_BUFFER_SIZE = 2 * 1024 * 1024;
    private static final int ACCEPT_BACKLOG = 16;

    private InetSocketAddress address = new InetSocketAddress(DEFAULT_HOSTNAME, DEFAULT_PORT);
    @Nullable
    private String path;
    @Nullable
    private String globalPrefix;
    private MetricRegistry registry;
    @Nullable
    private Executor executor;
    private int bufferSize = DEFAULT_BUFFER_SIZE;

    /**
     * @param address {@code host:port}, IPv6 hosts in brackets, e.g. {@code [::1]:9090}
     * @return this builder
     * @throws IllegalArgumentException if the address has no valid port
     */
    @NonNull
    public ExporterBuilder withAddress(@NonNull String address) {
        MetricUtils.throwArgBlank(address, "address");
        final int separator = address.lastIndexOf(':');
        if (separator <= 0 || separator == address.length() - 1) {
            throw new IllegalArgumentException("Address must be in host:port form, but was: " + address);
        }
        String host = address.substring(0, separator);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        final int port;
        try {
            port = Integer.parseInt(address.substring(separator + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in address: " + address, e);
        }
        return withAddress(new InetSocketAddress(host, port));
    }

    @NonNull
    public ExporterBuilder withAddress(@NonNull InetSocketAddress address) {
        this.address = Objects.requireNonNull(address, "address must not be null");
        return this;
    }

    /**
     * Sets the path metrics are served on. It must start with {@code /} and must not end with {@code /}.
     * Without this call metrics are served on the root path. The path is validated by {@link #install()}.
     */
    @NonNull
    public ExporterBuilder withPath(@NonNull String path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        return this;
    }

    /**
     * Prefixes every served metric name with {@code prefix + "_"}. Registered metrics keep their names.
     *
     * @throws IllegalArgumentException if the prefix is not a valid metric name
     */
    @NonNull
    public ExporterBuilder withGlobalPrefix(@NonNull String prefix) {
        this.globalPrefix = MetricUtils.validateMetricNameCharacters(prefix);
        return this;
    }

    /**
     * Same as {@link #withGlobalPrefix(String)}.
     */
    @NonNull
    public ExporterBuilder withNamespace(@NonNull String namespace) {
        return withGlobalPrefix(namespace);
    }

    @NonNull
    public ExporterBuilder withRegistry(@NonNull MetricRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        return this;
    }

    /**
     * Dispatches requests onto the given executor. The executor stays owned by the caller and is not shut down
     * when the server is closed.
     */
    @NonNull
    public ExporterBuilder withExecutor(@NonNull Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        return this;
    }

    /**
     * @param bufferSize response buffer size in bytes, {@code 0} to disable buffering
     */
    @NonNull
    public ExporterBuilder withBufferSize(int bufferSize) {
        if (bufferSize < 0 || bufferSize > MAX_BUFFER_SIZE) {
            throw new IllegalArgumentException(
                    "Buffer size must be between 0 and " + MAX_BUFFER_SIZE + ", but was: " + bufferSize);
        }
        this.bufferSize = bufferSize;
        return this;
    }

    /**
     * Binds the listener and starts serving. Returns as soon as the listener is started.
     *
     * @return the running server
     * @throws ExporterException with {@link ExporterException.Kind#INVALID_PATH} for an invalid path, or
     *                           {@link ExporterException.Kind#BIND} if the address cannot be bound
     */
    @NonNull
    public MetricsHttpServer install() throws ExporterException {
        final String servedPath = validatePath(path);
        final MetricRegistry servedRegistry = registry != null ? registry : MetricRegistry.defaultRegistry();

        final HttpServer server;
        try {
            server = HttpServer.create(address, ACCEPT_BACKLOG);
        } catch (IOException | UnresolvedAddressException e) {
            throw new ExporterException(
                    ExporterException.Kind.BIND, "Failed to bind metrics HTTP server to " + address, e);
        }

        final ExecutorService ownedExecutor =
                executor == null ? Executors.newFixedThreadPool(DEFAULT_THREADS, new DaemonThreadFactory()) : null;
        try {
            return new MetricsHttpServer(
                    server,
                    servedRegistry,
                    servedPath,
                    globalPrefix,
                    bufferSize,
                    executor != null ? executor : ownedExecutor,
                    ownedExecutor);
        } catch (RuntimeException e) {
            server.stop(0);
            if (ownedExecutor != null) {
                ownedExecutor.shutdownNow();
            }
            throw e;
        }
    }

    static String validatePath(@Nullable String path) throws ExporterException {
        if (path == null) {
            return "/";
        }
        if (path.isEmpty() || !path.startsWith("/") || path.endsWith("/")) {
            throw new ExporterException(
                    ExporterException.Kind.INVALID_PATH,
                    "Path must start with '/' and must not end with '/', but was: '" + path + "'");
        }
        return path;
    }

    private static final class DaemonThreadFactory implements ThreadFactory {

        private final AtomicInteger threadNumber = new AtomicInteger(1);

        @Override
        public Thread newThread(@NonNull Runnable runnable) {
            final Thread thread = new Thread(runnable, "prometric-exporter-" + threadNumber.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
