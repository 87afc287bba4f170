// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.exporter;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.zip.GZIPOutputStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.prometric.core.MetricRegistry;
import org.hiero.prometric.core.MetricRegistrySnapshot;

/**
 * An HTTP server exposing a {@link MetricRegistry} in the Prometheus text format.
 * <p>
 * {@code GET} on the configured path serves a fresh registry snapshot, {@code HEAD} answers with headers only and
 * other methods are rejected with 405. Requests for any other path get 404. Responses are gzip compressed when the
 * client accepts it. Requests are served concurrently.
 * <p>
 * Instances are created with {@link ExporterBuilder#install()} and stopped with {@link #close()}.
 */
public final class MetricsHttpServer implements Closeable {

    private static final Logger logger = LogManager.getLogger(MetricsHttpServer.class);

    private static final byte[] NOT_FOUND = "Not Found".getBytes(StandardCharsets.UTF_8);

    private final TextFormatWriter writer = new TextFormatWriter();
    private final MetricRegistry registry;
    private final String path;
    private final String globalPrefix;
    private final int bufferSize;

    private final HttpServer server;
    private final ExecutorService ownedExecutor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    MetricsHttpServer(
            @NonNull HttpServer server,
            @NonNull MetricRegistry registry,
            @NonNull String path,
            @Nullable String globalPrefix,
            int bufferSize,
            @NonNull Executor executor,
            @Nullable ExecutorService ownedExecutor) {
        this.server = Objects.requireNonNull(server, "server must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.globalPrefix = globalPrefix;
        this.bufferSize = bufferSize;
        this.ownedExecutor = ownedExecutor;

        server.setExecutor(Objects.requireNonNull(executor, "executor must not be null"));
        // a root context receives every request, so unknown paths can be answered with 404
        server.createContext("/", this::handle);
        server.start();

        logger.info(
                "Metrics HTTP server started. address={}, path={}, globalPrefix={}",
                server.getAddress(),
                path,
                globalPrefix);
    }

    /**
     * @return the address the server is bound to, with the actual port when port {@code 0} was requested
     */
    @NonNull
    public InetSocketAddress getAddress() {
        return server.getAddress();
    }

    /**
     * @return the path metrics are served on
     */
    @NonNull
    public String getPath() {
        return path;
    }

    private void handle(HttpExchange exchange) {
        try {
            final String method = exchange.getRequestMethod();
            if (!path.equals(exchange.getRequestURI().getPath())) {
                sendNotFound(exchange);
            } else if ("GET".equalsIgnoreCase(method)) {
                handleGetRequest(exchange);
            } else if ("HEAD".equalsIgnoreCase(method)) {
                handleHeadRequest(exchange);
            } else {
                exchange.getResponseHeaders().set("Allow", "GET, HEAD");
                exchange.sendResponseHeaders(405, -1);
            }
        } catch (IOException e) {
            logger.debug("Failed to send metrics response. remote={}", exchange.getRemoteAddress(), e);
        } catch (RuntimeException e) {
            logger.warn("Unexpected error while handling metrics request. uri={}", exchange.getRequestURI(), e);
            sendServerError(exchange);
        } finally {
            exchange.close();
        }
    }

    private void handleGetRequest(HttpExchange exchange) throws IOException {
        MetricRegistrySnapshot snapshot = registry.snapshot();
        if (globalPrefix != null) {
            snapshot = snapshot.withNamePrefix(globalPrefix);
        }

        setCommonOkResponseHeaders(exchange.getResponseHeaders());
        final boolean useGzip = handleGzipHeaders(exchange);
        exchange.sendResponseHeaders(200, 0);

        OutputStream outputStream = exchange.getResponseBody();
        if (useGzip) {
            outputStream = new GZIPOutputStream(outputStream);
        }
        if (bufferSize != 0) {
            outputStream = new BufferedOutputStream(outputStream, bufferSize);
        }
        try (OutputStream os = outputStream) {
            writer.write(snapshot, os);
        }
    }

    private void handleHeadRequest(HttpExchange exchange) throws IOException {
        setCommonOkResponseHeaders(exchange.getResponseHeaders());
        handleGzipHeaders(exchange);
        exchange.sendResponseHeaders(200, -1);
    }

    private static void sendNotFound(HttpExchange exchange) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(404, NOT_FOUND.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(NOT_FOUND);
        }
    }

    private static void sendServerError(HttpExchange exchange) {
        // the status line can only be sent while the response is not committed yet
        if (exchange.getResponseCode() != -1) {
            return;
        }
        try {
            exchange.getResponseHeaders().set("Cache-Control", "no-store");
            exchange.sendResponseHeaders(500, -1);
        } catch (IOException e) {
            logger.debug("Failed to send error response. remote={}", exchange.getRemoteAddress(), e);
        }
    }

    private static void setCommonOkResponseHeaders(Headers responseHeaders) {
        responseHeaders.set("Content-Type", TextFormatWriter.CONTENT_TYPE);
        responseHeaders.set("Cache-Control", "no-store");
        responseHeaders.set("Vary", "Accept-Encoding");
    }

    private static boolean handleGzipHeaders(HttpExchange exchange) {
        final List<String> encodingHeaders = exchange.getRequestHeaders().get("Accept-Encoding");
        if (encodingHeaders == null) {
            return false;
        }
        for (String encodingHeader : encodingHeaders) {
            for (String encoding : encodingHeader.split(",")) {
                if (encoding.trim().equalsIgnoreCase("gzip")) {
                    exchange.getResponseHeaders().set("Content-Encoding", "gzip");
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Stops the listener and the request threads owned by this server. Closing again has no effect. A caller supplied executor is left running.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.info("Stopping metrics HTTP server. address={}", server.getAddress());
        server.stop(0);
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }
}
