// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.exporter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.hiero.prometric.LongGauge;
import org.hiero.prometric.core.MetricRegistry;
import org.junit.jupiter.api.Test;

/**
 * Scrapes metrics declared through a schema and served by the HTTP endpoint.
 */
class ExpositionScenarioTest {

    @Test
    void testSchemaMetricsAreServed() throws Exception {
        MetricRegistry registry = new MetricRegistry();
        ScenarioMetricsBundle metrics = ScenarioMetricsBundle.builder()
                .withRegistry(registry)
                .withLabel("host", "localhost")
                .build();
        for (int i = 0; i < 3; i++) {
            metrics.requests("GET").increment();
        }
        metrics.latency().observe(0.75);

        try (MetricsHttpServer server = new ExporterBuilder()
                .withAddress("127.0.0.1:0")
                .withPath("/metrics")
                .withRegistry(registry)
                .install()) {
            HttpResponse<String> response = scrape(server, "/metrics");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body())
                    .isEqualTo(
                            """
                            # HELP app_request_seconds Time spent handling requests.
                            # TYPE app_request_seconds histogram
                            app_request_seconds_bucket{host="localhost",le="0.5"} 0
                            app_request_seconds_bucket{host="localhost",le="1"} 1
                            app_request_seconds_bucket{host="localhost",le="+Inf"} 1
                            app_request_seconds_sum{host="localhost"} 0.75
                            app_request_seconds_count{host="localhost"} 1
                            # TYPE app_requests counter
                            app_requests{host="localhost",method="GET"} 3
                            """);
            assertThat(scrape(server, "/other").statusCode()).isEqualTo(404);
        }
    }

    @Test
    void testEveryLabelCombinationIsOneLine() throws Exception {
        MetricRegistry registry = new MetricRegistry();
        ScenarioMetricsBundle metrics =
                ScenarioMetricsBundle.builder().withRegistry(registry).build();
        String[] methods = {"GET", "POST", "PUT", "DELETE"};
        for (int i = 0; i < methods.length; i++) {
            metrics.requests(methods[i]).increment(i + 1);
        }

        try (MetricsHttpServer server = new ExporterBuilder()
                .withAddress("127.0.0.1:0")
                .withRegistry(registry)
                .withGlobalPrefix("p")
                .install()) {
            String body = scrape(server, "/").body();

            assertThat(body.lines().filter(line -> line.startsWith("p_app_requests{")))
                    .containsExactly(
                            "p_app_requests{method=\"DELETE\"} 4",
                            "p_app_requests{method=\"GET\"} 1",
                            "p_app_requests{method=\"POST\"} 2",
                            "p_app_requests{method=\"PUT\"} 3");
            assertThat(body.lines().filter(line -> !line.startsWith("#")))
                    .allMatch(line -> line.startsWith("p_"));
        }
    }

    @Test
    void testBundlesWithOtherStaticLabelValuesAreBothServed() throws Exception {
        MetricRegistry registry = new MetricRegistry();
        ScenarioMetricsBundle a = ScenarioMetricsBundle.builder()
                .withRegistry(registry)
                .withLabel("host", "a")
                .build();
        ScenarioMetricsBundle b = ScenarioMetricsBundle.builder()
                .withRegistry(registry)
                .withLabel("host", "b")
                .build();
        a.requests("GET").increment();
        b.requests("GET").increment(5);

        try (MetricsHttpServer server = new ExporterBuilder()
                .withAddress("127.0.0.1:0")
                .withRegistry(registry)
                .install()) {
            String body = scrape(server, "/").body();

            assertThat(body.lines().filter(line -> line.startsWith("app_requests")))
                    .containsExactly(
                            "app_requests{host=\"a\",method=\"GET\"} 1",
                            "app_requests{host=\"b\",method=\"GET\"} 5");
            assertThat(body.lines().filter(line -> line.equals("# TYPE app_requests counter")))
                    .hasSize(1);
            assertThat(body.lines().filter(line -> line.equals("# TYPE app_request_seconds histogram")))
                    .hasSize(1);
        }
    }

    @Test
    void testMetricOfOtherKindUnderSameNameFailsBuild() {
        MetricRegistry registry = new MetricRegistry();
        registry.register(LongGauge.builder("app_requests"));

        assertThatThrownBy(() -> ScenarioMetricsBundle.builder()
                        .withRegistry(registry)
                        .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("app_requests")
                .hasMessageContaining("another definition");
    }

    private static HttpResponse<String> scrape(MetricsHttpServer server, String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path))
                .timeout(Duration.ofSeconds(5))
                .GET()
                .build();
        return HttpClient.newHttpClient().send(request, MetricsHttpServerTest.BODY_HANDLER);
    }
}
