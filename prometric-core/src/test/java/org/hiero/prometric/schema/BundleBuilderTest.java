// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import org.hiero.prometric.Histogram;
import org.hiero.prometric.LongCounter;
import org.hiero.prometric.LongGauge;
import org.hiero.prometric.ThreadUtils;
import org.hiero.prometric.core.Label;
import org.hiero.prometric.core.MetricRegistry;
import org.hiero.prometric.core.MetricSnapshot;
import org.junit.jupiter.api.Test;

class BundleBuilderTest {

    /**
     * Minimal bundle in the shape of the generated ones.
     */
    private record TestBundle(LongCounter requests, Histogram latency) {

        static Builder builder() {
            return new Builder();
        }

        static final class Builder extends BundleBuilder<Builder, TestBundle> {

            private String[] requestLabels = {"method"};

            Builder requestLabels(String... labels) {
                requestLabels = labels;
                return this;
            }

            @Override
            protected TestBundle newBundle() {
                return new TestBundle(
                        bind(LongCounter.builder("test_requests")
                                .setDescription("Requests")
                                .addDynamicLabelNames(requestLabels)),
                        bind(Histogram.builder("test_latency").setBuckets(0.1, 1.0)));
            }
        }
    }

    @Test
    void testBuildRegistersAllMetricsWithStaticLabels() {
        MetricRegistry registry = new MetricRegistry();

        TestBundle bundle = TestBundle.builder()
                .withRegistry(registry)
                .withLabel("host", "localhost")
                .build();

        assertThat(registry.getMetric(LongCounter.key("test_requests"))).isSameAs(bundle.requests());
        assertThat(registry.getMetric(Histogram.key("test_latency"))).isSameAs(bundle.latency());
        assertThat(bundle.requests().staticLabels()).containsExactly(new Label("host", "localhost"));
        assertThat(bundle.requests().description()).isEqualTo("Requests");
    }

    @Test
    void testWithLabelOverwritesSameKey() {
        MetricRegistry registry = new MetricRegistry();

        TestBundle bundle = TestBundle.builder()
                .withRegistry(registry)
                .withLabel("host", "a")
                .withLabel("env", "test")
                .withLabel("host", "b")
                .build();

        assertThat(bundle.latency().staticLabels()).containsExactly(new Label("env", "test"), new Label("host", "b"));
    }

    @Test
    void testWithRegistryReplacesPreviousRegistry() {
        MetricRegistry first = new MetricRegistry();
        MetricRegistry second = new MetricRegistry();

        TestBundle.builder().withRegistry(first).withRegistry(second).build();

        assertThat(first.metrics()).isEmpty();
        assertThat(second.metrics()).hasSize(2);
    }

    @Test
    void testInvalidStaticLabelThrows() {
        TestBundle.Builder builder = TestBundle.builder();

        assertThatThrownBy(() -> builder.withLabel("bad-name", "value")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.withLabel("host", null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> builder.withRegistry(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> builder.withConflictPolicy(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void testEmptyStaticLabelValueIsKept() {
        MetricRegistry registry = new MetricRegistry();

        TestBundle bundle =
                TestBundle.builder().withRegistry(registry).withLabel("zone", "").build();

        assertThat(bundle.requests().staticLabels()).containsExactly(new Label("zone", ""));
    }

    @Test
    void testStaticLabelConflictingWithDynamicLabelIsFatal() {
        MetricRegistry registry = new MetricRegistry();
        TestBundle.Builder builder =
                TestBundle.builder().withRegistry(registry).withLabel("method", "GET");

        assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
        assertThat(registry.metrics()).isEmpty();
    }

    @Test
    void testKeepRegisteredSharesStateBetweenBundles() {
        MetricRegistry registry = new MetricRegistry();

        TestBundle first = TestBundle.builder().withRegistry(registry).build();
        first.requests().getOrCreateLabeled("GET").increment(3);

        TestBundle second = TestBundle.builder().withRegistry(registry).build();
        second.requests().getOrCreateLabeled("GET").increment();

        assertThat(second.requests()).isSameAs(first.requests());
        assertThat(registry.getMetric(LongCounter.key("test_requests"))).isSameAs(first.requests());
        assertThat(registry.metrics()).hasSize(2);
    }

    @Test
    void testKeepRegisteredWithOtherLabelsIsFatal() {
        MetricRegistry registry = new MetricRegistry();
        LongCounter registered = registry.register(LongCounter.builder("test_requests"));

        assertThatThrownBy(() -> TestBundle.builder().withRegistry(registry).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("test_requests is already registered with another definition");
        assertThat(registry.getMetrics(LongCounter.key("test_requests"))).containsExactly(registered);
    }

    @Test
    void testKeepRegisteredWithOtherHelpIsFatal() {
        MetricRegistry registry = new MetricRegistry();
        registry.register(LongCounter.builder("test_requests")
                .setDescription("Other help")
                .addDynamicLabelNames("method"));

        assertThatThrownBy(() -> TestBundle.builder().withRegistry(registry).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("test_requests");
    }

    @Test
    void testKeepRegisteredWithOtherKindIsFatal() {
        MetricRegistry registry = new MetricRegistry();
        registry.register(LongGauge.builder("test_latency"));

        assertThatThrownBy(() -> TestBundle.builder().withRegistry(registry).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("test_latency");
        assertThat(registry.getMetric(LongGauge.key("test_latency"))).isNotNull();
    }

    @Test
    void testKeepRegisteredWithOtherBucketsIsFatal() {
        MetricRegistry registry = new MetricRegistry();
        registry.register(Histogram.builder("test_latency").setBuckets(5.0));

        assertThatThrownBy(() -> TestBundle.builder().withRegistry(registry).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("test_latency");
    }

    @Test
    void testBundlesWithDifferentStaticLabelValuesAreRegisteredSideBySide() {
        MetricRegistry registry = new MetricRegistry();
        TestBundle first =
                TestBundle.builder().withRegistry(registry).withLabel("host", "a").build();

        TestBundle second =
                TestBundle.builder().withRegistry(registry).withLabel("host", "b").build();
        first.requests().getOrCreateLabeled("GET").increment();
        second.requests().getOrCreateLabeled("GET").increment(5);

        assertThat(second.requests()).isNotSameAs(first.requests());
        assertThat(registry.getMetrics(LongCounter.key("test_requests")))
                .containsExactly(first.requests(), second.requests());
        assertThat(registry.snapshot().findAll("test_requests").stream()
                        .map(MetricSnapshot::staticLabels)
                        .toList())
                .containsExactly(List.of(new Label("host", "a")), List.of(new Label("host", "b")));

        TestBundle again =
                TestBundle.builder().withRegistry(registry).withLabel("host", "b").build();
        assertThat(again.requests()).isSameAs(second.requests());
    }

    @Test
    void testOtherStaticLabelNamesAreFatal() {
        MetricRegistry registry = new MetricRegistry();
        TestBundle.builder().withRegistry(registry).withLabel("host", "a").build();

        assertThatThrownBy(() -> TestBundle.builder()
                        .withRegistry(registry)
                        .withLabel("zone", "a")
                        .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already registered with another definition");
    }

    @Test
    void testReplacePolicyReplacesRegisteredMetrics() {
        MetricRegistry registry = new MetricRegistry();
        TestBundle first = TestBundle.builder().withRegistry(registry).build();

        TestBundle second = TestBundle.builder()
                .withRegistry(registry)
                .withConflictPolicy(ConflictPolicy.REPLACE)
                .requestLabels("method", "path")
                .build();

        assertThat(second.requests()).isNotSameAs(first.requests());
        assertThat(registry.getMetric(LongCounter.key("test_requests"))).isSameAs(second.requests());
        assertThat(registry.getMetric(LongCounter.key("test_requests")).dynamicLabelNames())
                .containsExactly("method", "path");
    }

    @Test
    void testConcurrentBuildsBindToOneInstance() throws InterruptedException {
        MetricRegistry registry = new MetricRegistry();
        int threadCount = 8;
        TestBundle[] bundles = new TestBundle[threadCount];

        ThreadUtils.runConcurrentAndWait(
                threadCount,
                Duration.ofSeconds(2),
                threadIdx -> () ->
                        bundles[threadIdx] = TestBundle.builder().withRegistry(registry).build());

        LongCounter registered = registry.getMetric(LongCounter.key("test_requests"));
        for (TestBundle bundle : bundles) {
            assertThat(bundle.requests()).isSameAs(registered);
        }
    }
}
