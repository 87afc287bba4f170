// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.hiero.prometric.core.MetricBaseTest;
import org.hiero.prometric.core.MetricKey;
import org.hiero.prometric.core.MetricSnapshotVerifier;
import org.hiero.prometric.core.MetricType;
import org.hiero.prometric.core.SettableMetricBaseTest;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class LongCounterTest extends SettableMetricBaseTest<LongCounter, LongCounter.Builder> {

    @Override
    protected MetricType metricType() {
        return MetricType.COUNTER;
    }

    @Override
    protected LongCounter.Builder emptyMetricBuilder(String name) {
        return LongCounter.builder(name);
    }

    @Test
    void testNullNameMetricKey() {
        assertThatThrownBy(() -> LongCounter.key(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void testNullMetricKeyBuilder() {
        assertThatThrownBy(() -> LongCounter.builder((MetricKey<LongCounter>) null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("key must not be null");
    }

    @Nested
    class ModifyMeasurementsTests {

        @Test
        void testDefaultInitialValueNoLabels() {
            LongCounter metric = emptyMetricBuilder().build();
            assertThat(metric.getOrCreateNotLabeled().get()).isEqualTo(0);

            metric.getOrCreateNotLabeled().increment();
            metric.getOrCreateNotLabeled().increment(2);
            assertThat(metric.getOrCreateNotLabeled().get()).isEqualTo(3);

            resetMetric(metric);
            assertThat(metric.getOrCreateNotLabeled().get()).isEqualTo(0);
        }

        @Test
        void testResetReturnsEveryLabelSetToZero() {
            LongCounter metric = emptyMetricBuilder().addDynamicLabelNames("label").build();

            metric.getOrCreateLabeled("1").increment(2);
            metric.getOrCreateLabeled("2").increment(3);
            metric.getOrCreateLabeled("2").increment(0);

            assertThat(metric.getOrCreateLabeled("1").get()).isEqualTo(2);
            assertThat(metric.getOrCreateLabeled("2").get()).isEqualTo(3);

            resetMetric(metric);

            assertThat(metric.getOrCreateLabeled("1").get()).isZero();
            assertThat(metric.getOrCreateLabeled("2").get()).isZero();
        }

        @Test
        void testMeasurementResetOnlyAffectsOneLabelSet() {
            LongCounter metric = emptyMetricBuilder().addDynamicLabelNames("label").build();
            metric.getOrCreateLabeled("1").increment(5);
            metric.getOrCreateLabeled("2").increment(7);

            metric.getOrCreateLabeled("1").reset();

            assertThat(metric.getOrCreateLabeled("1").get()).isEqualTo(0);
            assertThat(metric.getOrCreateLabeled("2").get()).isEqualTo(7);
        }

        @ParameterizedTest
        @ValueSource(longs = {-1, -100, Long.MIN_VALUE})
        void testNegativeIncrementThrows(long value) {
            LongCounter.Measurement measurement = emptyMetricBuilder().build().getOrCreateNotLabeled();

            assertThatThrownBy(() -> measurement.increment(value))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Increment value must be non-negative");
            assertThat(measurement.get()).isEqualTo(0);
        }

        @Test
        void testConcurrentMeasurementModification() throws InterruptedException {
            LongCounter.Measurement measurement = emptyMetricBuilder().build().getOrCreateNotLabeled();

            final int threadCount = 10;
            final int updatesPerThread = 10000;

            ThreadUtils.runConcurrentAndWait(threadCount, Duration.ofSeconds(2), threadIdx -> () -> {
                for (int i = 0; i < updatesPerThread; i++) {
                    measurement.increment();
                }
            });

            assertThat(measurement.get()).isEqualTo(threadCount * updatesPerThread);
        }
    }

    @Nested
    class SnapshotTests extends MetricBaseTest<LongCounter, LongCounter.Builder>.SnapshotTests {

        @Test
        void testSnapshotNoLabels() {
            LongCounter metric = emptyMetricBuilder().build();

            verifySnapshotIsEmpty(metric);

            metric.getOrCreateNotLabeled(); // just initialize measurement
            new MetricSnapshotVerifier(metric).add(0L).verify();

            metric.getOrCreateNotLabeled().increment(1);
            metric.getOrCreateNotLabeled().increment(2);

            new MetricSnapshotVerifier(metric).add(3L).verify();
            new MetricSnapshotVerifier(metric).add(3L).verify(); // still the same value
        }

        @Test
        void testSnapshotWithLabelsSortedByValues() {
            LongCounter metric =
                    emptyMetricBuilder().addDynamicLabelNames("method", "path").build();

            metric.getOrCreateLabeled("POST", "/api").increment(2);
            metric.getOrCreateLabeled("GET", "/b").increment(3);
            metric.getOrCreateLabeled("GET", "/a").increment();

            new MetricSnapshotVerifier(metric)
                    .add(1L, "GET", "/a")
                    .add(3L, "GET", "/b")
                    .add(2L, "POST", "/api")
                    .verify();
        }
    }
}
