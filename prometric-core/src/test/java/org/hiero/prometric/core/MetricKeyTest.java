// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.hiero.prometric.DoubleCounter;
import org.hiero.prometric.Histogram;
import org.hiero.prometric.LongCounter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

public class MetricKeyTest {

    @Test
    void testGetters() {
        MetricKey<Histogram> key = Histogram.key("app_latency");

        assertThat(key.name()).isEqualTo("app_latency");
        assertThat(key.type()).isEqualTo(Histogram.class);
    }

    @Test
    void testEqualsAndHashCode() {
        MetricKey<LongCounter> key1 = MetricKey.of("requests", LongCounter.class);
        MetricKey<LongCounter> key2 = LongCounter.key("requests");

        assertThat(key1).isEqualTo(key2);
        assertThat(key1.hashCode()).isEqualTo(key2.hashCode());
    }

    @Test
    void testNotEqualsWithDifferentType() {
        MetricKey<DoubleCounter> key1 = MetricKey.of("metric", DoubleCounter.class);
        MetricKey<LongCounter> key2 = MetricKey.of("metric", LongCounter.class);

        assertThat(key1).isNotEqualTo(key2);
    }

    @Test
    void testNullNameOrTypeThrows() {
        assertThatThrownBy(() -> MetricKey.of(null, LongCounter.class)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> MetricKey.of("metric", null)).isInstanceOf(NullPointerException.class);
    }

    @ParameterizedTest
    @MethodSource("org.hiero.prometric.TestUtils#invalidMetricNames")
    void testInvalidNameCharactersThrows(String invalidName) {
        assertThatThrownBy(() -> MetricKey.of(invalidName, LongCounter.class))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @MethodSource("org.hiero.prometric.TestUtils#validMetricNames")
    void testValidNameCharacters(String validName) {
        assertThat(MetricKey.of(validName, LongCounter.class).name()).isEqualTo(validName);
    }
}
