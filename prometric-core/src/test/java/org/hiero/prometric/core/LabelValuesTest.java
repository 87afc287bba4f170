// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

public class LabelValuesTest {

    @Test
    void testEmpty() {
        assertThat(LabelValues.EMPTY.size()).isZero();
        assertThat(LabelValues.EMPTY).hasToString("[]");
        assertThatThrownBy(() -> LabelValues.EMPTY.get(0)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void testPositionalAccess() {
        LabelValues values = new LabelValues("GET", "/api");

        assertThat(values.size()).isEqualTo(2);
        assertThat(values.get(0)).isEqualTo("GET");
        assertThat(values.get(1)).isEqualTo("/api");
    }

    @Test
    void testEqualsAndHashCode() {
        LabelValues values1 = new LabelValues("GET", "/api");
        LabelValues values2 = new LabelValues("GET", "/api");

        assertThat(values1).isEqualTo(values2);
        assertThat(values1.hashCode()).isEqualTo(values2.hashCode());
        assertThat(values1).isNotEqualTo(new LabelValues("/api", "GET"));
        assertThat(values1).isNotEqualTo(LabelValues.EMPTY);
        assertThat(values1).isNotEqualTo(new Object());
    }

    @Test
    void testCompareTo() {
        assertThat(new LabelValues("a", "b").compareTo(new LabelValues("a", "c"))).isNegative();
        assertThat(new LabelValues("b").compareTo(new LabelValues("a", "z"))).isPositive();
        assertThat(new LabelValues("a").compareTo(new LabelValues("a", "a"))).isNegative();
        assertThat(new LabelValues("a", "a").compareTo(new LabelValues("a", "a"))).isZero();
    }
}
