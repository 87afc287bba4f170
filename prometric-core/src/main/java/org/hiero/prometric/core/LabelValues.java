// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Arrays;
import java.util.Objects;

/**
 * Represents a set of label values for a specific combination of dynamic labels.
 * Values are positional: value at index {@code i} belongs to the dynamic label name at index {@code i}
 * of the metric it is created for.
 */
public final class LabelValues implements Comparable<LabelValues> {

    static final LabelValues EMPTY = new LabelValues();

    private final String[] values;

    private int hashCode = 0;

    LabelValues(String... values) {
        this.values = values;
    }

    /**
     * @return number of label values (is equal to number of dynamic labels of the metric it belongs to)
     */
    public int size() {
        return values.length;
    }

    /**
     * Get the label value at the specified index.
     *
     * @param index the index of the label value to retrieve
     * @return the label value at the specified index
     */
    @NonNull
    public String get(int index) {
        return values[index];
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof LabelValues that) {
            return Arrays.equals(values, that.values);
        }
        return false;
    }

    @Override
    public int hashCode() {
        if (hashCode == 0) {
            hashCode = 1;
            int limitValue = (Integer.MAX_VALUE >> 9);
            for (String value : values) {
                hashCode = hashCode % limitValue; // avoid integer overflow
                hashCode = 257 * hashCode + Objects.hashCode(value);
            }
        }

        return hashCode;
    }

    /**
     * Compares label values positionally, shorter sequences first when one is a prefix of the other.
     */
    @Override
    public int compareTo(LabelValues other) {
        return Arrays.compare(values, other.values);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
