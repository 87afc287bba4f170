// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Arrays;
import java.util.Objects;

/**
 * A snapshot of a histogram measurement: cumulative bucket counts, sum and count of all observations.
 * <p>
 * Cumulative counts array has one element more than the upper bounds array, the last one being
 * the implicit {@code +Inf} bucket, which is always equal to {@link #count()}.
 */
public final class HistogramMeasurementSnapshot extends MeasurementSnapshot {

    private final double[] upperBounds;
    private final long[] cumulativeCounts;
    private final double sum;

    /**
     * @param dynamicLabelValues the label values of the measurement
     * @param upperBounds        finite bucket upper bounds in ascending order, not copied
     * @param cumulativeCounts   cumulative counts per bucket including {@code +Inf}, not copied
     * @param sum                sum of all observed values
     */
    public HistogramMeasurementSnapshot(
            @NonNull LabelValues dynamicLabelValues,
            @NonNull double[] upperBounds,
            @NonNull long[] cumulativeCounts,
            double sum) {
        super(dynamicLabelValues);
        this.upperBounds = Objects.requireNonNull(upperBounds, "upper bounds must not be null");
        this.cumulativeCounts = Objects.requireNonNull(cumulativeCounts, "cumulative counts must not be null");
        if (cumulativeCounts.length != upperBounds.length + 1) {
            throw new IllegalArgumentException("Expected " + (upperBounds.length + 1) + " cumulative counts, got "
                    + cumulativeCounts.length);
        }
        this.sum = sum;
    }

    /**
     * @return number of buckets including the {@code +Inf} bucket
     */
    public int bucketCount() {
        return cumulativeCounts.length;
    }

    /**
     * @param index bucket index
     * @return upper bound of the bucket, {@link Double#POSITIVE_INFINITY} for the last one
     */
    public double upperBound(int index) {
        return index == upperBounds.length ? Double.POSITIVE_INFINITY : upperBounds[index];
    }

    /**
     * @param index bucket index
     * @return number of observations less than or equal to the upper bound of the bucket
     */
    public long cumulativeCount(int index) {
        return cumulativeCounts[index];
    }

    public double sum() {
        return sum;
    }

    public long count() {
        return cumulativeCounts[cumulativeCounts.length - 1];
    }

    @Override
    public String toString() {
        return "{" + super.toString() + ", buckets=" + Arrays.toString(cumulativeCounts) + ", sum=" + sum + "}";
    }
}
