// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable set of finite histogram bucket upper bounds in strictly ascending order.
 * The {@code +Inf} bucket is always implied and is not part of the bounds.
 */
public final class HistogramBuckets {

    /**
     * Default bucket bounds, suited to request durations in seconds.
     */
    public static final HistogramBuckets DEFAULT =
            of(0.005, 0.01, 0.025, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0);

    private final double[] upperBounds;

    private HistogramBuckets(double[] upperBounds) {
        this.upperBounds = upperBounds;
    }

    /**
     * Creates buckets from the given upper bounds. A trailing {@code +Inf} bound is accepted and dropped.
     *
     * @param upperBounds the bucket upper bounds, must not be {@code null}
     * @return the buckets
     * @throws NullPointerException     if bounds are {@code null}
     * @throws IllegalArgumentException if there are no finite bounds, any bound is not finite
     *                                  or bounds are not strictly ascending
     */
    @NonNull
    public static HistogramBuckets of(@NonNull double... upperBounds) {
        Objects.requireNonNull(upperBounds, "upper bounds must not be null");

        int length = upperBounds.length;
        if (length > 0 && upperBounds[length - 1] == Double.POSITIVE_INFINITY) {
            length--;
        }
        if (length == 0) {
            throw new IllegalArgumentException("Histogram must have at least one finite bucket bound");
        }

        final double[] bounds = Arrays.copyOf(upperBounds, length);
        for (int i = 0; i < bounds.length; i++) {
            if (!Double.isFinite(bounds[i])) {
                throw new IllegalArgumentException("Bucket bound must be finite, but was: " + bounds[i]);
            }
            if (i > 0 && bounds[i] <= bounds[i - 1]) {
                throw new IllegalArgumentException("Bucket bounds must be strictly ascending: " + bounds[i - 1]
                        + " followed by " + bounds[i]);
            }
        }
        return new HistogramBuckets(bounds);
    }

    /**
     * @return number of finite bounds, excluding the {@code +Inf} bucket
     */
    public int size() {
        return upperBounds.length;
    }

    /**
     * @return copy of the finite upper bounds
     */
    @NonNull
    public double[] upperBounds() {
        return upperBounds.clone();
    }

    /**
     * Index of the bucket the value falls into, that is the first bound greater than or equal to the value.
     * Values above every bound, and {@code NaN}, fall into the {@code +Inf} bucket at index {@link #size()}.
     */
    int bucketIndex(double value) {
        final int index = Arrays.binarySearch(upperBounds, value);
        return index >= 0 ? index : -index - 1;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof HistogramBuckets other && Arrays.equals(upperBounds, other.upperBounds));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(upperBounds);
    }

    @Override
    public String toString() {
        return Arrays.toString(upperBounds);
    }
}
