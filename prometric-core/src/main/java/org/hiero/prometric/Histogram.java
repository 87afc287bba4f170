// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;
import org.hiero.prometric.core.HistogramMeasurementSnapshot;
import org.hiero.prometric.core.LabelValues;
import org.hiero.prometric.core.MeasurementSnapshot;
import org.hiero.prometric.core.MetricKey;
import org.hiero.prometric.core.MetricType;
import org.hiero.prometric.core.MetricUtils;
import org.hiero.prometric.core.SettableMetric;

/**
 * A metric of type {@link MetricType#HISTOGRAM} that holds {@link Measurement} per label set,
 * counting observations into buckets with fixed upper bounds and keeping the sum of all observed values.
 * <p>
 * Bucket bounds are shared by all measurements of the metric and default to {@link HistogramBuckets#DEFAULT}.
 */
public final class Histogram extends SettableMetric<Histogram.Measurement> {

    private final HistogramBuckets buckets;

    private Histogram(Builder builder) {
        super(builder);
        buckets = builder.buckets;
    }

    /**
     * Create a metric key for a {@link Histogram} with the given name. <br>
     * Name must match {@value MetricUtils#METRIC_NAME_REGEX}.
     *
     * @param name the name of the metric
     * @return the metric key
     */
    @NonNull
    public static MetricKey<Histogram> key(@NonNull String name) {
        return MetricKey.of(name, Histogram.class);
    }

    /**
     * Create a builder for a {@link Histogram} with the given metric key.
     *
     * @param key the metric key
     * @return the builder
     */
    @NonNull
    public static Builder builder(@NonNull MetricKey<Histogram> key) {
        return new Builder(key);
    }

    /**
     * Create a builder for a {@link Histogram} with the given metric name. <br>
     * Name must match {@value MetricUtils#METRIC_NAME_REGEX}.
     *
     * @param name the name of the metric
     * @return the builder
     */
    @NonNull
    public static Builder builder(@NonNull String name) {
        return builder(key(name));
    }

    /**
     * @return the bucket bounds of this histogram, never {@code null}
     */
    @NonNull
    public HistogramBuckets buckets() {
        return buckets;
    }

    @NonNull
    @Override
    protected Measurement createMeasurement() {
        return new Measurement(buckets);
    }

    @Override
    protected MeasurementSnapshot createMeasurementSnapshot(
            @NonNull Measurement measurement, @NonNull LabelValues labelValues) {
        return measurement.snapshot(labelValues);
    }

    @Override
    protected void reset(Measurement measurement) {
        measurement.reset();
    }

    /**
     * Builder for {@link Histogram}.
     * <p>
     * Default bucket bounds are {@link HistogramBuckets#DEFAULT}, that can be changed via {@link #setBuckets(double...)}.
     */
    public static final class Builder extends SettableMetric.Builder<Builder, Histogram> {

        private HistogramBuckets buckets = HistogramBuckets.DEFAULT;

        private Builder(@NonNull MetricKey<Histogram> key) {
            super(MetricType.HISTOGRAM, key);
        }

        /**
         * Sets the bucket upper bounds. A trailing {@code +Inf} bound is accepted and dropped.
         *
         * @param upperBounds strictly ascending finite bounds
         * @return this builder
         * @throws IllegalArgumentException if bounds are empty, not finite or not strictly ascending
         */
        @NonNull
        public Builder setBuckets(@NonNull double... upperBounds) {
            return setBuckets(HistogramBuckets.of(upperBounds));
        }

        /**
         * Sets the bucket upper bounds.
         *
         * @param buckets the buckets, must not be {@code null}
         * @return this builder
         */
        @NonNull
        public Builder setBuckets(@NonNull HistogramBuckets buckets) {
            this.buckets = Objects.requireNonNull(buckets, "buckets must not be null");
            return this;
        }

        @NonNull
        @Override
        protected Histogram buildMetric() {
            return new Histogram(this);
        }
    }

    /**
     * A measurement counting observations per bucket.
     * Each observation is recorded atomically per bucket and sum, thread-safe without locking.
     */
    public static final class Measurement {

        private final HistogramBuckets buckets;
        private final double[] upperBounds;
        private final LongAdder[] counts;
        private final DoubleAdder sum = new DoubleAdder();

        private Measurement(@NonNull HistogramBuckets buckets) {
            this.buckets = Objects.requireNonNull(buckets, "buckets must not be null");
            upperBounds = buckets.upperBounds();
            counts = new LongAdder[upperBounds.length + 1];
            for (int i = 0; i < counts.length; i++) {
                counts[i] = new LongAdder();
            }
        }

        /**
         * Records a single observed value.
         *
         * @param value the observed value
         */
        public void observe(double value) {
            counts[buckets.bucketIndex(value)].increment();
            sum.add(value);
        }

        void reset() {
            for (LongAdder count : counts) {
                count.reset();
            }
            sum.reset();
        }

        HistogramMeasurementSnapshot snapshot(LabelValues labelValues) {
            final long[] cumulative = new long[counts.length];
            long running = 0L;
            for (int i = 0; i < counts.length; i++) {
                running += counts[i].sum();
                cumulative[i] = running;
            }
            return new HistogramMeasurementSnapshot(labelValues, upperBounds, cumulative, sum.sum());
        }
    }
}
