// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.concurrent.atomic.LongAdder;
import org.hiero.prometric.core.LabelValues;
import org.hiero.prometric.core.LongMeasurementSnapshot;
import org.hiero.prometric.core.MeasurementSnapshot;
import org.hiero.prometric.core.MetricKey;
import org.hiero.prometric.core.MetricType;
import org.hiero.prometric.core.MetricUtils;
import org.hiero.prometric.core.SettableMetric;

/**
 * A {@link MetricType#COUNTER} of whole numbers. Every label combination has its own {@link Measurement}
 * that starts at zero and only goes up until the registry is reset.
 */
public final class LongCounter extends SettableMetric<LongCounter.Measurement> {

    private LongCounter(Builder builder) {
        super(builder);
    }

    /**
     * Key of a {@link LongCounter} named {@code name}, which must match {@value MetricUtils#METRIC_NAME_REGEX}.
     *
     * @param name the metric name
     * @return the metric key
     */
    @NonNull
    public static MetricKey<LongCounter> key(@NonNull String name) {
        return MetricKey.of(name, LongCounter.class);
    }

    /**
     * @param key the metric key
     * @return a new builder for the key
     */
    @NonNull
    public static Builder builder(@NonNull MetricKey<LongCounter> key) {
        return new Builder(key);
    }

    /**
     * @param name the metric name, must match {@value MetricUtils#METRIC_NAME_REGEX}
     * @return a new builder for the name
     */
    @NonNull
    public static Builder builder(@NonNull String name) {
        return builder(key(name));
    }

    @NonNull
    @Override
    protected Measurement createMeasurement() {
        return new Measurement();
    }

    @Override
    protected MeasurementSnapshot createMeasurementSnapshot(
            @NonNull Measurement measurement, @NonNull LabelValues labelValues) {
        return new LongMeasurementSnapshot(labelValues, measurement.get());
    }

    @Override
    protected void reset(Measurement measurement) {
        measurement.reset();
    }

    /**
     * Builder for {@link LongCounter}.
     */
    public static final class Builder extends SettableMetric.Builder<Builder, LongCounter> {

        private Builder(@NonNull MetricKey<LongCounter> key) {
            super(MetricType.COUNTER, key);
        }

        @NonNull
        @Override
        protected LongCounter buildMetric() {
            return new LongCounter(this);
        }
    }

    /**
     * Count of one label combination, backed by a {@link LongAdder} so concurrent increments do not contend.
     */
    public static final class Measurement {

        private final LongAdder count = new LongAdder();

        private Measurement() {}

        /**
         * @param amount non-negative amount to add
         * @throws IllegalArgumentException if the amount is negative
         */
        public void increment(long amount) {
            if (amount < 0L) {
                throw new IllegalArgumentException("Increment value must be non-negative, but was: " + amount);
            }
            count.add(amount);
        }

        public void increment() {
            count.increment();
        }

        /**
         * Sets the count back to zero.
         */
        public void reset() {
            count.reset();
        }

        long get() {
            return count.sum();
        }
    }
}
