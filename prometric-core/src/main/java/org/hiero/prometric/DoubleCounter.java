// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.concurrent.atomic.DoubleAdder;
import org.hiero.prometric.core.DoubleMeasurementSnapshot;
import org.hiero.prometric.core.LabelValues;
import org.hiero.prometric.core.MeasurementSnapshot;
import org.hiero.prometric.core.MetricKey;
import org.hiero.prometric.core.MetricType;
import org.hiero.prometric.core.MetricUtils;
import org.hiero.prometric.core.SettableMetric;

/**
 * A {@link MetricType#COUNTER} of fractional amounts, e.g. seconds or bytes per label combination.
 * Each {@link Measurement} starts at {@code 0.0} and only goes up until the registry is reset.
 */
public final class DoubleCounter extends SettableMetric<DoubleCounter.Measurement> {

    private DoubleCounter(Builder builder) {
        super(builder);
    }

    /**
     * Key of a {@link DoubleCounter} named {@code name}, which must match {@value MetricUtils#METRIC_NAME_REGEX}.
     *
     * @param name the metric name
     * @return the metric key
     */
    @NonNull
    public static MetricKey<DoubleCounter> key(@NonNull String name) {
        return MetricKey.of(name, DoubleCounter.class);
    }

    @NonNull
    public static Builder builder(@NonNull MetricKey<DoubleCounter> key) {
        return new Builder(key);
    }

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
        return new DoubleMeasurementSnapshot(labelValues, measurement.get());
    }

    @Override
    protected void reset(Measurement measurement) {
        measurement.reset();
    }

    /**
     * Builder for {@link DoubleCounter}.
     */
    public static final class Builder extends SettableMetric.Builder<Builder, DoubleCounter> {

        private Builder(@NonNull MetricKey<DoubleCounter> key) {
            super(MetricType.COUNTER, key);
        }

        @NonNull
        @Override
        protected DoubleCounter buildMetric() {
            return new DoubleCounter(this);
        }
    }

    /**
     * Running total of one label combination. Increments are lock-free.
     */
    public static final class Measurement {

        private final DoubleAdder total = new DoubleAdder();

        private Measurement() {}

        /**
         * @param amount amount to add, must be non-negative and not NaN
         * @throws IllegalArgumentException if the amount is negative or NaN
         */
        public void increment(double amount) {
            if (!(amount >= 0.0)) {
                throw new IllegalArgumentException("Increment value must be non-negative, but was: " + amount);
            }
            total.add(amount);
        }

        public void increment() {
            total.add(1.0);
        }

        /**
         * Sets the total back to {@code 0.0}.
         */
        public void reset() {
            total.reset();
        }

        double get() {
            return total.sum();
        }
    }
}
