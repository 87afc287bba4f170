// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.concurrent.atomic.AtomicLong;
import org.hiero.prometric.core.DoubleMeasurementSnapshot;
import org.hiero.prometric.core.LabelValues;
import org.hiero.prometric.core.MeasurementSnapshot;
import org.hiero.prometric.core.MetricKey;
import org.hiero.prometric.core.MetricType;
import org.hiero.prometric.core.MetricUtils;
import org.hiero.prometric.core.SettableMetric;

/**
 * A metric of type {@link MetricType#GAUGE} that holds {@link Measurement} per label set, containing a {@code double}
 * value that can go up and down.
 */
public final class DoubleGauge extends SettableMetric<DoubleGauge.Measurement> {

    private final double initValue;

    private DoubleGauge(Builder builder) {
        super(builder);
        initValue = builder.initValue;
    }

    /**
     * Create a metric key for a {@link DoubleGauge} with the given name. <br>
     * Name must match {@value MetricUtils#METRIC_NAME_REGEX}.
     *
     * @param name the name of the metric
     * @return the metric key
     */
    @NonNull
    public static MetricKey<DoubleGauge> key(@NonNull String name) {
        return MetricKey.of(name, DoubleGauge.class);
    }

    /**
     * Create a builder for a {@link DoubleGauge} with the given metric key.
     *
     * @param key the metric key
     * @return the builder
     */
    @NonNull
    public static Builder builder(@NonNull MetricKey<DoubleGauge> key) {
        return new Builder(key);
    }

    /**
     * Create a builder for a {@link DoubleGauge} with the given metric name.<br>
     * Name must match {@value MetricUtils#METRIC_NAME_REGEX}.
     *
     * @param name the metric name
     * @return the builder
     */
    @NonNull
    public static Builder builder(@NonNull String name) {
        return builder(key(name));
    }

    @NonNull
    @Override
    protected Measurement createMeasurement() {
        return new Measurement(initValue);
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
     * Builder for {@link DoubleGauge}.
     * <p>
     * Default initial value is {@code 0.0}, that can be changed via {@link #setDefaultInitValue(double)}.
     */
    public static final class Builder extends SettableMetric.Builder<Builder, DoubleGauge> {

        private double initValue = 0.0;

        private Builder(@NonNull MetricKey<DoubleGauge> key) {
            super(MetricType.GAUGE, key);
        }

        /**
         * Set the initial value for the gauge and any measurement within this metric.
         *
         * @param defaultInitValue the initial value for any measurement within this metric
         * @return this builder
         */
        @NonNull
        public Builder setDefaultInitValue(double defaultInitValue) {
            initValue = defaultInitValue;
            return this;
        }

        @NonNull
        @Override
        protected DoubleGauge buildMetric() {
            return new DoubleGauge(this);
        }
    }

    /**
     * The measurement data holding a {@code double} value, stored as raw long bits.
     * Operations are thread-safe and atomic.
     */
    public static final class Measurement {

        private final double initValue;
        private final AtomicLong container;

        private Measurement(double initValue) {
            this.initValue = initValue;
            container = new AtomicLong(Double.doubleToRawLongBits(initValue));
        }

        /**
         * Set the value of this measurement.
         *
         * @param value the value to set
         */
        public void set(double value) {
            container.set(Double.doubleToRawLongBits(value));
        }

        /**
         * Adds the given signed amount.
         *
         * @param value the amount to add
         */
        public void add(double value) {
            container.accumulateAndGet(
                    Double.doubleToRawLongBits(value),
                    (current, delta) ->
                            Double.doubleToRawLongBits(Double.longBitsToDouble(current) + Double.longBitsToDouble(delta)));
        }

        /**
         * Subtracts the given signed amount.
         *
         * @param value the amount to subtract
         */
        public void subtract(double value) {
            add(-value);
        }

        public void increment() {
            add(1.0);
        }

        public void decrement() {
            add(-1.0);
        }

        double get() {
            return Double.longBitsToDouble(container.get());
        }

        void reset() {
            set(initValue);
        }
    }
}
