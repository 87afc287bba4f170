// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.concurrent.atomic.AtomicLong;
import org.hiero.prometric.core.LabelValues;
import org.hiero.prometric.core.LongMeasurementSnapshot;
import org.hiero.prometric.core.MeasurementSnapshot;
import org.hiero.prometric.core.MetricKey;
import org.hiero.prometric.core.MetricType;
import org.hiero.prometric.core.MetricUtils;
import org.hiero.prometric.core.SettableMetric;

/**
 * A metric of type {@link MetricType#GAUGE} that holds {@link Measurement} per label set, containing a {@code long}
 * value that can go up and down.
 */
public final class LongGauge extends SettableMetric<LongGauge.Measurement> {

    private final long initValue;

    private LongGauge(Builder builder) {
        super(builder);
        initValue = builder.initValue;
    }

    /**
     * Create a metric key for a {@link LongGauge} with the given name. <br>
     * Name must match {@value MetricUtils#METRIC_NAME_REGEX}.
     *
     * @param name the name of the metric
     * @return the metric key
     */
    @NonNull
    public static MetricKey<LongGauge> key(@NonNull String name) {
        return MetricKey.of(name, LongGauge.class);
    }

    /**
     * Create a builder for a {@link LongGauge} with the given metric key.
     *
     * @param key the metric key
     * @return the builder
     */
    @NonNull
    public static Builder builder(@NonNull MetricKey<LongGauge> key) {
        return new Builder(key);
    }

    /**
     * Create a builder for a {@link LongGauge} with the given metric name. <br>
     * Name must match {@value MetricUtils#METRIC_NAME_REGEX}.
     *
     * @param name the name of the metric
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
        return new LongMeasurementSnapshot(labelValues, measurement.get());
    }

    @Override
    protected void reset(Measurement measurement) {
        measurement.reset();
    }

    /**
     * Builder for {@link LongGauge}.
     * <p>
     * Default initial value is {@code 0L}, that can be changed via {@link #setDefaultInitValue(long)}.
     */
    public static final class Builder extends SettableMetric.Builder<Builder, LongGauge> {

        private long initValue = 0L;

        private Builder(@NonNull MetricKey<LongGauge> key) {
            super(MetricType.GAUGE, key);
        }

        /**
         * Set the initial value for the gauge and any measurement within this metric.
         *
         * @param defaultInitValue the initial value for any measurement within this metric
         * @return this builder
         */
        @NonNull
        public Builder setDefaultInitValue(long defaultInitValue) {
            initValue = defaultInitValue;
            return this;
        }

        @NonNull
        @Override
        protected LongGauge buildMetric() {
            return new LongGauge(this);
        }
    }

    /**
     * A measurement holding a {@code long} value.
     * Operations are thread-safe and atomic.
     */
    public static final class Measurement {

        private final long initValue;
        private final AtomicLong container;

        private Measurement(long initValue) {
            this.initValue = initValue;
            container = new AtomicLong(initValue);
        }

        /**
         * Set the value of this measurement.
         *
         * @param value the value to set
         */
        public void set(long value) {
            container.set(value);
        }

        /**
         * Adds the given signed amount.
         *
         * @param value the amount to add
         */
        public void add(long value) {
            container.addAndGet(value);
        }

        /**
         * Subtracts the given signed amount.
         *
         * @param value the amount to subtract
         */
        public void subtract(long value) {
            container.addAndGet(-value);
        }

        public void increment() {
            container.incrementAndGet();
        }

        public void decrement() {
            container.decrementAndGet();
        }

        long get() {
            return container.get();
        }

        void reset() {
            container.set(initValue);
        }
    }
}
