// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Abstract extension of {@link Metric}, that holds a set of measurements for each combination of dynamic label values
 * or a single measurement if no dynamic labels are defined.
 * <p>
 * Subclasses create measurements in their initial state and snapshots of a measurement
 * with its associated label values.
 * All measurements are created lazily, whenever new combination of dynamic label values are requested.
 * <p>
 * Clients should pay attention the dynamic label values cardinality, as high cardinality can lead to
 * higher costs for metrics backends. <b>Do not use</b> labels with values having unbounded cardinality,
 * such as IDs or timestamps.
 *
 * @param <M> The type of the measurement associated with this metric.
 */
public abstract class SettableMetric<M> extends Metric {

    private volatile M noLabelsMeasurement;
    private final Map<LabelValues, M> measurements;

    protected SettableMetric(SettableMetric.Builder<?, ?> builder) {
        super(builder);

        if (dynamicLabelNames().isEmpty()) {
            measurements = null;
        } else {
            measurements = new ConcurrentHashMap<>();
        }
    }

    /**
     * Get or create the measurement with no labels.
     *
     * @return the measurement with no labels
     * @throws IllegalStateException if metric has dynamic labels specified during creation
     */
    @NonNull
    public final M getOrCreateNotLabeled() {
        if (measurements != null) {
            throw new IllegalStateException("This metric has dynamic labels, so you must call getOrCreateLabeled()");
        }
        // lazy init of no labels measurement
        M localRef = noLabelsMeasurement;
        if (localRef == null) {
            synchronized (this) {
                localRef = noLabelsMeasurement;
                if (localRef == null) {
                    noLabelsMeasurement = localRef = createMeasurement();
                }
            }
        }
        return localRef;
    }

    /**
     * Get or create the measurement with the specified label values.
     * <p>
     * Values are positional and must be provided in the order of {@link #dynamicLabelNames()}.
     * Static labels should not be provided here, as they are already associated with the metric.
     *
     * @param labelValues one value per dynamic label name, e.g. {@code "GET", "/api"} for labels {@code method, path}
     * @return the measurement with the specified labels
     * @throws NullPointerException if any label value is {@code null}
     * @throws IllegalArgumentException if number of values doesn't match {@link #dynamicLabelNames()}
     */
    @NonNull
    public final M getOrCreateLabeled(@NonNull String... labelValues) {
        final LabelValues values = createLabelValues(labelValues);
        if (values.size() == 0) {
            return getOrCreateNotLabeled();
        } else {
            return measurements.computeIfAbsent(values, ignored -> createMeasurement());
        }
    }

    /**
     * Create a new measurement in its initial state.
     *
     * @return the created measurement
     */
    @NonNull
    protected abstract M createMeasurement();

    /**
     * Create a measurement snapshot for the given measurement and label values.
     *
     * @param measurement the measurement to create snapshot for
     * @param labelValues the label values associated with the measurement
     * @return the created measurement snapshot
     */
    protected abstract MeasurementSnapshot createMeasurementSnapshot(
            @NonNull M measurement, @NonNull LabelValues labelValues);

    /**
     * Reset the given measurement to its initial state.
     *
     * @param measurement the measurement to reset
     */
    protected abstract void reset(M measurement);

    @Override
    protected final void reset() {
        if (measurements == null) {
            if (noLabelsMeasurement != null) {
                reset(noLabelsMeasurement);
            }
        } else {
            measurements.values().forEach(this::reset);
        }
    }

    @Override
    protected final void collectMeasurementSnapshots(@NonNull Consumer<MeasurementSnapshot> consumer) {
        if (measurements == null) {
            final M localRef = noLabelsMeasurement;
            if (localRef != null) {
                consumer.accept(createMeasurementSnapshot(localRef, LabelValues.EMPTY));
            }
        } else {
            measurements.forEach(
                    (labelValues, measurement) -> consumer.accept(createMeasurementSnapshot(measurement, labelValues)));
        }
    }

    /**
     * Base abstract builder for {@link SettableMetric}.
     *
     * @param <B> the type of the builder to return for method chaining
     * @param <M> the type of the metric to build
     */
    public abstract static class Builder<B extends SettableMetric.Builder<B, M>, M extends SettableMetric<?>>
            extends Metric.Builder<B, M> {

        /**
         * Constructor for a settable metric builder.
         *
         * @param type the metric type, must not be {@code null}
         * @param key  the metric key, must not be {@code null}
         */
        protected Builder(@NonNull MetricType type, @NonNull MetricKey<M> key) {
            super(type, key);
        }
    }
}
