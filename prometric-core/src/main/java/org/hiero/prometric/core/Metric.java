// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Base class for all metric implementations.
 * <p>
 * It contains common to all metrics immutable metadata like name, type, description, static and dynamic labels.
 * Static labels are alphabetically sorted, while dynamic label names keep their declaration order,
 * because label values of measurements are bound positionally to them.
 * <p>
 * Constructor of this class requires a {@link Builder} instance to initialize common metric metadata.
 * Subclasses extending this class must provide their own builder extending {@link Builder}.
 * <p>
 * Measurements are not part of this abstract class, but subclasses, knowing their measurement and snapshot type,
 * must provide measurement snapshots in {@link #collectMeasurementSnapshots(Consumer)} whenever metric is gathered.
 */
public abstract class Metric implements MetricInfo {

    @NonNull
    private final MetricType type;

    @NonNull
    private final String name;

    @NonNull
    private final String description;

    private final List<Label> staticLabels;
    private final List<String> dynamicLabelNames;

    protected Metric(Builder<?, ?> builder) {
        type = builder.type;
        name = builder.key.name();
        description = builder.description;

        staticLabels = builder.staticLabels.values().stream().sorted().toList();
        dynamicLabelNames = List.copyOf(builder.dynamicLabelNames);
    }

    @NonNull
    @Override
    public final MetricType type() {
        return type;
    }

    @NonNull
    @Override
    public final String name() {
        return name;
    }

    @NonNull
    @Override
    public final String description() {
        return description;
    }

    @NonNull
    @Override
    public final List<Label> staticLabels() {
        return staticLabels;
    }

    @NonNull
    @Override
    public final List<String> dynamicLabelNames() {
        return dynamicLabelNames;
    }

    @Override
    public final String toString() {
        StringBuilder sb = new StringBuilder();

        sb.append("type=").append(type);
        sb.append(", name='").append(name).append('\'');
        if (!description.isEmpty()) {
            sb.append(", description='").append(description).append('\'');
        }
        sb.append(", staticLabels=").append(staticLabels);
        sb.append(", dynamicLabelNames=").append(dynamicLabelNames);

        return sb.toString();
    }

    /**
     * Takes an immutable snapshot of this metric and all its current measurements.
     * Measurement snapshots are ordered by their label values.
     * <p>
     * This method is package private to avoid exposing it in the public API and only called from metric registry
     * when gathering a {@link MetricRegistrySnapshot}.
     */
    @NonNull
    final MetricSnapshot snapshot() {
        final List<MeasurementSnapshot> measurementSnapshots = new ArrayList<>();
        collectMeasurementSnapshots(measurementSnapshots::add);
        measurementSnapshots.sort((a, b) -> a.getDynamicLabelValues().compareTo(b.getDynamicLabelValues()));
        return new MetricSnapshot(this, name, measurementSnapshots);
    }

    /**
     * Resets all measurements associated with this metric to their initial state.
     * Subclasses must implement this method to reset their specific measurements.
     * <p>
     * This method is protected to avoid exposing it in the public API and only called when whole metric registry
     * is reset by calling {@link MetricRegistry#reset()}.
     */
    protected abstract void reset();

    /**
     * Provides a snapshot of every existing measurement to the given consumer.
     *
     * @param consumer receiver of measurement snapshots, must not be {@code null}
     */
    protected abstract void collectMeasurementSnapshots(@NonNull Consumer<MeasurementSnapshot> consumer);

    /**
     * Creates {@link LabelValues} from the provided positional label values.
     * <p>
     * Values must be provided in the order of {@link #dynamicLabelNames()}.
     *
     * @param values the label values, one per dynamic label name
     * @return the created {@link LabelValues} instance
     * @throws NullPointerException     if {@code values} is {@code null} or any label value is {@code null}
     * @throws IllegalArgumentException if the number of values does not match the dynamic label names
     */
    protected final LabelValues createLabelValues(@NonNull String... values) {
        Objects.requireNonNull(values, "Label values must not be null");

        final List<String> labelNames = dynamicLabelNames();
        if (values.length != labelNames.size()) {
            throw new IllegalArgumentException("Expected " + labelNames.size() + " label values " + labelNames
                    + ", got " + values.length);
        }

        if (values.length == 0) {
            return LabelValues.EMPTY;
        }

        final String[] copy = values.clone();
        for (int i = 0; i < copy.length; i++) {
            if (copy[i] == null) {
                throw new NullPointerException("Label value must not be null for label: " + labelNames.get(i));
            }
        }

        return new LabelValues(copy);
    }

    /**
     * Base builder class for constructing {@link Metric} instances.
     *
     * @param <B> the concrete builder type to return for method chaining
     * @param <M> the concrete metric type to build
     */
    public abstract static class Builder<B extends Metric.Builder<B, M>, M extends Metric> {

        private final MetricType type;
        private final MetricKey<M> key;
        private String description = "";

        private final Map<String, Label> staticLabels = new HashMap<>();
        private final Set<String> dynamicLabelNames = new LinkedHashSet<>();

        /**
         * Constructor for a metric builder.
         *
         * @param type the metric type, must not be {@code null}
         * @param key  the metric key, must not be {@code null}
         * @throws NullPointerException if any of the parameters is {@code null}
         */
        protected Builder(@NonNull MetricType type, @NonNull MetricKey<M> key) {
            this.type = Objects.requireNonNull(type, "type must not be null");
            this.key = Objects.requireNonNull(key, "key must not be null");
        }

        /**
         * @return the metric key, never {@code null}
         */
        @NonNull
        public MetricKey<M> key() {
            return key;
        }

        /**
         * Sets the metric description, exposed as help text. {@code null} is treated as empty description.
         *
         * @param description the metric description, may be {@code null}
         * @return the builder instance
         */
        @NonNull
        public final B setDescription(@Nullable String description) {
            this.description = description == null ? "" : description;
            return self();
        }

        /**
         * Adds dynamic label names to the metric, keeping their order. <br>
         * Dynamic label names must be unique and must not conflict with static label names or metric name.
         * Exception will be thrown at metric build time, if there is static and dynamic labels with the same name.
         *
         * @param labelNames the dynamic label names to add, must not be {@code null}
         * @return the builder instance
         * @throws NullPointerException if any label name is {@code null}
         * @throws IllegalArgumentException if any label name doesn't match regex {@value MetricUtils#LABEL_NAME_REGEX}
         *                                  or was already added
         */
        @NonNull
        public final B addDynamicLabelNames(@NonNull String... labelNames) {
            Objects.requireNonNull(labelNames, "label names must not be null");
            for (String labelName : labelNames) {
                MetricUtils.validateLabelNameCharacters(labelName);
                validateLabelNameNoEqualMetricName(labelName);
                if (!dynamicLabelNames.add(labelName)) {
                    throw new IllegalArgumentException("Duplicate dynamic label name: " + labelName);
                }
            }
            return self();
        }

        /**
         * Adds a static label to the metric. Static label names must be unique and must not conflict with
         * dynamic label names or metric name.
         * Exception will be thrown at metric build time, if there is static and dynamic labels with the same name.
         *
         * @param labels the static labels to add, must not be {@code null}
         * @return the builder instance
         * @throws NullPointerException if label is {@code null}
         * @throws IllegalArgumentException if label name is same as metric name or conflicts with other static label
         */
        @NonNull
        public final B addStaticLabels(@NonNull Label... labels) {
            Objects.requireNonNull(labels, "labels must not be null");

            for (Label label : labels) {
                validateLabelNameNoEqualMetricName(label.name());

                Label existingLabel = staticLabels.put(label.name(), label);
                if (existingLabel != null && !existingLabel.equals(label)) {
                    throw new IllegalArgumentException(label + " conflicts with existing: " + existingLabel);
                }
            }

            return self();
        }

        /**
         * Builds the metric instance. Validates that dynamic label names do not conflict with static label names.
         *
         * @return the built metric instance, never {@code null}
         * @throws IllegalStateException if there are conflicts between dynamic and static label names
         */
        @NonNull
        public final M build() {
            for (String dynamicLabelName : dynamicLabelNames) {
                Label constLabel = staticLabels.get(dynamicLabelName);
                if (constLabel != null) {
                    throw new IllegalStateException("Dynamic label name '" + dynamicLabelName
                            + "' conflicts with a static label: " + constLabel);
                }
            }
            return buildMetric();
        }

        /**
         * Registers the built metric instance with the provided metric registry.
         *
         * @param registry the metric registry to register with, must not be {@code null}
         * @return the registered metric instance, never {@code null}
         * @throws MetricAlreadyRegisteredException if a metric with the same name is already registered
         */
        @NonNull
        public final M register(@NonNull MetricRegistry registry) {
            Objects.requireNonNull(registry, "registry must not be null");
            return registry.register(this);
        }

        /**
         * Builds the metric instance. Subclasses must implement this method to create the specific metric type.
         *
         * @return the built metric instance, never {@code null}
         */
        @NonNull
        protected abstract M buildMetric();

        /**
         * @return the builder instance concrete type to support fluent API
         */
        @NonNull
        @SuppressWarnings("unchecked")
        protected final B self() {
            return (B) this;
        }

        private void validateLabelNameNoEqualMetricName(String labelName) {
            if (labelName.equals(key.name())) {
                throw new IllegalArgumentException("Label name must not be the same as metric name: " + labelName);
            }
        }
    }
}
