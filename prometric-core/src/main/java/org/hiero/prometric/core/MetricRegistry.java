// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A thread-safe registry for {@link Metric} instances, that allows registering new metrics by their builders
 * and retrieving existing metrics by their {@link MetricKey}.
 * <p>
 * The identity of a registered metric is its name together with its static labels. Metrics sharing a name form a
 * family: they must agree on type, description, dynamic label names and static label names, and are exposed as one
 * metric with a series per static label set. A metric with the name of a family but another definition is rejected.
 * <p>
 * The process-wide default registry is available via {@link #defaultRegistry()}. It is created once at first use
 * and lives as long as the process, there is nothing to tear down.
 * Other registries can be created with the public constructor, e.g. to isolate tests.
 * <p>
 * Registered metrics can be gathered at any time with {@link #snapshot()}, which is safe to call concurrently with
 * metric updates and registrations.
 */
public final class MetricRegistry {

    private static final Logger logger = LogManager.getLogger(MetricRegistry.class);

    /** Family members by name, in registration order. Lists are immutable and replaced on change. */
    private final Map<String, List<Metric>> families = new ConcurrentHashMap<>();

    /**
     * Creates an empty registry.
     */
    public MetricRegistry() {}

    /**
     * @return the process-wide default registry, never {@code null}
     */
    @NonNull
    public static MetricRegistry defaultRegistry() {
        return DefaultRegistryHolder.INSTANCE;
    }

    /**
     * @return unmodifiable copy of all registered metrics in this registry, may be empty but never {@code null}
     */
    @NonNull
    public Collection<Metric> metrics() {
        return families.values().stream().flatMap(List::stream).toList();
    }

    /**
     * Creates and registers a metric using the given metric builder.
     * <p>
     * This method is <b>not idempotent</b> and throws an exception, if a metric with the same name and static labels
     * is already registered.
     *
     * @param builder the metric builder, must not be {@code null}
     * @param <M>     the type of the metric to be created and registered
     * @param <B>     the type of the metric builder that creates the metric
     * @return the created and registered metric, never {@code null}
     * @throws NullPointerException             if the builder is {@code null}
     * @throws MetricAlreadyRegisteredException if a metric with the same name and static labels already exists
     * @throws IllegalArgumentException         if metrics with the same name but another definition are registered
     */
    @NonNull
    public <M extends Metric, B extends Metric.Builder<?, M>> M register(final @NonNull B builder) {
        Objects.requireNonNull(builder, "metric builder must not be null");

        final MetricKey<M> metricKey = builder.key();
        final M metric = builder.build();

        families.compute(metricKey.name(), (name, family) -> {
            if (family == null) {
                logger.debug("Registered metric. name={}", name);
                return List.of(metric);
            }
            for (Metric member : family) {
                if (member.staticLabels().equals(metric.staticLabels())) {
                    throw new MetricAlreadyRegisteredException(metricKey, member);
                }
            }
            checkSameFamily(family.get(0), metric);
            logger.debug("Registered metric. name={}, staticLabels={}", name, metric.staticLabels());
            return append(family, metric);
        });
        return metric;
    }

    /**
     * Creates and registers a metric using the given metric builder, atomically replacing the metric
     * registered with the same name and static labels, if any. Measurements of the replaced metric are lost for
     * this registry.
     *
     * @param builder the metric builder, must not be {@code null}
     * @param <M>     the type of the metric to be created and registered
     * @param <B>     the type of the metric builder that creates the metric
     * @return the created and registered metric, never {@code null}
     * @throws NullPointerException     if the builder is {@code null}
     * @throws IllegalArgumentException if other metrics of the name remain registered with another definition
     */
    @NonNull
    public <M extends Metric, B extends Metric.Builder<?, M>> M registerOrReplace(final @NonNull B builder) {
        Objects.requireNonNull(builder, "metric builder must not be null");

        final MetricKey<M> metricKey = builder.key();
        final M metric = builder.build();

        families.compute(metricKey.name(), (name, family) -> {
            if (family == null) {
                logger.debug("Registered metric. name={}", name);
                return List.of(metric);
            }
            final List<Metric> kept = family.stream()
                    .filter(member -> !member.staticLabels().equals(metric.staticLabels()))
                    .toList();
            if (!kept.isEmpty()) {
                checkSameFamily(kept.get(0), metric);
            }
            if (kept.size() < family.size()) {
                logger.info("Replaced registered metric. name={}, staticLabels={}", name, metric.staticLabels());
            } else {
                logger.debug("Registered metric. name={}, staticLabels={}", name, metric.staticLabels());
            }
            return append(kept, metric);
        });
        return metric;
    }

    /**
     * Removes all metrics registered with the name of the given key, if they are of compatible type.
     *
     * @param key the metric key, must not be {@code null}
     * @return {@code true} if metrics were removed, {@code false} otherwise
     * @throws NullPointerException if the key is {@code null}
     */
    public boolean unregister(@NonNull MetricKey<?> key) {
        Objects.requireNonNull(key, "metric key must not be null");
        final List<Metric> family = families.get(key.name());
        if (family != null && key.type().isInstance(family.get(0)) && families.remove(key.name(), family)) {
            logger.debug("Unregistered metric. name={}, count={}", key.name(), family.size());
            return true;
        }
        return false;
    }

    /**
     * Resets all registered metrics and their measurements in this registry to their initial state.
     */
    public void reset() {
        metrics().forEach(Metric::reset);
    }

    /**
     * Checks if a metric with the given key is registered in the registry.
     * Metric to be found has to have the same name as the provided key and be of compatible type.
     *
     * @param key the metric key, must not be {@code null}
     * @return {@code true} if a metric with the given key is registered, {@code false} otherwise
     * @throws NullPointerException if the key is {@code null}
     */
    public boolean containsMetric(@NonNull MetricKey<?> key) {
        Objects.requireNonNull(key, "metric key must not be null");
        final List<Metric> family = families.get(key.name());
        return family != null && key.type().isInstance(family.get(0));
    }

    /**
     * Gets the first registered metric with the name of the key.
     * Metric to be found has to be of compatible type.
     *
     * @param key the metric key, must not be {@code null}
     * @param <M> the type of the metric
     * @return the found metric, never {@code null}
     * @throws NullPointerException if the key is {@code null}
     * @throws NoSuchElementException if no metric is found for the given key name
     * @throws ClassCastException if metric found with the given key name is not of the expected key type
     */
    @NonNull
    public <M extends Metric> M getMetric(@NonNull MetricKey<M> key) {
        return key.type().cast(family(key).get(0));
    }

    /**
     * Gets all metrics registered with the name of the key, one per static label set, in registration order.
     *
     * @param key the metric key, must not be {@code null}
     * @param <M> the type of the metrics
     * @return the found metrics, never empty
     * @throws NullPointerException if the key is {@code null}
     * @throws NoSuchElementException if no metric is found for the given key name
     * @throws ClassCastException if metrics found with the given key name are not of the expected key type
     */
    @NonNull
    public <M extends Metric> List<M> getMetrics(@NonNull MetricKey<M> key) {
        final List<Metric> family = family(key);
        final List<M> result = new ArrayList<>(family.size());
        for (Metric metric : family) {
            result.add(key.type().cast(metric));
        }
        return List.copyOf(result);
    }

    /**
     * Gathers all registered metrics with their current measurements.
     * Each measurement value is read atomically, while the snapshot as a whole is not a point-in-time view
     * if metrics are updated concurrently.
     *
     * @return immutable snapshot of the registry, never {@code null}
     */
    @NonNull
    public MetricRegistrySnapshot snapshot() {
        final List<MetricSnapshot> snapshots = new ArrayList<>();
        for (List<Metric> family : families.values()) {
            for (Metric metric : family) {
                snapshots.add(metric.snapshot());
            }
        }
        return new MetricRegistrySnapshot(snapshots);
    }

    @NonNull
    private List<Metric> family(@NonNull MetricKey<?> key) {
        Objects.requireNonNull(key, "metric key must not be null");
        final List<Metric> family = families.get(key.name());
        if (family == null) {
            throw new NoSuchElementException("Metric not found: " + key);
        }
        return family;
    }

    private static void checkSameFamily(@NonNull Metric registered, @NonNull Metric candidate) {
        if (registered.getClass() != candidate.getClass()
                || !registered.description().equals(candidate.description())
                || !registered.dynamicLabelNames().equals(candidate.dynamicLabelNames())
                || !staticLabelNames(registered).equals(staticLabelNames(candidate))) {
            throw new IllegalArgumentException("Metric " + candidate.name()
                    + " is already registered with another definition. registered=" + registered + ", requested="
                    + candidate);
        }
    }

    private static List<String> staticLabelNames(@NonNull Metric metric) {
        return metric.staticLabels().stream().map(Label::name).toList();
    }

    private static List<Metric> append(@NonNull List<Metric> family, @NonNull Metric metric) {
        final List<Metric> extended = new ArrayList<>(family.size() + 1);
        extended.addAll(family);
        extended.add(metric);
        return List.copyOf(extended);
    }

    private static final class DefaultRegistryHolder {
        private static final MetricRegistry INSTANCE = new MetricRegistry();
    }
}
