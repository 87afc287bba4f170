// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.schema;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.prometric.Histogram;
import org.hiero.prometric.core.Label;
import org.hiero.prometric.core.Metric;
import org.hiero.prometric.core.MetricAlreadyRegisteredException;
import org.hiero.prometric.core.MetricRegistry;

/**
 * Base class of the builders generated for {@link MetricsSchema} classes.
 * <p>
 * Collects the target registry, static labels applied to every metric of the bundle and the
 * {@link ConflictPolicy}. Generated subclasses implement {@link #newBundle()} by passing a metric builder
 * for each schema field to {@link #bind(Metric.Builder)}, in declaration order.
 * <p>
 * A builder is not thread-safe, but {@link #build()} may run concurrently with other builders
 * registering into the same registry.
 *
 * @param <B> the concrete builder type
 * @param <T> the bundle type
 */
public abstract class BundleBuilder<B extends BundleBuilder<B, T>, T> {

    private static final Logger logger = LogManager.getLogger(BundleBuilder.class);

    private MetricRegistry registry = MetricRegistry.defaultRegistry();
    private final Map<String, Label> staticLabels = new TreeMap<>();
    private ConflictPolicy conflictPolicy = ConflictPolicy.KEEP_REGISTERED;

    protected BundleBuilder() {}

    /**
     * Sets the registry metrics are registered into. Replaces the previously set registry.
     *
     * @param registry the registry, must not be {@code null}
     * @return this builder
     */
    @NonNull
    public final B withRegistry(@NonNull MetricRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        return self();
    }

    /**
     * Adds a static label to every metric of the bundle. A label with the same key is overwritten.
     *
     * @param key   the label name
     * @param value the label value, any string including an empty one
     * @return this builder
     * @throws NullPointerException     if key or value is {@code null}
     * @throws IllegalArgumentException if key is not a valid label name
     */
    @NonNull
    public final B withLabel(@NonNull String key, @NonNull String value) {
        staticLabels.put(key, new Label(key, value));
        return self();
    }

    /**
     * Sets the policy applied when a metric name is already registered.
     * Default is {@link ConflictPolicy#KEEP_REGISTERED}.
     *
     * @param conflictPolicy the policy, must not be {@code null}
     * @return this builder
     */
    @NonNull
    public final B withConflictPolicy(@NonNull ConflictPolicy conflictPolicy) {
        this.conflictPolicy = Objects.requireNonNull(conflictPolicy, "conflict policy must not be null");
        return self();
    }

    /**
     * Creates and registers all metrics of the schema and returns the bundle.
     *
     * @return the bundle, never {@code null}
     * @throws IllegalArgumentException if a metric of the schema is already registered with another definition
     * @throws IllegalStateException    if a static label name equals a dynamic label name of a metric
     */
    @NonNull
    public final T build() {
        final T bundle = newBundle();
        logger.debug(
                "Built metrics bundle. type={}, staticLabels={}, conflictPolicy={}",
                bundle.getClass().getSimpleName(),
                staticLabels.values(),
                conflictPolicy);
        return bundle;
    }

    /**
     * Creates the bundle, binding every schema metric with {@link #bind(Metric.Builder)}.
     *
     * @return the bundle
     */
    @NonNull
    protected abstract T newBundle();

    /**
     * Adds the static labels to the metric builder and registers the metric according to the conflict policy.
     * With {@link ConflictPolicy#KEEP_REGISTERED} a registered metric with the same name and static labels is reused
     * when its definition matches.
     *
     * @param builder the metric builder
     * @param <M>     the metric type
     * @return the registered metric the bundle must use
     * @throws IllegalArgumentException if the name is registered with another definition
     */
    @NonNull
    protected final <M extends Metric> M bind(@NonNull Metric.Builder<?, M> builder) {
        Objects.requireNonNull(builder, "metric builder must not be null");
        if (!staticLabels.isEmpty()) {
            builder.addStaticLabels(staticLabels.values().toArray(new Label[0]));
        }

        if (conflictPolicy == ConflictPolicy.REPLACE) {
            return registry.registerOrReplace(builder);
        }

        try {
            return registry.register(builder);
        } catch (MetricAlreadyRegisteredException e) {
            final Metric registered = e.getRegisteredMetric();
            final M candidate = builder.build();
            if (!isCompatible(registered, candidate)) {
                throw new IllegalArgumentException("Metric " + candidate.name()
                        + " is already registered with another definition. registered=" + registered
                        + ", requested=" + candidate);
            }
            logger.debug(
                    "Reusing registered metric. name={}, staticLabels={}",
                    registered.name(),
                    registered.staticLabels());
            return builder.key().type().cast(registered);
        }
    }

    private static boolean isCompatible(@NonNull Metric registered, @NonNull Metric candidate) {
        if (registered.getClass() != candidate.getClass()
                || !registered.description().equals(candidate.description())
                || !registered.dynamicLabelNames().equals(candidate.dynamicLabelNames())
                || !registered.staticLabels().equals(candidate.staticLabels())) {
            return false;
        }
        if (registered instanceof Histogram histogram) {
            return histogram.buckets().equals(((Histogram) candidate).buckets());
        }
        return true;
    }

    @SuppressWarnings("unchecked")
    private B self() {
        return (B) this;
    }
}
