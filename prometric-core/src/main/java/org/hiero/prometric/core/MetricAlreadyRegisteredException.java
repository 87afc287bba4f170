// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * Thrown by {@link MetricRegistry#register(Metric.Builder)} when a metric with the same name is already registered.
 * Carries the registered metric, so callers may decide to reuse it.
 */
public final class MetricAlreadyRegisteredException extends IllegalArgumentException {

    private final transient Metric registeredMetric;

    /**
     * @param metricKey        key of the metric that failed to register
     * @param registeredMetric the metric already registered under the same name
     */
    public MetricAlreadyRegisteredException(@NonNull MetricKey<?> metricKey, @NonNull Metric registeredMetric) {
        super("Duplicate metric name: " + metricKey + ". Existing metric: " + registeredMetric.name());
        this.registeredMetric = Objects.requireNonNull(registeredMetric, "registered metric must not be null");
    }

    /**
     * @return the metric already registered under the same name, never {@code null}
     */
    @NonNull
    public Metric getRegisteredMetric() {
        return registeredMetric;
    }
}
