// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Iterator;
import java.util.List;

/**
 * An immutable snapshot of a single {@link Metric} with all its measurements at specific point in time,
 * allowing iteration over {@link MeasurementSnapshot}s.
 */
public final class MetricSnapshot implements MetricInfo, Iterable<MeasurementSnapshot> {

    private final MetricInfo metricInfo;
    private final String name;
    private final List<MeasurementSnapshot> measurementSnapshots;

    MetricSnapshot(
            @NonNull MetricInfo metricInfo,
            @NonNull String name,
            @NonNull List<MeasurementSnapshot> measurementSnapshots) {
        this.metricInfo = metricInfo;
        this.name = name;
        this.measurementSnapshots = List.copyOf(measurementSnapshots);
    }

    @NonNull
    @Override
    public MetricType type() {
        return metricInfo.type();
    }

    /**
     * @return the exposed name of the metric, which may differ from the registered one, see {@link #withName(String)}
     */
    @NonNull
    @Override
    public String name() {
        return name;
    }

    @NonNull
    @Override
    public String description() {
        return metricInfo.description();
    }

    @NonNull
    @Override
    public List<Label> staticLabels() {
        return metricInfo.staticLabels();
    }

    @NonNull
    @Override
    public List<String> dynamicLabelNames() {
        return metricInfo.dynamicLabelNames();
    }

    /**
     * @return number of measurements in this snapshot
     */
    public int size() {
        return measurementSnapshots.size();
    }

    @NonNull
    @Override
    public Iterator<MeasurementSnapshot> iterator() {
        return measurementSnapshots.iterator();
    }

    /**
     * Copy of this snapshot exposed under a different name. The metric this snapshot was taken from is unaffected.
     *
     * @param newName the name to expose, must be a valid metric name
     * @return the renamed snapshot
     */
    @NonNull
    public MetricSnapshot withName(@NonNull String newName) {
        MetricUtils.validateMetricNameCharacters(newName);
        return new MetricSnapshot(metricInfo, newName, measurementSnapshots);
    }

    @Override
    public String toString() {
        return "MetricSnapshot{name=" + name + ", type=" + type() + ", measurements=" + measurementSnapshots + "}";
    }
}
