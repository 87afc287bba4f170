// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * An immutable snapshot of all metrics in a {@link MetricRegistry} at a specific point in time,
 * allowing iteration over {@link MetricSnapshot}s ordered by metric name.
 * Members of one family share the name and follow each other, ordered by their static labels.
 */
public final class MetricRegistrySnapshot implements Iterable<MetricSnapshot> {

    private static final MetricRegistrySnapshot EMPTY = new MetricRegistrySnapshot(List.of());

    private static final Comparator<MetricSnapshot> ORDER =
            Comparator.comparing(MetricSnapshot::name).thenComparing(MetricRegistrySnapshot::compareStaticLabels);

    private final List<MetricSnapshot> snapshots;

    MetricRegistrySnapshot(@NonNull List<MetricSnapshot> snapshots) {
        this.snapshots = snapshots.stream()
                .sorted(ORDER)
                .toList();
    }

    private static int compareStaticLabels(MetricSnapshot first, MetricSnapshot second) {
        final List<Label> a = first.staticLabels();
        final List<Label> b = second.staticLabels();
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            final int cmp = a.get(i).compareTo(b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    /**
     * @return a snapshot without any metrics
     */
    @NonNull
    public static MetricRegistrySnapshot empty() {
        return EMPTY;
    }

    @NonNull
    @Override
    public Iterator<MetricSnapshot> iterator() {
        return snapshots.iterator();
    }

    /**
     * @return number of metric snapshots
     */
    public int size() {
        return snapshots.size();
    }

    /**
     * Finds a metric snapshot by its exposed name. For a family with several static label sets, the one with the
     * lowest static labels is returned, see {@link #findAll(String)}.
     *
     * @param name the metric name
     * @return the snapshot if present
     */
    @NonNull
    public Optional<MetricSnapshot> find(@NonNull String name) {
        return snapshots.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    /**
     * Finds all family members exposed under the name, ordered by static labels.
     *
     * @param name the metric name
     * @return the snapshots, empty if none
     */
    @NonNull
    public List<MetricSnapshot> findAll(@NonNull String name) {
        return snapshots.stream().filter(s -> s.name().equals(name)).toList();
    }

    /**
     * Returns a copy of this snapshot where every metric name is prefixed with {@code prefix + "_"}.
     * Registered metrics are not renamed.
     *
     * @param prefix the prefix to prepend, must be a valid metric name
     * @return renamed copy of this snapshot
     * @throws IllegalArgumentException if the prefix is not a valid metric name
     */
    @NonNull
    public MetricRegistrySnapshot withNamePrefix(@NonNull String prefix) {
        MetricUtils.validateMetricNameCharacters(prefix);
        return new MetricRegistrySnapshot(snapshots.stream()
                .map(snapshot -> snapshot.withName(prefix + '_' + snapshot.name()))
                .toList());
    }
}
