// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * A label is an immutable key-value pair used to differentiate measurements withing same metric.
 */
public record Label(@NonNull String name, @NonNull String value) implements Comparable<Label> {

    /**
     * Constructs a new label with the specified name and value.
     *
     * @param name  the name of the label, must match {@value MetricUtils#LABEL_NAME_REGEX}
     * @param value the value of the label, any string including an empty one
     * @throws NullPointerException if name or value is {@code null}
     * @throws IllegalArgumentException if name doesn't match regex {@value MetricUtils#LABEL_NAME_REGEX}
     */
    public Label {
        MetricUtils.validateLabelNameCharacters(name);
        Objects.requireNonNull(value, "labelValue cannot be null");
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }

    @Override
    public int compareTo(Label other) {
        int nameCompare = name.compareTo(other.name);
        return nameCompare != 0 ? nameCompare : value.compareTo(other.value);
    }
}
