// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * An abstract class for snapshot of a single {@link Metric} measurement for specific dynamic label values at specific point in time.
 */
public abstract class MeasurementSnapshot {

    private final LabelValues dynamicLabelValues;

    protected MeasurementSnapshot(@NonNull LabelValues dynamicLabelValues) {
        this.dynamicLabelValues = Objects.requireNonNull(dynamicLabelValues, "label values must not be null");
    }

    /**
     * @return the dynamic label values associated with this measurement snapshot.
     */
    @NonNull
    public LabelValues getDynamicLabelValues() {
        return dynamicLabelValues;
    }

    @Override
    public String toString() {
        return "labelValues=" + dynamicLabelValues;
    }
}
