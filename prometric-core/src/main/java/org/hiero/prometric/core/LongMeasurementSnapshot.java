// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A snapshot of a measurement that holds a {@code long} value.
 */
public final class LongMeasurementSnapshot extends MeasurementSnapshot {

    private final long value;

    public LongMeasurementSnapshot(@NonNull LabelValues dynamicLabelValues, long value) {
        super(dynamicLabelValues);
        this.value = value;
    }

    /**
     * @return the {@code long} value of this measurement snapshot
     */
    public long get() {
        return value;
    }

    @Override
    public String toString() {
        return "{" + super.toString() + ", value=" + value + "}";
    }
}
