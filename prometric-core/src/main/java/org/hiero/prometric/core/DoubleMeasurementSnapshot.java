// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A snapshot of a measurement that holds a {@code double} value.
 */
public final class DoubleMeasurementSnapshot extends MeasurementSnapshot {

    private final double value;

    public DoubleMeasurementSnapshot(@NonNull LabelValues dynamicLabelValues, double value) {
        super(dynamicLabelValues);
        this.value = value;
    }

    /**
     * @return the {@code double} value of this measurement snapshot
     */
    public double get() {
        return value;
    }

    @Override
    public String toString() {
        return "{" + super.toString() + ", value=" + value + "}";
    }
}
