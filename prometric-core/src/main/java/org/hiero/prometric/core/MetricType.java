// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The type of metric as exposed in the Prometheus text exposition format.
 */
public enum MetricType {
    /**
     * A cumulative metric that represents a single monotonically increasing counter value.
     */
    COUNTER("counter"),
    /**
     * A metric that represents a single numerical value that can arbitrarily go up and down and set to any value.
     */
    GAUGE("gauge"),
    /**
     * A metric that samples observations into configurable cumulative buckets, also tracking their sum and count.
     */
    HISTOGRAM("histogram");

    private final String exposedName;

    MetricType(String exposedName) {
        this.exposedName = exposedName;
    }

    /**
     * @return the name of this type in the {@code # TYPE} line of the exposition format
     */
    @NonNull
    public String exposedName() {
        return exposedName;
    }
}
