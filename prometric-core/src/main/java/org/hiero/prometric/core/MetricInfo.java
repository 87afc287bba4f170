// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;

/**
 * Read-only information about a metric, including its type, name, description, and associated labels.
 */
public interface MetricInfo {

    /**
     * @return the type of this metric, never {@code null}
     */
    @NonNull
    MetricType type();

    /**
     * @return the name of this metric, never {@code null}
     */
    @NonNull
    String name();

    /**
     * @return the description of this metric used as help text, empty if none, never {@code null}
     */
    @NonNull
    String description();

    /**
     * @return the immutable alphabetically ordered list of static labels associated with this metric
     * and any of its measurement, may be empty but never {@code null}
     */
    @NonNull
    List<Label> staticLabels();

    /**
     * @return the immutable list of dynamic label names associated with this metric in declaration order,
     * may be empty but never {@code null}.
     * Label values of every measurement are positional and follow this order.
     */
    @NonNull
    List<String> dynamicLabelNames();
}
