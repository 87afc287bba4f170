// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.processor;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.List;
import javax.lang.model.element.VariableElement;

/**
 * A schema field resolved into everything needed to generate its metric and accessor.
 *
 * @param field      the declaring field
 * @param identifier the field name, used for the bundle field and accessor method
 * @param kind       the metric kind
 * @param fullName   the registered metric name, {@code scope + "_" + (rename or identifier)}
 * @param help       the help text, may be empty
 * @param labelNames dynamic label names in declaration order
 * @param buckets    explicit histogram bucket bounds, {@code null} for default buckets or other kinds
 */
record ResolvedMetric(
        @NonNull VariableElement field,
        @NonNull String identifier,
        @NonNull MetricKind kind,
        @NonNull String fullName,
        @NonNull String help,
        @NonNull List<String> labelNames,
        @Nullable double[] buckets) {

    /**
     * @return name of the generated accessor class
     */
    @NonNull
    String accessorName() {
        return Naming.pascalCase(identifier) + "Accessor";
    }
}
