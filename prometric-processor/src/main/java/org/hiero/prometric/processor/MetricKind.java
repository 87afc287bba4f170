// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.processor;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.List;
import org.hiero.prometric.DoubleCounter;
import org.hiero.prometric.DoubleGauge;
import org.hiero.prometric.Histogram;
import org.hiero.prometric.LongCounter;
import org.hiero.prometric.LongGauge;

/**
 * Metric kinds a schema field may declare, with the operations their accessors expose.
 */
enum MetricKind {
    LONG_COUNTER(
            LongCounter.class,
            List.of(
                    new Operation("increment", null, "Increments the counter by {@code 1}."),
                    new Operation("increment", "long", "Increments the counter by a non-negative value."),
                    new Operation("reset", null, "Resets the counter to its initial value."))),
    DOUBLE_COUNTER(
            DoubleCounter.class,
            List.of(
                    new Operation("increment", null, "Increments the counter by {@code 1.0}."),
                    new Operation("increment", "double", "Increments the counter by a non-negative value."),
                    new Operation("reset", null, "Resets the counter to its initial value."))),
    LONG_GAUGE(LongGauge.class, gaugeOperations("long")),
    DOUBLE_GAUGE(DoubleGauge.class, gaugeOperations("double")),
    HISTOGRAM(Histogram.class, List.of(new Operation("observe", "double", "Records an observed value.")));

    /**
     * An accessor method delegating to the measurement method of the same name.
     *
     * @param name          method name
     * @param parameterType primitive parameter type, {@code null} for no parameter
     * @param doc           Javadoc of the generated method
     */
    record Operation(@NonNull String name, @Nullable String parameterType, @NonNull String doc) {}

    private final Class<?> metricClass;
    private final List<Operation> operations;

    MetricKind(Class<?> metricClass, List<Operation> operations) {
        this.metricClass = metricClass;
        this.operations = operations;
    }

    /**
     * @return the metric kind declared by the given qualified type name, or {@code null} if none
     */
    @Nullable
    static MetricKind forTypeName(@NonNull String qualifiedName) {
        for (MetricKind kind : values()) {
            if (kind.qualifiedName().equals(qualifiedName)) {
                return kind;
            }
        }
        return null;
    }

    @NonNull
    String qualifiedName() {
        return metricClass.getCanonicalName();
    }

    @NonNull
    String simpleName() {
        return metricClass.getSimpleName();
    }

    @NonNull
    List<Operation> operations() {
        return operations;
    }

    private static List<Operation> gaugeOperations(String type) {
        return List.of(
                new Operation("increment", null, "Increments the gauge by one."),
                new Operation("decrement", null, "Decrements the gauge by one."),
                new Operation("add", type, "Adds a signed amount."),
                new Operation("subtract", type, "Subtracts a signed amount."),
                new Operation("set", type, "Sets the gauge value."));
    }
}
