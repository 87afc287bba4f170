// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.schema;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a metrics schema. Every non-static field of the class declares one metric,
 * whose type must be one of the metric kinds in {@code org.hiero.prometric}.
 * <p>
 * A {@code <Schema>Bundle} class is generated in the same package at compile time, exposing a builder
 * that registers all declared metrics and one typed accessor method per field.
 *
 * <pre>{@code
 * @MetricsSchema(scope = "app")
 * class AppMetrics {
 *     // Number of handled requests
 *     @MetricField(labels = {"method", "path"})
 *     LongCounter requests;
 * }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target(ElementType.TYPE)
public @interface MetricsSchema {

    /**
     * Prefix of every metric name declared by the schema, joined with {@code _}. Must not be blank.
     */
    String scope() default "";
}
