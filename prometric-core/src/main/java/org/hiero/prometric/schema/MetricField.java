// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.schema;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Optional attributes of a metric declared by a field of a {@link MetricsSchema} class.
 * A field without this annotation is a metric without labels, named after the field.
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target(ElementType.FIELD)
public @interface MetricField {

    /**
     * Metric name used instead of the field name. The scope is still prepended.
     */
    String name() default "";

    /**
     * Help text. When empty, the documentation comment of the field is used.
     */
    String help() default "";

    /**
     * Dynamic label names in the order their values are passed to the accessor method.
     */
    String[] labels() default {};

    /**
     * Histogram bucket upper bounds, strictly ascending. Only allowed on histograms.
     */
    double[] buckets() default {};
}
