// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.processor;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.VariableElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Elements;
import org.hiero.prometric.HistogramBuckets;
import org.hiero.prometric.core.MetricUtils;
import org.hiero.prometric.schema.MetricField;

/**
 * Resolves a single schema field into a {@link ResolvedMetric}.
 * <p>
 * Help text comes from the {@link MetricField#help()} attribute, or else from the documentation comment
 * of the field with block tags removed and lines joined by a single space.
 */
final class SchemaFieldResolver {

    private final Elements elements;

    SchemaFieldResolver(@NonNull Elements elements) {
        this.elements = Objects.requireNonNull(elements, "elements must not be null");
    }

    /**
     * @param field the non-static schema field
     * @param scope the non-blank schema scope
     * @return the resolved metric
     * @throws SchemaException if the field does not declare a valid metric
     */
    @NonNull
    ResolvedMetric resolve(@NonNull VariableElement field, @NonNull String scope) throws SchemaException {
        final String identifier = field.getSimpleName().toString();
        final MetricKind kind = resolveKind(field);

        if (Naming.RESERVED_FIELD_NAMES.contains(identifier)) {
            throw new SchemaException(
                    ErrorKind.INVALID_NAME, field, "field name '" + identifier + "' is reserved in generated bundles");
        }

        final MetricField annotation = field.getAnnotation(MetricField.class);
        final String rename = annotation == null ? "" : annotation.name();
        final String metricName = rename.isEmpty() ? identifier : rename;
        final String fullName = scope + "_" + metricName;
        if (!MetricUtils.isValidMetricName(fullName)) {
            throw new SchemaException(
                    ErrorKind.INVALID_NAME,
                    field,
                    "metric name '" + fullName + "' must match " + MetricUtils.METRIC_NAME_REGEX);
        }

        final List<String> labelNames =
                resolveLabels(field, fullName, annotation == null ? new String[0] : annotation.labels());
        final double[] buckets = resolveBuckets(field, kind, annotation);
        final String help = resolveHelp(field, annotation == null ? "" : annotation.help());

        return new ResolvedMetric(field, identifier, kind, fullName, help, labelNames, buckets);
    }

    private static MetricKind resolveKind(VariableElement field) throws SchemaException {
        final TypeMirror type = field.asType();
        MetricKind kind = null;
        if (type.getKind() == TypeKind.DECLARED) {
            final TypeElement typeElement = (TypeElement) ((DeclaredType) type).asElement();
            kind = MetricKind.forTypeName(typeElement.getQualifiedName().toString());
        }
        if (kind == null) {
            throw new SchemaException(
                    ErrorKind.UNSUPPORTED_KIND,
                    field,
                    "type " + type + " of field '" + field.getSimpleName() + "' is not a metric kind, expected one of "
                            + supportedKinds());
        }
        return kind;
    }

    private static List<String> resolveLabels(VariableElement field, String fullName, String[] labels)
            throws SchemaException {
        final Set<String> seen = new HashSet<>();
        final List<String> labelNames = new ArrayList<>(labels.length);
        for (String label : labels) {
            if (!MetricUtils.isValidLabelName(label)) {
                throw new SchemaException(
                        ErrorKind.INVALID_LABEL,
                        field,
                        "label name '" + label + "' must match " + MetricUtils.LABEL_NAME_REGEX);
            }
            if (label.equals(fullName)) {
                throw new SchemaException(
                        ErrorKind.INVALID_LABEL, field, "label name '" + label + "' equals the metric name");
            }
            if (!seen.add(label)) {
                throw new SchemaException(
                        ErrorKind.DUPLICATE_LABEL,
                        field,
                        "label '" + label + "' is declared more than once for metric '" + fullName + "'");
            }
            labelNames.add(label);
        }
        return List.copyOf(labelNames);
    }

    @Nullable
    private static double[] resolveBuckets(VariableElement field, MetricKind kind, MetricField annotation)
            throws SchemaException {
        if (annotation == null || !isExplicit(field, "buckets")) {
            return null;
        }
        if (kind != MetricKind.HISTOGRAM) {
            throw new SchemaException(
                    ErrorKind.BUCKETS_NOT_ALLOWED,
                    field,
                    "buckets are only allowed on " + MetricKind.HISTOGRAM.simpleName() + ", not on "
                            + kind.simpleName());
        }
        try {
            return HistogramBuckets.of(annotation.buckets()).upperBounds();
        } catch (IllegalArgumentException e) {
            throw new SchemaException(ErrorKind.INVALID_BUCKETS, field, e.getMessage());
        }
    }

    /**
     * Whether the attribute is written in the {@link MetricField} annotation of the field, rather than defaulted.
     */
    private static boolean isExplicit(VariableElement field, String attribute) {
        for (AnnotationMirror mirror : field.getAnnotationMirrors()) {
            final TypeElement annotationType =
                    (TypeElement) mirror.getAnnotationType().asElement();
            if (annotationType.getQualifiedName().contentEquals(MetricField.class.getCanonicalName())) {
                for (ExecutableElement element : mirror.getElementValues().keySet()) {
                    if (element.getSimpleName().contentEquals(attribute)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private String resolveHelp(VariableElement field, String explicitHelp) {
        if (!explicitHelp.isEmpty()) {
            return explicitHelp;
        }
        return docCommentText(elements.getDocComment(field));
    }

    /**
     * Main description of a documentation comment: text before the first block tag, lines joined by a single space.
     */
    @NonNull
    static String docCommentText(@Nullable String docComment) {
        if (docComment == null) {
            return "";
        }
        final StringBuilder sb = new StringBuilder();
        for (String line : docComment.split("\\R")) {
            final String trimmed = line.strip();
            if (trimmed.startsWith("@")) {
                break;
            }
            if (!trimmed.isEmpty()) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(trimmed);
            }
        }
        return sb.toString();
    }

    private static String supportedKinds() {
        final List<String> names = new ArrayList<>();
        for (MetricKind kind : MetricKind.values()) {
            names.add(kind.simpleName());
        }
        return String.join(", ", names);
    }
}
