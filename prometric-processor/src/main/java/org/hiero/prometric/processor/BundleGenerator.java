// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.processor;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import javax.annotation.processing.Generated;
import org.hiero.prometric.schema.BundleBuilder;

/**
 * Renders the source of a metric bundle for a resolved schema.
 * <p>
 * The bundle holds one metric per schema field, exposes one accessor method per field returning a
 * kind-specific accessor, and is created through a nested {@code Builder} extending {@link BundleBuilder}.
 */
final class BundleGenerator {

    private final String packageName;
    private final String bundleName;
    private final String schemaName;
    private final List<ResolvedMetric> metrics;

    /**
     * @param packageName package of the schema, empty for the unnamed package
     * @param bundleName  simple name of the generated bundle class
     * @param schemaName  canonical name of the schema class
     * @param metrics     resolved schema fields in declaration order
     */
    BundleGenerator(
            @NonNull String packageName,
            @NonNull String bundleName,
            @NonNull String schemaName,
            @NonNull List<ResolvedMetric> metrics) {
        this.packageName = Objects.requireNonNull(packageName, "packageName must not be null");
        this.bundleName = Objects.requireNonNull(bundleName, "bundleName must not be null");
        this.schemaName = Objects.requireNonNull(schemaName, "schemaName must not be null");
        this.metrics = List.copyOf(Objects.requireNonNull(metrics, "metrics must not be null"));
    }

    /**
     * @return qualified name of the generated bundle class
     */
    @NonNull
    String qualifiedBundleName() {
        return packageName.isEmpty() ? bundleName : packageName + "." + bundleName;
    }

    @NonNull
    String generate() {
        final SourceWriter out = new SourceWriter();
        if (!packageName.isEmpty()) {
            out.line("package %s;", packageName).blank();
        }
        writeImports(out);

        out.javadoc("Metric bundle generated from {@link " + schemaName + "}.");
        out.line("@Generated(%s)", Naming.stringLiteral(MetricsProcessor.class.getName()));
        out.begin("public final class %s", bundleName);

        for (ResolvedMetric metric : metrics) {
            out.line("private final %s %s;", metric.kind().simpleName(), metric.identifier());
        }
        out.blank();
        writeConstructor(out);
        writeFactories(out);
        for (ResolvedMetric metric : metrics) {
            writeAccessorMethod(out, metric);
        }
        writeBuilder(out);
        for (ResolvedMetric metric : metrics) {
            writeAccessorClass(out, metric);
        }

        out.end();
        return out.toString();
    }

    private void writeImports(SourceWriter out) {
        final Set<String> imports = new TreeSet<>();
        imports.add(Generated.class.getName());
        imports.add(BundleBuilder.class.getName());
        for (ResolvedMetric metric : metrics) {
            imports.add(metric.kind().qualifiedName());
        }
        for (String name : imports) {
            out.line("import %s;", name);
        }
        out.blank();
    }

    private void writeConstructor(SourceWriter out) {
        final List<String> parameters = new ArrayList<>();
        for (ResolvedMetric metric : metrics) {
            parameters.add(metric.kind().simpleName() + " " + metric.identifier());
        }
        out.begin("private %s(%s)", bundleName, String.join(", ", parameters));
        for (ResolvedMetric metric : metrics) {
            out.line("this.%1$s = %1$s;", metric.identifier());
        }
        out.end().blank();
    }

    private void writeFactories(SourceWriter out) {
        out.javadoc("Creates a builder using the default registry, no static labels and the\n"
                + "{@link org.hiero.prometric.schema.ConflictPolicy#KEEP_REGISTERED} conflict policy.");
        out.begin("public static Builder builder()");
        out.line("return new Builder();");
        out.end().blank();

        out.javadoc("Creates a bundle registered in the default registry, same as {@code builder().build()}.");
        out.begin("public static %s create()", bundleName);
        out.line("return builder().build();");
        out.end().blank();
    }

    private void writeAccessorMethod(SourceWriter out, ResolvedMetric metric) {
        final List<String> parameterNames = parameterNames(metric.labelNames());
        final List<String> parameters = new ArrayList<>();
        for (String name : parameterNames) {
            parameters.add("String " + name);
        }

        final StringBuilder doc = new StringBuilder();
        doc.append(
                metric.help().isEmpty()
                        ? "Accessor for {@code " + metric.fullName() + "}."
                        : Naming.javadocText(metric.help()));
        for (int i = 0; i < parameterNames.size(); i++) {
            doc.append(i == 0 ? "\n\n" : "\n")
                    .append("@param ")
                    .append(parameterNames.get(i))
                    .append(" value of label {@code ")
                    .append(metric.labelNames().get(i))
                    .append('}');
        }
        out.javadoc(doc.toString());

        out.begin("public %s %s(%s)", metric.accessorName(), metric.identifier(), String.join(", ", parameters));
        if (parameterNames.isEmpty()) {
            out.line("return new %s(this.%s.getOrCreateNotLabeled());", metric.accessorName(), metric.identifier());
        } else {
            out.line(
                    "return new %s(this.%s.getOrCreateLabeled(%s));",
                    metric.accessorName(),
                    metric.identifier(),
                    String.join(", ", parameterNames));
        }
        out.end().blank();
    }

    private void writeBuilder(SourceWriter out) {
        out.javadoc("Builder binding the metrics of the bundle to a registry.");
        out.begin("public static final class Builder extends BundleBuilder<Builder, %s>", bundleName);
        out.line("private Builder() {}").blank();
        out.line("@Override");
        out.begin("protected %s newBundle()", bundleName);
        if (metrics.isEmpty()) {
            out.line("return new %s();", bundleName);
        } else {
            out.line("return new %s(", bundleName);
            for (int i = 0; i < metrics.size(); i++) {
                out.line("        %s%s", metricBuilderExpression(metrics.get(i)), i == metrics.size() - 1 ? ");" : ",");
            }
        }
        out.end();
        out.end().blank();
    }

    private static String metricBuilderExpression(ResolvedMetric metric) {
        final StringBuilder sb = new StringBuilder("bind(")
                .append(metric.kind().simpleName())
                .append(".builder(")
                .append(Naming.stringLiteral(metric.fullName()))
                .append(')');
        if (!metric.help().isEmpty()) {
            sb.append(".setDescription(").append(Naming.stringLiteral(metric.help())).append(')');
        }
        if (!metric.labelNames().isEmpty()) {
            final List<String> literals = new ArrayList<>();
            for (String label : metric.labelNames()) {
                literals.add(Naming.stringLiteral(label));
            }
            sb.append(".addDynamicLabelNames(").append(String.join(", ", literals)).append(')');
        }
        if (metric.buckets() != null) {
            final List<String> literals = new ArrayList<>();
            for (double bound : metric.buckets()) {
                literals.add(Naming.doubleLiteral(bound));
            }
            sb.append(".setBuckets(").append(String.join(", ", literals)).append(')');
        }
        return sb.append(')').toString();
    }

    private static void writeAccessorClass(SourceWriter out, ResolvedMetric metric) {
        final String measurementType = metric.kind().simpleName() + ".Measurement";
        out.javadoc("Operations on a single measurement of {@code " + metric.fullName() + "}.");
        out.begin("public static final class %s", metric.accessorName());
        out.line("private final %s measurement;", measurementType).blank();
        out.begin("private %s(%s measurement)", metric.accessorName(), measurementType);
        out.line("this.measurement = measurement;");
        out.end();
        for (MetricKind.Operation operation : metric.kind().operations()) {
            out.blank();
            out.javadoc(operation.doc());
            if (operation.parameterType() == null) {
                out.begin("public void %s()", operation.name());
                out.line("measurement.%s();", operation.name());
            } else {
                out.begin("public void %s(%s value)", operation.name(), operation.parameterType());
                out.line("measurement.%s(value);", operation.name());
            }
            out.end();
        }
        out.end().blank();
    }

    /**
     * Parameter names for the given labels, suffixing keywords and resolving collisions between suffixed names.
     */
    @NonNull
    static List<String> parameterNames(@NonNull List<String> labelNames) {
        final Set<String> used = new HashSet<>(labelNames);
        final List<String> names = new ArrayList<>(labelNames.size());
        for (String label : labelNames) {
            String name = Naming.parameterName(label);
            if (!name.equals(label)) {
                while (used.contains(name)) {
                    name = name + "_";
                }
                used.add(name);
            }
            names.add(name);
        }
        return names;
    }
}
