// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.processor;

import com.google.auto.service.AutoService;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.PackageElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.VariableElement;
import javax.lang.model.util.ElementFilter;
import javax.tools.Diagnostic;
import javax.tools.JavaFileObject;
import org.hiero.prometric.schema.MetricField;
import org.hiero.prometric.schema.MetricsSchema;

/**
 * Generates a {@code <Schema>Bundle} class for every class annotated with {@link MetricsSchema}.
 * <p>
 * Schema errors are reported as compiler errors on the offending element. A schema with errors produces no bundle,
 * other schemas in the same compilation are still processed.
 */
@AutoService(Processor.class)
@SupportedAnnotationTypes("org.hiero.prometric.schema.MetricsSchema")
public final class MetricsProcessor extends AbstractProcessor {

    @Override
    public SourceVersion getSupportedSourceVersion() {
        return SourceVersion.latestSupported();
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        for (Element element : roundEnv.getElementsAnnotatedWith(MetricsSchema.class)) {
            try {
                final BundleGenerator generator = resolveSchema(element);
                writeBundle(generator, (TypeElement) element);
            } catch (SchemaException e) {
                processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR, e.getMessage(), e.element());
            }
        }
        return true;
    }

    private BundleGenerator resolveSchema(Element element) throws SchemaException {
        if (element.getKind() != ElementKind.CLASS) {
            throw new SchemaException(
                    ErrorKind.INVALID_SCHEMA,
                    element,
                    "@MetricsSchema is only allowed on classes, not on " + element.getKind());
        }
        final TypeElement schema = (TypeElement) element;
        final String scope = schema.getAnnotation(MetricsSchema.class).scope().strip();
        if (scope.isEmpty()) {
            throw new SchemaException(
                    ErrorKind.MISSING_SCOPE, schema, "@MetricsSchema of " + schema.getSimpleName() + " needs a scope");
        }

        final SchemaFieldResolver resolver = new SchemaFieldResolver(processingEnv.getElementUtils());
        final List<ResolvedMetric> metrics = new ArrayList<>();
        final Map<String, ResolvedMetric> byFullName = new HashMap<>();
        final Map<String, ResolvedMetric> byAccessor = new HashMap<>();
        for (VariableElement field : ElementFilter.fieldsIn(schema.getEnclosedElements())) {
            if (field.getModifiers().contains(Modifier.STATIC)) {
                if (field.getAnnotation(MetricField.class) != null) {
                    throw new SchemaException(
                            ErrorKind.INVALID_SCHEMA,
                            field,
                            "@MetricField is not allowed on static field '" + field.getSimpleName() + "'");
                }
                continue;
            }
            final ResolvedMetric metric = resolver.resolve(field, scope);
            final ResolvedMetric sameName = byFullName.putIfAbsent(metric.fullName(), metric);
            if (sameName != null) {
                throw new SchemaException(
                        ErrorKind.DUPLICATE_NAME,
                        field,
                        "metric name '" + metric.fullName() + "' is already used by field '"
                                + sameName.identifier() + "'");
            }
            final ResolvedMetric sameAccessor = byAccessor.putIfAbsent(metric.accessorName(), metric);
            if (sameAccessor != null) {
                throw new SchemaException(
                        ErrorKind.DUPLICATE_NAME,
                        field,
                        "field '" + metric.identifier() + "' and field '" + sameAccessor.identifier()
                                + "' both generate accessor " + metric.accessorName());
            }
            metrics.add(metric);
        }

        final PackageElement pkg = processingEnv.getElementUtils().getPackageOf(schema);
        final String packageName = pkg.isUnnamed() ? "" : pkg.getQualifiedName().toString();
        return new BundleGenerator(
                packageName, bundleName(schema), schema.getQualifiedName().toString(), metrics);
    }

    /**
     * Bundle name of a schema: its simple name, prefixed by the names of enclosing classes joined with {@code _},
     * followed by {@code Bundle}.
     */
    static String bundleName(TypeElement schema) {
        final StringBuilder sb = new StringBuilder(schema.getSimpleName());
        Element enclosing = schema.getEnclosingElement();
        while (enclosing != null && enclosing.getKind() != ElementKind.PACKAGE) {
            sb.insert(0, enclosing.getSimpleName() + "_");
            enclosing = enclosing.getEnclosingElement();
        }
        return sb.append("Bundle").toString();
    }

    private void writeBundle(BundleGenerator generator, TypeElement schema) {
        try {
            final JavaFileObject file =
                    processingEnv.getFiler().createSourceFile(generator.qualifiedBundleName(), schema);
            try (Writer writer = file.openWriter()) {
                writer.write(generator.generate());
            }
        } catch (IOException e) {
            processingEnv
                    .getMessager()
                    .printMessage(
                            Diagnostic.Kind.ERROR,
                            "Failed to write " + generator.qualifiedBundleName() + ": " + e.getMessage(),
                            schema);
        }
    }
}
