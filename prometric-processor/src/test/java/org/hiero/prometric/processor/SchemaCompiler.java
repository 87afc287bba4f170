// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.processor;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileManager;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import org.apache.logging.log4j.LogManager;
import org.hiero.prometric.LongCounter;

/**
 * Compiles schema sources in memory with {@link MetricsProcessor}, capturing diagnostics and generated sources.
 */
final class SchemaCompiler {

    private final Map<String, String> sources = new LinkedHashMap<>();

    /**
     * Adds a compilation unit.
     *
     * @param className qualified name of the top level class
     * @param source    the source code
     */
    @NonNull
    SchemaCompiler source(@NonNull String className, @NonNull String source) {
        sources.put(className, source);
        return this;
    }

    @NonNull
    Result compile() {
        final JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            throw new IllegalStateException("No system Java compiler available");
        }
        final DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        final StandardJavaFileManager standardFileManager =
                compiler.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8);
        final InMemoryFileManager fileManager = new InMemoryFileManager(standardFileManager);

        final List<JavaFileObject> units = new ArrayList<>();
        sources.forEach((name, source) -> units.add(new InMemoryFile(name, JavaFileObject.Kind.SOURCE, source)));

        final List<String> options = List.of("--release", "17", "-classpath", classpath());
        final JavaCompiler.CompilationTask task = compiler.getTask(null, fileManager, diagnostics, options, null, units);
        task.setProcessors(List.of(new MetricsProcessor()));
        final boolean success = task.call();

        final Map<String, String> generated = new LinkedHashMap<>();
        for (InMemoryFile file : fileManager.outputs) {
            if (file.getKind() == JavaFileObject.Kind.SOURCE) {
                generated.put(file.className, file.getCharContent(true).toString());
            }
        }
        return new Result(success, diagnostics.getDiagnostics(), generated);
    }

    private static String classpath() {
        return List.of(LongCounter.class, edu.umd.cs.findbugs.annotations.NonNull.class, LogManager.class).stream()
                .map(SchemaCompiler::codeSourcePath)
                .distinct()
                .collect(Collectors.joining(File.pathSeparator));
    }

    private static String codeSourcePath(Class<?> type) {
        try {
            return Path.of(type.getProtectionDomain().getCodeSource().getLocation().toURI())
                    .toString();
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Cannot locate classes of " + type, e);
        }
    }

    /**
     * Outcome of a compilation.
     *
     * @param success          whether javac reported no errors
     * @param diagnostics      all reported diagnostics
     * @param generatedSources generated source files by qualified class name
     */
    record Result(
            boolean success,
            List<Diagnostic<? extends JavaFileObject>> diagnostics,
            Map<String, String> generatedSources) {

        /**
         * @return messages of all error diagnostics
         */
        List<String> errors() {
            return diagnostics.stream()
                    .filter(d -> d.getKind() == Diagnostic.Kind.ERROR)
                    .map(d -> d.getMessage(Locale.ROOT))
                    .toList();
        }

        String generatedSource(String className) {
            final String source = generatedSources.get(className);
            if (source == null) {
                throw new AssertionError("No source generated for " + className + ", got " + generatedSources.keySet()
                        + " and errors " + errors());
            }
            return source;
        }
    }

    private static final class InMemoryFile extends SimpleJavaFileObject {

        private final String className;
        private final ByteArrayOutputStream content = new ByteArrayOutputStream();

        InMemoryFile(String className, Kind kind) {
            super(URI.create("mem:///" + className.replace('.', '/') + kind.extension), kind);
            this.className = className;
        }

        InMemoryFile(String className, Kind kind, String source) {
            this(className, kind);
            content.writeBytes(source.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors) {
            return content.toString(StandardCharsets.UTF_8);
        }

        @Override
        public OutputStream openOutputStream() {
            content.reset();
            return content;
        }

        @Override
        public Writer openWriter() {
            return new OutputStreamWriter(openOutputStream(), StandardCharsets.UTF_8);
        }
    }

    private static final class InMemoryFileManager extends ForwardingJavaFileManager<JavaFileManager> {

        private final List<InMemoryFile> outputs = new ArrayList<>();

        InMemoryFileManager(StandardJavaFileManager fileManager) {
            super(fileManager);
        }

        @Override
        public JavaFileObject getJavaFileForOutput(
                Location location, String className, JavaFileObject.Kind kind, FileObject sibling) {
            final InMemoryFile file = new InMemoryFile(className, kind);
            outputs.add(file);
            return file;
        }
    }
}
