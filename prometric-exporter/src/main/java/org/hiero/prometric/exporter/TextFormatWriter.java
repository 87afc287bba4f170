// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.exporter;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.prometric.core.DoubleMeasurementSnapshot;
import org.hiero.prometric.core.HistogramMeasurementSnapshot;
import org.hiero.prometric.core.Label;
import org.hiero.prometric.core.LabelValues;
import org.hiero.prometric.core.LongMeasurementSnapshot;
import org.hiero.prometric.core.MeasurementSnapshot;
import org.hiero.prometric.core.MetricRegistrySnapshot;
import org.hiero.prometric.core.MetricSnapshot;

/**
 * Writes registry snapshots in the Prometheus text exposition format, version 0.0.4.
 * <p>
 * Metric families are written in name order. Metrics registered under one name with different static labels are
 * written as one family: a single {@code HELP} and {@code TYPE} header followed by the samples of every member.
 * Labels of a sample are the static and dynamic labels of the metric sorted by name, histogram buckets add the
 * {@code le} label last. The writer holds no state and is thread-safe.
 *
 * <p>See <a href="https://prometheus.io/docs/instrumenting/exposition_formats/">Exposition formats</a>.
 */
final class TextFormatWriter {

    private static final Logger logger = LogManager.getLogger(TextFormatWriter.class);

    static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    /** Integral doubles below this magnitude are written without a fraction. */
    private static final double MAX_INTEGRAL = 1e15;

    private static final byte SPACE = ' ';
    private static final byte NEW_LINE = '\n';

    private static final byte[] TYPE = "# TYPE ".getBytes(StandardCharsets.UTF_8);
    private static final byte[] HELP = "# HELP ".getBytes(StandardCharsets.UTF_8);

    private static final String BUCKET_SUFFIX = "_bucket";
    private static final String SUM_SUFFIX = "_sum";
    private static final String COUNT_SUFFIX = "_count";
    private static final String LE_LABEL = "le";

    void write(MetricRegistrySnapshot registrySnapshot, OutputStream output) throws IOException {
        final List<MetricSnapshot> families = new ArrayList<>(registrySnapshot.size());
        registrySnapshot.forEach(families::add);
        // stable, keeps family members in static label order
        families.sort(Comparator.comparing(MetricSnapshot::name));

        String previousName = null;
        for (MetricSnapshot family : families) {
            if (!family.name().equals(previousName)) {
                writeHeader(family, output);
                previousName = family.name();
            }
            writeSamples(family, output);
        }
        output.flush();
    }

    private void writeHeader(MetricSnapshot metricSnapshot, OutputStream output) throws IOException {
        final byte[] nameBytes = metricSnapshot.name().getBytes(StandardCharsets.UTF_8);

        final String description = metricSnapshot.description();
        if (description != null && !description.isEmpty()) {
            output.write(HELP);
            output.write(nameBytes);
            output.write(SPACE);
            output.write(escapeHelp(description).getBytes(StandardCharsets.UTF_8));
            output.write(NEW_LINE);
        }

        output.write(TYPE);
        output.write(nameBytes);
        output.write(SPACE);
        output.write(metricSnapshot.type().exposedName().getBytes(StandardCharsets.UTF_8));
        output.write(NEW_LINE);
    }

    private void writeSamples(MetricSnapshot metricSnapshot, OutputStream output) throws IOException {
        final String name = metricSnapshot.name();
        for (MeasurementSnapshot measurementSnapshot : sortedMeasurements(metricSnapshot)) {
            final Map<String, String> labels = labels(metricSnapshot, measurementSnapshot);
            if (measurementSnapshot instanceof LongMeasurementSnapshot longSnapshot) {
                writeSample(output, name, labels, null, Long.toString(longSnapshot.get()));
            } else if (measurementSnapshot instanceof DoubleMeasurementSnapshot doubleSnapshot) {
                writeSample(output, name, labels, null, formatDouble(doubleSnapshot.get()));
            } else if (measurementSnapshot instanceof HistogramMeasurementSnapshot histogramSnapshot) {
                writeHistogram(output, name, labels, histogramSnapshot);
            } else {
                logger.warn(
                        "Skipping unsupported measurement snapshot. metric={}, type={}",
                        name,
                        measurementSnapshot.getClass().getName());
            }
        }
    }

    private void writeHistogram(
            OutputStream output, String name, Map<String, String> labels, HistogramMeasurementSnapshot snapshot)
            throws IOException {
        final String bucketName = name + BUCKET_SUFFIX;
        for (int i = 0; i < snapshot.bucketCount(); i++) {
            writeSample(
                    output,
                    bucketName,
                    labels,
                    formatDouble(snapshot.upperBound(i)),
                    Long.toString(snapshot.cumulativeCount(i)));
        }
        writeSample(output, name + SUM_SUFFIX, labels, null, formatDouble(snapshot.sum()));
        writeSample(output, name + COUNT_SUFFIX, labels, null, Long.toString(snapshot.count()));
    }

    private void writeSample(
            OutputStream output, String name, Map<String, String> labels, String le, String value)
            throws IOException {
        final StringBuilder line = new StringBuilder(name);
        if (!labels.isEmpty() || le != null) {
            line.append('{');
            boolean first = true;
            for (Map.Entry<String, String> label : labels.entrySet()) {
                if (!first) {
                    line.append(',');
                }
                first = false;
                appendLabel(line, label.getKey(), label.getValue());
            }
            if (le != null) {
                if (!first) {
                    line.append(',');
                }
                appendLabel(line, LE_LABEL, le);
            }
            line.append('}');
        }
        line.append(' ').append(value).append('\n');
        output.write(line.toString().getBytes(StandardCharsets.UTF_8));
    }

    private static void appendLabel(StringBuilder line, String name, String value) {
        line.append(name).append("=\"").append(escapeLabelValue(value)).append('"');
    }

    private static Map<String, String> labels(MetricSnapshot metricSnapshot, MeasurementSnapshot measurement) {
        final Map<String, String> labels = new TreeMap<>();
        for (Label label : metricSnapshot.staticLabels()) {
            labels.put(label.name(), label.value());
        }
        final List<String> labelNames = metricSnapshot.dynamicLabelNames();
        final LabelValues labelValues = measurement.getDynamicLabelValues();
        for (int i = 0; i < labelNames.size(); i++) {
            labels.put(labelNames.get(i), labelValues.get(i));
        }
        return labels;
    }

    private static List<MeasurementSnapshot> sortedMeasurements(MetricSnapshot metricSnapshot) {
        final List<MeasurementSnapshot> measurements = new ArrayList<>(metricSnapshot.size());
        metricSnapshot.forEach(measurements::add);
        measurements.sort(Comparator.comparing(MeasurementSnapshot::getDynamicLabelValues));
        return measurements;
    }

    /**
     * Formats a sample value: integral values without fraction, {@code +Inf}, {@code -Inf} and {@code NaN} for
     * special values, otherwise the shortest decimal representation.
     */
    static String formatDouble(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        } else if (value == Double.POSITIVE_INFINITY) {
            return "+Inf";
        } else if (value == Double.NEGATIVE_INFINITY) {
            return "-Inf";
        } else if (value == Math.rint(value) && Math.abs(value) < MAX_INTEGRAL) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /**
     * Escapes backslash {@code \}, double quote {@code "} and newline characters in label values.
     */
    static String escapeLabelValue(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    /**
     * Escapes backslash {@code \} and newline characters in help text.
     */
    static String escapeHelp(String value) {
        return value.replace("\\", "\\\\").replace("\n", "\\n");
    }
}
