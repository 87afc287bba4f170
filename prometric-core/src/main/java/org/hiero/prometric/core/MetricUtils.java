// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Utility class for metrics-related operations.
 */
public final class MetricUtils {

    /** Regex for validating metric names. */
    public static final String METRIC_NAME_REGEX = "^[a-zA-Z][a-zA-Z0-9_:]*$";

    /** Regex for validating label names. */
    public static final String LABEL_NAME_REGEX = "^[a-zA-Z][a-zA-Z0-9_]*$";

    private static final Pattern METRIC_NAME_PATTERN = Pattern.compile(METRIC_NAME_REGEX);
    private static final Pattern LABEL_NAME_PATTERN = Pattern.compile(LABEL_NAME_REGEX);

    private MetricUtils() {}

    /**
     * Checks whether the provided name is a valid metric name, matching {@value #METRIC_NAME_REGEX}.
     *
     * @param metricName the name to check, may be {@code null}
     * @return {@code true} if the name is valid, {@code false} otherwise
     */
    public static boolean isValidMetricName(String metricName) {
        return metricName != null && METRIC_NAME_PATTERN.matcher(metricName).matches();
    }

    /**
     * Checks whether the provided name is a valid label name, matching {@value #LABEL_NAME_REGEX}.
     *
     * @param labelName the name to check, may be {@code null}
     * @return {@code true} if the name is valid, {@code false} otherwise
     */
    public static boolean isValidLabelName(String labelName) {
        return labelName != null && LABEL_NAME_PATTERN.matcher(labelName).matches();
    }

    /**
     * Validates that the provided metric name adheres to the required character set. <br>
     * Pattern to validate is: {@value #METRIC_NAME_REGEX} <br>
     * Definition in ABNF (Augmented Backus-Naur Form):
     * <pre>
     *   name = name-initial-char *name-char
     *   name-initial-char = ALPHA
     *   name-char = name-initial-char / DIGIT / "_" / ":"
     * </pre>
     * @param metricName the name to validate
     * @return the validated name
     * @throws NullPointerException if metric name is {@code null}
     * @throws IllegalArgumentException if metric name is blank or contains invalid characters
     */
    public static String validateMetricNameCharacters(String metricName) {
        return validateNameCharacters(METRIC_NAME_PATTERN, metricName);
    }

    /**
     * Validates that the provided label name adheres to the required character set. <br>
     * Pattern to validate is: {@value #LABEL_NAME_REGEX} <br>
     * Definition in ABNF (Augmented Backus-Naur Form):
     * <pre>
     *   name = name-initial-char *name-char
     *   name-initial-char = ALPHA
     *   name-char = name-initial-char / DIGIT / "_"
     * </pre>
     * @param labelName the label name to validate
     * @return the validated name
     * @throws NullPointerException if label name is {@code null}
     * @throws IllegalArgumentException if label name is blank or contains invalid characters
     */
    public static String validateLabelNameCharacters(String labelName) {
        return validateNameCharacters(LABEL_NAME_PATTERN, labelName);
    }

    private static String validateNameCharacters(Pattern pattern, String name) {
        MetricUtils.throwArgBlank(name, "name");
        if (!pattern.matcher(name).matches()) {
            throw new IllegalArgumentException(
                    "Name contains illegal character: " + name + ". Required pattern is " + pattern.pattern());
        }
        return name;
    }

    /**
     * Validates that provided argument is not null or blank.
     *
     * @param argument     the argument checked
     * @param argumentName the name of the argument
     * @return the argument
     * @throws NullPointerException of passed argument is {@code null}
     * @throws IllegalArgumentException of passed argument is blank using {@link String#isBlank()}
     */
    @NonNull
    public static String throwArgBlank(@NonNull final String argument, @NonNull final String argumentName)
            throws NullPointerException, IllegalArgumentException {
        Objects.requireNonNull(argument, argumentName + " cannot be null");
        if (argument.isBlank()) {
            throw new IllegalArgumentException(argumentName + " cannot be blank");
        }
        return argument;
    }
}
