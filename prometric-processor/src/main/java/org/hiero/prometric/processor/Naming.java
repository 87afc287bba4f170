// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.processor;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Set;
import javax.lang.model.SourceVersion;

/**
 * Identifier and literal helpers for generated sources.
 */
final class Naming {

    /**
     * Member names of generated bundles and of {@link Object}, which metric fields must not use.
     */
    static final Set<String> RESERVED_FIELD_NAMES = Set.of(
            "builder", "create", "clone", "equals", "finalize", "getClass", "hashCode", "notify", "notifyAll",
            "toString", "wait");

    private Naming() {}

    /**
     * Converts an identifier to PascalCase, dropping underscores: {@code http_requests} and {@code httpRequests}
     * both become {@code HttpRequests}.
     */
    @NonNull
    static String pascalCase(@NonNull String identifier) {
        final StringBuilder sb = new StringBuilder(identifier.length());
        boolean upperNext = true;
        for (int i = 0; i < identifier.length(); i++) {
            final char c = identifier.charAt(i);
            if (c == '_' || c == '$') {
                upperNext = true;
            } else if (upperNext) {
                sb.append(Character.toUpperCase(c));
                upperNext = false;
            } else {
                sb.append(c);
            }
        }
        return sb.length() == 0 ? "Metric" : sb.toString();
    }

    /**
     * Returns a parameter name for a label, appending {@code _} to Java keywords and literals.
     */
    @NonNull
    static String parameterName(@NonNull String labelName) {
        return SourceVersion.isName(labelName) ? labelName : labelName + "_";
    }

    /**
     * Quotes the value as a Java string literal.
     */
    @NonNull
    static String stringLiteral(@NonNull String value) {
        final StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Formats a finite double as a Java literal.
     */
    @NonNull
    static String doubleLiteral(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Not a finite value: " + value);
        }
        return Double.toString(value);
    }

    /**
     * Makes text safe to embed in a Javadoc comment. Backslashes are replaced so that javac does not read
     * backslash-u sequences as unicode escapes.
     */
    @NonNull
    static String javadocText(@NonNull String text) {
        return text.replace("\\", "&#92;").replace("*/", "*&#47;").replace("@", "{@literal @}");
    }
}
