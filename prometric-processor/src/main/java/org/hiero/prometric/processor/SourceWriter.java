// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.processor;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Accumulates Java source text, tracking block indentation.
 * Lines opened with {@link #begin(String, Object...)} are closed with {@link #end()}.
 */
final class SourceWriter {

    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    /**
     * Appends a line at the current indentation, formatted with {@link String#format(String, Object...)}.
     */
    @NonNull
    SourceWriter line(@NonNull String format, Object... args) {
        if (format.isEmpty()) {
            out.append('\n');
            return this;
        }
        indent();
        out.append(args.length == 0 ? format : String.format(format, args)).append('\n');
        return this;
    }

    @NonNull
    SourceWriter blank() {
        return line("");
    }

    /**
     * Appends a line followed by {@code " {"} and increases the indentation.
     */
    @NonNull
    SourceWriter begin(@NonNull String format, Object... args) {
        indent();
        out.append(args.length == 0 ? format : String.format(format, args)).append(" {\n");
        depth++;
        return this;
    }

    /**
     * Decreases the indentation and closes the block.
     */
    @NonNull
    SourceWriter end() {
        if (depth == 0) {
            throw new IllegalStateException("No open block");
        }
        depth--;
        indent();
        out.append("}\n");
        return this;
    }

    /**
     * Appends a Javadoc comment. The text is written as is, so it may contain Javadoc tags; text taken from
     * user input must be escaped with {@link Naming#javadocText(String)} first. Nothing is written for empty text.
     */
    @NonNull
    SourceWriter javadoc(@NonNull String text) {
        if (text.isEmpty()) {
            return this;
        }
        line("/**");
        for (String docLine : text.split("\n", -1)) {
            line(docLine.isEmpty() ? " *" : " * " + docLine);
        }
        return line(" */");
    }

    @Override
    public String toString() {
        if (depth != 0) {
            throw new IllegalStateException("Unclosed blocks: " + depth);
        }
        return out.toString();
    }

    private void indent() {
        for (int i = 0; i < depth; i++) {
            out.append(INDENT);
        }
    }
}
