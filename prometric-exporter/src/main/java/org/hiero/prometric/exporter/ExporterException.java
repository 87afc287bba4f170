// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.exporter;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Objects;

/**
 * Thrown when the metrics HTTP endpoint cannot be installed.
 */
public class ExporterException extends Exception {

    /**
     * Reason the endpoint could not be installed.
     */
    public enum Kind {
        /** The configured path is not a valid endpoint path. */
        INVALID_PATH,
        /** The listener could not be bound to the configured address. */
        BIND
    }

    private final Kind kind;

    public ExporterException(@NonNull Kind kind, @NonNull String message) {
        this(kind, message, null);
    }

    public ExporterException(@NonNull Kind kind, @NonNull String message, @Nullable Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    @NonNull
    public Kind getKind() {
        return kind;
    }
}
