// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.processor;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Kinds of schema errors. The display name prefixes the compiler error message.
 */
enum ErrorKind {
    /** Field type is not one of the metric kinds. */
    UNSUPPORTED_KIND("UnsupportedKind"),
    /** Schema has no scope or a blank one. */
    MISSING_SCOPE("MissingScope"),
    /** Label name declared twice for one metric. */
    DUPLICATE_LABEL("DuplicateLabel"),
    /** Label name doesn't match the label name pattern or equals the metric name. */
    INVALID_LABEL("InvalidLabel"),
    /** Histogram buckets are empty, not finite or not strictly ascending. */
    INVALID_BUCKETS("InvalidBuckets"),
    /** Buckets declared on a metric that is not a histogram. */
    BUCKETS_NOT_ALLOWED("BucketsNotAllowed"),
    /** Full metric name doesn't match the metric name pattern, or the field name is reserved. */
    INVALID_NAME("InvalidName"),
    /** Two fields of one schema resolve to the same metric name or accessor. */
    DUPLICATE_NAME("DuplicateName"),
    /** Schema annotation is placed on something that cannot be a schema. */
    INVALID_SCHEMA("InvalidSchema");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    @NonNull
    String displayName() {
        return displayName;
    }
}
