// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.processor;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import javax.lang.model.element.Element;

/**
 * A schema declaration that cannot be compiled into a bundle, attached to the offending element.
 */
final class SchemaException extends Exception {

    private final ErrorKind kind;
    private final transient Element element;

    SchemaException(@NonNull ErrorKind kind, @NonNull Element element, @NonNull String message) {
        super(kind.displayName() + ": " + message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.element = Objects.requireNonNull(element, "element must not be null");
    }

    @NonNull
    ErrorKind kind() {
        return kind;
    }

    @NonNull
    Element element() {
        return element;
    }
}
