// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.schema;

/**
 * What a bundle builder does when a metric name is already registered in the target registry.
 */
public enum ConflictPolicy {
    /**
     * Bind to the registered metric with the same name and static labels if its definition matches, so state is
     * shared between bundles. A registered metric with another definition fails the build.
     */
    KEEP_REGISTERED,
    /**
     * Atomically replace the registered metric with the same name and static labels with the new one.
     */
    REPLACE
}
