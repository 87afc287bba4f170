// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.process;

import org.hiero.prometric.LongGauge;
import org.hiero.prometric.schema.MetricField;
import org.hiero.prometric.schema.MetricsSchema;

/**
 * Host metrics refreshed by {@link ProcessCollector}.
 */
@MetricsSchema(scope = "system")
class SystemMetrics {

    /** The number of logical CPU cores available in the system. */
    @MetricField(name = "cpu_cores")
    LongGauge cpuCores;

    /** The maximum CPU frequency of all cores in MHz. */
    @MetricField(name = "max_cpu_frequency")
    LongGauge maxCpuFrequency;

    /** The minimum CPU frequency of all cores in MHz. */
    @MetricField(name = "min_cpu_frequency")
    LongGauge minCpuFrequency;
}
