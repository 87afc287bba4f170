// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.process;

import org.hiero.prometric.DoubleGauge;
import org.hiero.prometric.LongCounter;
import org.hiero.prometric.LongGauge;
import org.hiero.prometric.schema.MetricField;
import org.hiero.prometric.schema.MetricsSchema;

/**
 * Metrics of the current process refreshed by {@link ProcessCollector}.
 */
@MetricsSchema(scope = "process")
class ProcessMetrics {

    /** The number of live threads of the process. */
    LongGauge threads;

    /** The CPU usage of the process as a percentage of all cores. */
    @MetricField(name = "cpu_usage")
    DoubleGauge cpuUsage;

    /** The resident memory of the process in bytes (RSS). */
    @MetricField(name = "resident_memory_bytes")
    LongGauge residentMemory;

    /** The resident memory of the process as a fraction of the total physical memory. */
    @MetricField(name = "resident_memory_usage")
    DoubleGauge residentMemoryUsage;

    /** The start time of the process in UNIX seconds. */
    @MetricField(name = "start_time_seconds")
    LongGauge startTime;

    /** The number of open file descriptors of the process. */
    @MetricField(name = "open_fds")
    LongGauge openFds;

    /** The maximum number of open file descriptors of the process. */
    @MetricField(name = "max_fds")
    LongGauge maxFds;

    /** The total bytes written to disk by the process. */
    @MetricField(name = "disk_written_bytes_total")
    LongCounter diskWrittenBytes;
}
