// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.process;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.hiero.prometric.core.DoubleMeasurementSnapshot;
import org.hiero.prometric.core.LongMeasurementSnapshot;
import org.hiero.prometric.core.MeasurementSnapshot;
import org.hiero.prometric.core.MetricRegistry;
import org.hiero.prometric.core.MetricSnapshot;
import org.hiero.prometric.core.MetricType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProcessCollectorTest {

    @TempDir
    Path procRoot;

    private MetricRegistry registry;

    @BeforeEach
    void setUp() throws IOException {
        registry = new MetricRegistry();
        Files.createDirectories(procRoot.resolve("self"));
    }

    @Test
    void testMetricsAreRegistered() {
        new ProcessCollector(registry, procRoot);

        assertThat(registry.snapshot())
                .extracting(MetricSnapshot::name)
                .containsExactlyInAnyOrder(
                        "system_cpu_cores",
                        "system_max_cpu_frequency",
                        "system_min_cpu_frequency",
                        "process_threads",
                        "process_cpu_usage",
                        "process_resident_memory_bytes",
                        "process_resident_memory_usage",
                        "process_start_time_seconds",
                        "process_open_fds",
                        "process_max_fds",
                        "process_disk_written_bytes_total");
        assertThat(snapshot("process_disk_written_bytes_total").type()).isEqualTo(MetricType.COUNTER);
        assertThat(snapshot("system_cpu_cores").description())
                .isEqualTo("The number of logical CPU cores available in the system.");
    }

    @Test
    void testValuesFromProcFiles() throws IOException {
        Files.writeString(
                procRoot.resolve("cpuinfo"),
                """
                processor\t: 0
                cpu MHz\t\t: 2400.000
                processor\t: 1
                cpu MHz\t\t: 3599.6
                processor\t: 2
                cpu MHz\t\t: 1200.250
                """);
        Files.writeString(procRoot.resolve("self/status"), "Name:\tjava\nVmRSS:\t   2048 kB\nThreads:\t12\n");
        Files.writeString(procRoot.resolve("self/io"), "rchar: 10\nwrite_bytes: 4096\ncancelled_write_bytes: 0\n");

        new ProcessCollector(registry, procRoot).collect();

        assertThat(longValue("system_cpu_cores")).isEqualTo(Runtime.getRuntime().availableProcessors());
        assertThat(longValue("system_max_cpu_frequency")).isEqualTo(3600);
        assertThat(longValue("system_min_cpu_frequency")).isEqualTo(1200);
        assertThat(longValue("process_resident_memory_bytes")).isEqualTo(2048 * 1024);
        assertThat(longValue("process_disk_written_bytes_total")).isEqualTo(4096);
        assertThat(longValue("process_threads")).isPositive();
        assertThat(longValue("process_start_time_seconds"))
                .isPositive()
                .isLessThanOrEqualTo(System.currentTimeMillis() / 1000);
    }

    @Test
    void testWrittenBytesIncrementByDelta() throws IOException {
        Path io = procRoot.resolve("self/io");
        ProcessCollector collector = new ProcessCollector(registry, procRoot);

        Files.writeString(io, "write_bytes: 100\n");
        collector.collect();
        Files.writeString(io, "write_bytes: 250\n");
        collector.collect();
        collector.collect();

        assertThat(longValue("process_disk_written_bytes_total")).isEqualTo(250);
    }

    @Test
    void testMissingProcFilesUseFallbacks() {
        ProcessCollector collector = new ProcessCollector(registry, procRoot.resolve("missing"));

        collector.collect();

        assertThat(longValue("system_max_cpu_frequency")).isZero();
        assertThat(longValue("system_min_cpu_frequency")).isZero();
        assertThat(longValue("process_resident_memory_bytes")).isPositive();
        assertThat(longValue("process_disk_written_bytes_total")).isZero();
        assertThat(longValue("process_open_fds")).isNotNegative();
    }

    @Test
    void testCpuInfoWithoutFrequencies() throws IOException {
        Files.writeString(procRoot.resolve("cpuinfo"), "processor\t: 0\nBogoMIPS\t: 50.00\n");

        new ProcessCollector(registry, procRoot).collect();

        assertThat(longValue("system_max_cpu_frequency")).isZero();
        assertThat(longValue("system_min_cpu_frequency")).isZero();
    }

    @Test
    void testMalformedFileKeepsPreviousValue() throws IOException {
        Path status = procRoot.resolve("self/status");
        ProcessCollector collector = new ProcessCollector(registry, procRoot);
        Files.writeString(procRoot.resolve("cpuinfo"), "cpu MHz\t: 1000\n");
        collector.collect();

        Files.writeString(procRoot.resolve("cpuinfo"), "cpu MHz\t: fast\n");
        Files.writeString(status, "VmRSS:\tlots kB\n");
        collector.collect();

        assertThat(longValue("system_max_cpu_frequency")).isEqualTo(1000);
        assertThat(longValue("process_resident_memory_bytes")).isPositive();
    }

    @Test
    void testUsageGaugesAreInRange() {
        new ProcessCollector(registry, procRoot).collect();

        for (MeasurementSnapshot measurement : snapshot("process_resident_memory_usage")) {
            assertThat(((DoubleMeasurementSnapshot) measurement).get()).isBetween(0.0, 1.0);
        }
        for (MeasurementSnapshot measurement : snapshot("process_cpu_usage")) {
            assertThat(((DoubleMeasurementSnapshot) measurement).get()).isBetween(0.0, 100.0);
        }
    }

    @Test
    void testPid() {
        assertThat(new ProcessCollector(registry, procRoot).pid()).isEqualTo(ProcessHandle.current().pid());
    }

    @Test
    void testSecondCollectorSharesMetrics() {
        new ProcessCollector(registry, procRoot).collect();
        new ProcessCollector(registry, procRoot).collect();

        assertThat(registry.snapshot().size()).isEqualTo(11);
    }

    private MetricSnapshot snapshot(String name) {
        return registry.snapshot()
                .find(name)
                .orElseThrow(() -> new AssertionError("Metric not registered: " + name));
    }

    private long longValue(String name) {
        MetricSnapshot snapshot = snapshot(name);
        assertThat(snapshot).hasSize(1);
        return ((LongMeasurementSnapshot) snapshot.iterator().next()).get();
    }
}
