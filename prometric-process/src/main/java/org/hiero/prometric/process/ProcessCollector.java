// SPDX-License-Identifier: Apache-2.0
package org.hiero.prometric.process;

import com.sun.management.UnixOperatingSystemMXBean;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.RuntimeMXBean;
import java.lang.management.ThreadMXBean;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.prometric.core.MetricRegistry;

/**
 * Collects metrics of the current process and the host it runs on.
 * <p>
 * The metrics are registered when the collector is created and refreshed on every {@link #collect()} call.
 * Values read from {@code /proc} are only available on Linux; elsewhere the affected metrics keep their
 * previous value, and fall back to JVM provided values where one exists.
 * <pre>{@code
 * ProcessCollector collector = new ProcessCollector(registry);
 * scheduler.scheduleAtFixedRate(collector::collect, 0, 10, TimeUnit.SECONDS);
 * }</pre>
 */
public final class ProcessCollector {

    private static final Logger logger = LogManager.getLogger(ProcessCollector.class);

    private static final Path PROC = Path.of("/proc");

    private final SystemMetricsBundle system;
    private final ProcessMetricsBundle process;
    private final Path procRoot;

    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();
    private final RuntimeMXBean runtimeBean = ManagementFactory.getRuntimeMXBean();
    private final ThreadMXBean threadBean = ManagementFactory.getThreadMXBean();
    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();

    private long lastWrittenBytes = 0;

    /**
     * Creates a collector registering its metrics in the {@link MetricRegistry#defaultRegistry() default registry}.
     */
    public ProcessCollector() {
        this(MetricRegistry.defaultRegistry());
    }

    public ProcessCollector(@NonNull MetricRegistry registry) {
        this(registry, PROC);
    }

    /**
     * @param registry the registry to register metrics in
     * @param procRoot mount point of the proc file system
     */
    ProcessCollector(@NonNull MetricRegistry registry, @NonNull Path procRoot) {
        Objects.requireNonNull(registry, "registry must not be null");
        this.procRoot = Objects.requireNonNull(procRoot, "procRoot must not be null");
        this.system = SystemMetricsBundle.builder().withRegistry(registry).build();
        this.process = ProcessMetricsBundle.builder().withRegistry(registry).build();
    }

    /**
     * @return the PID of the monitored process
     */
    public long pid() {
        return ProcessHandle.current().pid();
    }

    /**
     * Refreshes all metrics.
     */
    public synchronized void collect() {
        collectSystem();
        collectProcess();
    }

    private void collectSystem() {
        system.cpuCores().set(Runtime.getRuntime().availableProcessors());

        // accessors are taken up front so the gauges are exposed even when the source is unreadable
        final SystemMetricsBundle.MaxCpuFrequencyAccessor maxFrequency = system.maxCpuFrequency();
        final SystemMetricsBundle.MinCpuFrequencyAccessor minFrequency = system.minCpuFrequency();
        final Path cpuInfo = procRoot.resolve("cpuinfo");
        try {
            long max = 0;
            long min = Long.MAX_VALUE;
            for (String line : readLines(cpuInfo)) {
                if (line.startsWith("cpu MHz")) {
                    final long frequency = Math.round(Double.parseDouble(valueOf(line)));
                    max = Math.max(max, frequency);
                    min = Math.min(min, frequency);
                }
            }
            maxFrequency.set(max);
            minFrequency.set(min == Long.MAX_VALUE ? 0 : min);
        } catch (IOException | RuntimeException e) {
            logger.debug("Failed to read CPU frequencies. source={}", cpuInfo, e);
        }
    }

    private void collectProcess() {
        process.threads().set(threadBean.getThreadCount());
        process.startTime().set(runtimeBean.getStartTime() / 1000);

        final long residentMemory = residentMemory();
        process.residentMemory().set(residentMemory);

        final ProcessMetricsBundle.CpuUsageAccessor cpuUsage = process.cpuUsage();
        final ProcessMetricsBundle.ResidentMemoryUsageAccessor residentMemoryUsage = process.residentMemoryUsage();
        if (osBean instanceof com.sun.management.OperatingSystemMXBean mBean) {
            final double cpuLoad = mBean.getProcessCpuLoad();
            if (cpuLoad >= 0) {
                cpuUsage.set(cpuLoad * 100);
            }
            final long totalMemory = mBean.getTotalMemorySize();
            if (totalMemory > 0) {
                residentMemoryUsage.set((double) residentMemory / totalMemory);
            }
        }

        final ProcessMetricsBundle.OpenFdsAccessor openFds = process.openFds();
        final ProcessMetricsBundle.MaxFdsAccessor maxFds = process.maxFds();
        if (osBean instanceof UnixOperatingSystemMXBean mBean) {
            openFds.set(mBean.getOpenFileDescriptorCount());
            maxFds.set(mBean.getMaxFileDescriptorCount());
        }

        collectWrittenBytes();
    }

    private long residentMemory() {
        final Path status = procRoot.resolve("self").resolve("status");
        try {
            final OptionalLong kiloBytes = findLong(readLines(status), "VmRSS:");
            if (kiloBytes.isPresent()) {
                return kiloBytes.getAsLong() * 1024;
            }
        } catch (IOException | RuntimeException e) {
            logger.debug("Failed to read resident memory. source={}", status, e);
        }
        return memoryBean.getHeapMemoryUsage().getCommitted()
                + memoryBean.getNonHeapMemoryUsage().getCommitted();
    }

    private void collectWrittenBytes() {
        final ProcessMetricsBundle.DiskWrittenBytesAccessor diskWrittenBytes = process.diskWrittenBytes();
        final Path io = procRoot.resolve("self").resolve("io");
        try {
            final OptionalLong writtenBytes = findLong(readLines(io), "write_bytes:");
            if (writtenBytes.isPresent()) {
                final long delta = writtenBytes.getAsLong() - lastWrittenBytes;
                if (delta > 0) {
                    diskWrittenBytes.increment(delta);
                }
                lastWrittenBytes = Math.max(lastWrittenBytes, writtenBytes.getAsLong());
            }
        } catch (IOException | RuntimeException e) {
            logger.debug("Failed to read written bytes. source={}", io, e);
        }
    }

    private static List<String> readLines(Path file) throws IOException {
        return Files.readAllLines(file, StandardCharsets.UTF_8);
    }

    /**
     * Finds the first line starting with the key and parses the first token after it as a long.
     */
    private static OptionalLong findLong(List<String> lines, String key) {
        for (String line : lines) {
            if (line.startsWith(key)) {
                final String value = line.substring(key.length()).strip();
                final int end = value.indexOf(' ');
                return OptionalLong.of(Long.parseLong(end < 0 ? value : value.substring(0, end)));
            }
        }
        return OptionalLong.empty();
    }

    private static String valueOf(String line) {
        final int separator = line.indexOf(':');
        if (separator < 0) {
            throw new IllegalArgumentException("Missing ':' in line: " + line);
        }
        return line.substring(separator + 1).strip();
    }
}
