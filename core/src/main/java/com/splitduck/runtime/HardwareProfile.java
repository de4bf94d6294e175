package com.splitduck.runtime;

import java.lang.management.ManagementFactory;
import com.sun.management.OperatingSystemMXBean;

/**
 * Detects hardware capabilities used to size the embedded DuckDB engine.
 *
 * <p>Only the CPU core count and physical memory are relevant here: they
 * bound the engine's internal thread count and memory limit. Neither value
 * has any influence on which rows are selected or in what order.
 *
 * <p>Example usage:
 * <pre>
 *   HardwareProfile profile = HardwareProfile.detect();
 *   int threads = profile.recommendedThreadCount();
 *   String memLimit = profile.recommendedMemoryLimit();
 * </pre>
 *
 * @see DuckDBRuntime
 */
public class HardwareProfile {

    private final int cpuCores;
    private final long totalMemoryBytes;

    private HardwareProfile(int cpuCores, long totalMemory) {
        this.cpuCores = cpuCores;
        this.totalMemoryBytes = totalMemory;
    }

    /**
     * Detects the hardware profile of the current system.
     *
     * @return the detected hardware profile
     */
    public static HardwareProfile detect() {
        int cores = Runtime.getRuntime().availableProcessors();

        long memory;
        try {
            OperatingSystemMXBean osBean = ManagementFactory.getPlatformMXBean(
                OperatingSystemMXBean.class);
            memory = osBean.getTotalMemorySize();
        } catch (Exception e) {
            // Fallback to max heap if physical memory detection fails
            memory = Runtime.getRuntime().maxMemory() * 4;
        }

        return new HardwareProfile(cores, memory);
    }

    /**
     * Returns the recommended thread count for DuckDB: one per core.
     *
     * @return the recommended thread count
     */
    public int recommendedThreadCount() {
        return Math.max(1, cpuCores);
    }

    /**
     * Returns the recommended memory limit for DuckDB.
     *
     * <p>DuckDB recommends 4GB per thread, capped here at 80% of the total RAM.
     *
     * @return the memory limit string (e.g., "8GB", "512MB")
     */
    public String recommendedMemoryLimit() {
        long limitBytes = Math.min((totalMemoryBytes * 4) / 5, cpuCores * 4L * 1024 * 1024 * 1024);
        return formatBytes(limitBytes);
    }

    static String formatBytes(long bytes) {
        if (bytes >= 1024L * 1024 * 1024) {
            return (bytes / (1024L * 1024 * 1024)) + "GB";
        } else if (bytes >= 1024L * 1024) {
            return (bytes / (1024L * 1024)) + "MB";
        } else if (bytes >= 1024) {
            return (bytes / 1024) + "KB";
        } else {
            return bytes + "B";
        }
    }

    public int cpuCores() {
        return cpuCores;
    }

    @Override
    public String toString() {
        return String.format("HardwareProfile(cores=%d, memory=%s)",
            cpuCores, formatBytes(totalMemoryBytes));
    }
}
