/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.concurrency;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;

/**
 * Reads CPU utilization and heap pressure of the running JVM from its management beans.
 * <p>
 * CPU utilization is the process CPU load where the platform bean exposes it, otherwise the system
 * load average divided by the number of processors. Memory pressure is used heap divided by the
 * maximum heap (or the committed heap if no maximum is defined).
 */
public final class JvmSystemMetricsSource implements SystemMetricsSource {

  private final OperatingSystemMXBean operatingSystem;

  private final MemoryMXBean memory;

  public JvmSystemMetricsSource() {
    this(ManagementFactory.getOperatingSystemMXBean(), ManagementFactory.getMemoryMXBean());
  }

  JvmSystemMetricsSource(final OperatingSystemMXBean operatingSystem, final MemoryMXBean memory) {
    this.operatingSystem = operatingSystem;
    this.memory = memory;
  }

  @Override
  public SystemLoad sample() {
    return new SystemLoad(cpuUtilization(), memoryPressure());
  }

  private double cpuUtilization() {
    if (operatingSystem instanceof com.sun.management.OperatingSystemMXBean platformBean) {
      final double processLoad = platformBean.getProcessCpuLoad();
      if (processLoad >= 0.0) {
        return Math.min(1.0, processLoad);
      }
    }
    final double loadAverage = operatingSystem.getSystemLoadAverage();
    if (loadAverage < 0.0) {
      return 0.0;
    }
    return Math.min(1.0, loadAverage / Math.max(1, operatingSystem.getAvailableProcessors()));
  }

  private double memoryPressure() {
    final MemoryUsage heap = memory.getHeapMemoryUsage();
    final long limit = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
    if (limit <= 0) {
      return 0.0;
    }
    return Math.min(1.0, (double) heap.getUsed() / limit);
  }
}
