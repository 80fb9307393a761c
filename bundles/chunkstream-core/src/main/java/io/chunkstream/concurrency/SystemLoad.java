/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.concurrency;

/**
 * One observation of the system pressure.
 *
 * @param cpuUtilization CPU utilization in [0, 1]
 * @param memoryPressure memory pressure in [0, 1]
 */
public record SystemLoad(double cpuUtilization, double memoryPressure) {

  public MemoryPressureLevel memoryPressureLevel() {
    return MemoryPressureLevel.of(memoryPressure);
  }
}
