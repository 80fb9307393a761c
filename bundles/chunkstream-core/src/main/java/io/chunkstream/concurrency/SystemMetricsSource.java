/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.concurrency;

/**
 * Supplies periodic observations of CPU utilization and memory pressure.
 */
@FunctionalInterface
public interface SystemMetricsSource {

  /**
   * Take a sample.
   *
   * @return the current system load
   */
  SystemLoad sample();
}
