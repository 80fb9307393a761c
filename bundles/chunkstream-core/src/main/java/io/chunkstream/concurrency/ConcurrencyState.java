/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.concurrency;

/**
 * Immutable snapshot of the adaptive parallelism budget.
 *
 * @param currentLimit the parallelism budget
 * @param lastThroughputSample throughput observed by the previous sample
 * @param consecutiveAdjustments number of increases since the counter was last reset
 * @param lastSampleTime ticker reading of the previous sample in nanoseconds
 */
public record ConcurrencyState(int currentLimit, double lastThroughputSample, int consecutiveAdjustments,
    long lastSampleTime) {

  /** The counter saturates like an unsigned byte. */
  static final int MAX_CONSECUTIVE_COUNT = 255;

  static ConcurrencyState initial(final int limit, final long now) {
    return new ConcurrencyState(limit, 0.0, 0, now);
  }
}
