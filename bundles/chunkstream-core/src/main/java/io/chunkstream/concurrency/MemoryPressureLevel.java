/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.concurrency;

/**
 * Classification of a memory pressure ratio.
 */
public enum MemoryPressureLevel {
  NONE(0.0),

  LOW(0.5),

  MEDIUM(0.7),

  HIGH(0.85),

  CRITICAL(0.95);

  /** Lowest ratio belonging to the level. */
  private final double threshold;

  MemoryPressureLevel(final double threshold) {
    this.threshold = threshold;
  }

  public double getThreshold() {
    return threshold;
  }

  /**
   * Classify a pressure ratio. Non-finite ratios are classified as {@link #NONE}.
   *
   * @param ratio used / available memory
   * @return the level
   */
  public static MemoryPressureLevel of(final double ratio) {
    if (!Double.isFinite(ratio)) {
      return NONE;
    }
    final MemoryPressureLevel[] levels = values();
    for (int i = levels.length - 1; i > 0; i--) {
      if (ratio >= levels[i].threshold) {
        return levels[i];
      }
    }
    return NONE;
  }
}
