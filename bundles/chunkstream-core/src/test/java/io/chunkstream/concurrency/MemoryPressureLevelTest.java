/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.concurrency;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MemoryPressureLevelTest {

  @Test
  void testClassification() {
    assertEquals(MemoryPressureLevel.NONE, MemoryPressureLevel.of(0.0));
    assertEquals(MemoryPressureLevel.NONE, MemoryPressureLevel.of(0.49));
    assertEquals(MemoryPressureLevel.LOW, MemoryPressureLevel.of(0.5));
    assertEquals(MemoryPressureLevel.MEDIUM, MemoryPressureLevel.of(0.7));
    assertEquals(MemoryPressureLevel.HIGH, MemoryPressureLevel.of(0.9));
    assertEquals(MemoryPressureLevel.CRITICAL, MemoryPressureLevel.of(0.95));
    assertEquals(MemoryPressureLevel.CRITICAL, MemoryPressureLevel.of(3.0));
  }

  @Test
  void testNonFiniteRatio() {
    assertEquals(MemoryPressureLevel.NONE, MemoryPressureLevel.of(Double.NaN));
    assertEquals(MemoryPressureLevel.NONE, MemoryPressureLevel.of(Double.POSITIVE_INFINITY));
  }
}
