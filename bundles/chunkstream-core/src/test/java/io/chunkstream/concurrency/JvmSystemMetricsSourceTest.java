/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.concurrency;

import org.junit.jupiter.api.Test;

import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JvmSystemMetricsSourceTest {

  @Test
  void testLoadAverageAndHeapUsage() {
    final OperatingSystemMXBean operatingSystem = mock(OperatingSystemMXBean.class);
    when(operatingSystem.getSystemLoadAverage()).thenReturn(2.0);
    when(operatingSystem.getAvailableProcessors()).thenReturn(4);
    final MemoryMXBean memory = mock(MemoryMXBean.class);
    when(memory.getHeapMemoryUsage()).thenReturn(new MemoryUsage(0, 300, 500, 1000));

    final SystemLoad load = new JvmSystemMetricsSource(operatingSystem, memory).sample();

    assertEquals(0.5, load.cpuUtilization(), 1e-9);
    assertEquals(0.3, load.memoryPressure(), 1e-9);
  }

  @Test
  void testUnavailableValues() {
    final OperatingSystemMXBean operatingSystem = mock(OperatingSystemMXBean.class);
    when(operatingSystem.getSystemLoadAverage()).thenReturn(-1.0);
    final MemoryMXBean memory = mock(MemoryMXBean.class);
    when(memory.getHeapMemoryUsage()).thenReturn(new MemoryUsage(0, 400, 800, -1));

    final SystemLoad load = new JvmSystemMetricsSource(operatingSystem, memory).sample();

    assertEquals(0.0, load.cpuUtilization());
    assertEquals(0.5, load.memoryPressure(), 1e-9);
  }

  @Test
  void testPlatformBeansAreWithinRange() {
    final SystemLoad load = new JvmSystemMetricsSource().sample();

    assertTrue(load.cpuUtilization() >= 0.0 && load.cpuUtilization() <= 1.0);
    assertTrue(load.memoryPressure() >= 0.0 && load.memoryPressure() <= 1.0);
  }
}
