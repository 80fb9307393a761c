/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.concurrency;

import io.chunkstream.cache.ManualTicker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConcurrencyControllerTest {

  private ManualTicker ticker;

  private ConcurrencySettings settings;

  @BeforeEach
  void setUp() {
    ticker = new ManualTicker();
    settings = ConcurrencySettings.newBuilder().minParallelism(1).maxParallelism(8).initialLimit(4).build();
  }

  @Test
  void testInitialState() {
    final var controller = new ConcurrencyController(settings, ticker);

    assertEquals(4, controller.currentLimit());
    assertEquals(0.0, controller.state().lastThroughputSample());
    assertEquals(0, controller.state().consecutiveAdjustments());
  }

  @Test
  void testRisingThroughputWithHeadroomIncreasesLimit() {
    final var controller = new ConcurrencyController(settings, ticker);

    assertEquals(AdjustmentReason.HEADROOM, controller.sample(100, 0.2, 0.2));
    assertEquals(5, controller.currentLimit());
    assertEquals(AdjustmentReason.HEADROOM, controller.sample(150, 0.2, 0.2));
    assertEquals(6, controller.currentLimit());
    assertEquals(AdjustmentReason.HEADROOM, controller.sample(200, 0.2, 0.2));
    assertEquals(7, controller.currentLimit());
    assertEquals(3, controller.state().consecutiveAdjustments());
  }

  @Test
  void testFlatThroughputKeepsLimit() {
    final var controller = new ConcurrencyController(settings, ticker);
    controller.sample(100, 0.2, 0.2);

    assertEquals(AdjustmentReason.STEADY, controller.sample(100, 0.2, 0.2));
    assertEquals(5, controller.currentLimit());
  }

  @Test
  void testHighCpuDecreasesLimitAndResetsCounter() {
    final var controller = new ConcurrencyController(settings, ticker);
    controller.sample(100, 0.2, 0.2);

    assertEquals(AdjustmentReason.RESOURCE_SHORTAGE, controller.sample(300, 0.95, 0.2));
    assertEquals(4, controller.currentLimit());
    assertEquals(0, controller.state().consecutiveAdjustments());
  }

  @Test
  void testHighMemoryDecreasesLimit() {
    final var controller = new ConcurrencyController(settings, ticker);

    assertEquals(AdjustmentReason.RESOURCE_SHORTAGE, controller.sample(0, 0.1, 0.9));
    assertEquals(3, controller.currentLimit());
  }

  @Test
  void testLimitStopsAtBounds() {
    final var controller = new ConcurrencyController(settings, ticker);

    for (int i = 0; i < 10; i++) {
      controller.sample(0, 1.0, 1.0);
    }
    assertEquals(1, controller.currentLimit());

    for (int i = 1; i <= 20; i++) {
      controller.sample(i * 10, 0.0, 0.0);
    }
    assertEquals(8, controller.currentLimit());
  }

  @Test
  void testCounterAboveMaximumIsReset() {
    final var controller = new ConcurrencyController(settings, ticker);
    for (int i = 1; i <= 4; i++) {
      controller.sample(i * 100, 0.2, 0.2);
    }
    assertEquals(4, controller.state().consecutiveAdjustments());
    assertEquals(8, controller.currentLimit());

    assertEquals(AdjustmentReason.OSCILLATION_GUARD, controller.sample(400, 0.6, 0.6));
    assertEquals(0, controller.state().consecutiveAdjustments());
    assertEquals(8, controller.currentLimit());
  }

  @Test
  void testNonFiniteSampleChangesNothing() {
    final var controller = new ConcurrencyController(settings, ticker);
    controller.sample(100, 0.2, 0.2);

    assertEquals(AdjustmentReason.INVALID_SAMPLE, controller.sample(Double.NaN, 0.2, 0.2));
    assertEquals(AdjustmentReason.INVALID_SAMPLE, controller.sample(500, Double.NaN, 0.2));
    assertEquals(AdjustmentReason.INVALID_SAMPLE, controller.sample(500, 0.2, Double.POSITIVE_INFINITY));
    assertEquals(5, controller.currentLimit());
    assertEquals(1, controller.state().consecutiveAdjustments());
  }

  @Test
  void testOutOfRangeLoadIsClamped() {
    final var controller = new ConcurrencyController(settings, ticker);

    assertEquals(AdjustmentReason.RESOURCE_SHORTAGE, controller.sample(10, 7.0, -3.0));
    assertEquals(AdjustmentReason.HEADROOM, controller.sample(20, -1.0, -1.0));
  }

  @Test
  void testSampleRecordsTime() {
    final var controller = new ConcurrencyController(settings, ticker);
    ticker.advance(Duration.ofSeconds(5));

    controller.sample(1, 0.6, 0.6);

    assertEquals(Duration.ofSeconds(5).toNanos(), controller.state().lastSampleTime());
    assertEquals(1.0, controller.state().lastThroughputSample());
  }

  @Test
  void testRandomSamplesKeepLimitInBoundsAndStepByOne() {
    final Random random = new Random(42);
    final var controller = new ConcurrencyController(settings, ticker);

    for (int i = 0; i < 10_000; i++) {
      final int before = controller.currentLimit();
      final double throughput = random.nextInt(20) == 0 ? Double.NaN : random.nextDouble() * 1_000;
      controller.sample(throughput, random.nextDouble() * 1.2 - 0.1, random.nextDouble() * 1.2 - 0.1);
      final int after = controller.currentLimit();

      assertTrue(after >= settings.minParallelism && after <= settings.maxParallelism, "limit out of bounds");
      assertTrue(Math.abs(after - before) <= 1, "limit changed by more than one");
      assertTrue(controller.state().consecutiveAdjustments() <= 255);
    }
  }
}
