/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.concurrency;

import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

import static java.util.Objects.requireNonNull;

/**
 * Periodic driver of the {@link ConcurrencyController}. Each run derives the throughput from a
 * monotonically growing work counter, takes a system load sample and feeds both into the
 * controller. Meant to be scheduled with a fixed delay; a failing run is logged and does not
 * cancel the schedule.
 */
public final class ConcurrencySampler implements Runnable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConcurrencySampler.class);

  private final ConcurrencyController controller;

  private final SystemMetricsSource metricsSource;

  private final LongSupplier processedCounter;

  private final Ticker ticker;

  /** Only accessed by the sampling thread. */
  private long lastCount;

  private long lastTime;

  private MemoryPressureLevel lastLevel = MemoryPressureLevel.NONE;

  /**
   * Constructor.
   *
   * @param controller the controller to feed
   * @param metricsSource source of CPU and memory observations
   * @param processedCounter total amount of processed work, for instance applied update requests
   * @param ticker time source
   */
  public ConcurrencySampler(final ConcurrencyController controller, final SystemMetricsSource metricsSource,
      final LongSupplier processedCounter, final Ticker ticker) {
    this.controller = requireNonNull(controller);
    this.metricsSource = requireNonNull(metricsSource);
    this.processedCounter = requireNonNull(processedCounter);
    this.ticker = requireNonNull(ticker);
    this.lastCount = processedCounter.getAsLong();
    this.lastTime = ticker.read();
  }

  @Override
  public void run() {
    try {
      final long now = ticker.read();
      final long count = processedCounter.getAsLong();
      final long elapsedNanos = now - lastTime;
      final double throughput = elapsedNanos > 0
          ? (count - lastCount) / (elapsedNanos / (double) TimeUnit.SECONDS.toNanos(1))
          : 0.0;
      lastCount = count;
      lastTime = now;

      final SystemLoad load = metricsSource.sample();
      final MemoryPressureLevel level = load.memoryPressureLevel();
      if (level != lastLevel) {
        if (level.compareTo(MemoryPressureLevel.HIGH) >= 0) {
          LOGGER.warn("Memory pressure {} ({})", level, load.memoryPressure());
        } else {
          LOGGER.debug("Memory pressure {} ({})", level, load.memoryPressure());
        }
        lastLevel = level;
      }

      controller.sample(throughput, load.cpuUtilization(), load.memoryPressure());
    } catch (final Exception e) {
      LOGGER.error("Concurrency sampling failed", e);
    }
  }
}
