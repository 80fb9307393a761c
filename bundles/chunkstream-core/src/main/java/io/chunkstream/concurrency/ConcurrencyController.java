/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.concurrency;

import com.github.benmanes.caffeine.cache.Ticker;
import com.google.common.base.MoreObjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

import static java.util.Objects.requireNonNull;

/**
 * Maintains the shared parallelism budget and adapts it to system pressure and throughput trend.
 * <p>
 * Adjustment policy, first match wins:
 * <ol>
 *   <li>CPU or memory above the high threshold: decrease by one, reset the counter.</li>
 *   <li>CPU and memory below the low thresholds and throughput rising: increase by one, count.</li>
 *   <li>Counter above the maximum: keep the limit, reset the counter.</li>
 *   <li>Otherwise keep the limit.</li>
 * </ol>
 * The limit never leaves {@code [minParallelism, maxParallelism]} and changes by at most one per
 * sample.
 * <p>
 * <b>Thread Safety:</b> {@link #sample} is the single writer and is serialized, readers never
 * block.
 */
public final class ConcurrencyController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConcurrencyController.class);

  private final ConcurrencySettings settings;

  private final Ticker ticker;

  private final AtomicReference<ConcurrencyState> state;

  public ConcurrencyController(final ConcurrencySettings settings) {
    this(settings, Ticker.systemTicker());
  }

  public ConcurrencyController(final ConcurrencySettings settings, final Ticker ticker) {
    this.settings = requireNonNull(settings);
    this.ticker = requireNonNull(ticker);
    this.state = new AtomicReference<>(ConcurrencyState.initial(settings.initialLimit, ticker.read()));
    LOGGER.info("Created ConcurrencyController ({})", settings);
  }

  /**
   * Get the current parallelism budget without blocking.
   *
   * @return the current limit
   */
  public int currentLimit() {
    return state.get().currentLimit();
  }

  public ConcurrencyState state() {
    return state.get();
  }

  public ConcurrencySettings settings() {
    return settings;
  }

  /**
   * Apply the adjustment policy to one observation.
   *
   * @param observedThroughput processed work per second since the previous sample
   * @param cpuUtilization CPU utilization in [0, 1], values outside are clamped
   * @param memoryPressure memory pressure in [0, 1], values outside are clamped
   * @return the rule which was applied
   */
  public synchronized AdjustmentReason sample(final double observedThroughput, final double cpuUtilization,
      final double memoryPressure) {
    final ConcurrencyState current = state.get();
    final long now = ticker.read();
    final double throughput = Double.isFinite(observedThroughput)
        ? Math.max(0.0, observedThroughput)
        : current.lastThroughputSample();

    if (!Double.isFinite(observedThroughput) || !Double.isFinite(cpuUtilization)
        || !Double.isFinite(memoryPressure)) {
      state.set(new ConcurrencyState(current.currentLimit(), throughput, current.consecutiveAdjustments(), now));
      LOGGER.debug("Ignoring non-finite sample (throughput={}, cpu={}, memory={})", observedThroughput,
          cpuUtilization, memoryPressure);
      return AdjustmentReason.INVALID_SAMPLE;
    }

    final double cpu = clampUnit(cpuUtilization);
    final double memory = clampUnit(memoryPressure);
    int limit = current.currentLimit();
    int consecutive = current.consecutiveAdjustments();
    final AdjustmentReason reason;

    if (cpu > settings.highCpuThreshold || memory > settings.highMemoryThreshold) {
      limit = Math.max(settings.minParallelism, limit - 1);
      consecutive = 0;
      reason = AdjustmentReason.RESOURCE_SHORTAGE;
    } else if (cpu < settings.lowCpuThreshold && memory < settings.lowMemoryThreshold
        && throughput > current.lastThroughputSample()) {
      limit = Math.min(settings.maxParallelism, limit + 1);
      consecutive = Math.min(ConcurrencyState.MAX_CONSECUTIVE_COUNT, consecutive + 1);
      reason = AdjustmentReason.HEADROOM;
    } else if (consecutive > settings.maxConsecutiveAdjustments) {
      consecutive = 0;
      reason = AdjustmentReason.OSCILLATION_GUARD;
    } else {
      reason = AdjustmentReason.STEADY;
    }

    state.set(new ConcurrencyState(limit, throughput, consecutive, now));

    if (limit != current.currentLimit()) {
      LOGGER.debug("Concurrency limit {} -> {} ({}, cpu={}, memory={}, throughput={})", current.currentLimit(), limit,
          reason, cpu, memory, throughput);
    }
    return reason;
  }

  private static double clampUnit(final double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("state", state.get()).add("settings", settings).toString();
  }
}
