/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.concurrency;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Bounds and thresholds of the {@link ConcurrencyController}. Instances are created through
 * {@link #newBuilder()}.
 */
public final class ConcurrencySettings {

  /** Default threshold above which CPU utilization or memory pressure is a resource shortage. */
  public static final double DEFAULT_HIGH_THRESHOLD = 0.85;

  /** Default threshold below which CPU utilization or memory pressure leaves headroom. */
  public static final double DEFAULT_LOW_THRESHOLD = 0.5;

  /** Default number of consecutive increases after which the controller pauses once. */
  public static final int DEFAULT_MAX_CONSECUTIVE_ADJUSTMENTS = 3;

  public final int minParallelism;

  public final int maxParallelism;

  public final int initialLimit;

  public final double highCpuThreshold;

  public final double highMemoryThreshold;

  public final double lowCpuThreshold;

  public final double lowMemoryThreshold;

  public final int maxConsecutiveAdjustments;

  private ConcurrencySettings(final Builder builder) {
    minParallelism = builder.minParallelism;
    maxParallelism = builder.maxParallelism;
    initialLimit = builder.initialLimit == null
        ? Math.max(minParallelism, Math.min(maxParallelism, maxParallelism / 2))
        : builder.initialLimit;
    highCpuThreshold = builder.highCpuThreshold;
    highMemoryThreshold = builder.highMemoryThreshold;
    lowCpuThreshold = builder.lowCpuThreshold;
    lowMemoryThreshold = builder.lowMemoryThreshold;
    maxConsecutiveAdjustments = builder.maxConsecutiveAdjustments;

    checkArgument(minParallelism >= 1, "minParallelism must be >= 1: %s", minParallelism);
    checkArgument(maxParallelism >= minParallelism, "maxParallelism must be >= minParallelism: %s < %s",
        maxParallelism, minParallelism);
    checkArgument(initialLimit >= minParallelism && initialLimit <= maxParallelism,
        "initialLimit must be within [%s, %s]: %s", minParallelism, maxParallelism, initialLimit);
    checkThresholds("CPU", lowCpuThreshold, highCpuThreshold);
    checkThresholds("memory", lowMemoryThreshold, highMemoryThreshold);
    checkArgument(maxConsecutiveAdjustments >= 0, "maxConsecutiveAdjustments must be >= 0: %s",
        maxConsecutiveAdjustments);
  }

  private static void checkThresholds(final String name, final double low, final double high) {
    checkArgument(low >= 0.0 && low <= 1.0, "Low %s threshold must be within [0, 1]: %s", name, low);
    checkArgument(high >= 0.0 && high <= 1.0, "High %s threshold must be within [0, 1]: %s", name, high);
    checkArgument(low <= high, "Low %s threshold must not exceed the high one: %s > %s", name, low, high);
  }

  /**
   * Get a new builder with defaults derived from the number of available processors.
   *
   * @return a new builder
   */
  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder().minParallelism(minParallelism)
                        .maxParallelism(maxParallelism)
                        .initialLimit(initialLimit)
                        .highCpuThreshold(highCpuThreshold)
                        .highMemoryThreshold(highMemoryThreshold)
                        .lowCpuThreshold(lowCpuThreshold)
                        .lowMemoryThreshold(lowMemoryThreshold)
                        .maxConsecutiveAdjustments(maxConsecutiveAdjustments);
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (!(obj instanceof ConcurrencySettings other)) {
      return false;
    }
    return minParallelism == other.minParallelism && maxParallelism == other.maxParallelism
        && initialLimit == other.initialLimit && highCpuThreshold == other.highCpuThreshold
        && highMemoryThreshold == other.highMemoryThreshold && lowCpuThreshold == other.lowCpuThreshold
        && lowMemoryThreshold == other.lowMemoryThreshold
        && maxConsecutiveAdjustments == other.maxConsecutiveAdjustments;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(minParallelism, maxParallelism, initialLimit, highCpuThreshold, highMemoryThreshold,
        lowCpuThreshold, lowMemoryThreshold, maxConsecutiveAdjustments);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("minParallelism", minParallelism)
                      .add("maxParallelism", maxParallelism)
                      .add("initialLimit", initialLimit)
                      .add("highCpuThreshold", highCpuThreshold)
                      .add("highMemoryThreshold", highMemoryThreshold)
                      .add("lowCpuThreshold", lowCpuThreshold)
                      .add("lowMemoryThreshold", lowMemoryThreshold)
                      .add("maxConsecutiveAdjustments", maxConsecutiveAdjustments)
                      .toString();
  }

  /**
   * Builder for {@link ConcurrencySettings}. Validation happens in {@link #build()}.
   */
  public static final class Builder {
    private int minParallelism = 1;
    private int maxParallelism = Math.max(1, Runtime.getRuntime().availableProcessors());
    private @Nullable Integer initialLimit;
    private double highCpuThreshold = DEFAULT_HIGH_THRESHOLD;
    private double highMemoryThreshold = DEFAULT_HIGH_THRESHOLD;
    private double lowCpuThreshold = DEFAULT_LOW_THRESHOLD;
    private double lowMemoryThreshold = DEFAULT_LOW_THRESHOLD;
    private int maxConsecutiveAdjustments = DEFAULT_MAX_CONSECUTIVE_ADJUSTMENTS;

    private Builder() {
    }

    public Builder minParallelism(final int minParallelism) {
      this.minParallelism = minParallelism;
      return this;
    }

    public Builder maxParallelism(final int maxParallelism) {
      this.maxParallelism = maxParallelism;
      return this;
    }

    /**
     * Set the initial limit. Defaults to half of the maximum, but at least the minimum.
     *
     * @param initialLimit the initial limit
     * @return this builder instance
     */
    public Builder initialLimit(final int initialLimit) {
      this.initialLimit = initialLimit;
      return this;
    }

    public Builder highCpuThreshold(final double highCpuThreshold) {
      this.highCpuThreshold = highCpuThreshold;
      return this;
    }

    public Builder highMemoryThreshold(final double highMemoryThreshold) {
      this.highMemoryThreshold = highMemoryThreshold;
      return this;
    }

    public Builder lowCpuThreshold(final double lowCpuThreshold) {
      this.lowCpuThreshold = lowCpuThreshold;
      return this;
    }

    public Builder lowMemoryThreshold(final double lowMemoryThreshold) {
      this.lowMemoryThreshold = lowMemoryThreshold;
      return this;
    }

    public Builder maxConsecutiveAdjustments(final int maxConsecutiveAdjustments) {
      this.maxConsecutiveAdjustments = maxConsecutiveAdjustments;
      return this;
    }

    /**
     * Build the settings.
     *
     * @return validated settings
     * @throws IllegalArgumentException if bounds or thresholds are inconsistent
     */
    public ConcurrencySettings build() {
      return new ConcurrencySettings(this);
    }
  }
}
