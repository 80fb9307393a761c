/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.concurrency;

/**
 * Outcome of a single {@link ConcurrencyController#sample(double, double, double)} call.
 */
public enum AdjustmentReason {
  /** CPU or memory above the high threshold, the limit was decreased. */
  RESOURCE_SHORTAGE,

  /** Headroom available and throughput improving, the limit was increased. */
  HEADROOM,

  /** Too many consecutive increases, the limit was kept and the counter reset. */
  OSCILLATION_GUARD,

  /** No rule matched, the limit was kept. */
  STEADY,

  /** The sample contained non-finite values, the limit was kept. */
  INVALID_SAMPLE
}
