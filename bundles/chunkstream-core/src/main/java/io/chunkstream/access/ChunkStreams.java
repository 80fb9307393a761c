/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.access;

import com.github.benmanes.caffeine.cache.Ticker;
import io.chunkstream.batch.LightPolicy;
import io.chunkstream.batch.UpdateApplier;
import io.chunkstream.cache.ChunkLoader;
import io.chunkstream.chunk.Blocks;
import io.chunkstream.chunk.ChunkData;
import io.chunkstream.chunk.ChunkDataUpdateApplier;
import io.chunkstream.concurrency.JvmSystemMetricsSource;
import io.chunkstream.concurrency.SystemMetricsSource;

/**
 * Utility methods for opening {@link ChunkStreamSession}s.
 */
public final class ChunkStreams {

  private ChunkStreams() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Open a session for {@link ChunkData} chunks.
   *
   * @param configuration the configuration
   * @param loader loads chunks which are not cached, for instance from storage or a generator
   * @return the session, which must be closed
   */
  public static ChunkStreamSession<ChunkData> open(final ChunkStreamConfiguration configuration,
      final ChunkLoader<ChunkData> loader) {
    return open(configuration, loader, ChunkDataUpdateApplier.INSTANCE, Blocks.LIGHT_POLICY);
  }

  /**
   * Open a session for a custom chunk type, sampling the JVM for CPU and memory load.
   *
   * @param configuration the configuration
   * @param loader loads chunks which are not cached
   * @param applier applies update requests to chunk copies
   * @param lightPolicy decides which block placements require a lighting update
   * @param <V> the chunk value type
   * @return the session, which must be closed
   */
  public static <V> ChunkStreamSession<V> open(final ChunkStreamConfiguration configuration,
      final ChunkLoader<V> loader, final UpdateApplier<V> applier, final LightPolicy lightPolicy) {
    return open(configuration, loader, applier, lightPolicy, new JvmSystemMetricsSource(), Ticker.systemTicker());
  }

  public static <V> ChunkStreamSession<V> open(final ChunkStreamConfiguration configuration,
      final ChunkLoader<V> loader, final UpdateApplier<V> applier, final LightPolicy lightPolicy,
      final SystemMetricsSource metricsSource, final Ticker ticker) {
    return new ChunkStreamSession<>(configuration, loader, applier, lightPolicy, metricsSource, ticker);
  }
}
