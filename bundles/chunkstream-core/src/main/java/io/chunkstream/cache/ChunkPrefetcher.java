/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.cache;

import com.google.common.collect.ImmutableList;
import io.chunkstream.exception.ChunkLoadException;
import org.checkerframework.checker.index.qual.NonNegative;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntSupplier;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Warms the cache with the chunks around a center, nearest first.
 */
public final class ChunkPrefetcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkPrefetcher.class);

  private final ChunkCache<?> cache;

  private final Executor executor;

  private final IntSupplier parallelism;

  /**
   * Constructor.
   *
   * @param cache the cache to warm
   * @param executor runs the loads
   * @param parallelism current parallelism budget, read once per prefetch
   */
  public ChunkPrefetcher(final ChunkCache<?> cache, final Executor executor, final IntSupplier parallelism) {
    this.cache = requireNonNull(cache);
    this.executor = requireNonNull(executor);
    this.parallelism = requireNonNull(parallelism);
  }

  /**
   * Get all keys within the given euclidean distance of the center, sorted by distance. Keys with
   * equal distance are ordered by x, then z.
   *
   * @param center the center chunk
   * @param radius the radius in chunks
   * @return the keys, the center first
   */
  public static List<ChunkKey> prefetchOrder(final ChunkKey center, @NonNegative final int radius) {
    requireNonNull(center);
    checkArgument(radius >= 0, "Radius must not be negative: %s", radius);
    final long radiusSquared = (long) radius * radius;
    final List<ChunkKey> keys = new ArrayList<>();
    for (int dx = -radius; dx <= radius; dx++) {
      for (int dz = -radius; dz <= radius; dz++) {
        if ((long) dx * dx + (long) dz * dz <= radiusSquared) {
          keys.add(center.offset(dx, dz));
        }
      }
    }
    keys.sort(Comparator.<ChunkKey>comparingLong(key -> key.distanceSquared(center))
                        .thenComparingInt(ChunkKey::x)
                        .thenComparingInt(ChunkKey::z));
    return ImmutableList.copyOf(keys);
  }

  /**
   * Load all chunks around the center which are not cached yet.
   *
   * @param center the center chunk
   * @param radius the radius in chunks
   * @return future with the number of chunks which are cached after the prefetch
   */
  public CompletableFuture<Integer> prefetch(final ChunkKey center, @NonNegative final int radius) {
    final var pending = new ConcurrentLinkedQueue<>(prefetchOrder(center, radius));
    final int workers = Math.max(1, Math.min(parallelism.getAsInt(), pending.size()));
    final var warmed = new AtomicInteger();
    final var tasks = new ArrayList<CompletableFuture<Void>>(workers);

    for (int i = 0; i < workers; i++) {
      tasks.add(CompletableFuture.runAsync(() -> {
        ChunkKey key;
        while ((key = pending.poll()) != null) {
          if (cache.getIfPresent(key) != null) {
            warmed.incrementAndGet();
            continue;
          }
          try {
            cache.get(key);
            warmed.incrementAndGet();
          } catch (final ChunkLoadException e) {
            LOGGER.debug("Prefetch of chunk {} failed: {}", key, e.getMessage());
          }
        }
      }, executor));
    }

    return CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new)).thenApply(ignored -> {
      LOGGER.debug("Prefetched {} chunks around {} (radius={})", warmed.get(), center, radius);
      return warmed.get();
    });
  }
}
