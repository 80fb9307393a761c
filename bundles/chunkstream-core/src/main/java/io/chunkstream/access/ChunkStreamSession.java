/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.access;

import com.github.benmanes.caffeine.cache.Ticker;
import com.google.common.base.MoreObjects;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.chunkstream.batch.ApplySummary;
import io.chunkstream.batch.LightPolicy;
import io.chunkstream.batch.SpatialBatchScheduler;
import io.chunkstream.batch.UpdateApplier;
import io.chunkstream.batch.UpdateRequest;
import io.chunkstream.cache.CacheMaintenance;
import io.chunkstream.cache.CacheStats;
import io.chunkstream.cache.ChunkCacheManager;
import io.chunkstream.cache.ChunkKey;
import io.chunkstream.cache.ChunkLoader;
import io.chunkstream.cache.ChunkPrefetcher;
import io.chunkstream.concurrency.ConcurrencyController;
import io.chunkstream.concurrency.ConcurrencySampler;
import io.chunkstream.concurrency.ConcurrencyState;
import io.chunkstream.concurrency.SystemMetricsSource;
import io.chunkstream.exception.BatchException;
import io.chunkstream.exception.ChunkLoadException;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Entry point for consumers of chunk data. A session owns a chunk cache, the concurrency
 * controller, the batch scheduler and the thread pools running them:
 * <ul>
 *   <li>a cached worker pool for group workers and prefetch loads,</li>
 *   <li>a single background thread running cache maintenance and concurrency sampling with fixed
 *   delays.</li>
 * </ul>
 * Sessions are created through {@link ChunkStreams} and must be closed to stop the threads. All
 * operations of a closed session throw an {@link IllegalStateException}.
 *
 * @param <V> the chunk value type
 */
public final class ChunkStreamSession<V> implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkStreamSession.class);

  private final ChunkStreamConfiguration configuration;

  private final ChunkCacheManager<V> cache;

  private final ConcurrencyController controller;

  private final SpatialBatchScheduler<V> scheduler;

  private final ChunkPrefetcher prefetcher;

  private final ExecutorService workerPool;

  private final ScheduledExecutorService backgroundPool;

  private volatile boolean closed;

  ChunkStreamSession(final ChunkStreamConfiguration configuration, final ChunkLoader<V> loader,
      final UpdateApplier<V> applier, final LightPolicy lightPolicy, final SystemMetricsSource metricsSource,
      final Ticker ticker) {
    this.configuration = requireNonNull(configuration);
    requireNonNull(metricsSource);

    cache = new ChunkCacheManager<>(loader, configuration.getCacheCapacity(), configuration.getEntryTtl(), ticker);
    controller = new ConcurrencyController(configuration.getConcurrencySettings(), ticker);
    final CacheMaintenance maintenance = new CacheMaintenance(cache);

    workerPool = Executors.newCachedThreadPool(
        new ThreadFactoryBuilder().setNameFormat("chunkstream-worker-%d").setDaemon(true).build());
    backgroundPool = Executors.newSingleThreadScheduledExecutor(
        new ThreadFactoryBuilder().setNameFormat("chunkstream-background-%d").setDaemon(true).build());
    try {
      scheduler = new SpatialBatchScheduler<>(cache, controller, applier, lightPolicy, workerPool,
          configuration.getMaxDerivedPasses());
      prefetcher = new ChunkPrefetcher(cache, workerPool, controller::currentLimit);

      schedule(maintenance, configuration.getMaintenanceInterval());
      schedule(new ConcurrencySampler(controller, metricsSource, scheduler::appliedRequests, ticker),
          configuration.getSamplingInterval());
    } catch (final RuntimeException e) {
      backgroundPool.shutdownNow();
      workerPool.shutdownNow();
      throw e;
    }

    LOGGER.info("Opened chunk stream session: {}", configuration);
  }

  private void schedule(final Runnable task, final Duration interval) {
    final long nanos = toNanos(interval);
    backgroundPool.scheduleWithFixedDelay(task, nanos, nanos, TimeUnit.NANOSECONDS);
  }

  private static long toNanos(final Duration duration) {
    try {
      return duration.toNanos();
    } catch (final ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  private void assertNotClosed() {
    checkState(!closed, "Chunk stream session is already closed.");
  }

  /**
   * Get a chunk, loading it if it is not cached. Concurrent calls for the same chunk share one
   * load.
   *
   * @param key the chunk key
   * @return the chunk
   * @throws ChunkLoadException if the chunk could not be loaded
   */
  public V get(final ChunkKey key) throws ChunkLoadException {
    assertNotClosed();
    return cache.get(key);
  }

  public @Nullable V getIfPresent(final ChunkKey key) {
    assertNotClosed();
    return cache.getIfPresent(key);
  }

  public void put(final ChunkKey key, final V chunk) {
    assertNotClosed();
    cache.put(key, chunk);
  }

  public void invalidate(final ChunkKey key) {
    assertNotClosed();
    cache.invalidate(key);
  }

  /**
   * Apply update requests, see {@link SpatialBatchScheduler#submit(List)}.
   *
   * @param requests the requests
   * @return the summary
   * @throws BatchException if every group failed or the calling thread was interrupted
   */
  public ApplySummary submit(final List<UpdateRequest> requests) throws BatchException {
    assertNotClosed();
    return scheduler.submit(requests);
  }

  public ApplySummary flushDerived() throws BatchException {
    assertNotClosed();
    return scheduler.flushDerived();
  }

  /**
   * Apply update requests and their derived requests, see {@link SpatialBatchScheduler#settle(List)}.
   *
   * @param requests the requests
   * @return the merged summary
   * @throws BatchException if every group of the submission failed or the calling thread was
   *         interrupted
   */
  public ApplySummary settle(final List<UpdateRequest> requests) throws BatchException {
    assertNotClosed();
    return scheduler.settle(requests);
  }

  public int pendingDerivedRequests() {
    assertNotClosed();
    return scheduler.pendingDerivedRequests();
  }

  /**
   * Warm the cache around a center with the configured prefetch radius.
   *
   * @param center the center chunk
   * @return future with the number of cached chunks around the center
   */
  public CompletableFuture<Integer> prefetch(final ChunkKey center) {
    return prefetch(center, configuration.getPrefetchRadius());
  }

  public CompletableFuture<Integer> prefetch(final ChunkKey center, @NonNegative final int radius) {
    assertNotClosed();
    return prefetcher.prefetch(center, radius);
  }

  public CacheStats stats() {
    assertNotClosed();
    return cache.stats();
  }

  public ConcurrencyState concurrencyState() {
    assertNotClosed();
    return controller.state();
  }

  public ChunkStreamConfiguration getConfiguration() {
    return configuration;
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;

    backgroundPool.shutdown();
    workerPool.shutdown();
    try {
      if (!backgroundPool.awaitTermination(5, TimeUnit.SECONDS)) {
        LOGGER.warn("Background tasks did not terminate in time.");
        backgroundPool.shutdownNow();
      }
      if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
        LOGGER.warn("Chunk workers did not terminate in time.");
        workerPool.shutdownNow();
      }
    } catch (final InterruptedException e) {
      backgroundPool.shutdownNow();
      workerPool.shutdownNow();
      Thread.currentThread().interrupt();
    }
    cache.clear();

    LOGGER.info("Closed chunk stream session, final cache statistics: {}", cache.stats());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("closed", closed)
                      .add("cache", cache)
                      .add("controller", controller)
                      .toString();
  }
}
