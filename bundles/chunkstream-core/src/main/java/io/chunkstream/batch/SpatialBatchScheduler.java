/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.batch;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.util.concurrent.Striped;
import io.chunkstream.cache.ChunkCache;
import io.chunkstream.cache.ChunkKey;
import io.chunkstream.concurrency.ConcurrencyController;
import io.chunkstream.exception.BatchException;
import io.chunkstream.exception.ChunkLoadException;
import io.chunkstream.settings.DiagnosticSettings;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.Lock;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Groups update requests by chunk and applies each group against the chunk cache, with
 * parallelism bounded by the {@link ConcurrencyController}.
 * <p>
 * A pass works as follows:
 * <ol>
 *   <li>partition the requests by target chunk, keeping submission order per chunk,</li>
 *   <li>read the parallelism budget once for the whole pass,</li>
 *   <li>let {@code min(budget, groups)} workers pull groups: load the chunk, apply the group to a
 *   copy, write the copy back,</li>
 *   <li>queue neighbor notifications and lighting updates of applied block requests for the next
 *   pass ({@link #flushDerived()}).</li>
 * </ol>
 * A failing group does not abort the others; the pass only fails if no group could be applied.
 * <p>
 * <b>Write-back:</b> a group's copy is written with a single {@link ChunkCache#put}, so either the
 * whole group is visible or nothing. Read-modify-write of the same chunk by concurrent passes is
 * serialized with a striped lock. A chunk is pinned in the cache from its load until the pass
 * returns, so chunks loaded or written later in the same pass cannot evict it even if the pass
 * touches more chunks than the cache holds.
 *
 * @param <V> the chunk value type
 */
public final class SpatialBatchScheduler<V> {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpatialBatchScheduler.class);

  /** Default cap of derived passes run by {@link #settle(List)}. */
  public static final int DEFAULT_MAX_DERIVED_PASSES = 4;

  private final ChunkCache<V> cache;

  private final ConcurrencyController controller;

  private final UpdateApplier<V> applier;

  private final LightPolicy lightPolicy;

  private final ExecutorService executor;

  private final int maxDerivedPasses;

  private final Striped<Lock> chunkLocks = Striped.lock(64);

  private final Queue<UpdateRequest> derivedRequests = new ConcurrentLinkedQueue<>();

  private final LongAdder appliedRequests = new LongAdder();

  /**
   * Constructor.
   *
   * @param cache the chunk cache to read and write
   * @param controller source of the parallelism budget
   * @param applier applies requests to chunk copies
   * @param lightPolicy decides which block placements need a lighting update
   * @param executor runs the group workers, must be able to run at least the maximum parallelism
   *        concurrently
   * @param maxDerivedPasses cap of derived passes in {@link #settle(List)}
   */
  public SpatialBatchScheduler(final ChunkCache<V> cache, final ConcurrencyController controller,
      final UpdateApplier<V> applier, final LightPolicy lightPolicy, final ExecutorService executor,
      @NonNegative final int maxDerivedPasses) {
    checkArgument(maxDerivedPasses >= 0, "maxDerivedPasses must not be negative: %s", maxDerivedPasses);
    this.cache = requireNonNull(cache);
    this.controller = requireNonNull(controller);
    this.applier = requireNonNull(applier);
    this.lightPolicy = requireNonNull(lightPolicy);
    this.executor = requireNonNull(executor);
    this.maxDerivedPasses = maxDerivedPasses;
  }

  /**
   * Apply the given requests.
   *
   * @param requests the requests, applied in order per chunk
   * @return summary of applied groups and per-group failures
   * @throws BatchException if every group failed or the calling thread was interrupted
   */
  public ApplySummary submit(final List<UpdateRequest> requests) throws BatchException {
    requireNonNull(requests);
    return runPass(requests, "submit");
  }

  /**
   * Apply all derived requests queued by previous passes.
   *
   * @return summary of the derived pass
   * @throws BatchException if every group failed or the calling thread was interrupted
   */
  public ApplySummary flushDerived() throws BatchException {
    final List<UpdateRequest> requests = new ArrayList<>();
    UpdateRequest request;
    while ((request = derivedRequests.poll()) != null) {
      requests.add(request);
    }
    return runPass(requests, "derived");
  }

  /**
   * Submit the requests and flush derived requests until none remain or the pass cap is reached.
   * Failures of derived passes are reported in the summary, the primary submission already took
   * effect.
   *
   * @param requests the requests
   * @return merged summary of all passes
   * @throws BatchException if every group of the primary submission failed or the calling thread
   *         was interrupted
   */
  public ApplySummary settle(final List<UpdateRequest> requests) throws BatchException {
    ApplySummary summary = submit(requests);
    for (int pass = 0; pass < maxDerivedPasses && !derivedRequests.isEmpty(); pass++) {
      try {
        summary = summary.merge(flushDerived());
      } catch (final BatchException e) {
        if (e.getReason() != BatchException.Reason.ALL_GROUPS_FAILED) {
          throw e;
        }
        summary = summary.merge(new ApplySummary(0, 0, 0, e.getGroupFailures()));
      }
    }
    if (!derivedRequests.isEmpty()) {
      LOGGER.debug("Derived pass cap {} reached, {} requests stay queued", maxDerivedPasses, derivedRequests.size());
    }
    return summary;
  }

  /**
   * Get the number of derived requests waiting for {@link #flushDerived()}.
   *
   * @return the number of queued requests
   */
  public int pendingDerivedRequests() {
    return derivedRequests.size();
  }

  /**
   * Get the total number of requests applied so far, usable as throughput counter.
   *
   * @return the number of applied requests
   */
  public long appliedRequests() {
    return appliedRequests.sum();
  }

  private ApplySummary runPass(final List<UpdateRequest> requests, final String passName) throws BatchException {
    if (requests.isEmpty()) {
      return ApplySummary.empty();
    }
    final Stopwatch stopwatch = Stopwatch.createStarted();

    final ListMultimap<ChunkKey, UpdateRequest> groups = ArrayListMultimap.create();
    for (final UpdateRequest request : requests) {
      groups.put(request.chunkKey(), request);
    }
    final Queue<UpdateBatch> pending = new ConcurrentLinkedQueue<>();
    for (final ChunkKey key : groups.keySet()) {
      pending.add(new UpdateBatch(key, groups.get(key)));
    }

    final int groupCount = pending.size();
    final int workers = Math.min(controller.currentLimit(), groupCount);
    final Queue<GroupResult> results = new ConcurrentLinkedQueue<>();
    final WrittenChunks written = new WrittenChunks();
    final List<Future<?>> futures = new ArrayList<>(workers);
    try {
      for (int i = 0; i < workers; i++) {
        futures.add(executor.submit(() -> drain(pending, results, written)));
      }
      awaitWorkers(futures, passName);
    } finally {
      written.release();
    }

    int chunksTouched = 0;
    int requestsApplied = 0;
    int derivedQueued = 0;
    final List<BatchException> failures = new ArrayList<>();
    for (final GroupResult result : results) {
      if (result.failure() != null) {
        failures.add(result.failure());
      } else {
        chunksTouched++;
        requestsApplied += result.applied();
        derivedQueued += result.derived();
      }
    }
    appliedRequests.add(requestsApplied);

    LOGGER.debug("{} pass: {} requests in {} groups, {} workers, {} applied, {} failed, {} derived in {}", passName,
        requests.size(), groupCount, workers, requestsApplied, failures.size(), derivedQueued, stopwatch);

    if (chunksTouched == 0) {
      throw BatchException.allGroupsFailed(failures);
    }
    return new ApplySummary(chunksTouched, requestsApplied, derivedQueued, failures);
  }

  private static void awaitWorkers(final List<Future<?>> futures, final String passName) throws BatchException {
    try {
      for (final Future<?> future : futures) {
        future.get();
      }
    } catch (final InterruptedException e) {
      futures.forEach(future -> future.cancel(true));
      Thread.currentThread().interrupt();
      LOGGER.warn("{} pass interrupted, unfinished groups abandoned", passName);
      throw BatchException.interrupted(e);
    } catch (final ExecutionException e) {
      futures.forEach(future -> future.cancel(true));
      throw new IllegalStateException("Batch worker failed", e.getCause());
    }
  }

  private void drain(final Queue<UpdateBatch> pending, final Queue<GroupResult> results,
      final WrittenChunks written) {
    UpdateBatch batch;
    while (!Thread.currentThread().isInterrupted() && (batch = pending.poll()) != null) {
      final GroupResult result = applyGroup(batch, written);
      if (result != null) {
        results.add(result);
      }
    }
  }

  /**
   * Apply a group to a copy of its chunk and write the copy back. The chunk stays pinned after a
   * successful write-back until the pass releases {@code written}.
   *
   * @return the result, or {@code null} if the group was abandoned because of an interrupt
   */
  private @Nullable GroupResult applyGroup(final UpdateBatch batch, final WrittenChunks written) {
    final ChunkKey key = batch.key();
    final Lock lock = chunkLocks.get(key);
    try {
      lock.lockInterruptibly();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return null;
    }
    cache.pin(key);
    boolean pinHandedOver = false;
    try {
      final V chunk = cache.get(key);
      final V copy = applier.copy(chunk);
      for (final UpdateRequest request : batch.requests()) {
        applier.apply(copy, request);
      }
      if (Thread.currentThread().isInterrupted()) {
        LOGGER.warn("Abandoning write-back of chunk {}", key);
        return null;
      }
      cache.put(key, copy);
      pinHandedOver = true;
      written.add(key);

      final int derived = deriveRequests(batch);
      if (DiagnosticSettings.isSchedulerDebugEnabled()) {
        LOGGER.debug("Applied {} requests to chunk {}, derived {}", batch.size(), key, derived);
      }
      return new GroupResult(batch.size(), derived, null);
    } catch (final ChunkLoadException | RuntimeException e) {
      LOGGER.warn("Chunk {} unavailable: {}", key, e.getMessage());
      return new GroupResult(0, 0, BatchException.chunkUnavailable(key, e));
    } finally {
      if (!pinHandedOver) {
        cache.unpin(key);
      }
      lock.unlock();
    }
  }

  private int deriveRequests(final UpdateBatch batch) {
    int derived = 0;
    for (final UpdateRequest request : batch.requests()) {
      if (request.type() != UpdateType.BLOCK) {
        continue;
      }
      for (final BlockPosition neighbor : request.position().neighbors()) {
        derivedRequests.add(UpdateRequest.physics(neighbor));
        derived++;
      }
      final var block = (UpdatePayload.Block) request.payload();
      if (lightPolicy.affectsLight(block.blockId())) {
        derivedRequests.add(UpdateRequest.lighting(request.position()));
        derived++;
      }
    }
    return derived;
  }

  /**
   * Chunks written by one pass. Their pins are released when the pass returns; a worker finishing
   * after that, as it may after an interrupt, releases its own pin.
   */
  private final class WrittenChunks {

    private final List<ChunkKey> keys = new ArrayList<>();

    private boolean released;

    synchronized void add(final ChunkKey key) {
      if (released) {
        cache.unpin(key);
      } else {
        keys.add(key);
      }
    }

    synchronized void release() {
      released = true;
      keys.forEach(cache::unpin);
      keys.clear();
    }
  }

  private record GroupResult(int applied, int derived, @Nullable BatchException failure) {
  }
}
