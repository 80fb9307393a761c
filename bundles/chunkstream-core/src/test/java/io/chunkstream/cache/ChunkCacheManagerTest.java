/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.cache;

import io.chunkstream.exception.ChunkLoadException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

class ChunkCacheManagerTest {

  private static final Duration TTL = Duration.ofSeconds(60);

  private static final ChunkKey A = new ChunkKey(0, 0);
  private static final ChunkKey B = new ChunkKey(1, 0);
  private static final ChunkKey C = new ChunkKey(2, 0);

  private ManualTicker ticker;

  private AtomicInteger loads;

  private ExecutorService pool;

  @BeforeEach
  void setUp() {
    ticker = new ManualTicker();
    loads = new AtomicInteger();
    pool = Executors.newCachedThreadPool();
  }

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  private ChunkCacheManager<String> countingCache(final int capacity) {
    return new ChunkCacheManager<String>(key -> {
      loads.incrementAndGet();
      return "chunk" + key;
    }, capacity, TTL, ticker);
  }

  @Test
  void testHitAfterMiss() throws ChunkLoadException {
    final var cache = countingCache(4);

    assertEquals("chunk(0,0)", cache.get(A));
    assertEquals("chunk(0,0)", cache.get(A));

    assertEquals(1, loads.get());
    final CacheStats stats = cache.stats();
    assertEquals(1, stats.hits());
    assertEquals(1, stats.misses());
    assertEquals(1, stats.size());
    assertEquals(0.5, stats.hitRate(), 1e-9);
  }

  @Test
  void testHitRateWithoutRequestsIsZero() {
    assertEquals(0.0, countingCache(4).stats().hitRate());
  }

  @Test
  void testConcurrentRequestsShareOneLoad() throws Exception {
    final int requesters = 8;
    final CountDownLatch release = new CountDownLatch(1);
    final var cache = new ChunkCacheManager<Object>(key -> {
      loads.incrementAndGet();
      await(release);
      return new Object();
    }, 4, TTL, ticker);

    final List<Future<Object>> results = new ArrayList<>();
    for (int i = 0; i < requesters; i++) {
      results.add(pool.submit(() -> cache.get(A)));
    }
    awaitCondition(() -> cache.stats().misses() == requesters);
    assertEquals(1, cache.stats().inFlight());
    release.countDown();

    final Object first = results.get(0).get(5, TimeUnit.SECONDS);
    for (final Future<Object> result : results) {
      assertSame(first, result.get(5, TimeUnit.SECONDS), "all requesters must receive the same instance");
    }
    assertEquals(1, loads.get());
    assertEquals(0, cache.stats().inFlight());
  }

  @Test
  void testFailureReachesEveryWaiterAndIsNotCached() throws Exception {
    final CountDownLatch release = new CountDownLatch(1);
    final var cache = new ChunkCacheManager<String>(key -> {
      if (loads.incrementAndGet() == 1) {
        await(release);
        throw new ChunkLoadException(key, "storage offline");
      }
      return "recovered";
    }, 4, TTL, ticker);

    final List<Future<String>> results = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      results.add(pool.submit(() -> cache.get(A)));
    }
    awaitCondition(() -> cache.stats().misses() == 3);
    release.countDown();

    for (final Future<String> result : results) {
      final ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
      final ChunkLoadException cause = assertInstanceOf(ChunkLoadException.class, e.getCause());
      assertEquals(A, cause.getKey());
    }
    assertEquals(0, cache.stats().size());
    assertEquals(1, cache.stats().loadFailures());

    assertEquals("recovered", cache.get(A));
    assertEquals(2, loads.get());
  }

  @Test
  void testUncheckedLoaderFailureIsWrapped() {
    final var cache = new ChunkCacheManager<String>(key -> {
      throw new IllegalStateException("generator crashed");
    }, 4, TTL, ticker);

    final ChunkLoadException e = assertThrows(ChunkLoadException.class, () -> cache.get(A));
    assertInstanceOf(IllegalStateException.class, e.getCause());
    assertEquals(0, cache.stats().inFlight());
  }

  @Test
  void testNullFromLoaderIsAFailure() {
    final var cache = new ChunkCacheManager<String>(key -> null, 4, TTL, ticker);

    assertThrows(ChunkLoadException.class, () -> cache.get(A));
    assertEquals(0, cache.stats().size());
  }

  @Test
  void testExpiredEntryIsReloaded() throws ChunkLoadException {
    final var cache = countingCache(4);

    cache.get(A);
    ticker.advance(TTL);
    cache.get(A);
    assertEquals(1, loads.get(), "an entry exactly at its time to live is still fresh");

    ticker.advance(Duration.ofMillis(1));
    assertNull(cache.getIfPresent(A));
    cache.get(A);
    assertEquals(2, loads.get());
    assertEquals(1, cache.stats().evictions());
  }

  @Test
  void testLeastRecentlyUsedIsEvicted() throws ChunkLoadException {
    final var cache = countingCache(2);

    cache.get(A);
    ticker.advance(Duration.ofSeconds(1));
    cache.get(B);
    ticker.advance(Duration.ofSeconds(1));
    cache.get(A);
    ticker.advance(Duration.ofSeconds(1));
    cache.get(C);

    assertEquals(2, cache.stats().size());
    assertEquals("chunk(0,0)", cache.getIfPresent(A));
    assertNull(cache.getIfPresent(B));
    assertEquals("chunk(2,0)", cache.getIfPresent(C));
  }

  @Test
  void testEqualAccessTimesEvictOldestInsertion() throws ChunkLoadException {
    final var cache = countingCache(2);

    cache.get(A);
    cache.get(B);
    cache.get(C);

    assertNull(cache.getIfPresent(A));
    assertEquals("chunk(1,0)", cache.getIfPresent(B));
    assertEquals("chunk(2,0)", cache.getIfPresent(C));
  }

  @Test
  void testTouchAtSameTimestampKeepsInsertionTieBreak() throws ChunkLoadException {
    final var cache = countingCache(2);

    cache.get(A);
    cache.get(B);
    cache.get(A);
    cache.get(C);

    assertNull(cache.getIfPresent(A));
    assertEquals("chunk(1,0)", cache.getIfPresent(B));
  }

  @Test
  void testPinnedEntriesSurviveEviction() throws ChunkLoadException {
    final var cache = countingCache(2);

    cache.pin(A);
    cache.get(A);
    ticker.advance(Duration.ofSeconds(1));
    cache.get(B);
    ticker.advance(Duration.ofSeconds(1));
    cache.get(C);

    assertEquals("chunk(0,0)", cache.getIfPresent(A));
    assertNull(cache.getIfPresent(B));
    assertEquals(1, cache.evictLru(0), "only the unpinned entry is evicted");
    assertEquals(0, cache.evictExpired(Duration.ZERO));
    assertEquals(1, cache.stats().size());

    cache.unpin(A);
    assertEquals(0, cache.pinnedKeys());
    assertEquals(1, cache.evictLru(0));
  }

  @Test
  void testReleasedPinsLetNextInsertRestoreCapacity() throws ChunkLoadException {
    final var cache = countingCache(1);

    cache.pin(A);
    cache.pin(B);
    cache.get(A);
    cache.get(B);
    assertEquals(2, cache.stats().size());

    cache.unpin(A);
    cache.unpin(B);
    assertEquals(2, cache.stats().size());

    ticker.advance(Duration.ofSeconds(1));
    cache.get(C);
    assertEquals(1, cache.stats().size());
    assertEquals("chunk(2,0)", cache.getIfPresent(C));
  }

  @Test
  void testPinsAreCounted() {
    final var cache = countingCache(1);

    cache.pin(A);
    cache.pin(A);
    cache.unpin(A);
    assertEquals(1, cache.pinnedKeys());
    cache.unpin(A);
    assertEquals(0, cache.pinnedKeys());
    assertThrows(IllegalStateException.class, () -> cache.unpin(A));
  }

  @Test
  void testInvalidateDuringLoadDoesNotCacheResult() throws Exception {
    final CountDownLatch started = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final var cache = new ChunkCacheManager<String>(key -> {
      if (loads.incrementAndGet() == 1) {
        started.countDown();
        await(release);
        return "stale";
      }
      return "fresh";
    }, 4, TTL, ticker);

    final Future<String> waiter = pool.submit(() -> cache.get(A));
    assertTrue(started.await(5, TimeUnit.SECONDS));
    cache.invalidate(A);
    assertEquals(0, cache.stats().inFlight());
    release.countDown();

    assertEquals("stale", waiter.get(5, TimeUnit.SECONDS), "the waiter still receives the loaded value");
    assertNull(cache.getIfPresent(A));
    assertEquals("fresh", cache.get(A));
    assertEquals(2, loads.get());
  }

  @Test
  void testPutDuringLoadWins() throws Exception {
    final CountDownLatch started = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final var cache = new ChunkCacheManager<String>(key -> {
      started.countDown();
      await(release);
      return "loaded";
    }, 4, TTL, ticker);

    final Future<String> waiter = pool.submit(() -> cache.get(A));
    assertTrue(started.await(5, TimeUnit.SECONDS));
    cache.put(A, "written");
    release.countDown();

    assertEquals("loaded", waiter.get(5, TimeUnit.SECONDS));
    assertEquals("written", cache.getIfPresent(A));
  }

  @Test
  void testPutRespectsCapacity() {
    final var cache = countingCache(2);

    cache.put(A, "a");
    ticker.advance(Duration.ofSeconds(1));
    cache.put(B, "b");
    ticker.advance(Duration.ofSeconds(1));
    cache.put(C, "c");

    assertEquals(2, cache.stats().size());
    assertNull(cache.getIfPresent(A));
    assertEquals(0, loads.get());
  }

  @Test
  void testEvictExpiredAndLru() throws ChunkLoadException {
    final var cache = countingCache(8);

    cache.get(A);
    ticker.advance(Duration.ofSeconds(10));
    cache.get(B);
    cache.get(C);

    assertEquals(1, cache.evictExpired(Duration.ofSeconds(5)));
    assertNull(cache.getIfPresent(A));
    assertEquals(1, cache.evictLru(1));
    assertEquals(1, cache.stats().size());
    assertEquals(0, cache.evictLru(1));
    assertEquals(2, cache.stats().evictions());
  }

  @Test
  void testClearDetachesRunningLoads() throws Exception {
    final CountDownLatch started = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final var cache = new ChunkCacheManager<String>(key -> {
      started.countDown();
      await(release);
      return "loaded";
    }, 4, TTL, ticker);
    cache.put(B, "b");

    final Future<String> waiter = pool.submit(() -> cache.get(A));
    assertTrue(started.await(5, TimeUnit.SECONDS));
    cache.clear();
    release.countDown();

    assertEquals("loaded", waiter.get(5, TimeUnit.SECONDS));
    assertEquals(0, cache.stats().size());
  }

  @Test
  void testInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> countingCache(0));
    assertThrows(IllegalArgumentException.class,
        () -> new ChunkCacheManager<>(key -> "x", 1, Duration.ofSeconds(-1), ticker));
    final var cache = countingCache(1);
    assertThrows(NullPointerException.class, () -> cache.put(A, null));
    assertThrows(IllegalArgumentException.class, () -> cache.evictLru(-1));
  }

  private static void await(final CountDownLatch latch) {
    try {
      if (!latch.await(5, TimeUnit.SECONDS)) {
        throw new IllegalStateException("latch not released");
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }

  static void awaitCondition(final BooleanSupplier condition) throws InterruptedException {
    final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        fail("condition not reached in time");
      }
      Thread.sleep(5);
    }
  }
}
