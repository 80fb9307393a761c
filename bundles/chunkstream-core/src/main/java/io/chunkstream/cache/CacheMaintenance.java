/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.cache;

import io.chunkstream.settings.DiagnosticSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

import static java.util.Objects.requireNonNull;

/**
 * Background maintenance of a {@link ChunkCacheManager}: removes expired entries and restores the
 * capacity bound. Meant to be scheduled with a fixed delay; a failing run is logged and does not
 * cancel the schedule.
 *
 * @see ChunkCacheManager
 */
public final class CacheMaintenance implements Runnable {

  private static final Logger LOGGER = LoggerFactory.getLogger(CacheMaintenance.class);

  private final ChunkCacheManager<?> cache;

  private final AtomicLong runs = new AtomicLong();
  private final AtomicLong expiredRemoved = new AtomicLong();
  private final AtomicLong lruRemoved = new AtomicLong();

  public CacheMaintenance(final ChunkCacheManager<?> cache) {
    this.cache = requireNonNull(cache);
  }

  @Override
  public void run() {
    try {
      final int expired = cache.evictExpired(cache.ttl());
      final int evicted = cache.evictLru(cache.capacity());
      runs.incrementAndGet();
      expiredRemoved.addAndGet(expired);
      lruRemoved.addAndGet(evicted);

      if (expired + evicted > 0) {
        LOGGER.debug("Cache maintenance removed {} expired and {} least recently used entries", expired, evicted);
      }
      if (DiagnosticSettings.isCacheStatisticsEnabled()) {
        LOGGER.info("Cache statistics: {}", cache.stats());
      }
    } catch (final Exception e) {
      LOGGER.error("Cache maintenance failed", e);
    }
  }

  /**
   * Get maintenance statistics.
   *
   * @return diagnostic string
   */
  public String getStatistics() {
    return String.format("CacheMaintenance: runs=%d, expired=%d, lru=%d", runs.get(), expiredRemoved.get(),
        lruRemoved.get());
  }
}
