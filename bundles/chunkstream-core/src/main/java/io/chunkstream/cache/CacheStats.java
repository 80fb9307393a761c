/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.cache;

/**
 * Point-in-time statistics of a {@link ChunkCache}.
 *
 * @param hits number of requests served from a fresh entry
 * @param misses number of requests which had to load or wait for a load
 * @param size number of live entries
 * @param hitRate {@code hits / (hits + misses)}, {@code 0} without any request
 * @param evictions number of entries removed by TTL expiry or LRU pressure
 * @param loadFailures number of failed loader invocations
 * @param inFlight number of loads currently running
 */
public record CacheStats(long hits, long misses, int size, double hitRate, long evictions, long loadFailures,
    int inFlight) {

  static CacheStats of(final long hits, final long misses, final int size, final long evictions,
      final long loadFailures, final int inFlight) {
    final long requests = hits + misses;
    final double hitRate = requests == 0 ? 0.0 : (double) hits / requests;
    return new CacheStats(hits, misses, size, hitRate, evictions, loadFailures, inFlight);
  }
}
