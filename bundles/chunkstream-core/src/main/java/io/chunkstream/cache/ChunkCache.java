/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.cache;

import io.chunkstream.exception.ChunkLoadException;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Duration;

/**
 * Interface of the chunk cache. Values are loaded lazily, at most one load per key runs at any
 * time, and entries are bounded by a time to live as well as by a capacity.
 *
 * @param <V> the chunk value type
 */
public interface ChunkCache<V> {

  /**
   * Get the chunk for the given key, loading it if it is absent or expired. Concurrent callers for
   * the same absent key share a single load.
   *
   * @param key the chunk key
   * @return the chunk data
   * @throws ChunkLoadException if the load failed, every waiter of the load receives the failure
   */
  V get(ChunkKey key) throws ChunkLoadException;

  /**
   * Get a fresh cached chunk without loading it and without recording statistics.
   *
   * @param key the chunk key
   * @return the chunk data or {@code null} if not cached
   */
  @Nullable
  V getIfPresent(ChunkKey key);

  /**
   * Insert or replace the chunk for the given key. A load running for the key is detached, its
   * result is handed to its waiters but not cached.
   *
   * @param key the chunk key
   * @param value the chunk data
   */
  void put(ChunkKey key, @NonNull V value);

  /**
   * Remove the entry and any in-flight load for the key. Does nothing if the key is absent.
   *
   * @param key the chunk key
   */
  void invalidate(ChunkKey key);

  /**
   * Remove all unpinned entries older than the given time to live.
   *
   * @param ttl the time to live
   * @return number of removed entries
   */
  int evictExpired(Duration ttl);

  /**
   * Remove least recently accessed unpinned entries until at most {@code targetSize} entries
   * remain or only pinned entries are left.
   *
   * @param targetSize the target size
   * @return number of evicted entries
   */
  int evictLru(int targetSize);

  /**
   * Protect the entry of the key from eviction until {@link #unpin(ChunkKey)} is called. Pins are
   * counted, a key stays protected while at least one pin is held. A key may be pinned before its
   * chunk is loaded.
   *
   * @param key the chunk key
   */
  void pin(ChunkKey key);

  /**
   * Release one pin of the key.
   *
   * @param key the chunk key
   * @throws IllegalStateException if the key is not pinned
   */
  void unpin(ChunkKey key);

  /**
   * Get the statistics.
   *
   * @return current statistics
   */
  CacheStats stats();

  /**
   * Clearing the cache. That is removing all entries and detaching all in-flight loads.
   */
  void clear();
}
