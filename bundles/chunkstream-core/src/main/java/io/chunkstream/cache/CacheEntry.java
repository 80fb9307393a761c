/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.cache;

import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

/**
 * A loaded chunk together with its bookkeeping. Timestamps are ticker readings in nanoseconds.
 * <p>
 * The access timestamp is mutated only while holding the lock of the owning
 * {@link ChunkCacheManager}.
 *
 * @param <V> the chunk value type
 */
public final class CacheEntry<V> {

  private final V value;

  private final long insertedAt;

  /** Monotonic insertion number, tie-breaker for equal access timestamps. */
  private final long sequence;

  private long lastAccessed;

  CacheEntry(final V value, final long insertedAt, final long sequence) {
    this.value = requireNonNull(value);
    this.insertedAt = insertedAt;
    this.lastAccessed = insertedAt;
    this.sequence = sequence;
  }

  public V value() {
    return value;
  }

  public long insertedAt() {
    return insertedAt;
  }

  public long lastAccessed() {
    return lastAccessed;
  }

  long sequence() {
    return sequence;
  }

  void touch(final long now) {
    lastAccessed = now;
  }

  /**
   * Determines if the entry is older than the given time to live.
   *
   * @param now current ticker reading
   * @param ttlNanos the time to live in nanoseconds
   * @return {@code true}, if {@code now - insertedAt > ttl}
   */
  boolean isExpired(final long now, final long ttlNanos) {
    return now - insertedAt > ttlNanos;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("insertedAt", insertedAt)
                      .add("lastAccessed", lastAccessed)
                      .add("sequence", sequence)
                      .toString();
  }
}
