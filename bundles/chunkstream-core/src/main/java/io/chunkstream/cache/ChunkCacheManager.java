/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import com.google.common.base.MoreObjects;
import io.chunkstream.exception.ChunkLoadException;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Deduplicating chunk cache bounded by a time to live and an LRU capacity.
 * <p>
 * Each key is in one of three states: absent, loading (a {@link LoadTicket} exists) or loaded (a
 * {@link CacheEntry} exists). All transitions happen while holding a single lock, the loader
 * itself runs outside of the lock so that loads of distinct keys proceed in parallel.
 * <p>
 * <b>Invalidation of a running load:</b> the load completes normally and its waiters receive the
 * value, but the value is not cached. A later {@link #get(ChunkKey)} issues a fresh load.
 * <p>
 * <b>Eviction order:</b> by last access, ties broken by insertion order. Entries are kept in
 * access order, so finding the next victim only looks at the head of the map.
 * <p>
 * <b>Pins:</b> a pinned key is skipped by every eviction, the capacity bound included. While pins
 * are held the cache may grow above its capacity; the next insertion after the pins are released
 * restores the bound. Reads still treat a pinned entry past its time to live as stale.
 *
 * @param <V> the chunk value type
 */
public final class ChunkCacheManager<V> implements ChunkCache<V> {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkCacheManager.class);

  private final ChunkLoader<V> loader;

  private final Ticker ticker;

  private final int capacity;

  private final Duration ttl;

  private final long ttlNanos;

  private final ReentrantLock lock = new ReentrantLock();

  /** Loaded entries, least recently accessed first, guarded by {@link #lock}. */
  private final LinkedHashMap<ChunkKey, CacheEntry<V>> entries = new LinkedHashMap<>();

  /** Keys of {@link #entries}, oldest insertion first, guarded by {@link #lock}. */
  private final Set<ChunkKey> insertionOrder = new LinkedHashSet<>();

  /** Pin counts, guarded by {@link #lock}. */
  private final Map<ChunkKey, Integer> pins = new HashMap<>();

  /** Running loads, guarded by {@link #lock}. */
  private final Map<ChunkKey, LoadTicket<V>> tickets = new HashMap<>();

  /** Guarded by {@link #lock}. */
  private long sequence;

  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final AtomicLong evictions = new AtomicLong();
  private final AtomicLong loadFailures = new AtomicLong();

  public ChunkCacheManager(final ChunkLoader<V> loader, @NonNegative final int capacity, final Duration ttl) {
    this(loader, capacity, ttl, Ticker.systemTicker());
  }

  /**
   * Constructor.
   *
   * @param loader loads absent chunks
   * @param capacity maximum number of entries kept after an insertion
   * @param ttl age after which an entry is stale
   * @param ticker time source
   */
  public ChunkCacheManager(final ChunkLoader<V> loader, @NonNegative final int capacity, final Duration ttl,
      final Ticker ticker) {
    checkArgument(capacity > 0, "Capacity must be positive: %s", capacity);
    checkArgument(!ttl.isNegative(), "TTL must not be negative: %s", ttl);
    this.loader = requireNonNull(loader);
    this.capacity = capacity;
    this.ttl = ttl;
    this.ttlNanos = toNanos(ttl);
    this.ticker = requireNonNull(ticker);
    LOGGER.info("Created ChunkCacheManager (capacity={}, ttl={})", capacity, ttl);
  }

  @Override
  public V get(final ChunkKey key) throws ChunkLoadException {
    requireNonNull(key);
    final LoadTicket<V> ticket;
    final boolean owner;

    lock.lock();
    try {
      final long now = ticker.read();
      final CacheEntry<V> entry = entries.get(key);
      if (entry != null) {
        if (!entry.isExpired(now, ttlNanos)) {
          touch(key, entry, now);
          hits.incrementAndGet();
          return entry.value();
        }
        removeEntry(key);
        evictions.incrementAndGet();
      }

      misses.incrementAndGet();
      final LoadTicket<V> existing = tickets.get(key);
      if (existing != null) {
        ticket = existing;
        owner = false;
      } else {
        ticket = new LoadTicket<>(key);
        tickets.put(key, ticket);
        owner = true;
      }
    } finally {
      lock.unlock();
    }

    if (owner) {
      runLoad(ticket);
    }
    return ticket.await();
  }

  private void runLoad(final LoadTicket<V> ticket) {
    final ChunkKey key = ticket.key();
    try {
      V value = null;
      ChunkLoadException failure = null;
      try {
        value = loader.load(key);
        if (value == null) {
          failure = new ChunkLoadException(key, "loader returned no data");
        }
      } catch (final ChunkLoadException e) {
        failure = e;
      } catch (final RuntimeException e) {
        failure = new ChunkLoadException(key, e);
      }

      lock.lock();
      try {
        tickets.remove(key, ticket);
        if (failure == null && !ticket.isDetached()) {
          insert(key, value);
        }
      } finally {
        lock.unlock();
      }

      if (failure != null) {
        loadFailures.incrementAndGet();
        LOGGER.warn("Loading chunk {} failed: {}", key, failure.getMessage());
        ticket.fail(failure);
      } else {
        if (ticket.isDetached()) {
          LOGGER.debug("Chunk {} was invalidated while loading, result not cached", key);
        }
        ticket.complete(value);
      }
    } finally {
      if (!ticket.isDone()) {
        lock.lock();
        try {
          tickets.remove(key, ticket);
        } finally {
          lock.unlock();
        }
        ticket.fail(new ChunkLoadException(key, "load aborted"));
      }
    }
  }

  /**
   * Insert an entry and restore the capacity bound. Must be called while holding the lock.
   */
  private void insert(final ChunkKey key, final V value) {
    final long now = ticker.read();
    removeEntry(key);
    entries.put(key, new CacheEntry<>(value, now, sequence++));
    insertionOrder.add(key);
    final int expired = removeExpired(now, ttlNanos);
    final int evicted = removeLeastRecentlyUsed(capacity);
    if (expired + evicted > 0) {
      LOGGER.debug("Inserted chunk {}, evicted {} expired and {} least recently used entries", key, expired, evicted);
    }
  }

  @Override
  public @Nullable V getIfPresent(final ChunkKey key) {
    requireNonNull(key);
    lock.lock();
    try {
      final CacheEntry<V> entry = entries.get(key);
      if (entry == null) {
        return null;
      }
      final long now = ticker.read();
      if (entry.isExpired(now, ttlNanos)) {
        return null;
      }
      touch(key, entry, now);
      return entry.value();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void put(final ChunkKey key, @NonNull final V value) {
    requireNonNull(key);
    requireNonNull(value, "Cannot cache null chunk");
    lock.lock();
    try {
      final LoadTicket<V> ticket = tickets.remove(key);
      if (ticket != null) {
        ticket.detach();
      }
      insert(key, value);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void invalidate(final ChunkKey key) {
    requireNonNull(key);
    lock.lock();
    try {
      removeEntry(key);
      final LoadTicket<V> ticket = tickets.remove(key);
      if (ticket != null) {
        ticket.detach();
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int evictExpired(final Duration ttl) {
    checkArgument(!ttl.isNegative(), "TTL must not be negative: %s", ttl);
    lock.lock();
    try {
      return removeExpired(ticker.read(), toNanos(ttl));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Remove unpinned entries older than the time to live. Insertion times grow along
   * {@link #insertionOrder}, so the scan stops at the first fresh entry.
   */
  private int removeExpired(final long now, final long ttlNanos) {
    int removed = 0;
    final Iterator<ChunkKey> iterator = insertionOrder.iterator();
    while (iterator.hasNext()) {
      final ChunkKey key = iterator.next();
      if (pins.containsKey(key)) {
        continue;
      }
      if (!entries.get(key).isExpired(now, ttlNanos)) {
        break;
      }
      iterator.remove();
      entries.remove(key);
      removed++;
    }
    evictions.addAndGet(removed);
    return removed;
  }

  @Override
  public int evictLru(@NonNegative final int targetSize) {
    checkArgument(targetSize >= 0, "Target size must not be negative: %s", targetSize);
    lock.lock();
    try {
      return removeLeastRecentlyUsed(targetSize);
    } finally {
      lock.unlock();
    }
  }

  private int removeLeastRecentlyUsed(final int targetSize) {
    int removed = 0;
    while (entries.size() > targetSize) {
      final ChunkKey victim = leastRecentlyUsed();
      if (victim == null) {
        break;
      }
      removeEntry(victim);
      removed++;
    }
    evictions.addAndGet(removed);
    return removed;
  }

  /**
   * Find the unpinned entry to evict next. Access timestamps grow along {@link #entries}, so only
   * the leading run of entries sharing the oldest timestamp is inspected, and the lowest insertion
   * sequence among them wins.
   *
   * @return the key of the victim or {@code null} if every entry is pinned
   */
  private @Nullable ChunkKey leastRecentlyUsed() {
    ChunkKey victim = null;
    CacheEntry<V> victimEntry = null;
    for (final Map.Entry<ChunkKey, CacheEntry<V>> candidate : entries.entrySet()) {
      if (pins.containsKey(candidate.getKey())) {
        continue;
      }
      final CacheEntry<V> entry = candidate.getValue();
      if (victimEntry == null) {
        victim = candidate.getKey();
        victimEntry = entry;
      } else if (entry.lastAccessed() != victimEntry.lastAccessed()) {
        break;
      } else if (entry.sequence() < victimEntry.sequence()) {
        victim = candidate.getKey();
        victimEntry = entry;
      }
    }
    return victim;
  }

  private void touch(final ChunkKey key, final CacheEntry<V> entry, final long now) {
    entry.touch(now);
    entries.remove(key);
    entries.put(key, entry);
  }

  private void removeEntry(final ChunkKey key) {
    if (entries.remove(key) != null) {
      insertionOrder.remove(key);
    }
  }

  @Override
  public void pin(final ChunkKey key) {
    requireNonNull(key);
    lock.lock();
    try {
      pins.merge(key, 1, Integer::sum);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void unpin(final ChunkKey key) {
    requireNonNull(key);
    lock.lock();
    try {
      final Integer count = pins.get(key);
      checkState(count != null, "Chunk %s is not pinned", key);
      if (count == 1) {
        pins.remove(key);
      } else {
        pins.put(key, count - 1);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Get the number of pinned keys.
   *
   * @return the number of keys with at least one pin
   */
  public int pinnedKeys() {
    lock.lock();
    try {
      return pins.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public CacheStats stats() {
    lock.lock();
    try {
      return CacheStats.of(hits.get(), misses.get(), entries.size(), evictions.get(), loadFailures.get(),
          tickets.size());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void clear() {
    lock.lock();
    try {
      entries.clear();
      insertionOrder.clear();
      tickets.values().forEach(LoadTicket::detach);
      tickets.clear();
    } finally {
      lock.unlock();
    }
  }

  private static long toNanos(final Duration duration) {
    try {
      return duration.toNanos();
    } catch (final ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  public int capacity() {
    return capacity;
  }

  public Duration ttl() {
    return ttl;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("capacity", capacity).add("ttl", ttl).add("stats", stats()).toString();
  }
}
