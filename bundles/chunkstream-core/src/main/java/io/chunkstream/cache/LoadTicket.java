/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.cache;

import io.chunkstream.exception.ChunkLoadException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static java.util.Objects.requireNonNull;

/**
 * An in-progress load of a single chunk. The first requester owns the ticket and runs the loader,
 * every concurrent requester for the same key waits on the ticket and receives the same outcome.
 *
 * @param <V> the chunk value type
 */
final class LoadTicket<V> {

  private final ChunkKey key;

  private final CompletableFuture<V> result = new CompletableFuture<>();

  /** Set once the key was invalidated or overwritten while the load was running. */
  private volatile boolean detached;

  LoadTicket(final ChunkKey key) {
    this.key = requireNonNull(key);
  }

  ChunkKey key() {
    return key;
  }

  void detach() {
    detached = true;
  }

  boolean isDetached() {
    return detached;
  }

  boolean isDone() {
    return result.isDone();
  }

  void complete(final V value) {
    result.complete(value);
  }

  void fail(final ChunkLoadException failure) {
    result.completeExceptionally(failure);
  }

  /**
   * Block until the load completed.
   *
   * @return the loaded value
   * @throws ChunkLoadException if the load failed or the waiting thread was interrupted
   */
  V await() throws ChunkLoadException {
    try {
      return result.get();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ChunkLoadException(key, e);
    } catch (final ExecutionException e) {
      if (e.getCause() instanceof ChunkLoadException loadException) {
        throw loadException;
      }
      throw new ChunkLoadException(key, e.getCause());
    }
  }
}
