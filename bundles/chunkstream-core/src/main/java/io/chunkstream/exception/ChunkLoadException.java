/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.exception;

import io.chunkstream.cache.ChunkKey;

import static java.util.Objects.requireNonNull;

/**
 * Thrown when the loader could not produce the data of a chunk. Failures are never cached, the next
 * request for the same key issues a fresh load.
 */
public final class ChunkLoadException extends ChunkStreamException {

  private static final long serialVersionUID = 1L;

  /** The chunk which failed to load. */
  private final ChunkKey key;

  public ChunkLoadException(final ChunkKey key, final String message) {
    super("Failed to load chunk %s: %s", key, message);
    this.key = requireNonNull(key);
  }

  public ChunkLoadException(final ChunkKey key, final Throwable cause) {
    super(cause, "Failed to load chunk %s: %s", key, String.valueOf(cause.getMessage()));
    this.key = requireNonNull(key);
  }

  /**
   * Get the key of the chunk which failed to load.
   *
   * @return the chunk key
   */
  public ChunkKey getKey() {
    return key;
  }
}
