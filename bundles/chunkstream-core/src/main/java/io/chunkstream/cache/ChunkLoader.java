/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.cache;

import io.chunkstream.exception.ChunkLoadException;

/**
 * Produces the data of a chunk, usually by reading it from storage or generating it. May block,
 * and must be safe to call concurrently for distinct keys.
 *
 * @param <V> the chunk value type
 */
@FunctionalInterface
public interface ChunkLoader<V> {

  /**
   * Load the chunk with the given key.
   *
   * @param key the chunk key
   * @return the chunk data, never {@code null}
   * @throws ChunkLoadException if the chunk cannot be produced
   */
  V load(ChunkKey key) throws ChunkLoadException;
}
