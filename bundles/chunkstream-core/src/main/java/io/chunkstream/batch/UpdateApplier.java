/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.batch;

/**
 * Applies update requests to chunk data of type {@code V}.
 *
 * @param <V> the chunk value type
 */
public interface UpdateApplier<V> {

  /**
   * Create an independent copy of the chunk, mutations of the copy must not be visible through the
   * original.
   *
   * @param chunk the cached chunk
   * @return a deep copy
   */
  V copy(V chunk);

  /**
   * Apply one request to the given chunk copy.
   *
   * @param chunk the chunk copy
   * @param request a request targeting the chunk
   */
  void apply(V chunk, UpdateRequest request);
}
