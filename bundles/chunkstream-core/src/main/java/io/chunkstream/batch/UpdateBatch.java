/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.batch;

import com.google.common.collect.ImmutableList;
import io.chunkstream.cache.ChunkKey;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Update requests targeting one chunk, in submission order.
 *
 * @param key the chunk all requests target
 * @param requests the requests
 */
public record UpdateBatch(ChunkKey key, List<UpdateRequest> requests) {

  public UpdateBatch {
    requireNonNull(key);
    requests = ImmutableList.copyOf(requests);
    for (final UpdateRequest request : requests) {
      checkArgument(key.equals(request.chunkKey()), "Request %s does not target chunk %s", request, key);
    }
  }

  public int size() {
    return requests.size();
  }
}
