/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.batch;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.chunkstream.cache.ChunkKey;
import io.chunkstream.exception.BatchException;

import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of one or more scheduling passes.
 *
 * @param chunksTouched number of chunk groups which were written back
 * @param requestsApplied number of requests applied in those groups
 * @param derivedRequestsQueued number of derived requests queued for the next pass
 * @param failures per-group {@link BatchException.Reason#CHUNK_UNAVAILABLE} failures
 */
public record ApplySummary(int chunksTouched, int requestsApplied, int derivedRequestsQueued,
    List<BatchException> failures) {

  private static final ApplySummary EMPTY = new ApplySummary(0, 0, 0, List.of());

  public ApplySummary {
    failures = ImmutableList.copyOf(requireNonNull(failures));
  }

  public static ApplySummary empty() {
    return EMPTY;
  }

  /**
   * Get the keys of all chunks which could not be updated, so that a caller can retry just those.
   *
   * @return the failed keys
   */
  public Set<ChunkKey> failedKeys() {
    return failures.stream().map(BatchException::getKey).collect(ImmutableSet.toImmutableSet());
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }

  /**
   * Combine two summaries, for instance of a submission and its derived passes.
   *
   * @param other the other summary
   * @return the sum of both
   */
  public ApplySummary merge(final ApplySummary other) {
    return new ApplySummary(chunksTouched + other.chunksTouched, requestsApplied + other.requestsApplied,
        derivedRequestsQueued + other.derivedRequestsQueued,
        ImmutableList.<BatchException>builder().addAll(failures).addAll(other.failures).build());
  }
}
