/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.exception;

import com.google.common.collect.ImmutableList;
import io.chunkstream.cache.ChunkKey;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Failure while applying update batches.
 *
 * <p>A {@link Reason#CHUNK_UNAVAILABLE} failure belongs to a single chunk group and is collected in
 * the apply summary. Only {@link Reason#ALL_GROUPS_FAILED} and {@link Reason#INTERRUPTED} are
 * thrown from a submission.
 */
public final class BatchException extends ChunkStreamException {

  private static final long serialVersionUID = 1L;

  public enum Reason {
    /** The chunk of one group could not be loaded or written back. */
    CHUNK_UNAVAILABLE,

    /** Not a single group of a submission could be applied. */
    ALL_GROUPS_FAILED,

    /** The submitting thread was interrupted, unfinished groups were abandoned. */
    INTERRUPTED
  }

  private final Reason reason;

  private final @Nullable ChunkKey key;

  private final ImmutableList<BatchException> groupFailures;

  private BatchException(final Reason reason, final @Nullable ChunkKey key, final List<BatchException> groupFailures,
      final String message, final @Nullable Throwable cause) {
    super(message, cause);
    this.reason = requireNonNull(reason);
    this.key = key;
    this.groupFailures = ImmutableList.copyOf(groupFailures);
  }

  public static BatchException chunkUnavailable(final ChunkKey key, final Throwable cause) {
    requireNonNull(key);
    return new BatchException(Reason.CHUNK_UNAVAILABLE, key, List.of(), "Chunk " + key + " is unavailable", cause);
  }

  public static BatchException allGroupsFailed(final List<BatchException> failures) {
    final BatchException exception = new BatchException(Reason.ALL_GROUPS_FAILED, null, failures,
        "All " + failures.size() + " chunk groups failed", failures.isEmpty() ? null : failures.get(0));
    failures.stream().skip(1).forEach(exception::addSuppressed);
    return exception;
  }

  public static BatchException interrupted(final InterruptedException cause) {
    return new BatchException(Reason.INTERRUPTED, null, List.of(), "Batch submission interrupted", cause);
  }

  public Reason getReason() {
    return reason;
  }

  /**
   * Get the chunk key of a {@link Reason#CHUNK_UNAVAILABLE} failure.
   *
   * @return the key, or {@code null} for call-level failures
   */
  public @Nullable ChunkKey getKey() {
    return key;
  }

  /**
   * Get the per-group failures of a {@link Reason#ALL_GROUPS_FAILED} failure.
   *
   * @return the group failures, empty for other reasons
   */
  public List<BatchException> getGroupFailures() {
    return groupFailures;
  }
}
