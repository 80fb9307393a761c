/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.batch;

/**
 * Logical kind of an {@link UpdateRequest}.
 */
public enum UpdateType {
  /** Block placement or removal, derives neighbor notifications and lighting updates. */
  BLOCK,

  /** Entity movement. */
  ENTITY,

  /** Lighting recalculation at a position. */
  LIGHTING,

  /** Physics tick, used for neighbor notifications. */
  PHYSICS
}
