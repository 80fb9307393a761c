/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.batch;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Data carried by an {@link UpdateRequest}.
 */
public interface UpdatePayload {

  /** Payload of requests which only carry a position. */
  UpdatePayload NONE = new UpdatePayload() {
    @Override
    public String toString() {
      return "NONE";
    }
  };

  /**
   * New block state.
   *
   * @param blockId the block id
   * @param metadata block metadata in {@code [0, 255]}
   */
  record Block(int blockId, int metadata) implements UpdatePayload {
    public Block {
      checkArgument(blockId >= 0 && blockId <= Short.MAX_VALUE, "Block id out of range: %s", blockId);
      checkArgument(metadata >= 0 && metadata <= 0xFF, "Metadata out of range: %s", metadata);
    }
  }

  /**
   * Relative movement of an entity.
   *
   * @param entityId the entity id
   * @param dx movement along x
   * @param dy movement along y
   * @param dz movement along z
   */
  record Entity(long entityId, double dx, double dy, double dz) implements UpdatePayload {
  }
}
