/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.batch;

import io.chunkstream.cache.ChunkKey;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A single mutation of chunk data.
 *
 * @param type the kind of update, used for grouping and derivation
 * @param position the target position in world coordinates
 * @param payload the update data, {@link UpdatePayload.Block} for {@link UpdateType#BLOCK},
 *        {@link UpdatePayload.Entity} for {@link UpdateType#ENTITY}
 */
public record UpdateRequest(UpdateType type, BlockPosition position, UpdatePayload payload) {

  public UpdateRequest {
    requireNonNull(type);
    requireNonNull(position);
    requireNonNull(payload);
    switch (type) {
      case BLOCK -> checkArgument(payload instanceof UpdatePayload.Block, "Block update needs a block payload");
      case ENTITY -> checkArgument(payload instanceof UpdatePayload.Entity, "Entity update needs an entity payload");
      default -> {
      }
    }
  }

  public static UpdateRequest block(final BlockPosition position, final int blockId, final int metadata) {
    return new UpdateRequest(UpdateType.BLOCK, position, new UpdatePayload.Block(blockId, metadata));
  }

  public static UpdateRequest block(final int x, final int y, final int z, final int blockId) {
    return block(new BlockPosition(x, y, z), blockId, 0);
  }

  public static UpdateRequest entity(final BlockPosition position, final long entityId, final double dx,
      final double dy, final double dz) {
    return new UpdateRequest(UpdateType.ENTITY, position, new UpdatePayload.Entity(entityId, dx, dy, dz));
  }

  public static UpdateRequest lighting(final BlockPosition position) {
    return new UpdateRequest(UpdateType.LIGHTING, position, UpdatePayload.NONE);
  }

  public static UpdateRequest physics(final BlockPosition position) {
    return new UpdateRequest(UpdateType.PHYSICS, position, UpdatePayload.NONE);
  }

  public ChunkKey chunkKey() {
    return position.chunkKey();
  }
}
