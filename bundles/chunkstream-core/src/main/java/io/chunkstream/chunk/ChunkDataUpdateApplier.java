/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.chunk;

import io.chunkstream.batch.BlockPosition;
import io.chunkstream.batch.UpdateApplier;
import io.chunkstream.batch.UpdatePayload;
import io.chunkstream.batch.UpdateRequest;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Applies update requests to {@link ChunkData}:
 * <ul>
 *   <li>{@code BLOCK} sets block id and metadata,</li>
 *   <li>{@code ENTITY} accumulates the entity movement,</li>
 *   <li>{@code LIGHTING} marks the position for lighting recalculation,</li>
 *   <li>{@code PHYSICS} schedules a block tick at the position.</li>
 * </ul>
 * A request for a position outside the chunk column fails with an {@link IllegalArgumentException},
 * which fails the whole group.
 */
public final class ChunkDataUpdateApplier implements UpdateApplier<ChunkData> {

  public static final ChunkDataUpdateApplier INSTANCE = new ChunkDataUpdateApplier();

  private ChunkDataUpdateApplier() {
  }

  @Override
  public ChunkData copy(final ChunkData chunk) {
    return chunk.copy();
  }

  @Override
  public void apply(final ChunkData chunk, final UpdateRequest request) {
    final BlockPosition position = request.position();
    checkArgument(chunk.key().equals(request.chunkKey()), "Request %s does not target chunk %s", request, chunk.key());
    checkArgument(position.isInsideWorld(), "Position outside of the world: %s", position);

    switch (request.type()) {
      case BLOCK -> {
        final var block = (UpdatePayload.Block) request.payload();
        chunk.setBlock(position.localX(), position.y(), position.localZ(), block.blockId(), block.metadata());
      }
      case ENTITY -> {
        final var entity = (UpdatePayload.Entity) request.payload();
        chunk.moveEntity(entity.entityId(), entity.dx(), entity.dy(), entity.dz());
      }
      case LIGHTING -> chunk.markLightDirty(position);
      case PHYSICS -> chunk.scheduleTick(position);
      default -> throw new IllegalStateException("Unknown update type: " + request.type());
    }
  }
}
