/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.chunk;

import io.chunkstream.batch.BlockPosition;
import io.chunkstream.batch.UpdateRequest;
import io.chunkstream.cache.ChunkKey;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChunkDataUpdateApplierTest {

  private final ChunkDataUpdateApplier applier = ChunkDataUpdateApplier.INSTANCE;

  @Test
  void testApplyEveryType() {
    final ChunkData chunk = new ChunkData(new ChunkKey(-1, 0));
    final BlockPosition position = new BlockPosition(-3, 40, 2);

    applier.apply(chunk, UpdateRequest.block(position, Blocks.SAND, 4));
    applier.apply(chunk, UpdateRequest.entity(position, 5L, 0, -1, 0));
    applier.apply(chunk, UpdateRequest.lighting(position));
    applier.apply(chunk, UpdateRequest.physics(position));

    assertEquals(Blocks.SAND, chunk.getBlock(13, 40, 2));
    assertEquals(4, chunk.getMetadata(13, 40, 2));
    assertEquals(new ChunkData.EntityOffset(0, -1, 0), chunk.entityOffset(5L));
    assertTrue(chunk.isLightDirty(position));
    assertTrue(chunk.hasPendingTick(position));
  }

  @Test
  void testRejectsForeignAndOutOfWorldRequests() {
    final ChunkData chunk = new ChunkData(new ChunkKey(0, 0));

    assertThrows(IllegalArgumentException.class, () -> applier.apply(chunk, UpdateRequest.block(16, 1, 0, 1)));
    assertThrows(IllegalArgumentException.class, () -> applier.apply(chunk, UpdateRequest.block(0, -1, 0, 1)));
  }
}
