/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.batch;

import com.google.common.collect.ImmutableList;
import io.chunkstream.cache.ChunkKey;

import java.util.List;

/**
 * Position of a block in world coordinates.
 *
 * @param x world x coordinate
 * @param y height, {@code 0 <= y < 256} for positions inside the world
 * @param z world z coordinate
 */
public record BlockPosition(int x, int y, int z) {

  /** Number of block layers of a chunk column. */
  public static final int WORLD_HEIGHT = 256;

  public ChunkKey chunkKey() {
    return ChunkKey.ofBlock(x, z);
  }

  /**
   * Get the x coordinate within the chunk.
   *
   * @return local x in {@code [0, 16)}
   */
  public int localX() {
    return Math.floorMod(x, ChunkKey.CHUNK_SIZE);
  }

  /**
   * Get the z coordinate within the chunk.
   *
   * @return local z in {@code [0, 16)}
   */
  public int localZ() {
    return Math.floorMod(z, ChunkKey.CHUNK_SIZE);
  }

  public boolean isInsideWorld() {
    return y >= 0 && y < WORLD_HEIGHT;
  }

  public BlockPosition offset(final int dx, final int dy, final int dz) {
    return new BlockPosition(x + dx, y + dy, z + dz);
  }

  /**
   * Get the face-adjacent positions which are inside the world.
   *
   * @return up to six neighbors in the order east, west, up, down, south, north
   */
  public List<BlockPosition> neighbors() {
    final var neighbors = ImmutableList.<BlockPosition>builderWithExpectedSize(6);
    for (final BlockPosition neighbor : List.of(offset(1, 0, 0), offset(-1, 0, 0), offset(0, 1, 0), offset(0, -1, 0),
        offset(0, 0, 1), offset(0, 0, -1))) {
      if (neighbor.isInsideWorld()) {
        neighbors.add(neighbor);
      }
    }
    return neighbors.build();
  }
}
