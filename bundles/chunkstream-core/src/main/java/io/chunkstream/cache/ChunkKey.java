/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.cache;

/**
 * Cache key of a chunk column, identified by its chunk coordinates.
 *
 * @param x the chunk x coordinate
 * @param z the chunk z coordinate
 */
public record ChunkKey(int x, int z) {

  /** Edge length of a chunk in blocks. */
  public static final int CHUNK_SIZE = 16;

  /**
   * Get the key of the chunk containing the given world block coordinates. Negative coordinates
   * are floored, that is block {@code -1} belongs to chunk {@code -1}.
   *
   * @param blockX world x coordinate
   * @param blockZ world z coordinate
   * @return the chunk key
   */
  public static ChunkKey ofBlock(final int blockX, final int blockZ) {
    return new ChunkKey(Math.floorDiv(blockX, CHUNK_SIZE), Math.floorDiv(blockZ, CHUNK_SIZE));
  }

  public ChunkKey offset(final int dx, final int dz) {
    return new ChunkKey(x + dx, z + dz);
  }

  public long distanceSquared(final ChunkKey other) {
    final long dx = (long) x - other.x;
    final long dz = (long) z - other.z;
    return dx * dx + dz * dz;
  }

  @Override
  public String toString() {
    return "(" + x + "," + z + ")";
  }
}
